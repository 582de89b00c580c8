package com.pharmanio.duty.repository;

import com.pharmanio.duty.domain.roster.OnDutyRoster;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OnDutyRosterRepository extends JpaRepository<OnDutyRoster, Long> {

    // the first row ever created is the roster
    Optional<OnDutyRoster> findFirstByOrderByIdAsc();
}
