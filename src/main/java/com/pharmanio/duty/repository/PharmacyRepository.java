package com.pharmanio.duty.repository;

import com.pharmanio.duty.domain.pharmacy.Pharmacy;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PharmacyRepository extends JpaRepository<Pharmacy, Long> {

    // id order is the registry iteration order the matcher relies on for tie-breaks
    List<Pharmacy> findAllByCity_NameOrderByIdAsc(String cityName);
}
