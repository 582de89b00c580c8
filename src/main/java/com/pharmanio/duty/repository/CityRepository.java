package com.pharmanio.duty.repository;

import com.pharmanio.duty.domain.city.City;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CityRepository extends JpaRepository<City, Long> {

    Optional<City> findByName(String name);

    boolean existsByNameIgnoreCase(String name);
}
