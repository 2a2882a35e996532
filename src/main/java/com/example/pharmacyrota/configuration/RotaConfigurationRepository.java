package com.example.pharmacyrota.configuration;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface RotaConfigurationRepository extends JpaRepository<RotaConfiguration, Long> {

    Optional<RotaConfiguration> findByWeekStart(LocalDate weekStart);

    boolean existsByWeekStart(LocalDate weekStart);
}
