package com.example.pharmacyrota.requirement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClinicSlotRepository extends JpaRepository<ClinicSlot, Long> {

    List<ClinicSlot> findByActiveTrue();
}
