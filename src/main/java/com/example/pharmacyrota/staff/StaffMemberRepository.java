package com.example.pharmacyrota.staff;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface StaffMemberRepository extends JpaRepository<StaffMember, Long> {

    Optional<StaffMember> findByName(String name);

    List<StaffMember> findByIdIn(Collection<Long> ids);

    List<StaffMember> findByActiveTrueOrderByNameAsc();
}
