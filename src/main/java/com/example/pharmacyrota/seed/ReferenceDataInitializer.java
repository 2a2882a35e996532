package com.example.pharmacyrota.seed;

import com.example.pharmacyrota.requirement.ClinicSlot;
import com.example.pharmacyrota.requirement.ClinicSlotRepository;
import com.example.pharmacyrota.requirement.DutyRequirement;
import com.example.pharmacyrota.requirement.DutyRequirementRepository;
import com.example.pharmacyrota.rota.AssignmentType;
import com.example.pharmacyrota.staff.StaffMember;
import com.example.pharmacyrota.staff.StaffMemberRepository;
import com.example.pharmacyrota.staff.StaffType;
import com.example.pharmacyrota.staff.UnavailabilityRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Demo reference data, loaded at start-up when the store is empty.
 */
@Configuration
@ConditionalOnProperty(name = "rota.seed.enabled", havingValue = "true", matchIfMissing = true)
public class ReferenceDataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataInitializer.class);

    private static final Set<DayOfWeek> WEEKDAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    @Bean
    CommandLineRunner loadReferenceData(StaffMemberRepository staffRepository,
                                        DutyRequirementRepository requirementRepository,
                                        ClinicSlotRepository clinicRepository) {
        return args -> {
            if (staffRepository.count() > 0) {
                return;
            }
            List<StaffMember> staff = staffRepository.saveAll(demoStaff());
            requirementRepository.saveAll(demoRequirements());

            ClinicSlot warfarin = new ClinicSlot("Warfarin Clinic", DayOfWeek.TUESDAY,
                    LocalTime.of(9, 0), LocalTime.of(12, 0), true);
            warfarin.setDifficulty(7);
            warfarin.getPreferredStaffIds().add(staff.get(1).getId());
            ClinicSlot anticoag = new ClinicSlot("Anticoagulation Clinic", DayOfWeek.THURSDAY,
                    LocalTime.of(13, 0), LocalTime.of(16, 0), true);
            ClinicSlot respiratory = new ClinicSlot("Respiratory Clinic", DayOfWeek.WEDNESDAY,
                    LocalTime.of(9, 0), LocalTime.of(12, 30), false);
            respiratory.setTravelTimeAfter(30);
            clinicRepository.saveAll(List.of(warfarin, anticoag, respiratory));

            logger.info("Seeded {} staff, {} requirements, {} clinics",
                    staff.size(), requirementRepository.count(), clinicRepository.count());
        };
    }

    private List<StaffMember> demoStaff() {
        List<StaffMember> staff = new ArrayList<>();

        StaffMember alice = pharmacist("Alice Archer", "8a", "EAU", "Ward 7", "Ward 12");
        alice.setDefaultRoster(true);
        alice.getSpecialistTraining().add("Critical Care");
        staff.add(alice);

        StaffMember ben = pharmacist("Ben Okafor", "7", "Ward 7", "Ward 12");
        ben.setWarfarinTrained(true);
        ben.setDefaultRoster(true);
        ben.getPrimaryWards().add("Ward 7");
        staff.add(ben);

        StaffMember chloe = pharmacist("Chloe Singh", "7", "EAU", "Ward 12");
        chloe.getWorkingDays().addAll(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY));
        chloe.setPrimaryDirectorate("Surgery");
        staff.add(chloe);

        StaffMember dev = pharmacist("Dev Patel", "8b", "EAU", "Ward 7");
        dev.getSpecialistTraining().add("Critical Care");
        dev.getUnavailabilityRules().add(new UnavailabilityRule(DayOfWeek.FRIDAY, LocalTime.of(13, 0), LocalTime.of(17, 0)));
        staff.add(dev);

        StaffMember hana = pharmacist("Hana Kowalski", "7", "Ward 7", "Ward 12");
        hana.setDispensaryPharmacist(true);
        staff.add(hana);

        StaffMember ella = technician("Ella Brown", "5");
        ella.setDefaultRoster(true);
        staff.add(ella);

        StaffMember finn = technician("Finn Murphy", "4");
        finn.getUnavailabilityRules().add(new UnavailabilityRule(DayOfWeek.MONDAY, LocalTime.of(9, 0), LocalTime.of(13, 0)));
        staff.add(finn);

        StaffMember grace = technician("Grace Lee", "5");
        grace.setWarfarinTrained(true);
        staff.add(grace);

        return staff;
    }

    private List<DutyRequirement> demoRequirements() {
        DutyRequirement eau = new DutyRequirement("EAU", AssignmentType.WARD, "Acute", 1, 2, 9);
        eau.setDoNotSplit(true);
        eau.setContinuitySensitive(true);
        eau.setDaysOfWeek(EnumSet.copyOf(WEEKDAYS));

        DutyRequirement ward7 = new DutyRequirement("Ward 7", AssignmentType.WARD, "Medicine", 1, 1, 6);
        ward7.setDirectorate("Medicine");
        ward7.setDaysOfWeek(EnumSet.copyOf(WEEKDAYS));

        DutyRequirement ward12 = new DutyRequirement("Ward 12", AssignmentType.WARD, "Surgery", 1, 1, 5);
        ward12.setDirectorate("Surgery");
        ward12.setDaysOfWeek(EnumSet.copyOf(WEEKDAYS));

        DutyRequirement critical = new DutyRequirement("ICU", AssignmentType.WARD, "Critical Care", 1, 1, 8);
        critical.setRequiredTraining("Critical Care");
        critical.setDaysOfWeek(EnumSet.copyOf(WEEKDAYS));

        DutyRequirement dispensaryAm = new DutyRequirement("Dispensary", AssignmentType.DISPENSARY, "Dispensary", 1, 2, 4);
        dispensaryAm.setStartTime(LocalTime.of(9, 0));
        dispensaryAm.setEndTime(LocalTime.of(13, 0));
        dispensaryAm.setSplitShareable(true);

        DutyRequirement dispensaryPm = new DutyRequirement("Dispensary", AssignmentType.DISPENSARY, "Dispensary", 1, 2, 4);
        dispensaryPm.setStartTime(LocalTime.of(13, 0));
        dispensaryPm.setEndTime(LocalTime.of(17, 0));
        dispensaryPm.setSplitShareable(true);

        DutyRequirement management = new DutyRequirement("Management", AssignmentType.MANAGEMENT, "Management", 0, 1, 1);
        management.setDaysOfWeek(EnumSet.of(DayOfWeek.FRIDAY));
        management.setStartTime(LocalTime.of(14, 0));
        management.setEndTime(LocalTime.of(17, 0));

        return List.of(eau, ward7, ward12, critical, dispensaryAm, dispensaryPm, management);
    }

    private StaffMember pharmacist(String name, String band, String... trainedLocations) {
        StaffMember member = new StaffMember(name, StaffType.PHARMACIST, band);
        member.getTrainedLocations().addAll(List.of(trainedLocations));
        return member;
    }

    private StaffMember technician(String name, String band) {
        return new StaffMember(name, StaffType.TECHNICIAN, band);
    }
}
