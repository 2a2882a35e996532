package com.example.pharmacyrota.configuration;

import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.exception.StoredDataException;
import com.example.pharmacyrota.requirement.RoleRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
@Transactional
public class RotaConfigurationService {

    private static final Logger logger = LoggerFactory.getLogger(RotaConfigurationService.class);
    private static final ObjectMapper CONFIG_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<Map<Long, Set<DayOfWeek>>> WORKING_DAYS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<Long, Set<Integer>>> IGNORED_RULES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<DayOfWeek, List<RoleRequest>>> ROLE_REQUESTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<Long, List<RotaUnavailability>>> ROTA_UNAVAILABILITY_TYPE =
            new TypeReference<>() {
            };

    private final RotaConfigurationRepository configurationRepository;
    private final Clock clock;

    public RotaConfigurationService(RotaConfigurationRepository configurationRepository, Clock clock) {
        this.configurationRepository = configurationRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<RotaConfigurationDto> find(LocalDate weekStart) {
        return configurationRepository.findByWeekStart(weekStart).map(this::toDto);
    }

    @Transactional(readOnly = true)
    public boolean exists(LocalDate weekStart) {
        return configurationRepository.existsByWeekStart(weekStart);
    }

    /**
     * Creates or updates the configuration of a week. Saving parameters does not
     * touch any generated documents.
     */
    public RotaConfigurationDto save(LocalDate weekStart, RotaConfigurationRequest request, String modifiedBy) {
        RotaConfiguration configuration = apply(weekStart, request, modifiedBy);
        logger.info("Saved rota configuration for week {}: {} staff, {} weekdays, {} clinics",
                weekStart, request.staffIds().size(), request.selectedWeekdays().size(),
                request.selectedClinicIds().size());
        return toDto(configuration);
    }

    /** Stores the parameters a generation actually ran with. */
    public RotaConfiguration recordGeneration(LocalDate weekStart, RotaConfigurationRequest request,
                                              String generatedBy, LocalDateTime generatedAt) {
        RotaConfiguration configuration = apply(weekStart, request, generatedBy);
        configuration.setGenerated(Boolean.TRUE);
        configuration.setRotaGeneratedAt(generatedAt);
        return configuration;
    }

    /** Back to configuring once a week's drafts are cleared. */
    public void markCleared(LocalDate weekStart) {
        configurationRepository.findByWeekStart(weekStart).ifPresent(c -> {
            c.setGenerated(Boolean.FALSE);
            c.setLastModified(LocalDateTime.now(clock));
        });
    }

    private RotaConfiguration apply(LocalDate weekStart, RotaConfigurationRequest request, String modifiedBy) {
        if (weekStart == null || weekStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new RotaPreconditionException("Week start must be a Monday: " + weekStart);
        }
        RotaConfiguration configuration = configurationRepository.findByWeekStart(weekStart)
                .orElseGet(() -> new RotaConfiguration(weekStart));
        configuration.getSelectedStaffIds().clear();
        configuration.getSelectedStaffIds().addAll(request.staffIds());
        configuration.getSelectedClinicIds().clear();
        configuration.getSelectedClinicIds().addAll(request.selectedClinicIds());
        configuration.getSelectedWeekdays().clear();
        configuration.getSelectedWeekdays().addAll(request.selectedWeekdays());
        configuration.getSinglePharmacistDispensaryDays().clear();
        configuration.getSinglePharmacistDispensaryDays().addAll(request.singlePharmacistDispensaryDays());
        configuration.setWorkingDaysOverride(write(request.workingDaysOverride()));
        configuration.setIgnoredUnavailability(write(request.ignoredUnavailability()));
        configuration.setRoleRequests(write(request.extraRoleRequestsByWeekday()));
        configuration.setRotaUnavailability(write(request.rotaUnavailability()));
        configuration.setLastModified(LocalDateTime.now(clock));
        configuration.setLastModifiedBy(modifiedBy);
        return configurationRepository.save(configuration);
    }

    private RotaConfigurationDto toDto(RotaConfiguration configuration) {
        List<Long> staffIds = new ArrayList<>(configuration.getSelectedStaffIds());
        Collections.sort(staffIds);
        List<Long> clinicIds = new ArrayList<>(configuration.getSelectedClinicIds());
        Collections.sort(clinicIds);
        return new RotaConfigurationDto(
                configuration.getWeekStart(),
                staffIds,
                Set.copyOf(configuration.getSelectedWeekdays()),
                clinicIds,
                read(configuration, "workingDaysOverride", configuration.getWorkingDaysOverride(), WORKING_DAYS_TYPE),
                read(configuration, "ignoredUnavailability", configuration.getIgnoredUnavailability(), IGNORED_RULES_TYPE),
                read(configuration, "extraRoleRequestsByWeekday", configuration.getRoleRequests(), ROLE_REQUESTS_TYPE),
                Set.copyOf(configuration.getSinglePharmacistDispensaryDays()),
                read(configuration, "rotaUnavailability", configuration.getRotaUnavailability(),
                        ROTA_UNAVAILABILITY_TYPE),
                configuration.getLastModified(),
                configuration.getLastModifiedBy(),
                Boolean.TRUE.equals(configuration.getGenerated()),
                configuration.getRotaGeneratedAt());
    }

    private String write(Map<?, ?> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return CONFIG_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to store rota configuration", e);
        }
    }

    private <K, V> Map<K, V> read(RotaConfiguration configuration, String field, String raw,
                                  TypeReference<Map<K, V>> type) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<K, V> value = CONFIG_MAPPER.readValue(raw, type);
            return value == null ? Collections.emptyMap() : value;
        } catch (JsonProcessingException e) {
            throw new StoredDataException("Stored " + field + " of the rota configuration for week "
                    + configuration.getWeekStart() + " is unreadable", e);
        }
    }
}
