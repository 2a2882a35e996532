package com.example.pharmacyrota.configuration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class RotaConfigurationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RotaConfigurationRepository configurationRepository;

    @BeforeEach
    void setUp() {
        configurationRepository.deleteAll();
    }

    @Test
    void saveThenLoad_keepsEveryParameter() throws Exception {
        mockMvc.perform(get("/api/rota-configurations/2024-05-06"))
            .andExpect(status().isNotFound());

        String payload = """
            {
              "staffIds": [3, 1],
              "selectedWeekdays": ["MONDAY", "WEDNESDAY"],
              "selectedClinicIds": [7],
              "workingDaysOverride": { "3": ["MONDAY"] },
              "ignoredUnavailability": { "1": [0] },
              "extraRoleRequestsByWeekday": {
                "WEDNESDAY": [ { "name": "Audit", "startTime": "13:00", "endTime": "17:00", "staffCount": 1 } ]
              },
              "singlePharmacistDispensaryDays": ["WEDNESDAY"],
              "rotaUnavailability": {
                "1": [ { "dayOfWeek": "TUESDAY", "startTime": "09:00", "endTime": "13:00" } ]
              },
              "modifiedBy": "planner"
            }
            """;

        mockMvc.perform(put("/api/rota-configurations/2024-05-06")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.lastModifiedBy").value("planner"))
            .andExpect(jsonPath("$.data.generated").value(false));

        mockMvc.perform(get("/api/rota-configurations/2024-05-06"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.staffIds[0]").value(1))
            .andExpect(jsonPath("$.data.staffIds[1]").value(3))
            .andExpect(jsonPath("$.data.selectedClinicIds[0]").value(7))
            .andExpect(jsonPath("$.data.workingDaysOverride['3'][0]").value("MONDAY"))
            .andExpect(jsonPath("$.data.ignoredUnavailability['1'][0]").value(0))
            .andExpect(jsonPath("$.data.extraRoleRequestsByWeekday.WEDNESDAY[0].name").value("Audit"))
            .andExpect(jsonPath("$.data.singlePharmacistDispensaryDays[0]").value("WEDNESDAY"))
            .andExpect(jsonPath("$.data.rotaUnavailability['1'][0].dayOfWeek").value("TUESDAY"));

        assertThat(configurationRepository.findByWeekStart(LocalDate.of(2024, 5, 6))).isPresent();
    }

    @Test
    void save_forNonMonday_isRejected() throws Exception {
        mockMvc.perform(put("/api/rota-configurations/2024-05-07")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"staffIds\": [1]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ROTA_PRECONDITION"));
    }

    @Test
    void get_withCorruptStoredParameters_failsInsteadOfReturningEmptyMaps() throws Exception {
        RotaConfiguration configuration = new RotaConfiguration(LocalDate.of(2024, 5, 6));
        configuration.getSelectedStaffIds().add(1L);
        configuration.setRoleRequests("{\"MONDAY\": [ {\"name\": ");
        configurationRepository.saveAndFlush(configuration);

        mockMvc.perform(get("/api/rota-configurations/2024-05-06"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("STORED_DATA_UNREADABLE"))
            .andExpect(jsonPath("$.message").value(
                "Stored extraRoleRequestsByWeekday of the rota configuration for week 2024-05-06 is unreadable"));
    }
}
