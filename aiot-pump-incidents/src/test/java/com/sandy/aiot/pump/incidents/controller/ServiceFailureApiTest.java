package com.sandy.aiot.pump.incidents.controller;

import com.sandy.aiot.pump.incidents.exception.StorageException;
import com.sandy.aiot.pump.incidents.service.IncidentTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Storage and database outages as seen by API clients.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ServiceFailureApiTest {
    @Autowired MockMvc mockMvc;
    @MockBean IncidentTracker incidentTracker;
    @MockBean JdbcTemplate jdbcTemplate;

    private static final String EVENT = "{\"device\":\"well-pump-monitor\",\"location\":\"Pump House\","
            + "\"timestamp\":\"1640995200000\",\"type\":1,\"value\":8.5,\"threshold\":7.2,"
            + "\"startTime\":\"1640995180000\",\"duration\":20000,\"active\":true,"
            + "\"description\":\"High current detected on pump 1\"}";

    @Test
    void storageFailureIsInternalErrorWithoutDetail() throws Exception {
        when(incidentTracker.submit(any())).thenThrow(
                new StorageException("Timed out after 5000ms waiting for incident lock key=well-pump-monitor", true));

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("Internal server error")))
                .andExpect(content().string(not(containsString("Timed out"))))
                .andExpect(content().string(not(containsString("well-pump-monitor"))));
    }

    @Test
    void healthReportsDisconnectedDatabaseAs503() throws Exception {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status", is("unhealthy")))
                .andExpect(jsonPath("$.database", is("disconnected")));
    }
}
