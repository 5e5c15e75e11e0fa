package com.cleanbear.assignment.integration;

import com.cleanbear.assignment.exception.RosterUnavailableException;
import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.service.RosterStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class AssignmentControllerIntegrationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @MockBean private RosterStore rosterStore;

    private static Map<String, Object> technician(String id, double lat, boolean overtime, String... types) {
        Map<String, Object> technician = new HashMap<>();
        technician.put("technician_id", id);
        technician.put("name", "기사 " + id);
        technician.put("home_lat", lat);
        technician.put("home_lng", 127.0);
        technician.put("service_types", List.of(types));
        technician.put("overtime_allowed", overtime);
        return technician;
    }

    private static Map<String, Object> fixedJob(String id, String type, String date, String start, int duration) {
        Map<String, Object> job = new HashMap<>();
        job.put("job_id", id);
        job.put("service_type", type);
        job.put("lat", 37.50);
        job.put("lng", 127.0);
        job.put("date", date);
        job.put("duration_min", duration);
        job.put("time_fixed", true);
        job.put("fixed_start_time", start);
        return job;
    }

    private static Technician rosterTechnician(String id, double lat, String type) {
        return Technician.builder().technicianId(id).name("기사 " + id).phone("010-1234-5678").area("강남구")
                .home(new Coordinate(lat, 127.0)).serviceTypes(Set.of(type)).overtimeAllowed(true).build();
    }

    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    @Test
    void testActuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("{\"status\":\"UP\"}"));
    }

    @Test
    void testServiceHealthReportsRoster() throws Exception {
        when(rosterStore.isLoaded()).thenReturn(true);
        when(rosterStore.currentRoster()).thenReturn(List.of(rosterTechnician("T1", 37.5, "입주청소")));
        when(rosterStore.getLastRefreshedAt()).thenReturn(Instant.parse("2025-03-10T00:00:00Z"));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.roster_loaded").value(true))
                .andExpect(jsonPath("$.technician_count").value(1))
                .andExpect(jsonPath("$.last_refreshed_at").value("2025-03-10T00:00:00Z"));
    }

    @Test
    void testAssignPicksNearestTechnician() throws Exception {
        Map<String, Object> body = Map.of(
                "jobs", List.of(fixedJob("A", "입주청소", "2025-03-10", "09:00", 480)),
                "technicians", List.of(
                        technician("T1", 37.51, false, "입주청소"),
                        technician("T2", 37.70, true, "입주청소")));

        postJson("/api/v1/assign", body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.assigned_jobs", hasSize(1)))
                .andExpect(jsonPath("$.assigned_jobs[0].job_id").value("A"))
                .andExpect(jsonPath("$.assigned_jobs[0].technician_id").value("T1"))
                .andExpect(jsonPath("$.assigned_jobs[0].start_time").value("09:00"))
                .andExpect(jsonPath("$.assigned_jobs[0].end_time").value("17:00"))
                .andExpect(jsonPath("$.assigned_jobs[0].time_status").value("fixed"))
                .andExpect(jsonPath("$.assigned_jobs[0].status").value("assigned"))
                .andExpect(jsonPath("$.summary.total_jobs").value(1))
                .andExpect(jsonPath("$.summary.assigned").value(1))
                .andExpect(jsonPath("$.human_message", containsString("배정 완료: 1건")));
    }

    @Test
    void testUnfixedJobCarriesMemo() throws Exception {
        Map<String, Object> job = new HashMap<>(fixedJob("FLEX", "입주청소", "2025-03-10", null, 120));
        job.put("time_fixed", false);
        job.put("slot_type", "오후");
        Map<String, Object> body = Map.of(
                "jobs", List.of(job),
                "technicians", List.of(technician("T1", 37.51, false, "입주청소")));

        postJson("/api/v1/assign", body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assigned_jobs[0].time_status").value("undefined"))
                .andExpect(jsonPath("$.assigned_jobs[0].start_time").value("12:00"))
                .andExpect(jsonPath("$.assigned_jobs[0].memo").value("시간 미정 - 전날 통화 조율"));
    }

    @Test
    void testRejectedJobsAreReportedNotFatal() throws Exception {
        Map<String, Object> badDate = new HashMap<>(fixedJob("BAD", "입주청소", "10/03/2025", "10:00", 60));
        Map<String, Object> noTime = new HashMap<>(fixedJob("NOTIME", "입주청소", "2025-03-10", null, 60));
        Map<String, Object> body = Map.of(
                "jobs", List.of(
                        fixedJob("OK", "입주청소", "2025-03-10", "10:00", 60),
                        fixedJob("MOVE", "이사청소", "2025-03-10", "14:00", 60),
                        badDate,
                        noTime),
                "technicians", List.of(technician("T1", 37.51, true, "입주청소")));

        postJson("/api/v1/assign", body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.total_jobs").value(4))
                .andExpect(jsonPath("$.summary.assigned").value(1))
                .andExpect(jsonPath("$.summary.failed").value(3))
                .andExpect(jsonPath("$.failed_jobs[?(@.job_id == 'MOVE')].error_reason").value("SERVICE_TYPE_MISMATCH"))
                .andExpect(jsonPath("$.failed_jobs[?(@.job_id == 'BAD')].error_reason").value("INVALID_FIELD_FORMAT"))
                .andExpect(jsonPath("$.failed_jobs[?(@.job_id == 'NOTIME')].error_reason").value("FIXED_TIME_MISSING"))
                .andExpect(jsonPath("$.failed_jobs[0].status").value("failed"));
    }

    @Test
    void testDayLimitDefers() throws Exception {
        Map<String, Object> body = Map.of(
                "jobs", List.of(
                        fixedJob("D2", "입주청소", "2025-03-11", "10:00", 60),
                        fixedJob("D1", "입주청소", "2025-03-10", "10:00", 60)),
                "technicians", List.of(technician("T1", 37.51, true, "입주청소")),
                "system_rules", Map.of("max_preassign_days", 1));

        postJson("/api/v1/assign", body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assigned_jobs[0].job_id").value("D1"))
                .andExpect(jsonPath("$.deferred_jobs[0].job_id").value("D2"))
                .andExpect(jsonPath("$.deferred_jobs[0].status").value("deferred"))
                .andExpect(jsonPath("$.deferred_jobs[0].error_reason").value("MAX_PREASSIGN_DAYS_EXCEEDED"));
    }

    @Test
    void testSkippedTechnicianListed() throws Exception {
        Map<String, Object> noHome = technician("T0", 37.50, true, "입주청소");
        noHome.remove("home_lat");
        noHome.remove("home_lng");
        Map<String, Object> body = Map.of(
                "jobs", List.of(fixedJob("A", "입주청소", "2025-03-10", "10:00", 60)),
                "technicians", List.of(noHome, technician("T1", 37.70, true, "입주청소")));

        postJson("/api/v1/assign", body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assigned_jobs[0].technician_id").value("T1"))
                .andExpect(jsonPath("$.skipped_technicians[0].technician_id").value("T0"))
                .andExpect(jsonPath("$.skipped_technicians[0].missing_fields[0]").value("home_location"));
    }

    @Test
    void testUsesRosterWhenTechniciansOmitted() throws Exception {
        when(rosterStore.currentRoster()).thenReturn(List.of(rosterTechnician("R1", 37.52, "입주청소")));

        postJson("/api/v1/assign", Map.of("jobs", List.of(fixedJob("A", "입주청소", "2025-03-10", "10:00", 60))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assigned_jobs[0].technician_id").value("R1"));
    }

    @Test
    void testEmptyJobsIsBadRequest() throws Exception {
        postJson("/api/v1/assign", Map.of("jobs", List.of()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("작업 데이터가 없습니다"))
                .andExpect(jsonPath("$.summary.total_jobs").value(0));
    }

    @Test
    void testNoTechniciansIsBadRequest() throws Exception {
        postJson("/api/v1/assign", Map.of("jobs", List.of(fixedJob("A", "입주청소", "2025-03-10", "10:00", 60))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.summary.total_jobs").value(1))
                .andExpect(jsonPath("$.summary.assigned").value(0));
    }

    @Test
    void testMissingJobsIsBadRequest() throws Exception {
        postJson("/api/v1/assign", Map.of("technicians", List.of()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void testJobsNotAListIsBadRequest() throws Exception {
        postJson("/api/v1/assign", Map.of("jobs", "not-a-list"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void testInvalidRulesIsBadRequest() throws Exception {
        Map<String, Object> body = Map.of(
                "jobs", List.of(fixedJob("A", "입주청소", "2025-03-10", "10:00", 60)),
                "technicians", List.of(technician("T1", 37.51, true, "입주청소")),
                "system_rules", Map.of("work_start", "18:00", "work_end", "09:00"));

        postJson("/api/v1/assign", body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("system_rules")));
    }

    @Test
    void testSingleAssignment() throws Exception {
        when(rosterStore.currentRoster()).thenReturn(List.of(
                rosterTechnician("R1", 37.70, "입주청소"),
                rosterTechnician("R2", 37.52, "입주청소")));

        postJson("/api/v1/assign/single", fixedJob("S", "입주청소", "2025-03-10", "10:00", 60))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.technician.technician_id").value("R2"))
                .andExpect(jsonPath("$.technician.phone").value("010-1234-5678"))
                .andExpect(jsonPath("$.start_time").value("10:00"))
                .andExpect(jsonPath("$.end_time").value("11:00"));
    }

    @Test
    void testSingleAssignmentWithoutMatch() throws Exception {
        when(rosterStore.currentRoster()).thenReturn(List.of(rosterTechnician("R1", 37.52, "입주청소")));

        postJson("/api/v1/assign/single", fixedJob("S", "이사청소", "2025-03-10", "10:00", 60))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("SERVICE_TYPE_MISMATCH"))
                .andExpect(jsonPath("$.message").value("'이사청소' 서비스를 처리할 수 있는 기사가 없음"));
    }

    @Test
    void testRosterRefresh() throws Exception {
        when(rosterStore.refresh()).thenReturn(4);

        mockMvc.perform(post("/api/v1/roster/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.technician_count").value(4));
    }

    @Test
    void testRosterRefreshFailure() throws Exception {
        when(rosterStore.refresh()).thenThrow(new RosterUnavailableException("sheet down"));

        mockMvc.perform(post("/api/v1/roster/refresh"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("sheet down"));
    }
}
