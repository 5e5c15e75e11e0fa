package com.cleanbear.assignment.service;

import com.cleanbear.assignment.dto.JobRequest;
import com.cleanbear.assignment.dto.SystemRulesRequest;
import com.cleanbear.assignment.dto.TechnicianRecord;
import com.cleanbear.assignment.dto.TechnicianStateRequest;
import com.cleanbear.assignment.exception.InvalidRequestException;
import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.LocationInput;
import com.cleanbear.assignment.model.SlotType;
import com.cleanbear.assignment.model.SystemRules;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.model.TechnicianStateSeed;
import com.cleanbear.assignment.model.TimeInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RequestMapperTest {

    private static final Coordinate GANGNAM = new Coordinate(37.4979, 127.0276);

    private RequestMapper mapper;

    @BeforeEach
    void setUp() {
        LocationResolver resolver = mock(LocationResolver.class);
        when(resolver.resolve(any())).thenAnswer(invocation -> {
            LocationInput input = invocation.getArgument(0);
            switch (input.getKind()) {
                case COORDINATE:
                    return Optional.of(input.getCoordinate());
                case ADDRESS:
                    return input.getAddress().startsWith("강남") ? Optional.of(GANGNAM) : Optional.empty();
                default:
                    return Optional.empty();
            }
        });
        mapper = new RequestMapper(resolver, SystemRules.defaults());
    }

    private static JobRequest request() {
        JobRequest request = new JobRequest();
        request.setJobId(" J1 ");
        request.setServiceType("입주청소");
        request.setLat(37.5);
        request.setLng(127.0);
        request.setDate("2025-03-10");
        request.setDurationMin("120");
        return request;
    }

    @Test
    void testWellFormedJob() {
        JobRequest request = request();
        request.setTimeFixed(true);
        request.setFixedStartTime("9:30");
        request.setSlotType("오후");

        Job job = mapper.toJob(request);

        assertEquals("J1", job.getJobId());
        assertEquals(new Coordinate(37.5, 127.0), job.getLocation());
        assertEquals(LocalDate.of(2025, 3, 10), job.getDate());
        assertEquals(120, job.getDurationMin());
        assertTrue(job.isTimeFixed());
        assertEquals(LocalTime.of(9, 30), job.getFixedStartTime());
        assertEquals(SlotType.AFTERNOON, job.getSlotType());
        assertTrue(job.getInputErrors().isEmpty());
    }

    @Test
    void testAddressResolvedWhenNoCoordinates() {
        JobRequest request = request();
        request.setLat(null);
        request.setAddress("강남역");

        assertEquals(GANGNAM, mapper.toJob(request).getLocation());
    }

    @Test
    void testUnresolvableAddressFlagged() {
        JobRequest request = request();
        request.setLat(null);
        request.setLng(null);
        request.setAddress("알 수 없는 곳");

        Job job = mapper.toJob(request);

        assertNull(job.getLocation());
        assertTrue(job.isLocationUnresolved());
    }

    @Test
    void testBadValuesRecordedAsInputErrors() {
        JobRequest request = request();
        request.setDate("2025/03/10");
        request.setDurationMin("두시간");
        request.setFixedStartTime("25:99");
        request.setSlotType("새벽");

        Job job = mapper.toJob(request);

        assertEquals(Set.of("date", "duration_min", "fixed_start_time", "slot_type"), job.getInputErrors().keySet());
        assertNull(job.getDate());
        assertNull(job.getDurationMin());
    }

    @Test
    void testWholeNumberDurationWithDecimalPoint() {
        JobRequest request = request();
        request.setDurationMin("90.0");

        assertEquals(90, mapper.toJob(request).getDurationMin());
    }

    @Test
    void testTechnicianHomeFallsBackToArea() {
        TechnicianRecord record = new TechnicianRecord();
        record.setTechnicianId("T1");
        record.setArea("강남구");
        record.setServiceTypes(List.of(" 입주청소 ", "", "이사청소"));
        record.setOvertimeAllowed(true);

        Technician technician = mapper.toTechnician(record);

        assertEquals(GANGNAM, technician.getHome());
        assertEquals(Set.of("입주청소", "이사청소"), technician.getServiceTypes());
    }

    @Test
    void testTechnicianWithoutServiceTypesKeepsNull() {
        TechnicianRecord record = new TechnicianRecord();
        record.setTechnicianId("T1");
        record.setHomeLat(37.5);
        record.setHomeLng(127.0);

        Technician technician = mapper.toTechnician(record);

        assertNull(technician.getServiceTypes());
        assertNull(technician.getOvertimeAllowed());
    }

    @Test
    void testStateSeeds() {
        TechnicianStateRequest state = new TechnicianStateRequest();
        state.setTechnicianId("T1");
        state.setLastAddress("강남 사무실");
        state.setCommitments(List.of(new TechnicianStateRequest.CommitmentRequest("2025-03-10", "10:00", "12:00")));

        List<TechnicianStateSeed> seeds = mapper.toStateSeeds(List.of(state));

        assertEquals(1, seeds.size());
        assertEquals(GANGNAM, seeds.get(0).getLastLocation());
        assertEquals(new TimeInterval(600, 720), seeds.get(0).getCommitments().get(0).getInterval());
    }

    @Test
    void testMalformedCommitmentRejectsRequest() {
        TechnicianStateRequest state = new TechnicianStateRequest();
        state.setTechnicianId("T1");
        state.setCommitments(List.of(new TechnicianStateRequest.CommitmentRequest("2025-03-10", "12:00", "10:00")));

        assertThrows(InvalidRequestException.class, () -> mapper.toStateSeeds(List.of(state)));
    }

    @Test
    void testRulesOverridesAndDefaults() {
        SystemRulesRequest request = new SystemRulesRequest();
        request.setWorkEnd("20:00");
        request.setMaxPreassignDays(5);

        SystemRules rules = mapper.toRules(request);

        assertEquals(LocalTime.of(9, 0), rules.getWorkStart());
        assertEquals(LocalTime.of(20, 0), rules.getWorkEnd());
        assertEquals(5, rules.getMaxPreassignDays());
        assertEquals(30, rules.getDefaultBufferMin());
        assertEquals(LocalTime.of(18, 0), mapper.toRules(null).getWorkEnd());
    }

    @Test
    void testContradictoryRulesRejected() {
        SystemRulesRequest request = new SystemRulesRequest();
        request.setWorkStart("18:00");
        request.setWorkEnd("09:00");

        assertThrows(InvalidRequestException.class, () -> mapper.toRules(request));

        SystemRulesRequest negative = new SystemRulesRequest();
        negative.setDefaultBufferMin(-5);
        assertThrows(InvalidRequestException.class, () -> mapper.toRules(negative));
    }
}
