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
import com.cleanbear.assignment.util.TimeFormats;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts wire records into domain objects. Per-record problems are recorded on the
 * record itself so that one bad job never fails the whole request; only malformed
 * rules or technician states are fatal.
 */
@Service
public class RequestMapper {

    private static final Pattern WHOLE_MINUTES = Pattern.compile("(-?\\d+)(?:\\.0+)?");

    private final LocationResolver locationResolver;
    private final SystemRules defaultRules;

    public RequestMapper(LocationResolver locationResolver, SystemRules defaultRules) {
        this.locationResolver = locationResolver;
        this.defaultRules = defaultRules;
    }

    public Job toJob(JobRequest request) {
        Job.Builder builder = Job.builder()
                .jobId(trimToNull(request.getJobId()))
                .serviceType(trimToNull(request.getServiceType()))
                .address(trimToNull(request.getAddress()))
                .timeFixed(Boolean.TRUE.equals(request.getTimeFixed()));

        LocationInput location = LocationInput.of(request.getLat(), request.getLng(), request.getAddress());
        Optional<Coordinate> resolved = locationResolver.resolve(location);
        if (resolved.isPresent()) {
            builder.location(resolved.get());
        } else if (location.getKind() == LocationInput.Kind.ADDRESS) {
            builder.locationUnresolved(true);
        }

        String rawDate = request.getDate();
        LocalDate date = TimeFormats.parseDate(rawDate);
        builder.date(date);
        if (date == null && !isBlank(rawDate)) {
            builder.inputError("date", "expected YYYY-MM-DD, got '" + rawDate + "'");
        }

        String rawDuration = request.getDurationMin();
        if (!isBlank(rawDuration)) {
            Integer duration = parseMinutes(rawDuration);
            if (duration == null) {
                builder.inputError("duration_min", "not a whole number of minutes: '" + rawDuration + "'");
            }
            builder.durationMin(duration);
        }

        String rawStart = request.getFixedStartTime();
        LocalTime fixedStart = TimeFormats.parseTime(rawStart);
        builder.fixedStartTime(fixedStart);
        if (fixedStart == null && !isBlank(rawStart)) {
            builder.inputError("fixed_start_time", "expected HH:MM, got '" + rawStart + "'");
        }

        String rawSlot = request.getSlotType();
        if (!isBlank(rawSlot)) {
            SlotType slotType = SlotType.parse(rawSlot);
            if (slotType == null) {
                builder.inputError("slot_type", "unknown slot '" + rawSlot + "'");
            }
            builder.slotType(slotType);
        }

        return builder.build();
    }

    /**
     * Home falls back from coordinates to {@code home_address}, then to {@code area}.
     * An unresolvable home leaves it null, which later skips the technician.
     */
    public Technician toTechnician(TechnicianRecord record) {
        String homeAddress = !isBlank(record.getHomeAddress()) ? record.getHomeAddress() : record.getArea();
        Coordinate home = locationResolver
                .resolve(LocationInput.of(record.getHomeLat(), record.getHomeLng(), homeAddress))
                .orElse(null);

        Set<String> serviceTypes = null;
        if (record.getServiceTypes() != null) {
            serviceTypes = new LinkedHashSet<>();
            for (String type : record.getServiceTypes()) {
                if (!isBlank(type)) {
                    serviceTypes.add(type.trim());
                }
            }
        }

        return Technician.builder()
                .technicianId(trimToNull(record.getTechnicianId()))
                .name(record.getName())
                .phone(record.getPhone())
                .area(record.getArea())
                .home(home)
                .serviceTypes(serviceTypes)
                .overtimeAllowed(record.getOvertimeAllowed())
                .build();
    }

    public List<Technician> toTechnicians(List<TechnicianRecord> records) {
        List<Technician> technicians = new ArrayList<>();
        for (TechnicianRecord record : records) {
            if (record != null) {
                technicians.add(toTechnician(record));
            }
        }
        return technicians;
    }

    public List<TechnicianStateSeed> toStateSeeds(List<TechnicianStateRequest> requests) {
        List<TechnicianStateSeed> seeds = new ArrayList<>();
        if (requests == null) {
            return seeds;
        }
        for (TechnicianStateRequest request : requests) {
            if (request == null || isBlank(request.getTechnicianId())) {
                continue;
            }
            Coordinate last = locationResolver
                    .resolve(LocationInput.of(request.getLastLat(), request.getLastLng(), request.getLastAddress()))
                    .orElse(null);

            List<TechnicianStateSeed.Commitment> commitments = new ArrayList<>();
            if (request.getCommitments() != null) {
                for (TechnicianStateRequest.CommitmentRequest commitment : request.getCommitments()) {
                    commitments.add(toCommitment(request.getTechnicianId(), commitment));
                }
            }
            seeds.add(new TechnicianStateSeed(request.getTechnicianId().trim(), last, commitments));
        }
        return seeds;
    }

    /**
     * Configured rules with any per-request overrides applied.
     */
    public SystemRules toRules(SystemRulesRequest request) {
        if (request == null) {
            return defaultRules;
        }
        LocalTime workStart = parseRuleTime("work_start", request.getWorkStart(), defaultRules.getWorkStart());
        LocalTime workEnd = parseRuleTime("work_end", request.getWorkEnd(), defaultRules.getWorkEnd());
        int maxDays = request.getMaxPreassignDays() != null
                ? request.getMaxPreassignDays() : defaultRules.getMaxPreassignDays();
        int buffer = request.getDefaultBufferMin() != null
                ? request.getDefaultBufferMin() : defaultRules.getDefaultBufferMin();
        try {
            return new SystemRules(workStart, workEnd, maxDays, buffer);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid system_rules: " + e.getMessage(), e);
        }
    }

    private TechnicianStateSeed.Commitment toCommitment(String technicianId,
                                                       TechnicianStateRequest.CommitmentRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Empty commitment for technician " + technicianId);
        }
        LocalDate date = TimeFormats.parseDate(request.getDate());
        LocalTime start = TimeFormats.parseTime(request.getStartTime());
        LocalTime end = TimeFormats.parseTime(request.getEndTime());
        if (date == null || start == null || end == null || end.isBefore(start)) {
            throw new InvalidRequestException("Invalid commitment for technician " + technicianId
                    + ": " + request.getDate() + " " + request.getStartTime() + "-" + request.getEndTime());
        }
        return new TechnicianStateSeed.Commitment(date,
                new TimeInterval(TimeFormats.toMinutes(start), TimeFormats.toMinutes(end)));
    }

    private static LocalTime parseRuleTime(String field, String raw, LocalTime fallback) {
        if (isBlank(raw)) {
            return fallback;
        }
        LocalTime parsed = TimeFormats.parseTime(raw);
        if (parsed == null) {
            throw new InvalidRequestException("Invalid system_rules." + field + ": '" + raw + "'");
        }
        return parsed;
    }

    // Accepts "90" and "90.0"; anything else is a format error.
    private static Integer parseMinutes(String raw) {
        Matcher matcher = WHOLE_MINUTES.matcher(raw.trim());
        if (!matcher.matches()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
