package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.JobOutcome;
import com.cleanbear.assignment.model.ReasonCode;
import com.cleanbear.assignment.model.SkippedTechnician;
import com.cleanbear.assignment.model.Technician;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks on jobs and technicians, run before any matching.
 */
@Component
public class RecordValidator {

    private static final Logger logger = LoggerFactory.getLogger(RecordValidator.class);

    public static final String UNKNOWN_ID = "UNKNOWN";

    /** One job never spans more than a calendar day. */
    public static final int MAX_DURATION_MIN = 24 * 60;

    /**
     * Splits the roster into usable technicians (sorted by id) and skipped ones.
     */
    public TechnicianScreening screenTechnicians(List<Technician> technicians) {
        List<Technician> accepted = new ArrayList<>();
        List<SkippedTechnician> skipped = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (Technician technician : technicians) {
            List<String> missing = new ArrayList<>();
            if (isBlank(technician.getTechnicianId())) missing.add("technician_id");
            if (technician.getHome() == null) missing.add("home_location");
            if (technician.getServiceTypes() == null || technician.getServiceTypes().isEmpty()) {
                missing.add("service_types");
            }
            if (technician.getOvertimeAllowed() == null) missing.add("overtime_allowed");

            String id = isBlank(technician.getTechnicianId()) ? UNKNOWN_ID : technician.getTechnicianId();

            if (!missing.isEmpty()) {
                logger.warn("Skipping technician {}: missing {}", id, missing);
                skipped.add(new SkippedTechnician(id,
                        ReasonCode.MISSING_REQUIRED_FIELD.getDescription() + ": " + String.join(", ", missing),
                        missing));
                continue;
            }

            if (!seenIds.add(id)) {
                logger.warn("Skipping duplicate technician id {}", id);
                skipped.add(new SkippedTechnician(id, "중복된 기사 ID", List.of()));
                continue;
            }

            accepted.add(technician);
        }

        accepted.sort(Comparator.comparing(Technician::getTechnicianId));
        return new TechnicianScreening(accepted, skipped);
    }

    /**
     * Reason the job cannot be scheduled at all, or empty when it is structurally valid.
     */
    public Optional<JobOutcome> validateJob(Job job) {
        Map<String, String> inputErrors = job.getInputErrors();

        if (job.isTimeFixed() && job.getFixedStartTime() == null
                && !inputErrors.containsKey("fixed_start_time")) {
            return Optional.of(new JobOutcome(job, ReasonCode.FIXED_TIME_MISSING,
                    ReasonCode.FIXED_TIME_MISSING.getDescription()));
        }

        List<String> missing = new ArrayList<>();
        if (isBlank(job.getJobId())) missing.add("job_id");
        if (isBlank(job.getServiceType())) missing.add("service_type");
        if (job.getLocation() == null && !job.isLocationUnresolved()) missing.add("location");
        if (job.getDate() == null && !inputErrors.containsKey("date")) missing.add("date");
        if (job.getDurationMin() == null && !inputErrors.containsKey("duration_min")) missing.add("duration_min");

        if (!missing.isEmpty()) {
            return Optional.of(new JobOutcome(job, ReasonCode.MISSING_REQUIRED_FIELD,
                    ReasonCode.MISSING_REQUIRED_FIELD.getDescription() + ": " + String.join(", ", missing)));
        }

        if (job.isLocationUnresolved()) {
            return Optional.of(new JobOutcome(job, ReasonCode.LOCATION_UNRESOLVED,
                    ReasonCode.LOCATION_UNRESOLVED.getDescription() + ": " + job.getAddress()));
        }

        if (!inputErrors.isEmpty()) {
            String detail = inputErrors.entrySet().stream()
                    .map(e -> e.getKey() + " (" + e.getValue() + ")")
                    .collect(Collectors.joining(", "));
            return Optional.of(new JobOutcome(job, ReasonCode.INVALID_FIELD_FORMAT,
                    ReasonCode.INVALID_FIELD_FORMAT.getDescription() + ": " + detail));
        }

        if (job.getDurationMin() <= 0) {
            return Optional.of(new JobOutcome(job, ReasonCode.INVALID_FIELD_FORMAT,
                    ReasonCode.INVALID_FIELD_FORMAT.getDescription() + ": duration_min must be positive"));
        }

        if (job.getDurationMin() > MAX_DURATION_MIN) {
            return Optional.of(new JobOutcome(job, ReasonCode.INVALID_FIELD_FORMAT,
                    ReasonCode.INVALID_FIELD_FORMAT.getDescription()
                            + ": duration_min must not exceed " + MAX_DURATION_MIN));
        }

        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static final class TechnicianScreening {
        private final List<Technician> accepted;
        private final List<SkippedTechnician> skipped;

        TechnicianScreening(List<Technician> accepted, List<SkippedTechnician> skipped) {
            this.accepted = List.copyOf(accepted);
            this.skipped = List.copyOf(skipped);
        }

        public List<Technician> getAccepted() { return accepted; }
        public List<SkippedTechnician> getSkipped() { return skipped; }
    }
}
