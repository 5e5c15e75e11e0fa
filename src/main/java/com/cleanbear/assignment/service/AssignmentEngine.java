package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Assignment;
import com.cleanbear.assignment.model.AssignmentResult;
import com.cleanbear.assignment.model.CandidateEvaluation;
import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.JobOutcome;
import com.cleanbear.assignment.model.ReasonCode;
import com.cleanbear.assignment.model.SystemRules;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.model.TechnicianState;
import com.cleanbear.assignment.model.TechnicianStateSeed;
import com.cleanbear.assignment.util.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Greedy, per-day assignment of jobs to technicians.
 *
 * <p>Jobs are placed one at a time in (date, fixed start) order. For each job the
 * technicians offering the service are filtered by the day limit, their travel
 * times are looked up, each candidate's slot is checked for conflicts and
 * overtime, and the survivor with the shortest travel (ties by id) is committed
 * before the next job is considered. The result is fully determined by the
 * inputs and the distance provider's answers.
 */
@Service
public class AssignmentEngine {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentEngine.class);

    // Sorts unfixed jobs after every fixed start of the same date.
    private static final int UNFIXED_SORT_KEY = Integer.MAX_VALUE;

    private final RecordValidator recordValidator;
    private final TravelTimeLookup travelTimeLookup;
    private final SchedulePlanner schedulePlanner;

    public AssignmentEngine(RecordValidator recordValidator,
                            TravelTimeLookup travelTimeLookup,
                            SchedulePlanner schedulePlanner) {
        this.recordValidator = recordValidator;
        this.travelTimeLookup = travelTimeLookup;
        this.schedulePlanner = schedulePlanner;
    }

    public AssignmentResult assign(List<Job> jobs, List<Technician> technicians,
                                   List<TechnicianStateSeed> existingStates, SystemRules rules) {
        logger.info("=== Starting assignment for {} jobs, {} technicians ({}) ===",
                jobs.size(), technicians.size(), rules);

        RecordValidator.TechnicianScreening screening = recordValidator.screenTechnicians(technicians);
        List<TechnicianState> states = buildStates(screening.getAccepted(), existingStates);

        List<Assignment> assigned = new ArrayList<>();
        List<JobOutcome> failed = new ArrayList<>();
        List<JobOutcome> deferred = new ArrayList<>();

        List<Job> pending = new ArrayList<>();
        for (Job job : jobs) {
            Optional<JobOutcome> rejection = recordValidator.validateJob(job);
            if (rejection.isPresent()) {
                logger.debug("Job {} rejected during validation: {}", job.getJobId(), rejection.get().getDetail());
                failed.add(rejection.get());
            } else {
                pending.add(job);
            }
        }

        // List.sort is stable, so input order breaks ties among unfixed jobs.
        pending.sort(Comparator.comparing(Job::getDate).thenComparingInt(AssignmentEngine::sortKey));

        for (Job job : pending) {
            JobDecision decision = decide(job, states, rules);

            if (!decision.isChosen()) {
                JobOutcome outcome = new JobOutcome(job, decision.getReason(), decision.getDetail());
                if (decision.getReason().isDeferral()) {
                    deferred.add(outcome);
                } else {
                    failed.add(outcome);
                }
                logger.debug("Job {} not assigned: {}", job.getJobId(), decision.getReason());
                continue;
            }

            TechnicianState chosen = decision.getChosen();
            CandidateEvaluation evaluation = decision.getEvaluation();
            chosen.commit(job.getDate(), evaluation.getInterval(), job.getLocation());

            Assignment assignment = new Assignment(job, chosen.getTechnician(), evaluation.getInterval(),
                    evaluation.getTimeStatus(), decision.getTravelMinutes());
            assigned.add(assignment);
            logger.debug("Assigned {}", assignment);
        }

        logger.info("=== Completed: {} assigned, {} failed, {} deferred, {} technicians skipped ===",
                assigned.size(), failed.size(), deferred.size(), screening.getSkipped().size());

        return new AssignmentResult(assigned, failed, deferred, screening.getSkipped());
    }

    /**
     * Picks the technician for one job without committing anything.
     * {@code states} must be ordered by technician id.
     */
    JobDecision decide(Job job, List<TechnicianState> states, SystemRules rules) {
        List<TechnicianState> eligible = states.stream()
                .filter(s -> s.getTechnician().canHandle(job.getServiceType()))
                .collect(Collectors.toList());

        if (eligible.isEmpty()) {
            return JobDecision.rejected(ReasonCode.SERVICE_TYPE_MISMATCH,
                    "'" + job.getServiceType() + "' " + ReasonCode.SERVICE_TYPE_MISMATCH.getDescription());
        }

        List<TechnicianState> candidates = new ArrayList<>();
        for (TechnicianState state : eligible) {
            if (state.isDayLimitBlocked(job.getDate(), rules.getMaxPreassignDays())) {
                logger.trace("Technician {} is day-limit blocked for job {} ({} days used)",
                        state.getTechnicianId(), job.getJobId(), state.getDistinctDayCount());
            } else {
                candidates.add(state);
            }
        }

        if (candidates.isEmpty()) {
            return JobDecision.rejected(ReasonCode.MAX_PREASSIGN_DAYS_EXCEEDED,
                    ReasonCode.MAX_PREASSIGN_DAYS_EXCEEDED.getDescription()
                            + " (" + rules.getMaxPreassignDays() + "일)");
        }

        Map<String, Double> travel = travelTimeLookup.lookup(candidates, job.getLocation());

        TechnicianState best = null;
        CandidateEvaluation bestEvaluation = null;
        double bestTravel = Double.POSITIVE_INFINITY;
        Map<ReasonCode, Integer> rejections = new LinkedHashMap<>();

        for (TechnicianState candidate : candidates) {
            double minutes = travel.getOrDefault(candidate.getTechnicianId(), DistanceProvider.UNREACHABLE_MINUTES);
            CandidateEvaluation evaluation = schedulePlanner.evaluate(job, candidate, minutes, rules);

            if (!evaluation.isAccepted()) {
                rejections.merge(evaluation.getRejection(), 1, Integer::sum);
                continue;
            }

            // Candidates arrive in id order, so a strict comparison keeps the lowest id on ties.
            if (best == null || Double.compare(minutes, bestTravel) < 0) {
                best = candidate;
                bestEvaluation = evaluation;
                bestTravel = minutes;
            }
        }

        if (best == null) {
            ReasonCode reason = rejections.containsKey(ReasonCode.OVERTIME_NOT_ALLOWED)
                    ? ReasonCode.OVERTIME_NOT_ALLOWED
                    : rejections.containsKey(ReasonCode.TIME_CONFLICT)
                    ? ReasonCode.TIME_CONFLICT
                    : rejections.containsKey(ReasonCode.SLOT_CAPACITY_EXCEEDED)
                    ? ReasonCode.SLOT_CAPACITY_EXCEEDED
                    : ReasonCode.NO_TECHNICIAN_AVAILABLE;
            return JobDecision.rejected(reason, reason.getDescription() + " (후보 " + candidates.size() + "명)");
        }

        return JobDecision.chosen(best, bestEvaluation, bestTravel);
    }

    private List<TechnicianState> buildStates(List<Technician> technicians, List<TechnicianStateSeed> seeds) {
        Map<String, TechnicianStateSeed> seedById = new LinkedHashMap<>();
        if (seeds != null) {
            for (TechnicianStateSeed seed : seeds) {
                if (seed != null && seed.getTechnicianId() != null) {
                    seedById.put(seed.getTechnicianId(), seed);
                }
            }
        }

        List<TechnicianState> states = new ArrayList<>(technicians.size());
        for (Technician technician : technicians) {
            states.add(TechnicianState.seeded(technician, seedById.remove(technician.getTechnicianId())));
        }

        if (!seedById.isEmpty()) {
            logger.debug("Ignoring states for unknown technicians: {}", seedById.keySet());
        }
        return states;
    }

    private static int sortKey(Job job) {
        return job.isTimeFixed() ? TimeFormats.toMinutes(job.getFixedStartTime()) : UNFIXED_SORT_KEY;
    }
}
