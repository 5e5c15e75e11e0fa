package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Assignment;
import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.JobOutcome;
import com.cleanbear.assignment.model.SelectionResult;
import com.cleanbear.assignment.model.SystemRules;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.model.TechnicianState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Best technician for a single job, ignoring every other job. Each call starts
 * from fresh technician states, so nothing carries over between calls.
 */
@Service
public class SingleJobSelector {

    private static final Logger logger = LoggerFactory.getLogger(SingleJobSelector.class);

    private final RecordValidator recordValidator;
    private final AssignmentEngine assignmentEngine;

    public SingleJobSelector(RecordValidator recordValidator, AssignmentEngine assignmentEngine) {
        this.recordValidator = recordValidator;
        this.assignmentEngine = assignmentEngine;
    }

    public SelectionResult select(Job job, List<Technician> technicians, SystemRules rules) {
        Optional<JobOutcome> rejection = recordValidator.validateJob(job);
        if (rejection.isPresent()) {
            return SelectionResult.none(rejection.get().getReason(), rejection.get().getDetail());
        }

        List<TechnicianState> states = recordValidator.screenTechnicians(technicians).getAccepted().stream()
                .map(TechnicianState::fresh)
                .collect(Collectors.toList());

        JobDecision decision = assignmentEngine.decide(job, states, rules);
        if (!decision.isChosen()) {
            logger.info("No technician for job {}: {}", job.getJobId(), decision.getReason());
            return SelectionResult.none(decision.getReason(), decision.getDetail());
        }

        Assignment assignment = new Assignment(job, decision.getChosen().getTechnician(),
                decision.getEvaluation().getInterval(), decision.getEvaluation().getTimeStatus(),
                decision.getTravelMinutes());
        logger.info("Selected {}", assignment);
        return SelectionResult.selected(assignment);
    }
}
