package com.cleanbear.assignment.service;

import com.cleanbear.assignment.dto.AssignRequest;
import com.cleanbear.assignment.dto.AssignResponse;
import com.cleanbear.assignment.dto.AssignedJobView;
import com.cleanbear.assignment.dto.AssignmentSummary;
import com.cleanbear.assignment.dto.HealthResponse;
import com.cleanbear.assignment.dto.JobRequest;
import com.cleanbear.assignment.dto.RejectedJobView;
import com.cleanbear.assignment.dto.SingleAssignResponse;
import com.cleanbear.assignment.dto.SkippedTechnicianView;
import com.cleanbear.assignment.model.AssignmentResult;
import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.ReasonCode;
import com.cleanbear.assignment.model.SelectionResult;
import com.cleanbear.assignment.model.SystemRules;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.model.TechnicianStateSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One HTTP request's worth of work: map the payload, run the engine or selector,
 * and shape the response.
 */
@Service
public class AssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentService.class);

    private final RequestMapper requestMapper;
    private final AssignmentEngine assignmentEngine;
    private final SingleJobSelector singleJobSelector;
    private final RosterStore rosterStore;
    private final SummaryMessageBuilder summaryMessageBuilder;

    public AssignmentService(RequestMapper requestMapper,
                             AssignmentEngine assignmentEngine,
                             SingleJobSelector singleJobSelector,
                             RosterStore rosterStore,
                             SummaryMessageBuilder summaryMessageBuilder) {
        this.requestMapper = requestMapper;
        this.assignmentEngine = assignmentEngine;
        this.singleJobSelector = singleJobSelector;
        this.rosterStore = rosterStore;
        this.summaryMessageBuilder = summaryMessageBuilder;
    }

    /**
     * Runs a batch assignment. A response with {@code success=false} means nothing was
     * attempted because there were no jobs or no technicians.
     */
    public AssignResponse assign(AssignRequest request) {
        List<JobRequest> jobRequests = request.getJobs();
        if (jobRequests == null || jobRequests.isEmpty()) {
            logger.warn("Assignment request without jobs");
            return AssignResponse.failure("작업 데이터가 없습니다", summaryMessageBuilder.noJobs(), 0);
        }

        SystemRules rules = requestMapper.toRules(request.getSystemRules());

        // The roster snapshot is read once, so a concurrent refresh cannot change this run.
        List<Technician> technicians = request.getTechnicians() != null
                ? requestMapper.toTechnicians(request.getTechnicians())
                : rosterStore.currentRoster();

        if (technicians.isEmpty()) {
            logger.warn("Assignment request for {} jobs but no technicians", jobRequests.size());
            return AssignResponse.failure("기사 데이터가 없습니다",
                    summaryMessageBuilder.noTechnicians(jobRequests.size()), jobRequests.size());
        }

        List<Job> jobs = new ArrayList<>(jobRequests.size());
        for (JobRequest jobRequest : jobRequests) {
            jobs.add(requestMapper.toJob(jobRequest != null ? jobRequest : new JobRequest()));
        }
        List<TechnicianStateSeed> seeds = requestMapper.toStateSeeds(request.getTechnicianStates());

        AssignmentResult result = assignmentEngine.assign(jobs, technicians, seeds, rules);

        return new AssignResponse(
                result.getAssigned().stream().map(AssignedJobView::from).collect(Collectors.toList()),
                result.getFailed().stream().map(RejectedJobView::from).collect(Collectors.toList()),
                result.getDeferred().stream().map(RejectedJobView::from).collect(Collectors.toList()),
                result.getSkippedTechnicians().stream().map(SkippedTechnicianView::from).collect(Collectors.toList()),
                new AssignmentSummary(result.getTotalJobs(), result.getAssigned().size(),
                        result.getFailed().size(), result.getDeferred().size()),
                summaryMessageBuilder.build(result));
    }

    /**
     * Best roster technician for one job, without touching any schedule.
     */
    public SingleAssignResponse assignSingle(JobRequest jobRequest) {
        List<Technician> technicians = rosterStore.currentRoster();
        if (technicians.isEmpty()) {
            return SingleAssignResponse.failure(ReasonCode.NO_TECHNICIAN_AVAILABLE.name(), "기사 데이터가 없습니다");
        }

        Job job = requestMapper.toJob(jobRequest);
        SelectionResult selection = singleJobSelector.select(job, technicians, requestMapper.toRules(null));

        if (!selection.isSelected()) {
            return SingleAssignResponse.failure(selection.getReason().name(), selection.getDetail());
        }
        return SingleAssignResponse.of(selection.getAssignment());
    }

    /**
     * @throws com.cleanbear.assignment.exception.RosterUnavailableException if the roster cannot be reloaded
     */
    public int refreshRoster() {
        return rosterStore.refresh();
    }

    public HealthResponse health() {
        return new HealthResponse("ok", rosterStore.isLoaded(), rosterStore.currentRoster().size(),
                rosterStore.getLastRefreshedAt() != null ? rosterStore.getLastRefreshedAt().toString() : null);
    }
}
