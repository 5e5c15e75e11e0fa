package com.cleanbear.assignment.controllers;

import com.cleanbear.assignment.dto.AssignRequest;
import com.cleanbear.assignment.dto.AssignResponse;
import com.cleanbear.assignment.dto.HealthResponse;
import com.cleanbear.assignment.dto.JobRequest;
import com.cleanbear.assignment.dto.RosterRefreshResponse;
import com.cleanbear.assignment.dto.SingleAssignResponse;
import com.cleanbear.assignment.exception.RosterUnavailableException;
import com.cleanbear.assignment.service.AssignmentService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class AssignmentController {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentController.class);

    private final AssignmentService assignmentService;

    public AssignmentController(AssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @PostMapping("/assign")
    public ResponseEntity<AssignResponse> assign(@Valid @RequestBody AssignRequest request) {
        AssignResponse response = assignmentService.assign(request);
        if (!response.isSuccess()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/assign/single")
    public ResponseEntity<SingleAssignResponse> assignSingle(@RequestBody JobRequest job) {
        return ResponseEntity.ok(assignmentService.assignSingle(job));
    }

    @PostMapping("/roster/refresh")
    public ResponseEntity<RosterRefreshResponse> refreshRoster() {
        try {
            int count = assignmentService.refreshRoster();
            return ResponseEntity.ok(RosterRefreshResponse.refreshed(count));
        } catch (RosterUnavailableException e) {
            logger.warn("Manual roster refresh failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(RosterRefreshResponse.failed(e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(assignmentService.health());
    }
}
