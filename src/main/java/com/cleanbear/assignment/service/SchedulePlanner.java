package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.CandidateEvaluation;
import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.ReasonCode;
import com.cleanbear.assignment.model.SlotType;
import com.cleanbear.assignment.model.SystemRules;
import com.cleanbear.assignment.model.TechnicianState;
import com.cleanbear.assignment.model.TimeInterval;
import com.cleanbear.assignment.model.TimeStatus;
import com.cleanbear.assignment.util.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;

/**
 * Decides when a technician would do a job and whether the slot is acceptable.
 */
@Service
public class SchedulePlanner {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePlanner.class);

    public CandidateEvaluation evaluate(Job job, TechnicianState state, double travelMinutes, SystemRules rules) {
        int buffer = rules.getDefaultBufferMin();
        int start;
        TimeStatus status;

        if (job.isTimeFixed()) {
            start = TimeFormats.toMinutes(job.getFixedStartTime());
            status = TimeStatus.FIXED;
        } else {
            int windowStart = rules.slotWindowStart(job.getSlotType());
            OptionalInt lastEnd = state.lastEndOn(job.getDate());

            if (lastEnd.isEmpty()) {
                start = windowStart;
                status = TimeStatus.TO_BE_CONFIRMED;
            } else {
                int gap = buffer;
                if (!DistanceProvider.isUnreachable(travelMinutes)) {
                    gap = Math.max(buffer, (int) Math.ceil(travelMinutes));
                }
                start = Math.max(windowStart, lastEnd.getAsInt() + gap);
                status = TimeStatus.COMPUTED;
            }
        }

        TimeInterval interval = new TimeInterval(start, start + job.getDurationMin());

        for (TimeInterval existing : state.getCommitments(job.getDate())) {
            if (interval.overlaps(existing, buffer)) {
                logger.trace("Technician {} rejected for job {}: {} conflicts with {}",
                        state.getTechnicianId(), job.getJobId(), interval, existing);
                return CandidateEvaluation.rejected(interval, ReasonCode.TIME_CONFLICT);
            }
        }

        if (interval.getEnd() > rules.getWorkEndMinutes() && !state.getTechnician().isOvertimeAllowed()) {
            logger.trace("Technician {} rejected for job {}: ends {} after work end {}",
                    state.getTechnicianId(), job.getJobId(),
                    TimeFormats.format(interval.getEnd()), rules.getWorkEnd());
            return CandidateEvaluation.rejected(interval, ReasonCode.OVERTIME_NOT_ALLOWED);
        }

        if (!job.isTimeFixed() && interval.getEnd() > rules.slotWindowEnd(job.getSlotType())) {
            logger.trace("Technician {} rejected for job {}: {} does not fit the {} slot ending {}",
                    state.getTechnicianId(), job.getJobId(), interval,
                    job.getSlotType() != null ? job.getSlotType() : SlotType.ALLDAY,
                    TimeFormats.format(rules.slotWindowEnd(job.getSlotType())));
            return CandidateEvaluation.rejected(interval, ReasonCode.SLOT_CAPACITY_EXCEEDED);
        }

        return CandidateEvaluation.accepted(interval, status);
    }
}
