package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.AssignmentResult;
import com.cleanbear.assignment.model.JobOutcome;
import com.cleanbear.assignment.model.SkippedTechnician;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.StringJoiner;

/**
 * Korean plain-text summary of a run, meant for operator notifications and sheet memos.
 */
@Component
public class SummaryMessageBuilder {

    static final int MAX_FAILED_LISTED = 5;
    static final int MAX_DEFERRED_LISTED = 3;
    static final int MAX_SKIPPED_LISTED = 3;

    public String build(AssignmentResult result) {
        int total = result.getTotalJobs();
        if (total == 0) {
            return "배정할 작업이 없습니다.";
        }

        StringJoiner lines = new StringJoiner("\n");
        lines.add("배정 결과 요약");
        lines.add("- 전체 작업: " + total + "건");
        lines.add("- 배정 완료: " + result.getAssigned().size() + "건");
        lines.add("- 배정 실패: " + result.getFailed().size() + "건");
        lines.add("- 배정일 제한 초과: " + result.getDeferred().size() + "건");

        List<JobOutcome> failed = result.getFailed();
        if (!failed.isEmpty()) {
            lines.add("");
            lines.add("배정 실패 작업:");
            for (JobOutcome outcome : failed.subList(0, Math.min(MAX_FAILED_LISTED, failed.size()))) {
                lines.add("  • " + label(outcome) + ": " + outcome.getDetail());
            }
            addOverflow(lines, failed.size(), MAX_FAILED_LISTED, "건");
        }

        List<JobOutcome> deferred = result.getDeferred();
        if (!deferred.isEmpty()) {
            lines.add("");
            lines.add("배정일 제한 초과 작업 (다음 배정 단계에서 처리):");
            for (JobOutcome outcome : deferred.subList(0, Math.min(MAX_DEFERRED_LISTED, deferred.size()))) {
                lines.add("  • " + label(outcome) + ": " + outcome.getJob().getDate());
            }
            addOverflow(lines, deferred.size(), MAX_DEFERRED_LISTED, "건");
        }

        List<SkippedTechnician> skipped = result.getSkippedTechnicians();
        if (!skipped.isEmpty()) {
            lines.add("");
            lines.add("기사 스킵: " + skipped.size() + "명");
            for (SkippedTechnician technician : skipped.subList(0, Math.min(MAX_SKIPPED_LISTED, skipped.size()))) {
                lines.add("  • " + technician.getTechnicianId() + ": " + technician.getReason());
            }
            addOverflow(lines, skipped.size(), MAX_SKIPPED_LISTED, "명");
        }

        return lines.toString();
    }

    public String noJobs() {
        return "작업 데이터가 없습니다.";
    }

    public String noTechnicians(int jobCount) {
        return "기사 데이터가 없습니다. 작업 " + jobCount + "건이 배정되지 않았습니다.";
    }

    private static String label(JobOutcome outcome) {
        String jobId = outcome.getJob().getJobId();
        return jobId != null ? jobId : RecordValidator.UNKNOWN_ID;
    }

    private static void addOverflow(StringJoiner lines, int size, int shown, String unit) {
        if (size > shown) {
            lines.add("  ... 외 " + (size - shown) + unit);
        }
    }
}
