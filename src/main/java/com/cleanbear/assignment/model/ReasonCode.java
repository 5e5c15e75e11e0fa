package com.cleanbear.assignment.model;

/**
 * Why a job was not assigned. Every code except {@link #MAX_PREASSIGN_DAYS_EXCEEDED}
 * lands the job in the failed bucket.
 */
public enum ReasonCode {
    FIXED_TIME_MISSING("시간 지정 작업에 시작 시간이 없음"),
    MISSING_REQUIRED_FIELD("필수 필드 누락"),
    INVALID_FIELD_FORMAT("필드 형식 오류"),
    LOCATION_UNRESOLVED("주소를 좌표로 변환할 수 없음"),
    SERVICE_TYPE_MISMATCH("서비스를 처리할 수 있는 기사가 없음"),
    MAX_PREASSIGN_DAYS_EXCEEDED("최대 사전 배정 일수 초과"),
    OVERTIME_NOT_ALLOWED("초과근무 불가"),
    TIME_CONFLICT("시간 충돌"),
    SLOT_CAPACITY_EXCEEDED("슬롯 크기 초과"),
    NO_TECHNICIAN_AVAILABLE("배정 가능한 기사가 없음");

    private final String description;

    ReasonCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isDeferral() {
        return this == MAX_PREASSIGN_DAYS_EXCEEDED;
    }
}
