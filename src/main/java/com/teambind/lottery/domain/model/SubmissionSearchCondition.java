package com.teambind.lottery.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 응모 내역 검색 조건 (null 인 항목은 조건에서 제외)
 */
@Value
@Builder
public class SubmissionSearchCondition {
    String email;
    Long couponId;
    Boolean assigned;
    Long assignedRewardId;
    LocalDateTime submittedFrom;
    LocalDateTime submittedTo;

    public static SubmissionSearchCondition all() {
        return SubmissionSearchCondition.builder().build();
    }
}
