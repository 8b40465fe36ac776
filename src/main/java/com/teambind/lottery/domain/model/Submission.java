package com.teambind.lottery.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 쿠폰 사용(응모) 기록
 * 쿠폰 하나당 정확히 하나만 존재한다
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class Submission {

    private final Long id;
    private final Long couponId;
    private final String name;
    private final String email;
    private final String phone;
    private final String address;
    private final String productExperience;
    private final Long selectedRewardId;
    private final String ipAddress;
    private final String userAgent;
    private final Map<String, Object> additionalData;
    private final LocalDateTime submittedAt;

    private final Long assignedRewardId;
    private final LocalDateTime rewardAssignedAt;
    private final Long rewardAssignedBy;
    private final String assignmentNotes;

    public boolean hasAssignment() {
        return assignedRewardId != null;
    }
}
