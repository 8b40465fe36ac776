package com.teambind.lottery.application.port.out;

import com.teambind.lottery.domain.model.ClientMeta;
import com.teambind.lottery.domain.model.Submission;
import com.teambind.lottery.domain.model.SubmissionFields;

import java.time.LocalDateTime;

/**
 * 응모 내역 저장/변경 포트
 */
public interface SaveSubmissionPort {

    /**
     * @throws com.teambind.lottery.domain.exception.DuplicateCouponSubmissionException 이미 이 쿠폰으로 생성된 응모가 있는 경우
     */
    Submission create(Long couponId, SubmissionFields fields, ClientMeta clientMeta, LocalDateTime submittedAt);

    /**
     * 배정이 비어 있는 경우에만 배정 정보를 기록
     *
     * @return false 이면 이미 배정된 응모
     */
    boolean setAssignment(Long submissionId, Long rewardAccountId, Long assignedBy, String notes, LocalDateTime assignedAt);

    /**
     * 기대한 리워드가 배정된 경우에만 배정 정보를 비운다
     *
     * @return false 이면 배정이 없거나 다른 리워드가 배정된 응모
     */
    boolean clearAssignment(Long submissionId, Long expectedRewardAccountId);

    /**
     * 배정이 비어 있는 응모만 삭제
     *
     * @return false 이면 응모가 없거나 배정이 남아 있는 응모
     */
    boolean deleteIfUnassigned(Long submissionId);
}
