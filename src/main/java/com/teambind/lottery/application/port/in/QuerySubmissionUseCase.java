package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.Submission;
import com.teambind.lottery.domain.model.SubmissionSearchCondition;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

/**
 * 응모 내역 조회 유스케이스
 */
public interface QuerySubmissionUseCase {

    Optional<Submission> findById(Long submissionId);

    List<Submission> findWithoutAssignment();

    Optional<Submission> findByAssignedReward(Long rewardAccountId);

    Page<Submission> search(SubmissionSearchCondition condition, Pageable pageable);

    List<Submission> findRecent(int limit);
}
