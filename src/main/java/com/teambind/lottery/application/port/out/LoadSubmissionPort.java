package com.teambind.lottery.application.port.out;

import com.teambind.lottery.domain.model.Submission;
import com.teambind.lottery.domain.model.SubmissionSearchCondition;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

/**
 * 응모 내역 조회 포트
 */
public interface LoadSubmissionPort {

    Optional<Submission> loadSubmission(Long submissionId);

    /**
     * 영속성 컨텍스트를 거치지 않고 현재 배정 상태를 다시 읽는다
     *
     * @return 응모가 삭제되었으면 empty
     */
    Optional<AssignmentSnapshot> loadAssignmentSnapshot(Long submissionId);

    List<Submission> loadWithoutAssignment();

    Optional<Submission> loadByAssignedReward(Long rewardAccountId);

    Page<Submission> search(SubmissionSearchCondition condition, Pageable pageable);

    List<Submission> loadRecent(int limit);

    long countAll();

    long countWithAssignment();

    record AssignmentSnapshot(Long submissionId, Long assignedRewardId) {
        public boolean isAssigned() {
            return assignedRewardId != null;
        }
    }
}
