package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import com.teambind.lottery.domain.model.Submission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 리워드 배정/해제 유스케이스
 * 재배정은 암묵적으로 일어나지 않으며 반드시 해제 후 다시 배정해야 한다
 */
public interface AssignRewardUseCase {

    AssignmentResult assign(AssignRewardCommand command);

    AssignmentResult remove(Long submissionId, Long removedBy);

    /**
     * 배정/해제 결과
     */
    @Getter
    @Builder
    @AllArgsConstructor
    class AssignmentResult {
        private final boolean success;
        private final Long submissionId;
        private final Long rewardAccountId;
        private final Submission submission;
        private final FailureReason reason;
        private final ErrorKind errorKind;
        private final String message;

        public static AssignmentResult success(Submission submission, Long rewardAccountId) {
            return AssignmentResult.builder()
                    .success(true)
                    .submissionId(submission.getId())
                    .rewardAccountId(rewardAccountId)
                    .submission(submission)
                    .build();
        }

        public static AssignmentResult failure(Long submissionId, Long rewardAccountId, FailureReason reason) {
            return failure(submissionId, rewardAccountId, reason, reason.getDefaultKind());
        }

        public static AssignmentResult conflict(Long submissionId, Long rewardAccountId, FailureReason reason) {
            return failure(submissionId, rewardAccountId, reason, ErrorKind.CONFLICT);
        }

        public static AssignmentResult failure(Long submissionId, Long rewardAccountId,
                                               FailureReason reason, ErrorKind kind) {
            return AssignmentResult.builder()
                    .success(false)
                    .submissionId(submissionId)
                    .rewardAccountId(rewardAccountId)
                    .reason(reason)
                    .errorKind(kind)
                    .message(reason.getMessage())
                    .build();
        }
    }
}
