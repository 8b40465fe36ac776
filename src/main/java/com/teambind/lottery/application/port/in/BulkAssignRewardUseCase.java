package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 리워드 일괄 배정 유스케이스
 * 한 항목의 실패가 앞서 성공한 항목을 되돌리거나 나머지 처리를 중단시키지 않는다
 */
public interface BulkAssignRewardUseCase {

    BulkAssignResult assignBulk(BulkAssignRewardCommand command);

    /**
     * 일괄 배정 결과 (항목 순서는 입력 순서와 동일)
     */
    @Getter
    @Builder
    @AllArgsConstructor
    class BulkAssignResult {
        private final int totalRequested;
        private final int successCount;
        private final int failureCount;
        private final List<ItemResult> items;

        public static BulkAssignResult of(List<ItemResult> items) {
            int success = (int) items.stream().filter(ItemResult::isSuccess).count();
            return BulkAssignResult.builder()
                    .totalRequested(items.size())
                    .successCount(success)
                    .failureCount(items.size() - success)
                    .items(List.copyOf(items))
                    .build();
        }

        public boolean isCompleteSuccess() {
            return totalRequested == successCount;
        }

        public boolean hasFailures() {
            return failureCount > 0;
        }
    }

    @Getter
    @Builder
    @AllArgsConstructor
    class ItemResult {
        private final Long submissionId;
        private final Long rewardAccountId;
        private final boolean success;
        private final FailureReason error;
        private final ErrorKind errorKind;
        private final String message;

        public static ItemResult from(AssignRewardUseCase.AssignmentResult result,
                                      Long submissionId, Long rewardAccountId) {
            return ItemResult.builder()
                    .submissionId(submissionId)
                    .rewardAccountId(rewardAccountId)
                    .success(result.isSuccess())
                    .error(result.getReason())
                    .errorKind(result.getErrorKind())
                    .message(result.getMessage())
                    .build();
        }

        public static ItemResult inconsistent(Long submissionId, Long rewardAccountId, String message) {
            return ItemResult.builder()
                    .submissionId(submissionId)
                    .rewardAccountId(rewardAccountId)
                    .success(false)
                    .error(FailureReason.INCONSISTENT_STATE)
                    .errorKind(ErrorKind.INCONSISTENT)
                    .message(message)
                    .build();
        }
    }
}
