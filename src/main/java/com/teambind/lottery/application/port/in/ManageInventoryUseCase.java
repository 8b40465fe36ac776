package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 관리자 재고 관리 유스케이스
 * 쿠폰 비활성화, 리워드 계정 만료, 응모 삭제
 */
public interface ManageInventoryUseCase {

    AdminActionResult deactivateCoupon(String code, Long adminId);

    AdminActionResult expireRewardAccount(Long rewardAccountId, Long adminId);

    /**
     * 배정된 리워드가 있으면 먼저 해제한 뒤 응모를 삭제한다 (쿠폰은 REDEEMED 로 유지)
     */
    AdminActionResult deleteSubmission(Long submissionId, Long adminId);

    @Getter
    @Builder
    @AllArgsConstructor
    class AdminActionResult {
        private final boolean success;
        private final Long targetId;
        private final FailureReason reason;
        private final ErrorKind errorKind;
        private final String message;

        public static AdminActionResult success(Long targetId) {
            return AdminActionResult.builder()
                    .success(true)
                    .targetId(targetId)
                    .build();
        }

        public static AdminActionResult failure(Long targetId, FailureReason reason) {
            return failure(targetId, reason, reason.getDefaultKind());
        }

        public static AdminActionResult failure(Long targetId, FailureReason reason, ErrorKind kind) {
            return AdminActionResult.builder()
                    .success(false)
                    .targetId(targetId)
                    .reason(reason)
                    .errorKind(kind)
                    .message(reason.getMessage())
                    .build();
        }
    }
}
