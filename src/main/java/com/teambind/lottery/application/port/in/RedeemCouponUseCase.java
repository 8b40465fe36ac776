package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import com.teambind.lottery.domain.model.Submission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 쿠폰 사용(응모) 유스케이스
 * 쿠폰 하나로는 동시 요청이 몇 개든 응모가 최대 하나만 생성된다
 */
public interface RedeemCouponUseCase {

    RedemptionResult redeem(RedeemCouponCommand command);

    /**
     * 쿠폰 사용 결과
     */
    @Getter
    @Builder
    @AllArgsConstructor
    class RedemptionResult {
        private final boolean success;
        private final String code;
        private final Submission submission;
        private final FailureReason reason;
        private final ErrorKind errorKind;
        private final String message;

        public static RedemptionResult success(String code, Submission submission) {
            return RedemptionResult.builder()
                    .success(true)
                    .code(code)
                    .submission(submission)
                    .message("쿠폰이 사용되었습니다")
                    .build();
        }

        public static RedemptionResult failure(String code, FailureReason reason) {
            return failure(code, reason, reason.getDefaultKind());
        }

        public static RedemptionResult conflict(String code, FailureReason reason) {
            return failure(code, reason, ErrorKind.CONFLICT);
        }

        private static RedemptionResult failure(String code, FailureReason reason, ErrorKind kind) {
            return RedemptionResult.builder()
                    .success(false)
                    .code(code)
                    .reason(reason)
                    .errorKind(kind)
                    .message(reason.getMessage())
                    .build();
        }
    }
}
