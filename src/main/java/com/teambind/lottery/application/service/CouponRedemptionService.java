package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.RedeemCouponCommand;
import com.teambind.lottery.application.port.in.RedeemCouponUseCase;
import com.teambind.lottery.application.port.out.LoadCouponPort;
import com.teambind.lottery.application.port.out.SaveSubmissionPort;
import com.teambind.lottery.application.port.out.UpdateCouponStatePort;
import com.teambind.lottery.application.port.out.UpdateCouponStatePort.RedeemMark;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import com.teambind.lottery.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 쿠폰 사용(응모) 서비스
 * 쿠폰 상태 전이와 응모 생성을 하나의 트랜잭션으로 묶는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CouponRedemptionService implements RedeemCouponUseCase {

    private final LoadCouponPort loadCouponPort;
    private final UpdateCouponStatePort updateCouponStatePort;
    private final SaveSubmissionPort saveSubmissionPort;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Override
    @Transactional
    public RedemptionResult redeem(RedeemCouponCommand command) {
        String code = command.getCode();
        log.info("쿠폰 사용 시작 - code: {}", code);

        // 1. 쿠폰 조회
        Optional<Coupon> found = loadCouponPort.loadByCode(code);
        if (found.isEmpty()) {
            log.info("쿠폰 사용 실패 - 존재하지 않는 코드: {}", code);
            return RedemptionResult.failure(code, FailureReason.COUPON_NOT_FOUND);
        }

        Coupon coupon = found.get();
        LocalDateTime now = LocalDateTime.now(clock);

        // 2. 상태 및 만료 확인
        if (!coupon.isActive()) {
            FailureReason reason = reasonForInactive(coupon.getStatus());
            log.info("쿠폰 사용 실패 - code: {}, status: {}", code, coupon.getStatus());
            return RedemptionResult.failure(code, reason);
        }

        if (coupon.isExpiredAt(now)) {
            expireOnRead(coupon, now);
            return RedemptionResult.failure(code, FailureReason.COUPON_EXPIRED);
        }

        // 3. 조건부 상태 전이 (ACTIVE → REDEEMED)
        RedeemMark mark = updateCouponStatePort.tryMarkRedeemed(
                coupon.getId(), command.getFields().getEmail(), now);

        if (mark != RedeemMark.MARKED) {
            log.debug("쿠폰 사용 경합 - code: {}, result: {}", code, mark);
            FailureReason reason = mark == RedeemMark.ALREADY_CONSUMED
                    ? FailureReason.ALREADY_REDEEMED
                    : FailureReason.COUPON_NOT_ACTIVE;
            return RedemptionResult.conflict(code, reason);
        }

        // 4. 응모 생성 (실패 시 쿠폰 전이까지 롤백)
        ClientMeta clientMeta = command.getClientMeta() != null ? command.getClientMeta() : ClientMeta.empty();
        Submission submission;
        try {
            submission = saveSubmissionPort.create(coupon.getId(), command.getFields(), clientMeta, now);
        } catch (RuntimeException e) {
            log.error("쿠폰 사용 정합성 오류 - 쿠폰은 REDEEMED 로 전이되었으나 응모 생성 실패 - couponId: {}, code: {}, error: {}",
                    coupon.getId(), code, e.getMessage(), e);
            throw new InconsistentStateException("redeem", coupon.getId(),
                    "쿠폰 상태 전이 후 응모 생성에 실패했습니다 - couponId: " + coupon.getId(), e);
        }

        // 5. 감사 로그
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("status", CouponStatus.REDEEMED.name());
        after.put("submissionId", submission.getId());
        after.put("redeemedBy", command.getFields().getEmail());
        auditLogService.record(AuditEntry.ANONYMOUS_ACTOR, AuditAction.COUPON_REDEEMED, AuditTargetType.COUPON, coupon.getId(),
                Map.of("status", CouponStatus.ACTIVE.name()), after);

        log.info("쿠폰 사용 완료 - code: {}, submissionId: {}", code, submission.getId());
        return RedemptionResult.success(code, submission);
    }

    private FailureReason reasonForInactive(CouponStatus status) {
        return switch (status) {
            case REDEEMED -> FailureReason.ALREADY_REDEEMED;
            case EXPIRED -> FailureReason.COUPON_EXPIRED;
            default -> FailureReason.COUPON_NOT_ACTIVE;
        };
    }

    /**
     * 아직 배치로 만료 처리되지 않은 쿠폰을 조회 시점에 만료시킨다
     */
    private void expireOnRead(Coupon coupon, LocalDateTime now) {
        boolean expired = updateCouponStatePort.tryMarkExpired(coupon.getId(), now);
        log.info("만료된 쿠폰 사용 시도 - code: {}, expiresAt: {}, transitioned: {}",
                coupon.getCode(), coupon.getExpiresAt(), expired);

        if (expired) {
            auditLogService.record(AuditEntry.SYSTEM_ACTOR, AuditAction.COUPON_EXPIRED, AuditTargetType.COUPON,
                    coupon.getId(),
                    Map.of("status", CouponStatus.ACTIVE.name()),
                    Map.of("status", CouponStatus.EXPIRED.name()));
        }
    }
}
