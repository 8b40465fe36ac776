package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.SweepExpiredCouponsUseCase;
import com.teambind.lottery.application.port.out.UpdateCouponStatePort;
import com.teambind.lottery.domain.model.AuditAction;
import com.teambind.lottery.domain.model.AuditEntry;
import com.teambind.lottery.domain.model.AuditTargetType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 쿠폰 만료 처리 서비스
 * 만료 시각이 지난 ACTIVE 쿠폰을 EXPIRED 로 일괄 전이 (리워드 재고와는 무관)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CouponExpiryService implements SweepExpiredCouponsUseCase {

    private final UpdateCouponStatePort updateCouponStatePort;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Value("${lottery.expiry-sweep.enabled:true}")
    private boolean sweepEnabled;

    @Override
    @Transactional
    public int sweepExpired(LocalDateTime now) {
        log.info("만료 쿠폰 처리 시작 - asOf: {}", now);

        int expiredCount = updateCouponStatePort.markExpiredBatch(now);

        if (expiredCount == 0) {
            log.debug("만료 처리할 쿠폰이 없습니다");
            return 0;
        }

        auditLogService.record(AuditEntry.SYSTEM_ACTOR, AuditAction.COUPON_EXPIRY_SWEEP, AuditTargetType.COUPON,
                null, Map.of("asOf", now.toString()), Map.of("expiredCount", expiredCount));

        log.info("만료 쿠폰 처리 완료 - expired: {}", expiredCount);
        return expiredCount;
    }

    /**
     * 주기 실행
     */
    @Scheduled(cron = "${lottery.expiry-sweep.cron:0 */5 * * * *}")
    @Transactional
    public void sweepOnSchedule() {
        if (!sweepEnabled) {
            return;
        }
        sweepExpired(LocalDateTime.now(clock));
    }
}
