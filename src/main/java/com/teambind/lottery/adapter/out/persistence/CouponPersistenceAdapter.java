package com.teambind.lottery.adapter.out.persistence;

import com.teambind.lottery.adapter.out.persistence.mapper.CouponMapper;
import com.teambind.lottery.adapter.out.persistence.repository.CouponRepository;
import com.teambind.lottery.application.port.out.LoadCouponPort;
import com.teambind.lottery.application.port.out.UpdateCouponStatePort;
import com.teambind.lottery.domain.model.Coupon;
import com.teambind.lottery.domain.model.CouponStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 쿠폰 영속성 어댑터
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CouponPersistenceAdapter implements LoadCouponPort, UpdateCouponStatePort {

    private final CouponRepository couponRepository;
    private final CouponMapper couponMapper;
    private final Clock clock;

    @Override
    public Optional<Coupon> loadByCode(String code) {
        return couponRepository.findByCode(code)
                .map(couponMapper::toDomain);
    }

    @Override
    public Optional<CouponStatus> loadCurrentStatus(Long couponId) {
        return couponRepository.findStatusById(couponId);
    }

    @Override
    public Map<CouponStatus, Long> countByStatus() {
        Map<CouponStatus, Long> counts = new EnumMap<>(CouponStatus.class);
        for (CouponStatus status : CouponStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : couponRepository.countGroupByStatus()) {
            counts.put((CouponStatus) row[0], (Long) row[1]);
        }
        return counts;
    }

    @Override
    public RedeemMark tryMarkRedeemed(Long couponId, String redeemedBy, LocalDateTime redeemedAt) {
        int updated = couponRepository.redeemIfStatus(
                couponId, CouponStatus.ACTIVE, CouponStatus.REDEEMED, redeemedBy, redeemedAt);

        if (updated == 1) {
            return RedeemMark.MARKED;
        }

        // 0건: ACTIVE 가 아니었음. 이미 사용된 것인지 다른 종료 상태인지 구분
        CouponStatus current = loadCurrentStatus(couponId).orElse(null);
        log.debug("쿠폰 사용 조건부 업데이트 미적용 - couponId: {}, currentStatus: {}", couponId, current);
        return current == CouponStatus.REDEEMED ? RedeemMark.ALREADY_CONSUMED : RedeemMark.NOT_ACTIVE;
    }

    @Override
    public boolean tryMarkExpired(Long couponId, LocalDateTime asOf) {
        return couponRepository.expireIfDue(couponId, CouponStatus.ACTIVE, CouponStatus.EXPIRED, asOf) == 1;
    }

    @Override
    public int markExpiredBatch(LocalDateTime asOf) {
        return couponRepository.expireAllDue(CouponStatus.ACTIVE, CouponStatus.EXPIRED, asOf);
    }

    @Override
    public boolean tryDeactivate(Long couponId) {
        return couponRepository.transitionIfStatus(
                couponId, CouponStatus.ACTIVE, CouponStatus.DEACTIVATED, LocalDateTime.now(clock)) == 1;
    }
}
