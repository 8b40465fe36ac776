package com.teambind.lottery.application.port.out;

import com.teambind.lottery.domain.model.Coupon;
import com.teambind.lottery.domain.model.CouponStatus;

import java.util.Map;
import java.util.Optional;

/**
 * 쿠폰 조회 포트
 */
public interface LoadCouponPort {

    Optional<Coupon> loadByCode(String code);

    /**
     * 영속성 컨텍스트를 거치지 않고 현재 저장된 상태를 다시 읽는다
     */
    Optional<CouponStatus> loadCurrentStatus(Long couponId);

    Map<CouponStatus, Long> countByStatus();
}
