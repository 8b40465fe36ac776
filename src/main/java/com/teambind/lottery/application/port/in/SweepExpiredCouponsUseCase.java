package com.teambind.lottery.application.port.in;

import java.time.LocalDateTime;

/**
 * 만료 쿠폰 일괄 처리 유스케이스
 */
public interface SweepExpiredCouponsUseCase {

    /**
     * 만료 시각이 지난 ACTIVE 쿠폰을 EXPIRED 로 전이
     *
     * @param now 기준 시각
     * @return 이번 호출에서 전이된 건수 (같은 기준 시각으로 다시 호출하면 0)
     */
    int sweepExpired(LocalDateTime now);
}
