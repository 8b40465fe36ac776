package com.teambind.lottery.application.port.out;

import java.time.LocalDateTime;

/**
 * 리워드 재고 점유/해제 포트
 * 읽은 뒤 쓰는 방식이 아닌 단일 조건부 업데이트로 구현해야 한다
 */
public interface RewardInventoryPort {

    /**
     * AVAILABLE 인 경우에만 ASSIGNED 로 바꾸고 보유자를 지정
     */
    Reservation tryReserve(Long rewardAccountId, Long holderSubmissionId, LocalDateTime reservedAt);

    /**
     * 현재 보유자가 기대한 응모인 경우에만 AVAILABLE 로 되돌린다
     */
    Release release(Long rewardAccountId, Long expectedHolderSubmissionId);

    /**
     * AVAILABLE → EXPIRED
     */
    boolean tryExpire(Long rewardAccountId);

    enum Reservation {
        RESERVED,
        NOT_AVAILABLE
    }

    enum Release {
        RELEASED,
        NOT_HELD_BY_EXPECTED_HOLDER
    }
}
