package com.teambind.lottery.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 감사 로그 항목
 * 추가만 가능하며 수정/삭제하지 않는다
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class AuditEntry {

    /** 시스템(스케줄러 등)이 수행한 작업의 actor id */
    public static final long SYSTEM_ACTOR = 0L;

    /** 로그인하지 않은 최종 사용자(쿠폰 사용자)의 actor id, 사용자 식별 정보는 after 스냅샷에 남긴다 */
    public static final long ANONYMOUS_ACTOR = -1L;

    private final Long id;
    private final Long actorId;
    private final AuditAction action;
    private final AuditTargetType targetType;
    private final Long targetId;
    private final Map<String, Object> before;
    private final Map<String, Object> after;
    private final LocalDateTime createdAt;
}
