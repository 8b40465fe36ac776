package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.QueryAuditLogUseCase;
import com.teambind.lottery.application.port.out.AppendAuditLogPort;
import com.teambind.lottery.domain.event.AuditRecordedEvent;
import com.teambind.lottery.domain.model.AuditAction;
import com.teambind.lottery.domain.model.AuditEntry;
import com.teambind.lottery.domain.model.AuditTargetType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 감사 로그 서비스
 * 호출한 쪽의 트랜잭션 안에서 기록되며, 외부 발행은 커밋 이후에 이루어진다
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuditLogService implements QueryAuditLogUseCase {

    private final AppendAuditLogPort appendAuditLogPort;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public AuditEntry record(Long actorId, AuditAction action, AuditTargetType targetType, Long targetId,
                             Map<String, Object> before, Map<String, Object> after) {
        AuditEntry entry = AuditEntry.builder()
                .actorId(actorId)
                .action(action)
                .targetType(targetType)
                .targetId(targetId)
                .before(before)
                .after(after)
                .createdAt(LocalDateTime.now(clock))
                .build();

        AuditEntry saved = appendAuditLogPort.append(entry);
        log.debug("감사 로그 기록 - action: {}, target: {}:{}, actor: {}", action, targetType, targetId, actorId);

        eventPublisher.publishEvent(AuditRecordedEvent.from(saved));
        return saved;
    }

    @Override
    public List<AuditEntry> findByTarget(AuditTargetType targetType, Long targetId) {
        return appendAuditLogPort.loadByTarget(targetType, targetId);
    }
}
