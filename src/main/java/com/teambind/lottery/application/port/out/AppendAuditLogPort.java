package com.teambind.lottery.application.port.out;

import com.teambind.lottery.domain.model.AuditEntry;
import com.teambind.lottery.domain.model.AuditTargetType;

import java.util.List;

/**
 * 감사 로그 저장 포트 (추가 전용)
 */
public interface AppendAuditLogPort {

    AuditEntry append(AuditEntry entry);

    List<AuditEntry> loadByTarget(AuditTargetType targetType, Long targetId);
}
