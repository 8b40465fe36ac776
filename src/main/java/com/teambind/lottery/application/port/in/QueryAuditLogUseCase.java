package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.AuditEntry;
import com.teambind.lottery.domain.model.AuditTargetType;

import java.util.List;

public interface QueryAuditLogUseCase {

    List<AuditEntry> findByTarget(AuditTargetType targetType, Long targetId);
}
