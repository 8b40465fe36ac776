package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.out.SendEventPort;
import com.teambind.lottery.domain.event.AuditRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 감사 로그 이벤트 중계
 * 커밋된 감사 로그만 외부로 발행하며, 롤백된 작업의 감사 로그는 발행되지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditEventRelay {

    private final SendEventPort sendEventPort;

    @Value("${lottery.audit.publish-enabled:true}")
    private boolean publishEnabled;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleAuditRecorded(AuditRecordedEvent event) {
        if (!publishEnabled) {
            return;
        }
        try {
            sendEventPort.send(event);
        } catch (RuntimeException e) {
            // 감사 로그는 이미 DB 에 커밋되어 있으므로 발행 실패는 기록만 한다
            log.error("감사 로그 이벤트 발행 실패 - auditId: {}, action: {}, error: {}",
                    event.getAuditId(), event.getAction(), e.getMessage(), e);
        }
    }
}
