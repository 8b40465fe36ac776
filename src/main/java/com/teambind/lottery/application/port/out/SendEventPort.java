package com.teambind.lottery.application.port.out;

import com.teambind.lottery.domain.event.AuditRecordedEvent;

/**
 * 외부 이벤트 발행 포트
 */
public interface SendEventPort {

    void send(AuditRecordedEvent event);
}
