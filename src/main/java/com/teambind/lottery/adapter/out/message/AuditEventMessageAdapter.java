package com.teambind.lottery.adapter.out.message;

import com.teambind.lottery.application.port.out.SendEventPort;
import com.teambind.lottery.domain.event.AuditRecordedEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * 감사 로그 이벤트 Kafka 발행 어댑터
 */
@Component
public class AuditEventMessageAdapter extends AbstractMessageAdapter implements SendEventPort {

    private final String auditTopic;

    public AuditEventMessageAdapter(KafkaTemplate<String, Object> kafkaTemplate,
                                    @Value("${lottery.audit.topic:lottery-audit-events}") String auditTopic) {
        super(kafkaTemplate);
        this.auditTopic = auditTopic;
    }

    @Override
    public void send(AuditRecordedEvent event) {
        sendMessage(auditTopic, event.getPartitionKey(), event);
    }
}
