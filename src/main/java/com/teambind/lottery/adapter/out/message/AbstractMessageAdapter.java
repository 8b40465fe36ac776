package com.teambind.lottery.adapter.out.message;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka 메시지 전송 추상 어댑터
 */
@Slf4j
public abstract class AbstractMessageAdapter {

    protected final KafkaTemplate<String, Object> kafkaTemplate;

    protected AbstractMessageAdapter(KafkaTemplate<String, Object> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * 비동기 전송. 결과는 로그로만 남긴다
     *
     * @param topic   토픽
     * @param key     메시지 키 (같은 대상의 이벤트는 같은 파티션으로)
     * @param payload 메시지 페이로드
     */
    protected CompletableFuture<SendResult<String, Object>> sendMessage(String topic, String key, Object payload) {
        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, payload);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("메시지 전송 성공 - topic: {}, key: {}, offset: {}",
                        topic, key, result.getRecordMetadata().offset());
            } else {
                log.error("메시지 전송 실패 - topic: {}, key: {}, error: {}",
                        topic, key, ex.getMessage(), ex);
            }
        });
        return future;
    }
}
