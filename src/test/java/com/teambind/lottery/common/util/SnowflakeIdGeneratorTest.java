package com.teambind.lottery.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnowflakeIdGenerator 테스트")
class SnowflakeIdGeneratorTest {

    @Test
    @DisplayName("연속 생성한 ID 는 증가한다")
    void monotonic() {
        SnowflakeIdGenerator generator = new SnowflakeIdGenerator(1, 1);

        long previous = generator.nextId();
        for (int i = 0; i < 10_000; i++) {
            long next = generator.nextId();
            assertThat(next).isGreaterThan(previous);
            previous = next;
        }
    }

    @Test
    @DisplayName("여러 스레드에서 생성해도 중복이 없다")
    void uniqueAcrossThreads() throws Exception {
        SnowflakeIdGenerator generator = new SnowflakeIdGenerator(2, 1);
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(8);

        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    ids.add(generator.nextId());
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(16_000);
    }

    @Test
    @DisplayName("ID 에서 생성 시각을 복원할 수 있다")
    void extractTimestamp() {
        Instant instant = Instant.parse("2024-06-01T12:00:00Z");
        SnowflakeIdGenerator generator = new SnowflakeIdGenerator(3, 0, Clock.fixed(instant, ZoneOffset.UTC));

        long id = generator.nextId();

        assertThat(SnowflakeIdGenerator.extractTimestamp(id)).isEqualTo(instant.toEpochMilli());
    }

    @Test
    @DisplayName("같은 밀리초 안에서는 시퀀스로 구분된다")
    void sequenceWithinSameMillis() {
        SnowflakeIdGenerator generator = new SnowflakeIdGenerator(
                0, 0, Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));

        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(generator.nextId());
        }

        assertThat(ids).hasSize(100);
    }

    @Test
    @DisplayName("범위를 벗어난 워커 ID 는 거부한다")
    void invalidWorkerId() {
        assertThatThrownBy(() -> new SnowflakeIdGenerator(32, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
