package com.teambind.lottery.common.util;

import java.time.Clock;

/**
 * 분산 환경에서 유니크한 ID를 생성하는 Snowflake ID Generator
 * 감사 로그처럼 여러 인스턴스가 동시에 추가하는 레코드의 ID 로 사용
 *
 * ID 구조 (64 bits):
 * - 1 bit: 부호 (항상 0)
 * - 41 bits: 타임스탬프 (밀리초 단위)
 * - 10 bits: 머신 ID (데이터센터 ID 5 bits + 워커 ID 5 bits)
 * - 12 bits: 시퀀스 (같은 밀리초 내에서 증가)
 */
public class SnowflakeIdGenerator {

    private static final long EPOCH = 1704067200000L; // 2024-01-01 00:00:00 UTC
    private static final long WORKER_ID_BITS = 5L;
    private static final long DATACENTER_ID_BITS = 5L;
    private static final long SEQUENCE_BITS = 12L;

    private static final long MAX_WORKER_ID = ~(-1L << WORKER_ID_BITS);
    private static final long MAX_DATACENTER_ID = ~(-1L << DATACENTER_ID_BITS);
    private static final long SEQUENCE_MASK = ~(-1L << SEQUENCE_BITS);

    private static final long WORKER_ID_SHIFT = SEQUENCE_BITS;
    private static final long DATACENTER_ID_SHIFT = SEQUENCE_BITS + WORKER_ID_BITS;
    private static final long TIMESTAMP_SHIFT = SEQUENCE_BITS + WORKER_ID_BITS + DATACENTER_ID_BITS;

    private final long workerId;
    private final long datacenterId;
    private final Clock clock;

    private long sequence = 0L;
    private long lastTimestamp = -1L;

    public SnowflakeIdGenerator(long workerId, long datacenterId) {
        this(workerId, datacenterId, Clock.systemUTC());
    }

    public SnowflakeIdGenerator(long workerId, long datacenterId, Clock clock) {
        if (workerId > MAX_WORKER_ID || workerId < 0) {
            throw new IllegalArgumentException("Worker ID must be between 0 and " + MAX_WORKER_ID);
        }
        if (datacenterId > MAX_DATACENTER_ID || datacenterId < 0) {
            throw new IllegalArgumentException("Datacenter ID must be between 0 and " + MAX_DATACENTER_ID);
        }
        this.workerId = workerId;
        this.datacenterId = datacenterId;
        this.clock = clock;
    }

    public synchronized long nextId() {
        long now = clock.millis();

        if (now < lastTimestamp) {
            throw new IllegalStateException(
                    "시스템 시계가 뒤로 이동했습니다 - last: " + lastTimestamp + ", now: " + now);
        }

        if (now == lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                // 같은 밀리초의 시퀀스를 모두 사용하면 다음 밀리초까지 대기
                while (now <= lastTimestamp) {
                    now = clock.millis();
                }
            }
        } else {
            sequence = 0L;
        }

        lastTimestamp = now;

        return ((now - EPOCH) << TIMESTAMP_SHIFT)
                | (datacenterId << DATACENTER_ID_SHIFT)
                | (workerId << WORKER_ID_SHIFT)
                | sequence;
    }

    /**
     * ID 에 포함된 생성 시각 (epoch millis)
     */
    public static long extractTimestamp(long id) {
        return (id >>> TIMESTAMP_SHIFT) + EPOCH;
    }
}
