package com.teambind.lottery.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Redis 기반 Rate Limiter
 * Sliding Window 방식, 여러 인스턴스가 같은 카운터를 공유한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterService {

    private static final String KEY_PREFIX = "lottery:rate_limit:";

    // ZSET 에 요청 시각을 쌓고 윈도우 밖의 항목을 제거한 뒤 개수로 판단
    private static final String SLIDING_WINDOW_SCRIPT = """
            local key = KEYS[1]
            local limit = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])
            local now = tonumber(ARGV[3])
            local member = ARGV[4]

            redis.call('ZREMRANGEBYSCORE', key, 0, now - window * 1000)

            local current = redis.call('ZCARD', key)
            if current < limit then
                redis.call('ZADD', key, now, member)
                redis.call('EXPIRE', key, window)
                return {1, current + 1}
            end
            return {0, current}
            """;

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> SCRIPT = new DefaultRedisScript<>(SLIDING_WINDOW_SCRIPT, List.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final Clock clock;

    /**
     * 요청 허용 여부 확인
     *
     * @param key           제한 키 (예: "redeem:ip:10.0.0.1")
     * @param limit         윈도우 내 허용 횟수
     * @param windowSeconds 윈도우 크기 (초)
     */
    @SuppressWarnings("unchecked")
    public boolean allowRequest(String key, int limit, int windowSeconds) {
        String redisKey = KEY_PREFIX + key;
        long now = clock.millis();

        try {
            List<Long> result = redisTemplate.execute(
                    SCRIPT,
                    List.of(redisKey),
                    String.valueOf(limit),
                    String.valueOf(windowSeconds),
                    String.valueOf(now),
                    now + ":" + System.nanoTime()
            );

            if (result == null || result.isEmpty()) {
                return true;
            }

            boolean allowed = result.get(0) == 1L;
            if (!allowed) {
                log.info("Rate limit 초과 - key: {}, current: {}/{}", key, result.get(1), limit);
            }
            return allowed;
        } catch (RuntimeException e) {
            // Redis 장애 시 요청 허용 (fail open)
            log.error("Rate limiter 오류, 요청을 허용합니다 - key: {}, error: {}", key, e.getMessage(), e);
            return true;
        }
    }

    /**
     * 분당/시간당 제한을 모두 확인 (0 이하면 해당 단계 생략)
     */
    public boolean allowRequestMultiLevel(String key, int perMinute, int perHour) {
        if (perMinute > 0 && !allowRequest(key + ":minute", perMinute, 60)) {
            return false;
        }
        return perHour <= 0 || allowRequest(key + ":hour", perHour, 3600);
    }
}
