package com.teambind.lottery.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 스케줄러 설정 (만료 쿠폰 주기 처리)
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "lottery.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
