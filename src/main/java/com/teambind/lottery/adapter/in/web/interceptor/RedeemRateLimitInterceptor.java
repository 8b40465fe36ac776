package com.teambind.lottery.adapter.in.web.interceptor;

import com.teambind.lottery.adapter.in.web.ClientIpResolver;
import com.teambind.lottery.adapter.out.redis.RateLimiterService;
import com.teambind.lottery.common.exceptions.CustomException;
import com.teambind.lottery.common.exceptions.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 쿠폰 사용 요청 속도 제한 인터셉터
 * 코드 무작위 대입을 막기 위해 클라이언트 IP 별로 제한한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedeemRateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiterService rateLimiterService;

    @Value("${lottery.rate-limit.enabled:true}")
    private boolean rateLimitEnabled;

    @Value("${lottery.rate-limit.redeem-per-minute:10}")
    private int limitPerMinute;

    @Value("${lottery.rate-limit.redeem-per-hour:50}")
    private int limitPerHour;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!rateLimitEnabled || !"POST".equalsIgnoreCase(request.getMethod())) {
            return true;
        }

        String clientIp = ClientIpResolver.resolve(request);
        boolean allowed = rateLimiterService.allowRequestMultiLevel(
                "redeem:ip:" + clientIp, limitPerMinute, limitPerHour);

        if (!allowed) {
            log.warn("쿠폰 사용 요청 속도 제한 초과 - ip: {}, uri: {}", clientIp, request.getRequestURI());
            response.addHeader("Retry-After", "60");
            throw new CustomException(ErrorCode.RATE_LIMIT_EXCEEDED,
                    "요청 속도 제한을 초과했습니다. 잠시 후 다시 시도해주세요.");
        }
        return true;
    }
}
