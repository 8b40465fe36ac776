package com.teambind.lottery.adapter.in.web;

import com.teambind.lottery.adapter.in.web.interceptor.RedeemRateLimitInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final RedeemRateLimitInterceptor redeemRateLimitInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(redeemRateLimitInterceptor)
                .addPathPatterns("/api/coupons/*/redeem");
    }
}
