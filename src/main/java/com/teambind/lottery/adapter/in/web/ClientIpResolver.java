package com.teambind.lottery.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 프록시 헤더를 고려한 클라이언트 IP 추출
 */
public final class ClientIpResolver {

    private static final String[] IP_HEADERS = {
            "X-Forwarded-For",
            "X-Real-IP",
            "Proxy-Client-IP",
            "WL-Proxy-Client-IP"
    };

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        for (String header : IP_HEADERS) {
            String ip = request.getHeader(header);
            if (ip != null && !ip.isBlank() && !"unknown".equalsIgnoreCase(ip)) {
                // 콤마로 구분된 경우 첫 번째가 원 클라이언트
                return ip.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }
}
