package com.teambind.lottery.domain.model;

import lombok.Value;

/**
 * 요청 클라이언트 정보
 */
@Value(staticConstructor = "of")
public class ClientMeta {
    String ipAddress;
    String userAgent;

    public static ClientMeta empty() {
        return of(null, null);
    }
}
