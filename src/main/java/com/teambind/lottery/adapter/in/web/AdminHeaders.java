package com.teambind.lottery.adapter.in.web;

/**
 * 인증 계층이 검증 후 전달하는 관리자 식별 헤더
 */
public final class AdminHeaders {

    public static final String ADMIN_ID = "X-Admin-Id";

    private AdminHeaders() {
    }
}
