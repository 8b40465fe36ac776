/**
 * 도메인 모델
 * 쿠폰, 응모, 리워드 계정, 감사 로그와 실패 사유 분류
 */
package com.teambind.lottery.domain.model;
