/**
 * 아웃바운드 포트
 * 쿠폰/리워드/응모 저장소와 감사 로그, 이벤트 발행
 */
package com.teambind.lottery.application.port.out;
