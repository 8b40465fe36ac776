/**
 * 애플리케이션 서비스
 * 쿠폰 사용, 리워드 배정/해제/일괄 배정, 만료 처리, 관리자 작업과 조회
 */
package com.teambind.lottery.application.service;
