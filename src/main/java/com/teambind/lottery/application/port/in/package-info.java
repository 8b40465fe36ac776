/**
 * 인바운드 포트 (유스케이스)
 * 실패는 예외가 아닌 결과 객체로 반환하며, 정합성 위반만 예외로 전파한다
 */
package com.teambind.lottery.application.port.in;
