/**
 * REST 인바운드 어댑터
 * 유스케이스 결과의 실패 분류를 HTTP 상태 코드로 변환한다
 */
package com.teambind.lottery.adapter.in.web;
