/**
 * Redis 어댑터
 * 쿠폰 사용 요청 속도 제한
 */
package com.teambind.lottery.adapter.out.redis;
