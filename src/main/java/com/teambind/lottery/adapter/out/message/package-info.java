/**
 * Kafka 메시지 발행 어댑터
 */
package com.teambind.lottery.adapter.out.message;
