/**
 * JPA 영속성 어댑터
 * 상태 전이는 조건부 업데이트의 영향받은 행 수로 판단한다
 */
package com.teambind.lottery.adapter.out.persistence;
