package com.codeclass.backend.execution.service;

/**
 * Run 조회/취소 권한 판단. 인증과 attempt 소유 관계는 외부 시스템이 가지고 있다.
 */
public interface AttemptAccessPolicy {

  /**
   * @param attemptId Run이 속한 attempt
   * @param principal 요청자 식별자. 익명이면 null
   */
  boolean canAccess(Long attemptId, String principal);
}
