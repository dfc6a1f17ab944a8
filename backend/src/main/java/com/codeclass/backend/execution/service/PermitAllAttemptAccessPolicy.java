package com.codeclass.backend.execution.service;

import org.springframework.stereotype.Component;

// 인증 연동 전 기본값
@Component
public class PermitAllAttemptAccessPolicy implements AttemptAccessPolicy {

  @Override
  public boolean canAccess(Long attemptId, String principal) {
    return true;
  }
}
