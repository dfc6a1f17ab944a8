package com.codeclass.backend.execution.websocket;

import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.repository.RunRepository;
import com.codeclass.backend.execution.service.AttemptAccessPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run 상태 변화를 구독 중인 클라이언트에 밀어준다.
 *
 * <p>폴링을 대신하지 않는다. 다른 노드의 워커가 처리한 Run 이벤트는 이 노드로 오지 않는다.
 */
@Slf4j
@Component
public class RunStatusWebSocketHandler extends TextWebSocketHandler {
  static final String RUN_ID_ATTRIBUTE = "runId";
  static final String PRINCIPAL_ATTRIBUTE = "principal";

  private final Map<Long, Set<WebSocketSession>> sessions = new ConcurrentHashMap<>();
  private final RunRepository runRepository;
  private final ObjectMapper objectMapper;
  private final AttemptAccessPolicy accessPolicy;

  public RunStatusWebSocketHandler(RunRepository runRepository, ObjectMapper objectMapper,
                                   AttemptAccessPolicy accessPolicy) {
    this.runRepository = runRepository;
    this.objectMapper = objectMapper;
    this.accessPolicy = accessPolicy;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    Long runId = runIdOf(session);
    if (runId == null) {
      return;
    }
    Optional<Run> run = runRepository.findById(runId);
    if (run.isEmpty()) {
      close(session, CloseStatus.NOT_ACCEPTABLE.withReason("Run not found"));
      return;
    }
    Object principal = session.getAttributes().get(PRINCIPAL_ATTRIBUTE);
    if (!accessPolicy.canAccess(run.get().getAttemptId(), principal == null ? null : principal.toString())) {
      log.warn("Denied status subscription to run {} for {}", runId, principal);
      close(session, CloseStatus.POLICY_VIOLATION.withReason("Unauthorized"));
      return;
    }
    sessions.computeIfAbsent(runId, id -> ConcurrentHashMap.newKeySet()).add(session);
    // 연결 직후 현재 상태를 한 번 보낸다
    send(session, run.get().getStatus());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    Long runId = runIdOf(session);
    if (runId == null) {
      return;
    }
    sessions.computeIfPresent(runId, (id, set) -> {
      set.remove(session);
      return set.isEmpty() ? null : set;
    });
  }

  /**
   * 상태 변화를 알린다. 종료 상태면 세션도 닫는다.
   */
  public void publish(Long runId, RunStatus status) {
    Set<WebSocketSession> subscribers = status.isTerminal() ? sessions.remove(runId) : sessions.get(runId);
    if (subscribers == null) {
      return;
    }
    for (WebSocketSession session : subscribers) {
      send(session, status);
      if (status.isTerminal()) {
        close(session, CloseStatus.NORMAL);
      }
    }
  }

  private void send(WebSocketSession session, RunStatus status) {
    if (!session.isOpen()) {
      return;
    }
    try {
      Map<String, String> message = new LinkedHashMap<>();
      message.put("type", "status");
      message.put("data", status.getValue());
      String payload = objectMapper.writeValueAsString(message);
      synchronized (session) {
        session.sendMessage(new TextMessage(payload));
      }
    } catch (JsonProcessingException e) {
      log.warn("Failed to encode status message: {}", e.getMessage());
    } catch (IOException e) {
      log.debug("Failed to push status to session {}: {}", session.getId(), e.getMessage());
    }
  }

  private void close(WebSocketSession session, CloseStatus closeStatus) {
    try {
      session.close(closeStatus);
    } catch (IOException e) {
      log.debug("Failed to close session {}: {}", session.getId(), e.getMessage());
    }
  }

  private static Long runIdOf(WebSocketSession session) {
    Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
    return runId instanceof Long ? (Long) runId : null;
  }
}
