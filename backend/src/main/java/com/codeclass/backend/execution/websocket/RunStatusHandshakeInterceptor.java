package com.codeclass.backend.execution.websocket;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * WebSocket 경로에서 runId를, 헤더나 쿼리에서 요청자를 추출한다.
 */
@Component
public class RunStatusHandshakeInterceptor implements HandshakeInterceptor {
  static final String USER_HEADER = "X-User-Id";
  static final String USER_PARAM = "user_id";

  @Override
  public boolean beforeHandshake(
          ServerHttpRequest request,
          ServerHttpResponse response,
          WebSocketHandler wsHandler,
          Map<String, Object> attributes
  ) {
    // 경로 형식: /ws/run/{runId}
    String path = request.getURI().getPath();
    String[] parts = path.split("/");
    if (parts.length == 0) {
      return false;
    }

    // 헤더가 없으면 쿼리 파라미터 user_id
    String principal = request.getHeaders().getFirst(USER_HEADER);
    if (principal == null) {
      principal = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(USER_PARAM);
    }
    if (principal != null) {
      attributes.put(RunStatusWebSocketHandler.PRINCIPAL_ATTRIBUTE, principal);
    }

    try {
      attributes.put(RunStatusWebSocketHandler.RUN_ID_ATTRIBUTE, Long.valueOf(parts[parts.length - 1]));
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  @Override
  public void afterHandshake(
          ServerHttpRequest request,
          ServerHttpResponse response,
          WebSocketHandler wsHandler,
          Exception exception
  ) {
  }
}
