package com.codeclass.backend.execution.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 엔드포인트 등록.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final RunStatusWebSocketHandler handler;
  private final RunStatusHandshakeInterceptor interceptor;

  public WebSocketConfig(RunStatusWebSocketHandler handler, RunStatusHandshakeInterceptor interceptor) {
    this.handler = handler;
    this.interceptor = interceptor;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    // runId는 핸드셰이크 인터셉터에서 추출한다.
    registry.addHandler(handler, "/ws/run/{runId}")
            .addInterceptors(interceptor)
            .setAllowedOrigins("*");
  }
}
