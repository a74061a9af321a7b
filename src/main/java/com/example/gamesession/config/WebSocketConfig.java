package com.example.gamesession.config;

import com.example.gamesession.handler.GameWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mounts the game socket. {@code app.websocket.allowed-origins} is a CSV of origins;
 * a local origin also admits localhost and 127.0.0.1 on any port, "*" admits everyone.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final GameWebSocketHandler handler;
  private final String socketPath;
  private final List<String> originPatterns;

  public WebSocketConfig(
      GameWebSocketHandler handler,
      @Value("${app.websocket.path:/sessionSocket}") String socketPath,
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String allowedOrigins
  ) {
    this.handler = handler;
    this.socketPath = socketPath;
    this.originPatterns = originPatternsOf(allowedOrigins);
  }

  static List<String> originPatternsOf(String csv) {
    Set<String> patterns = new LinkedHashSet<>();
    for (String raw : csv.split(",")) {
      String origin = raw.trim();
      if (origin.isEmpty()) continue;
      patterns.addAll(expandToPatterns(origin));
    }
    return patterns.isEmpty() ? List.of("*") : List.copyOf(patterns);
  }

  static List<String> expandToPatterns(String origin) {
    if ("*".equals(origin)) return List.of("*");
    if (origin.startsWith("http://localhost") || origin.startsWith("http://127.0.0.1")) {
      return List.of(origin, "http://localhost:*", "http://127.0.0.1:*");
    }
    return List.of(origin);
  }

  List<String> getOriginPatterns() {
    return originPatterns;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, socketPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}
