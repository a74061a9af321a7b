package com.example.gamesession.controller;

import com.example.gamesession.engine.GameEngineDirectory;
import com.example.gamesession.service.ConnectionRegistry;
import com.example.gamesession.service.SessionReaper;
import com.example.gamesession.service.SessionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final SessionRegistry sessions;
  private final ConnectionRegistry connections;
  private final GameEngineDirectory engines;
  private final SessionReaper reaper;
  private final String activeProfile;

  public HealthController(SessionRegistry sessions,
                          ConnectionRegistry connections,
                          GameEngineDirectory engines,
                          SessionReaper reaper,
                          @Value("${spring.profiles.active:default}") String activeProfile) {
    this.sessions = sessions;
    this.connections = connections;
    this.engines = engines;
    this.reaper = reaper;
    this.activeProfile = activeProfile;
  }

  /** Liveness check, no state touched */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human readable status with in-memory counters */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("profile", activeProfile);
    m.put("sessions", sessions.size());
    m.put("connections", connections.size());
    m.put("staleConnections", connections.staleCount());
    m.put("engines", engines.size());
    m.put("reaper", reaper.isRunning() ? "running" : "stopped");
    m.put("cleanupTimeout", reaper.getCleanupTimeout().toString());
    return m;
  }
}
