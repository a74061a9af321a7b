package com.example.gamesession.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties("app.session")
public class SessionProperties {

  /** Grace period after the last human left a started session (0 in tests). */
  @NotNull
  private Duration cleanupTimeout = Duration.ofSeconds(30);

  /** Replay queue cap per participant. */
  @Min(1)
  private int maxQueueSize = 100;

  /** Fixed rate of the reaper sweep. */
  @NotNull
  private Duration reaperInterval = Duration.ofSeconds(5);

  /** Upper bound for one AI decision before the default action is used. */
  @NotNull
  private Duration aiDecisionTimeout = Duration.ofSeconds(2);

  /** Worker threads for AI decisions. */
  @Min(1)
  private int agentThreads = 4;

  /** A connection silent for longer than this is reported as stale. */
  @NotNull
  private Duration connectionStaleAfter = Duration.ofSeconds(30);

  /** A connection silent for this long is treated as disconnected by the sweep (0 = never). */
  @NotNull
  private Duration connectionIdleTimeout = Duration.ofMinutes(5);

  /** Replay entries older than this are pruned by the sweep (0 = keep until flushed). */
  @NotNull
  private Duration replayMaxAge = Duration.ofMinutes(30);

  // --- getters/setters ---

  public Duration getCleanupTimeout() { return cleanupTimeout; }
  public void setCleanupTimeout(Duration cleanupTimeout) { this.cleanupTimeout = cleanupTimeout; }

  public int getMaxQueueSize() { return maxQueueSize; }
  public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }

  public Duration getReaperInterval() { return reaperInterval; }
  public void setReaperInterval(Duration reaperInterval) { this.reaperInterval = reaperInterval; }

  public Duration getAiDecisionTimeout() { return aiDecisionTimeout; }
  public void setAiDecisionTimeout(Duration aiDecisionTimeout) { this.aiDecisionTimeout = aiDecisionTimeout; }

  public int getAgentThreads() { return agentThreads; }
  public void setAgentThreads(int agentThreads) { this.agentThreads = agentThreads; }

  public Duration getConnectionStaleAfter() { return connectionStaleAfter; }
  public void setConnectionStaleAfter(Duration connectionStaleAfter) { this.connectionStaleAfter = connectionStaleAfter; }

  public Duration getConnectionIdleTimeout() { return connectionIdleTimeout; }
  public void setConnectionIdleTimeout(Duration connectionIdleTimeout) { this.connectionIdleTimeout = connectionIdleTimeout; }

  public Duration getReplayMaxAge() { return replayMaxAge; }
  public void setReplayMaxAge(Duration replayMaxAge) { this.replayMaxAge = replayMaxAge; }
}
