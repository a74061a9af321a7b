package com.example.gamesession.config;

import com.example.gamesession.agent.ConservativeDecisionStrategy;
import com.example.gamesession.agent.DecisionStrategy;
import com.example.gamesession.engine.GameRuleEngineFactory;
import com.example.gamesession.engine.OpenTableEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/** Core beans of the session continuity layer. Strategy and engine factory can be overridden. */
@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Worker pool for AI decisions; daemon threads so a stuck strategy never blocks shutdown. */
  @Bean(name = "agentExecutor", destroyMethod = "shutdownNow")
  public ExecutorService agentExecutor(SessionProperties props) {
    AtomicInteger seq = new AtomicInteger();
    return Executors.newFixedThreadPool(props.getAgentThreads(), r -> {
      Thread t = new Thread(r, "agent-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  @ConditionalOnMissingBean
  public DecisionStrategy decisionStrategy() {
    return new ConservativeDecisionStrategy();
  }

  @Bean
  @ConditionalOnMissingBean
  public GameRuleEngineFactory gameRuleEngineFactory() {
    return session -> new OpenTableEngine(session.getSessionId());
  }
}
