/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Gateway settings under {@code querygate}.
 *
 * <p>Every property can be set from the environment through relaxed binding, e.g. {@code
 * QUERYGATE_SERVER_PORT=9001} or {@code QUERYGATE_CACHE_ENABLED=false}.
 */
@Data
@ConfigurationProperties(prefix = "querygate")
public class QueryGatewayProperties {

  private Server server = new Server();
  private Pool pool = new Pool();
  private Dispatcher dispatcher = new Dispatcher();
  private Database database = new Database();
  private Cache cache = new Cache();
  private Scenario scenario = new Scenario();
  private Report report = new Report();
  private Instrumentation instrumentation = new Instrumentation();

  /** TCP listener. */
  @Data
  public static class Server {

    private String host = "0.0.0.0";

    /** Bind port; 0 picks an ephemeral port. */
    private int port = 9001;

    /** Longest accepted handshake line, newline included. */
    private int handshakeMaxBytes = 64;

    /** Buffer of one receive call; each call yields at most one query. */
    private int receiveBufferBytes = 16384;

    /** Buffer of one receive call while reading the maintenance payload. */
    private int maintenanceBufferBytes = 8192;
  }

  @Data
  public static class Pool {

    /** Database connections; also the number of dispatcher workers. */
    private int size = 10;
  }

  @Data
  public static class Dispatcher {

    /** Longest a worker waits on an empty queue before re-checking for shutdown. */
    private Duration idleBackoff = Duration.ofMillis(50);

    /** How long shutdown waits for tasks in flight. */
    private Duration shutdownGrace = Duration.ofSeconds(5);
  }

  @Data
  public static class Database {

    private String url = "jdbc:clickhouse://localhost:8123/default";
    private String username = "default";
    private String password = "";

    /** Timeout of the validity probe run after a failed query. */
    private Duration validationTimeout = Duration.ofSeconds(2);
  }

  @Data
  public static class Cache {

    /** Use Redis when reachable; {@code false} goes straight to the in-process cache. */
    private boolean enabled = true;

    private String host = "127.0.0.1";
    private int port = 6379;
    private int database = 0;
    private Duration ttl = Duration.ofSeconds(300);
    private Duration connectTimeout = Duration.ofSeconds(2);
    private String keyPrefix = "ch:query:";
  }

  @Data
  public static class Scenario {

    /** Record cache hits into the result ledger, so reports include them. */
    private boolean countCacheHits = true;
  }

  @Data
  public static class Report {

    /** JSON summaries go here, figures into its {@code plots} subdirectory. */
    private String outputDir = "results/optimized";
  }

  @Data
  public static class Instrumentation {

    private Duration sampleInterval = Duration.ofMillis(100);
    private Duration rateWindow = Duration.ofMillis(200);
    private Duration settleDelay = Duration.ofMillis(250);
  }
}
