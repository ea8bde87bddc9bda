/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Query gateway server.
 *
 * <p>Run with: {@code java -jar query-gateway-server.jar}
 *
 * <p>Listens on {@code querygate.server.port} (default 9001). Requires ClickHouse reachable at
 * {@code querygate.database.url}; Redis at {@code querygate.cache.host} is optional.
 */
@SpringBootApplication
public class QueryGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(QueryGatewayApplication.class, args);
  }
}
