/*
 * Where: Notification infrastructure configuration
 * What: Opens the NATS connection used by the transaction event subscriber
 * Why: Spring owns the connection lifecycle and closes it after the subscriber drains
 */
package com.pimapos.notification.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(properties.connectionName())
            .connectionTimeout(properties.connectionTimeout())
            .reconnectWait(properties.reconnectWait())
            .maxReconnects(properties.maxReconnects())
            .connectionListener(
                (connection, event) ->
                    logger.info(
                        "nats connection event event={} server={}",
                        event,
                        connection.getConnectedUrl()))
            .build();
    return Nats.connect(options);
  }
}
