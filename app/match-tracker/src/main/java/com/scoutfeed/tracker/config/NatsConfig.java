/*
 * Where: Match tracker infrastructure configuration
 * What: owns the NATS connection and makes sure the owner notice stream exists
 * Why: JetStream dedup on Nats-Msg-Id only works once the stream is declared
 */
package com.scoutfeed.tracker.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.api.StreamConfiguration;
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
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(properties.connectionTimeout())
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream ownerNoticeJetStream(
      Connection connection, OwnerNoticeNatsProperties properties)
      throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    upsertStream(connection.jetStreamManagement(), streamConfiguration);
    logger.info(
        "owner notice stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
    return connection.jetStream();
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }
}
