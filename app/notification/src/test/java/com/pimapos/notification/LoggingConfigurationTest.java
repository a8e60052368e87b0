package com.pimapos.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackWritesJsonWithServiceAndTraceFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String config =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(config).contains("LoggingEventCompositeJsonEncoder");
    assertThat(config).contains("defaultValue=\"notification-engine\"");
    assertThat(config).contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"");
    assertThat(config).contains("<mdc>");
  }
}
