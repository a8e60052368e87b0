package com.pimapos.notification;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;

/**
 * Skips PostgreSQL-backed tests when no Docker daemon is reachable, or fails them when {@value
 * #REQUIRE_DOCKER_PROPERTY} is {@code true}.
 */
public class DockerAvailableCondition implements ExecutionCondition {

  public static final String REQUIRE_DOCKER_PROPERTY = "notification.tests.require-docker";

  private static final Logger logger = LoggerFactory.getLogger(DockerAvailableCondition.class);

  @Override
  public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
    return evaluate(
        DockerClientFactory.instance().isDockerAvailable(),
        Boolean.getBoolean(REQUIRE_DOCKER_PROPERTY));
  }

  static ConditionEvaluationResult evaluate(boolean dockerAvailable, boolean dockerRequired) {
    if (dockerAvailable) {
      return ConditionEvaluationResult.enabled("Docker is available");
    }
    if (dockerRequired) {
      throw new IllegalStateException(
          "Docker is required for PostgreSQL tests (" + REQUIRE_DOCKER_PROPERTY + "=true)");
    }
    logger.warn(
        "Docker unavailable, PostgreSQL tests skipped; set {}=true to fail instead",
        REQUIRE_DOCKER_PROPERTY);
    return ConditionEvaluationResult.disabled("Docker is not available");
  }
}
