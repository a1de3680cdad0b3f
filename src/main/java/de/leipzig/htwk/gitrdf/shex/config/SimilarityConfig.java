package de.leipzig.htwk.gitrdf.shex.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shex.similarity")
public class SimilarityConfig {

  private long graphEditDistanceTimeoutSeconds = 60;

  public Duration getGraphEditDistanceTimeout() {
    return Duration.ofSeconds(graphEditDistanceTimeoutSeconds);
  }

  public long getGraphEditDistanceTimeoutSeconds() {
    return graphEditDistanceTimeoutSeconds;
  }

  public void setGraphEditDistanceTimeoutSeconds(long graphEditDistanceTimeoutSeconds) {
    this.graphEditDistanceTimeoutSeconds = graphEditDistanceTimeoutSeconds;
  }
}
