package dev.papernotes.search;

import dev.papernotes.note.EmbeddingField;
import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the query pipeline.
 *
 * <p>Properties are bound from {@code papernotes.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code neighbors} - k for every per-field nearest-neighbour lookup (default 10, bounded [1,
 *       200])
 *   <li>{@code global-threshold} - exclusive bound on the fused score (default 0.2)
 *   <li>{@code thresholds.<field>} - exclusive bound on each field's cosine distance (default 0.2
 *       for every field)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "papernotes.search")
public class SearchProperties {

  static final double DEFAULT_THRESHOLD = 0.2;

  private int neighbors = 10;
  private double globalThreshold = DEFAULT_THRESHOLD;
  private Map<EmbeddingField, Double> thresholds = new EnumMap<>(EmbeddingField.class);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (neighbors < 1 || neighbors > 200) {
      throw new IllegalStateException(
          "papernotes.search.neighbors must be in [1, 200], got: " + neighbors);
    }
    if (globalThreshold <= 0.0 || globalThreshold > 2.0) {
      throw new IllegalStateException(
          "papernotes.search.global-threshold must be in (0.0, 2.0], got: " + globalThreshold);
    }
    thresholds.forEach(
        (field, value) -> {
          if (value == null || value <= 0.0 || value > 2.0) {
            throw new IllegalStateException(
                "papernotes.search.thresholds." + field + " must be in (0.0, 2.0], got: " + value);
          }
        });
  }

  /** Exclusive distance bound for one field; fields without an override use 0.2. */
  public double thresholdFor(EmbeddingField field) {
    Double value = thresholds.get(field);
    return value == null ? DEFAULT_THRESHOLD : value;
  }

  public int getNeighbors() {
    return neighbors;
  }

  public void setNeighbors(int neighbors) {
    this.neighbors = neighbors;
  }

  public double getGlobalThreshold() {
    return globalThreshold;
  }

  public void setGlobalThreshold(double globalThreshold) {
    this.globalThreshold = globalThreshold;
  }

  public Map<EmbeddingField, Double> getThresholds() {
    return thresholds;
  }

  public void setThresholds(Map<EmbeddingField, Double> thresholds) {
    this.thresholds = new EnumMap<>(EmbeddingField.class);
    this.thresholds.putAll(thresholds);
  }
}
