package dev.runbar.catalog;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the package catalog, bound from {@code runbar.catalog.*}.
 *
 * <ul>
 *   <li>{@code location} - Spring resource location of the catalog JSON (default {@code
 *       classpath:catalog.json})
 *   <li>{@code deprecation-penalty} - points subtracted from deprecated packages and from history
 *       entries pointing at them (default 200, bounded [0, 1000])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "runbar.catalog")
public class CatalogProperties {

  private String location = "classpath:catalog.json";
  private int deprecationPenalty = 200;

  @PostConstruct
  void validate() {
    if (location == null || location.isBlank()) {
      throw new IllegalStateException("runbar.catalog.location must not be blank");
    }
    if (deprecationPenalty < 0 || deprecationPenalty > 1000) {
      throw new IllegalStateException(
          "runbar.catalog.deprecation-penalty must be in [0, 1000], got: " + deprecationPenalty);
    }
  }

  public String getLocation() {
    return location;
  }

  public void setLocation(String location) {
    this.location = location;
  }

  public int getDeprecationPenalty() {
    return deprecationPenalty;
  }

  public void setDeprecationPenalty(int deprecationPenalty) {
    this.deprecationPenalty = deprecationPenalty;
  }

  /**
   * Applies the deprecation penalty to a score, never going below zero.
   *
   * @param score the undemoted score
   * @return the demoted score
   */
  public int penalize(int score) {
    return Math.max(score - deprecationPenalty, 0);
  }
}
