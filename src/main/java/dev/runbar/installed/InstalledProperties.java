package dev.runbar.installed;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the installed-program index, bound from {@code
 * runbar.installed.*}.
 *
 * <ul>
 *   <li>{@code roots} - application directories to scan
 *   <li>{@code max-depth} - directory levels below each root (default 4, bounded [1, 16])
 *   <li>{@code result-limit} - index hits considered per query (default 300)
 *   <li>{@code refresh-interval} - age after which the scan is redone (default 5m)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "runbar.installed")
public class InstalledProperties {

  private List<Path> roots = new ArrayList<>(defaultRoots());
  private int maxDepth = 4;
  private int resultLimit = 300;
  private Duration refreshInterval = Duration.ofMinutes(5);

  @PostConstruct
  void validate() {
    if (roots == null) {
      throw new IllegalStateException("runbar.installed.roots must not be null");
    }
    if (maxDepth < 1 || maxDepth > 16) {
      throw new IllegalStateException(
          "runbar.installed.max-depth must be in [1, 16], got: " + maxDepth);
    }
    if (resultLimit < 1 || resultLimit > 10_000) {
      throw new IllegalStateException(
          "runbar.installed.result-limit must be in [1, 10000], got: " + resultLimit);
    }
    if (refreshInterval == null || refreshInterval.isNegative()) {
      throw new IllegalStateException(
          "runbar.installed.refresh-interval must be >= 0, got: " + refreshInterval);
    }
  }

  private static List<Path> defaultRoots() {
    String home = System.getProperty("user.home");
    return List.of(
        Path.of("/Applications"),
        Path.of("/System/Applications"),
        Path.of(home, "Applications"),
        Path.of("/usr/share/applications"),
        Path.of(home, ".local", "share", "applications"));
  }

  public List<Path> getRoots() {
    return roots;
  }

  public void setRoots(List<Path> roots) {
    this.roots = roots;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  public int getResultLimit() {
    return resultLimit;
  }

  public void setResultLimit(int resultLimit) {
    this.resultLimit = resultLimit;
  }

  public Duration getRefreshInterval() {
    return refreshInterval;
  }

  public void setRefreshInterval(Duration refreshInterval) {
    this.refreshInterval = refreshInterval;
  }
}
