package dev.runbar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Runbar launcher search service.
 *
 * <p>Serves search, history and completion endpoints under {@code /api} on port 8080.
 */
@SpringBootApplication
public class RunbarApplication {
  public static void main(String[] args) {
    SpringApplication.run(RunbarApplication.class, args);
  }
}
