package dev.runbar.catalog;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Loads the package catalog once at startup from {@code runbar.catalog.location}. */
@Configuration
public class CatalogConfig {

  @Bean
  public CatalogStore catalogStore(CatalogLoader loader, CatalogProperties properties) {
    return loader.load(properties.getLocation());
  }
}
