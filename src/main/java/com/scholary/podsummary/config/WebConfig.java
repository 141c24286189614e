package com.scholary.podsummary.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the browser front end.
 *
 * <p>{@code podsummary.corsOrigins} is a comma-separated list; empty or {@code *} allows any
 * origin.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final String[] allowedOrigins;

  public WebConfig(@Value("${podsummary.corsOrigins:*}") String corsOrigins) {
    String[] origins =
        Arrays.stream(corsOrigins.split(","))
            .map(String::trim)
            .filter(origin -> !origin.isEmpty())
            .toArray(String[]::new);
    this.allowedOrigins = origins.length == 0 ? new String[] {"*"} : origins;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOriginPatterns(allowedOrigins)
        .allowedMethods("*")
        .allowedHeaders("*")
        .allowCredentials(true);
  }
}
