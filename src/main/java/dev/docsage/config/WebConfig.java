package dev.docsage.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Opens the REST API to the browser frontend's origins. Credentials are not allowed. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

  private final CorsProperties cors;

  public WebConfig(CorsProperties cors) {
    this.cors = cors;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    log.info("CORS enabled on /api/** for origins {}", cors.allowedOrigins());
    registry
        .addMapping("/api/**")
        // replaces the registration's permit-all origin default
        .allowedOrigins()
        .allowedOriginPatterns(cors.allowedOrigins().toArray(String[]::new))
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .allowCredentials(false);
  }
}
