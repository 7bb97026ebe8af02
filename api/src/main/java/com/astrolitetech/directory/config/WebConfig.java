package com.astrolitetech.directory.config;

import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS for the known front ends, and static serving of stored employee photos. */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

  static final String DEFAULT_ORIGINS =
      "http://51.21.195.141:8036,http://51.21.195.141:8156,http://51.21.195.141:3093,"
          + "http://51.21.195.141:5500,http://127.0.0.1:5500";

  private final String[] allowedOrigins;
  private final Path uploadDir;
  private final String urlPrefix;

  public WebConfig(
      @Value("${directory.cors.allowed-origins:" + DEFAULT_ORIGINS + "}") String[] allowedOrigins,
      @Value("${directory.uploads.dir:uploads}") String uploadDir,
      @Value("${directory.uploads.url-prefix:uploads}") String urlPrefix) {
    this.allowedOrigins = allowedOrigins;
    this.uploadDir = Path.of(uploadDir);
    this.urlPrefix = urlPrefix;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOrigins(allowedOrigins)
        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
        .allowedHeaders("Content-Type", "Authorization")
        .allowCredentials(true);
  }

  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    String location = uploadDir.toAbsolutePath().toUri().toString();
    if (!location.endsWith("/")) {
      location = location + "/";
    }
    log.debug("Serving uploads from {} at /{}/**", location, urlPrefix);
    registry.addResourceHandler("/" + urlPrefix + "/**").addResourceLocations(location);
  }
}
