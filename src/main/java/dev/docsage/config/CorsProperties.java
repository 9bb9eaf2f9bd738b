package dev.docsage.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Browser origins allowed to call the REST API, bound from {@code docsage.cors.*}.
 *
 * @param allowedOrigins origin patterns, e.g. {@code https://docs.example.com} or
 *     {@code http://localhost:*}; {@code *} allows any origin
 */
@ConfigurationProperties(prefix = "docsage.cors")
public record CorsProperties(@DefaultValue("*") List<String> allowedOrigins) {}
