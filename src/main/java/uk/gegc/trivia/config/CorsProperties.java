package uk.gegc.trivia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * CORS headers written on every response. The API is public, so the defaults open it
 * to any origin.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.cors")
public class CorsProperties {

    private String allowedOrigin = "*";

    private String allowedHeaders = "Content-Type,Authorization,true";

    private String allowedMethods = "GET,PUT,POST,DELETE,OPTIONS";
}
