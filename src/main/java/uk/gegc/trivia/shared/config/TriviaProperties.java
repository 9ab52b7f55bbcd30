package uk.gegc.trivia.shared.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.trivia")
public class TriviaProperties {

    /**
     * Number of questions returned per page by every listing endpoint.
     */
    @Min(value = 1, message = "Questions per page must be at least 1")
    private int questionsPerPage = 10;

    /**
     * Value echoed as {@code current_category} by the question listing.
     */
    private int currentCategory = 1;
}
