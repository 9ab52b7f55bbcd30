package uk.gegc.trivia.features.category.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "All categories keyed by id")
public record CategoryListResponse(
        @Schema(description = "Always true for successful requests", example = "true")
        boolean success,

        @Schema(description = "Category labels keyed by category id", example = "{\"1\": \"Science\", \"2\": \"Art\"}")
        Map<Integer, String> categories,

        @Schema(description = "Number of categories", example = "6")
        @JsonProperty("total_categories")
        int totalCategories
) {
}
