package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "A page of all questions together with the category labels")
public record QuestionPageResponse(
        boolean success,

        @Schema(description = "Questions on the requested page")
        List<QuestionDto> questions,

        @Schema(description = "Number of questions across all pages", example = "19")
        @JsonProperty("total_questions")
        long totalQuestions,

        @Schema(description = "Category labels keyed by category id")
        Map<Integer, String> categories,

        @Schema(description = "Currently selected category", example = "1")
        @JsonProperty("current_category")
        int currentCategory
) {
}
