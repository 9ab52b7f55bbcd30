package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "A page of questions matching a search term or a category")
public record QuestionListResponse(
        boolean success,

        @Schema(description = "Matching questions on the requested page")
        List<QuestionDto> questions,

        @Schema(description = "Number of matching questions across all pages", example = "3")
        @JsonProperty("total_questions")
        long totalQuestions
) {
}
