package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of creating a question")
public record QuestionCreatedResponse(
        boolean success,

        @Schema(description = "Id assigned to the new question", example = "24")
        Integer created,

        @Schema(description = "Questions on the requested page after the insert")
        List<QuestionDto> questions,

        @Schema(description = "Number of questions after the insert", example = "20")
        @JsonProperty("total_questions")
        long totalQuestions
) {
}
