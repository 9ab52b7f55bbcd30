package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of deleting a question")
public record QuestionDeletedResponse(
        boolean success,

        @Schema(description = "Id of the deleted question", example = "5")
        Integer deleted,

        @Schema(description = "Questions on the requested page after the deletion")
        List<QuestionDto> questions,

        @Schema(description = "Number of questions left", example = "18")
        @JsonProperty("total_questions")
        long totalQuestions
) {
}
