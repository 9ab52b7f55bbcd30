package uk.gegc.trivia.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;

@Schema(description = "Next quiz question")
public record QuizQuestionResponse(
        boolean success,

        @Schema(description = "Randomly chosen unseen question, or null when none is left", nullable = true)
        QuestionDto question
) {
}
