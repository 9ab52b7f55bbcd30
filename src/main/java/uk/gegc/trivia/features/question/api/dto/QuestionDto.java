package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A trivia question as returned by every endpoint")
public record QuestionDto(
        @Schema(description = "Question id", example = "12")
        Integer id,

        @Schema(description = "Question text", example = "What is the heaviest organ in the human body?")
        String question,

        @Schema(description = "Answer text", example = "The Liver")
        String answer,

        @Schema(description = "Id of the category the question belongs to", example = "1")
        Integer category,

        @Schema(description = "Difficulty rating", example = "4")
        Integer difficulty
) {
}
