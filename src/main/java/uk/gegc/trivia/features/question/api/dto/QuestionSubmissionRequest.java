package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Body of {@code POST /questions}. A non-empty {@code searchTerm} turns the request into a
 * search and the remaining fields are ignored; otherwise all four content fields are
 * required to create a question.
 */
@Schema(description = "Either a new question or a search term")
public record QuestionSubmissionRequest(
        @Schema(description = "Question text", example = "Which planet is closest to the sun?")
        String question,

        @Schema(description = "Answer text", example = "Mercury")
        String answer,

        @Schema(description = "Category id", example = "1")
        Integer category,

        @Schema(description = "Difficulty rating", example = "2")
        Integer difficulty,

        @Schema(description = "Case-insensitive substring to search question texts for", example = "planet")
        String searchTerm
) {

    public boolean hasSearchTerm() {
        return searchTerm != null && !searchTerm.isEmpty();
    }
}
