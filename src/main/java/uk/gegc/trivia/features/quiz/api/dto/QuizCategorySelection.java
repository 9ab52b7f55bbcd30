package uk.gegc.trivia.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Category picked for the quiz; id 0 means all categories")
public record QuizCategorySelection(
        @Schema(description = "Category id, or 0 for every category", example = "1")
        Integer id,

        @Schema(description = "Category label", example = "Science")
        String type
) {

    public boolean isAllCategories() {
        return id != null && id == 0;
    }
}
