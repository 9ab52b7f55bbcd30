package uk.gegc.trivia.features.quiz.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "State of a running quiz")
public record QuizQuestionRequest(
        @Schema(description = "Ids of the questions already asked in this quiz", example = "[3, 12]")
        @JsonProperty("previous_questions")
        List<Integer> previousQuestions,

        @Schema(description = "Category restriction; omitted or id 0 for all categories")
        @JsonProperty("quiz_category")
        QuizCategorySelection quizCategory
) {
}
