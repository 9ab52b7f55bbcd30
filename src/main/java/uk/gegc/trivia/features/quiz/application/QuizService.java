package uk.gegc.trivia.features.quiz.application;

import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionRequest;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionResponse;

public interface QuizService {

    /**
     * Picks a random question that is not among the previous questions and, when a
     * category is selected, belongs to it. Returns a null question once the pool is
     * exhausted.
     */
    QuizQuestionResponse nextQuestion(QuizQuestionRequest request);
}
