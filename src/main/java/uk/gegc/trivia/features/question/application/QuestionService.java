package uk.gegc.trivia.features.question.application;

import uk.gegc.trivia.features.question.api.dto.QuestionCreatedResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionDeletedResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionListResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionPageResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionSubmissionRequest;

public interface QuestionService {

    /**
     * @throws uk.gegc.trivia.shared.exception.ResourceNotFoundException if the page holds no questions
     */
    QuestionPageResponse listQuestions(int page);

    /**
     * Deletes the question and returns the requested page of what is left. A missing id is
     * reported as unprocessable, not as not-found.
     */
    QuestionDeletedResponse deleteQuestion(Integer questionId, int page);

    QuestionCreatedResponse createQuestion(QuestionSubmissionRequest request, int page);

    QuestionListResponse searchQuestions(String searchTerm, int page);

    /**
     * @throws uk.gegc.trivia.shared.exception.ResourceNotFoundException if the category does not exist
     */
    QuestionListResponse listQuestionsByCategory(Integer categoryId, int page);
}
