package uk.gegc.trivia.features.quiz.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.features.quiz.api.dto.QuizCategorySelection;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionRequest;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionResponse;
import uk.gegc.trivia.features.quiz.application.QuizService;
import uk.gegc.trivia.shared.exception.UnprocessableEntityException;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class QuizServiceImpl implements QuizService {

    private final QuestionRepository questionRepository;
    private final QuestionMapper questionMapper;
    private final Random quizRandom;

    @Override
    public QuizQuestionResponse nextQuestion(QuizQuestionRequest request) {
        Integer category = resolveCategory(request.quizCategory());
        Set<Integer> previous = request.previousQuestions() == null
                ? Set.of()
                : request.previousQuestions().stream()
                        .filter(Objects::nonNull)
                        .collect(Collectors.toSet());

        List<Question> candidates;
        try {
            candidates = previous.isEmpty()
                    ? questionRepository.findQuizCandidates(category)
                    : questionRepository.findQuizCandidatesExcluding(category, previous);
        } catch (DataAccessException ex) {
            log.error("Failed to load quiz candidates: {}", ex.getMessage(), ex);
            throw new UnprocessableEntityException("Quiz candidates could not be loaded", ex);
        }

        if (candidates.isEmpty()) {
            log.debug("No questions left for category {} after {} previous", category, previous.size());
            return new QuizQuestionResponse(true, null);
        }

        Question picked = candidates.get(quizRandom.nextInt(candidates.size()));
        return new QuizQuestionResponse(true, questionMapper.toDto(picked));
    }

    /**
     * Maps the selector onto a category filter; {@code null} means every category.
     */
    private Integer resolveCategory(QuizCategorySelection selection) {
        if (selection == null || selection.isAllCategories()) {
            return null;
        }
        if (selection.id() == null) {
            log.warn("Rejected quiz request: quiz_category has no id");
            throw new UnprocessableEntityException("quiz_category must carry an id");
        }
        return selection.id();
    }
}
