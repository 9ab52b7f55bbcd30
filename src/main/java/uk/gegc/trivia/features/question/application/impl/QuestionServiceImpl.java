package uk.gegc.trivia.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.features.question.api.dto.QuestionCreatedResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionDeletedResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.api.dto.QuestionListResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionPageResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionSubmissionRequest;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.shared.config.TriviaProperties;
import uk.gegc.trivia.shared.exception.ResourceNotFoundException;
import uk.gegc.trivia.shared.exception.UnprocessableEntityException;
import uk.gegc.trivia.shared.pagination.Paginator;

import java.util.List;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class QuestionServiceImpl implements QuestionService {

    private final QuestionRepository questionRepository;
    private final CategoryRepository categoryRepository;
    private final CategoryService categoryService;
    private final QuestionMapper questionMapper;
    private final TriviaProperties triviaProperties;

    @Override
    @Transactional(readOnly = true)
    public QuestionPageResponse listQuestions(int page) {
        List<QuestionDto> currentQuestions = paginate(questionRepository.findAllByOrderByIdAsc(), page);
        if (currentQuestions.isEmpty()) {
            throw new ResourceNotFoundException("No questions on page " + page);
        }

        return new QuestionPageResponse(
                true,
                currentQuestions,
                questionRepository.count(),
                categoryService.getCategoryTypes(),
                triviaProperties.getCurrentCategory()
        );
    }

    @Override
    public QuestionDeletedResponse deleteQuestion(Integer questionId, int page) {
        try {
            Question question = questionRepository.findById(questionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
            questionRepository.delete(question);
            // surface constraint failures here rather than at commit
            questionRepository.flush();

            List<Question> remaining = questionRepository.findAllByOrderByIdAsc();
            log.info("Deleted question {}, {} questions left", questionId, remaining.size());

            return new QuestionDeletedResponse(true, questionId, paginate(remaining, page), remaining.size());
        } catch (ResourceNotFoundException | DataAccessException ex) {
            log.warn("Could not delete question {}: {}", questionId, ex.getMessage());
            throw new UnprocessableEntityException("Question " + questionId + " could not be deleted", ex);
        }
    }

    @Override
    public QuestionCreatedResponse createQuestion(QuestionSubmissionRequest request, int page) {
        validateSubmission(request);

        try {
            Question saved = questionRepository.save(questionMapper.toEntity(request));
            List<Question> all = questionRepository.findAllByOrderByIdAsc();
            log.info("Created question {} in category {}", saved.getId(), saved.getCategory());

            return new QuestionCreatedResponse(true, saved.getId(), paginate(all, page), all.size());
        } catch (DataAccessException ex) {
            log.error("Failed to store new question: {}", ex.getMessage(), ex);
            throw new UnprocessableEntityException("Question could not be stored", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionListResponse searchQuestions(String searchTerm, int page) {
        try {
            List<Question> matches = questionRepository.findByQuestionContainingIgnoreCaseOrderByIdAsc(searchTerm);
            log.debug("Search for '{}' matched {} questions", searchTerm, matches.size());

            return new QuestionListResponse(true, paginate(matches, page), matches.size());
        } catch (DataAccessException ex) {
            log.error("Search for '{}' failed: {}", searchTerm, ex.getMessage(), ex);
            throw new UnprocessableEntityException("Search could not be performed", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionListResponse listQuestionsByCategory(Integer categoryId, int page) {
        if (!categoryRepository.existsById(categoryId)) {
            throw new ResourceNotFoundException("Category " + categoryId + " not found");
        }

        List<Question> questions = questionRepository.findByCategoryOrderByIdAsc(categoryId);
        return new QuestionListResponse(true, paginate(questions, page), questions.size());
    }

    private List<QuestionDto> paginate(List<Question> questions, int page) {
        List<Question> slice = Paginator.slice(questions, page, triviaProperties.getQuestionsPerPage());
        return questionMapper.toDtos(slice);
    }

    private void validateSubmission(QuestionSubmissionRequest request) {
        if (isBlank(request.question())
                || isBlank(request.answer())
                || request.category() == null
                || request.difficulty() == null) {
            log.warn("Rejected question submission with missing fields");
            throw new UnprocessableEntityException("Question, answer, category and difficulty are required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
