package uk.gegc.trivia;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;

/**
 * Full application context on in-memory H2; every test runs in a transaction that is
 * rolled back afterwards.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
public abstract class BaseIntegrationTest {

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected QuestionRepository questionRepository;

    @Autowired
    protected CategoryRepository categoryRepository;

    protected Category category(String type) {
        return categoryRepository.save(new Category(type));
    }

    protected Question question(String text, String answer, Category category, int difficulty) {
        return questionRepository.save(new Question(text, answer, category.getId(), difficulty));
    }
}
