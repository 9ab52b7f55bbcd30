package uk.gegc.trivia.features.question.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.api.dto.QuestionSubmissionRequest;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class QuestionMapper {

    public QuestionDto toDto(Question question) {
        return new QuestionDto(
                question.getId(),
                question.getQuestion(),
                question.getAnswer(),
                question.getCategory(),
                question.getDifficulty()
        );
    }

    public List<QuestionDto> toDtos(List<Question> questions) {
        return questions.stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    public Question toEntity(QuestionSubmissionRequest request) {
        return new Question(
                request.question(),
                request.answer(),
                request.category(),
                request.difficulty()
        );
    }
}
