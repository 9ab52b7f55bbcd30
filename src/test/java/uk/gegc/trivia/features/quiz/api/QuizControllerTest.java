package uk.gegc.trivia.features.quiz.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionRequest;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionResponse;
import uk.gegc.trivia.features.quiz.application.QuizService;
import uk.gegc.trivia.shared.exception.UnprocessableEntityException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuizController.class)
class QuizControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuizService quizService;

    @Test
    @DisplayName("POST /quizzes binds previous_questions and quiz_category")
    void nextQuestion_bindsSnakeCaseBody() throws Exception {
        QuestionDto dto = new QuestionDto(9, "Who discovered penicillin?", "Alexander Fleming", 1, 3);
        when(quizService.nextQuestion(any(QuizQuestionRequest.class))).thenReturn(new QuizQuestionResponse(true, dto));

        mockMvc.perform(post("/quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previous_questions\": [2, 4], \"quiz_category\": {\"id\": \"1\", \"type\": \"Science\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.question.id").value(9))
                .andExpect(jsonPath("$.question.answer").value("Alexander Fleming"));

        ArgumentCaptor<QuizQuestionRequest> captor = ArgumentCaptor.forClass(QuizQuestionRequest.class);
        verify(quizService).nextQuestion(captor.capture());
        assertThat(captor.getValue().previousQuestions()).containsExactly(2, 4);
        assertThat(captor.getValue().quizCategory().id()).isEqualTo(1);
        assertThat(captor.getValue().quizCategory().type()).isEqualTo("Science");
    }

    @Test
    @DisplayName("POST /quizzes serialises an exhausted quiz as question null")
    void nextQuestion_exhausted_returnsNull() throws Exception {
        when(quizService.nextQuestion(any(QuizQuestionRequest.class))).thenReturn(new QuizQuestionResponse(true, null));

        mockMvc.perform(post("/quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previous_questions\": [1]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.question").value(nullValue()));
    }

    @Test
    @DisplayName("POST /quizzes maps service rejections to the 422 envelope")
    void nextQuestion_rejected_returns422() throws Exception {
        when(quizService.nextQuestion(any(QuizQuestionRequest.class)))
                .thenThrow(new UnprocessableEntityException("quiz_category must carry an id"));

        mockMvc.perform(post("/quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previous_questions\": [], \"quiz_category\": {\"type\": \"Science\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(422))
                .andExpect(jsonPath("$.message").value("unprocessable"));
    }

    @Test
    @DisplayName("POST /quizzes with wrongly typed fields returns the 422 envelope")
    void nextQuestion_wrongType_returns422() throws Exception {
        mockMvc.perform(post("/quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previous_questions\": [], \"quiz_category\": {\"id\": \"abc\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value(422))
                .andExpect(jsonPath("$.message").value("unprocessable"));

        mockMvc.perform(post("/quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previous_questions\": \"none\"}"))
                .andExpect(status().isUnprocessableEntity());

        verifyNoInteractions(quizService);
    }

    @Test
    @DisplayName("POST /quizzes with malformed JSON returns the 400 envelope")
    void nextQuestion_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/quizzes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previous_questions\": [1,"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("bad request"));

        verifyNoInteractions(quizService);
    }
}
