package uk.gegc.trivia.features.quiz.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionRequest;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionResponse;
import uk.gegc.trivia.features.quiz.application.QuizService;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;

@RestController
@RequestMapping("/quizzes")
@RequiredArgsConstructor
@Tag(name = "Quizzes", description = "Play a quiz one random question at a time")
public class QuizController {

    private final QuizService quizService;

    @Operation(
            summary = "Next quiz question",
            description = "Returns a random question not asked yet, optionally limited to one category. " +
                    "The question is null once every eligible question has been asked."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question (or null) returned"),
            @ApiResponse(responseCode = "400", description = "Body is not valid JSON",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Request could not be processed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping
    public ResponseEntity<QuizQuestionResponse> nextQuestion(@RequestBody QuizQuestionRequest request) {
        return ResponseEntity.ok(quizService.nextQuestion(request));
    }
}
