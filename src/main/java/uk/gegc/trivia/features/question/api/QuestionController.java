package uk.gegc.trivia.features.question.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.trivia.features.question.api.dto.QuestionDeletedResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionPageResponse;
import uk.gegc.trivia.features.question.api.dto.QuestionSubmissionRequest;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;
import uk.gegc.trivia.shared.pagination.Paginator;

@Tag(
        name = "Questions",
        description = "Listing, creating, searching and deleting trivia questions"
)
@RestController
@RequestMapping("/questions")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionService questionService;

    @Operation(
            summary = "List questions",
            description = "Page of questions ordered by id, ten per page, with the category labels",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of questions returned"),
            @ApiResponse(responseCode = "404", description = "Requested page holds no questions",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping
    public ResponseEntity<QuestionPageResponse> getQuestions(
            @Parameter(description = "1-based page number; anything non-numeric means page 1")
            @RequestParam(name = "page", required = false) String page
    ) {
        return ResponseEntity.ok(questionService.listQuestions(Paginator.resolvePage(page)));
    }

    @Operation(
            summary = "Delete a question",
            description = "Delete a question by id and return the requested page of the remaining questions",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question deleted"),
            @ApiResponse(responseCode = "422", description = "Question missing or could not be deleted",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{questionId:\\d+}")
    public ResponseEntity<QuestionDeletedResponse> deleteQuestion(
            @Parameter(description = "Id of the question", required = true)
            @PathVariable Integer questionId,
            @Parameter(description = "1-based page number of the remaining questions to return")
            @RequestParam(name = "page", required = false) String page
    ) {
        return ResponseEntity.ok(questionService.deleteQuestion(questionId, Paginator.resolvePage(page)));
    }

    @Operation(
            summary = "Create or search questions",
            description = "With a non-empty searchTerm, returns the questions whose text contains it. " +
                    "Otherwise creates a question from question, answer, category and difficulty.",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question created or search results returned"),
            @ApiResponse(responseCode = "400", description = "Body is not valid JSON",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Required fields missing or request could not be processed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping
    public ResponseEntity<?> submitQuestion(
            @RequestBody QuestionSubmissionRequest request,
            @Parameter(description = "1-based page number of the results to return")
            @RequestParam(name = "page", required = false) String page
    ) {
        int resolvedPage = Paginator.resolvePage(page);
        if (request.hasSearchTerm()) {
            return ResponseEntity.ok(questionService.searchQuestions(request.searchTerm(), resolvedPage));
        }
        return ResponseEntity.ok(questionService.createQuestion(request, resolvedPage));
    }
}
