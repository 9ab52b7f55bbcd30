package uk.gegc.trivia.features.category.api;

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
import uk.gegc.trivia.features.category.api.dto.CategoryListResponse;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.question.api.dto.QuestionListResponse;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;
import uk.gegc.trivia.shared.pagination.Paginator;

@Tag(
        name = "Categories",
        description = "Question categories and the questions filed under them"
)
@RestController
@RequestMapping("/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;
    private final QuestionService questionService;

    @Operation(
            summary = "List categories",
            description = "All categories as an id to label map",
            tags = {"Categories"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Categories returned")
    })
    @GetMapping
    public ResponseEntity<CategoryListResponse> getCategories() {
        return ResponseEntity.ok(categoryService.listCategories());
    }

    @Operation(
            summary = "List questions of a category",
            description = "Page of the questions in the given category, ordered by id",
            tags = {"Categories"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of questions returned"),
            @ApiResponse(responseCode = "404", description = "Category not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{categoryId:\\d+}/questions")
    public ResponseEntity<QuestionListResponse> getQuestionsByCategory(
            @Parameter(description = "Id of the category", required = true)
            @PathVariable Integer categoryId,
            @Parameter(description = "1-based page number; anything non-numeric means page 1")
            @RequestParam(name = "page", required = false) String page
    ) {
        return ResponseEntity.ok(questionService.listQuestionsByCategory(categoryId, Paginator.resolvePage(page)));
    }
}
