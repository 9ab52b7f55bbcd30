package uk.gegc.trivia.shared.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.trivia.shared.exception.ErrorKind;

@Schema(description = "Envelope returned for every failed request")
public record ErrorResponse(
        @Schema(description = "Always false for errors", example = "false")
        boolean success,

        @Schema(description = "HTTP status code", example = "404")
        int error,

        @Schema(description = "Fixed message for the error kind", example = "resource not found")
        String message
) {

    public static ErrorResponse of(ErrorKind kind) {
        return new ErrorResponse(false, kind.getStatus().value(), kind.getMessage());
    }
}
