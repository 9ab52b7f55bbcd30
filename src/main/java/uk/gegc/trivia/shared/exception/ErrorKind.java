package uk.gegc.trivia.shared.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of failures the API reports. Each kind has a fixed HTTP status and a fixed
 * client-facing message; the detail of the underlying exception is never exposed.
 */
@Getter
public enum ErrorKind {

    BAD_REQUEST(HttpStatus.BAD_REQUEST, "bad request"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "resource not found"),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "method not allowed"),
    UNPROCESSABLE(HttpStatus.UNPROCESSABLE_ENTITY, "unprocessable"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "internal server error");

    private final HttpStatus status;
    private final String message;

    ErrorKind(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public static Optional<ErrorKind> forStatus(int statusCode) {
        return Arrays.stream(values())
                .filter(kind -> kind.status.value() == statusCode)
                .findFirst();
    }
}
