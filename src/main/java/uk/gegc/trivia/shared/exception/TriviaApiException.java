package uk.gegc.trivia.shared.exception;

import lombok.Getter;

/**
 * Base type for failures that map onto one of the {@link ErrorKind}s.
 */
@Getter
public abstract class TriviaApiException extends RuntimeException {

    private final ErrorKind kind;

    protected TriviaApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TriviaApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
