package uk.gegc.trivia.shared.exception;

/**
 * Raised when a request is well-formed but cannot be carried out: missing required
 * fields, a lookup that came back empty during a write, or a store failure.
 */
public class UnprocessableEntityException extends TriviaApiException {

    public UnprocessableEntityException(String message) {
        super(ErrorKind.UNPROCESSABLE, message);
    }

    public UnprocessableEntityException(String message, Throwable cause) {
        super(ErrorKind.UNPROCESSABLE, message, cause);
    }
}
