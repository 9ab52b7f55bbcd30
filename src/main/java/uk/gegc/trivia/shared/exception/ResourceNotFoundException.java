package uk.gegc.trivia.shared.exception;

public class ResourceNotFoundException extends TriviaApiException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
