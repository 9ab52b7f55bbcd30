package uk.gegc.trivia.shared.api.advice;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;
import uk.gegc.trivia.shared.exception.ErrorKind;
import uk.gegc.trivia.shared.exception.TriviaApiException;

import java.util.Optional;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TriviaApiException.class)
    public ResponseEntity<ErrorResponse> handleTriviaApiException(TriviaApiException ex, HttpServletRequest request) {
        ErrorKind kind = ex.getKind();
        logger.debug("{} {} -> {}: {}", request.getMethod(), request.getRequestURI(), kind, ex.getMessage());
        return ResponseEntity.status(kind.getStatus()).body(ErrorResponse.of(kind));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex, HttpServletRequest request) {
        logger.error("Unhandled exception on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorKind.INTERNAL_ERROR));
    }

    /**
     * Framework-level failures (unreadable body, type mismatch, unknown route, unsupported method)
     * reuse the same envelope as the application errors. Only syntactically broken JSON stays a
     * 400: a well-formed body with wrongly typed fields is unprocessable, and a path id that does
     * not fit an integer names nothing that exists.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex,
            Object body,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode,
            @NonNull WebRequest request
    ) {
        Optional<ErrorKind> reclassified = reclassify(ex, request);
        HttpStatusCode status = reclassified.<HttpStatusCode>map(ErrorKind::getStatus).orElse(statusCode);
        ErrorResponse error = reclassified.or(() -> ErrorKind.forStatus(statusCode.value()))
                .map(ErrorResponse::of)
                .orElseGet(() -> new ErrorResponse(false, statusCode.value(), reasonPhrase(statusCode)));
        logger.debug("Request {} rejected with {}: {}", request.getDescription(false), status.value(), ex.getMessage());
        return ResponseEntity.status(status).headers(headers).body(error);
    }

    private static Optional<ErrorKind> reclassify(Exception ex, WebRequest request) {
        if (ex instanceof HttpMessageNotReadableException && ex.getCause() instanceof MismatchedInputException) {
            return Optional.of(ErrorKind.UNPROCESSABLE);
        }
        if (ex instanceof MethodArgumentTypeMismatchException mismatch
                && mismatch.getParameter().hasParameterAnnotation(PathVariable.class)) {
            // a missing question on delete is reported as unprocessable
            return Optional.of(isDelete(request) ? ErrorKind.UNPROCESSABLE : ErrorKind.NOT_FOUND);
        }
        return Optional.empty();
    }

    private static boolean isDelete(WebRequest request) {
        return request instanceof ServletWebRequest servletRequest
                && HttpMethod.DELETE.equals(servletRequest.getHttpMethod());
    }

    private static String reasonPhrase(HttpStatusCode statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        return status != null ? status.getReasonPhrase().toLowerCase() : "error";
    }
}
