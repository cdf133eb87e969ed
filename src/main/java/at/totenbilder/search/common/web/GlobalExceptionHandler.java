package at.totenbilder.search.common.web;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.AbstractException;
import at.totenbilder.search.common.convention.result.Result;
import at.totenbilder.search.common.convention.result.Results;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Turns exceptions thrown by controllers into {@link Result} failures
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Bean Validation failures
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public Result<Void> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null
                ? firstError.getField() + ": " + firstError.getDefaultMessage()
                : SearchErrorCode.PARAM_INVALID.message();

        log.error("[{}] {} - validation failed: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                errorMessage);

        return Results.failure(SearchErrorCode.PARAM_INVALID.code(), errorMessage);
    }

    /**
     * Missing, unparsable or mistyped request parameters
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public Result<Void> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.error("[{}] {} - bad request: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getMessage());

        return Results.failure(SearchErrorCode.PARAM_INVALID);
    }

    /**
     * ClientException / ServiceException
     */
    @ExceptionHandler(AbstractException.class)
    public Result<Void> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        if (ex.getCause() != null) {
            log.error("[{}] {} - {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode(),
                    ex);
        } else {
            log.error("[{}] {} - {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode());
        }

        return Results.failure(ex);
    }

    /**
     * Anything else. Internal details are not exposed.
     */
    @ExceptionHandler(Throwable.class)
    public Result<Void> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - unhandled error",
                request.getMethod(),
                getFullRequestUrl(request),
                throwable);

        return Results.failure(SearchErrorCode.SERVICE_ERROR);
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() +
                (queryString != null ? "?" + queryString : "");
    }
}
