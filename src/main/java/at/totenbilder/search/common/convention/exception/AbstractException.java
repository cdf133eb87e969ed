package at.totenbilder.search.common.convention.exception;

import at.totenbilder.search.common.convention.errorcode.IErrorCode;
import lombok.Getter;

import java.util.Optional;

/**
 * Base class of all business exceptions
 */
@Getter
public abstract class AbstractException extends RuntimeException {

    /**
     * Error code
     */
    private final String errorCode;

    /**
     * Error message
     */
    private final String errorMessage;

    /**
     * @param message custom message, falls back to {@code errorCode.message()} when null
     * @param throwable cause
     * @param errorCode error code
     */
    protected AbstractException(String message, Throwable throwable, IErrorCode errorCode) {
        super(message, throwable);
        this.errorCode = errorCode.code();
        this.errorMessage = Optional.ofNullable(message).orElse(errorCode.message());
    }
}
