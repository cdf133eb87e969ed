package at.totenbilder.search.common.convention.exception;

import at.totenbilder.search.common.convention.errorcode.IErrorCode;
import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;

import java.util.Optional;

/**
 * Server side error: unavailable dependencies, store or model failures.
 */
public class ServiceException extends AbstractException {

    public ServiceException(String message) {
        this(message, null, SearchErrorCode.SERVICE_ERROR);
    }

    public ServiceException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * @param message custom message
     * @param throwable cause
     * @param errorCode error code
     */
    public ServiceException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
