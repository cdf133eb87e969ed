package at.totenbilder.search.common.convention.exception;

import at.totenbilder.search.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * Error caused by the request: invalid or conflicting parameters, wrong API key,
 * references to images that do not exist.
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
