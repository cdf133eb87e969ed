package at.totenbilder.search.common.convention.result;

import at.totenbilder.search.common.convention.errorcode.IErrorCode;
import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.AbstractException;

import java.util.Optional;

/**
 * Factory methods for {@link Result}
 */
public final class Results {

    private Results() {
    }

    public static <T> Result<T> success(T data) {
        return new Result<T>()
                .setCode(Result.SUCCESS_CODE)
                .setMessage(SearchErrorCode.SUCCESS.message())
                .setData(data);
    }

    /**
     * Failure built from a business exception
     */
    public static Result<Void> failure(AbstractException exception) {
        return new Result<Void>()
                .setCode(Optional.ofNullable(exception.getErrorCode())
                        .orElse(SearchErrorCode.SERVICE_ERROR.code()))
                .setMessage(Optional.ofNullable(exception.getErrorMessage())
                        .orElse(SearchErrorCode.SERVICE_ERROR.message()));
    }

    public static Result<Void> failure(String errorCode, String errorMessage) {
        return new Result<Void>()
                .setCode(errorCode)
                .setMessage(errorMessage);
    }

    public static Result<Void> failure(IErrorCode errorCode) {
        return new Result<Void>()
                .setCode(errorCode.code())
                .setMessage(errorCode.message());
    }
}
