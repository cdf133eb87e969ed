package at.totenbilder.search.common.convention.errorcode;

/**
 * Error code contract. Every error code enum implements this interface.
 */
public interface IErrorCode {

    /**
     * Stable error code
     */
    String code();

    /**
     * Default error message
     */
    String message();
}
