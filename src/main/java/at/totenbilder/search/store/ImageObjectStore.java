package at.totenbilder.search.store;

/**
 * Object store holding the image bytes
 */
public interface ImageObjectStore {

    /**
     * Whether the store client could be initialised. Initialises it on first call.
     */
    boolean isAvailable();

    /**
     * All object keys under the prefix. The listing is paginated lazily while iterating.
     */
    Iterable<String> listKeys(String prefix);

    /**
     * Whole object body.
     *
     * @throws at.totenbilder.search.common.convention.exception.ClientException IMAGE_NOT_FOUND if the key does not exist
     * @throws at.totenbilder.search.common.convention.exception.ServiceException on any other store failure
     */
    byte[] fetch(String key);
}
