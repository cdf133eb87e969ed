package at.totenbilder.search.common.support;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ServiceException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;

/**
 * One shared, lazily created client of an external dependency.
 *
 * <p>The factory runs at most once, either on first use or from the startup warm-up.
 * A failed initialisation is remembered: the dependency then stays unavailable and every
 * {@link #get()} fails fast with {@link SearchErrorCode#DEPENDENCY_UNAVAILABLE}.</p>
 *
 * @param <T> client type
 */
@Slf4j
public class LazyDependency<T> {

    public enum State {
        PENDING,
        READY,
        UNAVAILABLE
    }

    private final String name;
    private final Callable<T> factory;

    private volatile State state = State.PENDING;
    private volatile T instance;
    private volatile String failureMessage;

    public LazyDependency(String name, Callable<T> factory) {
        this.name = name;
        this.factory = factory;
    }

    /**
     * Returns the client, initialising it on first call.
     *
     * @throws ServiceException when the dependency could not be initialised
     */
    public T get() {
        initializeOnce();
        if (state != State.READY) {
            throw new ServiceException(name + " unavailable: " + failureMessage,
                SearchErrorCode.DEPENDENCY_UNAVAILABLE);
        }
        return instance;
    }

    /**
     * Initialises the dependency if it has not been tried yet and reports whether it is usable.
     */
    public boolean isAvailable() {
        initializeOnce();
        return state == State.READY;
    }

    /**
     * Same as {@link #isAvailable()}, meant for the background warm-up
     */
    public void warmUp() {
        if (isAvailable()) {
            log.info("Dependency ready: {}", name);
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Current state without triggering initialisation
     */
    public State getState() {
        return state;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    private void initializeOnce() {
        if (state != State.PENDING) {
            return;
        }
        synchronized (this) {
            if (state != State.PENDING) {
                return;
            }
            try {
                T created = factory.call();
                if (created == null) {
                    throw new IllegalStateException("factory returned no client");
                }
                instance = created;
                state = State.READY;
            } catch (Exception e) {
                failureMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                state = State.UNAVAILABLE;
                log.error("Dependency {} failed to initialise: {}", name, failureMessage, e);
            }
        }
    }
}
