package com.coderenew.core.resilience;

/**
 * A blocking call to an external dependency.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ServiceCall<T> {

    /**
     * Performs the call.
     *
     * @return call result
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    T call() throws InterruptedException;
}
