package org.carball.tempo.executor;

/**
 * Deferred unit of database work supplied by the caller.
 */
@FunctionalInterface
public interface QueryWork<T> {

    T execute() throws Exception;
}
