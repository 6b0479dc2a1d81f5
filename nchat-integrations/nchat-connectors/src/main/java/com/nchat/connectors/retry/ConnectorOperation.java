package com.nchat.connectors.retry;

/**
 * A provider call executed under
 * {@link com.nchat.connectors.core.ResilientConnector#withRetry(ConnectorOperation, String)}.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface ConnectorOperation<R> {

    R call() throws Exception;
}
