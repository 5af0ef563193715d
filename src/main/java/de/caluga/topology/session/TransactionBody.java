package de.caluga.topology.session;

import de.caluga.topology.driver.DriverException;

/**
 * callback run inside {@link ClientSession#withTransaction(TransactionBody, TransactionOptions)}. It may
 * be called more than once.
 */
@FunctionalInterface
public interface TransactionBody<T> {
    T execute(ClientSession session) throws DriverException;
}
