package org.carball.querycollector.collector;

import java.util.List;

/**
 * The next step in a host driver's statement-execution chain.
 *
 * <p>Adapters for a particular driver or ORM supply an implementation that actually runs the statement.
 * {@code context} is whatever the host passes along with each call; the collector forwards it untouched.
 *
 * @param <C> host-specific execution context
 * @param <R> execution result
 */
@FunctionalInterface
public interface StatementExecutor<C, R> {

    R execute(String sql, List<?> params, boolean batch, C context) throws Exception;
}
