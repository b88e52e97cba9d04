package org.carball.querycollector.jdbc;

/**
 * Context handed to the collector for each JDBC execution: the {@code Statement} method that ran it.
 */
public record JdbcExecutionContext(String methodName) {
}
