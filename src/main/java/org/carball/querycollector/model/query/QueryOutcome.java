package org.carball.querycollector.model.query;

import java.util.Objects;

/**
 * Outcome of a wrapped statement execution: either it returned, or it raised.
 */
public interface QueryOutcome {

    QueryStatus status();

    static QueryOutcome success() {
        return Success.INSTANCE;
    }

    static QueryOutcome failure(Throwable error) {
        return new Failure(error);
    }

    /**
     * The statement returned normally. The result itself is handed back to the caller, not kept.
     */
    record Success() implements QueryOutcome {
        private static final Success INSTANCE = new Success();

        @Override
        public QueryStatus status() {
            return QueryStatus.OK;
        }
    }

    /**
     * The statement raised {@code error}; the same instance was rethrown to the caller.
     */
    record Failure(Throwable error) implements QueryOutcome {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public QueryStatus status() {
            return QueryStatus.ERROR;
        }
    }
}
