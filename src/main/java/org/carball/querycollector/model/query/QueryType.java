package org.carball.querycollector.model.query;

/**
 * Statement classification derived from the leading keyword of the SQL text.
 */
public enum QueryType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE,
    DROP,
    ALTER,
    OTHER
}
