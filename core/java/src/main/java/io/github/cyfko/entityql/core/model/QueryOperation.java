package io.github.cyfko.entityql.core.model;

/**
 * Execution entry points of the engine, used to tag failures and log lines.
 */
public enum QueryOperation {
    FIND_ALL,
    FIND_ONE,
    FIND_BY_ID,
    COUNT_ALL
}
