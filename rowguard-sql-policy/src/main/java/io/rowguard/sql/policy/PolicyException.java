package io.rowguard.sql.policy;

/**
 * Expected outcome of a policy operation: administrative mistakes and "not authorized" writes.
 * Callers branch on this type to tell a denial apart from a system error
 * ({@link PolicyEvaluationException}).
 */
public class PolicyException extends Exception {

    public PolicyException(String message) {
        super(message);
    }

    public PolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
