package io.rowguard.sql.policy;

/**
 * A predicate could not be evaluated. Aborts the enclosing operation; never downgraded to a deny.
 */
public class PolicyEvaluationException extends RuntimeException {

    public PolicyEvaluationException(String message) {
        super(message);
    }

    public PolicyEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
