package io.rowguard.sql.policy;

/**
 * Malformed or unevaluable predicate: unknown function, unsupported node, missing column or type mismatch.
 */
public class PredicateEvaluationException extends PolicyEvaluationException {

    public PredicateEvaluationException(String message) {
        super(message);
    }

    public PredicateEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
