package io.rowguard.sql.policy.claims;

import io.rowguard.sql.policy.PolicyException;

public class InvalidServiceKeyException extends PolicyException {

    public InvalidServiceKeyException() {
        super("invalid service key");
    }
}
