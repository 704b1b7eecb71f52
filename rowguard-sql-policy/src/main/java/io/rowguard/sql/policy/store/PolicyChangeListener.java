package io.rowguard.sql.policy.store;

/**
 * Notified synchronously, while the store's write lock is held, after a table's policies or
 * RLS flag changed. Implementations must be quick and must not call back into the store's write methods.
 */
@FunctionalInterface
public interface PolicyChangeListener {
    void onChange(TableSecurityState newState);
}
