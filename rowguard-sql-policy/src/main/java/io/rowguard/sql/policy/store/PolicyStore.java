package io.rowguard.sql.policy.store;

import io.rowguard.sql.policy.DuplicatePolicyNameException;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;
import io.rowguard.sql.policy.PolicyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Policies and the {@code rls_enabled} flag per table.
 *
 * <p>Administrative changes take the write lock and serialize against each other and against
 * in-flight reads; reads share the read lock. Every change bumps the table's generation and is
 * reported to the registered {@link PolicyChangeListener}s before the write lock is released.
 *
 * <p>A table that was never registered is reported with RLS disabled.
 */
public class PolicyStore {

    private static final Logger logger = LoggerFactory.getLogger(PolicyStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, TableSecurityState> tables = new HashMap<>();
    private final List<PolicyChangeListener> listeners = new CopyOnWriteArrayList<>();
    private long generation = 0;

    public void addListener(PolicyChangeListener listener) {
        listeners.add(listener);
    }

    public void register(Policy policy) throws DuplicatePolicyNameException {
        lock.writeLock().lock();
        try {
            var current = stateUnlocked(policy.table());
            if (current.policy(policy.name()) != null) {
                throw new DuplicatePolicyNameException(policy.table(), policy.name());
            }
            var policies = new ArrayList<>(current.policies());
            policies.add(policy);
            update(policy.table(), s -> new TableSecurityState(s.table(), s.rlsEnabled(), policies, 0));
            logger.atInfo().log("Registered policy {} on {} for {}", policy.name(), policy.table(), policy.operation());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Policy drop(String table, String name) throws PolicyNotFoundException {
        lock.writeLock().lock();
        try {
            var current = stateUnlocked(table);
            var existing = current.policy(name);
            if (existing == null) {
                throw new PolicyNotFoundException(table, name);
            }
            var policies = new ArrayList<>(current.policies());
            policies.remove(existing);
            update(table, s -> new TableSecurityState(s.table(), s.rlsEnabled(), policies, 0));
            logger.atInfo().log("Dropped policy {} on {}", name, table);
            return existing;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void enableRls(String table) {
        setRlsEnabled(table, true);
    }

    public void disableRls(String table) {
        setRlsEnabled(table, false);
    }

    public boolean isRlsEnabled(String table) {
        return state(table).rlsEnabled();
    }

    /**
     * Policies of kind {@code operation} or ALL, in registration order.
     */
    public List<Policy> policiesFor(String table, Operation operation) {
        return state(table).policiesFor(operation);
    }

    public TableSecurityState state(String table) {
        lock.readLock().lock();
        try {
            return stateUnlocked(table);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TableSecurityState> states() {
        lock.readLock().lock();
        try {
            return List.copyOf(tables.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void setRlsEnabled(String table, boolean enabled) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Table cannot be null or empty");
        }
        lock.writeLock().lock();
        try {
            update(table, s -> new TableSecurityState(s.table(), enabled, s.policies(), 0));
            logger.atInfo().log("Row level security {} on {}", enabled ? "enabled" : "disabled", table);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void update(String table, Function<TableSecurityState, TableSecurityState> change) {
        var changed = change.apply(stateUnlocked(table));
        var next = new TableSecurityState(table, changed.rlsEnabled(), changed.policies(), ++generation);
        tables.put(table, next);
        for (var l : listeners) {
            l.onChange(next);
        }
    }

    private TableSecurityState stateUnlocked(String table) {
        var state = tables.get(table);
        return state != null ? state : TableSecurityState.unregistered(table);
    }
}
