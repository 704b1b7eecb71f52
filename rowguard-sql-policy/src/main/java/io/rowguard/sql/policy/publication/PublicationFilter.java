package io.rowguard.sql.policy.publication;

import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.enforce.EnforcementGate;
import io.rowguard.sql.policy.recorder.NOOPPolicyRecorder;
import io.rowguard.sql.policy.recorder.PolicyRecorder;
import io.rowguard.sql.policy.storage.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which subscribers receive a change: exactly those whose SELECT would return the changed row.
 * Sub-queries in the policy read the store's current committed contents.
 */
public class PublicationFilter {

    private static final Logger logger = LoggerFactory.getLogger(PublicationFilter.class);

    private final EnforcementGate gate;
    private final TableStore store;
    private final PolicyRecorder recorder;

    public PublicationFilter(EnforcementGate gate, TableStore store) {
        this(gate, store, NOOPPolicyRecorder.INSTANCE);
    }

    public PublicationFilter(EnforcementGate gate, TableStore store, PolicyRecorder recorder) {
        this.gate = gate;
        this.store = store;
        this.recorder = recorder;
    }

    /**
     * @param table table the subscription is on; must be the event's table
     */
    public boolean shouldBroadcast(ChangeEvent event, String table, ClaimsContext subscriber) {
        if (!event.table().equals(table)) {
            throw new IllegalArgumentException("Event on " + event.table() + " offered to subscription on " + table);
        }
        var delivered = gate.isVisible(table, event.subject(), subscriber, store.snapshot());
        recorder.recordBroadcast(table, delivered);
        logger.atDebug().log("{} on {} {} to {}", event.type(), table, delivered ? "delivered" : "suppressed", subscriber);
        return delivered;
    }

    /**
     * Subscribers, in the given order, that receive {@code event}.
     */
    public List<ClaimsContext> recipients(ChangeEvent event, List<ClaimsContext> subscribers) {
        var result = new ArrayList<ClaimsContext>();
        for (var s : subscribers) {
            if (shouldBroadcast(event, event.table(), s)) {
                result.add(s);
            }
        }
        return result;
    }
}
