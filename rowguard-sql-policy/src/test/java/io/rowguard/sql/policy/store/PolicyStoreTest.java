package io.rowguard.sql.policy.store;

import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.DuplicatePolicyNameException;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;
import io.rowguard.sql.policy.PolicyNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyStoreTest {

    private PolicyStore store;

    @BeforeEach
    void setup() {
        store = new PolicyStore();
    }

    private static Policy policy(String name, Operation operation) {
        return Policy.of(name, "profiles", operation, Transformations.compileFilterString("auth.uid() = id"));
    }

    @Test
    void testUnregisteredTableHasRlsDisabled() {
        assertFalse(store.isRlsEnabled("profiles"));
        assertTrue(store.policiesFor("profiles", Operation.SELECT).isEmpty());
    }

    @Test
    void testRegisterAndDrop() throws Exception {
        store.register(policy("own", Operation.SELECT));
        store.register(policy("all", Operation.ALL));
        store.register(policy("del", Operation.DELETE));

        assertEquals(List.of("own", "all"), names(store.policiesFor("profiles", Operation.SELECT)));
        assertEquals(List.of("all", "del"), names(store.policiesFor("profiles", Operation.DELETE)));

        var dropped = store.drop("profiles", "all");
        assertEquals("all", dropped.name());
        assertEquals(List.of("own"), names(store.policiesFor("profiles", Operation.SELECT)));
    }

    @Test
    void testDuplicateName() throws Exception {
        store.register(policy("own", Operation.SELECT));
        var e = assertThrows(DuplicatePolicyNameException.class, () -> store.register(policy("own", Operation.UPDATE)));
        assertEquals("own", e.getPolicyName());
        assertEquals(1, store.state("profiles").policies().size());
    }

    @Test
    void testDropUnknown() {
        var e = assertThrows(PolicyNotFoundException.class, () -> store.drop("profiles", "missing"));
        assertEquals("profiles", e.getTable());
    }

    @Test
    void testRlsFlagKeepsPolicies() throws Exception {
        store.register(policy("own", Operation.SELECT));
        store.enableRls("profiles");
        assertTrue(store.isRlsEnabled("profiles"));
        store.disableRls("profiles");
        assertFalse(store.isRlsEnabled("profiles"));
        assertEquals(1, store.policiesFor("profiles", Operation.SELECT).size());
    }

    @Test
    void testEveryChangeNotifiesWithNewGeneration() throws Exception {
        var states = new ArrayList<TableSecurityState>();
        store.addListener(states::add);
        store.enableRls("profiles");
        store.register(policy("own", Operation.SELECT));
        store.drop("profiles", "own");

        assertEquals(3, states.size());
        assertTrue(states.get(0).generation() < states.get(1).generation());
        assertTrue(states.get(1).generation() < states.get(2).generation());
        assertEquals(states.get(2), store.state("profiles"));
    }

    @Test
    void testConcurrentRegistration() throws Exception {
        var executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            var name = "p" + i;
            executor.submit(() -> {
                store.register(policy(name, Operation.SELECT));
                return null;
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(100, store.policiesFor("profiles", Operation.SELECT).size());
    }

    private static List<String> names(List<Policy> policies) {
        return policies.stream().map(Policy::name).toList();
    }
}
