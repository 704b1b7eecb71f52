package io.rowguard.sql.policy.enforce;

import com.fasterxml.jackson.databind.JsonNode;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;
import io.rowguard.sql.policy.PolicyCheckViolationException;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.Row;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.claims.StaticServiceKeyVerifier;
import io.rowguard.sql.policy.eval.ExpressionEvaluator;
import io.rowguard.sql.policy.recorder.PolicyRecorder;
import io.rowguard.sql.policy.resolve.PolicyResolver;
import io.rowguard.sql.policy.storage.InMemoryTableStore;
import io.rowguard.sql.policy.store.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PolicyEnforcedExecutorTest {

    private PolicyStore policies;
    private InMemoryTableStore store;
    private PolicyEnforcedExecutor executor;

    @BeforeEach
    void setup() throws Exception {
        policies = new PolicyStore();
        store = new InMemoryTableStore();
        executor = new PolicyEnforcedExecutor(store,
                new EnforcementGate(new PolicyResolver(policies), new ExpressionEvaluator()));

        store.createTable("profiles", List.of("id", "name"));
        try (var tx = store.begin()) {
            tx.insert("profiles", Row.of("id", "u1", "name", "Ann"));
            tx.insert("profiles", Row.of("id", "u2", "name", "Bob"));
            tx.commit();
        }
        policies.enableRls("profiles");
        policies.register(Policy.of("public_profiles", "profiles", Operation.SELECT, List.of("*"), sql("true"), null));
        policies.register(Policy.of("own_profile", "profiles", Operation.UPDATE, List.of(), sql("auth.uid() = id"), null));
        policies.register(Policy.of("create_own", "profiles", Operation.INSERT, List.of("authenticated"), null,
                sql("auth.uid() = id")));
    }

    private static JsonNode sql(String filter) {
        return Transformations.compileFilterString(filter);
    }

    private String nameOf(String id) {
        return store.snapshot().rows("profiles").stream()
                .filter(r -> id.equals(r.get("id")))
                .map(r -> (String) r.get("name"))
                .findFirst().orElse(null);
    }

    @Test
    void testEveryoneReadsAllProfiles() {
        assertEquals(2, executor.select("profiles", null, ClaimsContext.anonymous()).size());
        assertEquals(2, executor.select("profiles", null, ClaimsContext.authenticated("u1")).size());
        assertEquals(1, executor.select("profiles", sql("name = 'Bob'"), ClaimsContext.anonymous()).size());
    }

    @Test
    void testUpdateOfForeignRowAffectsNothing() throws Exception {
        var claims = ClaimsContext.authenticated("u1");
        assertEquals(0, executor.update("profiles", sql("id = 'u2'"), Map.of("name", "Mallory"), claims));
        assertEquals("Bob", nameOf("u2"));

        var e = assertThrows(PolicyCheckViolationException.class,
                () -> executor.updateOne("profiles", sql("id = 'u2'"), Map.of("name", "Mallory"), claims));
        assertEquals("profiles", e.getTable());
        assertEquals(Operation.UPDATE, e.getOperation());
        assertEquals("Bob", nameOf("u2"));
    }

    @Test
    void testUpdateOfOwnRowSucceeds() throws Exception {
        executor.updateOne("profiles", sql("id = 'u1'"), Map.of("name", "Anna"), ClaimsContext.authenticated("u1"));
        assertEquals("Anna", nameOf("u1"));
        // without a caller filter only the visible row is touched
        assertEquals(1, executor.update("profiles", null, Map.of("name", "A."), ClaimsContext.authenticated("u1")));
        assertEquals("A.", nameOf("u1"));
        assertEquals("Bob", nameOf("u2"));
    }

    @Test
    void testUpdateViolatingCheckIsRejected() {
        var e = assertThrows(PolicyCheckViolationException.class, () -> executor.update("profiles",
                sql("id = 'u1'"), Map.of("id", "u3"), ClaimsContext.authenticated("u1")));
        assertTrue(e.getMessage().contains("new row violates row-level security policy for table \"profiles\""));
        assertEquals("Ann", nameOf("u1"));
    }

    @Test
    void testUpdateOneMatchingSeveralRows() throws Exception {
        policies.register(Policy.of("admin_update", "profiles", Operation.UPDATE, List.of("admin"), sql("true"), null));
        var admin = ClaimsContext.of("admin", "a1", Map.of());
        assertThrows(IllegalArgumentException.class,
                () -> executor.updateOne("profiles", null, Map.of("name", "x"), admin));
        assertEquals("Ann", nameOf("u1"));
    }

    @Test
    void testInsertChecksEveryRowAtomically() throws Exception {
        var claims = ClaimsContext.authenticated("u3");
        executor.insert("profiles", Row.of("id", "u3", "name", "Cy"), claims);
        assertEquals("Cy", nameOf("u3"));

        assertThrows(PolicyCheckViolationException.class, () -> executor.insertAll("profiles",
                List.of(Row.of("id", "u3", "name", "Cy again"), Row.of("id", "u4", "name", "Dee")), claims));
        assertEquals(3, store.snapshot().rows("profiles").size());
    }

    @Test
    void testInsertFillsMissingColumns() throws Exception {
        executor.insert("profiles", Row.of("id", "u5"), ClaimsContext.authenticated("u5"));
        var inserted = store.snapshot().rows("profiles").get(2);
        assertTrue(inserted.hasColumn("name"));
        assertNull(inserted.get("name"));
    }

    @Test
    void testAnonymousInsertHasNoPolicy() {
        var e = assertThrows(PolicyCheckViolationException.class,
                () -> executor.insert("profiles", Row.of("id", "x"), ClaimsContext.anonymous()));
        assertTrue(e.getMessage().contains("no INSERT policy on table \"profiles\" applies to role anon"));
    }

    @Test
    void testDeleteWithoutPolicyIsRejectedUpFront() {
        assertThrows(PolicyCheckViolationException.class,
                () -> executor.delete("profiles", sql("id = 'u1'"), ClaimsContext.authenticated("u1")));
        assertEquals(2, store.snapshot().rows("profiles").size());
    }

    @Test
    void testDeleteOnlyOwnRows() throws Exception {
        policies.register(Policy.of("delete_own", "profiles", Operation.DELETE, List.of(), sql("auth.uid() = id"), null));
        var claims = ClaimsContext.authenticated("u2");
        assertEquals(1, executor.delete("profiles", null, claims));
        assertNull(nameOf("u2"));
        assertEquals("Ann", nameOf("u1"));
        assertThrows(PolicyCheckViolationException.class, () -> executor.deleteOne("profiles", sql("id = 'u1'"), claims));
    }

    @Test
    void testBypassWritesAnything() throws Exception {
        var service = StaticServiceKeyVerifier.bypass(ClaimsContext.anonymous());
        executor.updateOne("profiles", sql("id = 'u2'"), Map.of("name", "Robert"), service);
        assertEquals("Robert", nameOf("u2"));
        assertEquals(2, executor.delete("profiles", null, service));
    }

    @Test
    void testEvaluationErrorRollsBack() throws Exception {
        policies.register(Policy.of("broken", "profiles", Operation.UPDATE, List.of("editor"),
                sql("cast(case when id = 'u1' then '1' else name end as integer) = 1"), null));
        var editor = ClaimsContext.of("editor", "e1", Map.of());
        // Ann's row passes and is changed first, then Bob's name does not cast
        assertThrows(PredicateEvaluationException.class,
                () -> executor.update("profiles", null, Map.of("name", "Changed"), editor));
        assertEquals("Ann", nameOf("u1"));
        assertEquals("Bob", nameOf("u2"));
    }

    @Test
    void testWriteFilteredCountsOnlyTargetedRows() throws Exception {
        var recorder = mock(PolicyRecorder.class);
        var counted = new PolicyEnforcedExecutor(store,
                new EnforcementGate(new PolicyResolver(policies), new ExpressionEvaluator(), recorder));
        var claims = ClaimsContext.authenticated("u1");

        assertEquals(1, counted.update("profiles", sql("id = 'u1'"), Map.of("name", "Anna"), claims));
        verify(recorder, never()).recordWriteFiltered(anyString(), any());

        assertEquals(0, counted.update("profiles", sql("id = 'u2'"), Map.of("name", "Mallory"), claims));
        verify(recorder, times(1)).recordWriteFiltered("profiles", Operation.UPDATE);

        // no caller filter selects every row, the hidden one included
        assertEquals(1, counted.update("profiles", null, Map.of("name", "A."), claims));
        verify(recorder, times(2)).recordWriteFiltered("profiles", Operation.UPDATE);
    }

    @Test
    void testInsertCheckReadsOtherTables() throws Exception {
        store.createTable("notes", List.of("id", "profile_id"));
        policies.enableRls("notes");
        policies.register(Policy.of("notes_on_existing_profiles", "notes", Operation.INSERT, List.of(), null,
                sql("exists (select 1 from profiles p where p.id = notes.profile_id)")));
        var claims = ClaimsContext.authenticated("u1");
        assertEquals(1, executor.insertAll("notes", List.of(Row.of("id", 1L, "profile_id", "u2")), claims));
        assertThrows(PolicyCheckViolationException.class,
                () -> executor.insert("notes", Row.of("id", 2L, "profile_id", "nobody"), claims));
    }
}
