package io.rowguard.sql.policy.enforce;

import io.rowguard.sql.commons.ConnectionPool;
import io.rowguard.sql.commons.ExpressionFactory;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.eval.ExpressionEvaluator;
import io.rowguard.sql.policy.eval.Interval;
import io.rowguard.sql.policy.resolve.PolicyResolver;
import io.rowguard.sql.policy.store.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ClaimsBinderTest {

    private PolicyStore policies;
    private ExpressionEvaluator evaluator;
    private ClaimsBinder binder;

    @BeforeEach
    void setup() {
        policies = new PolicyStore();
        evaluator = new ExpressionEvaluator();
        binder = new ClaimsBinder(evaluator, new PolicyResolver(policies));
    }

    /**
     * Runs {@code sql} in DuckDB with the column {@code bound} replaced by the literal for {@code value}.
     */
    private static Boolean withLiteral(String sql, Object value) throws Exception {
        var tree = Transformations.parseToTree(sql);
        var replaced = Transformations.transform(tree,
                n -> Transformations.IS_REFERENCE.apply(n) && "bound".equals(Transformations.getReferenceName(n)[0]),
                n -> ClaimsBinder.literal(value));
        return ConnectionPool.collectFirst(Transformations.parseToSql(replaced), Boolean.class);
    }

    @Test
    void testLiteralsRoundTripThroughDuckDB() throws Exception {
        assertTrue(withLiteral("select bound = 42", 42L));
        assertTrue(withLiteral("select bound = 'o''brien'", "o'brien"));
        assertTrue(withLiteral("select bound = 1.5", new BigDecimal("1.5")));
        assertTrue(withLiteral("select bound = date '2024-01-15'", LocalDate.parse("2024-01-15")));
        assertTrue(withLiteral("select bound = timestamptz '2024-01-15 10:00:00+00'", Instant.parse("2024-01-15T10:00:00Z")));
        assertTrue(withLiteral("select bound = interval '26 hours'", Interval.parse("1 day 2 hours")));
        assertTrue(withLiteral("select list_contains(bound, 20)", List.of(10L, 20L)));
        assertTrue(withLiteral("select bound is null", null));
    }

    @Test
    void testMapBindsAsJsonText() {
        var literal = ClaimsBinder.literal(Map.of("k", "v"));
        assertEquals("{\"k\":\"v\"}", literal.get("value").get("value").asText());
    }

    @Test
    void testUnsupportedLiteral() {
        assertThrows(PredicateEvaluationException.class, () -> ClaimsBinder.literal(new Object()));
    }

    @Test
    void testBindReplacesClaimCalls() {
        var predicate = Transformations.compileFilterString("auth.uid() = owner_id and auth.role() = 'authenticated'");
        var context = evaluator.rootContext(ClaimsContext.authenticated("u1"), null, null);
        var bound = binder.bind(predicate, context);
        assertTrue(Transformations.collectFunction(bound, "uid").isEmpty());
        assertFalse(Transformations.collectFunction(predicate, "uid").isEmpty());
        assertEquals(1, Transformations.collectReferences(bound).size());
    }

    @Test
    void testNowIsLeftForDuckDB() {
        var predicate = Transformations.compileFilterString("created_at > now() - interval '1 day'");
        var bound = binder.bind(predicate, evaluator.rootContext(ClaimsContext.anonymous(), null, null));
        assertEquals(predicate, bound);
    }

    @Test
    void testTableFilterOfUnrestrictedTableIsNull() throws Exception {
        var context = evaluator.rootContext(ClaimsContext.anonymous(), null, null);
        assertNull(binder.tableFilter("anything", context));
        policies.enableRls("anything");
        policies.register(Policy.of("mine", "anything", Operation.SELECT,
                Transformations.compileFilterString("owner = auth.uid()")));
        var filter = binder.tableFilter("anything", evaluator.rootContext(ClaimsContext.authenticated("u9"), null, null));
        assertNotNull(filter);
        assertTrue(Transformations.collectFunction(filter, "uid").isEmpty());
    }

    @Test
    void testBindSelectRejectsNonSelect() {
        var node = ExpressionFactory.constant(1);
        assertThrows(PredicateEvaluationException.class,
                () -> binder.bindSelect(node, evaluator.rootContext(ClaimsContext.anonymous(), null, null)));
    }
}
