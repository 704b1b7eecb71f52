package io.rowguard.sql.policy.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.MutableClock;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.PolicyCheckViolationException;
import io.rowguard.sql.policy.Row;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.claims.InvalidServiceKeyException;
import io.rowguard.sql.policy.claims.JwtServiceKeyVerifier;
import io.rowguard.sql.policy.claims.StaticServiceKeyVerifier;
import io.rowguard.sql.policy.eval.QueryDefinerFunction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyEngineFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static Config config(String rowguard) {
        return ConfigFactory.parseString("rowguard { " + rowguard + " }")
                .withFallback(ConfigFactory.load())
                .getConfig("rowguard");
    }

    private static final String SCENARIO = """
            max_recursion_depth = 4
            service_key_verifier { class = "io.rowguard.sql.policy.claims.StaticServiceKeyVerifier", key = "s3cret" }
            tables = [
              { name = profiles, columns = [id, name] }
              { name = stories, columns = [id, created_at] }
            ]
            policies = [
              { name = profiles_visible, table = profiles, operation = SELECT, roles = ["*"], using = "true" }
              { name = own_profile, table = profiles, operation = UPDATE, using = "auth.uid() = id" }
              { name = recent_stories, table = stories, operation = SELECT, using = "created_at > now() - interval '1 day'" }
            ]
            """;

    @Test
    void testDefaults() throws Exception {
        var engine = PolicyEngineFactory.createFromConfig(config(""));
        assertEquals(8, engine.evaluator().maxDepth());
        assertInstanceOf(JwtServiceKeyVerifier.class, engine.serviceKeyVerifier());
        assertTrue(engine.policyStore().states().isEmpty());
        assertSame(engine.gate(), engine.gate());
    }

    @Test
    void testProfilesScenario() throws Exception {
        var engine = PolicyEngineFactory.createFromConfig(config(SCENARIO));
        try (var tx = engine.tableStore().begin()) {
            tx.insert("profiles", Row.of("id", "u1", "name", "Ann"));
            tx.insert("profiles", Row.of("id", "u2", "name", "Bob"));
            tx.commit();
        }
        var executor = engine.executor();
        assertEquals(2, executor.select("profiles", null, ClaimsContext.anonymous()).size());
        assertEquals(2, executor.select("profiles", null, ClaimsContext.of("editor", "e1", Map.of())).size());

        var u1 = ClaimsContext.authenticated("u1");
        var otherRow = Transformations.compileFilterString("id = 'u2'");
        assertEquals(0, executor.update("profiles", otherRow, Map.of("name", "x"), u1));
        assertThrows(PolicyCheckViolationException.class,
                () -> executor.updateOne("profiles", otherRow, Map.of("name", "x"), u1));
        executor.updateOne("profiles", Transformations.compileFilterString("id = 'u1'"), Map.of("name", "Anna"), u1);
        assertEquals(1, executor.select("profiles", Transformations.compileFilterString("name = 'Anna'"), u1).size());
    }

    @Test
    void testStoriesScenario() throws Exception {
        var clock = new MutableClock(NOW, ZoneOffset.UTC);
        var engine = PolicyEngineFactory.builder(config(SCENARIO)).withClock(clock).build();
        try (var tx = engine.tableStore().begin()) {
            tx.insert("stories", Row.of("id", 1L, "created_at", NOW.minus(Duration.ofHours(25))));
            tx.insert("stories", Row.of("id", 2L, "created_at", NOW.minus(Duration.ofHours(1))));
            tx.commit();
        }
        for (var claims : List.of(ClaimsContext.anonymous(), ClaimsContext.authenticated("u1"),
                ClaimsContext.of("admin", "a1", Map.of()))) {
            var rows = engine.executor().select("stories", null, claims);
            assertEquals(List.of(2L), rows.stream().map(r -> r.get("id")).toList());
        }
    }

    @Test
    void testServiceKeyBypass() throws Exception {
        var engine = PolicyEngineFactory.createFromConfig(config(SCENARIO));
        assertInstanceOf(StaticServiceKeyVerifier.class, engine.serviceKeyVerifier());
        assertThrows(InvalidServiceKeyException.class,
                () -> engine.withServiceKey(ClaimsContext.anonymous(), "guess"));

        var service = engine.withServiceKey(ClaimsContext.anonymous(), "s3cret");
        assertTrue(service.hasBypass());
        try (var tx = engine.tableStore().begin()) {
            tx.insert("profiles", Row.of("id", "u1", "name", "Ann"));
            tx.commit();
        }
        engine.executor().updateOne("profiles", null, Map.of("name", "Service"), service);
        assertEquals("Service", engine.tableStore().snapshot().rows("profiles").get(0).get("name"));
    }

    @Test
    void testBuilderOverrides() throws Exception {
        var registry = new SimpleMeterRegistry();
        var engine = PolicyEngineFactory.builder(config(SCENARIO))
                .withMeterRegistry(registry)
                .withMaxRecursionDepth(2)
                .withServiceKeyVerifier(new StaticServiceKeyVerifier("other"))
                .withDefinerFunction(QueryDefinerFunction.fromSql("private.profile_ids", List.of(),
                        "select id from profiles", QueryDefinerFunction.Result.LIST))
                .build();
        assertEquals(2, engine.evaluator().maxDepth());
        assertTrue(engine.evaluator().definer("private.profile_ids").isPresent());
        assertTrue(engine.withServiceKey(ClaimsContext.anonymous(), "other").hasBypass());

        engine.executor().select("profiles", null, ClaimsContext.anonymous());
        engine.executor().select("profiles", null, ClaimsContext.anonymous());
        assertEquals(1.0, registry.find("rowguard.policy.cache_miss.count").tag("table", "profiles").counter().count());
        assertEquals(1.0, registry.find("rowguard.policy.cache_hit.count").tag("table", "profiles").counter().count());
    }

    @Test
    void testPoliciesAreLiveAfterBuild() throws Exception {
        var engine = PolicyEngineFactory.createFromConfig(config(SCENARIO));
        try (var tx = engine.tableStore().begin()) {
            tx.insert("profiles", Row.of("id", "u1", "name", "Ann"));
            tx.commit();
        }
        assertEquals(1, engine.executor().select("profiles", null, ClaimsContext.anonymous()).size());
        engine.policyStore().drop("profiles", "profiles_visible");
        assertEquals(0, engine.executor().select("profiles", null, ClaimsContext.anonymous()).size());
        engine.policyStore().disableRls("profiles");
        assertEquals(1, engine.executor().select("profiles", null, ClaimsContext.anonymous()).size());
        assertTrue(engine.resolver().resolve("profiles", Operation.DELETE, ClaimsContext.anonymous()).unrestricted());
    }
}
