package io.rowguard.sql.policy.recorder;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rowguard.sql.policy.MutableClock;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.claims.StaticServiceKeyVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class MicroMeterPolicyRecorderTest {

    private MeterRegistry registry;
    private MicroMeterPolicyRecorder recorder;
    private ListAppender<ILoggingEvent> audit;

    @BeforeEach
    void setup() {
        registry = new SimpleMeterRegistry();
        recorder = new MicroMeterPolicyRecorder(registry,
                new MutableClock(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
        audit = new ListAppender<>();
        audit.start();
        ((Logger) LoggerFactory.getLogger(Auditor.AUDIT_LOGGER)).addAppender(audit);
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(Auditor.AUDIT_LOGGER)).detachAppender(audit);
    }

    private Counter counter(String metric, String table) {
        return registry.find("rowguard.policy." + metric + ".count")
                .tag("table", table)
                .counter();
    }

    @Test
    void testResolutionCounters() {
        recorder.recordResolution("documents", Operation.SELECT, false);
        recorder.recordResolution("documents", Operation.SELECT, true);
        recorder.recordResolution("documents", Operation.UPDATE, true);

        assertEquals(1.0, counter("cache_miss", "documents").count());
        assertEquals(2.0, counter("cache_hit", "documents").count());
        assertNull(counter("cache_hit", "profiles"));
    }

    @Test
    void testRowsFiltered() {
        recorder.recordRowsFiltered("documents", 0);
        assertNull(counter("rows_filtered", "documents"));
        recorder.recordRowsFiltered("documents", 3);
        recorder.recordRowsFiltered("documents", 2);
        assertEquals(5.0, counter("rows_filtered", "documents").count());
    }

    @Test
    void testWriteCounters() {
        recorder.recordWriteAllowed("documents", Operation.INSERT);
        recorder.recordWriteFiltered("documents", Operation.UPDATE);
        recorder.recordQueryRewrite("documents");
        recorder.recordBroadcast("messages", true);
        recorder.recordBroadcast("messages", false);

        assertEquals(1.0, counter("write_allowed", "documents").count());
        assertEquals(1.0, counter("write_filtered", "documents").count());
        assertEquals(1.0, counter("query_rewrite", "documents").count());
        assertEquals(1.0, counter("broadcast_delivered", "messages").count());
        assertEquals(1.0, counter("broadcast_suppressed", "messages").count());
        assertTrue(audit.list.isEmpty());
    }

    @Test
    void testRejectedWriteIsAudited() {
        recorder.recordWriteRejected("documents", Operation.INSERT, ClaimsContext.authenticated("u1"), "new row violates");

        assertEquals(1.0, counter("write_rejected", "documents").count());
        assertEquals(1, audit.list.size());
        var line = audit.list.get(0).getFormattedMessage();
        assertTrue(line.contains("\"action\":\"REJECT\""));
        assertTrue(line.contains("\"subject\":\"u1\""));
        assertTrue(line.contains("\"timestamp\":\"2024-05-01T00:00:00Z\""));
    }

    @Test
    void testBypassIsAuditedWithServiceSubject() {
        recorder.recordBypass("documents", Operation.DELETE, StaticServiceKeyVerifier.bypass(ClaimsContext.anonymous()));

        assertEquals(1.0, counter("bypass", "documents").count());
        var line = audit.list.get(0).getFormattedMessage();
        assertTrue(line.contains("\"action\":\"BYPASS\""));
        assertTrue(line.contains("\"subject\":\"test-service\""));
        assertTrue(line.contains(StaticServiceKeyVerifier.class.getName()));
    }

    @Test
    void testEvaluationErrorIsAudited() {
        recorder.recordEvaluationError("documents", Operation.SELECT, ClaimsContext.anonymous(),
                new PredicateEvaluationException("unknown function foo"));

        assertEquals(1.0, counter("evaluation_error", "documents").count());
        assertTrue(audit.list.get(0).getFormattedMessage().contains("PredicateEvaluationException: unknown function foo"));
    }
}
