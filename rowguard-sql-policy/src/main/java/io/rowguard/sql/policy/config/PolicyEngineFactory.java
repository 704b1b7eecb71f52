package io.rowguard.sql.policy.config;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.rowguard.sql.commons.config.ConfigBasedProvider;
import io.rowguard.sql.policy.claims.AbstractServiceKeyVerifier;
import io.rowguard.sql.policy.claims.JwtServiceKeyVerifier;
import io.rowguard.sql.policy.claims.ServiceKeyVerifier;
import io.rowguard.sql.policy.enforce.EnforcementGate;
import io.rowguard.sql.policy.eval.DefinerFunction;
import io.rowguard.sql.policy.eval.ExpressionEvaluator;
import io.rowguard.sql.policy.publication.PublicationFilter;
import io.rowguard.sql.policy.recorder.MicroMeterPolicyRecorder;
import io.rowguard.sql.policy.recorder.NOOPPolicyRecorder;
import io.rowguard.sql.policy.recorder.PolicyRecorder;
import io.rowguard.sql.policy.resolve.PolicyResolver;
import io.rowguard.sql.policy.storage.InMemoryTableStore;
import io.rowguard.sql.policy.storage.TableStore;
import io.rowguard.sql.policy.store.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.rowguard.sql.policy.ConfigConstants.*;

/**
 * Builds a {@link PolicyEngine} from configuration.
 *
 * <h2>Configuration Keys</h2>
 * <ul>
 *   <li><b>max_recursion_depth</b> - Nesting limit for policy sub-queries (default: 8)</li>
 *   <li><b>predicate_cache.max_size</b> - Resolved predicates kept (default: 10000)</li>
 *   <li><b>predicate_cache.expire_after_access</b> - Eviction of idle entries (default: 10m)</li>
 *   <li><b>tables</b> - Tables with their {@code rls_enabled} flag and, for the in-memory store, {@code columns}</li>
 *   <li><b>policies</b> - Policy definitions, see {@link PolicyLoader}</li>
 *   <li><b>definer_functions</b> - Security definer helpers callable from policies</li>
 *   <li><b>service_key_verifier</b> - Block naming the {@link ServiceKeyVerifier} class and its settings</li>
 * </ul>
 *
 * <h2>Example Usage</h2>
 * <pre>{@code
 * Config config = ConfigFactory.load().getConfig("rowguard");
 * PolicyEngine engine = PolicyEngineFactory.builder(config)
 *     .withMeterRegistry(registry)
 *     .build();
 * }</pre>
 */
public final class PolicyEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(PolicyEngineFactory.class);

    private PolicyEngineFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static PolicyEngine createFromConfig(Config config) throws Exception {
        return builder(config).build();
    }

    public static EngineBuilder builder(Config config) {
        return new EngineBuilder(config);
    }

    public static class EngineBuilder {
        private final Config config;
        private final List<DefinerFunction> definerFunctions = new ArrayList<>();
        private Clock clock;
        private PolicyRecorder recorder;
        private TableStore tableStore;
        private ServiceKeyVerifier serviceKeyVerifier;
        private Integer maxRecursionDepth;

        private EngineBuilder(Config config) {
            this.config = config;
        }

        /**
         * Clock behind {@code now()} and {@code current_date} in policies.
         */
        public EngineBuilder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EngineBuilder withRecorder(PolicyRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public EngineBuilder withMeterRegistry(MeterRegistry registry) {
            this.recorder = new MicroMeterPolicyRecorder(registry);
            return this;
        }

        /**
         * Storage to run against. Tables declared with {@code columns} are only created in the
         * default in-memory store.
         */
        public EngineBuilder withTableStore(TableStore tableStore) {
            this.tableStore = tableStore;
            return this;
        }

        public EngineBuilder withServiceKeyVerifier(ServiceKeyVerifier verifier) {
            this.serviceKeyVerifier = verifier;
            return this;
        }

        public EngineBuilder withMaxRecursionDepth(int maxRecursionDepth) {
            this.maxRecursionDepth = maxRecursionDepth;
            return this;
        }

        public EngineBuilder withDefinerFunction(DefinerFunction function) {
            this.definerFunctions.add(function);
            return this;
        }

        /**
         * @throws io.rowguard.sql.policy.DuplicatePolicyNameException if two configured policies share a name on one table
         * @throws Exception if the service key verifier cannot be loaded
         */
        public PolicyEngine build() throws Exception {
            Clock finalClock = clock != null
                    ? clock
                    : Clock.systemUTC();

            PolicyRecorder finalRecorder = recorder != null
                    ? recorder
                    : NOOPPolicyRecorder.INSTANCE;

            int finalMaxDepth = maxRecursionDepth != null
                    ? maxRecursionDepth
                    : config.hasPath(MAX_RECURSION_DEPTH_KEY)
                        ? config.getInt(MAX_RECURSION_DEPTH_KEY)
                        : DEFAULT_MAX_RECURSION_DEPTH;

            TableStore finalTableStore = tableStore != null
                    ? tableStore
                    : createTableStore(config);

            ServiceKeyVerifier finalVerifier = serviceKeyVerifier != null
                    ? serviceKeyVerifier
                    : loadServiceKeyVerifier(config, finalClock);

            var evaluator = new ExpressionEvaluator(finalClock, finalMaxDepth);
            for (var function : PolicyLoader.definerFunctions(config)) {
                evaluator.register(function);
            }
            for (var function : definerFunctions) {
                evaluator.register(function);
            }

            var policyStore = new PolicyStore();
            var resolver = new PolicyResolver(policyStore, cacheMaxSize(config), cacheExpiry(config), finalRecorder);
            PolicyLoader.load(config, policyStore);

            var gate = new EnforcementGate(resolver, evaluator, finalRecorder);
            var publicationFilter = new PublicationFilter(gate, finalTableStore, finalRecorder);
            logger.atInfo().log("Policy engine ready with {} tables under row level security",
                    policyStore.states().stream().filter(s -> s.rlsEnabled()).count());
            return new PolicyEngine(policyStore, finalTableStore, evaluator, resolver, gate,
                    publicationFilter, finalVerifier);
        }

        private static TableStore createTableStore(Config config) {
            var store = new InMemoryTableStore();
            if (config.hasPath(TABLES_KEY)) {
                for (var table : config.getConfigList(TABLES_KEY)) {
                    if (table.hasPath(TABLE_COLUMNS_KEY)) {
                        store.createTable(table.getString(TABLE_NAME_KEY), table.getStringList(TABLE_COLUMNS_KEY));
                    }
                }
            }
            return store;
        }

        private static ServiceKeyVerifier loadServiceKeyVerifier(Config config, Clock clock) throws Exception {
            ServiceKeyVerifier verifier = ConfigBasedProvider.<ServiceKeyVerifier>load(
                    config, SERVICE_KEY_VERIFIER_KEY, new JwtServiceKeyVerifier());
            if (verifier instanceof AbstractServiceKeyVerifier abstractVerifier) {
                abstractVerifier.setClock(clock);
            }
            return verifier;
        }

        private static long cacheMaxSize(Config config) {
            return config.hasPath(PREDICATE_CACHE_MAX_SIZE_KEY)
                    ? config.getLong(PREDICATE_CACHE_MAX_SIZE_KEY)
                    : 10_000;
        }

        private static Duration cacheExpiry(Config config) {
            return config.hasPath(PREDICATE_CACHE_EXPIRE_AFTER_ACCESS_KEY)
                    ? config.getDuration(PREDICATE_CACHE_EXPIRE_AFTER_ACCESS_KEY)
                    : Duration.ofMinutes(10);
        }
    }
}
