package io.rowguard.sql.policy.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.DuplicatePolicyNameException;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;
import io.rowguard.sql.policy.eval.QueryDefinerFunction;
import io.rowguard.sql.policy.store.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static io.rowguard.sql.policy.ConfigConstants.*;

/**
 * Reads policy definitions. Predicates are written as SQL boolean expressions and compiled with
 * DuckDB's parser, e.g. {@code using = "auth.uid() = owner_id"}.
 *
 * <pre>
 * tables = [ { name = profiles, rls_enabled = true, columns = [id, name] } ]
 * policies = [
 *   { name = own_profile, table = profiles, operation = UPDATE, roles = [authenticated],
 *     using = "auth.uid() = id" }
 * ]
 * definer_functions = [
 *   { name = "private.user_teams", parameters = [p_user], result = LIST,
 *     sql = "select team_id from members where user_id = p_user" }
 * ]
 * </pre>
 */
public final class PolicyLoader {

    private static final Logger logger = LoggerFactory.getLogger(PolicyLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private PolicyLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Applies the {@code tables} flags, then registers every policy of {@code config}.
     */
    public static void load(Config config, PolicyStore store) throws DuplicatePolicyNameException {
        if (config.hasPath(TABLES_KEY)) {
            for (var table : config.getConfigList(TABLES_KEY)) {
                var name = table.getString(TABLE_NAME_KEY);
                if (!table.hasPath(TABLE_RLS_ENABLED_KEY) || table.getBoolean(TABLE_RLS_ENABLED_KEY)) {
                    store.enableRls(name);
                } else {
                    store.disableRls(name);
                }
            }
        }
        for (var policy : policies(config)) {
            store.register(policy);
        }
    }

    public static List<Policy> policies(Config config) {
        var result = new ArrayList<Policy>();
        if (!config.hasPath(POLICIES_KEY)) {
            return result;
        }
        for (var p : config.getConfigList(POLICIES_KEY)) {
            result.add(policy(
                    p.getString(POLICY_NAME_KEY),
                    p.getString(POLICY_TABLE_KEY),
                    p.hasPath(POLICY_OPERATION_KEY) ? p.getString(POLICY_OPERATION_KEY) : Operation.ALL.name(),
                    p.hasPath(POLICY_ROLES_KEY) ? p.getStringList(POLICY_ROLES_KEY) : List.of(),
                    p.hasPath(POLICY_USING_KEY) ? compile(p.getString(POLICY_USING_KEY)) : null,
                    p.hasPath(POLICY_WITH_CHECK_KEY) ? compile(p.getString(POLICY_WITH_CHECK_KEY)) : null));
        }
        logger.atInfo().log("Loaded {} policies from configuration", result.size());
        return result;
    }

    public static List<QueryDefinerFunction> definerFunctions(Config config) {
        var result = new ArrayList<QueryDefinerFunction>();
        if (!config.hasPath(DEFINER_FUNCTIONS_KEY)) {
            return result;
        }
        for (var f : config.getConfigList(DEFINER_FUNCTIONS_KEY)) {
            var result_ = f.hasPath(DEFINER_RESULT_KEY)
                    ? QueryDefinerFunction.Result.valueOf(f.getString(DEFINER_RESULT_KEY).toUpperCase(Locale.ROOT))
                    : QueryDefinerFunction.Result.LIST;
            result.add(QueryDefinerFunction.fromSql(
                    f.getString(DEFINER_NAME_KEY),
                    f.hasPath(DEFINER_PARAMETERS_KEY) ? f.getStringList(DEFINER_PARAMETERS_KEY) : List.of(),
                    f.getString(DEFINER_SQL_KEY),
                    result_));
        }
        return result;
    }

    /**
     * One policy per line, as JSON objects with the same keys as the configuration. {@code using} and
     * {@code with_check} are SQL text, or expression trees as produced by {@code json_serialize_sql}.
     * Blank lines and lines starting with {@code #} are skipped.
     *
     * @throws IllegalArgumentException on a malformed line, naming its line number
     */
    public static List<Policy> fromJsonLines(Reader reader) throws IOException {
        var result = new ArrayList<Policy>();
        var lines = new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                result.add(fromJson(objectMapper.readTree(trimmed)));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid policy on line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        return result;
    }

    static Policy fromJson(JsonNode node) {
        var roles = new ArrayList<String>();
        for (var r : node.path(POLICY_ROLES_KEY)) {
            roles.add(r.asText());
        }
        return policy(
                required(node, POLICY_NAME_KEY),
                required(node, POLICY_TABLE_KEY),
                node.path(POLICY_OPERATION_KEY).asText(Operation.ALL.name()),
                roles,
                expression(node.get(POLICY_USING_KEY)),
                expression(node.get(POLICY_WITH_CHECK_KEY)));
    }

    private static Policy policy(String name, String table, String operation, List<String> roles,
                                 JsonNode using, JsonNode withCheck) {
        return Policy.of(name, table, Operation.parse(operation), roles, using, withCheck);
    }

    private static JsonNode expression(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? compile(value.asText()) : value;
    }

    private static JsonNode compile(String sql) {
        return Transformations.compileFilterString(sql);
    }

    private static String required(JsonNode node, String key) {
        var value = node.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Missing " + key);
        }
        return value.asText();
    }
}
