package io.rowguard.sql.policy;

public class ConfigConstants {
    public static final String CONFIG_PATH = "rowguard";

    public static final String MAX_RECURSION_DEPTH_KEY = "max_recursion_depth";
    public static final String PREDICATE_CACHE_KEY = "predicate_cache";
    public static final String PREDICATE_CACHE_MAX_SIZE_KEY = "predicate_cache.max_size";
    public static final String PREDICATE_CACHE_EXPIRE_AFTER_ACCESS_KEY = "predicate_cache.expire_after_access";

    public static final String TABLES_KEY = "tables";
    public static final String TABLE_NAME_KEY = "name";
    public static final String TABLE_RLS_ENABLED_KEY = "rls_enabled";
    public static final String TABLE_COLUMNS_KEY = "columns";

    public static final String POLICIES_KEY = "policies";
    public static final String POLICY_NAME_KEY = "name";
    public static final String POLICY_TABLE_KEY = "table";
    public static final String POLICY_OPERATION_KEY = "operation";
    public static final String POLICY_ROLES_KEY = "roles";
    public static final String POLICY_USING_KEY = "using";
    public static final String POLICY_WITH_CHECK_KEY = "with_check";

    public static final String DEFINER_FUNCTIONS_KEY = "definer_functions";
    public static final String DEFINER_NAME_KEY = "name";
    public static final String DEFINER_PARAMETERS_KEY = "parameters";
    public static final String DEFINER_SQL_KEY = "sql";
    public static final String DEFINER_RESULT_KEY = "result";

    public static final String SERVICE_KEY_VERIFIER_KEY = "service_key_verifier";
    public static final String SECRET_KEY_KEY = "secret_key";

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 8;
}
