package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.ViolationType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rules compiled into the engine. Also the default for every section a
 * configuration file leaves out.
 */
final class BuiltInPatterns {

    private BuiltInPatterns() {
    }

    static Map<String, PatternRule> businessRules() {
        Map<String, PatternRule> rules = new LinkedHashMap<>();
        rules.put("password_reset", business("password_reset", "Password reset",
                List.of("reset_password", "password_reset", "forgot_password"),
                element("token_generation",
                        List.of("secrets.token", "securerandom", "uuid.randomuuid", "random.", "generate_token", "create_token"),
                        "Generate a cryptographically secure token with SecureRandom (at least 32 bytes)"),
                element("token_storage",
                        List.of("save", "store", "persist", "insert", "database", "create("),
                        "Store the token with user id, creation time and expiry time"),
                element("expiry_check",
                        List.of("expir", "valid_until", "created_at", "ttl", "lifetime", "timeout", "duration"),
                        "Reject tokens past their expiry time (typically one hour)"),
                element("invalidation_after_use",
                        List.of("invalidate", ".delete", "used", "consumed", "revoke", "remove"),
                        "Delete the token or mark it used after a successful reset"),
                element("rate_limiting",
                        List.of("rate_limit", "throttle", "attempts", "cooldown", "backoff", "max_attempts"),
                        "Limit reset requests to a few per hour per email")));
        rules.put("user_registration", business("user_registration", "User registration",
                List.of("register", "signup", "sign_up", "create_user"),
                element("email_uniqueness_check",
                        List.of("exists_by_email", "find_by_email", "get_by_email", "check_email", ".exists"),
                        "Look up an existing user with the same email before creating one"),
                element("password_hashing",
                        List.of("bcrypt", "password_encoder", "hashpw", "pbkdf2", "argon", "scrypt", "hash_password"),
                        "Hash the password with BCrypt or Argon2 before storing it"),
                element("activation_email",
                        List.of("send_email", "send_activation", "activation_email", "verify_email", "send_verification"),
                        "Send an activation link to verify email ownership"),
                element("duplicate_prevention",
                        List.of("data_integrity", "integrity", "unique", "constraint", "duplicate", "rollback"),
                        "Add a unique constraint on email and handle the violation")));
        rules.put("authentication", business("authentication", "Authentication",
                List.of("login", "authenticate", "sign_in"),
                element("password_verification",
                        List.of("checkpw", "matches(", "verify_password", "check_password", "validate_password"),
                        "Verify the password with PasswordEncoder.matches or BCrypt.checkpw"),
                element("session_creation",
                        List.of("create_session", "generate_token", "jwt", "set_cookie", "session"),
                        "Create a session or JWT after successful authentication"),
                element("failed_attempt_tracking",
                        List.of("failed_attempts", "login_attempts", "increment", "track_attempt"),
                        "Increment a failed-attempt counter on each failed login"),
                element("account_lockout",
                        List.of("locked", "lockout", "disable", "suspend", "max_attempts", "account_lock"),
                        "Lock the account for 30 minutes after 5 failed attempts")));
        rules.put("payment_processing", business("payment_processing", "Payment processing",
                List.of("payment", "charge", "process_payment", "transaction"),
                element("amount_validation",
                        List.of("validate", "amount", "positive", "range", "big_decimal"),
                        "Validate that the amount is positive with at most two decimal places"),
                element("idempotency_check",
                        List.of("idempoten", "duplicate", "unique_id", "transaction_id"),
                        "Check whether the transaction id was already processed"),
                element("transaction_logging",
                        List.of("log.", "audit", "record", "history"),
                        "Write every transaction to an audit log"),
                element("rollback_mechanism",
                        List.of("rollback", "revert", "undo", "compensate", "@transactional"),
                        "Run the payment in a transaction that rolls back on failure"),
                new RequiredElement("fraud_check",
                        List.of("fraud", "risk", "verify", "suspicious"),
                        Severity.WARNING,
                        "Call a fraud detection service or apply basic risk scoring")));
        return rules;
    }

    static Map<String, PatternRule> integrationRules() {
        Map<String, PatternRule> rules = new LinkedHashMap<>();
        rules.put("data_format_mismatch", integration("data_format_mismatch",
                "type_mismatch_at_boundary", Severity.CRITICAL,
                "standardize on ISO8601", "create format validation tests for API boundaries"));
        rules.put("missing_error_handling", integration("missing_error_handling",
                "no_try_catch_on_external_call", Severity.CRITICAL,
                "add circuit breaker pattern", "create failure scenario tests for dependency errors"));
        rules.put("missing_retry_logic", integration("missing_retry_logic",
                "no_retry_on_dependency_call", Severity.WARNING,
                "add exponential backoff retry mechanism", "create retry behavior tests"));
        rules.put("timeout_cascade", integration("timeout_cascade",
                "timeout_sum > parent_timeout", Severity.WARNING,
                "adjust timeout hierarchy", "create timeout cascade tests"));
        rules.put("circular_dependency", integration("circular_dependency",
                "A -> B -> A", Severity.CRITICAL,
                "introduce event bus or mediator pattern", "create dependency tests"));
        return rules;
    }

    static DefensivePatterns defensive() {
        return new DefensivePatterns(
                5,
                Set.of("get", "getOrDefault", "keys", "values", "keySet", "entrySet", "equals", "hashCode",
                        "toString", "getClass", "isPresent", "isEmpty", "orElse", "orElseGet", "orElseThrow",
                        "ifPresent", "stream", "of", "valueOf", "builder", "length"),
                Set.of("this", "super", "log", "logger", "LOG", "LOGGER", "System", "Objects", "Optional"),
                Set.of("java", "javax", "jakarta", "org", "com", "io", "net", "lombok"),
                Set.of("pop", "remove", "removeFirst", "removeLast", "getFirst", "getLast", "element",
                        "first", "last", "next"),
                List.of(
                        new ExternalCallSpec("HttpClient.newHttpClient", ViolationType.EXTERNAL_CALL_SAFETY,
                                List.of(), 0, "HttpClient created without a connect timeout"),
                        new ExternalCallSpec("HttpClient.newBuilder", ViolationType.EXTERNAL_CALL_SAFETY,
                                List.of("connectTimeout"), 0, "HttpClient built without connectTimeout"),
                        new ExternalCallSpec("HttpRequest.newBuilder", ViolationType.EXTERNAL_CALL_SAFETY,
                                List.of("timeout"), 0, "HTTP request built without a timeout"),
                        new ExternalCallSpec("openConnection", ViolationType.EXTERNAL_CALL_SAFETY,
                                List.of("setConnectTimeout", "setReadTimeout"), 0,
                                "URL connection opened without connect/read timeouts"),
                        new ExternalCallSpec("new RestTemplate", ViolationType.EXTERNAL_CALL_SAFETY,
                                List.of("setConnectTimeout", "setReadTimeout", "connectTimeout", "readTimeout"), 1,
                                "RestTemplate created without timeouts"),
                        new ExternalCallSpec("new Socket", ViolationType.EXTERNAL_CALL_SAFETY,
                                List.of("setSoTimeout"), 0, "Socket opened without a read timeout"),
                        new ExternalCallSpec("waitFor", ViolationType.TIMEOUT_PRESENCE,
                                List.of(), 2, "Process wait without a timeout")),
                List.of("Integer.parseInt", "Integer.valueOf", "Long.parseLong", "Long.valueOf",
                        "Double.parseDouble", "Double.valueOf", "Float.parseFloat", "Short.parseShort",
                        "new BigDecimal", "new BigInteger", "UUID.fromString", "readValue", "readTree",
                        "JsonParser.parseString", "LocalDate.parse", "LocalDateTime.parse", "Instant.parse"));
    }

    static List<OperationRequirement> errorHandlingRequirements() {
        return List.of(
                new OperationRequirement("database_operations",
                        List.of("jdbc", "template", "statement", "stmt", "connection", "entitymanager", "session"),
                        List.of("execute", "executeQuery", "executeUpdate", "query", "queryForObject",
                                "queryForList", "update", "batchUpdate", "commit", "persist", "merge"),
                        List.of(),
                        false,
                        Severity.CRITICAL,
                        "Wrap the database call in try/catch to handle connection, timeout and constraint errors"),
                new OperationRequirement("external_api_calls",
                        List.of("resttemplate", "webclient", "httpclient", "client"),
                        List.of("getForObject", "getForEntity", "postForObject", "postForEntity", "exchange",
                                "send", "retrieve"),
                        List.of(),
                        false,
                        Severity.CRITICAL,
                        "Wrap the API call in try/catch to handle timeout, connection and response errors"),
                new OperationRequirement("file_operations",
                        List.of("Files"),
                        List.of("readString", "readAllBytes", "readAllLines", "lines", "write", "writeString",
                                "newBufferedReader", "newBufferedWriter", "newInputStream", "newOutputStream",
                                "copy", "move", "delete", "createFile", "createDirectory", "createDirectories",
                                "list", "walk"),
                        List.of("FileReader", "FileWriter", "FileInputStream", "FileOutputStream",
                                "RandomAccessFile", "PrintWriter"),
                        true,
                        Severity.WARNING,
                        "Handle IOException (NoSuchFileException, AccessDeniedException) with try/catch "
                                + "or open the file in try-with-resources"));
    }

    static SecurityPatterns security() {
        return new SecurityPatterns(
                List.of("SELECT", "INSERT", "UPDATE", "DELETE", "FROM", "WHERE"),
                List.of("password", "passwd", "ssn", "social_security", "credit_card", "card_number", "cvv",
                        "secret", "token", "api_key", "private_key"),
                Set.of("trace", "debug", "info", "warn", "error", "fatal"),
                Set.of("System.out.println", "System.out.print", "System.out.printf",
                        "System.err.println", "System.err.print", "System.err.printf"),
                Set.of("GetMapping", "PostMapping", "PutMapping", "DeleteMapping", "PatchMapping", "RequestMapping"),
                Set.of("PreAuthorize", "PostAuthorize", "Secured", "RolesAllowed", "PermitAll", "DenyAll"),
                Set.of("health", "ping", "status", "metrics"));
    }

    static CodingStandards standards() {
        return new CodingStandards(
                Set.of("VALIDATION_FAILED", "NOT_FOUND", "UNAUTHORIZED", "FORBIDDEN", "CONFLICT",
                        "RATE_LIMIT_EXCEEDED", "BAD_REQUEST", "INVALID_INPUT", "INTERNAL_ERROR",
                        "SERVICE_UNAVAILABLE", "TIMEOUT", "DEPENDENCY_FAILED", "DATABASE_ERROR",
                        "EXTERNAL_API_ERROR"),
                Set.of(1, 2, 5, 10, 15, 30, 60, 120, 300, 900),
                Set.of("toEpochMilli", "getEpochSecond", "toEpochSecond"),
                "yyyy-MM-dd'T'HH:mm:ss");
    }

    static IntegrationSettings integration() {
        return new IntegrationSettings(
                5,
                List.of("circuit", "fallback"),
                List.of("retry", "backoff", "retryable", "resilience4j"));
    }

    private static PatternRule business(String id, String description, List<String> detection,
                                        RequiredElement... elements) {
        return new PatternRule(id, description, detection, List.of(elements), Severity.CRITICAL, null, null);
    }

    private static RequiredElement element(String name, List<String> keywords, String fix) {
        return new RequiredElement(name, keywords, null, fix);
    }

    private static PatternRule integration(String id, String detection, Severity severity,
                                           String fix, String testGeneration) {
        return new PatternRule(id, null, List.of(detection), List.of(), severity, fix, testGeneration);
    }
}
