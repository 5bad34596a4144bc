package com.vidnyan.codeguard.adapter.out.detector.security;

import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.SecurityPatterns;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SQL built from runtime values, sensitive data written to logs and
 * web endpoints without an authorization annotation.
 * <p>
 * SQL detection looks at how SQL string literals (text blocks included) are
 * combined with other values and reports every dynamic construction, whether
 * or not the value is attacker controlled. At most one finding per line.
 */
@Component
@Order(110)
public class SecurityScanner implements ViolationDetector {

    private static final Pattern STATEMENT_START = Pattern.compile(
            "^\\s*(?:select\\s.+\\sfrom|insert\\s+into|update\\s+\\w+\\s+set|delete\\s+from)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PLACEHOLDER = Pattern.compile("%[sd]|\\{\\d+}");
    private static final Set<String> FORMAT_CALLS = Set.of("String.format", "MessageFormat.format");

    @Override
    public List<Violation> detect(DetectionContext context) {
        return scan(context.tree(), context.patterns().security());
    }

    public List<Violation> scan(SyntaxTree tree, SecurityPatterns patterns) {
        List<Violation> violations = new ArrayList<>();
        violations.addAll(findSqlInjection(tree, patterns));
        violations.addAll(findPiiInLogs(tree, patterns));
        violations.addAll(findMissingAuthorization(tree, patterns));
        return violations;
    }

    // ============ SQL injection ============

    List<Violation> findSqlInjection(SyntaxTree tree, SecurityPatterns patterns) {
        if (patterns.sqlKeywords().isEmpty()) {
            return List.of();
        }
        Pattern upperKeyword = Pattern.compile("\\b(?:" + patterns.sqlKeywords().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|")) + ")\\b");

        List<Violation> violations = new ArrayList<>();
        Set<Integer> reportedLines = new HashSet<>();
        for (SyntaxNode literal : tree.findAll(NodeKind.STRING_LITERAL)) {
            String value = literal.name();
            if (!upperKeyword.matcher(value).find() && !STATEMENT_START.matcher(value).find()) {
                continue;
            }
            Optional<String> family = sqlFamily(tree, literal);
            if (family.isPresent() && reportedLines.add(literal.line())) {
                violations.add(Violation.builder()
                        .location(literal.location())
                        .type(ViolationType.SQL_INJECTION)
                        .severity(Severity.CRITICAL)
                        .description("Potential SQL injection: query built with " + family.get())
                        .snippet(tree.snippet(literal))
                        .suggestion("Use a parameterized query: \"SELECT * FROM users WHERE id = ?\" "
                                + "with PreparedStatement.setXxx or JdbcTemplate arguments")
                        .build());
            }
        }
        return violations;
    }

    /**
     * How a SQL literal is combined with runtime values, judged from its parent node.
     */
    private Optional<String> sqlFamily(SyntaxTree tree, SyntaxNode literal) {
        Optional<SyntaxNode> parent = tree.parentOf(literal);
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode p = parent.get();
        if (p.is(NodeKind.BINARY_OP) && p.name().equals("+")) {
            return hasDynamicOperand(topOfConcatenation(tree, p))
                    ? Optional.of("string concatenation") : Optional.empty();
        }
        if (p.is(NodeKind.ATTRIBUTE_ACCESS) && p.name().equals("formatted")) {
            boolean withArguments = tree.parentOf(p)
                    .filter(call -> call.is(NodeKind.CALL) && call.callee().orElse(null) == p)
                    .filter(call -> !call.arguments().isEmpty())
                    .isPresent();
            return withArguments ? Optional.of("String.formatted") : Optional.empty();
        }
        if (p.is(NodeKind.CALL) && p.arguments().contains(literal)) {
            if (FORMAT_CALLS.contains(p.qualifiedName())
                    && p.arguments().size() > 1
                    && PLACEHOLDER.matcher(literal.name()).find()) {
                return Optional.of("String.format");
            }
            if (p.name().equals("append") && appendsRuntimeValue(tree, p)) {
                return Optional.of("StringBuilder.append");
            }
        }
        return Optional.empty();
    }

    private SyntaxNode topOfConcatenation(SyntaxTree tree, SyntaxNode plus) {
        SyntaxNode top = plus;
        Optional<SyntaxNode> up = tree.parentOf(top);
        while (up.isPresent() && up.get().is(NodeKind.BINARY_OP) && up.get().name().equals("+")) {
            top = up.get();
            up = tree.parentOf(top);
        }
        return top;
    }

    private boolean hasDynamicOperand(SyntaxNode concatenation) {
        for (SyntaxNode operand : concatenation.children()) {
            boolean dynamic = operand.is(NodeKind.BINARY_OP) && operand.name().equals("+")
                    ? hasDynamicOperand(operand)
                    : !operand.is(NodeKind.STRING_LITERAL, NodeKind.NUMBER_LITERAL, NodeKind.LITERAL);
            if (dynamic) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the builder the SQL fragment is appended to also receives a
     * non-literal value, in the same chain or in another statement on the same variable.
     */
    private boolean appendsRuntimeValue(SyntaxTree tree, SyntaxNode append) {
        SyntaxNode root = builderRoot(append);
        SyntaxNode scope = tree.enclosingCallable(append).orElse(tree.root());
        return scope.descendantsAndSelf().stream()
                .filter(n -> n.is(NodeKind.CALL) && n.name().equals("append"))
                .filter(n -> sameBuilder(root, builderRoot(n)))
                .flatMap(n -> n.arguments().stream())
                .anyMatch(arg -> !arg.is(NodeKind.STRING_LITERAL, NodeKind.NUMBER_LITERAL, NodeKind.LITERAL));
    }

    private SyntaxNode builderRoot(SyntaxNode call) {
        SyntaxNode current = call;
        Optional<SyntaxNode> receiver = current.receiver();
        while (receiver.isPresent()) {
            current = receiver.get();
            if (!current.is(NodeKind.CALL)) {
                break;
            }
            receiver = current.receiver();
        }
        return current;
    }

    private boolean sameBuilder(SyntaxNode a, SyntaxNode b) {
        if (a == b) {
            return true;
        }
        return a.is(NodeKind.NAME) && b.is(NodeKind.NAME) && a.name().equals(b.name());
    }

    // ============ PII in logs ============

    List<Violation> findPiiInLogs(SyntaxTree tree, SecurityPatterns patterns) {
        List<Violation> violations = new ArrayList<>();
        for (SyntaxNode call : tree.findAll(NodeKind.CALL)) {
            if (!isLoggingCall(call, patterns)) {
                continue;
            }
            String text = tree.textOf(call).toLowerCase(Locale.ROOT);
            String compactText = text.replace("_", "");
            patterns.piiKeywords().stream()
                    .filter(k -> text.contains(k) || compactText.contains(k.replace("_", "")))
                    .findFirst()
                    .ifPresent(keyword -> violations.add(Violation.builder()
                            .location(call.location())
                            .type(ViolationType.PII_IN_LOGS)
                            .severity(Severity.CRITICAL)
                            .description("Potential PII in log statement: '" + keyword + "'")
                            .snippet(tree.snippet(call))
                            .suggestion("Mask or omit sensitive values before logging, e.g. log the user id instead")
                            .build()));
        }
        return violations;
    }

    private boolean isLoggingCall(SyntaxNode call, SecurityPatterns patterns) {
        if (patterns.printCalls().contains(call.qualifiedName())) {
            return true;
        }
        if (!patterns.loggerMethods().contains(call.name())) {
            return false;
        }
        return call.receiver()
                .filter(r -> r.is(NodeKind.NAME, NodeKind.ATTRIBUTE_ACCESS))
                .map(r -> r.name().toLowerCase(Locale.ROOT))
                .filter(name -> name.equals("log") || name.endsWith("logger"))
                .isPresent();
    }

    // ============ Authorization ============

    List<Violation> findMissingAuthorization(SyntaxTree tree, SecurityPatterns patterns) {
        List<Violation> violations = new ArrayList<>();
        for (SyntaxNode method : tree.findAll(NodeKind.FUNCTION_DEF)) {
            Optional<String> mapping = patterns.endpointAnnotations().stream()
                    .sorted()
                    .filter(method::hasAnnotation)
                    .findFirst();
            if (mapping.isEmpty() || isPublic(method, patterns) || isAuthorized(tree, method, patterns)) {
                continue;
            }
            violations.add(Violation.builder()
                    .location(method.location())
                    .type(ViolationType.MISSING_AUTHORIZATION)
                    .severity(Severity.WARNING)
                    .description("Endpoint '" + method.name() + "' (@" + mapping.get()
                            + ") has no authorization annotation")
                    .snippet(tree.snippet(method))
                    .suggestion("Add " + patterns.authorizationAnnotations().stream().sorted()
                            .map(a -> "@" + a).collect(Collectors.joining(" / "))
                            + " to the method or its controller")
                    .build());
        }
        return violations;
    }

    private boolean isPublic(SyntaxNode method, SecurityPatterns patterns) {
        String name = method.name().toLowerCase(Locale.ROOT);
        return patterns.publicEndpoints().stream()
                .anyMatch(endpoint -> name.equals(endpoint) || name.equals("get" + endpoint));
    }

    private boolean isAuthorized(SyntaxTree tree, SyntaxNode method, SecurityPatterns patterns) {
        if (patterns.authorizationAnnotations().stream().anyMatch(method::hasAnnotation)) {
            return true;
        }
        return tree.ancestorsOf(method).stream()
                .filter(a -> a.is(NodeKind.CLASS_DEF))
                .anyMatch(c -> patterns.authorizationAnnotations().stream().anyMatch(c::hasAnnotation));
    }
}
