package com.vidnyan.codeguard.adapter.out.detector.standards;

import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.CallMatcher;
import com.vidnyan.codeguard.domain.pattern.CodingStandards;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Conventions every component must share so that they agree at their boundaries:
 * error codes, timeout values, timestamp representation and datetime formats.
 */
@Component
@Order(90)
public class CodingStandardsDetector implements ViolationDetector {

    private static final Pattern ERROR_CODE = Pattern.compile("[A-Z][A-Z0-9]*(?:_[A-Z0-9]+)+|[A-Z]{4,}");
    private static final Pattern ERROR_WORD = Pattern.compile("ERROR|FAILED|INVALID|UNAUTHORIZED");

    @Override
    public List<Violation> detect(DetectionContext context) {
        CodingStandards standards = context.patterns().standards();
        List<Violation> violations = new ArrayList<>();
        checkErrorCodes(context, standards, violations);
        for (SyntaxNode node : context.tree().findAll(NodeKind.CALL, NodeKind.NEW_INSTANCE)) {
            checkTimeout(context, standards, node, violations);
            checkUnixTimestamp(context, standards, node, violations);
            checkDatetimeFormat(context, standards, node, violations);
        }
        return violations;
    }

    private void checkErrorCodes(DetectionContext context, CodingStandards standards, List<Violation> violations) {
        Set<String> reported = new HashSet<>();
        for (SyntaxNode literal : context.tree().findAll(NodeKind.STRING_LITERAL)) {
            String code = literal.name();
            if (!ERROR_CODE.matcher(code).matches() || !ERROR_WORD.matcher(code).find()
                    || standards.errorCodes().contains(code) || !reported.add(code)) {
                continue;
            }
            violations.add(context.violation(literal, ViolationType.NON_STANDARD_ERROR_CODE, Severity.WARNING,
                    "Non-standard error code '" + code + "'",
                    "Use one of the standard error codes: " + String.join(", ", sorted(standards.errorCodes()))));
        }
    }

    private void checkTimeout(DetectionContext context, CodingStandards standards, SyntaxNode call,
                              List<Violation> violations) {
        if (!call.is(NodeKind.CALL) || !call.name().toLowerCase(Locale.ROOT).contains("timeout")
                || call.arguments().isEmpty()) {
            return;
        }
        OptionalDouble seconds = seconds(call.arguments().get(0));
        if (seconds.isEmpty() || isStandard(seconds.getAsDouble(), standards.timeoutsSeconds())) {
            return;
        }
        violations.add(context.violation(call, ViolationType.NON_STANDARD_TIMEOUT, Severity.WARNING,
                "Non-standard timeout value: " + format(seconds.getAsDouble()) + "s",
                "Use a standard timeout in seconds: " + sorted(standards.timeoutsSeconds())));
    }

    private void checkUnixTimestamp(DetectionContext context, CodingStandards standards, SyntaxNode call,
                                    List<Violation> violations) {
        if (call.is(NodeKind.CALL) && standards.unixTimestampCalls().contains(call.name())) {
            violations.add(context.violation(call, ViolationType.UNIX_TIMESTAMP_USAGE, Severity.WARNING,
                    "Unix timestamp usage via '" + call.name() + "()'",
                    "Exchange timestamps as ISO-8601 strings (Instant.toString() / DateTimeFormatter.ISO_INSTANT)"));
        }
    }

    private void checkDatetimeFormat(DetectionContext context, CodingStandards standards, SyntaxNode node,
                                     List<Violation> violations) {
        boolean formatter = CallMatcher.matches("DateTimeFormatter.ofPattern", node)
                || CallMatcher.matches("new SimpleDateFormat", node);
        if (!formatter || node.arguments().isEmpty() || !node.arguments().get(0).is(NodeKind.STRING_LITERAL)) {
            return;
        }
        String pattern = node.arguments().get(0).name();
        if (pattern.startsWith(standards.datetimePatternPrefix())) {
            return;
        }
        violations.add(context.violation(node, ViolationType.CUSTOM_DATETIME_FORMAT, Severity.WARNING,
                "Custom datetime format '" + pattern + "'",
                "Use ISO-8601 (DateTimeFormatter.ISO_DATE_TIME or \"" + standards.datetimePatternPrefix() + "\")"));
    }

    /**
     * Timeout in seconds from a {@code Duration.ofXxx(n)} call or a raw millisecond literal.
     */
    private OptionalDouble seconds(SyntaxNode argument) {
        if (argument.is(NodeKind.NUMBER_LITERAL)) {
            return number(argument).stream().map(ms -> ms / 1000.0).findFirst();
        }
        if (!argument.is(NodeKind.CALL) || argument.arguments().size() != 1) {
            return OptionalDouble.empty();
        }
        OptionalDouble value = number(argument.arguments().get(0));
        if (value.isEmpty() || !argument.qualifiedName().startsWith("Duration.")) {
            return OptionalDouble.empty();
        }
        return switch (argument.name()) {
            case "ofMillis" -> OptionalDouble.of(value.getAsDouble() / 1000.0);
            case "ofSeconds" -> value;
            case "ofMinutes" -> OptionalDouble.of(value.getAsDouble() * 60);
            default -> OptionalDouble.empty();
        };
    }

    private OptionalDouble number(SyntaxNode literal) {
        if (!literal.is(NodeKind.NUMBER_LITERAL)) {
            return OptionalDouble.empty();
        }
        String text = literal.name().replace("_", "").replaceAll("[lLdDfF]$", "");
        try {
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            // hex and octal literals are not timeouts worth judging
            return OptionalDouble.empty();
        }
    }

    private boolean isStandard(double seconds, Set<Integer> standard) {
        return seconds == Math.rint(seconds) && standard.contains((int) seconds);
    }

    private static String format(double seconds) {
        return seconds == Math.rint(seconds) ? String.valueOf((long) seconds) : String.valueOf(seconds);
    }

    private static <T extends Comparable<T>> List<T> sorted(Set<T> values) {
        return values.stream().sorted().toList();
    }
}
