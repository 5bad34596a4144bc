package com.vidnyan.codeguard.adapter.out.detector.business;

import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.pattern.PatternRule;
import com.vidnyan.codeguard.domain.pattern.RequiredElement;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that methods implementing a known business flow contain every step
 * the flow requires.
 * <p>
 * A method belongs to a flow when its name or Javadoc matches one of the flow's
 * detection keywords. Each required element is satisfied by any of its keywords
 * appearing in the method's source text. Keywords are written in snake case and
 * also match the camel-case spelling ({@code rate_limit} matches {@code rateLimiter}).
 * Flows come from the pattern library, so a new checklist needs no code change.
 */
@Slf4j
@Component
@Order(100)
public class BusinessLogicVerifier implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        return verify(context.tree(), context.patterns());
    }

    public List<Violation> verify(SyntaxTree tree, PatternLibrary library) {
        List<Violation> violations = new ArrayList<>();
        for (SyntaxNode method : tree.findAll(NodeKind.FUNCTION_DEF)) {
            if (method.children().stream().noneMatch(c -> c.is(NodeKind.BLOCK))) {
                continue;
            }
            for (PatternRule flow : library.businessFlows()) {
                if (!implementsFlow(method, flow)) {
                    continue;
                }
                log.debug("{}#{} matches business flow {}", tree.path(), method.name(), flow.id());
                violations.addAll(missingElements(tree, method, flow));
            }
        }
        return violations;
    }

    private boolean implementsFlow(SyntaxNode method, PatternRule flow) {
        String name = compact(method.name());
        String doc = method.comment().toLowerCase(Locale.ROOT);
        for (String keyword : flow.detectionPatterns()) {
            String lower = keyword.toLowerCase(Locale.ROOT);
            if (name.contains(compact(lower)) || (!doc.isEmpty() && doc.contains(lower.replace('_', ' ')))) {
                return true;
            }
        }
        return false;
    }

    private List<Violation> missingElements(SyntaxTree tree, SyntaxNode method, PatternRule flow) {
        String body = tree.textOf(method).toLowerCase(Locale.ROOT);
        String compactBody = compact(body);
        List<Violation> violations = new ArrayList<>();
        for (RequiredElement element : flow.requiredElements()) {
            boolean present = element.keywords().stream()
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .anyMatch(k -> body.contains(k) || compactBody.contains(compact(k)));
            if (present) {
                continue;
            }
            violations.add(Violation.builder()
                    .location(method.location())
                    .type(ViolationType.BUSINESS_LOGIC_INCOMPLETE)
                    .severity(element.effectiveSeverity(flow))
                    .description(flow.displayName() + " in '" + method.name() + "' is missing "
                            + element.name().replace('_', ' '))
                    .snippet(tree.snippet(method))
                    .suggestion(element.effectiveFix())
                    .build());
        }
        return violations;
    }

    private static String compact(String text) {
        return text.toLowerCase(Locale.ROOT).replace("_", "");
    }
}
