package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Catch-all handlers and handlers that swallow the exception.
 */
@Component
@Order(60)
public class ExceptionHandlingDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        List<Violation> violations = new ArrayList<>();
        for (SyntaxNode handler : context.tree().findAll(NodeKind.EXCEPTION_HANDLER)) {
            if (catchesThrowable(handler)) {
                violations.add(context.violation(handler, ViolationType.EXCEPTION_HANDLING, Severity.CRITICAL,
                        "catch-all handler for Throwable also catches Errors such as OutOfMemoryError",
                        "Catch the specific exceptions this block can recover from"));
            }
            if (isEmpty(handler)) {
                violations.add(context.violation(handler, ViolationType.EXCEPTION_HANDLING, Severity.WARNING,
                        "Exception " + handler.name() + " silently caught",
                        "Log the exception or rethrow it wrapped in a domain exception"));
            }
        }
        return violations;
    }

    private boolean catchesThrowable(SyntaxNode handler) {
        return Arrays.stream(handler.name().split("\\|"))
                .anyMatch(type -> type.equals("Throwable") || type.equals("java.lang.Throwable"));
    }

    private boolean isEmpty(SyntaxNode handler) {
        return handler.children().stream().allMatch(c -> c.is(NodeKind.NO_OP));
    }
}
