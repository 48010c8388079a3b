package com.shardmesh.engine.expression;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * First gate for custom expressions: a length cap and a deny-list of host-code constructs.
 * Anything that passes still has to compile under {@link ExpressionCompiler}, whose grammar has no calls at all.
 */
public final class ExpressionScreen {
    private static final List<Pattern> DENIED = List.of(
            Pattern.compile("require\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("import\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("eval\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Function\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("new\\s+Function", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.constructor", Pattern.CASE_INSENSITIVE),
            Pattern.compile("__proto__", Pattern.CASE_INSENSITIVE),
            Pattern.compile("prototype", Pattern.CASE_INSENSITIVE),
            Pattern.compile("process\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("global\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("window\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("document\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("XMLHttpRequest", Pattern.CASE_INSENSITIVE),
            Pattern.compile("fetch\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("setTimeout\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("setInterval\\s*\\(", Pattern.CASE_INSENSITIVE)
    );

    private final int maxLength;

    public ExpressionScreen(int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * @return the reason the expression is rejected, or empty when it may be parsed
     */
    public Optional<String> rejectionReason(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of("empty expression");
        }
        if (expression.length() > maxLength) {
            return Optional.of("expression longer than " + maxLength + " characters");
        }
        for (Pattern pattern : DENIED) {
            if (pattern.matcher(expression).find()) {
                return Optional.of("expression matches denied pattern " + pattern.pattern());
            }
        }
        return Optional.empty();
    }
}
