package com.vidnyan.codeguard.domain.context;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual guards recognised in the lines above a risky expression.
 */
public enum CheckKind {

    /**
     * {@code v != null}, {@code v == null} guard clauses, {@code Objects.requireNonNull(v)},
     * or an assignment of a fresh object or string literal.
     */
    NONE_CHECK {
        @Override
        boolean matches(String text, String variable, int index) {
            String v = quote(variable);
            return find(text, "\\b" + v + "\\s*[!=]=\\s*null\\b")
                    || find(text, "\\bnull\\s*[!=]=\\s*" + v + "\\b")
                    || find(text, "Objects\\.(?:nonNull|isNull|requireNonNull)\\(\\s*" + v + "\\b")
                    || find(text, "\\b" + v + "\\s+instanceof\\b")
                    || find(text, "Optional\\.ofNullable\\(\\s*" + v + "\\b")
                    || find(text, "\\b" + v + "\\s*=\\s*(?:new\\b|\")");
        }
    },

    /** {@code map.containsKey(...)}. */
    KEY_CHECK {
        @Override
        boolean matches(String text, String variable, int index) {
            return find(text, "\\b" + quote(variable) + "\\.containsKey\\(");
        }
    },

    /** A size or length comparison that covers the accessed index. */
    BOUNDS_CHECK {
        @Override
        boolean matches(String text, String variable, int index) {
            String v = quote(variable);
            if (index == 0 && find(text, "\\b" + v + "\\.isEmpty\\(\\)")) {
                return true;
            }
            Matcher after = Pattern.compile("\\b" + v + "\\.(?:size\\(\\)|length)\\s*(>=|>|==|!=)\\s*(\\d+)")
                    .matcher(text);
            while (after.find()) {
                long bound = bound(after.group(2));
                switch (after.group(1)) {
                    case ">", "!=" -> {
                        if (bound >= index) return true;
                    }
                    case ">=", "==" -> {
                        if (bound > index) return true;
                    }
                    default -> { }
                }
            }
            Matcher before = Pattern.compile("(\\d+)\\s*(<|<=)\\s*" + v + "\\.(?:size\\(\\)|length)\\b")
                    .matcher(text);
            while (before.find()) {
                long bound = bound(before.group(1));
                if (before.group(2).equals("<") ? bound >= index : bound > index) return true;
            }
            return false;
        }
    },

    /** {@code isEmpty()}, {@code size() > 0}, {@code hasNext()}, {@code peek()}. */
    EMPTY_CHECK {
        @Override
        boolean matches(String text, String variable, int index) {
            String v = quote(variable);
            return find(text, "\\b" + v + "\\.isEmpty\\(\\)")
                    || find(text, "\\b" + v + "\\.(?:size\\(\\)|length)\\s*(?:>|>=|!=|==)\\s*\\d")
                    || find(text, "\\b" + v + "\\.hasNext\\(\\)")
                    || find(text, "\\b" + v + "\\.peek\\w*\\(\\)");
        }
    },

    /** Comparison of the divisor with zero. */
    ZERO_CHECK {
        @Override
        boolean matches(String text, String variable, int index) {
            String v = quote(variable);
            return find(text, "\\b" + v + "\\s*(?:!=|==|>=|<=|>|<)\\s*0(?:\\.0+)?[dDfFlL]?\\b")
                    || find(text, "\\b0(?:\\.0+)?[dDfFlL]?\\s*(?:!=|==|>=|<=|>|<)\\s*" + v + "\\b");
        }
    };

    abstract boolean matches(String text, String variable, int index);

    /**
     * Numeric value of a digit run, saturating at {@code Long.MAX_VALUE}.
     */
    static long bound(String digits) {
        String significant = digits.replaceFirst("^0+(?=\\d)", "");
        return significant.length() > 18 ? Long.MAX_VALUE : Long.parseLong(significant);
    }

    private static String quote(String variable) {
        return Pattern.quote(variable);
    }

    private static boolean find(String text, String regex) {
        return Pattern.compile(regex).matcher(text).find();
    }
}
