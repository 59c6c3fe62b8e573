package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.LiteralExpression;
import org.scadfront.frontend.ast.LiteralValue;
import org.scadfront.frontend.ast.SourceSpan;
import org.scadfront.frontend.ast.VariableExpression;

import java.util.regex.Pattern;

/**
 * Classifies leaf text by lexical shape.
 */
public final class LiteralClassifier {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private LiteralClassifier() {
    }

    /**
     * Classifies leaf text as a number, then a boolean or {@code undef} keyword, and otherwise as a
     * variable reference.
     *
     * @param text The leaf text.
     * @param span The source span of the leaf.
     * @return A literal or variable expression.
     */
    public static ExpressionNode classify(String text, SourceSpan span) {
        String trimmed = text.trim();
        if (isNumber(trimmed)) {
            return new LiteralExpression(LiteralValue.ofNumber(Double.parseDouble(trimmed)), span);
        }
        LiteralValue keyword = keyword(trimmed);
        if (keyword != null) {
            return new LiteralExpression(keyword, span);
        }
        return new VariableExpression(trimmed, span);
    }

    /**
     * Coerces parameter default text by lexical shape: number, boolean, {@code undef}, quoted string.
     * Any other text is kept verbatim as a string.
     *
     * @param text The default value source text.
     * @return The coerced value.
     */
    public static LiteralValue coerce(String text) {
        String trimmed = text.trim();
        if (isNumber(trimmed)) {
            return LiteralValue.ofNumber(Double.parseDouble(trimmed));
        }
        LiteralValue keyword = keyword(trimmed);
        if (keyword != null) {
            return keyword;
        }
        if (isQuoted(trimmed)) {
            return LiteralValue.ofString(unquote(trimmed));
        }
        return LiteralValue.ofString(trimmed);
    }

    public static boolean isNumber(String text) {
        return text != null && NUMBER.matcher(text.trim()).matches();
    }

    static boolean isQuoted(String text) {
        return text.length() >= 2
                && ((text.startsWith("\"") && text.endsWith("\"")) || (text.startsWith("'") && text.endsWith("'")));
    }

    static String unquote(String text) {
        return isQuoted(text) ? text.substring(1, text.length() - 1) : text;
    }

    private static LiteralValue keyword(String text) {
        return switch (text) {
            case "true" -> LiteralValue.ofBoolean(true);
            case "false" -> LiteralValue.ofBoolean(false);
            case "undef" -> LiteralValue.undef();
            default -> null;
        };
    }
}
