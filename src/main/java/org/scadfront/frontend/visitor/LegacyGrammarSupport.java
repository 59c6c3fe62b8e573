package org.scadfront.frontend.visitor;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.ForLoopVariable;
import org.scadfront.frontend.ast.LoopRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compatibility paths for grammar versions that do not assign field names. Handlers always try
 * field access first and only call into this class when the field is absent.
 */
public final class LegacyGrammarSupport {

    private static final Logger log = LoggerFactory.getLogger(LegacyGrammarSupport.class);

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private LegacyGrammarSupport() {
    }

    /**
     * Returns the child bound to a field, or the named child at a fixed position when the grammar
     * did not assign the field.
     *
     * @param node          The parent node.
     * @param fieldName     The preferred field.
     * @param positionIndex The index among named, non-comment children to use instead.
     * @return The child, or null if neither lookup finds one.
     */
    public static CstNode fieldOrPosition(CstNode node, String fieldName, int positionIndex) {
        CstNode byField = node.childForFieldName(fieldName);
        if (byField != null) {
            return byField;
        }
        List<CstNode> named = CstNodes.namedChildren(node);
        if (positionIndex < 0 || positionIndex >= named.size()) {
            return null;
        }
        log.debug("Field '{}' absent on '{}', using named child {}", fieldName, node.type(), positionIndex);
        return named.get(positionIndex);
    }

    /**
     * Recovers loop iterators from raw header text such as {@code i = [0 : 0.5 : 5], j = [0 : 2]}.
     * The text may also be a whole {@code for (...)} statement. Only iterators whose bounds are
     * numeric literals can be rebuilt this way; others are skipped.
     *
     * @param text The header or statement text.
     * @return The recovered iterators in source order.
     */
    public static List<ForLoopVariable> splitIteratorText(String text) {
        List<ForLoopVariable> variables = new ArrayList<>();
        if (text == null) {
            return variables;
        }
        String header = stripForKeyword(text.trim());
        for (String assignment : splitTopLevel(header, ',')) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = assignment.substring(0, eq).trim();
            String range = assignment.substring(eq + 1).trim();
            if (name.isEmpty() || !range.startsWith("[") || !range.endsWith("]")) {
                continue;
            }
            List<String> parts = splitTopLevel(range.substring(1, range.length() - 1), ':');
            if (parts.size() < 2 || parts.size() > 3 || !parts.stream().allMatch(LegacyGrammarSupport::isNumber)) {
                continue;
            }
            double start = Double.parseDouble(parts.get(0));
            double end = Double.parseDouble(parts.get(parts.size() - 1));
            Double step = parts.size() == 3 ? Double.valueOf(parts.get(1)) : null;
            variables.add(new ForLoopVariable(name, new LoopRange.NumericBounds(start, end), step));
        }
        if (!variables.isEmpty()) {
            log.debug("Recovered {} loop iterator(s) from header text", variables.size());
        }
        return variables;
    }

    private static boolean isNumber(String text) {
        return NUMBER.matcher(text).matches();
    }

    private static String stripForKeyword(String text) {
        if (!text.startsWith("for")) {
            return text;
        }
        int open = text.indexOf('(');
        if (open < 0) {
            return text;
        }
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return text.substring(open + 1, i);
                }
            }
        }
        return text.substring(open + 1);
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
