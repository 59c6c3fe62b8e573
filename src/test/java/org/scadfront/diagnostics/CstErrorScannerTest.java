package org.scadfront.diagnostics;

import org.scadfront.cst.CstNode;
import org.scadfront.cst.FixtureCstParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CstErrorScannerTest {

    private final CstErrorScanner scanner = new CstErrorScanner();

    private List<ParserError> scan(String source) {
        CstNode root = FixtureCstParser.parse(source);
        return scanner.scan(root, source);
    }

    @Test
    @Tag("unit")
    void cleanSourceHasNoErrors() {
        assertThat(scan("cube(10);\nsphere(5);")).isEmpty();
        assertThat(scanner.scan(null, "x")).isEmpty();
    }

    @Test
    @Tag("unit")
    void missingSemicolonAtEndOfPreviousToken() {
        List<ParserError> errors = scan("cube(10)\nsphere(5);");

        assertThat(errors).hasSize(1);
        ParserError error = errors.get(0);
        assertThat(error.getCode()).isEqualTo(ErrorCode.MISSING_SEMICOLON);
        assertThat(error.getMessage()).isEqualTo("Missing semicolon");
        assertThat(error.getContext().getLine()).isEqualTo(1);
        assertThat(error.getContext().getColumn()).isEqualTo(9);
        assertThat(error.getContext().getLength()).isZero();
        assertThat(error.getContext().getExpected()).containsExactly(";");
        assertThat(error.getContext().getSuggestion()).isEqualTo("Insert ';'");
        assertThat(error.getContext().getSource()).isEqualTo("cube(10)\nsphere(5);");
    }

    @Test
    @Tag("unit")
    void unclosedBracketReportedBeforeFollowingSemicolon() {
        List<ParserError> errors = scan("translate([1,2,3) cube(5);");

        assertThat(errors).extracting(ParserError::getCode)
                .containsExactly(ErrorCode.UNCLOSED_BRACKET, ErrorCode.MISSING_SEMICOLON);
        assertThat(errors.get(0).getMessage()).isEqualTo("Missing closing ']'");
        assertThat(errors.get(0).getContext().getColumn()).isEqualTo(17);
        assertThat(errors.get(1).getContext().getColumn()).isEqualTo(18);
    }

    @Test
    @Tag("unit")
    void errorNodeBecomesSyntaxError() {
        List<ParserError> errors = scan("x = 1;\n) junk;\ny = 2;");

        assertThat(errors).hasSize(1);
        ParserError error = errors.get(0);
        assertThat(error).isInstanceOf(ParserSyntaxError.class);
        assertThat(error.getMessage()).isEqualTo("Syntax error at line 2, column 1: unexpected ') junk;'");
        assertThat(error.getContext().getNodeType()).isEqualTo(CstNode.ERROR_TYPE);
        assertThat(error.getContext().getFound()).isEqualTo(") junk;");
        assertThat(error.getContext().getLength()).isEqualTo(7);
        assertThat(error.getContext().getSource()).isEqualTo("x = 1;\n) junk;\ny = 2;");
    }

    @Test
    @Tag("unit")
    void snippetKeepsTwoLinesOfContext() {
        String source = "a\nb\nc\nd\ne\nf";

        assertThat(CstErrorScanner.snippet(source, 3)).isEqualTo("b\nc\nd\ne\nf");
        assertThat(CstErrorScanner.snippet(source, 0)).isEqualTo("a\nb\nc");
        assertThat(CstErrorScanner.snippet(source, 9)).isEmpty();
    }
}
