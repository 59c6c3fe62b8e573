package org.scadfront.frontend.visitor.features.loop;

import org.scadfront.cst.CstNode;
import org.scadfront.cst.CstPoint;
import org.scadfront.cst.FixtureCstParser;
import org.scadfront.cst.SimpleCstNode;
import org.scadfront.frontend.ast.ForLoopNode;
import org.scadfront.frontend.ast.ForLoopVariable;
import org.scadfront.frontend.ast.LoopRange;
import org.scadfront.frontend.ast.ModuleInstantiationNode;
import org.scadfront.frontend.ast.NodeType;
import org.scadfront.frontend.ast.RangeExpression;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.frontend.ast.VariableExpression;
import org.scadfront.frontend.visitor.AstBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ForStatementHandlerTest {

    private static ForLoopNode loop(String source) {
        List<StatementNode> statements = new AstBuilder().buildProgram(FixtureCstParser.parse(source));
        assertThat(statements).hasSize(1);
        assertThat(statements.get(0).type()).isEqualTo(NodeType.FOR_LOOP);
        return (ForLoopNode) statements.get(0);
    }

    @Test
    @Tag("unit")
    void steppedNumericRangeMovesStepToVariable() {
        ForLoopNode node = loop("for (i = [0:0.5:5]) cube(i);");

        assertThat(node.variables()).containsExactly(
                new ForLoopVariable("i", new LoopRange.NumericBounds(0, 5), 0.5));
        assertThat(node.body()).hasSize(1);
        assertThat(((ModuleInstantiationNode) node.body().get(0)).name()).isEqualTo("cube");
    }

    @Test
    @Tag("unit")
    void negativeBoundIsNumeric() {
        ForLoopVariable variable = loop("for (i = [-2 : 2]) cube(i);").variables().get(0);

        assertThat(variable.range()).isEqualTo(new LoopRange.NumericBounds(-2, 2));
        assertThat(variable.hasStep()).isFalse();
    }

    @Test
    @Tag("unit")
    void nonNumericRangeIsKeptAsExpression() {
        ForLoopVariable variable = loop("for (i = [0 : n]) cube(i);").variables().get(0);

        assertThat(variable.range()).isInstanceOf(LoopRange.ExpressionRange.class);
        assertThat(((LoopRange.ExpressionRange) variable.range()).expression()).isInstanceOf(RangeExpression.class);
        assertThat(variable.step()).isNull();
    }

    @Test
    @Tag("unit")
    void iterationOverVariableIsKeptAsExpression() {
        ForLoopVariable variable = loop("for (p = points) echo(p);").variables().get(0);

        assertThat(variable.variable()).isEqualTo("p");
        LoopRange.ExpressionRange range = (LoopRange.ExpressionRange) variable.range();
        assertThat(((VariableExpression) range.expression()).name()).isEqualTo("points");
    }

    @Test
    @Tag("unit")
    void blockBodyKeepsAllStatements() {
        ForLoopNode node = loop("for (i = [0:2]) { a(); b(); }");

        assertThat(node.body()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void headerTextIsUsedWhenTreeHasNoIteratorNodes() {
        String text = "for (i = [0:2:10], j = [1:3]) {}";
        CstPoint start = new CstPoint(0, 0);
        CstPoint end = new CstPoint(0, text.length());
        CstNode keyword = SimpleCstNode.builder("for").text("for").named(false)
                .range(0, 3, start, new CstPoint(0, 3)).build();
        CstNode block = SimpleCstNode.builder("block").text("{}")
                .range(text.length() - 2, text.length(), new CstPoint(0, text.length() - 2), end).build();
        CstNode forStatement = SimpleCstNode.builder("for_statement").text(text)
                .range(0, text.length(), start, end)
                .child(keyword)
                .child(block)
                .build();

        ForLoopNode node = (ForLoopNode) new AstBuilder().visit(forStatement);

        assertThat(node.variables()).containsExactly(
                new ForLoopVariable("i", new LoopRange.NumericBounds(0, 10), 2.0),
                new ForLoopVariable("j", new LoopRange.NumericBounds(1, 3), null));
        assertThat(node.body()).isEmpty();
    }
}
