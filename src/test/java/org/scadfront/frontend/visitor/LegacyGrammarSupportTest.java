package org.scadfront.frontend.visitor;

import org.scadfront.cst.CstNode;
import org.scadfront.cst.CstPoint;
import org.scadfront.cst.SimpleCstNode;
import org.scadfront.frontend.ast.ForLoopVariable;
import org.scadfront.frontend.ast.LoopRange;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LegacyGrammarSupportTest {

    @Test
    @Tag("unit")
    void splitsSteppedIterator() {
        assertThat(LegacyGrammarSupport.splitIteratorText("i = [0 : 0.5 : 5]"))
                .containsExactly(new ForLoopVariable("i", new LoopRange.NumericBounds(0, 5), 0.5));
    }

    @Test
    @Tag("unit")
    void splitsWholeStatementWithSeveralIterators() {
        assertThat(LegacyGrammarSupport.splitIteratorText("for (i = [0:5], j = [-1:1]) cube(i);"))
                .containsExactly(
                        new ForLoopVariable("i", new LoopRange.NumericBounds(0, 5), null),
                        new ForLoopVariable("j", new LoopRange.NumericBounds(-1, 1), null));
    }

    @Test
    @Tag("unit")
    void skipsIteratorsWithoutNumericBounds() {
        assertThat(LegacyGrammarSupport.splitIteratorText("p = points")).isEmpty();
        assertThat(LegacyGrammarSupport.splitIteratorText("i = [0 : n]")).isEmpty();
        assertThat(LegacyGrammarSupport.splitIteratorText(null)).isEmpty();
    }

    @Test
    @Tag("unit")
    void fieldOrPositionPrefersField() {
        CstNode first = leaf("identifier", "a", 0);
        CstNode second = leaf("identifier", "b", 2);
        CstNode byField = SimpleCstNode.builder("pair").child(first).field("name", second).build();
        CstNode byPosition = SimpleCstNode.builder("pair").child(first).child(second).build();

        assertThat(LegacyGrammarSupport.fieldOrPosition(byField, "name", 0)).isSameAs(second);
        assertThat(LegacyGrammarSupport.fieldOrPosition(byPosition, "name", 1)).isSameAs(second);
        assertThat(LegacyGrammarSupport.fieldOrPosition(byPosition, "name", 5)).isNull();
    }

    private static CstNode leaf(String type, String text, int offset) {
        return SimpleCstNode.builder(type).text(text)
                .range(offset, offset + text.length(), new CstPoint(0, offset), new CstPoint(0, offset + text.length()))
                .build();
    }
}
