package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.cst.CstPoint;
import org.scadfront.cst.SimpleCstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.MemberAccessExpression;
import org.scadfront.frontend.ast.VariableExpression;
import org.scadfront.frontend.visitor.AstBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Covers the standalone {@code member_expression} kind and its field layout.
 */
public class MemberAccessHandlerTest {

    private static CstNode token(String type, String text, int start, boolean named) {
        return SimpleCstNode.builder(type).text(text).named(named)
                .range(start, start + text.length(), new CstPoint(0, start), new CstPoint(0, start + text.length()))
                .build();
    }

    private static CstNode member(CstNode property) {
        return SimpleCstNode.builder("member_expression")
                .text("gear." + property.text())
                .range(0, property.endByte(), new CstPoint(0, 0), new CstPoint(0, property.endByte()))
                .field("object", token("identifier", "gear", 0, true))
                .child(token(".", ".", 4, false))
                .field("property", property)
                .build();
    }

    @Test
    @Tag("unit")
    void readsObjectAndProperty() {
        AstNode node = new AstBuilder().visit(member(token("identifier", "teeth", 5, true)));

        assertThat(node).isInstanceOf(MemberAccessExpression.class);
        MemberAccessExpression access = (MemberAccessExpression) node;
        assertThat(access.property()).isEqualTo("teeth");
        assertThat(((VariableExpression) access.object()).name()).isEqualTo("gear");
        assertThat(access.location().end().offset()).isEqualTo(10);
    }

    @Test
    @Tag("unit")
    void missingPropertyYieldsNothing() {
        CstNode missing = SimpleCstNode.builder("identifier").text("").named(true).missing(true)
                .range(5, 5, new CstPoint(0, 5), new CstPoint(0, 5)).build();

        assertThat(new AstBuilder().visit(member(missing))).isNull();
    }
}
