package org.scadfront.frontend.ast;

import java.util.List;

/**
 * Member access {@code object.property}, as in {@code point.x}.
 *
 * @param object   The accessed expression.
 * @param property The member name.
 * @param location The source span.
 */
public record MemberAccessExpression(ExpressionNode object, String property, SourceSpan location)
        implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.MEMBER_ACCESS;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }
}
