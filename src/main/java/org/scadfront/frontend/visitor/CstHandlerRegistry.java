package org.scadfront.frontend.visitor;

import org.scadfront.frontend.visitor.features.def.FunctionDefinitionHandler;
import org.scadfront.frontend.visitor.features.def.ModuleDefinitionHandler;
import org.scadfront.frontend.visitor.features.expr.AccessorExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.ArrayExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.BinaryExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.CallExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.ConditionalExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.ExpressionWrapperHandler;
import org.scadfront.frontend.visitor.features.expr.IdentifierHandler;
import org.scadfront.frontend.visitor.features.expr.IndexExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.LetExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.ListComprehensionHandler;
import org.scadfront.frontend.visitor.features.expr.LiteralHandler;
import org.scadfront.frontend.visitor.features.expr.MemberAccessHandler;
import org.scadfront.frontend.visitor.features.expr.ParenthesizedExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.RangeExpressionHandler;
import org.scadfront.frontend.visitor.features.expr.UnaryExpressionHandler;
import org.scadfront.frontend.visitor.features.loop.ForStatementHandler;
import org.scadfront.frontend.visitor.features.stmt.AssertStatementHandler;
import org.scadfront.frontend.visitor.features.stmt.AssignmentHandler;
import org.scadfront.frontend.visitor.features.stmt.EchoStatementHandler;
import org.scadfront.frontend.visitor.features.stmt.IfStatementHandler;
import org.scadfront.frontend.visitor.features.stmt.ModuleInstantiationHandler;
import org.scadfront.frontend.visitor.features.stmt.StatementWrapperHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for CST node handlers.
 * Maps grammar node kinds (e.g., "module_definition", "additive_expression") to their handlers.
 */
public class CstHandlerRegistry {

    private final Map<String, ICstNodeHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for a node kind, replacing any previous one.
     * @param nodeType The grammar node kind.
     * @param handler  The handler for this kind.
     */
    public void register(String nodeType, ICstNodeHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Looks up the handler for a node kind.
     * @param nodeType The grammar node kind.
     * @return The handler, or empty if the kind has no handler.
     */
    public Optional<ICstNodeHandler> get(String nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    /**
     * Creates a registry with handlers for every supported OpenSCAD node kind.
     * @return A new registry instance.
     */
    public static CstHandlerRegistry initialize() {
        CstHandlerRegistry registry = new CstHandlerRegistry();

        // Statements
        registry.register("statement", new StatementWrapperHandler());
        registry.register("assignment_statement", new AssignmentHandler());
        registry.register("module_definition", new ModuleDefinitionHandler());
        registry.register("function_definition", new FunctionDefinitionHandler());
        registry.register("module_instantiation", new ModuleInstantiationHandler());
        registry.register("if_statement", new IfStatementHandler());
        registry.register("for_statement", new ForStatementHandler());
        registry.register("echo_statement", new EchoStatementHandler());
        registry.register("assert_statement", new AssertStatementHandler());

        // Expression wrappers
        ExpressionWrapperHandler wrapper = new ExpressionWrapperHandler();
        registry.register("expression", wrapper);
        registry.register("primary_expression", wrapper);

        // Operators
        BinaryExpressionHandler binary = new BinaryExpressionHandler();
        for (String kind : BinaryExpressionHandler.NODE_TYPES) {
            registry.register(kind, binary);
        }
        registry.register("unary_expression", new UnaryExpressionHandler());
        registry.register("conditional_expression", new ConditionalExpressionHandler());

        // Postfix
        CallExpressionHandler call = new CallExpressionHandler();
        IndexExpressionHandler index = new IndexExpressionHandler();
        MemberAccessHandler member = new MemberAccessHandler();
        registry.register("call_expression", call);
        registry.register("index_expression", index);
        registry.register("member_expression", member);
        registry.register("accessor_expression", new AccessorExpressionHandler(call, index, member));

        // Primaries
        LiteralHandler literal = new LiteralHandler();
        registry.register("number", literal);
        registry.register("string", literal);
        registry.register("boolean", literal);
        registry.register("undef", literal);
        IdentifierHandler identifier = new IdentifierHandler();
        registry.register("identifier", identifier);
        registry.register("special_variable", identifier);
        registry.register("parenthesized_expression", new ParenthesizedExpressionHandler());
        ArrayExpressionHandler array = new ArrayExpressionHandler();
        registry.register("vector_expression", array);
        registry.register("array_literal", array);
        registry.register("range_expression", new RangeExpressionHandler());

        // Scoped forms
        registry.register("let_expression", new LetExpressionHandler());
        registry.register("list_comprehension", new ListComprehensionHandler());

        return registry;
    }
}
