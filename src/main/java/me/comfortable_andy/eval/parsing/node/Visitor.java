package me.comfortable_andy.eval.parsing.node;

/**
 * An interpretation of a finished tree. There is one method per variant that can appear in a
 * finished tree, so adding a variant breaks every visitor until it handles it.
 *
 * @param <T> result of visiting a node
 * @author AndyNoob
 */
public interface Visitor<T> {

    T visit(IntegerNode node);

    T visit(RationalNode node);

    T visit(FloatNode node);

    T visit(BooleanNode node);

    T visit(VariableNode node);

    T visit(ConstantNode node);

    T visit(StringNode node);

    T visit(InfixExpressionNode node);

    T visit(TernaryExpressionNode node);

    T visit(FunctionNode node);

}
