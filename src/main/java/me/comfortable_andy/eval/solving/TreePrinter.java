package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.parsing.node.*;

/**
 * Prints a tree with the type of every literal, for debugging.
 * {@code 1+x/2} prints as {@code (+, 1:int, (/, x, 2:int))} unsimplified.
 *
 * @author AndyNoob
 */
public class TreePrinter implements Visitor<String> {

    @Override
    public String visit(IntegerNode node) {
        return node.value() + ":int";
    }

    @Override
    public String visit(RationalNode node) {
        return node.numerator() + "/" + node.denominator() + ":rational";
    }

    @Override
    public String visit(FloatNode node) {
        return node.value() + ":float";
    }

    @Override
    public String visit(BooleanNode node) {
        return node.value() + ":bool";
    }

    @Override
    public String visit(VariableNode node) {
        return node.name();
    }

    @Override
    public String visit(ConstantNode node) {
        return node.name();
    }

    @Override
    public String visit(StringNode node) {
        return "\"" + node.value() + "\":string";
    }

    @Override
    public String visit(InfixExpressionNode node) {
        final String left = print(node.left());
        if (node.right() == null) return "(" + node.symbol() + ", " + left + ")";
        return "(" + node.symbol() + ", " + left + ", " + print(node.right()) + ")";
    }

    @Override
    public String visit(TernaryExpressionNode node) {
        return "(" + print(node.condition()) + "; " + print(node.left()) + "; " + print(node.right()) + "):" + TernaryExpressionNode.OPERATOR;
    }

    @Override
    public String visit(FunctionNode node) {
        return node.name() + "(" + print(node.operand()) + ")";
    }

    private String print(/* nullable */ Node node) {
        return node == null ? "null" : node.accept(this);
    }

}
