package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;

/**
 * Prints a tree back as plain text that parses to the same tree, with as few parentheses as
 * precedence allows.
 *
 * @author AndyNoob
 */
public class ASCIIPrinter implements Visitor<String> {

    @Override
    public String visit(IntegerNode node) {
        return String.valueOf(node.value());
    }

    @Override
    public String visit(RationalNode node) {
        if (node.denominator() == 1) return String.valueOf(node.numerator());
        return node.numerator() + "/" + node.denominator();
    }

    @Override
    public String visit(FloatNode node) {
        return formatFloat(node.value());
    }

    @Override
    public String visit(BooleanNode node) {
        return node.value() ? "TRUE" : "FALSE";
    }

    @Override
    public String visit(VariableNode node) {
        return node.name();
    }

    @Override
    public String visit(ConstantNode node) {
        switch (node.name()) {
            case "pi":
            case "e":
            case "i":
            case "NAN":
            case "INF":
                return node.name();
            default:
                throw MathParserException.unknownConstant(node.name());
        }
    }

    @Override
    public String visit(StringNode node) {
        return "\"" + node.value() + "\"";
    }

    @Override
    public String visit(InfixExpressionNode node) {
        final Node left = node.left();
        final Node right = node.right();

        switch (node.operator()) {
            case ADDITION:
                return left.accept(this) + "+" + parenthesize(right, node, false);
            case SUBTRACTION:
            case UNARY_MINUS:
                if (right == null) return "-" + parenthesize(left, node, false);
                return left.accept(this) + "-" + parenthesize(right, node, false);
            case MULTIPLICATION:
            case DIVISION:
                return parenthesize(left, node, false) + node.symbol() + parenthesize(right, node, true);
            case EXPONENTIATION:
                return parenthesize(left, node, true) + "^" + parenthesize(right, node, false);
            case AND:
            case AND_WORD:
                return left.accept(this) + " AND " + parenthesize(right, node, false);
            case OR:
            case OR_WORD:
                return left.accept(this) + " OR " + parenthesize(right, node, false);
            default:
                // relational
                return left.accept(this) + node.symbol() + parenthesize(right, node, false);
        }
    }

    @Override
    public String visit(TernaryExpressionNode node) {
        if (node.condition() == null || node.left() == null || node.right() == null)
            return TernaryExpressionNode.OPERATOR;
        return TernaryExpressionNode.OPERATOR + " (" + node.condition().accept(this) + ") {"
                + node.left().accept(this) + "} else {" + node.right().accept(this) + "}";
    }

    @Override
    public String visit(FunctionNode node) {
        final String operand = node.operand().accept(this);
        if (!node.name().equals("!") && !node.name().equals("!!")) return node.name() + "(" + operand + ")";

        final Node inner = node.operand();
        // factorials hug their operand, so anything but a plain name or a non-negative number needs parentheses
        final boolean bare = inner instanceof VariableNode || inner instanceof ConstantNode
                || (inner instanceof NumericNode && ((NumericNode) inner).doubleValue() >= 0);
        return (bare ? operand : "(" + operand + ")") + node.name();
    }

    /**
     * Prints {@code node} as an operand of {@code cutoff}.
     *
     * @param conservative also wrap same-precedence operands, for the right side of / and the base of ^
     */
    public String parenthesize(Node node, InfixExpressionNode cutoff, boolean conservative) {
        final String text = node.accept(this);

        if (node instanceof InfixExpressionNode) {
            final InfixExpressionNode infix = (InfixExpressionNode) node;
            if (infix.isNegation() || infix.operator() == InfixOperator.UNARY_MINUS) return "(" + text + ")";
            if (cutoff.operator() == InfixOperator.SUBTRACTION && infix.lowerPrecedenceThan(cutoff))
                return "(" + text + ")";
            if (conservative) {
                if (cutoff.operator() == InfixOperator.DIVISION && infix.lowerPrecedenceThan(cutoff))
                    return "(" + text + ")";
                if (cutoff.operator() == InfixOperator.EXPONENTIATION && infix.operator() == InfixOperator.EXPONENTIATION)
                    return "(" + text + ")";
            }
            if (infix.strictlyLowerPrecedenceThan(cutoff)) return "(" + text + ")";
        }

        if (node instanceof NumericNode && ((NumericNode) node).doubleValue() < 0) return "(" + text + ")";

        // a fraction prints like a division
        if (node instanceof RationalNode && ((RationalNode) node).denominator() != 1
                && new InfixExpressionNode(InfixOperator.DIVISION, null, null).lowerPrecedenceThan(cutoff))
            return "(" + text + ")";

        return text;
    }

    static String formatFloat(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15)
            return String.valueOf((long) value);
        return String.valueOf(value);
    }

}
