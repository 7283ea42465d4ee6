package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;

/**
 * Typesets an arithmetic tree as LaTeX. Fractions use {@code \frac}, except inside exponents
 * where they are written with a solidus. Not thread safe.
 *
 * @author AndyNoob
 */
public class LaTeXPrinter implements Visitor<String> {

    // set while printing an exponent
    private boolean solidus = false;

    @Override
    public String visit(IntegerNode node) {
        return String.valueOf(node.value());
    }

    @Override
    public String visit(RationalNode node) {
        if (node.denominator() == 1) return String.valueOf(node.numerator());
        if (this.solidus) return node.numerator() + "/" + node.denominator();
        return "\\frac{" + node.numerator() + "}{" + node.denominator() + "}";
    }

    @Override
    public String visit(FloatNode node) {
        return ASCIIPrinter.formatFloat(node.value());
    }

    @Override
    public String visit(BooleanNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public String visit(VariableNode node) {
        return node.name();
    }

    @Override
    public String visit(ConstantNode node) {
        switch (node.name()) {
            case "pi":
                return "\\pi{}";
            case "e":
                return "e";
            case "i":
                return "i";
            case "NAN":
                return "\\operatorname{NAN}";
            case "INF":
                return "\\infty{}";
            default:
                throw MathParserException.unknownConstant(node.name());
        }
    }

    @Override
    public String visit(StringNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public String visit(InfixExpressionNode node) {
        final Node left = node.left();
        final Node right = node.right();
        final boolean prefix = node.operator() == InfixOperator.SUBTRACTION || node.operator() == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();

        switch (node.operator()) {
            case ADDITION:
                return left.accept(this) + "+" + parenthesize(right, node, false);
            case SUBTRACTION:
            case UNARY_MINUS:
                if (right == null) return "-" + parenthesize(left, node, false);
                return left.accept(this) + "-" + parenthesize(right, node, false);
            case MULTIPLICATION:
                final String operator = needsCdot(left, right) ? "\\cdot " : "";
                return parenthesize(left, node, false) + operator + parenthesize(right, node, false);
            case DIVISION:
                if (this.solidus) return parenthesize(left, node, false) + "/" + parenthesize(right, node, false);
                return "\\frac{" + left.accept(this) + "}{" + right.accept(this) + "}";
            case EXPONENTIATION:
                final String base = parenthesize(left, node, true);
                return base + "^" + exponent(right);
            default:
                throw MathParserException.unknownOperator(node.symbol());
        }
    }

    @Override
    public String visit(TernaryExpressionNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public String visit(FunctionNode node) {
        final Node operand = node.operand();
        switch (node.name()) {
            case "sqrt":
                return "\\sqrt{" + operand.accept(this) + "}";
            case "exp":
                if (operand.complexity() < 10) return "e^" + exponent(operand);
                return "\\exp(" + operand.accept(this) + ")";
            case "ln":
            case "log":
            case "sin":
            case "cos":
            case "tan":
            case "arcsin":
            case "arccos":
            case "arctan":
                return "\\" + node.name() + "(" + operand.accept(this) + ")";
            case "abs":
                return "\\lvert " + operand.accept(this) + "\\rvert ";
            case "!":
            case "!!":
                final String text = operand.accept(this);
                final boolean bare = operand instanceof VariableNode || operand instanceof ConstantNode
                        || (operand instanceof NumericNode && ((NumericNode) operand).doubleValue() >= 0);
                return (bare ? text : "(" + text + ")") + node.name();
            default:
                return "\\operatorname{" + node.name() + "}(" + operand.accept(this) + ")";
        }
    }

    public String parenthesize(Node node, InfixExpressionNode cutoff, boolean conservative) {
        final String text = node.accept(this);

        if (node instanceof InfixExpressionNode) {
            final InfixExpressionNode infix = (InfixExpressionNode) node;
            if (infix.isNegation() || infix.operator() == InfixOperator.UNARY_MINUS) return "(" + text + ")";
            if (cutoff.operator() == InfixOperator.SUBTRACTION && infix.lowerPrecedenceThan(cutoff))
                return "(" + text + ")";
            if (infix.strictlyLowerPrecedenceThan(cutoff)) return "(" + text + ")";
            if (conservative) {
                if (cutoff.operator() == InfixOperator.DIVISION && infix.lowerPrecedenceThan(cutoff))
                    return "(" + text + ")";
                if (cutoff.operator() == InfixOperator.EXPONENTIATION && infix.operator() == InfixOperator.EXPONENTIATION)
                    return "{" + text + "}";
            }
        }

        if (node instanceof NumericNode && ((NumericNode) node).doubleValue() < 0) return "(" + text + ")";
        return text;
    }

    /**
     * Prints an exponent, braced unless it is a single symbol or digit.
     */
    private String exponent(Node node) {
        final boolean previous = this.solidus;
        this.solidus = true;
        try {
            final String text = node.accept(this);
            if (node instanceof VariableNode || node instanceof ConstantNode) return text;
            if (node instanceof IntegerNode && ((IntegerNode) node).value() >= 0 && ((IntegerNode) node).value() <= 9)
                return text;
            return "{" + text + "}";
        } finally {
            this.solidus = previous;
        }
    }

    private static boolean needsCdot(Node left, Node right) {
        if (left instanceof FunctionNode) return true;
        if (right instanceof NumericNode) return true;
        return right instanceof InfixExpressionNode && ((InfixExpressionNode) right).left() instanceof NumericNode;
    }

}
