package me.comfortable_andy.eval.solving;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;
import me.comfortable_andy.eval.parsing.operation.OperationBuilder;

/**
 * Symbolic differentiation with respect to one variable. Every intermediate node is built
 * through an {@link OperationBuilder}, so the result comes out simplified.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class Differentiator implements Visitor<Node> {

    private final String variable;
    private final OperationBuilder builder;

    public Differentiator(String variable) {
        this(variable, new OperationBuilder());
    }

    public Node differentiate(Node node) {
        return node.accept(this);
    }

    @Override
    public Node visit(IntegerNode node) {
        return new IntegerNode(0);
    }

    @Override
    public Node visit(RationalNode node) {
        return new IntegerNode(0);
    }

    @Override
    public Node visit(FloatNode node) {
        return new IntegerNode(0);
    }

    @Override
    public Node visit(BooleanNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Node visit(VariableNode node) {
        return new IntegerNode(node.name().equals(this.variable) ? 1 : 0);
    }

    @Override
    public Node visit(ConstantNode node) {
        if (node.name().equals("NAN")) return node;
        return new IntegerNode(0);
    }

    @Override
    public Node visit(StringNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Node visit(InfixExpressionNode node) {
        final Node left = node.left();
        final Node right = node.right();
        final boolean prefix = node.operator() == InfixOperator.SUBTRACTION || node.operator() == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();

        switch (node.operator()) {
            case ADDITION:
                return this.builder.addition(left.accept(this), right.accept(this));
            case SUBTRACTION:
            case UNARY_MINUS:
                if (right == null) return this.builder.unaryMinus(left.accept(this));
                return this.builder.subtraction(left.accept(this), right.accept(this));
            case MULTIPLICATION:
                // (fg)' = fg' + f'g
                return this.builder.addition(
                        this.builder.multiplication(left, right.accept(this)),
                        this.builder.multiplication(left.accept(this), right)
                );
            case DIVISION:
                // (f/g)' = (f'g - fg') / g^2
                final Node numerator = this.builder.subtraction(
                        this.builder.multiplication(left.accept(this), right),
                        this.builder.multiplication(left, right.accept(this))
                );
                return this.builder.division(numerator, this.builder.exponentiation(right, new IntegerNode(2)));
            case EXPONENTIATION:
                return power(node, left, right);
            default:
                throw MathParserException.unknownOperator(node.symbol());
        }
    }

    private Node power(InfixExpressionNode node, Node base, Node exponent) {
        if (exponent instanceof IntegerNode) {
            final long n = ((IntegerNode) exponent).value();
            final Node lowered = this.builder.exponentiation(base, new IntegerNode(n - 1));
            return this.builder.multiplication(exponent, this.builder.multiplication(lowered, base.accept(this)));
        }
        if (exponent instanceof FloatNode) {
            final double n = ((FloatNode) exponent).value();
            final Node lowered = this.builder.exponentiation(base, new FloatNode(n - 1));
            return this.builder.multiplication(exponent, this.builder.multiplication(lowered, base.accept(this)));
        }
        if (exponent instanceof RationalNode) {
            final RationalNode n = (RationalNode) exponent;
            final Node lowered = this.builder.exponentiation(base, new RationalNode(n.numerator() - n.denominator(), n.denominator()));
            return this.builder.multiplication(exponent, this.builder.multiplication(lowered, base.accept(this)));
        }
        if (base instanceof ConstantNode && ((ConstantNode) base).name().equals("e"))
            return this.builder.multiplication(exponent.accept(this), node);

        // f^g = exp(g ln f), so (f^g)' = f^g (g' ln f + g f' / f)
        final Node logarithmic = this.builder.multiplication(exponent.accept(this), new FunctionNode("ln", base));
        final Node quotient = this.builder.division(this.builder.multiplication(exponent, base.accept(this)), base);
        return this.builder.multiplication(node, this.builder.addition(logarithmic, quotient));
    }

    @Override
    public Node visit(TernaryExpressionNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Node visit(FunctionNode node) {
        if (node.operand() == null) throw MathParserException.nullOperand();
        final Node argument = node.operand();
        final Node inner = argument.accept(this);
        final Node outer;

        switch (node.name()) {
            case "sin":
                outer = new FunctionNode("cos", argument);
                break;
            case "cos":
                outer = this.builder.unaryMinus(new FunctionNode("sin", argument));
                break;
            case "tan":
                outer = this.builder.addition(new IntegerNode(1), square(node));
                break;
            case "cot":
                outer = this.builder.subtraction(new IntegerNode(-1), square(node));
                break;
            case "arcsin":
                return this.builder.division(inner, new FunctionNode("sqrt", this.builder.subtraction(new IntegerNode(1), square(argument))));
            case "arccos":
                return this.builder.division(
                        this.builder.unaryMinus(inner),
                        new FunctionNode("sqrt", this.builder.subtraction(new IntegerNode(1), square(argument)))
                );
            case "arctan":
                return this.builder.division(inner, this.builder.addition(new IntegerNode(1), square(argument)));
            case "arccot":
                outer = this.builder.unaryMinus(
                        this.builder.division(new IntegerNode(1), this.builder.addition(new IntegerNode(1), square(argument)))
                );
                break;
            case "exp":
                outer = new FunctionNode("exp", argument);
                break;
            case "ln":
            case "log":
                return this.builder.division(inner, argument);
            case "lg":
                return this.builder.division(inner, this.builder.multiplication(new FunctionNode("ln", new IntegerNode(10)), argument));
            case "sqrt":
                return this.builder.division(inner, this.builder.multiplication(new IntegerNode(2), node));
            case "sinh":
                outer = new FunctionNode("cosh", argument);
                break;
            case "cosh":
                outer = new FunctionNode("sinh", argument);
                break;
            case "tanh":
            case "coth":
                outer = this.builder.subtraction(new IntegerNode(1), square(new FunctionNode(node.name(), argument)));
                break;
            case "arsinh":
                return this.builder.division(inner, new FunctionNode("sqrt", this.builder.addition(square(argument), new IntegerNode(1))));
            case "arcosh":
                return this.builder.division(inner, new FunctionNode("sqrt", this.builder.subtraction(square(argument), new IntegerNode(1))));
            case "artanh":
            case "arcoth":
                return this.builder.division(inner, this.builder.subtraction(new IntegerNode(1), square(argument)));
            case "abs":
                outer = new FunctionNode("sgn", argument);
                break;
            default:
                throw MathParserException.unknownFunction(node.name());
        }

        // chain rule
        return this.builder.multiplication(inner, outer);
    }

    private Node square(Node node) {
        return this.builder.exponentiation(node, new IntegerNode(2));
    }

}
