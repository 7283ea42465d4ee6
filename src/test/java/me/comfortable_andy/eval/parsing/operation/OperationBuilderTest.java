package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OperationBuilderTest {

    private static final VariableNode X = new VariableNode("x");
    private static final VariableNode Y = new VariableNode("y");
    private static final IntegerNode ZERO = new IntegerNode(0);
    private static final IntegerNode ONE = new IntegerNode(1);

    private final OperationBuilder builder = new OperationBuilder();

    @Test
    public void testIdentities() {
        assertEquals(X, this.builder.addition(ZERO, X));
        assertEquals(X, this.builder.addition(X, ZERO));
        assertEquals(X, this.builder.multiplication(X, ONE));
        assertEquals(X, this.builder.multiplication(ONE, X));
        assertEquals(ZERO, this.builder.multiplication(X, ZERO));
        assertEquals(X, this.builder.division(X, ONE));
        assertEquals(ZERO, this.builder.division(ZERO, X));
        assertEquals(ONE, this.builder.division(X, new VariableNode("x")));
        assertEquals(ZERO, this.builder.subtraction(X, new VariableNode("x")));
        assertEquals(ONE, this.builder.exponentiation(X, ZERO));
        assertEquals(X, this.builder.exponentiation(X, ONE));
        // subtracting zero is left alone
        assertEquals(new InfixExpressionNode(InfixOperator.SUBTRACTION, X, ZERO), this.builder.subtraction(X, ZERO));
    }

    @Test
    public void testPromotion() {
        assertEquals(new IntegerNode(5), this.builder.addition(new IntegerNode(2), new IntegerNode(3)));
        assertEquals(new RationalNode(5, 6), this.builder.addition(new RationalNode(1, 2), new RationalNode(1, 3)));
        assertEquals(new FloatNode(2.5), this.builder.addition(new FloatNode(1.5), ONE));
        assertEquals(new IntegerNode(8), this.builder.exponentiation(new IntegerNode(2), new IntegerNode(3)));
        assertEquals(new RationalNode(3, 2), this.builder.addition(ONE, new RationalNode(1, 2)));
        assertEquals(new IntegerNode(-1), this.builder.subtraction(new IntegerNode(2), new IntegerNode(3)));
        assertEquals(new FloatNode(1.0), this.builder.multiplication(new FloatNode(0.5), new IntegerNode(2)));
    }

    @Test
    public void testDivision() {
        assertEquals(new RationalNode(3, 2), this.builder.division(new RationalNode(1, 2), new RationalNode(1, 3)));
        // exact quotients stay rational even when whole
        assertEquals(new RationalNode(2, 1), this.builder.division(new IntegerNode(4), new IntegerNode(2)));
        assertEquals(new FloatNode(0.25), this.builder.division(new FloatNode(0.5), new IntegerNode(2)));
        final MathParserException exception = assertThrows(MathParserException.class, () -> this.builder.division(X, ZERO));
        assertEquals(MathParserException.Reason.DIVISION_BY_ZERO, exception.reason());
        assertThrows(MathParserException.class, () -> this.builder.division(ONE, new FloatNode(0.0)));
    }

    @Test
    public void testExponentiation() {
        final MathParserException exception = assertThrows(MathParserException.class, () -> this.builder.exponentiation(ZERO, ZERO));
        assertEquals(MathParserException.Reason.EXPONENTIAL, exception.reason());

        assertEquals(new RationalNode(1, 8), this.builder.exponentiation(new IntegerNode(2), new IntegerNode(-3)));
        assertThrows(MathParserException.class, () -> this.builder.exponentiation(ZERO, new IntegerNode(-1)));
        assertEquals(new FloatNode(Math.pow(10, 30)), this.builder.exponentiation(new IntegerNode(10), new IntegerNode(30)));
        assertEquals(new RationalNode(1, 4), this.builder.exponentiation(new RationalNode(1, 2), new IntegerNode(2)));
        // (x^2)^3 is x^6
        final Node squared = this.builder.exponentiation(X, new IntegerNode(2));
        assertEquals(new InfixExpressionNode(InfixOperator.EXPONENTIATION, X, new IntegerNode(6)), this.builder.exponentiation(squared, new IntegerNode(3)));
        // a symbolic exponent is not folded
        assertEquals(new InfixExpressionNode(InfixOperator.EXPONENTIATION, squared, Y), this.builder.exponentiation(squared, Y));
    }

    @Test
    public void testUnaryMinus() {
        assertEquals(new IntegerNode(-3), this.builder.unaryMinus(new IntegerNode(3)));
        assertEquals(new RationalNode(-1, 2), this.builder.unaryMinus(new RationalNode(1, 2)));
        assertEquals(InfixExpressionNode.negation(X), this.builder.unaryMinus(X));
        assertEquals(X, this.builder.unaryMinus(InfixExpressionNode.negation(X)));
        assertEquals(InfixExpressionNode.negation(X), this.builder.subtraction(X, null));
    }

    @Test
    public void testRelational() {
        assertEquals(BooleanNode.TRUE, this.builder.relation(new IntegerNode(3), new IntegerNode(2), InfixOperator.GREATER_THAN));
        assertEquals(BooleanNode.TRUE, this.builder.relation(new RationalNode(1, 2), new FloatNode(0.5), InfixOperator.EQUAL_TO));
        assertEquals(BooleanNode.FALSE, this.builder.relation(new RationalNode(1, 3), new RationalNode(1, 2), InfixOperator.GREATER_OR_EQUAL_THAN));
        assertEquals(BooleanNode.TRUE, this.builder.relation(X, new VariableNode("x"), InfixOperator.LESS_OR_EQUAL_THAN));
        assertEquals(BooleanNode.TRUE, this.builder.relation(BooleanNode.TRUE, BooleanNode.FALSE, InfixOperator.DIFFERENT_THAN));
        assertEquals(new InfixExpressionNode(InfixOperator.LESS_THAN, X, Y), this.builder.relation(X, Y, InfixOperator.LESS_THAN));
        assertEquals(BooleanNode.TRUE, new RelationalOperation().makeNode(new IntegerNode(1), new IntegerNode(1), ">="));
        assertThrows(MathParserException.class, () -> new RelationalOperation().evaluate(X, Y, InfixOperator.ADDITION));
    }

    @Test
    public void testLogical() {
        final Node comparison = new InfixExpressionNode(InfixOperator.GREATER_THAN, X, new IntegerNode(2));
        assertEquals(BooleanNode.FALSE, this.builder.conjunction(BooleanNode.TRUE, BooleanNode.FALSE));
        assertEquals(BooleanNode.TRUE, this.builder.disjunction(BooleanNode.TRUE, BooleanNode.FALSE));
        // nested comparisons fold first
        final Node nested = new InfixExpressionNode(InfixOperator.DIFFERENT_THAN, ONE, ZERO);
        assertEquals(BooleanNode.TRUE, this.builder.conjunction(nested, nested));
        assertEquals(new InfixExpressionNode(InfixOperator.AND, comparison, BooleanNode.TRUE), this.builder.conjunction(comparison, nested));
        // the spelling survives
        assertEquals(InfixOperator.OR_WORD, ((InfixExpressionNode) new DisjunctionOperation().makeNode(comparison, Y, InfixOperator.OR_WORD)).operator());
        final MathParserException exception = assertThrows(MathParserException.class,
                () -> new ConjunctionOperation().makeNode(X, Y, InfixOperator.OR));
        assertEquals(MathParserException.Reason.UNEXPECTED_OPERATOR, exception.reason());
    }

    @Test
    public void testCondition() {
        assertEquals(X, this.builder.condition(BooleanNode.TRUE, X, Y));
        assertEquals(Y, this.builder.condition(BooleanNode.FALSE, X, Y));
        assertEquals(Y, this.builder.condition(ZERO, X, Y));
        assertEquals(X, this.builder.condition(new InfixExpressionNode(InfixOperator.LESS_THAN, ONE, new IntegerNode(2)), X, Y));
        final Node open = new InfixExpressionNode(InfixOperator.GREATER_THAN, X, new IntegerNode(2));
        assertEquals(new TernaryExpressionNode(open, X, Y), this.builder.condition(open, X, Y));
        assertThrows(MathParserException.class,
                () -> this.builder.condition(new InfixExpressionNode(InfixOperator.GREATER_THAN, X, null), X, Y));
    }

    @Test
    public void testSimplify() {
        assertEquals(new IntegerNode(3), this.builder.simplify(new InfixExpressionNode("+", ONE, new IntegerNode(2))));
        assertEquals(new IntegerNode(-2), this.builder.simplify(new InfixExpressionNode(InfixOperator.UNARY_MINUS, new IntegerNode(2), null)));
        assertEquals(BooleanNode.TRUE, this.builder.simplify(new InfixExpressionNode("=", ONE, ONE)));
        assertEquals(Y, this.builder.simplify(new TernaryExpressionNode(BooleanNode.FALSE, X, Y)));
        assertEquals(X, this.builder.simplify(X));

        MathParserException exception = assertThrows(MathParserException.class,
                () -> this.builder.simplify(new InfixExpressionNode("*", X, null)));
        assertEquals(MathParserException.Reason.NULL_OPERAND, exception.reason());
        exception = assertThrows(MathParserException.class,
                () -> this.builder.simplify(new TernaryExpressionNode(null, X, Y)));
        assertEquals(MathParserException.Reason.NULL_OPERAND, exception.reason());
    }

    @Test
    public void testLongOverflowDegradesToFloat() {
        final IntegerNode max = new IntegerNode(Long.MAX_VALUE);
        final IntegerNode min = new IntegerNode(Long.MIN_VALUE);
        final IntegerNode twoToThe32 = new IntegerNode(4294967296L);
        assertEquals(new FloatNode(0x1p63), this.builder.addition(max, ONE));
        assertEquals(new FloatNode(-0x1p63), this.builder.subtraction(min, ONE));
        assertEquals(new FloatNode(0x1p64), this.builder.multiplication(twoToThe32, twoToThe32));
        assertEquals(new FloatNode(0x1p63), this.builder.unaryMinus(min));
        assertEquals(new IntegerNode(-Long.MAX_VALUE), this.builder.unaryMinus(max));
        // the largest sum that still fits stays exact
        assertEquals(max, this.builder.addition(new IntegerNode(Long.MAX_VALUE - 1), ONE));
    }

    @Test
    public void testRationalOverflowDegradesToFloat() {
        final RationalNode tiny = new RationalNode(1, 4294967296L);
        assertEquals(new FloatNode(0x1p-64), this.builder.multiplication(tiny, tiny));
        assertEquals(new FloatNode(0x1p-32 / 0x1p32), this.builder.division(tiny, new IntegerNode(4294967296L)));
        final Node sum = this.builder.addition(new RationalNode(1, 3037000500L), new RationalNode(1, 3037000501L));
        assertTrue(sum instanceof FloatNode);
        assertEquals(1.0 / 3037000500L + 1.0 / 3037000501L, ((FloatNode) sum).value());
        assertEquals(BooleanNode.TRUE, this.builder.relation(new RationalNode(1, 3037000500L), new RationalNode(1, 3037000501L), InfixOperator.GREATER_THAN));
    }

    @Test
    public void testRationalPowerOutOfRange() {
        final Node large = this.builder.exponentiation(new RationalNode(3, 2), new IntegerNode(200));
        assertEquals(new FloatNode(Math.pow(1.5, 200)), large);
        final Node small = this.builder.exponentiation(new RationalNode(1, 2), new RationalNode(400, 2));
        assertEquals(new FloatNode(Math.pow(0.5, 200)), small);
    }

}
