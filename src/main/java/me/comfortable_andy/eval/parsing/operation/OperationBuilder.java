package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;

/**
 * Entry point to the simplifying node constructors. The parser passes every node it reduces
 * through {@link #simplify(Node)}; the differentiator uses the individual operations to keep its
 * results tidy.
 *
 * @author AndyNoob
 */
public class OperationBuilder {

    private final AdditionOperation addition = new AdditionOperation();
    private final SubtractionOperation subtraction = new SubtractionOperation();
    private final MultiplicationOperation multiplication = new MultiplicationOperation();
    private final DivisionOperation division = new DivisionOperation();
    private final ExponentiationOperation exponentiation = new ExponentiationOperation();
    private final RelationalOperation relational = new RelationalOperation();
    private final ConjunctionOperation conjunction = new ConjunctionOperation();
    private final DisjunctionOperation disjunction = new DisjunctionOperation();
    private final ConditionOperation condition = new ConditionOperation();

    public Node addition(Node left, Node right) {
        return this.addition.makeNode(left, right);
    }

    public Node subtraction(Node left, /* nullable */ Node right) {
        return this.subtraction.makeNode(left, right);
    }

    public Node unaryMinus(Node operand) {
        return this.subtraction.createUnaryMinusNode(operand);
    }

    public Node multiplication(Node left, Node right) {
        return this.multiplication.makeNode(left, right);
    }

    public Node division(Node left, Node right) {
        return this.division.makeNode(left, right);
    }

    public Node exponentiation(Node left, Node right) {
        return this.exponentiation.makeNode(left, right);
    }

    public Node relation(Node left, Node right, InfixOperator operator) {
        return this.relational.makeNode(left, right, operator);
    }

    public Node conjunction(Node left, Node right) {
        return this.conjunction.makeNode(left, right);
    }

    public Node disjunction(Node left, Node right) {
        return this.disjunction.makeNode(left, right);
    }

    public Node condition(Node condition, Node then, Node otherwise) {
        return this.condition.makeNode(condition, then, otherwise);
    }

    /**
     * Rebuilds a populated operator node through the matching operation. Nodes that are not
     * operators come back unchanged.
     */
    public Node simplify(Node node) {
        if (node instanceof TernaryExpressionNode) {
            final TernaryExpressionNode ternary = (TernaryExpressionNode) node;
            if (ternary.condition() == null || ternary.left() == null || ternary.right() == null)
                throw MathParserException.nullOperand();
            return condition(ternary.condition(), ternary.left(), ternary.right());
        }
        if (!(node instanceof InfixExpressionNode)) return node;

        final InfixExpressionNode infix = (InfixExpressionNode) node;
        final InfixOperator operator = infix.operator();
        final Node left = infix.left();
        final Node right = infix.right();
        final boolean prefix = operator == InfixOperator.SUBTRACTION || operator == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();

        switch (operator) {
            case ADDITION:
                return addition(left, right);
            case SUBTRACTION:
                return subtraction(left, right);
            case UNARY_MINUS:
                return unaryMinus(left);
            case MULTIPLICATION:
                return multiplication(left, right);
            case DIVISION:
                return division(left, right);
            case EXPONENTIATION:
                return exponentiation(left, right);
            case AND:
            case AND_WORD:
                return this.conjunction.makeNode(left, right, operator);
            case OR:
            case OR_WORD:
                return this.disjunction.makeNode(left, right, operator);
            default:
                return relation(left, right, operator);
        }
    }

}
