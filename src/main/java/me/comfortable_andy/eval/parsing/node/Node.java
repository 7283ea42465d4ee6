package me.comfortable_andy.eval.parsing.node;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.lexing.Token;
import me.comfortable_andy.eval.number.Rational;

/**
 * A node of the abstract syntax tree. Nodes are immutable; operations that "change" a node
 * build a new one.
 *
 * @author AndyNoob
 */
public abstract class Node {

    public abstract <T> T accept(Visitor<T> visitor);

    public abstract NodeKind kind();

    /**
     * A rough cost of the subtree, used by printers to pick between compact and explicit forms.
     */
    public abstract int complexity();

    /**
     * Structural equality, except that an integer and a rational with denominator 1 holding the
     * same value are considered the same. Floats only ever match floats.
     */
    public abstract boolean sameAs(/* nullable */ Node other);

    public boolean isNumeric() {
        return kind().isNumeric();
    }

    public boolean isStructural() {
        return kind().isStructural();
    }

    protected static boolean sameAs(/* nullable */ Node a, /* nullable */ Node b) {
        if (a == null) return b == null;
        return a.sameAs(b);
    }

    /**
     * Maps a token to the node the parser works with.
     */
    public static Node factory(Token token) {
        switch (token.type()) {
            case ADDITION_OPERATOR:
            case SUBTRACTION_OPERATOR:
            case MULTIPLICATION_OPERATOR:
            case DIVISION_OPERATOR:
            case EXPONENTIAL_OPERATOR:
            case EQUAL_TO:
            case DIFFERENT_THAN:
            case GREATER_THAN:
            case LESS_THAN:
            case GREATER_OR_EQUAL_THAN:
            case LESS_OR_EQUAL_THAN:
            case AND:
            case OR:
                return new InfixExpressionNode(token.value(), null, null);
            case NATURAL_NUMBER:
            case INTEGER:
                return new IntegerNode(parseInteger(token.value()));
            case RATIONAL_NUMBER:
                return new RationalNode(Rational.parse(token.value()));
            case REAL_NUMBER:
                return new FloatNode(Double.parseDouble(token.value().replace(',', '.')));
            case BOOLEAN:
                return BooleanNode.parse(token.value());
            case VARIABLE:
                return new VariableNode(token.value());
            case CONSTANT:
                return new ConstantNode(token.value());
            case STRING:
                return new StringNode(token.value());
            case FUNCTION_NAME:
                return new PendingFunctionNode(token.value());
            case OPEN_PARENTHESIS:
                return new OpenParenthesisNode();
            case CLOSE_PARENTHESIS:
                return new CloseParenthesisNode();
            case OPEN_BRACE:
                return new OpenBraceNode();
            case CLOSE_BRACE:
                return new CloseBraceNode();
            case IF:
                return new TernaryExpressionNode(null, null, null);
            case FACTORIAL_OPERATOR:
                return new PostfixExpressionNode("!");
            case SEMI_FACTORIAL_OPERATOR:
                return new PostfixExpressionNode("!!");
            case TERMINATOR:
                return new TerminatorNode();
            case NOT:
            case UNARY_MINUS:
                // prefix operators only exist as the parser's own unary minus marker
                throw MathParserException.unknownOperator(token.value());
            default:
                return new UnmappedNode(token.value());
        }
    }

    private static long parseInteger(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw MathParserException.syntaxError();
        }
    }

}
