package me.comfortable_andy.eval.parsing;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.lexing.Token;
import me.comfortable_andy.eval.lexing.TokenType;
import me.comfortable_andy.eval.parsing.node.*;
import me.comfortable_andy.eval.parsing.operation.OperationBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import java.util.stream.Collectors;

/**
 * Turns a token list into a syntax tree with the shunting yard algorithm.
 * <p>
 * Operands go onto an operand stack, operators wait on an operator stack until an operator of
 * lower precedence, a closing delimiter or the end of input forces them to be reduced. When
 * simplifying, every reduced node goes through the {@link OperationBuilder}, so constant
 * sub-expressions are folded (and division by zero is reported) while parsing.
 * <p>
 * The flags are read once per {@link #parse(List)} call, and all other state lives in that call,
 * so one parser can serve several threads.
 *
 * @author AndyNoob
 */
@Slf4j
@Getter
@Setter
@Accessors(chain = true)
public class Parser {

    private volatile boolean implicitMultiplication;
    private volatile boolean simplifying;
    private volatile boolean debugMode;

    public Parser() {
        this(true, true, false);
    }

    public Parser(boolean implicitMultiplication, boolean simplifying, boolean debugMode) {
        this.implicitMultiplication = implicitMultiplication;
        this.simplifying = simplifying;
        this.debugMode = debugMode;
    }

    public Node parse(List<Token> tokens) {
        List<Token> processed = filterTokens(tokens);
        if (this.implicitMultiplication) processed = insertImplicitMultiplication(processed);
        return new ParseState(this.simplifying, this.debugMode).shuntingYard(processed);
    }

    /**
     * Drops the whitespace tokens.
     */
    public static List<Token> filterTokens(List<Token> tokens) {
        return tokens.stream()
                .filter(token -> token.type() != TokenType.WHITESPACE)
                .collect(Collectors.toList());
    }

    /**
     * Inserts a {@code *} between every two adjacent tokens that form an implied product.
     *
     * @see Token#canFactorsInImplicitMultiplication(Token, Token)
     */
    public static List<Token> insertImplicitMultiplication(List<Token> tokens) {
        final List<Token> result = new ArrayList<>();
        Token last = null;
        for (Token token : tokens) {
            if (Token.canFactorsInImplicitMultiplication(last, token))
                result.add(new Token("*", TokenType.MULTIPLICATION_OPERATOR));
            result.add(token);
            last = token;
        }
        return result;
    }

    /**
     * The stacks of one parse.
     */
    private static final class ParseState {

        private final boolean simplifying;
        private final boolean debugMode;
        private final OperationBuilder builder = new OperationBuilder();
        private final Stack<Node> operands = new Stack<>();
        private final Stack<Node> operators = new Stack<>();
        private final List<String[]> trace = new ArrayList<>();

        // previous accepted node, decides whether + and - are unary
        private Node lastNode;

        private ParseState(boolean simplifying, boolean debugMode) {
            this.simplifying = simplifying;
            this.debugMode = debugMode;
        }

        private Node shuntingYard(List<Token> tokens) {
            for (Token token : tokens) {
                if (this.debugMode)
                    this.trace.add(new String[]{token.value(), this.operands.toString(), this.operators.toString()});
                processToken(token);
            }

            if (this.debugMode) printTrace();

            while (!this.operators.isEmpty())
                this.operands.push(populateNode(this.operators.pop()));

            if (this.operands.size() != 1) throw MathParserException.syntaxError();
            return this.operands.pop();
        }

        private void processToken(Token token) {
            Node node = Node.factory(token);

            switch (node.kind()) {
                case INTEGER:
                case RATIONAL:
                case FLOAT:
                case BOOLEAN:
                case VARIABLE:
                case CONSTANT:
                case STRING:
                    this.operands.push(node);
                    break;
                case INFIX:
                    node = handleInfixOperator((InfixExpressionNode) node);
                    // unary plus is dropped and leaves no trace
                    if (node == null) return;
                    break;
                case POSTFIX:
                    if (this.operands.isEmpty()) throw MathParserException.syntaxError();
                    this.operands.push(((PostfixExpressionNode) node).apply(this.operands.pop()));
                    break;
                case TERNARY:
                case PENDING_FUNCTION:
                case OPEN_PARENTHESIS:
                case OPEN_BRACE:
                    this.operators.push(node);
                    break;
                case CLOSE_PARENTHESIS:
                    handleCloseParenthesis();
                    return;
                case CLOSE_BRACE:
                    handleCloseBrace();
                    break;
                case UNMAPPED:
                    return;
                default:
                    // terminators only separate, but still start a new operand
                    break;
            }

            this.lastNode = node;
        }

        /**
         * @return the node actually pushed, null if it was a discarded unary plus
         */
        private InfixExpressionNode handleInfixOperator(InfixExpressionNode node) {
            if (isUnary(node)) {
                if (node.operator() == InfixOperator.ADDITION) return null;
                node = new InfixExpressionNode(InfixOperator.UNARY_MINUS, null, null);
                // a prefix operator has no left operand, so nothing before it can be reduced yet
                this.operators.push(node);
                return node;
            }

            while (!this.operators.isEmpty() && node.lowerPrecedenceThan(this.operators.peek()))
                this.operands.push(populateNode(this.operators.pop()));

            this.operators.push(node);
            return node;
        }

        private boolean isUnary(InfixExpressionNode node) {
            if (!node.canBeUnary()) return false;
            if (this.operators.isEmpty() && this.operands.isEmpty()) return true;
            final Node last = this.lastNode;
            if (last instanceof OpenParenthesisNode || last instanceof OpenBraceNode) return true;
            if (last instanceof TerminatorNode) return true;
            return last instanceof InfixExpressionNode && ((InfixExpressionNode) last).operator() == InfixOperator.UNARY_MINUS;
        }

        private void handleCloseParenthesis() {
            boolean matched = false;
            while (!this.operators.isEmpty()) {
                final Node popped = this.operators.pop();
                if (popped instanceof OpenParenthesisNode) {
                    matched = true;
                    break;
                }
                this.operands.push(populateNode(popped));
            }
            if (!matched) throw MathParserException.delimiterMismatch(")");

            // the parentheses held a function argument
            if (!this.operators.isEmpty() && this.operators.peek() instanceof PendingFunctionNode) {
                final PendingFunctionNode function = (PendingFunctionNode) this.operators.pop();
                if (this.operands.isEmpty()) throw MathParserException.syntaxError();
                this.operands.push(function.apply(this.operands.pop()));
            }
        }

        private void handleCloseBrace() {
            while (!this.operators.isEmpty()) {
                final Node popped = this.operators.pop();
                if (popped instanceof OpenBraceNode) return;
                this.operands.push(populateNode(popped));
            }
            throw MathParserException.delimiterMismatch("}");
        }

        private Node populateNode(Node node) {
            if (node instanceof PendingFunctionNode)
                throw MathParserException.delimiterMismatch(((PendingFunctionNode) node).name());
            if (node instanceof OpenParenthesisNode) throw MathParserException.delimiterMismatch("(");
            if (node instanceof OpenBraceNode) throw MathParserException.delimiterMismatch("{");

            if (node instanceof TernaryExpressionNode) {
                final Node otherwise = popOperand();
                final Node then = popOperand();
                final Node condition = popOperand();
                final TernaryExpressionNode ternary = ((TernaryExpressionNode) node).withOperands(condition, then, otherwise);
                return this.simplifying ? this.builder.simplify(ternary) : ternary;
            }

            if (!(node instanceof InfixExpressionNode)) throw MathParserException.syntaxError();
            final InfixExpressionNode infix = (InfixExpressionNode) node;

            if (infix.operator() == InfixOperator.UNARY_MINUS) {
                final Node operand = popOperand();
                return this.simplifying ? this.builder.unaryMinus(operand) : InfixExpressionNode.negation(operand);
            }

            final Node right = popOperand();
            final Node left = popOperand();
            final InfixExpressionNode populated = infix.withOperands(left, right);
            return this.simplifying ? this.builder.simplify(populated) : populated;
        }

        private Node popOperand() {
            if (this.operands.isEmpty()) throw MathParserException.syntaxError();
            return this.operands.pop();
        }

        private void printTrace() {
            int width = "token".length();
            for (String[] row : this.trace)
                width = Math.max(width, row[0].length());
            final String format = "%-" + width + "s | %s | %s";
            final StringBuilder table = new StringBuilder(String.format(format, "token", "rpn_output", "operator_stack"));
            for (String[] row : this.trace)
                table.append(System.lineSeparator()).append(String.format(format, (Object[]) row));
            log.debug("Shunting yard trace:{}{}", System.lineSeparator(), table);
        }

    }

}
