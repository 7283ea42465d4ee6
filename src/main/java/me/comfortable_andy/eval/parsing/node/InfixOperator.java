package me.comfortable_andy.eval.parsing.node;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import me.comfortable_andy.eval.exception.MathParserException;

/**
 * The fixed set of binary operators plus the parser's internal unary minus marker {@code ~}.
 *
 * @author AndyNoob
 */
@Getter
@RequiredArgsConstructor
public enum InfixOperator {
    AND("&&", 1, Associativity.LEFT, 1),
    OR("||", 1, Associativity.LEFT, 1),
    AND_WORD("AND", 1, Associativity.LEFT, 1),
    OR_WORD("OR", 1, Associativity.LEFT, 1),
    EQUAL_TO("=", 2, Associativity.LEFT, 1),
    DIFFERENT_THAN("<>", 2, Associativity.LEFT, 1),
    GREATER_THAN(">", 2, Associativity.LEFT, 1),
    LESS_THAN("<", 2, Associativity.LEFT, 1),
    GREATER_OR_EQUAL_THAN(">=", 2, Associativity.LEFT, 1),
    LESS_OR_EQUAL_THAN("<=", 2, Associativity.LEFT, 1),
    ADDITION("+", 3, Associativity.LEFT, 1),
    SUBTRACTION("-", 3, Associativity.LEFT, 1),
    UNARY_MINUS("~", 3, Associativity.LEFT, 1),
    MULTIPLICATION("*", 4, Associativity.LEFT, 1),
    DIVISION("/", 4, Associativity.LEFT, 3),
    EXPONENTIATION("^", 5, Associativity.RIGHT, 8),
    ;

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;
    // added to the operands' complexity
    private final int weight;

    public static InfixOperator valueOfSymbol(String symbol) {
        for (InfixOperator operator : values()) {
            if (operator.symbol.equals(symbol)) return operator;
        }
        throw MathParserException.unknownOperator(symbol);
    }

    public boolean isRelational() {
        return this.precedence == 2;
    }

    public boolean isLogical() {
        return this.precedence == 1;
    }

    public boolean isConjunction() {
        return this == AND || this == AND_WORD;
    }

    public boolean canBeUnary() {
        return this == ADDITION || this == SUBTRACTION || this == UNARY_MINUS;
    }

    public enum Associativity {
        LEFT, RIGHT
    }

}
