package me.comfortable_andy.eval.lexing;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Every kind of token a lexer can emit. The two flags say whether a token of this kind may sit on
 * the left or the right of an implied multiplication, e.g. {@code 2x} or {@code (a)(b)}.
 *
 * @author AndyNoob
 */
@Getter
@RequiredArgsConstructor
public enum TokenType {
    // operands
    NATURAL_NUMBER(true, true),
    INTEGER(true, true),
    RATIONAL_NUMBER(false, false),
    REAL_NUMBER(true, true),
    BOOLEAN(false, false),
    VARIABLE(true, true),
    CONSTANT(true, true),
    STRING(false, false),

    // prefix
    UNARY_MINUS(false, false),
    NOT(false, false),

    // postfix
    FACTORIAL_OPERATOR(true, false),
    SEMI_FACTORIAL_OPERATOR(true, false),

    // infix
    ADDITION_OPERATOR(false, false),
    SUBTRACTION_OPERATOR(false, false),
    MULTIPLICATION_OPERATOR(false, false),
    DIVISION_OPERATOR(false, false),
    EXPONENTIAL_OPERATOR(false, false),
    EQUAL_TO(false, false),
    DIFFERENT_THAN(false, false),
    GREATER_THAN(false, false),
    LESS_THAN(false, false),
    GREATER_OR_EQUAL_THAN(false, false),
    LESS_OR_EQUAL_THAN(false, false),
    AND(false, false),
    OR(false, false),

    // ternary
    IF(false, false),
    THEN(false, false),
    ELSE(false, false),

    FUNCTION_NAME(true, true),

    OPEN_PARENTHESIS(false, true),
    CLOSE_PARENTHESIS(true, false),
    OPEN_BRACE(false, false),
    CLOSE_BRACE(false, false),
    WHITESPACE(false, false),
    NEW_LINE(false, false),
    TERMINATOR(false, false),
    SENTINEL(false, false),
    ;

    private final boolean leftFactor;
    private final boolean rightFactor;

}
