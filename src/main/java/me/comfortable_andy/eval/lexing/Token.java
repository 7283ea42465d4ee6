package me.comfortable_andy.eval.lexing;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A lexeme with its kind. {@code value} is the standardized text (e.g. {@code asin} becomes
 * {@code arcsin}), {@code match} is what was actually read from the input.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor
public final class Token {

    private final String value;
    private final TokenType type;
    private final String match;

    public Token(String value, TokenType type) {
        this(value, type, value);
    }

    public int length() {
        return this.match.length();
    }

    /**
     * @return whether a {@code *} should be inserted between the two tokens
     */
    public static boolean canFactorsInImplicitMultiplication(/* nullable */ Token first, /* nullable */ Token second) {
        if (first == null || second == null) return false;
        // sin(x) is an application, not a product
        if (first.type == TokenType.FUNCTION_NAME && second.type == TokenType.OPEN_PARENTHESIS) return false;
        return first.type.isLeftFactor() && second.type.isRightFactor();
    }

    @Override
    public String toString() {
        return this.value;
    }

}
