package me.comfortable_andy.eval.lexing;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A pattern that recognizes one kind of token at the current input position.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
public final class TokenDefinition {

    private final Pattern pattern;
    private final TokenType type;
    private final /* nullable */ String standardValue;

    public TokenDefinition(String regex, TokenType type, String standardValue) {
        this.pattern = Pattern.compile(regex);
        this.type = type;
        this.standardValue = standardValue;
    }

    public TokenDefinition(String regex, TokenType type) {
        this(regex, type, null);
    }

    /**
     * @return the token starting exactly at {@code offset}, or null if this definition does not match there
     */
    public Token match(String input, int offset) {
        final Matcher matcher = this.pattern.matcher(input);
        matcher.region(offset, input.length());
        if (!matcher.lookingAt() || matcher.end() == offset) return null;
        final String matched = matcher.group();
        return new Token(this.standardValue == null ? matched : this.standardValue, this.type, matched);
    }

}
