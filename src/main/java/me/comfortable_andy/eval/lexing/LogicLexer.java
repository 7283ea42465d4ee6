package me.comfortable_andy.eval.lexing;

/**
 * Conditionals, comparisons and boolean connectives. Variables may be whole words here, which is
 * why implicit multiplication is usually switched off with this dialect.
 *
 * @author AndyNoob
 */
public class LogicLexer extends Lexer {

    public LogicLexer() {
        add(new TokenDefinition("IF|if", TokenType.IF, "if"));
        add(new TokenDefinition("THEN|then", TokenType.THEN, "then"));
        add(new TokenDefinition("ELSE|else", TokenType.ELSE, "else"));

        add(new TokenDefinition("NOT", TokenType.NOT));

        add(new TokenDefinition("=", TokenType.EQUAL_TO));
        add(new TokenDefinition("<>", TokenType.DIFFERENT_THAN));
        add(new TokenDefinition(">=", TokenType.GREATER_OR_EQUAL_THAN));
        add(new TokenDefinition("<=", TokenType.LESS_OR_EQUAL_THAN));
        add(new TokenDefinition(">", TokenType.GREATER_THAN));
        add(new TokenDefinition("<", TokenType.LESS_THAN));
        add(new TokenDefinition("&&", TokenType.AND));
        add(new TokenDefinition("\\|\\|", TokenType.OR));
        add(new TokenDefinition("AND", TokenType.AND));
        add(new TokenDefinition("OR", TokenType.OR));

        add(new TokenDefinition("TRUE|true|FALSE|false", TokenType.BOOLEAN));
        add(new TokenDefinition("e", TokenType.CONSTANT));
        add(new TokenDefinition("[a-zA-Z]+", TokenType.VARIABLE));
    }

}
