package me.comfortable_andy.eval.lexing;

/**
 * Real-valued arithmetic: single letter variables and Euler's number.
 *
 * @author AndyNoob
 */
public class StdMathLexer extends Lexer {

    public StdMathLexer() {
        add(new TokenDefinition("e", TokenType.CONSTANT));
        add(new TokenDefinition("[a-zA-Z]", TokenType.VARIABLE));
    }

}
