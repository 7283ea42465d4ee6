package me.comfortable_andy.eval.lexing;

/**
 * Complex arithmetic, adding the imaginary unit and the functions that take a complex apart.
 *
 * @author AndyNoob
 */
public class ComplexMathLexer extends Lexer {

    public ComplexMathLexer() {
        add(new TokenDefinition("arg", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("conj", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("re", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("im", TokenType.FUNCTION_NAME));

        add(new TokenDefinition("i", TokenType.CONSTANT));
        add(new TokenDefinition("e", TokenType.CONSTANT));
        add(new TokenDefinition("[a-zA-Z]", TokenType.VARIABLE));
    }

}
