package me.comfortable_andy.eval.lexing;

import me.comfortable_andy.eval.exception.MathParserException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits an expression into tokens by trying each registered definition, in registration order,
 * at the current position. The first definition that matches wins, so longer names must be
 * registered before their prefixes ({@code sinh} before {@code sin}).
 * <p>
 * This base registers the numbers, functions, operators and delimiters every dialect shares;
 * subclasses append their own constants, variables and keywords.
 *
 * @author AndyNoob
 */
public abstract class Lexer {

    private final List<TokenDefinition> definitions = new ArrayList<>();

    protected Lexer() {
        add(new TokenDefinition("\\d+[,.]\\d+(e[+-]?\\d+)?", TokenType.REAL_NUMBER));
        add(new TokenDefinition("\\d+", TokenType.NATURAL_NUMBER));
        add(new TokenDefinition("\\d*(\\.\\d\\d)", TokenType.STRING));

        add(new TokenDefinition("sqrt", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("round", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("ceil", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("floor", TokenType.FUNCTION_NAME));

        // degree based trigonometry
        add(new TokenDefinition("sind", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("cosd", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("tand", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("cotd", TokenType.FUNCTION_NAME));

        add(new TokenDefinition("sinh", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("cosh", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("tanh", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("coth", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("sin", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("cos", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("tan", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("cot", TokenType.FUNCTION_NAME));

        add(new TokenDefinition("arcsin|asin", TokenType.FUNCTION_NAME, "arcsin"));
        add(new TokenDefinition("arccos|acos", TokenType.FUNCTION_NAME, "arccos"));
        add(new TokenDefinition("arctan|atan", TokenType.FUNCTION_NAME, "arctan"));
        add(new TokenDefinition("arccot|acot", TokenType.FUNCTION_NAME, "arccot"));
        add(new TokenDefinition("arsinh|arcsinh|asinh", TokenType.FUNCTION_NAME, "arsinh"));
        add(new TokenDefinition("arcosh|arccosh|acosh", TokenType.FUNCTION_NAME, "arcosh"));
        add(new TokenDefinition("artanh|arctanh|atanh", TokenType.FUNCTION_NAME, "artanh"));
        add(new TokenDefinition("arcoth|arccoth|acoth", TokenType.FUNCTION_NAME, "arcoth"));

        add(new TokenDefinition("exp", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("log10|lg", TokenType.FUNCTION_NAME, "lg"));
        add(new TokenDefinition("log", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("ln", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("abs", TokenType.FUNCTION_NAME));
        add(new TokenDefinition("sgn", TokenType.FUNCTION_NAME));

        add(new TokenDefinition("\\(", TokenType.OPEN_PARENTHESIS));
        add(new TokenDefinition("\\)", TokenType.CLOSE_PARENTHESIS));
        add(new TokenDefinition("\\{", TokenType.OPEN_BRACE));
        add(new TokenDefinition("}", TokenType.CLOSE_BRACE));

        add(new TokenDefinition("\\+", TokenType.ADDITION_OPERATOR));
        add(new TokenDefinition("-", TokenType.SUBTRACTION_OPERATOR));
        add(new TokenDefinition("\\*", TokenType.MULTIPLICATION_OPERATOR));
        add(new TokenDefinition("/", TokenType.DIVISION_OPERATOR));
        add(new TokenDefinition("\\^", TokenType.EXPONENTIAL_OPERATOR));

        add(new TokenDefinition("!!", TokenType.SEMI_FACTORIAL_OPERATOR));
        add(new TokenDefinition("!", TokenType.FACTORIAL_OPERATOR));

        add(new TokenDefinition("NAN", TokenType.CONSTANT));
        add(new TokenDefinition("INF", TokenType.CONSTANT));
        add(new TokenDefinition("pi", TokenType.CONSTANT));

        add(new TokenDefinition(",", TokenType.TERMINATOR));
        add(new TokenDefinition(";", TokenType.TERMINATOR));
        add(new TokenDefinition("\n", TokenType.TERMINATOR));
        add(new TokenDefinition("\\s+", TokenType.WHITESPACE));
    }

    protected final void add(TokenDefinition definition) {
        this.definitions.add(definition);
    }

    public List<TokenDefinition> getDefinitions() {
        return Collections.unmodifiableList(this.definitions);
    }

    public List<Token> tokenize(String input) {
        final List<Token> tokens = new ArrayList<>();
        int offset = 0;
        while (offset < input.length()) {
            final Token token = nextToken(input, offset);
            if (token == null)
                throw MathParserException.unknownToken(String.valueOf(input.charAt(offset)));
            tokens.add(token);
            offset += token.length();
        }
        return tokens;
    }

    private Token nextToken(String input, int offset) {
        for (TokenDefinition definition : this.definitions) {
            final Token token = definition.match(input, offset);
            if (token != null) return token;
        }
        return null;
    }

}
