package me.comfortable_andy.eval.lexing;

import me.comfortable_andy.eval.exception.MathParserException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.diogonunes.jcolor.Ansi.colorize;
import static com.diogonunes.jcolor.Attribute.*;
import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    private static List<String> values(List<Token> tokens) {
        return tokens.stream().map(Token::value).collect(Collectors.toList());
    }

    @Test
    public void testStdMath() {
        final List<Token> tokens = new StdMathLexer().tokenize("sin(2x) + 3.5");
        System.out.println("Tokens: " + colorize(tokens.toString(), BRIGHT_BLACK_BACK()));
        assertEquals(Arrays.asList(
                TokenType.FUNCTION_NAME, TokenType.OPEN_PARENTHESIS, TokenType.NATURAL_NUMBER, TokenType.VARIABLE,
                TokenType.CLOSE_PARENTHESIS, TokenType.WHITESPACE, TokenType.ADDITION_OPERATOR, TokenType.WHITESPACE,
                TokenType.REAL_NUMBER
        ), types(tokens));
    }

    @Test
    public void testStandardizedNames() {
        final List<Token> tokens = new StdMathLexer().tokenize("asin(x)+log10(x)");
        final Token asin = tokens.get(0);
        assertEquals("arcsin", asin.value());
        assertEquals("asin", asin.match());
        assertEquals(4, asin.length());
        assertEquals("lg", tokens.get(5).value());
    }

    @Test
    public void testNumbers() {
        assertEquals(Arrays.asList("3.5e-2"), values(new StdMathLexer().tokenize("3.5e-2")));
        assertEquals(TokenType.REAL_NUMBER, new StdMathLexer().tokenize("2,5").get(0).type());
        assertEquals(Arrays.asList("12", "!!", "!"), values(new StdMathLexer().tokenize("12!!!")));
    }

    @Test
    public void testConstantsAndVariables() {
        final List<Token> tokens = new StdMathLexer().tokenize("pi e xy");
        assertEquals(Arrays.asList(
                TokenType.CONSTANT, TokenType.WHITESPACE, TokenType.CONSTANT, TokenType.WHITESPACE,
                TokenType.VARIABLE, TokenType.VARIABLE
        ), types(tokens));
    }

    @Test
    public void testUnknownToken() {
        final MathParserException exception = assertThrows(MathParserException.class, () -> new StdMathLexer().tokenize("1 $ 2"));
        assertEquals(MathParserException.Reason.UNKNOWN_TOKEN, exception.reason());
        assertEquals("$", exception.data());
    }

    @Test
    public void testComplex() {
        final List<Token> tokens = new ComplexMathLexer().tokenize("re(2+3i)");
        assertEquals(Arrays.asList("re", "(", "2", "+", "3", "i", ")"), values(tokens));
        assertEquals(TokenType.CONSTANT, tokens.get(5).type());
        assertEquals(TokenType.FUNCTION_NAME, new ComplexMathLexer().tokenize("conj(z)").get(0).type());
    }

    @Test
    public void testLogic() {
        final List<Token> tokens = withoutWhitespace(new LogicLexer().tokenize("if (price >= 100 AND member) {TRUE} else {x <> y}"));
        assertEquals(Arrays.asList(
                TokenType.IF, TokenType.OPEN_PARENTHESIS, TokenType.VARIABLE, TokenType.GREATER_OR_EQUAL_THAN,
                TokenType.NATURAL_NUMBER, TokenType.AND, TokenType.VARIABLE, TokenType.CLOSE_PARENTHESIS,
                TokenType.OPEN_BRACE, TokenType.BOOLEAN, TokenType.CLOSE_BRACE, TokenType.ELSE, TokenType.OPEN_BRACE,
                TokenType.VARIABLE, TokenType.DIFFERENT_THAN, TokenType.VARIABLE, TokenType.CLOSE_BRACE
        ), types(tokens));
        assertEquals("price", tokens.get(2).value());
        assertEquals(TokenType.OR, new LogicLexer().tokenize("||").get(0).type());
    }

    @Test
    public void testImplicitMultiplicationTable() {
        final Token two = new Token("2", TokenType.NATURAL_NUMBER);
        final Token x = new Token("x", TokenType.VARIABLE);
        final Token sin = new Token("sin", TokenType.FUNCTION_NAME);
        final Token open = new Token("(", TokenType.OPEN_PARENTHESIS);
        final Token close = new Token(")", TokenType.CLOSE_PARENTHESIS);
        final Token factorial = new Token("!", TokenType.FACTORIAL_OPERATOR);
        final Token plus = new Token("+", TokenType.ADDITION_OPERATOR);

        assertTrue(Token.canFactorsInImplicitMultiplication(two, x));
        assertTrue(Token.canFactorsInImplicitMultiplication(close, open));
        assertTrue(Token.canFactorsInImplicitMultiplication(two, sin));
        assertTrue(Token.canFactorsInImplicitMultiplication(factorial, x));
        assertFalse(Token.canFactorsInImplicitMultiplication(sin, open));
        assertFalse(Token.canFactorsInImplicitMultiplication(x, factorial));
        assertFalse(Token.canFactorsInImplicitMultiplication(two, plus));
        assertFalse(Token.canFactorsInImplicitMultiplication(null, x));
    }

    @Test
    public void testDialectsExtendSharedDefinitions() {
        final List<TokenDefinition> std = new StdMathLexer().getDefinitions();
        final List<TokenDefinition> logic = new LogicLexer().getDefinitions();
        assertTrue(logic.size() > std.size());
        assertThrows(UnsupportedOperationException.class, std::clear);
    }

    private static List<Token> withoutWhitespace(List<Token> tokens) {
        return tokens.stream().filter(token -> token.type() != TokenType.WHITESPACE).collect(Collectors.toList());
    }

}
