package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.lexing.StdMathLexer;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.diogonunes.jcolor.Ansi.colorize;
import static com.diogonunes.jcolor.Attribute.*;
import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {

    private static final Node X = new VariableNode("x");
    private static final Node Y = new VariableNode("y");

    private static Node infix(String symbol, Node left, Node right) {
        return new InfixExpressionNode(symbol, left, right);
    }

    private static Node integer(long value) {
        return new IntegerNode(value);
    }

    @Test
    public void testTreePrinter() {
        final TreePrinter printer = new TreePrinter();
        assertEquals("(+, 1:int, (/, x, 2:int))", infix("+", integer(1), infix("/", X, integer(2))).accept(printer));
        assertEquals("1/2:rational", new RationalNode(1, 2).accept(printer));
        assertEquals("1.5:float", new FloatNode(1.5).accept(printer));
        assertEquals("true:bool", BooleanNode.TRUE.accept(printer));
        assertEquals("\"ab\":string", new StringNode("ab").accept(printer));
        assertEquals("(-, x)", InfixExpressionNode.negation(X).accept(printer));
        assertEquals("(true:bool; x; 1:int):if", new TernaryExpressionNode(BooleanNode.TRUE, X, integer(1)).accept(printer));
        assertEquals("sin(pi)", new FunctionNode("sin", new ConstantNode("pi")).accept(printer));
    }

    @Test
    public void testASCIIPrinter() {
        final ASCIIPrinter printer = new ASCIIPrinter();
        assertEquals("x^2+1", infix("+", infix("^", X, integer(2)), integer(1)).accept(printer));
        assertEquals("(x+1)*y", infix("*", infix("+", X, integer(1)), Y).accept(printer));
        assertEquals("x-(y+1)", infix("-", X, infix("+", Y, integer(1))).accept(printer));
        assertEquals("x/(y*2)", infix("/", X, infix("*", Y, integer(2))).accept(printer));
        assertEquals("(x^y)^2", infix("^", infix("^", X, Y), integer(2)).accept(printer));
        assertEquals("x^y^2", infix("^", X, infix("^", Y, integer(2))).accept(printer));
        assertEquals("x*(-y)", infix("*", X, InfixExpressionNode.negation(Y)).accept(printer));
        assertEquals("2*(-3)", infix("*", integer(2), integer(-3)).accept(printer));
        assertEquals("(1/2)*x", infix("*", new RationalNode(1, 2), X).accept(printer));
        assertEquals("x+1/2", infix("+", X, new RationalNode(1, 2)).accept(printer));
        assertEquals("2", new FloatNode(2.0).accept(printer));
        assertEquals("2.5", new FloatNode(2.5).accept(printer));
        assertEquals("sin(x+1)", new FunctionNode("sin", infix("+", X, integer(1))).accept(printer));
        assertEquals("(x+1)!", new FunctionNode("!", infix("+", X, integer(1))).accept(printer));
        assertEquals("5!!", new FunctionNode("!!", integer(5)).accept(printer));
        assertEquals("TRUE AND FALSE", infix("&&", BooleanNode.TRUE, BooleanNode.FALSE).accept(printer));
        assertEquals("if (x>1) {x} else {0}",
                new TernaryExpressionNode(infix(">", X, integer(1)), X, integer(0)).accept(printer));
        assertThrows(MathParserException.class, () -> new ConstantNode("tau").accept(printer));
    }

    @Test
    public void testASCIIRoundTrip() {
        final Parser parser = new Parser(true, false, false);
        final StdMathLexer lexer = new StdMathLexer();
        final ASCIIPrinter printer = new ASCIIPrinter();
        for (String expression : Arrays.asList("x-(y+z)", "x/(y*z)", "(x^y)^z", "x^y^z", "(x+1)*y", "sin(x)/2", "-x^2", "(x-1)!")) {
            final Node tree = parser.parse(lexer.tokenize(expression));
            final String printed = tree.accept(printer);
            System.out.println(colorize(expression, BRIGHT_BLACK_BACK()) + " -> " + colorize(printed, BOLD()));
            assertEquals(tree, parser.parse(lexer.tokenize(printed)), expression);
        }
    }

    @Test
    public void testLaTeXPrinter() {
        final LaTeXPrinter printer = new LaTeXPrinter();
        assertEquals("\\frac{x}{2}", infix("/", X, integer(2)).accept(printer));
        assertEquals("\\frac{1}{2}", new RationalNode(1, 2).accept(printer));
        assertEquals("x^{1/2}", infix("^", X, new RationalNode(1, 2)).accept(printer));
        assertEquals("x^{y/2}", infix("^", X, infix("/", Y, integer(2))).accept(printer));
        assertEquals("x^{1/2}+\\frac{1}{2}",
                infix("+", infix("^", X, new RationalNode(1, 2)), new RationalNode(1, 2)).accept(printer));
        assertEquals("x^2", infix("^", X, integer(2)).accept(printer));
        assertEquals("x^{12}", infix("^", X, integer(12)).accept(printer));
        assertEquals("(x+1)^2", infix("^", infix("+", X, integer(1)), integer(2)).accept(printer));
        assertEquals("\\sqrt{x}", new FunctionNode("sqrt", X).accept(printer));
        assertEquals("e^x", new FunctionNode("exp", X).accept(printer));
        assertEquals("\\sin(x)", new FunctionNode("sin", X).accept(printer));
        assertEquals("\\lvert x\\rvert ", new FunctionNode("abs", X).accept(printer));
        assertEquals("\\operatorname{sinh}(x)", new FunctionNode("sinh", X).accept(printer));
        assertEquals("2x", infix("*", integer(2), X).accept(printer));
        assertEquals("x\\cdot 2", infix("*", X, integer(2)).accept(printer));
        assertEquals("\\sin(x)\\cdot x", infix("*", new FunctionNode("sin", X), X).accept(printer));
        assertEquals("2\\pi{}", infix("*", integer(2), new ConstantNode("pi")).accept(printer));
        assertThrows(MathParserException.class, () -> BooleanNode.TRUE.accept(printer));
    }

}
