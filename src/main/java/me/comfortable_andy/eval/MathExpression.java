package me.comfortable_andy.eval;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.lexing.Lexer;
import me.comfortable_andy.eval.lexing.StdMathLexer;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.Node;
import me.comfortable_andy.eval.solving.ASCIIPrinter;
import me.comfortable_andy.eval.solving.Differentiator;
import me.comfortable_andy.eval.solving.LaTeXPrinter;
import me.comfortable_andy.eval.solving.StdMathEvaluator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a parsed mathematical expression, e.g. 2 + 2 * 9^2 / cos(0), together with the
 * values of its variables.
 *
 * @author AndyNoob
 */
@SuppressWarnings({"UnusedReturnValue", "unused"})
@RequiredArgsConstructor
@Accessors(chain = true)
public class MathExpression {

    private static final Lexer LEXER = new StdMathLexer();
    private static final Parser PARSER = new Parser();

    @Getter
    private final Node tree;
    private final Map<String, Double> variables;

    public MathExpression(Node tree) {
        this.tree = tree;
        this.variables = new ConcurrentHashMap<>();
    }

    public double evaluate() {
        return this.tree.accept(new StdMathEvaluator(this.variables));
    }

    public MathExpression setVariable(String name, double val) {
        this.variables.put(name, val);
        return this;
    }

    public Double removeVariable(String name) {
        return this.variables.remove(name);
    }

    /**
     * @return the derivative, starting with a copy of this expression's variables
     */
    public MathExpression differentiate(String variable) {
        return new MathExpression(new Differentiator(variable).differentiate(this.tree), new ConcurrentHashMap<>(this.variables));
    }

    public String toLaTeX() {
        return this.tree.accept(new LaTeXPrinter());
    }

    @Override
    public String toString() {
        return this.tree.accept(new ASCIIPrinter());
    }

    public static MathExpression parse(String expression) {
        return parse(expression, new ConcurrentHashMap<>());
    }

    public static MathExpression parse(String expression, Map<String, Double> variables) {
        return new MathExpression(PARSER.parse(LEXER.tokenize(expression)), new ConcurrentHashMap<>(variables));
    }

}
