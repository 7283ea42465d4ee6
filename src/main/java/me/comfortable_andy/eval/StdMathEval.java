package me.comfortable_andy.eval;

import me.comfortable_andy.eval.lexing.StdMathLexer;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.Visitor;
import me.comfortable_andy.eval.solving.StdMathEvaluator;

import java.util.Map;

/**
 * {@code new StdMathEval().evaluate("exp(2x)+xy", Map.of("x", 1, "y", -1))}
 *
 * @author AndyNoob
 */
public class StdMathEval extends AbstractEvaluator<Double> {

    public StdMathEval() {
        this(true, true, false);
    }

    public StdMathEval(boolean implicitMultiplication, boolean simplifying, boolean debugMode) {
        super(new StdMathLexer(), new Parser(implicitMultiplication, simplifying, debugMode));
    }

    @Override
    protected Visitor<Double> createEvaluator(Map<String, ?> variables) {
        return new StdMathEvaluator(variables);
    }

}
