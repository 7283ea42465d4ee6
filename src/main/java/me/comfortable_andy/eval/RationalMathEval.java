package me.comfortable_andy.eval;

import me.comfortable_andy.eval.lexing.StdMathLexer;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.Visitor;
import me.comfortable_andy.eval.solving.RationalEvaluator;

import java.util.Map;

/**
 * Exact evaluation. Variable values are given as {@link Rational}s, whole numbers or
 * {@code "p/q"} strings.
 *
 * @author AndyNoob
 */
public class RationalMathEval extends AbstractEvaluator<Rational> {

    public RationalMathEval() {
        this(true, true, false);
    }

    public RationalMathEval(boolean implicitMultiplication, boolean simplifying, boolean debugMode) {
        super(new StdMathLexer(), new Parser(implicitMultiplication, simplifying, debugMode));
    }

    @Override
    protected Visitor<Rational> createEvaluator(Map<String, ?> variables) {
        return new RationalEvaluator(variables);
    }

}
