package me.comfortable_andy.eval;

import me.comfortable_andy.eval.lexing.ComplexMathLexer;
import me.comfortable_andy.eval.number.Complex;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.Visitor;
import me.comfortable_andy.eval.solving.ComplexEvaluator;

import java.util.Map;

/**
 * @author AndyNoob
 */
public class ComplexMathEval extends AbstractEvaluator<Complex> {

    public ComplexMathEval() {
        this(true, true, false);
    }

    public ComplexMathEval(boolean implicitMultiplication, boolean simplifying, boolean debugMode) {
        super(new ComplexMathLexer(), new Parser(implicitMultiplication, simplifying, debugMode));
    }

    @Override
    protected Visitor<Complex> createEvaluator(Map<String, ?> variables) {
        return new ComplexEvaluator(variables);
    }

}
