package me.comfortable_andy.eval;

import me.comfortable_andy.eval.lexing.LogicLexer;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.Visitor;
import me.comfortable_andy.eval.solving.LogicEvaluator;

import java.util.Map;

/**
 * Conditions and comparisons over multi-letter variables, for example
 * {@code if (price > 100 AND member) {price * 0.9} else {price}}. Implicit multiplication is off
 * by default, since adjacent names are not products here.
 *
 * @author AndyNoob
 */
public class LogicEval extends AbstractEvaluator<Object> {

    public LogicEval() {
        this(false, true, false);
    }

    public LogicEval(boolean implicitMultiplication, boolean simplifying, boolean debugMode) {
        super(new LogicLexer(), new Parser(implicitMultiplication, simplifying, debugMode));
    }

    @Override
    protected Visitor<Object> createEvaluator(Map<String, ?> variables) {
        return new LogicEvaluator(variables);
    }

}
