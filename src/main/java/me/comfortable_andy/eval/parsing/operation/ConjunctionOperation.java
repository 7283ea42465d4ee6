package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.parsing.node.InfixOperator;

public class ConjunctionOperation extends LogicalOperation {

    @Override
    protected boolean combine(boolean left, boolean right) {
        return left && right;
    }

    @Override
    protected InfixOperator defaultOperator() {
        return InfixOperator.AND;
    }

    @Override
    protected boolean accepts(InfixOperator operator) {
        return operator.isConjunction();
    }

}
