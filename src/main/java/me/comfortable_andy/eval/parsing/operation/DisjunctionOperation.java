package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.parsing.node.InfixOperator;

public class DisjunctionOperation extends LogicalOperation {

    @Override
    protected boolean combine(boolean left, boolean right) {
        return left || right;
    }

    @Override
    protected InfixOperator defaultOperator() {
        return InfixOperator.OR;
    }

    @Override
    protected boolean accepts(InfixOperator operator) {
        return operator == InfixOperator.OR || operator == InfixOperator.OR_WORD;
    }

}
