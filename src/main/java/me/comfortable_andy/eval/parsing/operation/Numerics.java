package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.parsing.node.Node;
import me.comfortable_andy.eval.parsing.node.NumericNode;
import me.comfortable_andy.eval.parsing.node.NumericNode.Tower;

/**
 * Checks on literal operands shared by the operations.
 *
 * @author AndyNoob
 */
final class Numerics {

    private Numerics() {
    }

    static boolean isNumeric(/* nullable */ Node node) {
        return node instanceof NumericNode;
    }

    static boolean bothNumeric(Node left, Node right) {
        return isNumeric(left) && isNumeric(right);
    }

    static boolean isZero(/* nullable */ Node node) {
        return node instanceof NumericNode && ((NumericNode) node).isZero();
    }

    static boolean isOne(/* nullable */ Node node) {
        return node instanceof NumericNode && ((NumericNode) node).isOne();
    }

    static Tower resultingType(NumericNode left, NumericNode right) {
        return Tower.max(left.tower(), right.tower());
    }

}
