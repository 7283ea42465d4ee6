package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.parsing.node.Node;

/**
 * Builds the node for one arithmetic operator, folding it to a literal or dropping an identity
 * operand where it can.
 *
 * @author AndyNoob
 */
public interface MathOperation {

    Node makeNode(Node left, Node right);

}
