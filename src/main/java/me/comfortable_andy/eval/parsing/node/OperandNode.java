package me.comfortable_andy.eval.parsing.node;

/**
 * A leaf of the tree.
 *
 * @author AndyNoob
 */
public abstract class OperandNode extends Node {
}
