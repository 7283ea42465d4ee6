package me.comfortable_andy.eval.parsing.node;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A function name waiting on the operator stack for its closing parenthesis. Once the argument
 * is known it is turned into an immutable {@link FunctionNode}.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class PendingFunctionNode extends StructuralNode {

    private final String name;

    public FunctionNode apply(Node operand) {
        return new FunctionNode(this.name, operand);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PENDING_FUNCTION;
    }

    @Override
    public boolean sameAs(Node other) {
        return other instanceof PendingFunctionNode && ((PendingFunctionNode) other).name.equals(this.name);
    }

    @Override
    public int hashCode() {
        return this.name.hashCode();
    }

    @Override
    public String toString() {
        return this.name;
    }

}
