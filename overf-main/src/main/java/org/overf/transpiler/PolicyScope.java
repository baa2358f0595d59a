package org.overf.transpiler;

import org.overf.OverflowPolicy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * An immutable stack of active policies. The bottom entry is always
 * {@link OverflowPolicy#DEFAULT}; pushing returns a new scope and the enclosing scope is
 * restored simply by continuing to use it.
 * <p>
 * A scope also carries the function frame it belongs to and whether a propagation handler
 * already encloses it within that frame.
 */
public final class PolicyScope {

    private final OverflowPolicy policy;
    private final PolicyScope parent;
    private final FunctionFrame frame;
    private final boolean propagationHandled;

    private PolicyScope(OverflowPolicy policy, PolicyScope parent, FunctionFrame frame, boolean propagationHandled) {
        this.policy = policy;
        this.parent = parent;
        this.frame = frame;
        this.propagationHandled = propagationHandled;
    }

    public static PolicyScope base(FunctionFrame frame) {
        return new PolicyScope(OverflowPolicy.DEFAULT, null, frame, false);
    }

    public PolicyScope push(OverflowPolicy next) {
        return new PolicyScope(next, this, frame, propagationHandled);
    }

    public PolicyScope pop() {
        if (parent == null) {
            throw new IllegalStateException("Cannot pop the base policy");
        }
        return parent;
    }

    /**
     * Same policies, inside a new function body. Propagation never crosses the boundary, so the
     * new frame starts without a handler.
     */
    public PolicyScope enterFunction(FunctionFrame functionFrame) {
        return new PolicyScope(policy, parent, functionFrame, false);
    }

    public PolicyScope withPropagationHandled() {
        return new PolicyScope(policy, parent, frame, true);
    }

    public OverflowPolicy current() {
        return policy;
    }

    public FunctionFrame frame() {
        return frame;
    }

    public boolean isPropagationHandled() {
        return propagationHandled;
    }

    public boolean isBase() {
        return parent == null;
    }

    public int depth() {
        return parent == null ? 1 : parent.depth() + 1;
    }

    /**
     * @return the policies from bottom to top
     */
    public List<OverflowPolicy> policies() {
        Deque<OverflowPolicy> policies = new ArrayDeque<>();
        for (PolicyScope scope = this; scope != null; scope = scope.parent) {
            policies.addFirst(scope.policy);
        }
        return List.copyOf(policies);
    }

    @Override
    public String toString() {
        return "PolicyScope" + policies();
    }
}
