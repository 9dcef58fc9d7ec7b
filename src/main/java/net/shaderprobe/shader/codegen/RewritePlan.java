package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.parser.DebugTarget;
import net.shaderprobe.shader.parser.FunctionScope;
import net.shaderprobe.shader.parser.LogicalStatement;

import java.util.Objects;

/**
 * What the generator has to do for one request. Exactly one strategy applies,
 * chosen from where the target line sits.
 */
public class RewritePlan {

    public enum Strategy {
        /** Target inside the entry function: cut the function after the statement. */
        TRUNCATE_AND_CLOSE,
        /** Target inside a helper: return the value from the helper and call it. */
        WRAP_AND_CALL,
        /** Target outside every function: run the line on its own. */
        ONE_LINER
    }

    private final Strategy strategy;
    private final FunctionScope scope;
    private final DebugTarget target;
    private final LogicalStatement statement;

    private RewritePlan(Strategy strategy, FunctionScope scope, DebugTarget target, LogicalStatement statement) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.target = Objects.requireNonNull(target, "target");
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    /**
     * Picks the strategy for a target in the given scope.
     */
    public static RewritePlan of(FunctionScope scope, String entryFunction, DebugTarget target, LogicalStatement statement) {
        Strategy strategy;
        if (!scope.isInsideFunction()) {
            strategy = Strategy.ONE_LINER;
        } else if (scope.getName().equals(entryFunction)) {
            strategy = Strategy.TRUNCATE_AND_CLOSE;
        } else {
            strategy = Strategy.WRAP_AND_CALL;
        }
        return new RewritePlan(strategy, scope, target, statement);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public FunctionScope getScope() {
        return scope;
    }

    public DebugTarget getTarget() {
        return target;
    }

    public LogicalStatement getStatement() {
        return statement;
    }

    @Override
    public String toString() {
        return String.format("RewritePlan{%s, %s, %s}", strategy, scope, target);
    }
}
