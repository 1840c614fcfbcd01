// file: src/main/java/io/symtree/core/Evaluator.java
package io.symtree.core;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for evaluating expressions under explicit {@link TreeSettings}.
 * <p>
 * Without debug mode this is a plain call to {@link Symbol#evaluate(Double, double[])}.
 * With debug mode:
 *  - each evaluation is logged at FINE,
 *  - a result containing NaN or infinity raises ArithmeticException.
 */
public final class Evaluator {
    private static final Logger log = Logger.getLogger(Evaluator.class.getName());

    private final TreeSettings settings;

    public Evaluator(TreeSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public TreeSettings settings() {
        return settings;
    }

    public Value evaluate(Symbol expression, Double t, double[] y) {
        Objects.requireNonNull(expression, "expression");
        Value result = expression.evaluate(t, y);
        if (!settings.debugMode()) {
            return result;
        }

        if (log.isLoggable(Level.FINE)) {
            log.log(Level.FINE, String.format(
                    "eval %s (id=%d, t=%s, |y|=%s) -> %s",
                    expression.kind(),
                    expression.id(),
                    t,
                    y == null ? "none" : String.valueOf(y.length),
                    result
            ));
        }
        if (!result.isFinite()) {
            throw new ArithmeticException("non-finite result %s evaluating %s rooted at '%s'"
                    .formatted(result, expression.kind(), expression.name()));
        }
        return result;
    }

    public Value evaluate(Symbol expression) {
        return evaluate(expression, null, null);
    }
}
