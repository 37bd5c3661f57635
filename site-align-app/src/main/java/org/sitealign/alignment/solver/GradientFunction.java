package org.sitealign.alignment.solver;

/**
 * Gradient of one descent phase.
 */
public interface GradientFunction {

    /**
     * @return name used when logging and reporting the phase.
     */
    String getName();

    /**
     * Overwrites the gradient buffer with the gradient at the specified variables.
     */
    void evaluate(final VariableBuffer variables,
                  final double[] gradient);

    /**
     * Projects variables back onto their valid domain after a descent step.
     * Most phases have no constraints.
     */
    default void constrain(final VariableBuffer variables) {
    }

}
