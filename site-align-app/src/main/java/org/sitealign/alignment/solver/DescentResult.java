package org.sitealign.alignment.solver;

import java.io.Serializable;

/**
 * Outcome of running gradient descent for one phase.
 */
public class DescentResult implements Serializable {

    private final String phaseName;
    private final int iterations;
    private final double gradientNorm;
    private final boolean converged;

    public DescentResult(final String phaseName,
                         final int iterations,
                         final double gradientNorm,
                         final boolean converged) {
        this.phaseName = phaseName;
        this.iterations = iterations;
        this.gradientNorm = gradientNorm;
        this.converged = converged;
    }

    public String getPhaseName() {
        return phaseName;
    }

    /**
     * @return number of gradient evaluations (and descent steps) performed.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * @return euclidean norm of the last evaluated gradient.
     */
    public double getGradientNorm() {
        return gradientNorm;
    }

    /**
     * @return true if the phase stopped because its gradient norm reached the threshold
     *         rather than because the iteration limit was hit.
     */
    public boolean isConverged() {
        return converged;
    }

    @Override
    public String toString() {
        return phaseName + " phase " + (converged ? "converged" : "stopped") +
               " after " + iterations + " iterations with gradient norm " + gradientNorm;
    }
}
