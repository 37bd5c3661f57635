package org.sitealign.alignment.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed step gradient descent: repeatedly evaluate the gradient, step every variable
 * against it, and stop once the gradient norm reaches the threshold or the
 * iteration limit is hit.  The step is applied before the norm is checked,
 * so the final (small) gradient is still used.
 */
public class GradientDescent {

    private final double gradientThreshold;
    private final double gamma;
    private final int maxIterations;

    public GradientDescent(final DescentParameters parameters) {
        parameters.validateAndSetDefaults();
        this.gradientThreshold = parameters.gradientThreshold;
        this.gamma = parameters.stepSize;
        this.maxIterations = parameters.maxIterations;
    }

    public DescentResult minimize(final VariableBuffer variables,
                                  final GradientFunction gradientFunction) {

        final double[] gradient = variables.createGradient();

        int iterations = 0;
        double gradientNorm;
        boolean converged = false;
        while (true) {
            gradientFunction.evaluate(variables, gradient);
            gradientNorm = Math.sqrt(variables.descend(gradient, gamma));
            gradientFunction.constrain(variables);
            iterations++;

            if (LOG.isTraceEnabled()) {
                LOG.trace("minimize: {} iteration {} has gradient norm {}",
                          gradientFunction.getName(), iterations, gradientNorm);
            }

            if (gradientNorm <= gradientThreshold) {
                converged = true;
                break;
            } else if (iterations >= maxIterations) {
                break;
            }
        }

        final DescentResult result = new DescentResult(gradientFunction.getName(),
                                                       iterations,
                                                       gradientNorm,
                                                       converged);
        LOG.debug("minimize: exit, {}", result);

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GradientDescent.class);
}
