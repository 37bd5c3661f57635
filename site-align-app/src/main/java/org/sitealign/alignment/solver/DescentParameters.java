package org.sitealign.alignment.solver;

import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.sitealign.alignment.json.JsonUtils;

/**
 * Parameters for the fixed step gradient descent run by each solver phase.
 */
public class DescentParameters implements Serializable {

    @Parameter(
            names = "--gradientThreshold",
            description = "Stop a phase once the euclidean norm of its gradient drops to this value"
    )
    public Double gradientThreshold;

    @Parameter(
            names = "--stepSize",
            description = "Step size (gamma) applied to the gradient on every iteration"
    )
    public Double stepSize;

    @Parameter(
            names = "--maxIterations",
            description = "Maximum number of gradient evaluations for each phase"
    )
    public Integer maxIterations;

    @Parameter(
            names = "--minimumScale",
            description = "Smallest scale (meters per pixel) a level may take during the scale phase"
    )
    public Double minimumScale;

    public DescentParameters() {
    }

    public DescentParameters(final double gradientThreshold,
                             final double stepSize,
                             final int maxIterations,
                             final double minimumScale) {
        this.gradientThreshold = gradientThreshold;
        this.stepSize = stepSize;
        this.maxIterations = maxIterations;
        this.minimumScale = minimumScale;
    }

    /**
     * @return parameters with every default applied.
     */
    public static DescentParameters defaults() {
        final DescentParameters parameters = new DescentParameters();
        parameters.validateAndSetDefaults();
        return parameters;
    }

    /**
     * Fills in unspecified values and checks the result.
     *
     * @throws IllegalArgumentException
     *   if any value is out of range.
     */
    public void validateAndSetDefaults()
            throws IllegalArgumentException {

        if (gradientThreshold == null) {
            gradientThreshold = 1e-6;
        }
        if (stepSize == null) {
            stepSize = 1.0;
        }
        if (maxIterations == null) {
            maxIterations = 100;
        }
        if (minimumScale == null) {
            minimumScale = 1e-9;
        }

        if (! (gradientThreshold > 0.0)) {
            throw new IllegalArgumentException("gradientThreshold must be positive but is " + gradientThreshold);
        }
        if (! (stepSize > 0.0)) {
            throw new IllegalArgumentException("stepSize must be positive but is " + stepSize);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1 but is " + maxIterations);
        }
        if (! (minimumScale > 0.0)) {
            throw new IllegalArgumentException("minimumScale must be positive but is " + minimumScale);
        }
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.FAST_MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
