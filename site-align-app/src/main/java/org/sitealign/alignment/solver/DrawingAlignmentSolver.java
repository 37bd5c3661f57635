package org.sitealign.alignment.solver;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates one similarity transform per level from the correspondences in a {@link CorrespondenceIndex}.
 *
 * Scale, yaw and displacement are solved as three sequential descents, each run to its own
 * convergence and each starting from the variables left by the previous one.
 * When the solve has a ground truth, level 0 keeps its initial variables.
 */
public class DrawingAlignmentSolver {

    private final DescentParameters parameters;

    public DrawingAlignmentSolver() {
        this(DescentParameters.defaults());
    }

    public DrawingAlignmentSolver(final DescentParameters parameters) {
        parameters.validateAndSetDefaults();
        this.parameters = parameters;
    }

    public SolveResult solve(final CorrespondenceIndex index,
                             final boolean hasGroundTruth) {

        LOG.info("solve: entry, {} levels, {} fiducial groups, hasGroundTruth={}",
                 index.getLevelCount(), index.getGroupCount(), hasGroundTruth);

        final VariableBuffer variables = index.getInitialVariables();
        final GradientDescent descent = new GradientDescent(parameters);

        final List<GradientFunction> phases = new ArrayList<>();
        phases.add(new ScaleGradient(index, hasGroundTruth, parameters.minimumScale));
        phases.add(new YawGradient(index, hasGroundTruth));
        phases.add(new DisplacementGradient(index, hasGroundTruth));

        final List<DescentResult> phaseResults = new ArrayList<>();
        for (final GradientFunction phase : phases) {
            final DescentResult phaseResult = descent.minimize(variables, phase);
            if (! phaseResult.isConverged()) {
                LOG.warn("solve: {}", phaseResult);
            }
            phaseResults.add(phaseResult);
        }

        LOG.info("solve: exit, {}", phaseResults);

        return new SolveResult(index, variables, phaseResults);
    }

    private static final Logger LOG = LoggerFactory.getLogger(DrawingAlignmentSolver.class);
}
