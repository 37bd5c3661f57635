package org.sitealign.alignment.solver;

import java.util.Arrays;

/**
 * Shared structure of the pairwise gradient phases: zero the gradient, accumulate
 * per-term contributions, divide every entry by {@code max(weight, 1)} and keep
 * the ground truth level (if any) fixed.
 */
public abstract class AbstractPairwiseGradient
        implements GradientFunction {

    /** Index of the level that stays fixed when a solve has a ground truth frame. */
    public static final int GROUND_TRUTH_LEVEL = 0;

    protected final CorrespondenceIndex index;
    protected final boolean hasGroundTruth;

    protected AbstractPairwiseGradient(final CorrespondenceIndex index,
                                       final boolean hasGroundTruth) {
        this.index = index;
        this.hasGroundTruth = hasGroundTruth;
    }

    @Override
    public void evaluate(final VariableBuffer variables,
                         final double[] gradient) {

        Arrays.fill(gradient, 0.0);

        final double weight = accumulate(variables, gradient);
        final double divisor = Math.max(weight, 1.0);
        for (int i = 0; i < gradient.length; i++) {
            gradient[i] /= divisor;
        }

        if (hasGroundTruth && (variables.getLevelCount() > GROUND_TRUTH_LEVEL)) {
            new LevelGradient(GROUND_TRUTH_LEVEL, gradient).clear();
        }
    }

    /**
     * Adds every term's contribution to the gradient.
     *
     * @return number of contributions added.
     */
    protected abstract double accumulate(final VariableBuffer variables,
                                         final double[] gradient);

    /**
     * @return false if the level is the ground truth frame and must not be pushed by a term.
     */
    protected boolean isMutable(final int level) {
        return ! (hasGroundTruth && (level == GROUND_TRUTH_LEVEL));
    }

    /**
     * Visits every fiducial group present in both levels.
     *
     * @return sum of the weights returned by the visitor.
     */
    protected double forEachSharedFiducial(final LevelVariables levelI,
                                           final LevelVariables levelJ,
                                           final SharedFiducialVisitor visitor) {
        double weight = 0.0;
        final int i = levelI.getLevel();
        final int j = levelJ.getLevel();
        for (int k = 0; k < index.getSlotCount(i); k++) {
            final double[] phiKI = index.getFiducial(i, k);
            final double[] phiKJ = index.getFiducial(j, k);
            if ((phiKI != null) && (phiKJ != null)) {
                weight += visitor.visit(levelI.transform(phiKI), levelJ.transform(phiKJ));
            }
        }
        return weight;
    }

    /**
     * Visits every unordered pair of fiducial groups (k, m) with both groups present in both levels.
     *
     * @return sum of the weights returned by the visitor.
     */
    protected double forEachSharedSegment(final LevelVariables levelI,
                                          final LevelVariables levelJ,
                                          final SharedSegmentVisitor visitor) {
        double weight = 0.0;
        final int i = levelI.getLevel();
        final int j = levelJ.getLevel();
        final int slotCount = index.getSlotCount(i);
        for (int k = 0; k < slotCount; k++) {
            final double[] phiKI = index.getFiducial(i, k);
            final double[] phiKJ = index.getFiducial(j, k);
            if ((phiKI == null) || (phiKJ == null)) {
                continue;
            }
            final double[] fKI = levelI.transform(phiKI);
            final double[] fKJ = levelJ.transform(phiKJ);

            for (int m = k + 1; m < slotCount; m++) {
                final double[] phiMI = index.getFiducial(i, m);
                final double[] phiMJ = index.getFiducial(j, m);
                if ((phiMI != null) && (phiMJ != null)) {
                    weight += visitor.visit(fKI, levelI.transform(phiMI), fKJ, levelJ.transform(phiMJ));
                }
            }
        }
        return weight;
    }

    public interface SharedFiducialVisitor {
        /**
         * @return number of gradient contributions made for this fiducial.
         */
        double visit(final double[] worldI,
                     final double[] worldJ);
    }

    public interface SharedSegmentVisitor {
        /**
         * @return number of gradient contributions made for this segment.
         */
        double visit(final double[] worldKI,
                     final double[] worldMI,
                     final double[] worldKJ,
                     final double[] worldMJ);
    }

}
