package org.sitealign.alignment.solver;

import org.sitealign.alignment.spec.PointUtil;

/**
 * Pushes the rotation of each level in an unordered pair toward the other level's
 * heading for every shared fiducial segment.
 */
public class YawGradient
        extends AbstractPairwiseGradient {

    public YawGradient(final CorrespondenceIndex index,
                       final boolean hasGroundTruth) {
        super(index, hasGroundTruth);
    }

    @Override
    public String getName() {
        return "yaw";
    }

    @Override
    protected double accumulate(final VariableBuffer variables,
                                final double[] gradient) {
        double weight = 0.0;
        for (final LevelVariables levelI : VariableTraversal.all(variables)) {
            for (final LevelVariables levelJ : VariableTraversal.after(levelI.getLevel(), variables)) {
                weight += forEachSharedSegment(levelI, levelJ, (fKI, fMI, fKJ, fMJ) -> {

                    final double yawI = PointUtil.heading(fKI, fMI);
                    final double yawJ = PointUtil.heading(fKJ, fMJ);

                    double contributions = 0.0;
                    if (isMutable(levelI.getLevel())) {
                        new LevelGradient(levelI.getLevel(), gradient).addTheta(yawI - yawJ);
                        contributions += 1.0;
                    }

                    new LevelGradient(levelJ.getLevel(), gradient).addTheta(yawJ - yawI);
                    contributions += 1.0;

                    return contributions;
                });
            }
        }
        return weight;
    }

}
