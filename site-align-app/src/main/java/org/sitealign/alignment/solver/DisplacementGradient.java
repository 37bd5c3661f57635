package org.sitealign.alignment.solver;

/**
 * Pushes the translations of each level in an unordered pair toward each other
 * for every shared fiducial.
 */
public class DisplacementGradient
        extends AbstractPairwiseGradient {

    public DisplacementGradient(final CorrespondenceIndex index,
                                final boolean hasGroundTruth) {
        super(index, hasGroundTruth);
    }

    @Override
    public String getName() {
        return "displacement";
    }

    @Override
    protected double accumulate(final VariableBuffer variables,
                                final double[] gradient) {
        double weight = 0.0;
        for (final LevelVariables levelI : VariableTraversal.all(variables)) {
            for (final LevelVariables levelJ : VariableTraversal.after(levelI.getLevel(), variables)) {
                weight += forEachSharedFiducial(levelI, levelJ, (fKI, fKJ) -> {

                    final double deltaX = fKI[0] - fKJ[0];
                    final double deltaY = fKI[1] - fKJ[1];

                    double contributions = 0.0;
                    if (isMutable(levelI.getLevel())) {
                        final LevelGradient gradientI = new LevelGradient(levelI.getLevel(), gradient);
                        gradientI.addDx(deltaX);
                        gradientI.addDy(deltaY);
                        contributions += 1.0;
                    }

                    final LevelGradient gradientJ = new LevelGradient(levelJ.getLevel(), gradient);
                    gradientJ.addDx(-deltaX);
                    gradientJ.addDy(-deltaY);
                    contributions += 1.0;

                    return contributions;
                });
            }
        }
        return weight;
    }

}
