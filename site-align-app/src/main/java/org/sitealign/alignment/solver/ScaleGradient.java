package org.sitealign.alignment.solver;

import org.sitealign.alignment.spec.Measurement;
import org.sitealign.alignment.spec.PointUtil;

/**
 * Pulls each level's scale toward its own measured meters per pixel and toward
 * agreement with every other level on the length of shared fiducial segments.
 *
 * For an ordered level pair (i, j) and a shared segment with world lengths s_i and s_j,
 * level i receives {@code scale_i * (1 - s_j / s_i)} and level j receives
 * {@code scale_j * (1 - s_i / s_j)}.
 */
public class ScaleGradient
        extends AbstractPairwiseGradient {

    private final double minimumScale;

    public ScaleGradient(final CorrespondenceIndex index,
                         final boolean hasGroundTruth,
                         final double minimumScale) {
        super(index, hasGroundTruth);
        this.minimumScale = minimumScale;
    }

    @Override
    public String getName() {
        return "scale";
    }

    @Override
    protected double accumulate(final VariableBuffer variables,
                                final double[] gradient) {

        double weight = 0.0;

        for (final LevelVariables levelI : VariableTraversal.all(variables)) {
            final LevelGradient gradientI = new LevelGradient(levelI.getLevel(), gradient);
            for (final Measurement measurement : index.getMeasurements(levelI.getLevel())) {
                gradientI.addScale(levelI.getScale() - measurement.getMetersPerPixel());
                weight += 1.0;
            }
        }

        for (final LevelVariables levelI : VariableTraversal.all(variables)) {
            for (final LevelVariables levelJ : VariableTraversal.except(levelI.getLevel(), variables)) {
                weight += forEachSharedSegment(levelI, levelJ, (fKI, fMI, fKJ, fMJ) -> {

                    final double lengthI = PointUtil.distance(fKI, fMI);
                    final double lengthJ = PointUtil.distance(fKJ, fMJ);

                    // coincident fiducials carry no length information
                    if ((lengthI == 0.0) || (lengthJ == 0.0)) {
                        return 0.0;
                    }

                    double contributions = 0.0;
                    if (isMutable(levelI.getLevel())) {
                        new LevelGradient(levelI.getLevel(), gradient).addScale(
                                levelI.getScale() * (1.0 - lengthJ / lengthI));
                        contributions += 1.0;
                    }

                    new LevelGradient(levelJ.getLevel(), gradient).addScale(
                            levelJ.getScale() * (1.0 - lengthI / lengthJ));
                    contributions += 1.0;

                    return contributions;
                });
            }
        }

        return weight;
    }

    @Override
    public void constrain(final VariableBuffer variables) {
        for (int level = 0; level < variables.getLevelCount(); level++) {
            variables.clampScale(level, minimumScale);
        }
    }

}
