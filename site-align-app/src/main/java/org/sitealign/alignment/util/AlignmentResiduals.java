package org.sitealign.alignment.util;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.sitealign.alignment.solver.CorrespondenceIndex;
import org.sitealign.alignment.solver.LevelVariables;
import org.sitealign.alignment.solver.SolveResult;
import org.sitealign.alignment.solver.VariableBuffer;
import org.sitealign.alignment.solver.VariableTraversal;
import org.sitealign.alignment.spec.PointUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility to calculate residual distances between the world positions that aligned levels
 * give to the same fiducial group.
 */
public class AlignmentResiduals implements Serializable {

    public static class Residual implements Serializable {

        private final String levelA;
        private final String levelB;
        private final String groupId;
        private final double distance;

        public Residual(final String levelA,
                        final String levelB,
                        final String groupId,
                        final double distance) {
            this.levelA = levelA;
            this.levelB = levelB;
            this.groupId = groupId;
            this.distance = distance;
        }

        public double getDistance() {
            return distance;
        }

        @Override
        public String toString() {
            return String.format("%s between %s and %s: %8.4f", groupId, levelA, levelB, distance);
        }
    }

    private final List<Residual> residuals;
    private final Double medianDistance;
    private final Double meanDistance;
    private final Double maxDistance;
    private final Double rootMeanSquareError;
    private final Residual worstResidual;

    private AlignmentResiduals(final List<Residual> residuals) {

        this.residuals = residuals;

        if (residuals.size() > 0) {

            final List<Double> distanceList = new ArrayList<>(residuals.size());
            Residual worst = residuals.get(0);
            for (final Residual residual : residuals) {
                distanceList.add(residual.distance);
                if (residual.distance > worst.distance) {
                    worst = residual;
                }
            }

            Collections.sort(distanceList);

            final int middleIndex = distanceList.size() / 2;
            double median = distanceList.get(middleIndex);
            if (distanceList.size() % 2 == 0) {
                median = (median + distanceList.get(middleIndex - 1)) / 2.0;
            }

            double distanceSum = 0;
            double distanceSquaredSum = 0;
            for (final double distance : distanceList) {
                distanceSum += distance;
                distanceSquaredSum += Math.pow(distance, 2);
            }

            this.medianDistance = median;
            this.meanDistance = distanceSum / distanceList.size();
            this.maxDistance = distanceList.get(distanceList.size() - 1);
            this.rootMeanSquareError = Math.sqrt(distanceSquaredSum / distanceList.size());
            this.worstResidual = worst;

        } else {

            this.medianDistance = null;
            this.meanDistance = null;
            this.maxDistance = null;
            this.rootMeanSquareError = null;
            this.worstResidual = null;

        }
    }

    public int getCount() {
        return residuals.size();
    }

    public List<Residual> getResiduals() {
        return Collections.unmodifiableList(residuals);
    }

    public Double getMedianDistance() {
        return medianDistance;
    }

    public Double getMeanDistance() {
        return meanDistance;
    }

    public Double getMaxDistance() {
        return maxDistance;
    }

    public Double getRootMeanSquareError() {
        return rootMeanSquareError;
    }

    public Residual getWorstResidual() {
        return worstResidual;
    }

    @Override
    public String toString() {
        if (residuals.isEmpty()) {
            return "no shared fiducials";
        }
        return String.format("%d residuals, median %8.4f, mean %8.4f, max %8.4f, RMSE %8.4f (worst is %s)",
                             residuals.size(), medianDistance, meanDistance, maxDistance, rootMeanSquareError,
                             worstResidual);
    }

    public static AlignmentResiduals calculate(final SolveResult result) {
        return calculate(result.getIndex(), result.getVariables());
    }

    /**
     * @return residuals for every unordered pair of levels and every fiducial group the pair shares.
     */
    public static AlignmentResiduals calculate(final CorrespondenceIndex index,
                                               final VariableBuffer variables) {

        final List<Residual> residuals = new ArrayList<>();

        for (final LevelVariables levelI : VariableTraversal.all(variables)) {
            final int i = levelI.getLevel();
            for (final LevelVariables levelJ : VariableTraversal.after(i, variables)) {
                final int j = levelJ.getLevel();
                for (int group = 0; group < index.getGroupCount(); group++) {
                    final double[] localI = index.getFiducial(i, group);
                    final double[] localJ = index.getFiducial(j, group);
                    if ((localI != null) && (localJ != null)) {
                        final double distance = PointUtil.distance(levelI.transform(localI),
                                                                   levelJ.transform(localJ));
                        residuals.add(new Residual(index.getLevelName(i),
                                                   index.getLevelName(j),
                                                   index.getGroupId(group),
                                                   distance));
                    }
                }
            }
        }

        final AlignmentResiduals alignmentResiduals = new AlignmentResiduals(residuals);

        LOG.info("calculate: exit, {}", alignmentResiduals);

        return alignmentResiduals;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AlignmentResiduals.class);
}
