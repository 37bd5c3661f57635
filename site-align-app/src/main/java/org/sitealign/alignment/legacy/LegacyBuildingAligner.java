package org.sitealign.alignment.legacy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.sitealign.alignment.solver.CorrespondenceIndex;
import org.sitealign.alignment.solver.DescentParameters;
import org.sitealign.alignment.solver.DrawingAlignmentSolver;
import org.sitealign.alignment.solver.LevelVariables;
import org.sitealign.alignment.solver.SolveResult;
import org.sitealign.alignment.solver.VariableBuffer;
import org.sitealign.alignment.spec.Alignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the levels of a legacy building map with each other.
 *
 * No level is fixed during the solve.  Afterwards every translation is shifted
 * so that the reference level sits at the origin.
 */
public class LegacyBuildingAligner {

    private final DrawingAlignmentSolver solver;

    public LegacyBuildingAligner() {
        this(DescentParameters.defaults());
    }

    public LegacyBuildingAligner(final DescentParameters parameters) {
        this.solver = new DrawingAlignmentSolver(parameters);
    }

    /**
     * @return alignment for every level keyed by level name (in name order).
     *
     * @throws IllegalArgumentException
     *   if a level's measurements reference missing vertices.
     */
    public Map<String, Alignment> align(final LegacyBuildingMap building)
            throws IllegalArgumentException {
        return getAlignments(solve(building));
    }

    /**
     * @return recentered solve result for the building.
     */
    public SolveResult solve(final LegacyBuildingMap building)
            throws IllegalArgumentException {

        final SolveResult result = solver.solve(buildIndex(building), false);
        if (result.getIndex().getLevelCount() > 0) {
            applyCenterAdjustment(result.getVariables(), building.getReferenceLevelIndex());
        }
        return result;
    }

    public CorrespondenceIndex buildIndex(final LegacyBuildingMap building)
            throws IllegalArgumentException {
        final CorrespondenceIndex index = new CorrespondenceIndex();
        for (final Map.Entry<String, LegacyLevel> entry : building.getLevels().entrySet()) {
            final String levelName = entry.getKey();
            final LegacyLevel level = entry.getValue();
            index.addLevelWithMeasuredScale(levelName,
                                            level.getFiducialSpecs(),
                                            level.getMeasurementList(levelName));
        }
        return index;
    }

    public Map<String, Alignment> getAlignments(final SolveResult result) {
        final CorrespondenceIndex index = result.getIndex();
        final Map<String, Alignment> alignments = new LinkedHashMap<>();
        for (int level = 0; level < index.getLevelCount(); level++) {
            alignments.put(index.getLevelName(level), result.getAlignment(level));
        }
        return alignments;
    }

    /**
     * Shifts all translations so that the reference level ends up at the origin.
     */
    public static void applyCenterAdjustment(final VariableBuffer variables,
                                             final int referenceLevel) {
        final LevelVariables center = variables.getLevel(referenceLevel);
        final double dx = center.getDx();
        final double dy = center.getDy();

        LOG.debug("applyCenterAdjustment: shifting levels by ({}, {}) to center level {}",
                  -dx, -dy, referenceLevel);

        variables.translateAll(-dx, -dy);
    }

    private static final Logger LOG = LoggerFactory.getLogger(LegacyBuildingAligner.class);
}
