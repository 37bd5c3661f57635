package org.sitealign.alignment.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.sitealign.alignment.spec.FiducialSpec;
import org.sitealign.alignment.spec.Measurement;
import org.sitealign.alignment.spec.PointUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correspondence tables for one solve.
 *
 * Fiducial groups receive dense indexes in the order they are first seen across all levels.
 * Each level keeps a sparse table of appearances (null where the level does not contain a group)
 * and its own list of measurements.  The initial variables for every level are collected
 * alongside so that the solver can start from them.
 */
public class CorrespondenceIndex {

    /** Scale (meters per pixel) used for levels without any measurements. */
    public static final double DEFAULT_METERS_PER_PIXEL = 0.05;

    private final Map<String, Integer> groupIdToIndex;
    private final List<String> groupIds;
    private final List<String> levelNames;
    private final Map<String, Integer> levelNameToIndex;
    private final List<List<double[]>> levelFiducials;
    private final List<List<Measurement>> levelMeasurements;
    private final VariableBuffer initialVariables;

    public CorrespondenceIndex() {
        this.groupIdToIndex = new HashMap<>();
        this.groupIds = new ArrayList<>();
        this.levelNames = new ArrayList<>();
        this.levelNameToIndex = new HashMap<>();
        this.levelFiducials = new ArrayList<>();
        this.levelMeasurements = new ArrayList<>();
        this.initialVariables = new VariableBuffer();
    }

    /**
     * Adds a level that starts from a caller supplied pose.
     *
     * @return index of the added level.
     *
     * @throws IllegalArgumentException
     *   if the level name is missing or duplicated or if any grouped fiducial has a malformed position.
     */
    public int addLevel(final String levelName,
                        final List<FiducialSpec> fiducials,
                        final List<Measurement> measurements,
                        final double dx,
                        final double dy,
                        final double theta,
                        final double scale)
            throws IllegalArgumentException {

        if (levelName == null) {
            throw new IllegalArgumentException("level name must be specified");
        } else if (levelNameToIndex.containsKey(levelName)) {
            throw new IllegalArgumentException("level " + levelName + " was already added");
        }

        final int level = addLevelData(levelName, fiducials, measurements, dx, dy, theta, scale);
        levelNameToIndex.put(levelName, level);
        return level;
    }

    /**
     * Adds a fixed reference frame at identity with no measurements.
     * The label is only used for logging and diagnostics, so the frame can
     * never collide with (or be looked up as) a caller named level.
     *
     * @return index of the added level.
     *
     * @throws IllegalArgumentException
     *   if any grouped fiducial has a malformed position.
     */
    public int addReferenceLevel(final String label,
                                 final List<FiducialSpec> fiducials)
            throws IllegalArgumentException {
        return addLevelData(label, fiducials, Collections.emptyList(), 0.0, 0.0, 0.0, 1.0);
    }

    private int addLevelData(final String levelName,
                             final List<FiducialSpec> fiducials,
                             final List<Measurement> measurements,
                             final double dx,
                             final double dy,
                             final double theta,
                             final double scale)
            throws IllegalArgumentException {

        final List<double[]> appearances = new ArrayList<>();
        for (final FiducialSpec fiducial : fiducials) {
            if (! fiducial.hasGroup()) {
                LOG.debug("addLevel: skipping ungrouped fiducial in level {}", levelName);
                continue;
            }
            final double[] position = PointUtil.validate(fiducial.getPosition(),
                                                         "fiducial " + fiducial.getGroupId() +
                                                         " in level " + levelName);
            final int groupIndex = getOrAssignGroupIndex(fiducial.getGroupId());
            while (appearances.size() <= groupIndex) {
                appearances.add(null);
            }
            appearances.set(groupIndex, position.clone());
        }
        while (appearances.size() < groupIds.size()) {
            appearances.add(null);
        }

        final int level = initialVariables.addLevel(dx, dy, theta, scale);
        levelNames.add(levelName);
        levelFiducials.add(appearances);
        levelMeasurements.add(new ArrayList<>(measurements));

        LOG.debug("addLevel: added level {} ({}) with {} fiducial slots and {} measurements",
                  level, levelName, appearances.size(), measurements.size());

        return level;
    }

    /**
     * Adds a level that starts at the origin, unrotated, with a scale derived from its measurements.
     *
     * @return index of the added level.
     */
    public int addLevelWithMeasuredScale(final String levelName,
                                         final List<FiducialSpec> fiducials,
                                         final List<Measurement> measurements)
            throws IllegalArgumentException {
        return addLevel(levelName, fiducials, measurements, 0.0, 0.0, 0.0, getInitialScale(measurements));
    }

    /**
     * @return unweighted mean of meters per pixel over the measurements,
     *         or {@link #DEFAULT_METERS_PER_PIXEL} if there are none.
     */
    public static double getInitialScale(final List<Measurement> measurements) {
        if (measurements.isEmpty()) {
            return DEFAULT_METERS_PER_PIXEL;
        }
        double sum = 0.0;
        for (final Measurement measurement : measurements) {
            sum += measurement.getMetersPerPixel();
        }
        return sum / measurements.size();
    }

    public int getLevelCount() {
        return levelNames.size();
    }

    public int getGroupCount() {
        return groupIds.size();
    }

    public String getLevelName(final int level) {
        return levelNames.get(level);
    }

    /**
     * @return index of the named level, or null if no level was added with that name
     *         (reference levels are never returned).
     */
    public Integer getLevelIndex(final String levelName) {
        return levelNameToIndex.get(levelName);
    }

    public String getGroupId(final int group) {
        return groupIds.get(group);
    }

    /**
     * @return number of group slots recorded for the level (appearances beyond this are absent).
     */
    public int getSlotCount(final int level) {
        return levelFiducials.get(level).size();
    }

    /**
     * @return local position of the group's appearance in the level, or null if the level does not contain it.
     */
    public double[] getFiducial(final int level,
                                final int group) {
        if ((level < 0) || (level >= levelFiducials.size())) {
            return null;
        }
        final List<double[]> appearances = levelFiducials.get(level);
        return (group >= 0) && (group < appearances.size()) ? appearances.get(group) : null;
    }

    public List<Measurement> getMeasurements(final int level) {
        if ((level < 0) || (level >= levelMeasurements.size())) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(levelMeasurements.get(level));
    }

    /**
     * @return copy of the initial variables, safe for a solver to mutate.
     */
    public VariableBuffer getInitialVariables() {
        return initialVariables.copy();
    }

    private int getOrAssignGroupIndex(final String groupId) {
        Integer index = groupIdToIndex.get(groupId);
        if (index == null) {
            index = groupIds.size();
            groupIdToIndex.put(groupId, index);
            groupIds.add(groupId);
        }
        return index;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CorrespondenceIndex.class);
}
