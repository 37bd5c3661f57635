package org.sitealign.alignment.legacy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.sitealign.alignment.spec.FiducialSpec;
import org.sitealign.alignment.spec.Measurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The parts of a legacy building level used for alignment.
 * Walls, lanes, doors and the rest of the level are ignored when reading.
 */
public class LegacyLevel implements Serializable {

    private final List<LegacyVertex> vertices;
    private final List<LegacyFiducial> fiducials;
    private final List<LegacyMeasurement> measurements;

    public LegacyLevel() {
        this.vertices = new ArrayList<>();
        this.fiducials = new ArrayList<>();
        this.measurements = new ArrayList<>();
    }

    public List<LegacyVertex> getVertices() {
        return vertices == null ? new ArrayList<>() : vertices;
    }

    public List<LegacyFiducial> getFiducials() {
        return fiducials == null ? new ArrayList<>() : fiducials;
    }

    public List<LegacyMeasurement> getMeasurements() {
        return measurements == null ? new ArrayList<>() : measurements;
    }

    /**
     * @return index of the added vertex.
     */
    public int addVertex(final double x,
                         final double y) {
        vertices.add(new LegacyVertex(x, y));
        return vertices.size() - 1;
    }

    public LegacyLevel addFiducial(final double x,
                                   final double y,
                                   final String name) {
        fiducials.add(new LegacyFiducial(x, y, name));
        return this;
    }

    public LegacyLevel addMeasurement(final int start,
                                      final int end,
                                      final Double distance) {
        measurements.add(new LegacyMeasurement(start, end, distance));
        return this;
    }

    public List<FiducialSpec> getFiducialSpecs() {
        final List<FiducialSpec> specs = new ArrayList<>();
        for (final LegacyFiducial fiducial : getFiducials()) {
            specs.add(fiducial.toFiducialSpec());
        }
        return specs;
    }

    /**
     * @return usable measurements of this level with pixel distances derived from its vertices.
     *
     * @throws IllegalArgumentException
     *   if a measurement references a missing vertex.
     */
    public List<Measurement> getMeasurementList(final String levelName)
            throws IllegalArgumentException {
        final List<Measurement> list = new ArrayList<>();
        for (final LegacyMeasurement legacyMeasurement : getMeasurements()) {
            final Measurement measurement = legacyMeasurement.toMeasurement(getVertices(), levelName);
            if (measurement == null) {
                LOG.warn("getMeasurementList: skipping measurement without distance in level {}", levelName);
            } else if (measurement.isUsable()) {
                list.add(measurement);
            } else {
                LOG.warn("getMeasurementList: skipping unusable measurement {} in level {}", measurement, levelName);
            }
        }
        return list;
    }

    private static final Logger LOG = LoggerFactory.getLogger(LegacyLevel.class);
}
