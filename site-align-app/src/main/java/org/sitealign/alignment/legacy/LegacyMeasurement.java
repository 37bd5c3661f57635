package org.sitealign.alignment.legacy;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

import org.sitealign.alignment.spec.Measurement;
import org.sitealign.alignment.spec.PointUtil;

/**
 * Legacy level measurement, stored as {@code [startVertex, endVertex, {distance: [type, meters]}]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"start", "end", "properties"})
public class LegacyMeasurement implements Serializable {

    public static class Properties implements Serializable {

        /** Typed legacy value: {@code [valueType, meters]}. */
        private final double[] distance;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private Properties() {
            this(null);
        }

        public Properties(final double[] distance) {
            this.distance = distance;
        }
    }

    private final int start;
    private final int end;
    private final Properties properties;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LegacyMeasurement() {
        this(0, 0, null);
    }

    public LegacyMeasurement(final int start,
                             final int end,
                             final Double distance) {
        this.start = start;
        this.end = end;
        this.properties = new Properties(distance == null ? null : new double[] { 3, distance });
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * @return real world distance in meters or null if none was recorded.
     */
    public Double getDistance() {
        if ((properties == null) || (properties.distance == null) || (properties.distance.length < 2)) {
            return null;
        }
        return properties.distance[1];
    }

    /**
     * @return measurement with the pixel distance between this measurement's vertices,
     *         or null if no real world distance was recorded.
     *
     * @throws IllegalArgumentException
     *   if either vertex index is missing from the level.
     */
    public Measurement toMeasurement(final List<LegacyVertex> vertices,
                                     final String levelName)
            throws IllegalArgumentException {
        final Double distance = getDistance();
        if (distance == null) {
            return null;
        }
        final double[] p0 = getVertex(vertices, start, levelName).toPoint();
        final double[] p1 = getVertex(vertices, end, levelName).toPoint();
        return new Measurement(PointUtil.distance(p0, p1), distance);
    }

    private static LegacyVertex getVertex(final List<LegacyVertex> vertices,
                                          final int vertexIndex,
                                          final String levelName)
            throws IllegalArgumentException {
        if ((vertexIndex < 0) || (vertexIndex >= vertices.size())) {
            throw new IllegalArgumentException("measurement in level " + levelName + " references vertex " +
                                               vertexIndex + " but the level only has " +
                                               vertices.size() + " vertices");
        }
        return vertices.get(vertexIndex);
    }

}
