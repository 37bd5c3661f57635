package org.sitealign.alignment.legacy;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;

import org.sitealign.alignment.spec.FiducialSpec;

/**
 * Legacy level fiducial, stored as {@code [x, y, name]}.
 * Fiducials with the same name on different levels mark the same physical point.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y", "name"})
public class LegacyFiducial implements Serializable {

    private final double x;
    private final double y;
    private final String name;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LegacyFiducial() {
        this(0.0, 0.0, null);
    }

    public LegacyFiducial(final double x,
                          final double y,
                          final String name) {
        this.x = x;
        this.y = y;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public FiducialSpec toFiducialSpec() {
        return new FiducialSpec(name, new double[] { x, y });
    }

}
