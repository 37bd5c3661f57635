package org.sitealign.alignment.legacy;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Map;

/**
 * Legacy level vertex, stored as {@code [x, y, z, name, {properties}]} in image pixels.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y", "z", "name", "properties"})
public class LegacyVertex implements Serializable {

    private final double x;
    private final double y;
    private final double z;
    private final String name;
    private final Map<String, Object> properties;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LegacyVertex() {
        this(0.0, 0.0);
    }

    public LegacyVertex(final double x,
                        final double y) {
        this.x = x;
        this.y = y;
        this.z = 0.0;
        this.name = "";
        this.properties = null;
    }

    public double[] toPoint() {
        return new double[] { x, y };
    }

    public String getName() {
        return name;
    }

}
