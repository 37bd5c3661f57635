package org.sitealign.alignment.legacy;

import java.io.IOException;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.sitealign.alignment.spec.FiducialSpec;
import org.sitealign.alignment.spec.Measurement;

/**
 * Tests the {@link LegacyLevel} class.
 */
public class LegacyLevelTest {

    @Test
    public void testMeasurementList() throws IOException {

        final String yaml =
                "name: b\n" +
                "levels:\n" +
                "  basement:\n" +
                "    vertices:\n" +
                "      - [0, 0, 0, a]\n" +
                "      - [30, 40, 0, b]\n" +
                "      - [30, 40, 0, c]\n" +
                "    measurements:\n" +
                "      - [0, 1, {distance: [3, 5.0]}]\n" +
                "      - [0, 1, {}]\n" +
                "      - [1, 2, {distance: [3, 1.0]}]\n" +
                "    fiducials:\n" +
                "      - [1, 2, stair]\n";

        final LegacyLevel level = LegacyBuildingMap.fromYaml(yaml).getLevels().get("basement");

        Assert.assertEquals("invalid vertex count", 3, level.getVertices().size());
        Assert.assertEquals("invalid raw measurement count", 3, level.getMeasurements().size());
        Assert.assertNull("second measurement has no distance", level.getMeasurements().get(1).getDistance());

        final List<Measurement> measurements = level.getMeasurementList("basement");
        Assert.assertEquals("only the first measurement is usable", 1, measurements.size());
        Assert.assertEquals("invalid pixel distance", 50.0, measurements.get(0).getInPixels(), 1e-12);
        Assert.assertEquals("invalid meters per pixel", 0.1, measurements.get(0).getMetersPerPixel(), 1e-12);

        final List<FiducialSpec> fiducials = level.getFiducialSpecs();
        Assert.assertEquals("invalid fiducial count", 1, fiducials.size());
        Assert.assertEquals("invalid fiducial group", "stair", fiducials.get(0).getGroupId());
        Assert.assertArrayEquals("invalid fiducial position",
                                 new double[] { 1.0, 2.0 }, fiducials.get(0).getPosition(), 0.0);
    }

    @Test
    public void testAddVertex() {
        final LegacyLevel level = new LegacyLevel();
        Assert.assertEquals("invalid first index", 0, level.addVertex(1.0, 1.0));
        Assert.assertEquals("invalid second index", 1, level.addVertex(2.0, 2.0));
        level.addMeasurement(0, 1, 2.0);
        Assert.assertEquals("invalid distance", Double.valueOf(2.0), level.getMeasurements().get(0).getDistance());
    }

}
