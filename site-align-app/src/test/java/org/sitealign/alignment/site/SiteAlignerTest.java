package org.sitealign.alignment.site;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;
import org.sitealign.alignment.solver.CorrespondenceIndex;
import org.sitealign.alignment.solver.SolveResult;
import org.sitealign.alignment.spec.Alignment;
import org.sitealign.alignment.spec.DrawingSpec;
import org.sitealign.alignment.spec.SiteSpec;

/**
 * Tests the {@link SiteAligner} class.
 */
public class SiteAlignerTest {

    @Test
    public void testAlignDrawing() {

        final Alignment expected = new Alignment(new double[] { 5.0, 3.0 }, 0.3, 0.5);
        final SiteSpec site = buildSite(expected, new DrawingSpec(new double[] { 0.0, 0.0 }, 0.0, 2.0));

        final SiteAligner aligner = new SiteAligner();
        final SolveResult result = aligner.solve(site);

        final Alignment siteAlignment = result.getAlignment(SiteAligner.SITE_LEVEL);
        Assert.assertArrayEquals("site translation changed",
                                 new double[] { 0.0, 0.0 }, siteAlignment.getTranslation(), 0.0);
        Assert.assertEquals("site rotation changed", 0.0, siteAlignment.getRotation(), 0.0);
        Assert.assertEquals("site scale changed", 1.0, siteAlignment.getScale(), 0.0);

        final Alignment actual = aligner.getAlignments(site, result).get("floor-1");
        Assert.assertArrayEquals("invalid translation", expected.getTranslation(), actual.getTranslation(), 1e-6);
        Assert.assertEquals("invalid rotation", expected.getRotation(), actual.getRotation(), 1e-6);
        Assert.assertEquals("invalid scale", expected.getScale(), actual.getScale(), 1e-6);
        Assert.assertEquals("invalid pixels per meter", 2.0, actual.getPixelsPerMeter(), 1e-5);
    }

    @Test
    public void testRealignIsStable() {

        final Alignment expected = new Alignment(new double[] { -2.0, 8.0 }, -0.2, 0.25);
        final SiteAligner aligner = new SiteAligner();

        final Alignment first = aligner.align(
                buildSite(expected, new DrawingSpec(new double[] { 0.0, 0.0 }, 0.0, 4.0))).get("floor-1");

        final DrawingSpec solvedPose = new DrawingSpec(first.getTranslation(),
                                                       first.getRotation(),
                                                       first.getPixelsPerMeter());
        final Alignment second = aligner.align(buildSite(expected, solvedPose)).get("floor-1");

        Assert.assertArrayEquals("translation should not drift",
                                 first.getTranslation(), second.getTranslation(), 1e-9);
        Assert.assertEquals("rotation should not drift", first.getRotation(), second.getRotation(), 1e-9);
        Assert.assertEquals("scale should not drift", first.getScale(), second.getScale(), 1e-9);
    }

    @Test
    public void testDrawingWithoutCorrespondencesKeepsPose() {

        final SiteSpec site = new SiteSpec();
        site.addFiducial("a", 1.0, 1.0);
        site.addDrawing("annex", new DrawingSpec(new double[] { 4.0, 5.0 }, 0.2, 10.0));

        final Alignment alignment = new SiteAligner().align(site).get("annex");

        Assert.assertArrayEquals("invalid translation", new double[] { 4.0, 5.0 }, alignment.getTranslation(), 0.0);
        Assert.assertEquals("invalid rotation", 0.2, alignment.getRotation(), 0.0);
        Assert.assertEquals("invalid scale", 0.1, alignment.getScale(), 0.0);
    }

    @Test
    public void testDistanceAnnotationsSetScale() {

        final DrawingSpec drawing = new DrawingSpec(new double[] { 0.0, 0.0 }, 0.0, 1.0);
        drawing.addDistance(new double[] { 0.0, 0.0 }, new double[] { 100.0, 0.0 }, 5.0);
        drawing.addDistance(new double[] { 0.0, 0.0 }, new double[] { 0.0, 30.0 }, null);
        drawing.addDistance(new double[] { 7.0, 7.0 }, new double[] { 7.0, 7.0 }, 2.0);

        final SiteSpec site = new SiteSpec();
        site.addDrawing("plan", drawing);

        final SiteAligner aligner = new SiteAligner();
        final CorrespondenceIndex index = aligner.buildIndex(site);
        Assert.assertEquals("only the complete annotation should become a measurement",
                            1, index.getMeasurements(1).size());

        final Alignment alignment = aligner.align(site).get("plan");
        Assert.assertEquals("invalid scale", 0.05, alignment.getScale(), 1e-9);
        Assert.assertEquals("invalid pixels per meter", 20.0, alignment.getPixelsPerMeter(), 1e-6);
    }

    @Test
    public void testDrawingOrder() {

        final SiteSpec site = new SiteSpec();
        for (final String drawingId : new String[] { "zeta", "alpha", "mu" }) {
            site.addDrawing(drawingId, new DrawingSpec(new double[] { 0.0, 0.0 }, 0.0, 1.0));
        }

        final SiteAligner aligner = new SiteAligner();
        final CorrespondenceIndex index = aligner.buildIndex(site);
        Assert.assertEquals("site should be first level", SiteAligner.SITE_LEVEL_LABEL, index.getLevelName(0));
        Assert.assertEquals("invalid level for second drawing", "alpha", index.getLevelName(2));

        final Map<String, Alignment> alignments = aligner.align(site);
        Assert.assertEquals("invalid drawing order",
                            Arrays.asList("zeta", "alpha", "mu"), new ArrayList<>(alignments.keySet()));
    }

    @Test
    public void testDrawingNamedLikeSiteFrame() {

        final Alignment expected = new Alignment(new double[] { 5.0, 3.0 }, 0.3, 0.5);
        final SiteSpec site = buildSite(expected, new DrawingSpec(new double[] { 0.0, 0.0 }, 0.0, 2.0));
        final DrawingSpec labelled = new DrawingSpec(new double[] { 1.0, 1.0 }, 0.0, 2.0);
        site.addDrawing(SiteAligner.SITE_LEVEL_LABEL, labelled);

        final Map<String, Alignment> alignments = new SiteAligner().align(site);

        Assert.assertEquals("every drawing should be aligned",
                            Arrays.asList("floor-1", SiteAligner.SITE_LEVEL_LABEL),
                            new ArrayList<>(alignments.keySet()));
        Assert.assertArrayEquals("drawing without correspondences should keep its pose",
                                 new double[] { 1.0, 1.0 },
                                 alignments.get(SiteAligner.SITE_LEVEL_LABEL).getTranslation(), 0.0);
        Assert.assertArrayEquals("invalid translation",
                                 expected.getTranslation(), alignments.get("floor-1").getTranslation(), 1e-6);
    }

    @Test
    public void testIdenticalInputsGiveIdenticalResults() {

        final Alignment expected = new Alignment(new double[] { -7.0, 2.0 }, 0.4, 0.2);
        final SiteSpec site = buildSite(expected, new DrawingSpec(new double[] { 1.0, -1.0 }, 0.1, 4.0));
        site.addDrawing("annex", new DrawingSpec(new double[] { 2.0, 2.0 }, 0.0, 8.0)
                .addFiducial("a", 3.0, 4.0)
                .addFiducial("b", 40.0, 9.0));

        final SiteAligner aligner = new SiteAligner();
        final double[] first = aligner.solve(site).getVariables().toArray();
        final double[] second = aligner.solve(site).getVariables().toArray();

        Assert.assertEquals("invalid variable count", first.length, second.length);
        for (int i = 0; i < first.length; i++) {
            Assert.assertEquals("variable " + i + " differs between solves",
                                Double.doubleToLongBits(first[i]), Double.doubleToLongBits(second[i]));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteYaw() {
        final SiteSpec site = new SiteSpec();
        site.addDrawing("spinning", new DrawingSpec(new double[] { 0.0, 0.0 }, Double.NaN, 1.0));
        new SiteAligner().align(site);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidPixelsPerMeter() {
        final SiteSpec site = new SiteSpec();
        site.addDrawing("broken", new DrawingSpec(new double[] { 0.0, 0.0 }, 0.0, 0.0));
        new SiteAligner().align(site);
    }

    private static final double[][] WORLD_POINTS = { { 10, 10 }, { 0, 5 }, { 5, 0 } };
    private static final String[] GROUP_IDS = { "a", "b", "c" };

    private static SiteSpec buildSite(final Alignment drawingToSite,
                                      final DrawingSpec drawing) {
        final SiteSpec site = new SiteSpec();
        for (int i = 0; i < WORLD_POINTS.length; i++) {
            site.addFiducial(GROUP_IDS[i], WORLD_POINTS[i][0], WORLD_POINTS[i][1]);
            final double[] local = toLocal(drawingToSite, WORLD_POINTS[i]);
            drawing.addFiducial(GROUP_IDS[i], local[0], local[1]);
        }
        site.addDrawing("floor-1", drawing);
        return site;
    }

    private static double[] toLocal(final Alignment alignment,
                                    final double[] world) {
        final double[] translation = alignment.getTranslation();
        final double x = world[0] - translation[0];
        final double y = world[1] - translation[1];
        final double cos = Math.cos(-alignment.getRotation());
        final double sin = Math.sin(-alignment.getRotation());
        return new double[] {
                (cos * x - sin * y) / alignment.getScale(),
                (sin * x + cos * y) / alignment.getScale()
        };
    }

}
