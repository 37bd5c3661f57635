package org.sitealign.alignment.solver;

import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;
import org.sitealign.alignment.spec.FiducialSpec;

/**
 * Tests the {@link DisplacementGradient} class.
 */
public class DisplacementGradientTest {

    @Test
    public void testTranslationWithGroundTruth() {

        final CorrespondenceIndex index = new CorrespondenceIndex();
        index.addLevel("reference",
                       Collections.singletonList(fiducial("a", 1, 2)),
                       Collections.emptyList(),
                       0.0, 0.0, 0.0, 1.0);
        index.addLevel("drawing",
                       Collections.singletonList(fiducial("a", 0, 0)),
                       Collections.emptyList(),
                       0.0, 0.0, 0.0, 1.0);

        final VariableBuffer variables = index.getInitialVariables();
        final DescentResult result = new GradientDescent(DescentParameters.defaults()).minimize(
                variables, new DisplacementGradient(index, true));

        Assert.assertTrue("displacement phase should converge", result.isConverged());
        Assert.assertArrayEquals("reference should not move",
                                 new double[] { 0.0, 0.0 }, variables.getLevel(0).getTranslation(), 0.0);
        Assert.assertArrayEquals("drawing should move onto reference fiducial",
                                 new double[] { 1.0, 2.0 }, variables.getLevel(1).getTranslation(), 1e-12);
    }

    @Test
    public void testTranslationWithoutGroundTruth() {

        final CorrespondenceIndex index = new CorrespondenceIndex();
        index.addLevel("first",
                       Collections.singletonList(fiducial("a", 0, 0)),
                       Collections.emptyList(),
                       0.0, 0.0, 0.0, 1.0);
        index.addLevel("second",
                       Collections.singletonList(fiducial("a", 0, 0)),
                       Collections.emptyList(),
                       2.0, -4.0, 0.0, 1.0);

        final VariableBuffer variables = index.getInitialVariables();
        new GradientDescent(DescentParameters.defaults()).minimize(variables, new DisplacementGradient(index, false));

        Assert.assertArrayEquals("first level should meet second halfway",
                                 new double[] { 1.0, -2.0 }, variables.getLevel(0).getTranslation(), 1e-12);
        Assert.assertArrayEquals("second level should meet first halfway",
                                 new double[] { 1.0, -2.0 }, variables.getLevel(1).getTranslation(), 1e-12);
    }

    @Test
    public void testLevelWithoutFiducialsKeepsPose() {

        final CorrespondenceIndex index = new CorrespondenceIndex();
        index.addLevel("reference",
                       Collections.singletonList(fiducial("a", 1, 2)),
                       Collections.emptyList(),
                       0.0, 0.0, 0.0, 1.0);
        index.addLevel("isolated",
                       Collections.emptyList(),
                       Collections.emptyList(),
                       7.0, 8.0, 0.0, 1.0);

        final VariableBuffer variables = index.getInitialVariables();
        final DescentResult result = new GradientDescent(DescentParameters.defaults()).minimize(
                variables, new DisplacementGradient(index, true));

        Assert.assertEquals("zero gradient should stop after one evaluation", 1, result.getIterations());
        Assert.assertArrayEquals("isolated level should not move",
                                 new double[] { 7.0, 8.0 }, variables.getLevel(1).getTranslation(), 0.0);
    }

    private static FiducialSpec fiducial(final String groupId,
                                         final double x,
                                         final double y) {
        return new FiducialSpec(groupId, new double[] { x, y });
    }

}
