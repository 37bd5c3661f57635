package org.sitealign.alignment.site;

import java.util.LinkedHashMap;
import java.util.Map;

import org.sitealign.alignment.solver.CorrespondenceIndex;
import org.sitealign.alignment.solver.DescentParameters;
import org.sitealign.alignment.solver.DrawingAlignmentSolver;
import org.sitealign.alignment.solver.SolveResult;
import org.sitealign.alignment.spec.Alignment;
import org.sitealign.alignment.spec.DrawingSpec;
import org.sitealign.alignment.spec.SiteSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the drawings of a site with the site's own metric frame.
 *
 * The site is level 0, fixed at identity and carrying only its fiducials.
 * Every drawing starts from its current pose so that small edits
 * (e.g. one new fiducial) refine the previous placement instead of discarding it.
 */
public class SiteAligner {

    /** Index of the site's own frame in every solve. */
    public static final int SITE_LEVEL = 0;

    /** Label of the site's own frame in logs and residual reports. */
    public static final String SITE_LEVEL_LABEL = "<site>";

    private final DrawingAlignmentSolver solver;

    public SiteAligner() {
        this(DescentParameters.defaults());
    }

    public SiteAligner(final DescentParameters parameters) {
        this.solver = new DrawingAlignmentSolver(parameters);
    }

    /**
     * @return alignment for every drawing in the site, keyed and ordered like the site's drawings.
     *
     * @throws IllegalArgumentException
     *   if any drawing cannot be used to seed the solve.
     */
    public Map<String, Alignment> align(final SiteSpec site)
            throws IllegalArgumentException {
        return getAlignments(site, solve(site));
    }

    public SolveResult solve(final SiteSpec site)
            throws IllegalArgumentException {
        return solver.solve(buildIndex(site), true);
    }

    public CorrespondenceIndex buildIndex(final SiteSpec site)
            throws IllegalArgumentException {

        final CorrespondenceIndex index = new CorrespondenceIndex();
        index.addReferenceLevel(SITE_LEVEL_LABEL, site.getFiducials());

        for (final Map.Entry<String, DrawingSpec> entry : site.getDrawings().entrySet()) {
            final String drawingId = entry.getKey();
            final DrawingSpec drawing = entry.getValue();
            drawing.validate(drawingId);
            final double[] translation = drawing.getTranslation();
            index.addLevel(drawingId,
                           drawing.getFiducials(),
                           drawing.getMeasurements(drawingId),
                           translation[0],
                           translation[1],
                           drawing.getYaw(),
                           drawing.getScale());
        }

        LOG.debug("buildIndex: indexed {} drawings with {} fiducial groups",
                  site.getDrawings().size(), index.getGroupCount());

        return index;
    }

    public Map<String, Alignment> getAlignments(final SiteSpec site,
                                                final SolveResult result) {
        // drawings were indexed in iteration order right after the site frame
        final Map<String, Alignment> alignments = new LinkedHashMap<>();
        int level = SITE_LEVEL + 1;
        for (final String drawingId : site.getDrawings().keySet()) {
            alignments.put(drawingId, result.getAlignment(level));
            level++;
        }
        return alignments;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SiteAligner.class);
}
