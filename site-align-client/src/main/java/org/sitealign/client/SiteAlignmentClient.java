package org.sitealign.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import org.sitealign.alignment.site.SiteAligner;
import org.sitealign.alignment.solver.DescentParameters;
import org.sitealign.alignment.solver.SolveResult;
import org.sitealign.alignment.spec.Alignment;
import org.sitealign.alignment.spec.SiteSpec;
import org.sitealign.alignment.util.AlignmentResiduals;
import org.sitealign.client.parameter.CommandLineParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for aligning the drawings of a site with the site's metric frame.
 */
public class SiteAlignmentClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--siteJson",
                description = "Site JSON file with fiducials and drawings (.json or .gz)",
                required = true)
        public String siteJson;

        @Parameter(
                names = "--toJson",
                description = "File for the drawing placements (.json or .gz)",
                required = true)
        public String toJson;

        @ParametersDelegate
        public DescentParameters descent = new DescentParameters();
    }

    /**
     * Resolved placement of one drawing in the site frame.
     */
    public static class Placement implements Serializable {

        private final Alignment alignment;
        private final Double pixelsPerMeter;

        @SuppressWarnings("unused")
        private Placement() {
            // no-arg constructor needed for JSON deserialization
            this(null);
        }

        public Placement(final Alignment alignment) {
            this.alignment = alignment;
            this.pixelsPerMeter = alignment == null ? null : alignment.getPixelsPerMeter();
        }

        public Alignment getAlignment() {
            return alignment;
        }

        public Double getPixelsPerMeter() {
            return pixelsPerMeter;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final SiteAlignmentClient client = new SiteAlignmentClient(parameters);
                client.alignAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public SiteAlignmentClient(final Parameters parameters)
            throws IllegalArgumentException {

        FileUtil.validateReadableFile(parameters.siteJson, "site file");
        FileUtil.validateWritableFile(parameters.toJson, "placement file");
        parameters.descent.validateAndSetDefaults();

        this.parameters = parameters;
    }

    public Map<String, Placement> alignAndSave()
            throws IOException, IllegalArgumentException {

        final SiteSpec site;
        try (final Reader reader = FileUtil.getExtensionBasedReader(parameters.siteJson)) {
            site = SiteSpec.fromJson(reader);
        }

        LOG.info("alignAndSave: loaded {} drawings from {}", site.getDrawings().size(), parameters.siteJson);

        final SiteAligner aligner = new SiteAligner(parameters.descent);
        final SolveResult result = aligner.solve(site);

        AlignmentResiduals.calculate(result);

        final Map<String, Placement> placements = new LinkedHashMap<>();
        for (final Map.Entry<String, Alignment> entry : aligner.getAlignments(site, result).entrySet()) {
            placements.put(entry.getKey(), new Placement(entry.getValue()));
        }

        FileUtil.saveJsonFile(parameters.toJson, placements);

        return placements;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SiteAlignmentClient.class);
}
