package org.sitealign.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Reader;
import java.util.Map;

import org.sitealign.alignment.legacy.LegacyBuildingAligner;
import org.sitealign.alignment.legacy.LegacyBuildingMap;
import org.sitealign.alignment.solver.DescentParameters;
import org.sitealign.alignment.solver.SolveResult;
import org.sitealign.alignment.spec.Alignment;
import org.sitealign.alignment.util.AlignmentResiduals;
import org.sitealign.client.parameter.CommandLineParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for aligning the levels of a legacy building map with each other.
 * Results are centered on the building's reference level.
 */
public class LegacyBuildingAlignmentClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--buildingFile",
                description = "Legacy building map (.yaml, .json or .gz)",
                required = true)
        public String buildingFile;

        @Parameter(
                names = "--toJson",
                description = "File for the level alignments (.json or .gz)",
                required = true)
        public String toJson;

        @ParametersDelegate
        public DescentParameters descent = new DescentParameters();
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final LegacyBuildingAlignmentClient client = new LegacyBuildingAlignmentClient(parameters);
                client.alignAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public LegacyBuildingAlignmentClient(final Parameters parameters)
            throws IllegalArgumentException {

        FileUtil.validateReadableFile(parameters.buildingFile, "building file");
        FileUtil.validateWritableFile(parameters.toJson, "alignment file");
        parameters.descent.validateAndSetDefaults();

        this.parameters = parameters;
    }

    public Map<String, Alignment> alignAndSave()
            throws IOException, IllegalArgumentException {

        // JSON is a subset of YAML so one parser covers both formats
        final LegacyBuildingMap building;
        try (final Reader reader = FileUtil.getExtensionBasedReader(parameters.buildingFile)) {
            building = LegacyBuildingMap.fromYaml(reader);
        }

        LOG.info("alignAndSave: loaded building {} with levels {}", building.getName(), building.getLevelNames());

        final LegacyBuildingAligner aligner = new LegacyBuildingAligner(parameters.descent);
        final SolveResult result = aligner.solve(building);

        AlignmentResiduals.calculate(result);

        final Map<String, Alignment> alignments = aligner.getAlignments(result);

        FileUtil.saveJsonFile(parameters.toJson, alignments);

        return alignments;
    }

    private static final Logger LOG = LoggerFactory.getLogger(LegacyBuildingAlignmentClient.class);
}
