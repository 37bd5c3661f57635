package org.sitealign.alignment.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.sitealign.alignment.spec.Alignment;

/**
 * Final variables of a solve along with the correspondences they were solved from
 * and the report of each descent phase.
 */
public class SolveResult {

    private final CorrespondenceIndex index;
    private final VariableBuffer variables;
    private final List<DescentResult> phaseResults;

    public SolveResult(final CorrespondenceIndex index,
                       final VariableBuffer variables,
                       final List<DescentResult> phaseResults) {
        this.index = index;
        this.variables = variables;
        this.phaseResults = new ArrayList<>(phaseResults);
    }

    public CorrespondenceIndex getIndex() {
        return index;
    }

    public VariableBuffer getVariables() {
        return variables;
    }

    public List<DescentResult> getPhaseResults() {
        return Collections.unmodifiableList(phaseResults);
    }

    public Alignment getAlignment(final int level) {
        return variables.getLevel(level).toAlignment();
    }

    public Alignment getAlignment(final String levelName) {
        final Integer level = index.getLevelIndex(levelName);
        if (level == null) {
            throw new IllegalArgumentException("level " + levelName + " was not solved");
        }
        return getAlignment(level);
    }

}
