package org.sitealign.alignment.solver;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates over the levels of a {@link VariableBuffer} in ascending order.
 *
 * <ul>
 *   <li>{@link #all} visits every level,</li>
 *   <li>{@link #except} skips one level (nested in {@link #all}, yields every ordered pair),</li>
 *   <li>{@link #after} starts after one level (nested in {@link #all}, yields every unordered pair once).</li>
 * </ul>
 */
public class VariableTraversal
        implements Iterable<LevelVariables> {

    private static final int NONE = -1;

    private final VariableBuffer variables;
    private final int firstLevel;
    private final int excludedLevel;

    private VariableTraversal(final VariableBuffer variables,
                              final int firstLevel,
                              final int excludedLevel) {
        this.variables = variables;
        this.firstLevel = firstLevel;
        this.excludedLevel = excludedLevel;
    }

    public static VariableTraversal all(final VariableBuffer variables) {
        return new VariableTraversal(variables, 0, NONE);
    }

    public static VariableTraversal except(final int level,
                                           final VariableBuffer variables) {
        return new VariableTraversal(variables, 0, level);
    }

    public static VariableTraversal after(final int level,
                                          final VariableBuffer variables) {
        return new VariableTraversal(variables, level + 1, NONE);
    }

    @Override
    public Iterator<LevelVariables> iterator() {
        return new Iterator<LevelVariables>() {

            private int nextLevel = skipExcluded(firstLevel);

            @Override
            public boolean hasNext() {
                return nextLevel < variables.getLevelCount();
            }

            @Override
            public LevelVariables next() {
                if (! hasNext()) {
                    throw new NoSuchElementException();
                }
                final LevelVariables levelVariables = variables.getLevel(nextLevel);
                nextLevel = skipExcluded(nextLevel + 1);
                return levelVariables;
            }
        };
    }

    private int skipExcluded(final int level) {
        return level == excludedLevel ? level + 1 : level;
    }

}
