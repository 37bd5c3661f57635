package org.sitealign.alignment.solver;

/**
 * Mutable view of one level's slots within a gradient buffer laid out like a {@link VariableBuffer}.
 */
public class LevelGradient {

    private final double[] gradient;
    private final int offset;

    public LevelGradient(final int level,
                         final double[] gradient) {
        this.gradient = gradient;
        this.offset = VariableBuffer.offset(level);
    }

    public void addDx(final double value) {
        gradient[offset + VariableBuffer.DX] += value;
    }

    public void addDy(final double value) {
        gradient[offset + VariableBuffer.DY] += value;
    }

    public void addTheta(final double value) {
        gradient[offset + VariableBuffer.THETA] += value;
    }

    public void addScale(final double value) {
        gradient[offset + VariableBuffer.SCALE] += value;
    }

    public void clear() {
        for (int i = 0; i < VariableBuffer.VARIABLES_PER_LEVEL; i++) {
            gradient[offset + i] = 0.0;
        }
    }

}
