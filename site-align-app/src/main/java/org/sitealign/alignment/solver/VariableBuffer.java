package org.sitealign.alignment.solver;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Flat vector of solver variables holding four slots per level
 * ({@code [dx, dy, theta, scale]}) in level insertion order.
 */
public class VariableBuffer implements Serializable {

    public static final int VARIABLES_PER_LEVEL = 4;

    static final int DX = 0;
    static final int DY = 1;
    static final int THETA = 2;
    static final int SCALE = 3;

    private double[] values;

    public VariableBuffer() {
        this.values = new double[0];
    }

    private VariableBuffer(final double[] values) {
        this.values = values;
    }

    /**
     * Appends a level.
     *
     * @return index of the added level.
     */
    public int addLevel(final double dx,
                        final double dy,
                        final double theta,
                        final double scale) {
        final int level = getLevelCount();
        values = Arrays.copyOf(values, values.length + VARIABLES_PER_LEVEL);
        final int offset = offset(level);
        values[offset + DX] = dx;
        values[offset + DY] = dy;
        values[offset + THETA] = theta;
        values[offset + SCALE] = scale;
        return level;
    }

    public int getLevelCount() {
        return values.length / VARIABLES_PER_LEVEL;
    }

    public int size() {
        return values.length;
    }

    public double get(final int index) {
        return values[index];
    }

    public LevelVariables getLevel(final int level) {
        if ((level < 0) || (level >= getLevelCount())) {
            throw new IllegalArgumentException("level " + level + " is out of range, buffer has " +
                                               getLevelCount() + " levels");
        }
        return new LevelVariables(values, level);
    }

    /**
     * @return zeroed buffer with the same layout as this one.
     */
    public double[] createGradient() {
        return new double[values.length];
    }

    /**
     * Applies one descent step ({@code x -= gamma * gradient}).
     *
     * @return squared euclidean norm of the gradient.
     */
    double descend(final double[] gradient,
                   final double gamma) {
        double squaredNorm = 0.0;
        for (int i = 0; i < values.length; i++) {
            values[i] -= gamma * gradient[i];
            squaredNorm += gradient[i] * gradient[i];
        }
        return squaredNorm;
    }

    void clampScale(final int level,
                    final double minimumScale) {
        final int index = offset(level) + SCALE;
        if (values[index] < minimumScale) {
            values[index] = minimumScale;
        }
    }

    /**
     * Shifts every level's translation by the specified amount.
     */
    public void translateAll(final double deltaX,
                             final double deltaY) {
        for (int offset = 0; offset < values.length; offset += VARIABLES_PER_LEVEL) {
            values[offset + DX] += deltaX;
            values[offset + DY] += deltaY;
        }
    }

    public VariableBuffer copy() {
        return new VariableBuffer(values.clone());
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }

    static int offset(final int level) {
        return VARIABLES_PER_LEVEL * level;
    }

}
