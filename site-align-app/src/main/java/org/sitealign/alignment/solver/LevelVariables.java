package org.sitealign.alignment.solver;

import org.sitealign.alignment.spec.Alignment;

/**
 * Read-only view of one level's four variables within a {@link VariableBuffer}.
 */
public class LevelVariables {

    private final double[] values;
    private final int level;
    private final int offset;

    LevelVariables(final double[] values,
                   final int level) {
        this.values = values;
        this.level = level;
        this.offset = VariableBuffer.offset(level);
    }

    public int getLevel() {
        return level;
    }

    public double getDx() {
        return values[offset + VariableBuffer.DX];
    }

    public double getDy() {
        return values[offset + VariableBuffer.DY];
    }

    public double getTheta() {
        return values[offset + VariableBuffer.THETA];
    }

    public double getScale() {
        return values[offset + VariableBuffer.SCALE];
    }

    public double[] getTranslation() {
        return new double[] { getDx(), getDy() };
    }

    /**
     * @return {@code scale * R(theta) * point + translation} for a point in this level's local frame.
     */
    public double[] transform(final double[] point) {
        final double theta = getTheta();
        final double scale = getScale();
        final double cos = Math.cos(theta);
        final double sin = Math.sin(theta);
        return new double[] {
                scale * (cos * point[0] - sin * point[1]) + getDx(),
                scale * (sin * point[0] + cos * point[1]) + getDy()
        };
    }

    public Alignment toAlignment() {
        return new Alignment(getTranslation(), getTheta(), getScale());
    }

    @Override
    public String toString() {
        return "level " + level + ": [" + getDx() + ", " + getDy() + ", " + getTheta() + ", " + getScale() + "]";
    }
}
