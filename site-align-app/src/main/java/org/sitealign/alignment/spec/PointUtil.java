package org.sitealign.alignment.spec;

/**
 * Helpers for the two element {@code double[]} points used throughout the alignment model.
 */
public class PointUtil {

    /**
     * @return the specified point if it has exactly two finite coordinates.
     *
     * @throws IllegalArgumentException
     *   if the point is missing or malformed.
     */
    public static double[] validate(final double[] point,
                                    final String context)
            throws IllegalArgumentException {
        if (point == null) {
            throw new IllegalArgumentException(context + " is missing");
        } else if (point.length != 2) {
            throw new IllegalArgumentException(context + " must have 2 coordinates but has " + point.length);
        } else if (! (Double.isFinite(point[0]) && Double.isFinite(point[1]))) {
            throw new IllegalArgumentException(context + " has non-finite coordinates");
        }
        return point;
    }

    public static double distance(final double[] from,
                                  final double[] to) {
        return Math.hypot(to[0] - from[0], to[1] - from[1]);
    }

    /**
     * @return heading (radians) of the vector that points from {@code to} back to {@code from}.
     */
    public static double heading(final double[] from,
                                 final double[] to) {
        return Math.atan2(from[1] - to[1], from[0] - to[0]);
    }

    public static String toString(final double[] point) {
        return point == null ? "null" : "[" + point[0] + ", " + point[1] + "]";
    }

}
