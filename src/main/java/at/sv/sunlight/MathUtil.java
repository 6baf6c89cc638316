package at.sv.sunlight;

final class MathUtil {

    private MathUtil() {
    }

    /**
     * Floor based modulo, brings values into [0, max) for a positive {@code max}.
     */
    static double normalizeToScale(double value, double max) {
        double normalized = value - (max * Math.floor(value / max));
        // tiny negative values round up to max
        return normalized == max ? 0 : normalized;
    }
}
