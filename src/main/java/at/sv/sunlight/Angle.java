package at.sv.sunlight;

/**
 * An angle in degrees. All operations act on the degree value and return new instances.
 */
public record Angle(double degrees) {

    public static Angle ofRadians(double radians) {
        return new Angle((radians * 180.0) / Math.PI);
    }

    public double radians() {
        return (degrees * Math.PI) / 180.0;
    }

    /**
     * @return the angle reduced to [0, 360)
     */
    public Angle unwound() {
        return new Angle(MathUtil.normalizeToScale(degrees, 360));
    }

    /**
     * @return the angle shifted into [-180, 180]
     */
    public Angle quadrantShifted() {
        if (degrees >= -180 && degrees <= 180) {
            return this;
        }
        return new Angle(degrees - (360 * Math.rint(degrees / 360)));
    }

    public Angle plus(Angle other) {
        return new Angle(degrees + other.degrees);
    }

    public Angle minus(Angle other) {
        return new Angle(degrees - other.degrees);
    }

    public Angle times(Angle other) {
        return new Angle(degrees * other.degrees);
    }

    public Angle times(double factor) {
        return new Angle(degrees * factor);
    }

    public Angle dividedBy(Angle other) {
        return new Angle(degrees / other.degrees);
    }

    public Angle dividedBy(double divisor) {
        return new Angle(degrees / divisor);
    }

    @Override
    public String toString() {
        return degrees + "°";
    }
}
