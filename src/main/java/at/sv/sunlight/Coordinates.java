package at.sv.sunlight;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * A geographic location in decimal degrees. North and east are positive.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidCoordinates("Invalid latitude '" + latitude + "'. Must be within [-90..90].");
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidCoordinates("Invalid longitude '" + longitude + "'. Must be within [-180..180].");
        }
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    public Angle latitudeAngle() {
        return new Angle(latitude);
    }

    public Angle longitudeAngle() {
        return new Angle(longitude);
    }

    @Override
    public String toString() {
        DecimalFormat fmt = new DecimalFormat("0.0#####", DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        return fmt.format(latitude) + ", " + fmt.format(longitude);
    }
}
