package at.sv.sunlight;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Closed-form series for the position of the Sun and for rise, transit and set times.
 * <p>
 * Equations and page numbers refer to Jean Meeus, <i>Astronomical Algorithms</i>, 2nd edition.
 */
public final class Astronomical {

    private static final double J2000 = 2451545.0;
    private static final double DAYS_PER_JULIAN_CENTURY = 36525;
    private static final double SIDEREAL_DEGREES_PER_DAY = 360.985647;

    private Astronomical() {
    }

    /**
     * The geometric mean longitude of the sun. (p. 163)
     */
    public static Angle meanSolarLongitude(double T) {
        double term1 = 280.4664567;
        double term2 = 36000.76983 * T;
        double term3 = 0.0003032 * Math.pow(T, 2);
        double L0 = term1 + term2 + term3;
        return new Angle(L0).unwound();
    }

    /**
     * The geometric mean longitude of the moon. (p. 144)
     */
    public static Angle meanLunarLongitude(double T) {
        double term1 = 218.3165;
        double term2 = 481267.8813 * T;
        double Lp = term1 + term2;
        return new Angle(Lp).unwound();
    }

    /**
     * Longitude of the ascending node of the moon's mean orbit on the ecliptic. (p. 144)
     */
    public static Angle ascendingLunarNodeLongitude(double T) {
        double term1 = 125.04452;
        double term2 = 1934.136261 * T;
        double term3 = 0.0020708 * Math.pow(T, 2);
        double term4 = Math.pow(T, 3) / 450000;
        double omega = term1 - term2 + term3 + term4;
        return new Angle(omega).unwound();
    }

    /**
     * The mean anomaly of the sun. (p. 163)
     */
    public static Angle meanSolarAnomaly(double T) {
        double term1 = 357.52911;
        double term2 = 35999.05029 * T;
        double term3 = 0.0001537 * Math.pow(T, 2);
        double M = term1 + term2 - term3;
        return new Angle(M).unwound();
    }

    /**
     * The sun's equation of the center. Not unwound, as it is a small signed correction. (p. 164)
     */
    public static Angle solarEquationOfTheCenter(double T, Angle meanAnomaly) {
        double Mrad = meanAnomaly.radians();
        double term1 = (1.914602 - (0.004817 * T) - (0.000014 * Math.pow(T, 2))) * Math.sin(Mrad);
        double term2 = (0.019993 - (0.000101 * T)) * Math.sin(2 * Mrad);
        double term3 = 0.000289 * Math.sin(3 * Mrad);
        return new Angle(term1 + term2 + term3);
    }

    /**
     * The apparent longitude of the sun, referred to the true equinox of the date. (p. 164)
     */
    public static Angle apparentSolarLongitude(double T, Angle meanLongitude) {
        Angle longitude = meanLongitude.plus(solarEquationOfTheCenter(T, meanSolarAnomaly(T)));
        Angle omega = new Angle(125.04 - (1934.136 * T));
        Angle lambda = new Angle(longitude.degrees() - 0.00569 - (0.00478 * Math.sin(omega.radians())));
        return lambda.unwound();
    }

    /**
     * The mean obliquity of the ecliptic, formula adopted by the International Astronomical Union. (p. 147)
     */
    public static Angle meanObliquityOfTheEcliptic(double T) {
        double term1 = 23.439291;
        double term2 = 0.013004167 * T;
        double term3 = 0.0000001639 * Math.pow(T, 2);
        double term4 = 0.0000005036 * Math.pow(T, 3);
        return new Angle(term1 - term2 - term3 + term4);
    }

    /**
     * The mean obliquity of the ecliptic, corrected for calculating the apparent position of the sun. (p. 165)
     */
    public static Angle apparentObliquityOfTheEcliptic(double T, Angle meanObliquity) {
        double O = 125.04 - (1934.136 * T);
        return new Angle(meanObliquity.degrees() + (0.00256 * Math.cos(new Angle(O).radians())));
    }

    /**
     * Mean sidereal time, the hour angle of the vernal equinox. (p. 165)
     */
    public static Angle meanSiderealTime(double T) {
        double JD = (T * DAYS_PER_JULIAN_CENTURY) + J2000;
        double term1 = 280.46061837;
        double term2 = 360.98564736629 * (JD - J2000);
        double term3 = 0.000387933 * Math.pow(T, 2);
        double term4 = Math.pow(T, 3) / 38710000;
        double theta = term1 + term2 + term3 - term4;
        return new Angle(theta).unwound();
    }

    /**
     * Nutation in longitude in degrees. (p. 144)
     */
    public static double nutationInLongitude(Angle solarLongitude, Angle lunarLongitude, Angle ascendingNode) {
        double term1 = (-17.2 / 3600) * Math.sin(ascendingNode.radians());
        double term2 = (1.32 / 3600) * Math.sin(2 * solarLongitude.radians());
        double term3 = (0.23 / 3600) * Math.sin(2 * lunarLongitude.radians());
        double term4 = (0.21 / 3600) * Math.sin(2 * ascendingNode.radians());
        return term1 - term2 - term3 + term4;
    }

    /**
     * Nutation in obliquity in degrees. (p. 144)
     */
    public static double nutationInObliquity(Angle solarLongitude, Angle lunarLongitude, Angle ascendingNode) {
        double term1 = (9.2 / 3600) * Math.cos(ascendingNode.radians());
        double term2 = (0.57 / 3600) * Math.cos(2 * solarLongitude.radians());
        double term3 = (0.10 / 3600) * Math.cos(2 * lunarLongitude.radians());
        double term4 = (0.09 / 3600) * Math.cos(2 * ascendingNode.radians());
        return term1 + term2 + term3 - term4;
    }

    /**
     * (p. 93)
     */
    public static Angle altitudeOfCelestialBody(Angle observerLatitude, Angle declination, Angle localHourAngle) {
        double term1 = Math.sin(observerLatitude.radians()) * Math.sin(declination.radians());
        double term2 = Math.cos(observerLatitude.radians()) * Math.cos(declination.radians()) * Math.cos(localHourAngle.radians());
        return Angle.ofRadians(Math.asin(term1 + term2));
    }

    /**
     * The fraction of the day in [0, 1) at which the sun's right ascension equals the local sidereal time. (p. 102)
     */
    public static double approximateTransit(Angle longitude, Angle siderealTime, Angle rightAscension) {
        Angle Lw = longitude.times(-1);
        return MathUtil.normalizeToScale(rightAscension.plus(Lw).minus(siderealTime).dividedBy(360).degrees(), 1);
    }

    /**
     * The time at which the sun is at its highest point in the sky, in hours of the day (universal time). (p. 102)
     */
    public static double correctedTransit(double m0, Angle longitude, Angle siderealTime,
                                          Angle rightAscension, Angle previousRightAscension, Angle nextRightAscension) {
        Angle Lw = longitude.times(-1);
        Angle theta = new Angle(siderealTime.degrees() + (SIDEREAL_DEGREES_PER_DAY * m0)).unwound();
        Angle alpha = interpolateAngles(rightAscension, previousRightAscension, nextRightAscension, m0).unwound();
        Angle H = theta.minus(Lw).minus(alpha).quadrantShifted();
        Angle deltaM = H.dividedBy(-360);
        return (m0 + deltaM.degrees()) * 24;
    }

    /**
     * The time at which the sun crosses the given altitude before or after transit, in hours of the day (universal time).
     * A single correction step is applied. The result is not finite if the sun never reaches the altitude. (p. 102)
     */
    public static double correctedHourAngle(double m0, Angle altitude, Coordinates coordinates, boolean afterTransit,
                                            Angle siderealTime,
                                            Angle rightAscension, Angle previousRightAscension, Angle nextRightAscension,
                                            Angle declination, Angle previousDeclination, Angle nextDeclination) {
        Angle Lw = coordinates.longitudeAngle().times(-1);
        Angle latitude = coordinates.latitudeAngle();
        double term1 = Math.sin(altitude.radians()) - (Math.sin(latitude.radians()) * Math.sin(declination.radians()));
        double term2 = Math.cos(latitude.radians()) * Math.cos(declination.radians());
        Angle H0 = Angle.ofRadians(Math.acos(term1 / term2));
        double m = afterTransit ? m0 + (H0.degrees() / 360) : m0 - (H0.degrees() / 360);
        Angle theta = new Angle(siderealTime.degrees() + (SIDEREAL_DEGREES_PER_DAY * m)).unwound();
        Angle alpha = interpolateAngles(rightAscension, previousRightAscension, nextRightAscension, m).unwound();
        Angle delta = new Angle(interpolate(declination.degrees(), previousDeclination.degrees(), nextDeclination.degrees(), m));
        Angle H = theta.minus(Lw).minus(alpha);
        Angle h = altitudeOfCelestialBody(latitude, delta, H);
        double term3 = h.minus(altitude).degrees();
        double term4 = 360 * Math.cos(delta.radians()) * Math.cos(latitude.radians()) * Math.sin(H.radians());
        double deltaM = term3 / term4;
        return (m + deltaM) * 24;
    }

    /**
     * Interpolation of a value given equidistant previous and next values and a factor equal to the fraction of the
     * interpolated point's time over the time between values. (p. 24)
     */
    public static double interpolate(double value, double previousValue, double nextValue, double factor) {
        double a = value - previousValue;
        double b = nextValue - value;
        double c = b - a;
        return value + ((factor / 2) * (a + b + (factor * c)));
    }

    /**
     * Same as {@link #interpolate(double, double, double, double)}, with the differences unwound so values
     * straddling 0°/360° do not jump.
     */
    public static Angle interpolateAngles(Angle value, Angle previousValue, Angle nextValue, double factor) {
        Angle a = value.minus(previousValue).unwound();
        Angle b = nextValue.minus(value).unwound();
        Angle c = b.minus(a);
        return new Angle(value.degrees() + ((factor / 2) * (a.degrees() + b.degrees() + (factor * c.degrees()))));
    }

    /**
     * The Julian Day for the given Gregorian date. Hours may exceed 24 and roll over into the following days. (p. 60)
     */
    public static double julianDay(int year, int month, int day, double hours) {
        // the int casts truncate on purpose
        int Y = month > 2 ? year : year - 1;
        int M = month > 2 ? month : month + 12;
        double D = day + (hours / 24);

        int A = Y / 100;
        int B = 2 - A + (A / 4);

        int i0 = (int) (365.25 * (Y + 4716));
        int i1 = (int) (30.6001 * (M + 1));
        return i0 + i1 + D + B - 1524.5;
    }

    public static double julianDay(int year, int month, int day) {
        return julianDay(year, month, day, 0);
    }

    public static double julianDay(LocalDate date) {
        return julianDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Uses the hour and minute of the given date time, seconds are ignored.
     */
    public static double julianDay(LocalDateTime dateTime) {
        double hours = dateTime.getHour() + (dateTime.getMinute() / 60.0);
        return julianDay(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(), hours);
    }

    /**
     * Julian centuries since the epoch J2000.0. (p. 163)
     */
    public static double julianCentury(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_JULIAN_CENTURY;
    }
}
