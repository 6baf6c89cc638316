package at.sv.sunlight;

import lombok.Getter;

/**
 * Apparent equatorial position of the sun and apparent sidereal time at Greenwich for a single Julian Day.
 */
@Getter
public final class SolarPosition {

    /**
     * The angle between the rays of the sun and the plane of the earth's equator.
     */
    private final Angle declination;

    /**
     * The angular distance on the celestial equator from the vernal equinox to the hour circle, in [0, 360).
     */
    private final Angle rightAscension;

    /**
     * The hour angle of the true vernal equinox, in [0, 360).
     */
    private final Angle apparentSiderealTime;

    public SolarPosition(double julianDay) {
        double T = Astronomical.julianCentury(julianDay);
        Angle L0 = Astronomical.meanSolarLongitude(T);
        Angle Lp = Astronomical.meanLunarLongitude(T);
        Angle omega = Astronomical.ascendingLunarNodeLongitude(T);
        double lambda = Astronomical.apparentSolarLongitude(T, L0).radians();

        Angle theta0 = Astronomical.meanSiderealTime(T);
        double deltaPsi = Astronomical.nutationInLongitude(L0, Lp, omega);
        double deltaEpsilon = Astronomical.nutationInObliquity(L0, Lp, omega);

        Angle epsilon0 = Astronomical.meanObliquityOfTheEcliptic(T);
        double epsilonApparent = Astronomical.apparentObliquityOfTheEcliptic(T, epsilon0).radians();

        // p. 165
        declination = Angle.ofRadians(Math.asin(Math.sin(epsilonApparent) * Math.sin(lambda)));
        rightAscension = Angle.ofRadians(Math.atan2(Math.cos(epsilonApparent) * Math.sin(lambda), Math.cos(lambda))).unwound();

        // p. 88
        double correction = ((deltaPsi * 3600) * Math.cos(new Angle(epsilon0.degrees() + deltaEpsilon).radians())) / 3600;
        apparentSiderealTime = new Angle(theta0.degrees() + correction).unwound();
    }

    @Override
    public String toString() {
        return "SolarPosition{" +
               "declination=" + declination +
               ", rightAscension=" + rightAscension +
               ", apparentSiderealTime=" + apparentSiderealTime +
               '}';
    }
}
