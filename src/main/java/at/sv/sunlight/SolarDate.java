package at.sv.sunlight;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Solar noon, sunrise and sunset for one calendar day (UTC) at a given location.
 * <p>
 * Built from the solar positions of the previous, the current and the next day, which are kept to answer
 * {@link #timeForSolarAngle(Angle, boolean)} queries without recomputing them.
 */
@Slf4j
@Getter
public final class SolarDate {

    /**
     * Standard altitude of the sun's center at sunrise and sunset, accounting for refraction and the solar radius.
     */
    public static final Angle SOLAR_ALTITUDE = new Angle(-50.0 / 60.0);

    private final LocalDate date;
    private final Coordinates coordinates;
    private final SolarPosition solarPosition;
    @Getter(AccessLevel.NONE)
    private final SolarPosition previousSolarPosition;
    @Getter(AccessLevel.NONE)
    private final SolarPosition nextSolarPosition;
    @Getter(AccessLevel.NONE)
    private final double approximateTransit;

    private final ZonedDateTime solarNoon;
    private final ZonedDateTime sunrise;
    private final ZonedDateTime sunset;

    private SolarDate(LocalDate date, Coordinates coordinates, SolarPosition previousSolarPosition,
                      SolarPosition solarPosition, SolarPosition nextSolarPosition, double approximateTransit,
                      ZonedDateTime solarNoon, ZonedDateTime sunrise, ZonedDateTime sunset) {
        this.date = date;
        this.coordinates = coordinates;
        this.previousSolarPosition = previousSolarPosition;
        this.solarPosition = solarPosition;
        this.nextSolarPosition = nextSolarPosition;
        this.approximateTransit = approximateTransit;
        this.solarNoon = solarNoon;
        this.sunrise = sunrise;
        this.sunset = sunset;
    }

    /**
     * @return the solar times at the given day, or empty if the sun does not transit, rise or set on that day at the
     * given location (e.g. polar day or night)
     */
    public static Optional<SolarDate> of(Coordinates coordinates, LocalDate date) {
        double julianDay = Astronomical.julianDay(date);

        SolarPosition previous = new SolarPosition(julianDay - 1);
        SolarPosition solar = new SolarPosition(julianDay);
        SolarPosition next = new SolarPosition(julianDay + 1);
        double m0 = Astronomical.approximateTransit(coordinates.longitudeAngle(), solar.getApparentSiderealTime(),
                solar.getRightAscension());

        double transitHours = Astronomical.correctedTransit(m0, coordinates.longitudeAngle(),
                solar.getApparentSiderealTime(), solar.getRightAscension(), previous.getRightAscension(),
                next.getRightAscension());
        double sunriseHours = correctedHourAngle(coordinates, previous, solar, next, m0, SOLAR_ALTITUDE, false);
        double sunsetHours = correctedHourAngle(coordinates, previous, solar, next, m0, SOLAR_ALTITUDE, true);

        Optional<ZonedDateTime> solarNoon = UtcTimes.atHourOfDay(date, transitHours);
        Optional<ZonedDateTime> sunrise = UtcTimes.atHourOfDay(date, sunriseHours);
        Optional<ZonedDateTime> sunset = UtcTimes.atHourOfDay(date, sunsetHours);
        if (solarNoon.isEmpty() || sunrise.isEmpty() || sunset.isEmpty()) {
            log.debug("No solar times for {} at {}: transit={}, sunrise={}, sunset={}", date, coordinates,
                    transitHours, sunriseHours, sunsetHours);
            return Optional.empty();
        }
        return Optional.of(new SolarDate(date, coordinates, previous, solar, next, m0,
                solarNoon.get(), sunrise.get(), sunset.get()));
    }

    /**
     * The solar times of the current date in UTC.
     */
    public static Optional<SolarDate> of(Coordinates coordinates) {
        return of(coordinates, LocalDate.now(UtcTimes.UTC));
    }

    /**
     * Uses only the calendar date of the given date time, the time of day is ignored.
     */
    public static Optional<SolarDate> of(Coordinates coordinates, ZonedDateTime dateTime) {
        return of(coordinates, dateTime.toLocalDate());
    }

    /**
     * @param angle        the altitude of the sun's center, negative below the horizon
     * @param afterTransit {@code true} for the crossing after solar noon, {@code false} for the one before
     * @return the time the sun reaches the given altitude, or empty if it never does on this day
     */
    public Optional<ZonedDateTime> timeForSolarAngle(Angle angle, boolean afterTransit) {
        return UtcTimes.atHourOfDay(date, correctedHourAngle(coordinates, previousSolarPosition, solarPosition,
                nextSolarPosition, approximateTransit, angle, afterTransit));
    }

    /**
     * Same as {@link #timeForSolarAngle(Angle, boolean)}, as hours relative to midnight UTC of {@link #getDate()}.
     */
    public OptionalDouble hoursForSolarAngle(Angle angle, boolean afterTransit) {
        double hours = correctedHourAngle(coordinates, previousSolarPosition, solarPosition, nextSolarPosition,
                approximateTransit, angle, afterTransit);
        if (!Double.isFinite(hours)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(hours);
    }

    private static double correctedHourAngle(Coordinates coordinates, SolarPosition previous, SolarPosition solar,
                                             SolarPosition next, double m0, Angle angle, boolean afterTransit) {
        return Astronomical.correctedHourAngle(m0, angle, coordinates, afterTransit, solar.getApparentSiderealTime(),
                solar.getRightAscension(), previous.getRightAscension(), next.getRightAscension(),
                solar.getDeclination(), previous.getDeclination(), next.getDeclination());
    }

    @Override
    public String toString() {
        return "SolarDate{" +
               "date=" + date +
               ", coordinates=" + coordinates +
               ", solarNoon=" + solarNoon +
               ", sunrise=" + sunrise +
               ", sunset=" + sunset +
               '}';
    }
}
