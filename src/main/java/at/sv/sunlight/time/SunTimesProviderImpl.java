package at.sv.sunlight.time;

import at.sv.sunlight.Coordinates;
import at.sv.sunlight.SolarDate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String ABSENT_TIME = "--:--:--";
    private static final int MAX_CACHED_DATES = 32;

    private final Coordinates coordinates;
    private final Cache<LocalDate, Optional<SolarDate>> cache;

    public SunTimesProviderImpl(Coordinates coordinates) {
        this.coordinates = coordinates;
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DATES)
                        .build();
    }

    public SunTimesProviderImpl(double lat, double lng) {
        this(Coordinates.of(lat, lng));
    }

    @Override
    public Optional<ZonedDateTime> getNoon(ZonedDateTime dateTime) {
        return solarDateFor(dateTime).map(SolarDate::getSolarNoon).map(time -> inZoneOf(time, dateTime));
    }

    @Override
    public Optional<ZonedDateTime> getTime(ZonedDateTime dateTime, Twilight twilight, boolean afterTransit) {
        return solarDateFor(dateTime).flatMap(solarDate -> crossing(solarDate, twilight, afterTransit))
                                     .map(time -> inZoneOf(time, dateTime));
    }

    private static Optional<ZonedDateTime> crossing(SolarDate solarDate, Twilight twilight, boolean afterTransit) {
        if (twilight == Twilight.VISUAL) {
            return Optional.of(afterTransit ? solarDate.getSunset() : solarDate.getSunrise());
        }
        return solarDate.timeForSolarAngle(twilight.getAltitude(), afterTransit);
    }

    private Optional<SolarDate> solarDateFor(ZonedDateTime dateTime) {
        return cache.get(dateTime.toLocalDate(), this::computeSolarDate);
    }

    private Optional<SolarDate> computeSolarDate(LocalDate date) {
        Optional<SolarDate> solarDate = SolarDate.of(coordinates, date);
        log.trace("Computed solar date for {} at {}: {}", date, coordinates, solarDate);
        return solarDate;
    }

    private static ZonedDateTime inZoneOf(ZonedDateTime time, ZonedDateTime reference) {
        return time.withZoneSameInstant(reference.getZone());
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return Arrays.stream(SunEvent.values())
                     .map(event -> event.getKeyword() + ": " + format(getTime(dateTime, event)))
                     .collect(Collectors.joining("\n"));
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    private String format(Optional<ZonedDateTime> time) {
        return time.map(TIME_FORMATTER::format).orElse(ABSENT_TIME);
    }
}
