package at.sv.sunlight;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Turns hour-of-day values relative to midnight UTC back into instants.
 */
public final class UtcTimes {

    public static final ZoneId UTC = ZoneOffset.UTC;

    private UtcTimes() {
    }

    /**
     * Hours, minutes and seconds are each truncated. Values below zero or above 24 roll over into the neighbouring
     * days.
     *
     * @return the instant, or empty if {@code hours} is not a finite number
     */
    public static Optional<ZonedDateTime> atHourOfDay(LocalDate date, double hours) {
        if (!Double.isFinite(hours)) {
            return Optional.empty();
        }
        double wholeHours = Math.floor(hours);
        double minutes = Math.floor((hours - wholeHours) * 60);
        double seconds = Math.floor((hours - (wholeHours + minutes / 60)) * 60 * 60);
        return Optional.of(date.atStartOfDay(UTC)
                               .plusHours((long) wholeHours)
                               .plusMinutes((long) minutes)
                               .plusSeconds((long) seconds));
    }
}
