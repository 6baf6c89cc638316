package at.sv.sunlight.time;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Solar events for the calendar date of the given date time, returned in the zone of that date time.
 * An empty result means the event does not happen on that date at the configured location.
 */
public interface SunTimesProvider {

    Optional<ZonedDateTime> getNoon(ZonedDateTime dateTime);

    /**
     * @param afterTransit {@code true} for the evening crossing of the twilight altitude, {@code false} for the morning
     */
    Optional<ZonedDateTime> getTime(ZonedDateTime dateTime, Twilight twilight, boolean afterTransit);

    default Optional<ZonedDateTime> getTime(ZonedDateTime dateTime, SunEvent event) {
        if (event == SunEvent.NOON) {
            return getNoon(dateTime);
        }
        return getTime(dateTime, event.getTwilight(), event.isAfterTransit());
    }

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }

    default void clearCache() {
    }
}
