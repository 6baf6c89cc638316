package at.sv.sunlight.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;

class SunTimesProviderTest {

    private ZonedDateTime dateTime;
    private SunTimesProviderImpl provider;

    private void assertTime(Optional<ZonedDateTime> time, int hour, int minute, int second) {
        assertThat("Time missing", time.isPresent(), is(true));
        assertThat("Time differs", time.get().toLocalTime(), is(LocalTime.of(hour, minute, second)));
        assertThat("Zone differs", time.get().getZone(), is(dateTime.getZone()));
    }

    @BeforeEach
    void setUp() {
        ZoneId zone = ZoneId.of("America/New_York");
        dateTime = ZonedDateTime.of(2015, 7, 12, 0, 0, 0, 0, zone);
        provider = new SunTimesProviderImpl(35 + 47 / 60.0, -78 - 39 / 60.0);
    }

    @Test
    void returnsCorrectTimes_inZoneOfGivenDateTime() {
        assertTime(provider.getTime(dateTime, SunEvent.CIVIL_DAWN), 5, 38, 21);
        assertTime(provider.getTime(dateTime, SunEvent.SUNRISE), 6, 7, 54);
        assertTime(provider.getTime(dateTime, SunEvent.NOON), 13, 20, 14);
        assertTime(provider.getTime(dateTime, SunEvent.SUNSET), 20, 32, 16);
        assertTime(provider.getTime(dateTime, SunEvent.CIVIL_DUSK), 21, 1, 45);
    }

    @Test
    void returnsEvents_inChronologicalOrder() {
        List<Optional<ZonedDateTime>> events = List.of(
                provider.getTime(dateTime, SunEvent.ASTRONOMICAL_DAWN),
                provider.getTime(dateTime, SunEvent.NAUTICAL_DAWN),
                provider.getTime(dateTime, SunEvent.CIVIL_DAWN),
                provider.getTime(dateTime, SunEvent.SUNRISE),
                provider.getTime(dateTime, SunEvent.NOON),
                provider.getTime(dateTime, SunEvent.GOLDEN_HOUR),
                provider.getTime(dateTime, SunEvent.SUNSET),
                provider.getTime(dateTime, SunEvent.BLUE_HOUR),
                provider.getTime(dateTime, SunEvent.CIVIL_DUSK),
                provider.getTime(dateTime, SunEvent.NIGHT_HOUR),
                provider.getTime(dateTime, SunEvent.NAUTICAL_DUSK),
                provider.getTime(dateTime, SunEvent.ASTRONOMICAL_DUSK));

        for (int i = 1; i < events.size(); i++) {
            ZonedDateTime previous = events.get(i - 1).orElseThrow();
            ZonedDateTime current = events.get(i).orElseThrow();
            assertThat(previous + " is not before " + current, previous.isBefore(current), is(true));
        }
    }

    @Test
    void visualTwilight_isSunriseAndSunset() {
        assertThat(provider.getTime(dateTime, Twilight.VISUAL, false), is(provider.getTime(dateTime, SunEvent.SUNRISE)));
        assertThat(provider.getTime(dateTime, Twilight.VISUAL, true), is(provider.getTime(dateTime, SunEvent.SUNSET)));
        assertThat(provider.getTime(dateTime, Twilight.CIVIL, true), is(provider.getTime(dateTime, SunEvent.CIVIL_DUSK)));
    }

    @Test
    void returnsCorrectTime_doesNotDependOnTimeOfDay() {
        assertTime(provider.getTime(dateTime, SunEvent.SUNSET), 20, 32, 16);
        assertTime(provider.getTime(dateTime.withHour(20).withMinute(32).withSecond(30), SunEvent.SUNSET), 20, 32, 16);
    }

    @Test
    void sunEvents_resolveThroughTwilightAltitudes() {
        for (SunEvent event : SunEvent.values()) {
            if (event == SunEvent.NOON) {
                assertThat(provider.getTime(dateTime, event), is(provider.getNoon(dateTime)));
            } else {
                assertThat(event.getKeyword(), provider.getTime(dateTime, event),
                        is(provider.getTime(dateTime, event.getTwilight(), event.isAfterTransit())));
            }
        }
    }

    @Test
    void returnsSameTimes_afterCacheCleared() {
        Optional<ZonedDateTime> sunrise = provider.getTime(dateTime, SunEvent.SUNRISE);

        provider.clearCache();

        assertThat(provider.getTime(dateTime, SunEvent.SUNRISE), is(sunrise));
    }

    @Test
    void sunNeverSetsAtLocation_returnsEmpty() {
        provider = new SunTimesProviderImpl(78.614803, 15.895517); // Somewhere in Svalbard (Norway)
        ZonedDateTime summer = ZonedDateTime.of(2021, 6, 21, 0, 0, 0, 0, ZoneId.of("Europe/Oslo"));

        assertThat(provider.getTime(summer, SunEvent.SUNRISE), is(Optional.empty()));
        assertThat(provider.getTime(summer, SunEvent.NOON), is(Optional.empty()));
        assertThat(provider.getTime(summer, SunEvent.SUNSET), is(Optional.empty()));
        assertThat(provider.getTime(summer, SunEvent.CIVIL_DUSK), is(Optional.empty()));
    }

    @Test
    void debugString_listsAllEvents_absentAsPlaceholder() {
        String debugString = provider.toDebugString(dateTime);

        assertThat(debugString, containsString("civil_dawn: 05:38:21"));
        assertThat(debugString, containsString("sunrise: 06:07:54"));
        assertThat(debugString, containsString("noon: 13:20:14"));
        assertThat(debugString, containsString("sunset: 20:32:16"));
        assertThat(debugString, containsString("civil_dusk: 21:01:45"));

        provider = new SunTimesProviderImpl(78.614803, 15.895517);
        String polarDebugString = provider.toDebugString(dateTime);

        assertThat(polarDebugString, containsString("sunrise: --:--:--"));
        assertThat(polarDebugString, containsString("astronomical_dusk: --:--:--"));
        assertThat(debugString.lines().count(), is((long) SunEvent.values().length));
        assertThat(debugString, startsWith("astronomical_dawn: "));
    }
}
