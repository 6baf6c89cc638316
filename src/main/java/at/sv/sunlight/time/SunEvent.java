package at.sv.sunlight.time;

import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The named solar events of a day, in chronological order for locations where all of them happen.
 * Each event other than {@link #NOON} is the morning or evening crossing of a {@link Twilight} altitude.
 */
@Getter
public enum SunEvent {
    ASTRONOMICAL_DAWN(Twilight.ASTRONOMICAL, false, "astronomical_start"),
    NAUTICAL_DAWN(Twilight.NAUTICAL, false, "nautical_start"),
    CIVIL_DAWN(Twilight.CIVIL, false, "civil_start"),
    SUNRISE(Twilight.VISUAL, false),
    NOON(null, false),
    GOLDEN_HOUR(Twilight.GOLDEN_HOUR, true),
    SUNSET(Twilight.VISUAL, true),
    BLUE_HOUR(Twilight.BLUE_HOUR, true),
    CIVIL_DUSK(Twilight.CIVIL, true, "civil_end"),
    NIGHT_HOUR(Twilight.NIGHT_HOUR, true),
    NAUTICAL_DUSK(Twilight.NAUTICAL, true, "nautical_end"),
    ASTRONOMICAL_DUSK(Twilight.ASTRONOMICAL, true, "astronomical_end");

    private static final Map<String, SunEvent> BY_KEYWORD = new HashMap<>();

    static {
        for (SunEvent event : values()) {
            BY_KEYWORD.put(event.getKeyword(), event);
            event.aliases.forEach(alias -> BY_KEYWORD.put(alias, event));
        }
    }

    /**
     * {@code null} for {@link #NOON}, which is the transit and not an altitude crossing.
     */
    private final Twilight twilight;
    private final boolean afterTransit;
    private final List<String> aliases;

    SunEvent(Twilight twilight, boolean afterTransit, String... aliases) {
        this.twilight = twilight;
        this.afterTransit = afterTransit;
        this.aliases = List.of(aliases);
    }

    public String getKeyword() {
        return name().toLowerCase(Locale.ENGLISH);
    }

    /**
     * Case insensitive lookup by keyword or alias, e.g. {@code civil_dusk} or {@code civil_end}.
     */
    public static Optional<SunEvent> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword.toLowerCase(Locale.ENGLISH)));
    }
}
