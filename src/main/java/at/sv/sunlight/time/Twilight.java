package at.sv.sunlight.time;

import at.sv.sunlight.Angle;
import at.sv.sunlight.SolarDate;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Named altitudes of the sun's center.
 */
@Getter
@RequiredArgsConstructor
public enum Twilight {
    /**
     * Sunrise and sunset.
     */
    VISUAL(SolarDate.SOLAR_ALTITUDE),
    CIVIL(new Angle(-6)),
    NAUTICAL(new Angle(-12)),
    ASTRONOMICAL(new Angle(-18)),
    GOLDEN_HOUR(new Angle(6)),
    BLUE_HOUR(new Angle(-4)),
    NIGHT_HOUR(new Angle(-8));

    private final Angle altitude;
}
