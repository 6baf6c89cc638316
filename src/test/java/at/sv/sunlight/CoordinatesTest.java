package at.sv.sunlight;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinatesTest {

    @Test
    void angles_matchDecimalDegrees() {
        Coordinates coordinates = Coordinates.of(48.2, -16.39);

        assertThat(coordinates.latitudeAngle()).isEqualTo(new Angle(48.2));
        assertThat(coordinates.longitudeAngle()).isEqualTo(new Angle(-16.39));
        assertThat(coordinates).hasToString("48.2, -16.39");
    }

    @Test
    void bounds_areInclusive() {
        assertThat(Coordinates.of(90, 180).latitude()).isEqualTo(90);
        assertThat(Coordinates.of(-90, -180).longitude()).isEqualTo(-180);
    }

    @Test
    void invalidLatitude_exception() {
        assertThatThrownBy(() -> Coordinates.of(90.5, 0)).isInstanceOf(InvalidCoordinates.class)
                                                          .hasMessageContaining("latitude");
        assertThatThrownBy(() -> Coordinates.of(Double.NaN, 0)).isInstanceOf(InvalidCoordinates.class);
    }

    @Test
    void invalidLongitude_exception() {
        assertThatThrownBy(() -> Coordinates.of(0, -180.1)).isInstanceOf(InvalidCoordinates.class)
                                                           .hasMessageContaining("longitude");
        assertThatThrownBy(() -> Coordinates.of(0, Double.POSITIVE_INFINITY)).isInstanceOf(InvalidCoordinates.class);
    }
}
