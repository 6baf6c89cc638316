package at.sv.sunlight;

public final class InvalidCoordinates extends RuntimeException {
    public InvalidCoordinates(String message) {
        super(message);
    }
}
