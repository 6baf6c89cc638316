package at.sv.sunlight.time;

public final class InvalidStartTimeExpression extends RuntimeException {
    public InvalidStartTimeExpression(String message) {
        super(message);
    }
}
