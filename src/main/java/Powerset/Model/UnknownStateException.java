package Powerset.Model;

public class UnknownStateException extends AutomatonException {
    private final String state;

    public UnknownStateException(String state) {
        super("Unknown state: " + state);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
