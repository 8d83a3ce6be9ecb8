package Powerset.Model;

public class InvalidAutomatonException extends AutomatonException {

    public InvalidAutomatonException(String message) {
        super(message);
    }
}
