package Powerset.Model;

/**
 * Root of the failures raised while building or determinizing an automaton.
 * All of them are detected eagerly; none leave a partially built result behind.
 */
public abstract class AutomatonException extends RuntimeException {

    protected AutomatonException(String message) {
        super(message);
    }
}
