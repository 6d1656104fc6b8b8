package reaper;

/**
 * Unchecked exception for failures the reaper cannot absorb locally, such as a
 * claim that could not be completed or a catalog delete that did not go through.
 */
public class ReaperException extends RuntimeException {

    public ReaperException(String message) {
        super(message);
    }

    public ReaperException(String message, Throwable cause) {
        super(message, cause);
    }
}
