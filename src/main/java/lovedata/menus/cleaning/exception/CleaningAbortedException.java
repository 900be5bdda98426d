package lovedata.menus.cleaning.exception;

/**
 * Thrown when a worker shard fails mid-run. The whole run is abandoned;
 * no partial record set is ever emitted.
 */
public class CleaningAbortedException extends RuntimeException {

    public CleaningAbortedException(String message) {
        super(message);
    }

    public CleaningAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
