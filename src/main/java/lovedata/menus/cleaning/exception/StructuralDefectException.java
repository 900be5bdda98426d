package lovedata.menus.cleaning.exception;

/**
 * Fatal problem with the shape of the input or the static configuration
 * (missing source column, duplicate id, unreadable mapping table).
 *
 * Raised before any record is transformed; content-level defects never
 * produce this exception.
 */
public class StructuralDefectException extends RuntimeException {

    public StructuralDefectException(String message) {
        super(message);
    }

    public StructuralDefectException(String message, Throwable cause) {
        super(message, cause);
    }
}
