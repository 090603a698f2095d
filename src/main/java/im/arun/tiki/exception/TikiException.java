package im.arun.tiki.exception;

/**
 * Base type for all failures raised while reading, parsing or exporting Tiki documents.
 */
public class TikiException extends Exception {

    public TikiException(String message) {
        super(message);
    }

    public TikiException(String message, Throwable cause) {
        super(message, cause);
    }
}
