package im.arun.tiki.exception;

/**
 * Rendering or writing an export failed. Only the export operation is affected.
 */
public class TikiExportException extends TikiException {

    public TikiExportException(String message) {
        super(message);
    }

    public TikiExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
