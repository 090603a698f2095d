package im.arun.tiki.exception;

import lombok.Getter;

/**
 * The source is missing, unreadable, or not valid UTF-8. Raised before parsing begins.
 */
@Getter
public class TikiFileAccessException extends TikiException {

    private final String source;

    public TikiFileAccessException(String message, String source, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }
}
