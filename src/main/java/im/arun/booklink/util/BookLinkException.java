package im.arun.booklink.util;

/**
 * Failure that aborts processing of a whole document, such as an unreadable input tree.
 * Authoring problems inside a document are reported through {@link Diagnostics} instead.
 */
public class BookLinkException extends RuntimeException {

    public BookLinkException(String message) {
        super(message);
    }

    public BookLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
