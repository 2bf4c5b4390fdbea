package im.arun.booklink.pipeline;

/**
 * Progress callbacks invoked by {@link DocumentPipeline} around every pass.
 */
public interface PassObserver {

    PassObserver NONE = new PassObserver() {};

    default void passStarted(String documentName, TreePass pass) {
    }

    default void passFinished(String documentName, TreePass pass, long elapsedMillis) {
    }
}
