package im.arun.booklink.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingPassObserver implements PassObserver {
    private static final Logger logger = LoggerFactory.getLogger(LoggingPassObserver.class);

    @Override
    public void passStarted(String documentName, TreePass pass) {
        logger.debug("{}: starting pass '{}'", documentName, pass.name());
    }

    @Override
    public void passFinished(String documentName, TreePass pass, long elapsedMillis) {
        logger.info("{}: pass '{}' finished in {} ms", documentName, pass.name(), elapsedMillis);
    }
}
