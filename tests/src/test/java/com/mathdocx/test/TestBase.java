package com.mathdocx.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for mathdocx tests.
 *
 * <p>Logs test boundaries and offers {@link #logStep(String)} and
 * {@link #logData(String, Object)} for Given/When/Then style narration.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private long startNanos;

    @BeforeEach
    void logTestStart(TestInfo testInfo) {
        startNanos = System.nanoTime();
        logger.debug("Starting test: {}", testInfo.getDisplayName());
    }

    @AfterEach
    void logTestEnd(TestInfo testInfo) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("Finished test: {} ({} ms)", testInfo.getDisplayName(), elapsedMs);
    }

    /**
     * Logs a test step.
     *
     * @param step description of the step
     */
    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    /**
     * Logs a named value produced during the test.
     *
     * @param label what the value is
     * @param value the value
     */
    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }
}
