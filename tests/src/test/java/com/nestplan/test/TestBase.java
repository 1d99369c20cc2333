package com.nestplan.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for tests: logs test boundaries and offers setup hooks.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @BeforeEach
    void setUp(TestInfo testInfo) {
        logger.debug("Starting {}", testInfo.getDisplayName());
        doSetUp();
    }

    @AfterEach
    void tearDown(TestInfo testInfo) {
        doTearDown();
        logger.debug("Finished {}", testInfo.getDisplayName());
    }

    /** Override for per-test setup. */
    protected void doSetUp() {
    }

    /** Override for per-test cleanup. */
    protected void doTearDown() {
    }
}
