package com.docprinter.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LoggerUtilTest {

    @AfterEach
    void restoreLevel() {
        LoggerUtil.setConsoleLevel(Level.INFO);
    }

    @Test
    void handsOutLoggersNamedAfterTheClass() {
        Logger logger = LoggerUtil.getLogger(LoggerUtilTest.class);

        assertThat(logger.getName()).isEqualTo("com.docprinter.util.LoggerUtilTest");
    }

    @Test
    void consoleLevelAppliesToRootLogger() {
        LoggerUtil.setConsoleLevel(Level.FINE);

        assertThat(Logger.getLogger("").getLevel()).isEqualTo(Level.FINE);
        assertThat(LoggerUtil.getLogger(LoggerUtilTest.class).isLoggable(Level.FINE)).isTrue();
    }
}
