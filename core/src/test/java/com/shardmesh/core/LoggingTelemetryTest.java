package com.shardmesh.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingTelemetryTest {
    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LoggingTelemetry.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void eventsAreLoggedAtInfo() {
        new LoggingTelemetry().trackEvent("conversionSchema.created", Map.of("schemaId", "s-1"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertEquals("event conversionSchema.created {schemaId=s-1}", event.getFormattedMessage());
    }

    @Test
    void exceptionsAreLoggedAtWarnWithTheirCause() {
        IllegalStateException failure = new IllegalStateException("store offline");

        new LoggingTelemetry().trackException(failure, Map.of("operation", "integration.shard.create.record"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().startsWith("exception integration.shard.create.record"));
        assertTrue(event.getFormattedMessage().endsWith("store offline"));
        assertEquals("store offline", event.getThrowableProxy().getMessage());
    }
}
