package com.example.revisiondiff.application;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects the events logged by one class while attached.
 */
final class CapturingAppender extends AbstractAppender implements AutoCloseable {
    private final Logger logger;
    private final List<LogEvent> events = new CopyOnWriteArrayList<>();

    private CapturingAppender(Logger logger) {
        super("capture-" + logger.getName(), null, null, true, Property.EMPTY_ARRAY);
        this.logger = logger;
    }

    static CapturingAppender attachTo(Class<?> type) {
        CapturingAppender appender = new CapturingAppender((Logger) LogManager.getLogger(type));
        appender.start();
        appender.logger.addAppender(appender);
        return appender;
    }

    @Override
    public void append(LogEvent event) {
        events.add(event.toImmutable());
    }

    List<LogEvent> events() {
        return events;
    }

    @Override
    public void close() {
        logger.removeAppender(this);
        stop();
    }
}
