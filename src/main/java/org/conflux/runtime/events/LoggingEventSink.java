package org.conflux.runtime.events;

import org.conflux.runtime.spi.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the log at DEBUG and passes it on to a delegate.
 */
public class LoggingEventSink implements IEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingEventSink.class);

    private final IEventSink delegate;

    public LoggingEventSink(IEventSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void publish(EngineEvent event) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} {}", event.type(), event);
        }
        delegate.publish(event);
    }
}
