package com.acme.dcm.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Injects the current thread id into MDC and fills in a placeholder correlation id for log lines
 * written outside a command, so the pattern columns stay aligned.
 */
public class LogContextTurboFilter extends TurboFilter {
    static final String THREAD_ID_KEY = "threadId";
    static final String CORRELATION_ID_KEY = "correlationId";
    static final String NO_CORRELATION = "-";

    @Override
    public FilterReply decide(
        Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
        MDC.put(THREAD_ID_KEY, String.valueOf(Thread.currentThread().getId()));
        if (MDC.get(CORRELATION_ID_KEY) == null) {
            MDC.put(CORRELATION_ID_KEY, NO_CORRELATION);
        }
        return FilterReply.NEUTRAL;
    }
}
