/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.mathwords.config.logging.MdcFilter} injects {@code requestId} into
 * the Log4j2 ThreadContext for every HTTP request. The batch executor copies the context into
 * its worker threads, so log lines from a parallel batch carry the id of the request that
 * started it.
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-19 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.mathwords.config.ThreadPoolConfig
 */
package com.phillippitts.mathwords.config.logging;
