/**
 * Logging helpers: runtime verbosity control and truncation of page text before it reaches a log line.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 */
package io.netguard.logging;
