/**
 * CLI entry points: the {@code netguard} dispatcher and its {@code monitor}, {@code classify}, {@code sites},
 * {@code detections} and {@code cleanup} commands.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, and calls the
 * monitoring service.</p>
 * <p><strong>Concurrency:</strong> Commands run on the main thread; {@code monitor} blocks until interrupted.</p>
 * <p><strong>Security:</strong> Arguments are validated before use; hosts-file access errors map to a distinct exit code.</p>
 */
package io.netguard.api;
