/**
 * Decision value types emitted by the decision engine.
 *
 * @since 0.1.0
 */
package io.netguard.domain.decision;
