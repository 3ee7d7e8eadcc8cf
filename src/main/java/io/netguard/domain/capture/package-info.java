/**
 * Captured HTTP exchange types produced by the intercepting proxy in dev mode.
 *
 * @since 0.1.0
 */
package io.netguard.domain.capture;
