/**
 * Decision stage: sensitivity threshold mapping and manual overrides.
 *
 * @since 0.1.0
 */
package io.netguard.application.decision;
