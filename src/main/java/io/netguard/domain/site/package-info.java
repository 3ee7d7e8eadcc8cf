/**
 * Block list entries persisted by the blocked-site store and rendered into the hosts file.
 *
 * @since 0.1.0
 */
package io.netguard.domain.site;
