/**
 * File-backed adapters for the audit log, block list, model snapshot and settings, plus the bounded in-memory
 * transaction store.
 * <p><strong>Role:</strong> Storage adapters behind the application ports.</p>
 * <p><strong>Concurrency:</strong> Every adapter synchronizes on its instance; writers are single-threaded per file.</p>
 * <p><strong>Durability:</strong> Whole-document files are replaced through a sibling temp file and an atomic move;
 * the audit log appends and flushes one JSON line per record.</p>
 * <p><strong>Metrics:</strong> Emits {@code audit.*} counters.</p>
 * <p><strong>Security:</strong> Captured bodies are only held in memory and expire with the retention window.</p>
 */
package io.netguard.infrastructure.persistence;
