/**
 * In-memory WorkflowStore adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.sop.core.spi.WorkflowStore} SPI for tests and single-process use.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> Uses {@link java.util.concurrent.ConcurrentHashMap}
 *       and {@link java.util.concurrent.CopyOnWriteArrayList} for thread-safe operations</li>
 *   <li><strong>Ordering:</strong> Step records are listed per instance in insertion order</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.sop.core.spi.WorkflowStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.sop.adapter.inmemory.store;
