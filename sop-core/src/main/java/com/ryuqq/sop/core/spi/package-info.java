/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.spi.WorkflowStore} - Durable instance, step and message records</li>
 *   <li>{@link com.ryuqq.sop.core.spi.MessageBus} - Store-then-deliver role messaging</li>
 *   <li>{@link com.ryuqq.sop.core.spi.SopDefinitionSource} - SOP definition lookup</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code sop-adapter-inmemory} - In-memory store, bus and definition registry</li>
 *   <li>{@code sop-adapter-json} - Jackson-based definition loading</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.spi;
