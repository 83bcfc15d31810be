/**
 * In-process MessageBus adapter: store-then-deliver messaging between role actors.
 *
 * @see com.ryuqq.sop.core.spi.MessageBus
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.sop.adapter.inmemory.bus;
