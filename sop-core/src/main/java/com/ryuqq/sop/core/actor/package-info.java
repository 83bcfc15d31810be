/**
 * Role actor contract and registry.
 *
 * <p>A role actor is the pluggable handler that performs the business work of one role.
 * The engine only talks to actors through {@link com.ryuqq.sop.core.actor.RoleActor}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.actor.RoleActor} - execute action, make decision, receive message</li>
 *   <li>{@link com.ryuqq.sop.core.actor.ActorRegistry} - Thread-safe role to actor mapping</li>
 *   <li>{@link com.ryuqq.sop.core.actor.ActorInput} - Trigger data, prior results and step config</li>
 *   <li>{@link com.ryuqq.sop.core.actor.ActionResult} - Per-action completion flag and output</li>
 *   <li>{@link com.ryuqq.sop.core.actor.Decision} - Decision value and reasoning</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.actor;
