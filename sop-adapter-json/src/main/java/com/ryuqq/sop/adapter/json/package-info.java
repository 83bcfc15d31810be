/**
 * JSON adapter for SOP definitions and workflow values.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.adapter.json.SopDefinitionParser} - JSON document to
 *       {@link com.ryuqq.sop.core.model.SopDefinition}</li>
 *   <li>{@link com.ryuqq.sop.adapter.json.JsonSopDefinitionSource} - classpath or directory
 *       backed {@link com.ryuqq.sop.core.spi.SopDefinitionSource}</li>
 *   <li>{@link com.ryuqq.sop.adapter.json.ValueJsonMapper} - Jackson tree to
 *       {@link com.ryuqq.sop.core.model.Value} conversion</li>
 * </ul>
 *
 * <h2>Error Handling</h2>
 * <p>Malformed documents, missing required fields and graph violations all surface as
 * {@link com.ryuqq.sop.core.exception.DefinitionException}. Unknown fields are ignored.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.sop.adapter.json;
