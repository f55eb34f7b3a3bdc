/**
 * Workflow graph: authored definitions and their compiled, executable form.
 * <ul>
 *   <li>{@link com.flowmaestro.graph.definition.WorkflowDefinition} – steps, edges, entry and output designation (JSON via {@link com.flowmaestro.graph.WorkflowDefinitions})</li>
 *   <li>{@link com.flowmaestro.graph.GraphCompiler} – validation, dependency sets, depth by bounded relaxation, levels, terminals</li>
 *   <li>{@link com.flowmaestro.graph.compiled.CompiledGraph} – immutable result consumed by the scheduler</li>
 *   <li>{@link com.flowmaestro.graph.MalformedGraphException} / {@link com.flowmaestro.graph.CyclicGraphException} – compile errors</li>
 * </ul>
 */
package com.flowmaestro.graph;
