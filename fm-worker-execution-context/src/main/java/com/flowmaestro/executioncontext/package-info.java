/**
 * Per-run execution context.
 * <ul>
 *   <li>{@link com.flowmaestro.executioncontext.ExecutionContext} – append-only step outputs and variables; functional updates</li>
 *   <li>{@link com.flowmaestro.executioncontext.ContextSnapshot} – frozen view handed to a step at dispatch</li>
 *   <li>{@link com.flowmaestro.executioncontext.TemplateResolver} – {@code {{stepId.path}}} interpolation with an explicit unresolved marker</li>
 *   <li>{@link com.flowmaestro.executioncontext.OutputTruncator} – caps stored output size</li>
 * </ul>
 */
package com.flowmaestro.executioncontext;
