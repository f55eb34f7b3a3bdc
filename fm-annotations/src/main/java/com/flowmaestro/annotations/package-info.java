/**
 * FlowMaestro annotations shared by the worker and its pluggable features.
 * <ul>
 *   <li>{@link com.flowmaestro.annotations.FlowFeature} – step feature metadata (name, phase, applicable step kinds)</li>
 *   <li>{@link com.flowmaestro.annotations.FeaturePhase} – when a feature runs relative to a step</li>
 *   <li>{@link com.flowmaestro.annotations.ResourceCleanup} – shutdown hook contract</li>
 * </ul>
 */
package com.flowmaestro.annotations;
