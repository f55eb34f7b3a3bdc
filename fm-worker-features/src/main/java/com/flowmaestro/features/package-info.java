/**
 * Step features: annotation-based registration and pre/post step hooks.
 * <ul>
 *   <li>{@link com.flowmaestro.annotations.FlowFeature} – annotate a class to register it (name, phase, applicable step kinds)</li>
 *   <li>{@link com.flowmaestro.features.PreStepCall} / {@link com.flowmaestro.features.PostStepCall} – hook contracts</li>
 *   <li>{@link com.flowmaestro.features.FeatureRegistry} – registry; resolves features for a step kind</li>
 *   <li>{@link com.flowmaestro.features.StepFeatureRunner} – invokes hooks with privilege-aware failure handling</li>
 * </ul>
 */
package com.flowmaestro.features;
