package com.flowmaestro.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a step feature that can be registered and invoked around step execution.
 * Register it in a feature registry; implement the pre/post contracts matching {@link #phase()}.
 * <p>
 * {@link #applicableStepKinds()} supports exact match, prefix ("llm.*"), and "*" for all steps.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface FlowFeature {

    /** Unique feature identifier (used as the registry key). */
    String name();

    /** When to invoke: PRE, POST_SUCCESS, POST_ERROR, or PRE_FINALLY (before and after). */
    FeaturePhase phase() default FeaturePhase.PRE_FINALLY;

    /** Step kind patterns this feature applies to. Empty = all. E.g. "llm", "http.*", "*". */
    String[] applicableStepKinds() default { };
}
