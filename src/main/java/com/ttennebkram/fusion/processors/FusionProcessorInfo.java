package com.ttennebkram.fusion.processors;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for FusionProcessor classes to declare their metadata.
 * Read at runtime when the pipeline describes its stages.
 *
 * Example usage:
 * <pre>
 * {@literal @}FusionProcessorInfo(
 *     nodeType = "ContrastEnhance",
 *     displayName = "Contrast Enhance",
 *     category = "Enhancement",
 *     description = "Affine intensity remap\nMat.convertTo(dst, CV_8U, alpha, beta)"
 * )
 * public class ContrastEnhanceProcessor extends FusionProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FusionProcessorInfo {

    /**
     * The node type name. Must match getNodeType().
     */
    String nodeType();

    /**
     * Display name. If empty, defaults to nodeType.
     */
    String displayName() default "";

    /**
     * Category for grouping (e.g., "Basic", "Fusion").
     */
    String category();

    /**
     * Description/method signature.
     */
    String description() default "";

    /**
     * Whether this is a dual-input processor.
     * Dual-input processors extend FusionDualInputProcessor.
     */
    boolean dualInput() default false;
}
