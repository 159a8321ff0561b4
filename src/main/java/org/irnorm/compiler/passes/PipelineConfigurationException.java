package org.irnorm.compiler.passes;

/**
 * Thrown when a configured pass list cannot form a valid pipeline: an unknown pass name,
 * a tier running after a later tier, or a pass placed before one it depends on.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
