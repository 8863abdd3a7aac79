package com.lottiegen.optimization;

/**
 * Thrown when input to the optimizer breaks an invariant that an earlier pipeline
 * stage is responsible for, such as a timeline with no keyframes. Not recoverable;
 * the current generation run should be aborted.
 */
public final class CanonicalizationException extends RuntimeException {

    public CanonicalizationException(String message) {
        super(message);
    }
}
