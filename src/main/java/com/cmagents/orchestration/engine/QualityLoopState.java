package com.cmagents.orchestration.engine;

/**
 * States of the generate/qa retry loop. ACCEPTED and EXHAUSTED are final.
 */
public enum QualityLoopState {
    GENERATE,
    EVALUATE,
    RETRY,
    ACCEPTED,
    EXHAUSTED
}
