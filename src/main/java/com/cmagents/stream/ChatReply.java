package com.cmagents.stream;

import com.cmagents.artifact.ArtifactDocument;
import org.springframework.lang.Nullable;

/**
 * Assistant answer to a chat request, with the plan the request would run with when it
 * could be resolved.
 */
public record ChatReply(String content, @Nullable ArtifactDocument.Plan plan) {
}
