package com.cmagents.api;

import com.cmagents.artifact.ArtifactDocument;
import com.cmagents.session.ChatMessage;

public record ChatResponse(
        ChatMessage message,
        ArtifactDocument.Plan plan
) {
}
