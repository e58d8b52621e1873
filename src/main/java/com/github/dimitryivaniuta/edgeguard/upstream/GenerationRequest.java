package com.github.dimitryivaniuta.edgeguard.upstream;

public record GenerationRequest(
        String model,
        String contents,
        String systemInstruction
) {}
