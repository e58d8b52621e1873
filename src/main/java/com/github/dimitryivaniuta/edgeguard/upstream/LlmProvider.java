package com.github.dimitryivaniuta.edgeguard.upstream;

/**
 * External text-generation provider.
 */
public interface LlmProvider {

    /**
     * @return generated text, never {@code null}
     * @throws UpstreamException when the provider answers with an error
     */
    String generate(GenerationRequest request);

    /**
     * False when required credentials are missing; callers must not invoke {@link #generate} then.
     */
    boolean isConfigured();
}
