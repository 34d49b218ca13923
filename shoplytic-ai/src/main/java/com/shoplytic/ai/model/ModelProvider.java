package com.shoplytic.ai.model;

/**
 * A function-calling chat completion service.
 * <p>
 * Implementations block until the provider answers; callers bound the wait
 * themselves.
 */
public interface ModelProvider {

    /**
     * @throws ModelProviderException when the provider is unavailable or the call fails
     */
    ModelResponse complete(ModelRequest request);
}
