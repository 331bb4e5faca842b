package com.stockalert.data.provider;

/**
 * A single provider failed: transport, HTTP status, an error marker in the payload, or a
 * payload that could not be parsed.
 */
public class ProviderException extends Exception {
    private final ProviderKind provider;

    public ProviderException(ProviderKind provider, String message) {
        super(provider.id() + ": " + message);
        this.provider = provider;
    }

    public ProviderException(ProviderKind provider, String message, Throwable cause) {
        super(provider.id() + ": " + message, cause);
        this.provider = provider;
    }

    public ProviderKind provider() {
        return provider;
    }
}
