package com.chainrouter.rpc.registry;

/**
 * Malformed provider descriptor, unsupported chain, duplicate or unknown provider id.
 * Raised at registration time and never retried.
 */
public class ProviderConfigurationException extends IllegalArgumentException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
