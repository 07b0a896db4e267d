package com.chainrouter.rpc.registry;

import lombok.Getter;

/**
 * Lookup of a provider id that is not registered.
 */
@Getter
public class UnknownProviderException extends ProviderConfigurationException {

    private final String providerId;

    public UnknownProviderException(String providerId) {
        super("Unknown provider: " + providerId);
        this.providerId = providerId;
    }
}
