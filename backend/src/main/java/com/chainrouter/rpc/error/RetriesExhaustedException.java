package com.chainrouter.rpc.error;

import lombok.Getter;

import java.util.List;

/**
 * Terminal failure after {@code maxRetries + 1} attempts. The last underlying error is the cause.
 */
@Getter
public class RetriesExhaustedException extends RpcException {

    private final String chain;
    private final String method;
    private final List<String> attemptedProviders;
    private final int attempts;

    public RetriesExhaustedException(String chain, String method, List<String> attemptedProviders, int attempts, Throwable lastError) {
        super("RPC " + method + " on " + chain + " failed after " + attempts + " attempts (providers "
                + attemptedProviders + ")" + lastMessage(lastError), lastError);
        this.chain = chain;
        this.method = method;
        this.attemptedProviders = List.copyOf(attemptedProviders);
        this.attempts = attempts;
    }

    private static String lastMessage(Throwable lastError) {
        if (lastError == null || lastError.getMessage() == null || lastError.getMessage().isBlank()) {
            return "";
        }
        return ": " + lastError.getMessage();
    }
}
