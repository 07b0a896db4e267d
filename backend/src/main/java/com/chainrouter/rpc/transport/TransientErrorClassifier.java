package com.chainrouter.rpc.transport;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a JSON-RPC error is worth retrying on another provider: rate limits, overloaded
 * nodes, upstream timeouts. Everything else (reverts, bad params, unknown method) is the caller's
 * problem and is surfaced as-is.
 */
public final class TransientErrorClassifier {

    /** -32005 limit exceeded, -32603 internal error, 19/30 Cosmos/Solana-style "busy" codes, 429 echoed in-band. */
    private static final Set<Integer> TRANSIENT_CODES = Set.of(-32005, -32603, 19, 30, 429);

    private static final List<String> TRANSIENT_KEYWORDS = List.of(
            "rate limit", "too many requests", "limit exceeded", "timeout", "timed out",
            "try again", "temporarily unavailable", "service unavailable", "bad gateway",
            "gateway timeout", "overloaded", "capacity", "429", "502", "503", "504");

    private TransientErrorClassifier() {
    }

    public static boolean isTransient(int code, String message) {
        if (TRANSIENT_CODES.contains(code)) {
            return true;
        }
        return isTransientMessage(message);
    }

    public static boolean isTransientMessage(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String keyword : TRANSIENT_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
