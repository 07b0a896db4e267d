package com.chainrouter.rpc.router;

import com.chainrouter.domain.Urgency;

import java.util.List;

/**
 * One entry of a batch call.
 */
public record RpcCall(String method, List<Object> params, Urgency urgency) {

    public RpcCall {
        params = params != null ? List.copyOf(params) : List.of();
        urgency = urgency != null ? urgency : Urgency.MEDIUM;
    }

    public static RpcCall of(String method, Object... params) {
        return new RpcCall(method, List.of(params), Urgency.MEDIUM);
    }
}
