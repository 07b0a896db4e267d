package com.chainrouter.api.controller;

import com.chainrouter.rpc.router.ProviderStatus;
import com.chainrouter.rpc.router.RouterMetrics;
import com.chainrouter.rpc.router.RpcRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only router metrics and provider status, plus operator activation toggles.
 */
@RestController
@RequestMapping("/api/v1/rpc")
@RequiredArgsConstructor
public class RouterStatusController {

    private final RpcRouter rpcRouter;

    @GetMapping("/metrics")
    public RouterMetrics metrics() {
        return rpcRouter.getMetrics();
    }

    @GetMapping("/providers")
    public List<ProviderStatus> providers(@RequestParam(name = "chain", required = false) String chain) {
        if (chain == null || chain.isBlank()) {
            return rpcRouter.getProviderStatus();
        }
        return rpcRouter.getProviderStatus(chain);
    }

    @PostMapping("/providers/{id}/deactivate")
    public ResponseEntity<Void> deactivate(@PathVariable("id") String id) {
        rpcRouter.deactivateProvider(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/providers/{id}/activate")
    public ResponseEntity<Void> activate(@PathVariable("id") String id) {
        rpcRouter.activateProvider(id);
        return ResponseEntity.noContent().build();
    }
}
