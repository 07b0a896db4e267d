package com.chainrouter.rpc.job;

import com.chainrouter.rpc.dispatch.DispatchQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DispatchTickJob {

    private final DispatchQueue dispatchQueue;

    @Scheduled(fixedRateString = "${chainrouter.dispatch.tick-interval-ms:1000}")
    public void runScheduled() {
        dispatchQueue.drainOnce();
    }
}
