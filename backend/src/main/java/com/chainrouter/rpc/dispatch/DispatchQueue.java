package com.chainrouter.rpc.dispatch;

import com.chainrouter.domain.Provider;
import com.chainrouter.domain.RpcRequest;
import com.chainrouter.domain.RpcResponse;
import com.chainrouter.rpc.config.DispatchProperties;
import com.chainrouter.rpc.error.QueueSaturatedException;
import com.chainrouter.rpc.error.RpcException;
import com.chainrouter.rpc.execution.RequestExecutor;
import com.chainrouter.rpc.selection.ProviderSelector;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-chain FIFO of pending calls, drained once per tick at the best provider's rate limit.
 * A provider with {@code rateLimit} requests per second releases
 * {@code max(1, rateLimit * tickMs / 1000)} calls per tick, each pinned to that provider.
 */
@Slf4j
public class DispatchQueue {

    private final Map<String, ChainQueue> queues = new ConcurrentHashMap<>();
    private final ProviderSelector selector;
    private final RequestExecutor executor;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final int maxDepth;
    private final long tickIntervalMs;
    private volatile boolean shutdown;

    public DispatchQueue(ProviderSelector selector, RequestExecutor executor, Executor dispatchExecutor,
                         Clock clock, DispatchProperties properties) {
        if (properties.getMaxQueueDepth() <= 0) {
            throw new IllegalArgumentException("maxQueueDepth must be positive");
        }
        if (properties.getTickIntervalMs() <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be positive");
        }
        this.selector = selector;
        this.executor = executor;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.maxDepth = properties.getMaxQueueDepth();
        this.tickIntervalMs = properties.getTickIntervalMs();
    }

    /**
     * Appends the request to its chain's queue without blocking.
     *
     * @throws QueueSaturatedException when the chain already holds {@code maxQueueDepth} calls
     */
    public QueuedCall enqueue(RpcRequest request) {
        if (shutdown) {
            throw new RpcException("Dispatch queue is shut down; rejected " + request);
        }
        ChainQueue queue = queues.computeIfAbsent(request.getChain(), c -> new ChainQueue());
        QueuedCall call = new QueuedCall(request, clock.instant(), this);
        queue.lock.lock();
        try {
            if (queue.calls.size() >= maxDepth) {
                throw new QueueSaturatedException(request.getChain(), request.getMethod(), queue.calls.size(), maxDepth);
            }
            queue.calls.addLast(call);
        } finally {
            queue.lock.unlock();
        }
        log.debug("Queued {} (depth {})", request, depth(request.getChain()));
        return call;
    }

    /**
     * One dispatch tick across all chains.
     *
     * @return number of calls handed to the executor
     */
    public int drainOnce() {
        int dispatched = 0;
        for (Map.Entry<String, ChainQueue> entry : queues.entrySet()) {
            dispatched += drainChain(entry.getKey(), entry.getValue());
        }
        return dispatched;
    }

    public int depth(String chain) {
        ChainQueue queue = queues.get(chain);
        if (queue == null) {
            return 0;
        }
        queue.lock.lock();
        try {
            return queue.calls.size();
        } finally {
            queue.lock.unlock();
        }
    }

    /**
     * Depth per chain, ordered by chain name.
     */
    public Map<String, Integer> depths() {
        Map<String, Integer> out = new TreeMap<>();
        for (String chain : queues.keySet()) {
            out.put(chain, depth(chain));
        }
        return out;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    /**
     * Fails every pending call and rejects further enqueues.
     */
    public void shutdown() {
        shutdown = true;
        int failed = 0;
        for (Map.Entry<String, ChainQueue> entry : queues.entrySet()) {
            for (QueuedCall call : pollUpTo(entry.getValue(), Integer.MAX_VALUE)) {
                call.completeExceptionally(new RpcException("Dispatch queue shut down before " + call.getRequest() + " was sent"));
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Dispatch queue shut down with {} pending calls failed", failed);
        }
    }

    boolean withdraw(QueuedCall call) {
        ChainQueue queue = queues.get(call.getRequest().getChain());
        if (queue == null) {
            return false;
        }
        queue.lock.lock();
        try {
            return queue.calls.remove(call);
        } finally {
            queue.lock.unlock();
        }
    }

    static int batchSize(int rateLimit, long tickIntervalMs) {
        return (int) Math.max(1L, rateLimit * tickIntervalMs / 1000L);
    }

    private int drainChain(String chain, ChainQueue queue) {
        if (depth(chain) == 0) {
            return 0;
        }
        Optional<Provider> best = selector.best(chain);
        if (best.isEmpty()) {
            log.debug("No eligible provider for {}; {} calls stay queued", chain, depth(chain));
            return 0;
        }
        Provider provider = best.get();
        List<QueuedCall> batch = pollUpTo(queue, batchSize(provider.getRateLimit(), tickIntervalMs));
        for (QueuedCall call : batch) {
            RpcRequest request = call.getRequest();
            RpcRequest pinned = request.getPinnedProviderId() != null ? request : request.pinnedTo(provider.getId());
            submit(call, pinned);
        }
        if (!batch.isEmpty()) {
            log.debug("Dispatched {} queued calls on {} via {} (longest wait {} ms); {} left",
                    batch.size(), chain, provider.getId(), longestWaitMs(batch), depth(chain));
        }
        return batch.size();
    }

    private long longestWaitMs(List<QueuedCall> batch) {
        Instant now = clock.instant();
        long longest = 0L;
        for (QueuedCall call : batch) {
            longest = Math.max(longest, Duration.between(call.getEnqueuedAt(), now).toMillis());
        }
        return longest;
    }

    private void submit(QueuedCall call, RpcRequest request) {
        try {
            dispatchExecutor.execute(() -> {
                try {
                    RpcResponse response = executor.execute(request);
                    call.complete(response);
                } catch (RuntimeException e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch executor rejected {}: {}", request, e.getMessage());
            call.completeExceptionally(new RpcException("Dispatch executor rejected " + request, e));
        }
    }

    private static List<QueuedCall> pollUpTo(ChainQueue queue, int max) {
        List<QueuedCall> out = new ArrayList<>();
        queue.lock.lock();
        try {
            while (out.size() < max && !queue.calls.isEmpty()) {
                out.add(queue.calls.pollFirst());
            }
        } finally {
            queue.lock.unlock();
        }
        return out;
    }

    private static final class ChainQueue {
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<QueuedCall> calls = new ArrayDeque<>();
    }
}
