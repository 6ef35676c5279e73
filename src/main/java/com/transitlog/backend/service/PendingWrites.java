package com.transitlog.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Background writes that are still running.
 *
 * <p>A write leaves the registry as soon as it completes, so it only ever holds
 * work in flight. Hosts that freeze the process between invocations call
 * {@link #awaitAll()} before handing back control.
 */
@Component
@Slf4j
public class PendingWrites {

    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

    public <T> CompletableFuture<T> track(CompletableFuture<T> write) {
        pending.add(write);
        write.whenComplete((value, error) -> pending.remove(write));
        return write;
    }

    public int size() {
        return pending.size();
    }

    /**
     * Block until every write tracked so far has finished.
     * Failed writes are not rethrown; their failures are reported where they were tracked.
     *
     * @return the number of writes waited for
     */
    public int awaitAll() {
        CompletableFuture<?>[] writes = pending.toArray(new CompletableFuture[0]);
        if (writes.length == 0) {
            return 0;
        }
        log.info("⏳ Waiting for {} background write(s)", writes.length);
        CompletableFuture.allOf(writes)
                .handle((value, error) -> null)
                .join();
        return writes.length;
    }
}
