package com.acme.grc.graph;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool that carries the submitting thread's MDC into each task.
 */
final class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    MdcAwareExecutor(int threads) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "graph-read-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.delegate = Executors.newFixedThreadPool(threads, tf);
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        delegate.execute(() -> {
            if (parentMdc != null) MDC.setContextMap(parentMdc);
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) delegate.shutdownNow();
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
