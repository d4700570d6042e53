package com.eainde.extraction.thread;

import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executor that carries the submitting thread's MDC (e.g. {@code runId}) into
 * the worker thread and clears it afterwards.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    /**
     * Fixed pool of {@code threads} named {@code <prefix>N}.
     */
    public static MdcAwareExecutor fixed(int threads, String threadNamePrefix) {
        return new MdcAwareExecutor(Executors.newFixedThreadPool(threads, daemonFactory(threadNamePrefix)));
    }

    /**
     * Unbounded pool of reusable threads named {@code <prefix>N}.
     */
    public static MdcAwareExecutor cached(String threadNamePrefix) {
        return new MdcAwareExecutor(Executors.newCachedThreadPool(daemonFactory(threadNamePrefix)));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    /**
     * Stops accepting work and interrupts running tasks.
     */
    @Override
    public void close() {
        delegate.shutdownNow();
    }

    private static CustomizableThreadFactory daemonFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
