/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.ironwood.internal.compression.DecompressorFactory;

/**
 * Context object that manages shared resources for decoding query results.
 * <p>
 * Holds the thread pool used for per-column materialization and the decompressor factory.
 * A context may be shared by any number of {@link QueryResultReader}s; a reader opened without
 * one creates its own and closes it together with the reader.
 * </p>
 * <p>
 * Defaults are taken from the system properties {@value #THREADS_PROPERTY} (pool size,
 * available processors if unset) and {@value #PARALLEL_PROPERTY} ({@code true} to materialize
 * columns in parallel, {@code false} by default).
 * </p>
 */
public final class IronwoodContext implements AutoCloseable {

    static final String THREADS_PROPERTY = "ironwood.threads";
    static final String PARALLEL_PROPERTY = "ironwood.materialize.parallel";

    private static final System.Logger LOG = System.getLogger(IronwoodContext.class.getName());

    private final ExecutorService executor;
    private final DecompressorFactory decompressorFactory;
    private final boolean parallelMaterialization;

    private IronwoodContext(ExecutorService executor, boolean parallelMaterialization) {
        this.executor = executor;
        this.decompressorFactory = new DecompressorFactory();
        this.parallelMaterialization = parallelMaterialization;
    }

    /**
     * Create a new context configured from system properties.
     */
    public static IronwoodContext create() {
        return create(threadsFromProperty(), Boolean.getBoolean(PARALLEL_PROPERTY));
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static IronwoodContext create(int threads) {
        return create(threads, Boolean.getBoolean(PARALLEL_PROPERTY));
    }

    /**
     * Create a new context with a thread pool of the specified size.
     *
     * @param parallelMaterialization whether columns are materialized in parallel, one pass per column
     */
    public static IronwoodContext create(int threads, boolean parallelMaterialization) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "ironwood-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);

        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads, parallel materialization {1}",
                threads, parallelMaterialization ? "enabled" : "disabled");
        return new IronwoodContext(executor, parallelMaterialization);
    }

    private static int threadsFromProperty() {
        String value = System.getProperty(THREADS_PROPERTY);
        if (value == null || value.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + THREADS_PROPERTY + ": " + value, e);
        }
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Get the decompressor factory.
     */
    public DecompressorFactory decompressorFactory() {
        return decompressorFactory;
    }

    public boolean parallelMaterialization() {
        return parallelMaterialization;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
