/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.dependency;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * A collection of Objects that work together, plus the single thread that delivers their change notifications
 * in order.
 */
@SuppressFBWarnings(value = "SC_START_IN_CTOR", justification = "Starting thread in constructor is what we want")
public class Context implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Context.class);
    private final ConcurrentHashMap<Class<?>, Object> parts = new ConcurrentHashMap<>();
    private final BlockingDeque<Runnable> serialized = new LinkedBlockingDeque<>();
    private final AtomicBoolean requestPublishThreadStop = new AtomicBoolean();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private final Thread publishThread = new Thread() {
        {
            setName("Serialized listener processor");
            setPriority(Thread.MAX_PRIORITY - 1);
            setDaemon(true);
        }

        @SuppressWarnings("PMD.AvoidCatchingThrowable")
        @Override
        public void run() {
            while (!requestPublishThreadStop.get()) {
                try {
                    Runnable task = serialized.takeFirst();
                    task.run();
                } catch (InterruptedException ie) {
                    return;
                } catch (Throwable t) {
                    logger.atError().addKeyValue("eventType", "run-on-publish-queue-error").setCause(t).log();
                }
            }
        }
    };
    private static final Crashable doNothing = () -> {};

    public Context() {
        parts.put(Context.class, this);
        publishThread.start();
    }

    /**
     * Put an object into the Context.
     *
     * @param clazz  type of object to be stored
     * @param object instance to store
     * @param <T>    the type to put
     * @return this
     */
    public <T> Context put(Class<T> clazz, T object) {
        parts.put(clazz, object);
        return this;
    }

    /**
     * Get the object stored for a type.
     *
     * @param clazz type to look up
     * @param <T>   the type to look up
     * @return the stored object, or null if nothing was put for that type
     */
    @Nullable
    public <T> T get(Class<T> clazz) {
        Object o = parts.get(clazz);
        return o == null ? null : clazz.cast(o);
    }

    /**
     * Shutdown this context, closing all closeable objects stored in it.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }

        parts.values().forEach(object -> {
            if (object == this || !(object instanceof Closeable)) {
                return;
            }
            try {
                ((Closeable) object).close();
                logger.atDebug().addKeyValue("eventType", "context-shutdown")
                        .addKeyValue("class", object.getClass().getName()).log();
            } catch (IOException t) {
                logger.atError().addKeyValue("eventType", "context-shutdown-error")
                        .addKeyValue("class", object.getClass().getName()).setCause(t).log();
            }
        });

        // Request stop without actually interrupting the publish thread
        requestPublishThreadStop.set(true);
        // Add something into the queue to be sure that takeFirst returns
        runOnPublishQueue(() -> {});
    }

    @Override
    public void close() throws IOException {
        shutdown();
    }

    public void runOnPublishQueue(Runnable r) {
        serialized.add(r);
    }

    /**
     * Run a Crashable function on the publish queue and wait for it to finish execution.
     *
     * @param r Crashable
     * @return Throwable resulting from running the Crashable (if any)
     */
    @SuppressWarnings("PMD.AvoidCatchingThrowable")
    public Throwable runOnPublishQueueAndWait(Crashable r) {
        AtomicReference<Throwable> ret = new AtomicReference<>();
        CountDownLatch ready = new CountDownLatch(1);
        runOnPublishQueue(() -> {
            try {
                r.run();
            } catch (Throwable t) {
                ret.set(t);
            }
            ready.countDown();
        });
        if (!onPublishThread()) {
            try {
                ready.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                ret.set(ex);
            }
        }
        return ret.get();
    }

    /**
     * Block until every task queued so far, and anything those tasks queued, has run.
     */
    public void waitForPublishQueueToClear() {
        if (requestPublishThreadStop.get()) {
            return;
        }
        // An empty queue doesn't mean the last job has finished, so run once more at the end.
        do {
            runOnPublishQueueAndWait(doNothing);
        } while (!serialized.isEmpty());
        runOnPublishQueueAndWait(doNothing);
    }

    private boolean onPublishThread() {
        return Thread.currentThread() == publishThread;
    }
}
