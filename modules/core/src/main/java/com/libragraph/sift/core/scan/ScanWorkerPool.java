package com.libragraph.sift.core.scan;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Fixed set of worker threads draining one task queue.
 *
 * <p>Completion is an explicit count of submitted-but-unfinished tasks: a task's
 * children are submitted before the task itself counts as finished, so the count
 * only reaches zero once the whole tree is done. Workers exit when it does.
 *
 * <p>Anything a task throws, errors included, is handed to the fault callback and the
 * worker moves on, so one bad task never stalls the count.
 */
final class ScanWorkerPool {

    private static final Logger log = Logger.getLogger(ScanWorkerPool.class);

    private final String name;
    private final int workerCount;
    private final Consumer<ScanTask> processor;
    private final BiConsumer<ScanTask, Throwable> onFault;
    private final Runnable onIdle;

    private final BlockingQueue<ScanTask> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong submitted = new AtomicLong();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean running;

    /**
     * @param onIdle runs on a worker each time the count reaches zero; tasks it submits
     *               keep the pool going
     */
    ScanWorkerPool(String name, int workerCount, Consumer<ScanTask> processor,
                   BiConsumer<ScanTask, Throwable> onFault, Runnable onIdle) {
        this.name = name;
        this.workerCount = workerCount;
        this.processor = processor;
        this.onFault = onFault;
        this.onIdle = onIdle;
    }

    synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (int i = 0; i < workerCount; i++) {
            Thread worker = new Thread(this::workerLoop, name + "-worker-" + i);
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
        }
        log.debugf("Scan pool '%s' started with %d workers", name, workerCount);
    }

    void submit(ScanTask task) {
        pending.incrementAndGet();
        submitted.incrementAndGet();
        queue.add(task);
    }

    CompletableFuture<Void> completion() {
        return completion;
    }

    int pending() {
        return pending.get();
    }

    /**
     * Stops the workers. Only called once the pool is idle.
     */
    synchronized void shutdown() {
        running = false;
        for (Thread worker : workers) {
            worker.interrupt();
        }
        workers.clear();
    }

    private void workerLoop() {
        while (running) {
            ScanTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                processor.accept(task);
            } catch (Throwable e) {
                log.errorf(e, "Unexpected error processing %s", task);
                reportFault(task, e);
            } finally {
                taskFinished();
            }
        }
    }

    private void taskFinished() {
        while (pending.decrementAndGet() == 0) {
            // Hold the count above zero so tasks submitted by the callback cannot finish it.
            pending.incrementAndGet();
            long before = submitted.get();
            runIdleCallback();
            if (submitted.get() == before) {
                pending.decrementAndGet();
                running = false;
                completion.complete(null);
                wakeIdleWorkers();
                return;
            }
        }
    }

    private void runIdleCallback() {
        try {
            onIdle.run();
        } catch (Throwable e) {
            log.errorf(e, "Idle callback of scan pool '%s' failed", name);
        }
    }

    private void reportFault(ScanTask task, Throwable e) {
        try {
            onFault.accept(task, e);
        } catch (Throwable secondary) {
            log.errorf(secondary, "Could not record failure of %s", task);
        }
    }

    private synchronized void wakeIdleWorkers() {
        Thread self = Thread.currentThread();
        for (Thread worker : workers) {
            if (worker != self) {
                worker.interrupt();
            }
        }
    }
}
