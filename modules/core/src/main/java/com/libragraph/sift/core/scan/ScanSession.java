package com.libragraph.sift.core.scan;

import com.libragraph.sift.core.dispatch.DispatchEngine;
import com.libragraph.sift.core.dispatch.ParserHealth;
import com.libragraph.sift.core.dispatch.ValidatedMatch;
import com.libragraph.sift.core.report.FailureKind;
import com.libragraph.sift.core.report.FailureReport;
import com.libragraph.sift.core.report.ScanFailure;
import com.libragraph.sift.core.tree.ArtifactNode;
import com.libragraph.sift.core.tree.ResultTreeBuilder;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.registry.ParserRegistry;
import com.libragraph.sift.formats.registry.SignatureIndex;
import com.libragraph.sift.util.buffer.BinaryData;
import com.libragraph.sift.util.buffer.ByteRegion;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recursive scan of one input: a worker pool drains scan tasks, each task finds and
 * validates artifacts in its region, claims them, and queues their extracted children
 * at the next depth.
 *
 * <p>Child nodes are attached by the task that found them, in discovery order, before
 * their own tasks are queued, so the tree shape never depends on worker timing. With
 * content dedup on, the copy earliest in tree order is kept and later copies become
 * duplicates; see {@link DuplicateIndex}.
 *
 * <p>Lifecycle: {@link #start()}, optionally {@link #cancel()}, then {@link #await()}.
 */
public final class ScanSession {

    private static final Logger log = Logger.getLogger(ScanSession.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final ParserRegistry registry;
    private final SignatureIndex index;
    private final ScanOptions options;
    private final int minRegionSize;
    private final ArtifactNode root;

    private final FailureReport failures = new FailureReport();
    private final ParserHealth health;
    private final DispatchEngine engine;
    private final ScanWorkerPool pool;
    private final DuplicateIndex duplicates = new DuplicateIndex();
    private final Set<BinaryData> derived = ConcurrentHashMap.newKeySet();
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();

    private volatile boolean cancelled;
    private boolean started;
    private long startNanos;
    private ScanResult result;

    public ScanSession(ParserRegistry registry, ScanOptions options, BinaryData data, String name) {
        this(registry, options, ByteRegion.of(data), name);
    }

    public ScanSession(ParserRegistry registry, ScanOptions options, ByteRegion region, String name) {
        this.registry = registry;
        this.index = registry.signatureIndex();
        this.options = options;
        this.minRegionSize = options.minRegionSize() > 0
                ? options.minRegionSize()
                : index.minimumSignatureLength();
        this.root = ArtifactNode.root(name, region);
        this.health = new ParserHealth(options.poisonThreshold());
        this.engine = new DispatchEngine(health, failures);
        this.pool = new ScanWorkerPool("scan-" + SEQUENCE.incrementAndGet(), options.workerCount(),
                this::process, this::taskFault, this::resumeDeferred);
    }

    public synchronized ScanSession start() {
        if (started) {
            throw new IllegalStateException("Session already started");
        }
        started = true;
        startNanos = System.nanoTime();
        log.infof("Scanning '%s' (%d bytes, %d workers, max depth %d)",
                root.path(), root.region().length(), options.workerCount(), options.maxDepth());
        pool.start();
        pool.submit(ScanTask.root(root));
        return this;
    }

    /**
     * Requests a global stop. Tasks already running finish; queued tasks are marked
     * skipped instead of being scanned.
     */
    public void cancel() {
        if (!cancelled) {
            cancelled = true;
            log.infof("Scan of '%s' cancelled with %d tasks pending", root.path(), pool.pending());
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Blocks until every task has finished or been skipped.
     */
    public ScanResult await() throws InterruptedException {
        ensureStarted();
        try {
            pool.completion().get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scan pool failed", e.getCause());
        }
        return finish();
    }

    /**
     * Like {@link #await()} with a limit. On timeout the session keeps running; call
     * {@link #cancel()} and await again for the partial result.
     */
    public ScanResult await(Duration timeout) throws InterruptedException, TimeoutException {
        ensureStarted();
        try {
            pool.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scan pool failed", e.getCause());
        }
        return finish();
    }

    private synchronized void ensureStarted() {
        if (!started) {
            throw new IllegalStateException("Session not started");
        }
    }

    private synchronized ScanResult finish() {
        if (result == null) {
            pool.shutdown();
            if (options.dedupByContentHash()) {
                applyDuplicates();
            }
            ScanResult.Status status = cancelled && skipped.get() > 0
                    ? ScanResult.Status.ABORTED
                    : ScanResult.Status.COMPLETE;
            result = new ScanResult(ResultTreeBuilder.build(root), status, failures.failures(), health.poisoned());
            releaseDerived();
            log.infof("Scan of '%s' %s: %d tasks, %d skipped, %d failures, poisoned %s in %d ms",
                    root.path(), status, processed.get(), skipped.get(), result.failures().size(),
                    result.poisoned(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
        return result;
    }

    // -- task processing, runs on pool workers --

    void process(ScanTask task) {
        ArtifactNode node = task.node();
        ByteRegion region = task.region();

        if (cancelled) {
            node.skipped();
            skipped.incrementAndGet();
            task.transition(ScanTaskState.REJECTED);
            return;
        }
        processed.incrementAndGet();

        if (task.depth() >= options.maxDepth()) {
            node.unrecognized();
            node.putMetadata("limit", "max-depth");
            task.transition(ScanTaskState.REJECTED);
            return;
        }
        if (region.isEmpty() || region.length() < minRegionSize) {
            node.unrecognized();
            task.transition(ScanTaskState.REJECTED);
            return;
        }
        Optional<ArtifactNode> ancestor = task.cycleAncestor();
        if (ancestor.isPresent()) {
            log.debugf("Cycle: %s covers the same bytes as %s", node.path(), ancestor.get().path());
            node.cycleOf(ancestor.get().path());
            task.transition(ScanTaskState.REJECTED);
            return;
        }
        if (options.dedupByContentHash() && !task.gapScan()) {
            Optional<ArtifactNode> earlier = duplicates.register(task, region.contentRef());
            if (earlier.isPresent()) {
                // Stays pending; resolved once the pool is idle.
                log.debugf("Deferring %s, same content as %s", node.path(), earlier.get().path());
                return;
            }
        }

        task.transition(ScanTaskState.MATCHING);
        List<ValidatedMatch> matches = findArtifacts(task);
        if (matches.isEmpty()) {
            node.unrecognized();
            task.transition(ScanTaskState.REJECTED);
            return;
        }
        task.transition(ScanTaskState.VALIDATED);

        ValidatedMatch first = matches.get(0);
        if (matches.size() == 1 && first.offset() == 0 && first.consumed() == region.length()
                && first.carved().sameSpan(region)) {
            node.recognize(first.parserId(), first.description());
            queueChildren(task, node, first);
        } else {
            attachPieces(task, matches);
        }
    }

    /**
     * Scans left to right: dispatch at each candidate offset, claim on a match and
     * continue after the consumed bytes, otherwise move to the next candidate offset.
     */
    private List<ValidatedMatch> findArtifacts(ScanTask task) {
        ByteRegion region = task.region();
        String path = task.node().path();
        List<ValidatedMatch> matches = new ArrayList<>();

        long pos = 0;
        while (pos >= 0 && pos < region.length()) {
            List<FormatParser<?>> candidates = index.candidatesAt(region, pos);
            if (pos == 0 && !registry.fallbacks().isEmpty()) {
                List<FormatParser<?>> withFallbacks = new ArrayList<>(candidates);
                withFallbacks.addAll(registry.fallbacks());
                candidates = withFallbacks;
            }
            if (!candidates.isEmpty()) {
                if (task.state() == ScanTaskState.MATCHING) {
                    task.transition(ScanTaskState.VALIDATING);
                }
                Optional<ValidatedMatch> match = engine.dispatch(region, pos, candidates, path);
                if (match.isPresent()) {
                    ValidatedMatch m = match.get();
                    if (task.ledger().tryClaim(m.consumedRegion(region))) {
                        matches.add(m);
                        pos = m.end();
                        continue;
                    }
                    failures.record(new ScanFailure(FailureKind.OVERLAP, m.parserId(), path, pos,
                            "Claim of " + m.consumed() + " bytes overlaps an earlier claim"));
                    trackDerived(region, m.children());
                }
            }
            pos = index.nextCandidateOffset(region, pos + 1);
        }
        return matches;
    }

    /**
     * The region holds several artifacts, or one that does not cover it: one child per
     * carved artifact and per unclaimed gap, in offset order.
     */
    private void attachPieces(ScanTask task, List<ValidatedMatch> matches) {
        ArtifactNode node = task.node();
        ByteRegion region = task.region();
        List<ByteRegion> gaps = task.ledger().unclaimedRegions(region);
        node.carved();

        int m = 0;
        int g = 0;
        while (m < matches.size() || g < gaps.size()) {
            boolean takeMatch = g >= gaps.size()
                    || (m < matches.size() && region.offset() + matches.get(m).offset() < gaps.get(g).offset());
            if (takeMatch) {
                ValidatedMatch match = matches.get(m++);
                ByteRegion carved = match.carved();
                ArtifactNode piece = node.addChild(
                        "carved-" + carved.relativeTo(region) + "." + match.parserId(), carved);
                piece.recognize(match.parserId(), match.description());
                queueChildren(task, piece, match);
            } else {
                ByteRegion gap = gaps.get(g++);
                ArtifactNode gapNode = node.addChild("gap-" + gap.relativeTo(region), gap);
                gapNode.unrecognized();
                if (options.scanGaps() && !task.gapScan()) {
                    pool.submit(task.gap(gapNode));
                }
            }
        }
    }

    private void queueChildren(ScanTask task, ArtifactNode artifact, ValidatedMatch match) {
        List<ExtractedChild> children = match.children();
        if (children.isEmpty()) {
            return;
        }
        trackDerived(task.region(), children);
        if (artifact.depth() + 1 > options.maxDepth()) {
            artifact.putMetadata("childrenTruncated", true);
            return;
        }
        Set<String> hints = new HashSet<>();
        int i = 0;
        for (ExtractedChild child : children) {
            String hint = uniqueHint(child.pathHint().isEmpty() ? "child-" + i : child.pathHint(), hints);
            ArtifactNode childNode = artifact.addChild(hint, child.region());
            childNode.putExtractionMetadata(child.metadata());
            pool.submit(task.child(childNode, artifact));
            i++;
        }
    }

    // Sibling paths must not collide: "name", "name.1", "name.2".
    private static String uniqueHint(String hint, Set<String> taken) {
        String candidate = hint;
        for (int n = 1; !taken.add(candidate); n++) {
            candidate = hint + "." + n;
        }
        return candidate;
    }

    private void trackDerived(ByteRegion parent, List<ExtractedChild> children) {
        for (ExtractedChild child : children) {
            if (child.region().data() != parent.data()) {
                derived.add(child.region().data());
            }
        }
    }

    // Derived buffers are not referenced by the frozen tree.
    private void releaseDerived() {
        for (BinaryData data : derived) {
            try {
                data.close();
            } catch (IOException e) {
                log.warnf("Failed to release derived buffer %s: %s", data, e.getMessage());
            }
        }
        derived.clear();
    }

    /**
     * Pool idle: scans deferred copies that turned out to come first in the tree.
     */
    private void resumeDeferred() {
        if (!options.dedupByContentHash() || cancelled) {
            return;
        }
        for (ScanTask task : duplicates.resolve(root).rescans()) {
            log.debugf("Resuming %s, first copy of its content", task.node().path());
            pool.submit(task);
        }
    }

    private void applyDuplicates() {
        DuplicateIndex.Resolution resolution = duplicates.resolve(root);
        for (ScanTask task : resolution.rescans()) {
            task.node().skipped();
            skipped.incrementAndGet();
            task.transition(ScanTaskState.REJECTED);
        }
        resolution.duplicates().forEach((node, first) -> {
            failures.discardUnder(node.path());
            node.duplicateOf(first.path());
        });
    }

    private void taskFault(ScanTask task, Throwable e) {
        failures.record(ScanFailure.of(FailureKind.TASK_FAULT, null, task.node().path(), 0, e));
        task.node().unrecognized();
    }
}
