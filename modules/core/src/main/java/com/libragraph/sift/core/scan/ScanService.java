package com.libragraph.sift.core.scan;

import com.libragraph.sift.core.service.AbstractManagedService;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.registry.ParserRegistry;
import com.libragraph.sift.util.buffer.BinaryData;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for scans inside the application.
 *
 * <p>Freezes every discovered {@link FormatParser} bean into one registry at startup and
 * runs sessions with options taken from {@code sift.scan.*}. A scan that outlives
 * {@code sift.scan.await-timeout-seconds} is cancelled and returns its partial result.
 */
@ApplicationScoped
public class ScanService extends AbstractManagedService {

    @Inject
    Instance<FormatParser<?>> parsers;

    @ConfigProperty(name = "sift.scan.max-depth", defaultValue = "8")
    int maxDepth;

    @ConfigProperty(name = "sift.scan.min-region-size", defaultValue = "0")
    int minRegionSize;

    @ConfigProperty(name = "sift.scan.dedup-by-content-hash", defaultValue = "false")
    boolean dedupByContentHash;

    @ConfigProperty(name = "sift.scan.scan-gaps", defaultValue = "false")
    boolean scanGaps;

    @ConfigProperty(name = "sift.scan.worker-count")
    Optional<Integer> workerCount;

    @ConfigProperty(name = "sift.scan.poison-threshold", defaultValue = "3")
    int poisonThreshold;

    @ConfigProperty(name = "sift.scan.await-timeout-seconds", defaultValue = "300")
    long awaitTimeoutSeconds;

    private volatile ParserRegistry registry;
    private final Set<ScanSession> active = ConcurrentHashMap.newKeySet();

    @Override
    public String serviceId() {
        return "scan-service";
    }

    @Override
    protected void doStart() {
        registry = ParserRegistry.ofDiscovered(parsers);
        log.infof("ScanService ready with parsers %s",
                registry.parsers().stream().map(FormatParser::id).toList());
    }

    @Override
    protected void doStop() {
        for (ScanSession session : active) {
            session.cancel();
        }
    }

    public ParserRegistry registry() {
        if (registry == null) {
            throw new IllegalStateException("ScanService is " + state());
        }
        return registry;
    }

    public ScanOptions options() {
        return new ScanOptions(maxDepth, minRegionSize, dedupByContentHash, scanGaps,
                workerCount.orElse(Runtime.getRuntime().availableProcessors()), poisonThreshold);
    }

    /**
     * Scans {@code data} with the configured options.
     */
    public ScanResult scan(BinaryData data, String name) throws InterruptedException {
        return scan(data, name, options());
    }

    public ScanResult scan(BinaryData data, String name, ScanOptions options) throws InterruptedException {
        if (!isRunning()) {
            throw new IllegalStateException("ScanService is " + state());
        }
        ScanSession session = new ScanSession(registry(), options, data, name);
        active.add(session);
        try {
            session.start();
            try {
                return session.await(Duration.ofSeconds(awaitTimeoutSeconds));
            } catch (TimeoutException e) {
                log.warnf("Scan of '%s' exceeded %d s; cancelling", name, awaitTimeoutSeconds);
                session.cancel();
                return session.await();
            }
        } finally {
            active.remove(session);
        }
    }

    /**
     * Scans a file; the root node is named after the file.
     */
    public ScanResult scan(Path file) throws IOException, InterruptedException {
        try (BinaryData data = BinaryData.open(file)) {
            return scan(data, file.getFileName().toString());
        }
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("ScanService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping ScanService", e);
        }
    }
}
