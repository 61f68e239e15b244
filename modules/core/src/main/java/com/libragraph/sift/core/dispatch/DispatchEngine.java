package com.libragraph.sift.core.dispatch;

import com.libragraph.sift.core.ledger.ClaimLedger;
import com.libragraph.sift.core.report.FailureKind;
import com.libragraph.sift.core.report.FailureReport;
import com.libragraph.sift.core.report.ScanFailure;
import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.ParseResult;
import com.libragraph.sift.util.buffer.BufferBoundsException;
import com.libragraph.sift.util.buffer.ByteRegion;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Runs candidate parsers at one offset, in order, and returns the first that passes
 * every stage of the parser contract.
 *
 * <p>Mismatches move on to the next candidate. Contract violations poison the variant at
 * once; other faults, including errors such as {@link StackOverflowError}, are counted and
 * poison it at the session threshold. Only virtual machine errors like
 * {@link OutOfMemoryError} leave this class; the worker pool reports those against the task.
 *
 * <p>One engine per session; safe for concurrent use by that session's workers.
 */
public class DispatchEngine {

    private static final Logger log = Logger.getLogger(DispatchEngine.class);

    private final ParserHealth health;
    private final FailureReport failures;

    public DispatchEngine(ParserHealth health, FailureReport failures) {
        this.health = health;
        this.failures = failures;
    }

    public ParserHealth health() {
        return health;
    }

    /**
     * @param region     region being scanned
     * @param offset     candidate offset relative to {@code region}
     * @param candidates variants to try, in priority order
     * @param path       tree path of {@code region}, for the failure report
     */
    public Optional<ValidatedMatch> dispatch(ByteRegion region, long offset,
                                             List<FormatParser<?>> candidates, String path) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        ByteRegion tail = region.tail(offset);
        for (FormatParser<?> candidate : candidates) {
            if (health.isPoisoned(candidate.id())) {
                continue;
            }
            Optional<ValidatedMatch> match = attempt(candidate, tail, offset, path);
            if (match.isPresent()) {
                log.debugf("'%s' matched at %s+%d (%d bytes)", candidate.id(), path, offset, match.get().consumed());
                return match;
            }
        }
        return Optional.empty();
    }

    private <S> Optional<ValidatedMatch> attempt(FormatParser<S> parser, ByteRegion tail, long offset, String path) {
        try {
            return Optional.ofNullable(validate(parser, tail, offset));
        } catch (ContractViolationException e) {
            failures.record(ScanFailure.of(FailureKind.CONTRACT_VIOLATION, parser.id(), path, offset, e));
            if (health.poison(parser.id())) {
                failures.record(new ScanFailure(FailureKind.POISONED, parser.id(), path, offset,
                        "Disabled for the rest of the session after a contract violation"));
            }
        } catch (RuntimeException e) {
            fault(parser.id(), path, offset, e);
        } catch (Error e) {
            // A stack overflow has unwound by now; other VM errors go up to the pool.
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw e;
            }
            fault(parser.id(), path, offset, e);
        }
        return Optional.empty();
    }

    private void fault(String parserId, String path, long offset, Throwable e) {
        log.debugf(e, "Fault in '%s' at %s+%d", parserId, path, offset);
        failures.record(ScanFailure.of(FailureKind.PARSER_FAULT, parserId, path, offset, e));
        if (health.recordFault(parserId)) {
            failures.record(new ScanFailure(FailureKind.POISONED, parserId, path, offset,
                    "Disabled for the rest of the session after " + health.faultCount(parserId) + " faults"));
        }
    }

    /**
     * Runs the stages in contract order. Null means a structural mismatch.
     */
    private <S> ValidatedMatch validate(FormatParser<S> parser, ByteRegion tail, long offset) {
        String id = parser.id();

        ParseResult<S> result;
        try {
            result = parser.parse(tail);
        } catch (BufferBoundsException e) {
            log.debugf("'%s' mismatch at +%d: %s", id, offset, e.getMessage());
            return null;
        }
        if (result == null) {
            throw new ContractViolationException(id, "parse returned null");
        }
        if (result instanceof ParseResult.Mismatch<S> mismatch) {
            log.debugf("'%s' mismatch at +%d: %s", id, offset, mismatch.reason());
            return null;
        }
        S state = ((ParseResult.Ok<S>) result).state();

        long consumed = parser.consumedLength(state);
        if (consumed <= 0 || consumed > tail.length()) {
            throw new ContractViolationException(id,
                    "consumed length " + consumed + " outside (0, " + tail.length() + "]");
        }
        ByteRegion consumedRegion = tail.slice(0, consumed);

        ByteRegion carved;
        List<ExtractedChild> children;
        try {
            Optional<ByteRegion> carve = parser.carve(state, tail);
            if (carve == null) {
                throw new ContractViolationException(id, "carve returned null");
            }
            carved = carve.orElse(consumedRegion);
            if (carved.isEmpty() || !consumedRegion.contains(carved)) {
                throw new ContractViolationException(id,
                        "carved " + carved + " is empty or outside consumed " + consumedRegion);
            }

            children = parser.extractChildren(state, tail);
        } catch (BufferBoundsException e) {
            throw new ContractViolationException(id, "region outside bounds", e);
        }
        if (children == null) {
            throw new ContractViolationException(id, "extractChildren returned null");
        }
        ClaimLedger siblings = new ClaimLedger(carved);
        for (ExtractedChild child : children) {
            ByteRegion region = child.region();
            if (region.isEmpty()) {
                throw new ContractViolationException(id, "empty child region '" + child.pathHint() + "'");
            }
            if (region.data() != carved.data()) {
                continue;
            }
            if (!carved.contains(region)) {
                throw new ContractViolationException(id,
                        "child '" + child.pathHint() + "' " + region + " outside carved " + carved);
            }
            if (!siblings.tryClaim(region)) {
                throw new ContractViolationException(id,
                        "child '" + child.pathHint() + "' " + region + " overlaps an earlier child");
            }
        }

        Description description = parser.describe(state);
        if (description == null) {
            throw new IllegalStateException("describe returned null");
        }
        return new ValidatedMatch(id, offset, consumed, carved, children, description);
    }
}
