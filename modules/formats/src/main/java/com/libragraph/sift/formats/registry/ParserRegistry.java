package com.libragraph.sift.formats.registry;

import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.Signature;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen table of parser variants plus the {@link SignatureIndex} built from them.
 *
 * <p>Lifecycle is build, then freeze: a {@link Builder} validates each registration and
 * {@link Builder#build()} produces an immutable registry that scan workers only read.
 * Registration order is the tie-break when several variants match at one offset.
 */
public final class ParserRegistry {

    private static final Logger log = Logger.getLogger(ParserRegistry.class);

    /** CDI discovery order: priority descending, then id. */
    public static final Comparator<FormatParser<?>> DISCOVERY_ORDER =
            Comparator.<FormatParser<?>>comparingInt(FormatParser::priority).reversed()
                    .thenComparing(FormatParser::id);

    private final List<FormatParser<?>> parsers;
    private final Map<String, FormatParser<?>> byId;
    private final List<FormatParser<?>> fallbacks;
    private final SignatureIndex signatureIndex;

    private ParserRegistry(List<FormatParser<?>> parsers) {
        this.parsers = List.copyOf(parsers);
        Map<String, FormatParser<?>> ids = new LinkedHashMap<>();
        List<FormatParser<?>> noSignature = new ArrayList<>();
        for (FormatParser<?> parser : this.parsers) {
            ids.put(parser.id(), parser);
            if (parser.signatures().isEmpty()) {
                noSignature.add(parser);
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.fallbacks = List.copyOf(noSignature);
        this.signatureIndex = SignatureIndex.build(this.parsers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers {@code discovered} in {@link #DISCOVERY_ORDER}, for container-managed parsers
     * whose iteration order is not otherwise defined.
     */
    public static ParserRegistry ofDiscovered(Iterable<? extends FormatParser<?>> discovered) {
        List<FormatParser<?>> sorted = new ArrayList<>();
        discovered.forEach(sorted::add);
        sorted.sort(DISCOVERY_ORDER);
        Builder builder = builder();
        sorted.forEach(builder::register);
        return builder.build();
    }

    /**
     * All variants in registration order.
     */
    public List<FormatParser<?>> parsers() {
        return parsers;
    }

    public Optional<FormatParser<?>> parser(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Variants without signatures, tried at region start after signature candidates fail.
     */
    public List<FormatParser<?>> fallbacks() {
        return fallbacks;
    }

    public SignatureIndex signatureIndex() {
        return signatureIndex;
    }

    public int size() {
        return parsers.size();
    }

    /**
     * Collects parsers and freezes them into a registry. Single use.
     */
    public static final class Builder {

        private final List<FormatParser<?>> parsers = new ArrayList<>();
        private final Map<String, FormatParser<?>> ids = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        public Builder register(FormatParser<?> parser) {
            if (built) {
                throw new IllegalStateException("Registry already built; registrations are frozen");
            }
            validate(parser);
            ids.put(parser.id(), parser);
            parsers.add(parser);
            return this;
        }

        public Builder registerAll(Iterable<? extends FormatParser<?>> all) {
            all.forEach(this::register);
            return this;
        }

        public ParserRegistry build() {
            if (built) {
                throw new IllegalStateException("Registry already built");
            }
            built = true;
            ParserRegistry registry = new ParserRegistry(parsers);
            log.infof("Parser registry frozen: %d variants, %d signatures, %d fallbacks",
                    registry.size(), registry.signatureIndex().size(), registry.fallbacks().size());
            return registry;
        }

        private void validate(FormatParser<?> parser) {
            if (parser == null) {
                throw new RegistrationException("null", "parser is null");
            }
            String id = parser.id();
            if (id == null || id.isBlank()) {
                throw new RegistrationException(String.valueOf(id), "id must not be blank");
            }
            if (ids.containsKey(id)) {
                throw new RegistrationException(id, "duplicate id");
            }
            List<Signature> signatures = parser.signatures();
            if (signatures == null) {
                throw new RegistrationException(id, "signatures() returned null");
            }
            for (Signature signature : signatures) {
                if (signature == null) {
                    throw new RegistrationException(id, "null signature");
                }
                if (signature.length() == 0) {
                    throw new RegistrationException(id, "empty signature pattern");
                }
                if (signature.offset() < 0) {
                    throw new RegistrationException(id, "negative signature offset " + signature.offset());
                }
            }
            log.debugf("Registered parser '%s' with %d signatures", id, signatures.size());
        }
    }
}
