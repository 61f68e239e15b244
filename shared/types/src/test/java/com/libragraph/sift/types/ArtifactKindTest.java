package com.libragraph.sift.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ArtifactKindTest {

    @Test
    void idsRoundTrip() {
        for (ArtifactKind kind : ArtifactKind.values()) {
            assertThat(ArtifactKind.fromId(kind.id())).isSameAs(kind);
        }
    }

    @Test
    void unrecognizedCarriesTheTreeLabel() {
        assertThat(ArtifactKind.UNRECOGNIZED.label()).isEqualTo("unrecognized data");
    }

    @Test
    void rejectsUnknownId() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ArtifactKind.fromId(42))
                .withMessageContaining("42");
    }
}
