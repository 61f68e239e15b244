package com.libragraph.sift.core.tree;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.types.ArtifactKind;
import com.libragraph.sift.util.buffer.ByteRegion;
import com.libragraph.sift.util.buffer.RamBuffer;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ArtifactNodeTest {

    private static final ByteRegion DATA = ByteRegion.of(new RamBuffer(new byte[256]));

    @Test
    void precedesFollowsPreOrder() {
        ArtifactNode root = ArtifactNode.root("input.bin", DATA);
        ArtifactNode a = root.addChild("a", DATA.slice(0, 100));
        ArtifactNode a1 = a.addChild("a1", DATA.slice(0, 10));
        ArtifactNode a1x = a1.addChild("x", DATA.slice(0, 5));
        ArtifactNode b = root.addChild("b", DATA.slice(100, 100));

        assertThat(root.precedes(a)).isTrue();
        assertThat(a.precedes(a1)).isTrue();
        assertThat(a1x.precedes(b)).isTrue();
        assertThat(b.precedes(a1x)).isFalse();
        assertThat(a1.precedes(a)).isFalse();
        assertThat(b.precedes(b)).isFalse();
    }

    @Test
    void duplicateDropsScanOutputButKeepsExtractionMetadata() {
        ArtifactNode root = ArtifactNode.root("input.bin", DATA);
        ArtifactNode node = root.addChild("entry-1", DATA.slice(64, 64));
        node.putExtractionMetadata(Map.of("index", 1));
        node.recognize("cnt", Description.of(Set.of("container"), Map.of("entries", 2)));
        node.addChild("entry-0", DATA.slice(80, 16)).recognize("leaf", Description.ofLabels("leaf"));

        node.duplicateOf("input.bin/entry-0");

        assertThat(node.kind()).isEqualTo(ArtifactKind.DUPLICATE);
        assertThat(node.parserId()).isNull();
        assertThat(node.labels()).isEmpty();
        assertThat(node.children()).isEmpty();
        assertThat(node.metadata()).containsExactly(
                entry("index", 1),
                entry("duplicateOf", "input.bin/entry-0"));
    }
}
