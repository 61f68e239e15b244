package com.libragraph.sift.core.scan;

import com.libragraph.sift.core.tree.ArtifactNode;
import com.libragraph.sift.util.ContentRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content-hash dedup for one session.
 *
 * <p>The copy that counts as first is the one earliest in a pre-order walk of the tree,
 * whatever order the workers reach them in. While the scan runs, a task whose content is
 * already held by an earlier node is deferred rather than scanned. Once the pool is idle,
 * {@link #resolve} walks the tree: deferred nodes that turned out to be first must be
 * scanned after all, and every later copy becomes a duplicate.
 */
final class DuplicateIndex {

    /** Outcome of a walk over the finished tree. */
    record Resolution(List<ScanTask> rescans, Map<ArtifactNode, ArtifactNode> duplicates) {}

    private final Map<ContentRef, ArtifactNode> holders = new HashMap<>();
    private final Map<ArtifactNode, ContentRef> refs = new IdentityHashMap<>();
    private final Map<ArtifactNode, ScanTask> deferred = new IdentityHashMap<>();

    /**
     * Registers the task's content.
     *
     * @return the earlier node holding the same content, in which case the task is deferred
     */
    synchronized Optional<ArtifactNode> register(ScanTask task, ContentRef ref) {
        ArtifactNode node = task.node();
        refs.put(node, ref);
        ArtifactNode holder = holders.get(ref);
        if (holder != null && holder.precedes(node)) {
            deferred.put(node, task);
            return Optional.of(holder);
        }
        deferred.remove(node);
        holders.put(ref, node);
        return Optional.empty();
    }

    /**
     * Walks the tree in pre-order without changing it. Subtrees below a later copy are
     * not visited.
     */
    synchronized Resolution resolve(ArtifactNode root) {
        Map<ContentRef, ArtifactNode> first = new HashMap<>();
        List<ScanTask> rescans = new ArrayList<>();
        Map<ArtifactNode, ArtifactNode> duplicates = new IdentityHashMap<>();

        Deque<ArtifactNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ArtifactNode node = stack.pop();
            ContentRef ref = refs.get(node);
            if (ref != null) {
                ArtifactNode winner = first.putIfAbsent(ref, node);
                if (winner != null) {
                    duplicates.put(node, winner);
                    continue;
                }
                ScanTask pending = deferred.get(node);
                if (pending != null) {
                    holders.put(ref, node);
                    rescans.add(pending);
                }
            }
            List<ArtifactNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return new Resolution(List.copyOf(rescans), duplicates);
    }
}
