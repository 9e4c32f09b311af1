package org.selene.habitat.graph;

import java.util.BitSet;

/**
 * Compact visited-marker set over dense zone node ids.
 * <p>
 * Wraps a {@link BitSet}: O(1) mark/test and about one bit per node.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe; intended for one traversal at a time.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param nodeCount number of node ids the traversal may touch.
     */
    public VisitedSet(int nodeCount) {
        this.visited = new BitSet(nodeCount);
    }

    /**
     * Marks a node as visited.
     *
     * @return {@code true} if the node was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    /**
     * Number of nodes marked so far.
     */
    public int size() {
        return visited.cardinality();
    }
}
