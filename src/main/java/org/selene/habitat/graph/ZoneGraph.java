package org.selene.habitat.graph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.Zone;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Undirected zone adjacency graph derived from the one-directional neighbor lists of a layout.
 * <p>
 * Zone names are translated to dense int ids in first-seen order (each zone, then its declared
 * neighbors). A neighbor name that matches no zone becomes a stub node. Self-references are
 * dropped and parallel declarations collapse to one edge, so adjacency lists are duplicate-free
 * and keep declaration order.
 * <p>
 * Instances are immutable once built.
 */
public final class ZoneGraph {
    /** Distance reported for nodes that cannot reach the target. */
    public static final int UNREACHABLE = -1;

    private final Object2IntOpenHashMap<String> idsByName;
    private final String[] namesById;
    private final int[][] adjacency;
    private final int[] declaredZoneIds;

    private ZoneGraph(Object2IntOpenHashMap<String> idsByName, List<String> names,
                      List<IntArrayList> adjacency, int[] declaredZoneIds) {
        this.idsByName = idsByName;
        this.namesById = names.toArray(new String[0]);
        this.adjacency = new int[adjacency.size()][];
        for (int i = 0; i < adjacency.size(); i++) {
            this.adjacency[i] = adjacency.get(i).toIntArray();
        }
        this.declaredZoneIds = declaredZoneIds;
    }

    /**
     * Builds the symmetrized graph for a layout.
     */
    public static ZoneGraph of(Layout layout) {
        Object2IntOpenHashMap<String> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(-1);
        List<String> names = new ArrayList<>();
        List<IntArrayList> adjacency = new ArrayList<>();
        IntArrayList declared = new IntArrayList();

        for (Zone zone : layout.getZones()) {
            int zoneId = intern(zone.getName(), ids, names, adjacency);
            if (!declared.contains(zoneId)) {
                declared.add(zoneId);
            }
            for (String neighbor : zone.getConnections()) {
                if (neighbor.equals(zone.getName())) {
                    continue;
                }
                int neighborId = intern(neighbor, ids, names, adjacency);
                IntArrayList fromZone = adjacency.get(zoneId);
                if (!fromZone.contains(neighborId)) {
                    fromZone.add(neighborId);
                }
                IntArrayList fromNeighbor = adjacency.get(neighborId);
                if (!fromNeighbor.contains(zoneId)) {
                    fromNeighbor.add(zoneId);
                }
            }
        }
        ids.trim();
        return new ZoneGraph(ids, names, adjacency, declared.toIntArray());
    }

    private static int intern(String name, Object2IntOpenHashMap<String> ids,
                              List<String> names, List<IntArrayList> adjacency) {
        int id = ids.getInt(name);
        if (id == -1) {
            id = names.size();
            ids.put(name, id);
            names.add(name);
            adjacency.add(new IntArrayList(4));
        }
        return id;
    }

    public int nodeCount() {
        return namesById.length;
    }

    public boolean isEmpty() {
        return namesById.length == 0;
    }

    public boolean contains(String name) {
        return idsByName.containsKey(name);
    }

    public String nameOf(int nodeId) {
        return namesById[nodeId];
    }

    /**
     * Returns a copy of the neighbor names of {@code name}, empty if the name is unknown.
     */
    public List<String> neighbors(String name) {
        int id = idsByName.getInt(name);
        if (id == -1) {
            return List.of();
        }
        List<String> result = new ArrayList<>(adjacency[id].length);
        for (int neighbor : adjacency[id]) {
            result.add(namesById[neighbor]);
        }
        return result;
    }

    /**
     * Whether {@code a} and {@code b} share a direct edge (symmetric).
     */
    public boolean hasEdge(String a, String b) {
        int from = idsByName.getInt(a);
        int to = idsByName.getInt(b);
        if (from == -1 || to == -1) {
            return false;
        }
        for (int neighbor : adjacency[from]) {
            if (neighbor == to) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a breadth-first sweep from the first node reaches every declared zone.
     * An empty graph is not connected.
     */
    public boolean isConnected() {
        if (isEmpty()) {
            return false;
        }
        VisitedSet seen = new VisitedSet(nodeCount());
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        seen.markVisited(0);
        queue.enqueue(0);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            for (int neighbor : adjacency[node]) {
                if (seen.markVisited(neighbor)) {
                    queue.enqueue(neighbor);
                }
            }
        }
        for (int zoneId : declaredZoneIds) {
            if (!seen.isVisited(zoneId)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether any component contains a cycle.
     * <p>
     * Iterative depth-first traversal with an explicit frame stack: while expanding a node, any
     * already-visited neighbor other than the node's DFS parent is a back edge.
     */
    public boolean hasCycle() {
        int n = nodeCount();
        VisitedSet visited = new VisitedSet(n);
        int[] parent = new int[n];
        int[] cursor = new int[n];
        IntArrayList stack = new IntArrayList();

        for (int root = 0; root < n; root++) {
            if (!visited.markVisited(root)) {
                continue;
            }
            parent[root] = -1;
            cursor[root] = 0;
            stack.push(root);
            while (!stack.isEmpty()) {
                int node = stack.topInt();
                if (cursor[node] >= adjacency[node].length) {
                    stack.popInt();
                    continue;
                }
                int neighbor = adjacency[node][cursor[node]++];
                if (neighbor == parent[node]) {
                    continue;
                }
                if (visited.isVisited(neighbor)) {
                    return true;
                }
                visited.markVisited(neighbor);
                parent[neighbor] = node;
                cursor[neighbor] = 0;
                stack.push(neighbor);
            }
        }
        return false;
    }

    /**
     * Breadth-first hop distance from every node to {@code target}.
     *
     * @return array indexed by node id; {@link #UNREACHABLE} where no path exists. All entries
     * are unreachable when the target is not in the graph.
     */
    public int[] hopsTo(String target) {
        int[] distances = new int[nodeCount()];
        Arrays.fill(distances, UNREACHABLE);
        int targetId = idsByName.getInt(target);
        if (targetId == -1) {
            return distances;
        }
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        distances[targetId] = 0;
        queue.enqueue(targetId);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            for (int neighbor : adjacency[node]) {
                if (distances[neighbor] == UNREACHABLE) {
                    distances[neighbor] = distances[node] + 1;
                    queue.enqueue(neighbor);
                }
            }
        }
        return distances;
    }

    /**
     * Hop distance from {@code source} to {@code target}, or {@link #UNREACHABLE}.
     */
    public int hops(String source, String target) {
        int sourceId = idsByName.getInt(source);
        if (sourceId == -1) {
            return UNREACHABLE;
        }
        return hopsTo(target)[sourceId];
    }
}
