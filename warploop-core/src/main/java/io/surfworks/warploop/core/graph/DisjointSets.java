package io.surfworks.warploop.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Union-find over dense integer handles.
 *
 * <p>Union by size with path compression. Every class root also owns the list of
 * its members, kept sorted by handle and merged on union, so enumerating a class
 * costs nothing once the relation is built. Classes enumerate in the order of their
 * smallest member.
 *
 * <p>Once {@link #freeze()} is called the forest is fully compressed and further
 * unions are rejected, which makes every later lookup read-only.
 */
public final class DisjointSets {

    private static final int UNREGISTERED = -1;

    private int[] parent;
    private int[] size;
    private final List<List<Integer>> members;
    private int classCount;
    private boolean frozen;

    public DisjointSets() {
        this(16);
    }

    public DisjointSets(int expectedHandles) {
        int capacity = Math.max(expectedHandles, 1);
        this.parent = new int[capacity];
        this.size = new int[capacity];
        this.members = new ArrayList<>(Collections.nCopies(capacity, null));
        Arrays.fill(parent, UNREGISTERED);
    }

    /**
     * Registers {@code handle} as a singleton class if it is not registered yet.
     *
     * @return true if the handle was newly registered
     */
    public boolean initialize(int handle) {
        checkMutable();
        ensureCapacity(handle);
        if (parent[handle] != UNREGISTERED) {
            return false;
        }
        parent[handle] = handle;
        size[handle] = 1;
        List<Integer> singleton = new ArrayList<>(1);
        singleton.add(handle);
        members.set(handle, singleton);
        classCount++;
        return true;
    }

    public boolean contains(int handle) {
        return handle >= 0 && handle < parent.length && parent[handle] != UNREGISTERED;
    }

    /**
     * Unions the classes of {@code a} and {@code b}, registering either if needed.
     *
     * @return true if two distinct classes were merged
     */
    public boolean union(int a, int b) {
        checkMutable();
        initialize(a);
        initialize(b);
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            int tmp = rootA;
            rootA = rootB;
            rootB = tmp;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        members.set(rootA, mergeSorted(members.get(rootA), members.get(rootB)));
        members.set(rootB, null);
        classCount--;
        return true;
    }

    /**
     * Returns the root handle of the class containing {@code handle}.
     *
     * @throws IllegalArgumentException if the handle is not registered
     */
    public int find(int handle) {
        if (!contains(handle)) {
            throw new IllegalArgumentException("Handle " + handle + " is not registered");
        }
        int root = handle;
        while (parent[root] != root) {
            root = parent[root];
        }
        int current = handle;
        while (parent[current] != root) {
            int next = parent[current];
            parent[current] = root;
            current = next;
        }
        return root;
    }

    public boolean areMapped(int a, int b) {
        return contains(a) && contains(b) && find(a) == find(b);
    }

    /**
     * Members of the class containing {@code handle}, sorted by handle.
     */
    public List<Integer> members(int handle) {
        return Collections.unmodifiableList(members.get(find(handle)));
    }

    /**
     * Root handles of every class, ordered by each class's smallest member.
     */
    public List<Integer> classRoots() {
        List<Integer> roots = new ArrayList<>(classCount);
        for (int h = 0; h < parent.length; h++) {
            if (parent[h] == UNREGISTERED) {
                continue;
            }
            int root = find(h);
            if (members.get(root).get(0) == h) {
                roots.add(root);
            }
        }
        return roots;
    }

    public int classCount() {
        return classCount;
    }

    /**
     * Compresses every path and rejects further mutation.
     */
    public void freeze() {
        for (int h = 0; h < parent.length; h++) {
            if (parent[h] != UNREGISTERED) {
                find(h);
            }
        }
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    // ==================== Internal Helpers ====================

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("DisjointSets is frozen");
        }
    }

    private void ensureCapacity(int handle) {
        if (handle < 0) {
            throw new IllegalArgumentException("Handle must be non-negative: " + handle);
        }
        if (handle < parent.length) {
            return;
        }
        int capacity = Math.max(handle + 1, parent.length * 2);
        int oldLength = parent.length;
        parent = Arrays.copyOf(parent, capacity);
        size = Arrays.copyOf(size, capacity);
        Arrays.fill(parent, oldLength, capacity, UNREGISTERED);
        while (members.size() < capacity) {
            members.add(null);
        }
    }

    private static List<Integer> mergeSorted(List<Integer> a, List<Integer> b) {
        List<Integer> merged = new ArrayList<>(a.size() + b.size());
        int i = 0;
        int j = 0;
        while (i < a.size() && j < b.size()) {
            if (a.get(i) < b.get(j)) {
                merged.add(a.get(i++));
            } else {
                merged.add(b.get(j++));
            }
        }
        while (i < a.size()) merged.add(a.get(i++));
        while (j < b.size()) merged.add(b.get(j++));
        return merged;
    }

    @Override
    public String toString() {
        return String.format("DisjointSets[classes=%d, frozen=%s]", classCount, frozen);
    }
}
