package io.surfworks.warploop.core.graph;

import java.util.List;

import io.surfworks.warploop.ir.IterDomain;

/**
 * One equivalence class of a frozen {@link DomainGraph}.
 *
 * @param mode the relation this class belongs to
 * @param key stable class key (the union-find root handle)
 * @param members the class members, ordered by handle
 */
public record IdGroup(IdMappingMode mode, int key, List<IterDomain> members) {

    public IdGroup {
        members = List.copyOf(members);
    }

    public boolean has(IterDomain id) {
        return members.contains(id);
    }

    public IterDomain front() {
        return members.get(0);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return mode + members.toString();
    }
}
