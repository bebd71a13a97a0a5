package com.protein.network.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A maximal set of proteins reachable from one another through interaction edges.
 *
 * @param id      dense group id, only meaningful as an equivalence key within one run
 * @param root    the disjoint-set root that represented this group when it was extracted
 * @param members proteins in the group, in the order they were first seen in the edge list
 */
public record ConnectivityGroup(int id, String root, Set<String> members) {

    public ConnectivityGroup {
        Objects.requireNonNull(root, "root is required");
        Objects.requireNonNull(members, "members is required");
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0");
        }
        if (!members.contains(root)) {
            throw new IllegalArgumentException("root must be a member of the group");
        }
        members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String protein) {
        return members.contains(protein);
    }
}
