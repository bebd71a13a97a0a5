package com.protein.network.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The partition of all edge-touched proteins into connectivity groups, plus the
 * protein to group-id lookup derived from it.
 *
 * <p>Proteins that appear in no edge are absent: {@link #groupOf(String)} returns an
 * empty result for them instead of a synthesized singleton group.</p>
 */
public final class ConnectivityGroups {

    private final List<ConnectivityGroup> groups;
    private final Map<String, Integer> groupIds;

    public ConnectivityGroups(List<ConnectivityGroup> groups) {
        Objects.requireNonNull(groups, "groups is required");
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            ConnectivityGroup group = groups.get(i);
            if (group.id() != i) {
                throw new IllegalArgumentException(
                        "Group ids must be dense and ordered, expected " + i + " but was " + group.id());
            }
            for (String member : group.members()) {
                Integer previous = ids.put(member, group.id());
                if (previous != null) {
                    throw new IllegalArgumentException(
                            "Protein " + member + " belongs to groups " + previous + " and " + group.id());
                }
            }
        }
        this.groups = List.copyOf(groups);
        this.groupIds = Collections.unmodifiableMap(ids);
    }

    public static ConnectivityGroups empty() {
        return new ConnectivityGroups(List.of());
    }

    public List<ConnectivityGroup> groups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    public ConnectivityGroup get(int groupId) {
        return groups.get(groupId);
    }

    /**
     * Returns the group id of a protein, or empty when the protein has no edges.
     */
    public OptionalInt groupOf(String protein) {
        Integer id = groupIds.get(protein);
        return id != null ? OptionalInt.of(id) : OptionalInt.empty();
    }

    public boolean sameGroup(String a, String b) {
        Integer ga = groupIds.get(a);
        return ga != null && ga.equals(groupIds.get(b));
    }

    /**
     * Immutable protein to group-id map, iterated in first-seen order.
     */
    public Map<String, Integer> groupIdMap() {
        return groupIds;
    }

    public Set<String> entities() {
        return groupIds.keySet();
    }

    public List<Integer> groupSizes() {
        List<Integer> sizes = new ArrayList<>(groups.size());
        for (ConnectivityGroup group : groups) {
            sizes.add(group.size());
        }
        return sizes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectivityGroups that = (ConnectivityGroups) o;
        return groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "ConnectivityGroups{groups=" + groups.size() +
                ", entities=" + groupIds.size() + '}';
    }
}
