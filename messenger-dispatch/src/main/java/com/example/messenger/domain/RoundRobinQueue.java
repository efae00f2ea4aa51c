package com.example.messenger.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable ordered list of agent ids, serialised as a comma separated string in the shared store.
 */
public final class RoundRobinQueue {

    private static final RoundRobinQueue EMPTY = new RoundRobinQueue(List.of());

    private final List<Long> agentIds;

    private RoundRobinQueue(List<Long> agentIds) {
        this.agentIds = Collections.unmodifiableList(agentIds);
    }

    public static RoundRobinQueue empty() {
        return EMPTY;
    }

    public static RoundRobinQueue of(Collection<Long> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            return EMPTY;
        }
        return new RoundRobinQueue(new ArrayList<>(new LinkedHashSet<>(agentIds)));
    }

    public static RoundRobinQueue sorted(Collection<Long> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            return EMPTY;
        }
        return new RoundRobinQueue(agentIds.stream().distinct().sorted().collect(Collectors.toList()));
    }

    public static RoundRobinQueue parse(String serialized) {
        if (serialized == null || serialized.isBlank()) {
            return EMPTY;
        }
        List<Long> ids = new ArrayList<>();
        for (String part : serialized.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                ids.add(Long.parseLong(trimmed));
            }
        }
        return of(ids);
    }

    public String serialize() {
        return agentIds.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    public List<Long> agentIds() {
        return agentIds;
    }

    public Set<Long> members() {
        return new LinkedHashSet<>(agentIds);
    }

    public boolean hasMembers(Set<Long> expected) {
        return members().equals(expected);
    }

    public boolean contains(long agentId) {
        return agentIds.contains(agentId);
    }

    public boolean isEmpty() {
        return agentIds.isEmpty();
    }

    public Optional<Long> firstAllowed(Collection<Long> allowed) {
        if (allowed == null || allowed.isEmpty()) {
            return Optional.empty();
        }
        Set<Long> lookup = allowed instanceof Set<Long> set ? set : Set.copyOf(allowed);
        return agentIds.stream().filter(lookup::contains).findFirst();
    }

    public RoundRobinQueue moveToTail(long agentId) {
        List<Long> updated = new ArrayList<>(agentIds);
        updated.remove(Long.valueOf(agentId));
        updated.add(agentId);
        return new RoundRobinQueue(updated);
    }

    public RoundRobinQueue moveToHead(long agentId) {
        if (!contains(agentId)) {
            return this;
        }
        List<Long> updated = new ArrayList<>(agentIds.size());
        updated.add(agentId);
        for (Long id : agentIds) {
            if (id != agentId) {
                updated.add(id);
            }
        }
        return new RoundRobinQueue(updated);
    }

    public RoundRobinQueue append(long agentId) {
        if (contains(agentId)) {
            return this;
        }
        List<Long> updated = new ArrayList<>(agentIds);
        updated.add(agentId);
        return new RoundRobinQueue(updated);
    }

    public RoundRobinQueue without(long agentId) {
        if (!contains(agentId)) {
            return this;
        }
        List<Long> updated = new ArrayList<>(agentIds);
        updated.remove(Long.valueOf(agentId));
        return new RoundRobinQueue(updated);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RoundRobinQueue queue && agentIds.equals(queue.agentIds);
    }

    @Override
    public int hashCode() {
        return agentIds.hashCode();
    }

    @Override
    public String toString() {
        return agentIds.toString();
    }
}
