package com.identity.matching.nickname;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only map from a lowercase given name to every name linked to it as a
 * nickname or formal-name equivalent.
 *
 * <p>Links are symmetric. After the direct links are collected, each name
 * also receives the direct links of its direct links (a single propagation
 * pass), so "bob" and "rob" are linked through "robert". Longer chains are
 * not followed.</p>
 *
 * <p>An index built from a dataset that could not be loaded is empty and
 * reports itself as degraded; it never throws.</p>
 */
public final class NicknameIndex {
    private static final Logger log = LoggerFactory.getLogger(NicknameIndex.class);

    private static final NicknameIndex EMPTY = new NicknameIndex(Map.of(), null);

    private final Map<String, Set<String>> links;
    private final String degradedReason;

    private NicknameIndex(Map<String, Set<String>> links, String degradedReason) {
        this.links = links;
        this.degradedReason = degradedReason;
    }

    /**
     * Builds an index from dataset rows. Rows whose relationship is not
     * {@value NicknameRelation#HAS_NICKNAME}, or with a blank name, are ignored.
     */
    public static NicknameIndex load(Collection<NicknameRelation> rows) {
        Map<String, Set<String>> adjacency = new HashMap<>();
        int used = 0;
        for (NicknameRelation row : rows) {
            if (!row.isNickname()) {
                continue;
            }
            String a = key(row.name());
            String b = key(row.otherName());
            if (a.isEmpty() || b.isEmpty() || a.equals(b)) {
                continue;
            }
            adjacency.computeIfAbsent(a, k -> new HashSet<>()).add(b);
            adjacency.computeIfAbsent(b, k -> new HashSet<>()).add(a);
            used++;
        }

        Map<String, Set<String>> closed = new HashMap<>(adjacency.size() * 2);
        for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
            String name = entry.getKey();
            Set<String> linked = new HashSet<>(entry.getValue());
            for (String neighbor : entry.getValue()) {
                linked.addAll(adjacency.get(neighbor));
            }
            linked.remove(name);
            closed.put(name, Set.copyOf(linked));
        }

        log.info("nickname.index.loaded rows={} names={}", used, closed.size());
        return new NicknameIndex(Map.copyOf(closed), null);
    }

    /**
     * Returns an index with no links.
     */
    public static NicknameIndex empty() {
        return EMPTY;
    }

    /**
     * Returns an empty index that records why the dataset could not be used.
     */
    public static NicknameIndex degraded(String reason) {
        return new NicknameIndex(Map.of(), reason != null ? reason : "nickname dataset unavailable");
    }

    /**
     * Returns true if the two given names are equal or linked, ignoring case and surrounding whitespace.
     */
    public boolean areLinked(String nameA, String nameB) {
        if (nameA == null || nameB == null) {
            return false;
        }
        String a = key(nameA);
        String b = key(nameB);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }
        Set<String> linked = links.get(a);
        return linked != null && linked.contains(b);
    }

    /**
     * Returns every name linked to the given name, or an empty set.
     */
    public Set<String> getLinkedNames(String name) {
        if (name == null) {
            return Set.of();
        }
        return links.getOrDefault(key(name), Set.of());
    }

    /**
     * Number of distinct names that have at least one link.
     */
    public int size() {
        return links.size();
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }

    public boolean isDegraded() {
        return degradedReason != null;
    }

    public String getDegradedReason() {
        return degradedReason;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "NicknameIndex{names=" + links.size() +
                (degradedReason != null ? ", degraded='" + degradedReason + '\'' : "") + '}';
    }
}
