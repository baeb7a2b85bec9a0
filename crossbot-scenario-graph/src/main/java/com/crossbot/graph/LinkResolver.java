package com.crossbot.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the adjacency view of the link cells: source cell id → ordered target ids.
 * Targets keep document order; a repeated source/target pair is kept once.
 */
public final class LinkResolver {

    private LinkResolver() {
    }

    public static Map<String, List<String>> resolve(List<RawLinkCell> links) {
        if (links == null || links.isEmpty()) return Map.of();
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (RawLinkCell link : links) {
            List<String> targets = map.computeIfAbsent(link.getSourceId(), k -> new ArrayList<>());
            if (!targets.contains(link.getTargetId())) {
                targets.add(link.getTargetId());
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        map.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
