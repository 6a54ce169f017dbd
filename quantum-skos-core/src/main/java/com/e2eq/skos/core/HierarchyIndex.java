package com.e2eq.skos.core;

import java.util.*;

/**
 * Code-level view of the concept hierarchy: code to URI maps plus the broader and
 * narrower targets of every coded concept, expressed as codes. Built read-only from
 * the opaque statements.
 */
public final class HierarchyIndex {

    public static final String BROADER = "skos:broader";
    public static final String NARROWER = "skos:narrower";

    private final Map<String, String> codeToUri = new LinkedHashMap<>();
    private final Map<String, String> uriToCode = new HashMap<>();
    private final Map<String, Set<String>> broaderCodes = new HashMap<>();
    private final Map<String, Set<String>> narrowerCodes = new HashMap<>();

    private HierarchyIndex() {}

    public static HierarchyIndex of(List<Concept> concepts) {
        HierarchyIndex index = new HierarchyIndex();
        for (Concept c : concepts) {
            HierarchyCodes.extractCode(c.uri()).ifPresent(code -> {
                index.codeToUri.put(code, c.uri());
                index.uriToCode.put(c.uri(), code);
            });
        }
        for (Concept c : concepts) {
            String source = index.uriToCode.get(c.uri());
            if (source == null) continue;
            for (String prop : c.otherProperties()) {
                Statement st = Statement.parse(prop);
                Map<String, Set<String>> target;
                if (st.hasPredicate(BROADER)) {
                    target = index.broaderCodes;
                } else if (st.hasPredicate(NARROWER)) {
                    target = index.narrowerCodes;
                } else {
                    continue;
                }
                for (String id : st.identifiers()) {
                    HierarchyCodes.extractCode(id)
                            .ifPresent(code -> target.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(code));
                }
            }
        }
        return index;
    }

    public boolean isEmpty() {
        return codeToUri.isEmpty();
    }

    public Map<String, String> codeToUri() {
        return Collections.unmodifiableMap(codeToUri);
    }

    public Optional<String> codeOf(String uri) {
        return Optional.ofNullable(uriToCode.get(uri));
    }

    public Optional<String> uriOf(String code) {
        return Optional.ofNullable(codeToUri.get(code));
    }

    public boolean hasCode(String code) {
        return codeToUri.containsKey(code);
    }

    public Set<String> broaderCodes(String code) {
        return broaderCodes.getOrDefault(code, Set.of());
    }

    public Set<String> narrowerCodes(String code) {
        return narrowerCodes.getOrDefault(code, Set.of());
    }

    /**
     * Parent candidates of {@code code} that exist as concepts, longest first.
     */
    public List<String> existingCandidates(String code) {
        List<String> existing = new ArrayList<>();
        for (String candidate : HierarchyCodes.parentCandidates(code)) {
            if (hasCode(candidate)) existing.add(candidate);
        }
        return existing;
    }
}
