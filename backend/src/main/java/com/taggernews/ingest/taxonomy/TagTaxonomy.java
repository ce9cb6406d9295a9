package com.taggernews.ingest.taxonomy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Built-in tag hierarchy. Level 1 names are fixed categories; the level 2 names listed here
 * belong to a mother category. Anything else the enrichment service invents is level 3 unless
 * it was explicitly returned as level 2.
 */
public final class TagTaxonomy {
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    public static final Set<String> LEVEL_ONE = Collections.unmodifiableSet(new LinkedHashSet<>(
        List.of("Tech", "Business", "Science", "Society")
    ));

    public static final Map<String, List<String>> LEVEL_TWO_BY_CATEGORY;

    static {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("Region", List.of("EU", "USA", "China", "Canada", "India", "Germany", "France", "Netherlands", "UK"));
        categories.put("Tech Stacks", List.of("Python", "Rust", "Go", "JavaScript", "Linux"));
        categories.put("Tech Topics", List.of(
            "AI/ML", "Web", "Systems", "Security", "Mobile", "DevOps", "Data", "Cloud", "Open Source", "Hardware"
        ));
        categories.put("Business", List.of("Startups", "Finance", "Career", "Products", "Legal", "Marketing"));
        categories.put("Science", List.of("Research", "Space", "Biology", "Physics"));
        LEVEL_TWO_BY_CATEGORY = Collections.unmodifiableMap(categories);
    }

    private static final Map<String, String> LEVEL_ONE_BY_CATEGORY = Map.of(
        "Region", "Society",
        "Tech Stacks", "Tech",
        "Tech Topics", "Tech",
        "Business", "Business",
        "Science", "Science"
    );

    private static final Map<String, String> CANONICAL_BY_SLUG;
    private static final Map<String, String> CATEGORY_BY_SLUG;

    static {
        Map<String, String> canonical = new LinkedHashMap<>();
        Map<String, String> category = new LinkedHashMap<>();
        for (String name : LEVEL_ONE) {
            canonical.put(slugify(name), name);
        }
        for (Map.Entry<String, List<String>> entry : LEVEL_TWO_BY_CATEGORY.entrySet()) {
            for (String name : entry.getValue()) {
                canonical.putIfAbsent(slugify(name), name);
                category.putIfAbsent(slugify(name), entry.getKey());
            }
        }
        CANONICAL_BY_SLUG = Collections.unmodifiableMap(canonical);
        CATEGORY_BY_SLUG = Collections.unmodifiableMap(category);
    }

    private TagTaxonomy() {
    }

    public static String slugify(String name) {
        if (name == null) {
            return "";
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        String collapsed = NON_SLUG.matcher(lower).replaceAll("-");
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '-') {
            start++;
        }
        while (end > start && collapsed.charAt(end - 1) == '-') {
            end--;
        }
        return collapsed.substring(start, end);
    }

    public static boolean isLevelOne(String name) {
        String slug = slugify(name);
        return LEVEL_ONE.stream().anyMatch(l1 -> slugify(l1).equals(slug));
    }

    public static Optional<String> canonicalName(String name) {
        return Optional.ofNullable(CANONICAL_BY_SLUG.get(slugify(name)));
    }

    public static Optional<String> categoryOf(String name) {
        return Optional.ofNullable(CATEGORY_BY_SLUG.get(slugify(name)));
    }

    /**
     * Level 1 tag a category belongs under, e.g. "Tech Stacks" is filed under "Tech".
     */
    public static Optional<String> levelOneParentOf(String category) {
        if (category == null) {
            return Optional.empty();
        }
        return LEVEL_ONE_BY_CATEGORY.entrySet().stream()
            .filter(entry -> slugify(entry.getKey()).equals(slugify(category)))
            .map(Map.Entry::getValue)
            .findFirst();
    }

    /**
     * Level for a tag: canonical names keep their built-in level, others keep the level they were returned with.
     */
    public static int resolveLevel(String name, int requestedLevel) {
        if (isLevelOne(name)) {
            return 1;
        }
        if (CATEGORY_BY_SLUG.containsKey(slugify(name))) {
            return 2;
        }
        int clamped = Math.max(1, Math.min(3, requestedLevel));
        return clamped == 1 ? 3 : clamped;
    }

    public static Map<String, String> canonicalNamesBySlug() {
        return CANONICAL_BY_SLUG;
    }
}
