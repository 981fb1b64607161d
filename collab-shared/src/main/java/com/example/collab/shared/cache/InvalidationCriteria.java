package com.example.collab.shared.cache;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

/**
 * Entries matching any supplied criterion are removed. A null namespace targets every namespace.
 */
@Data
@Builder
public class InvalidationCriteria {
    private Set<String> tags;
    /** Key glob, {@code *} matches any run of characters. */
    private String pattern;
    private Instant olderThan;
    private String namespace;

    public static InvalidationCriteria byTags(String... tags) {
        return InvalidationCriteria.builder().tags(Set.of(tags)).build();
    }

    public boolean isEmpty() {
        return (tags == null || tags.isEmpty()) && (pattern == null || pattern.isEmpty()) && olderThan == null;
    }
}
