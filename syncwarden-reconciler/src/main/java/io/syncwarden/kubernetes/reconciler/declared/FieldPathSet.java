/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.declared;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.fabric8.kubernetes.api.model.HasMetadata;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An immutable, sorted set of leaf field paths extracted from a nested document.
 * <p>
 * Paths use JSON Pointer (RFC 6901) syntax: segments are separated by {@code /} and a literal {@code ~} or
 * {@code /} inside a segment is escaped as {@code ~0} or {@code ~1}. Maps are descended into; lists and scalars
 * are leaves. An empty map contributes no path (nothing is declared beneath it yet) whereas an empty list
 * contributes its own path (it is declared to be empty).
 * </p>
 * <p>
 * Paths are ordered by plain {@link String#compareTo(String)}, not numerically, so {@code /a/10} sorts before
 * {@code /a/2}. Serialized forms depend on that ordering and it must not change.
 * </p>
 * <p>
 * Two string forms exist and they are not interchangeable: the display form joins with {@code ", "} and is used
 * in admission responses and logs, the annotation form joins with {@code ","} and is persisted on managed objects.
 * </p>
 */
public final class FieldPathSet implements Iterable<String> {

    static final String ROOT = "/";
    private static final String SEPARATOR = "/";
    private static final String DISPLAY_DELIMITER = ", ";
    private static final String ANNOTATION_DELIMITER = ",";
    private static final String APPEND_SENTINEL = "-";

    private static final FieldPathSet EMPTY = new FieldPathSet(Collections.emptySortedSet());

    private final SortedSet<String> paths;

    private FieldPathSet(SortedSet<String> paths) {
        this.paths = Collections.unmodifiableSortedSet(paths);
    }

    public static FieldPathSet empty() {
        return EMPTY;
    }

    public static FieldPathSet of(String... paths) {
        return of(Arrays.asList(paths));
    }

    public static FieldPathSet of(Collection<String> paths) {
        Objects.requireNonNull(paths);
        if (paths.isEmpty()) {
            return EMPTY;
        }
        return new FieldPathSet(new TreeSet<>(paths));
    }

    /**
     * Computes the leaf field paths of a generic document made of {@link Map}s, {@link List}s and scalars.
     *
     * @param document the document, may be null
     * @param ignore exact paths to leave out of the result
     * @return the field path set, empty for a null document
     */
    public static FieldPathSet compute(@Nullable Object document, Collection<String> ignore) {
        Objects.requireNonNull(ignore);
        if (document == null) {
            return EMPTY;
        }
        var leaves = new TreeSet<String>();
        collectLeaves(document, ROOT, leaves);
        leaves.removeAll(ignore);
        return leaves.isEmpty() ? EMPTY : new FieldPathSet(leaves);
    }

    public static FieldPathSet compute(@Nullable Object document) {
        return compute(document, Set.of());
    }

    /**
     * Computes the leaf field paths of a Kubernetes object, typed or generic.
     *
     * @param object the object
     * @param ignore exact paths to leave out of the result
     * @return the field path set
     */
    public static FieldPathSet compute(HasMetadata object, Collection<String> ignore) {
        Objects.requireNonNull(object);
        return compute(Documents.toDocument(object), ignore);
    }

    private static void collectLeaves(@Nullable Object node, String ancestorPath, Set<String> leaves) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                collectLeaves(entry.getValue(), childPath(ancestorPath, String.valueOf(entry.getKey())), leaves);
            }
        }
        else {
            leaves.add(ancestorPath);
        }
    }

    static String childPath(String parent, String key) {
        return (parent.length() == 1 ? parent : parent + SEPARATOR) + escape(key);
    }

    /**
     * Escapes a single path segment: {@code ~} becomes {@code ~0} and {@code /} becomes {@code ~1}.
     *
     * @param segment raw segment
     * @return escaped segment
     */
    public static String escape(String segment) {
        Objects.requireNonNull(segment);
        if (segment.indexOf('~') < 0 && segment.indexOf('/') < 0) {
            return segment;
        }
        var sb = new StringBuilder(segment.length() + 4);
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '~') {
                sb.append("~0");
            }
            else if (c == '/') {
                sb.append("~1");
            }
            else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #escape(String)}. The input is scanned once, so {@code ~01} unescapes to {@code ~1}
     * rather than {@code /}. A {@code ~} not followed by {@code 0} or {@code 1} is kept as is.
     *
     * @param segment escaped segment
     * @return raw segment
     */
    public static String unescape(String segment) {
        Objects.requireNonNull(segment);
        if (segment.indexOf('~') < 0) {
            return segment;
        }
        var sb = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '~' && i + 1 < segment.length()) {
                char next = segment.charAt(i + 1);
                if (next == '0') {
                    sb.append('~');
                    i++;
                    continue;
                }
                if (next == '1') {
                    sb.append('/');
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Generalizes an element level path to the path of the list containing it by cutting the path at the first
     * segment which is an integer or the append sentinel {@code -}. For example {@code /a/0/b} and {@code /a/-}
     * both become {@code /a}. A path without list indices is returned unchanged.
     *
     * @param path the path
     * @return the path with any list index suffix removed
     */
    public static String stripListIndex(String path) {
        Objects.requireNonNull(path);
        String[] segments = path.split(SEPARATOR, -1);
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (APPEND_SENTINEL.equals(segment) || isInteger(segment)) {
                // a list at the document root strips to the empty pointer, which denotes the whole document
                return String.join(SEPARATOR, Arrays.asList(segments).subList(0, i));
            }
        }
        return path;
    }

    // any segment that parses as a 64 bit integer is a list index
    private static boolean isInteger(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        try {
            Long.parseLong(segment);
            return true;
        }
        catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Parses the {@code ", "} delimited display form produced by {@link #toDisplayString()}.
     *
     * @param value display form
     * @return the set, empty for an empty string
     */
    public static FieldPathSet fromDisplayString(String value) {
        return split(value, DISPLAY_DELIMITER);
    }

    /**
     * Parses the {@code ","} delimited annotation form produced by {@link #toAnnotationValue()}.
     *
     * @param value annotation value
     * @return the set, empty for an empty string
     */
    public static FieldPathSet fromAnnotationValue(String value) {
        return split(value, ANNOTATION_DELIMITER);
    }

    private static FieldPathSet split(String value, String delimiter) {
        Objects.requireNonNull(value);
        if (value.isEmpty()) {
            return EMPTY;
        }
        return of(List.of(value.split(Pattern.quote(delimiter), -1)));
    }

    public String toDisplayString() {
        return String.join(DISPLAY_DELIMITER, paths);
    }

    public String toAnnotationValue() {
        return String.join(ANNOTATION_DELIMITER, paths);
    }

    public FieldPathSet intersect(FieldPathSet other) {
        Objects.requireNonNull(other);
        return filter(other.paths::contains);
    }

    public FieldPathSet difference(FieldPathSet other) {
        Objects.requireNonNull(other);
        return filter(Predicate.not(other.paths::contains));
    }

    public FieldPathSet union(FieldPathSet other) {
        Objects.requireNonNull(other);
        if (other.isEmpty()) {
            return this;
        }
        var merged = new TreeSet<>(paths);
        merged.addAll(other.paths);
        return new FieldPathSet(merged);
    }

    public FieldPathSet filter(Predicate<String> predicate) {
        var kept = paths.stream().filter(predicate).collect(Collectors.toCollection(TreeSet::new));
        return kept.isEmpty() ? EMPTY : new FieldPathSet(kept);
    }

    public boolean contains(String path) {
        return paths.contains(path);
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public int size() {
        return paths.size();
    }

    /**
     * @return the paths in sorted order
     */
    public List<String> paths() {
        return List.copyOf(paths);
    }

    public Stream<String> stream() {
        return paths.stream();
    }

    @Override
    public Iterator<String> iterator() {
        return paths.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldPathSet that)) {
            return false;
        }
        return paths.equals(that.paths);
    }

    @Override
    public int hashCode() {
        return paths.hashCode();
    }

    @Override
    public String toString() {
        return "FieldPathSet[" + toDisplayString() + "]";
    }
}
