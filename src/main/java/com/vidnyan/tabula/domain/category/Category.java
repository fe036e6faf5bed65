package com.vidnyan.tabula.domain.category;

import com.vidnyan.tabula.domain.code.Code;
import com.vidnyan.tabula.domain.code.CodeRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A node of a CNV classification tree.
 *
 * <p>Immutable and thread-safe. Children are owned by value; the parent is only
 * known by its index. The union of the codes and ranges of the whole subtree is
 * computed once at construction, because a parent row usually declares nothing
 * itself and matches only through its descendants.
 */
public final class Category {

    private final int idx;
    private final String name;
    private final List<Code> codes;
    private final List<CodeRange> ranges;
    private final Integer parentIdx;
    private final List<Category> children;

    private final Set<Code> allCodes;
    private final List<CodeRange> allRanges;
    private final int hash;

    public Category(int idx, String name, List<Code> codes, List<CodeRange> ranges,
                    Integer parentIdx, List<Category> children) {
        this.idx = idx;
        this.name = Objects.requireNonNull(name, "name");
        this.codes = List.copyOf(codes);
        this.ranges = List.copyOf(ranges);
        this.parentIdx = parentIdx;
        this.children = List.copyOf(children);

        Set<Code> subtreeCodes = new LinkedHashSet<>(this.codes);
        Set<CodeRange> subtreeRanges = new LinkedHashSet<>(this.ranges);
        for (Category child : this.children) {
            subtreeCodes.addAll(child.allCodes);
            subtreeRanges.addAll(child.allRanges);
        }
        this.allCodes = Collections.unmodifiableSet(subtreeCodes);
        this.allRanges = List.copyOf(subtreeRanges);
        this.hash = Objects.hash(idx, name, this.codes, this.ranges, parentIdx, this.children);
    }

    /**
     * Create a root category without children.
     */
    public static Category of(int idx, String name, List<Code> codes, List<CodeRange> ranges) {
        return new Category(idx, name, codes, ranges, null, List.of());
    }

    public int idx() {
        return idx;
    }

    public String name() {
        return name;
    }

    /**
     * Codes declared on this category's own lines.
     */
    public List<Code> codes() {
        return codes;
    }

    /**
     * Ranges declared on this category's own lines.
     */
    public List<CodeRange> ranges() {
        return ranges;
    }

    public OptionalInt parentIdx() {
        return parentIdx == null ? OptionalInt.empty() : OptionalInt.of(parentIdx);
    }

    public List<Category> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Codes of this category and all its descendants.
     */
    public Set<Code> allCodes() {
        return allCodes;
    }

    /**
     * Ranges of this category and all its descendants.
     */
    public List<CodeRange> allRanges() {
        return allRanges;
    }

    /**
     * This category followed by its descendants, in pre-order.
     */
    public Stream<Category> descendants() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Category::descendants));
    }

    /**
     * Check whether the code belongs to this category or any descendant.
     */
    public boolean contains(Code code) {
        if (allCodes.contains(code)) {
            return true;
        }
        for (CodeRange range : allRanges) {
            if (range.contains(code)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Root of this subtree when it contains the code, i.e. this node itself.
     *
     * <p>The answer is relative to the node it is called on: on a child node it
     * never climbs to the forest root. Use {@link CategorySet#findRoot(Code)} for
     * the root category of the whole table.
     */
    public Optional<Category> findRoot(Code code) {
        return contains(code) ? Optional.of(this) : Optional.empty();
    }

    public Optional<Category> findRoot(int code) {
        return findRoot(Code.of(code));
    }

    public Optional<Category> findRoot(String code) {
        return findRoot(Code.of(code));
    }

    /**
     * Most specific category containing the code.
     * Children are searched first; this node's own codes act as a fallback below them.
     */
    public Optional<Category> findLeaf(Code code) {
        if (!contains(code)) {
            return Optional.empty();
        }
        for (Category child : children) {
            if (child.contains(code)) {
                return child.findLeaf(code);
            }
        }
        return Optional.of(this);
    }

    public Optional<Category> findLeaf(int code) {
        return findLeaf(Code.of(code));
    }

    public Optional<Category> findLeaf(String code) {
        return findLeaf(Code.of(code));
    }

    /**
     * Chain from this category down to {@link #findLeaf(Code)}, inclusive.
     */
    public Optional<List<Category>> findPath(Code code) {
        if (!contains(code)) {
            return Optional.empty();
        }
        List<Category> path = new ArrayList<>();
        Category current = this;
        path.add(current);
        while (current != null) {
            Category next = null;
            for (Category child : current.children) {
                if (child.contains(code)) {
                    next = child;
                    path.add(child);
                    break;
                }
            }
            current = next;
        }
        return Optional.of(List.copyOf(path));
    }

    public Optional<List<Category>> findPath(int code) {
        return findPath(Code.of(code));
    }

    public Optional<List<Category>> findPath(String code) {
        return findPath(Code.of(code));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Category other)) return false;
        return idx == other.idx
                && hash == other.hash
                && name.equals(other.name)
                && codes.equals(other.codes)
                && ranges.equals(other.ranges)
                && Objects.equals(parentIdx, other.parentIdx)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "Category(" + idx + ", '" + name + "', codes=" + codes + ", ranges=" + ranges
                + (parentIdx != null ? ", parent=" + parentIdx : "")
                + (children.isEmpty() ? "" : ", children=" + children.size())
                + ")";
    }
}
