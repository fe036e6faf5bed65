package com.vidnyan.tabula.domain.cnv;

import com.vidnyan.tabula.domain.category.Category;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assembles the category forest from decoded lines.
 *
 * <p>Two passes: records are first indexed by category index, merging
 * continuation lines, then every root is materialized by descending through the
 * records that name it as parent. Nodes are only ever created top-down, so the
 * result is a tree by construction; records that cannot be reached from a root
 * are reported as {@link InvalidHierarchyException}.
 */
public final class CategoryTreeBuilder {

    private final Map<Integer, RawCategoryRecord> records = new LinkedHashMap<>();
    private final Map<Integer, List<RawCategoryRecord>> childrenByParent = new LinkedHashMap<>();
    private final List<RawCategoryRecord> roots = new ArrayList<>();
    private final Set<Integer> materialized = new HashSet<>();

    private CategoryTreeBuilder() {
    }

    /**
     * Build the root categories, in order of first declaration.
     *
     * @throws InvalidHierarchyException on an undeclared parent or a parent cycle
     */
    public static List<Category> build(List<RawCategoryRecord> lines) {
        return new CategoryTreeBuilder().assemble(lines);
    }

    private List<Category> assemble(List<RawCategoryRecord> lines) {
        // Phase 1: merge continuation lines
        for (RawCategoryRecord line : lines) {
            records.merge(line.idx(), line, RawCategoryRecord::merge);
        }

        // Phase 2: partition roots and children
        for (RawCategoryRecord record : records.values()) {
            if (record.isRoot()) {
                roots.add(record);
            } else {
                childrenByParent.computeIfAbsent(record.parentIdx(), k -> new ArrayList<>()).add(record);
            }
        }

        // Phase 3: materialize top-down
        List<Category> result = roots.stream()
                .map(this::materialize)
                .collect(Collectors.toList());

        if (materialized.size() != records.size()) {
            records.values().stream()
                    .filter(r -> !materialized.contains(r.idx()))
                    .findFirst()
                    .ifPresent(this::reportUnreachable);
        }
        return result;
    }

    private Category materialize(RawCategoryRecord record) {
        materialized.add(record.idx());
        List<Category> children = childrenByParent.getOrDefault(record.idx(), List.of()).stream()
                .map(this::materialize)
                .collect(Collectors.toList());
        return new Category(record.idx(), record.name(), record.codes(), record.ranges(),
                record.parentIdx(), children);
    }

    private void reportUnreachable(RawCategoryRecord record) {
        Set<Integer> chain = new HashSet<>();
        RawCategoryRecord current = record;
        while (true) {
            chain.add(current.idx());
            RawCategoryRecord parent = records.get(current.parentIdx());
            if (parent == null) {
                throw new InvalidHierarchyException(InvalidHierarchyException.Reason.MISSING_PARENT,
                        current.idx(), "parent " + current.parentIdx() + " is not declared",
                        current.lineNumber());
            }
            if (chain.contains(parent.idx())) {
                throw new InvalidHierarchyException(InvalidHierarchyException.Reason.CYCLE,
                        parent.idx(), "parent chain leads back to itself",
                        parent.lineNumber());
            }
            current = parent;
        }
    }
}
