package com.vidnyan.tabula.domain.category;

import com.vidnyan.tabula.domain.cnv.CnvParser;
import com.vidnyan.tabula.domain.code.Code;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A parsed CNV document: the forest of root categories plus lookup by code and by index.
 * Immutable and thread-safe.
 */
public final class CategorySet {

    /**
     * Encoding the CNV tables are published in.
     */
    public static final Charset CNV_CHARSET = StandardCharsets.ISO_8859_1;

    private final int declaredCount;
    private final int codeLength;
    private final boolean letterCodes;
    private final List<Category> categories;
    private final Map<Integer, Category> flatCategories;

    public CategorySet(int declaredCount, int codeLength, boolean letterCodes, List<Category> categories) {
        this.declaredCount = declaredCount;
        this.codeLength = codeLength;
        this.letterCodes = letterCodes;
        this.categories = List.copyOf(categories);

        // pre-order, roots in declaration order; a repeated index keeps the last node seen
        Map<Integer, Category> flat = new TreeMap<>();
        this.categories.stream()
                .flatMap(Category::descendants)
                .forEach(c -> flat.put(c.idx(), c));
        this.flatCategories = Collections.unmodifiableMap(flat);
    }

    /**
     * Parse the text of a CNV document.
     */
    public static CategorySet fromCnv(String contents) {
        return CnvParser.parse(contents);
    }

    /**
     * Read and parse a CNV file in ISO-8859-1.
     */
    public static CategorySet fromCnvFile(Path path) {
        return CnvParser.parseFile(path, CNV_CHARSET);
    }

    public static CategorySet fromCnvFile(Path path, Charset charset) {
        return CnvParser.parseFile(path, charset);
    }

    public int declaredCount() {
        return declaredCount;
    }

    public int codeLength() {
        return codeLength;
    }

    public boolean letterCodes() {
        return letterCodes;
    }

    /**
     * Root categories, in declaration order.
     */
    public List<Category> categories() {
        return categories;
    }

    /**
     * Number of root categories.
     */
    public int size() {
        return categories.size();
    }

    /**
     * Every category of the forest, keyed and ordered by index.
     */
    public Map<Integer, Category> flatCategories() {
        return flatCategories;
    }

    /**
     * Coerce a raw code read from a data file according to this table's code mode.
     */
    public Code parseCode(String raw) {
        return Code.parse(raw, letterCodes);
    }

    /**
     * Root category containing the code.
     */
    public Optional<Category> findRoot(Code code) {
        for (Category root : categories) {
            if (root.contains(code)) {
                return Optional.of(root);
            }
        }
        return Optional.empty();
    }

    public Optional<Category> findRoot(int code) {
        return findRoot(Code.of(code));
    }

    public Optional<Category> findRoot(String code) {
        return findRoot(Code.of(code));
    }

    /**
     * Most specific category containing the code.
     */
    public Optional<Category> findLeaf(Code code) {
        for (Category root : categories) {
            Optional<Category> leaf = root.findLeaf(code);
            if (leaf.isPresent()) {
                return leaf;
            }
        }
        return Optional.empty();
    }

    public Optional<Category> findLeaf(int code) {
        return findLeaf(Code.of(code));
    }

    public Optional<Category> findLeaf(String code) {
        return findLeaf(Code.of(code));
    }

    /**
     * Root-to-leaf chain of the categories containing the code.
     */
    public Optional<List<Category>> findPath(Code code) {
        for (Category root : categories) {
            Optional<List<Category>> path = root.findPath(code);
            if (path.isPresent()) {
                return path;
            }
        }
        return Optional.empty();
    }

    public Optional<List<Category>> findPath(int code) {
        return findPath(Code.of(code));
    }

    public Optional<List<Category>> findPath(String code) {
        return findPath(Code.of(code));
    }

    /**
     * Most specific category containing the code.
     *
     * @throws CategoryNotFoundException if no category contains it
     */
    public Category lookup(Code code) {
        return findLeaf(code).orElseThrow(() -> CategoryNotFoundException.forCode(code));
    }

    public Category lookup(int code) {
        return lookup(Code.of(code));
    }

    public Category lookup(String code) {
        return lookup(Code.of(code));
    }

    /**
     * Category with the given index, anywhere in the forest.
     *
     * @throws CategoryNotFoundException if no category has that index
     */
    public Category get(int idx) {
        Category category = flatCategories.get(idx);
        if (category == null) {
            throw CategoryNotFoundException.forIndex(idx);
        }
        return category;
    }

    /**
     * Ancestor chain, root first, of the category with the given index.
     *
     * @throws CategoryNotFoundException if no category has that index
     */
    public List<Category> pathOf(int idx) {
        Category target = get(idx);
        List<Category> path = new ArrayList<>();
        for (Category root : categories) {
            if (descend(root, target, path)) {
                return List.copyOf(path);
            }
        }
        throw CategoryNotFoundException.forIndex(idx);
    }

    private static boolean descend(Category current, Category target, List<Category> path) {
        path.add(current);
        if (current == target) {
            return true;
        }
        for (Category child : current.children()) {
            if (descend(child, target, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    @Override
    public String toString() {
        return "CategorySet(codeLength=" + codeLength + ", letterCodes=" + letterCodes
                + ", roots=" + categories.size() + ", categories=" + flatCategories.size() + ")";
    }
}
