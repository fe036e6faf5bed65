package com.vidnyan.tabula.domain.category;

import com.vidnyan.tabula.domain.code.Code;
import com.vidnyan.tabula.domain.code.IntRange;
import com.vidnyan.tabula.domain.code.StrRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CategoryTest {

    private final Category capital = new Category(355030, "Sao Paulo (capital)",
            List.of(Code.of(355030)), List.of(), 35, List.of());
    private final Category interior = new Category(359999, "Interior",
            List.of(), List.of(new IntRange(350000, 359999)), 35, List.of());
    private final Category saoPaulo = new Category(35, "Sao Paulo",
            List.of(), List.of(), 3, List.of(capital, interior));
    private final Category rio = new Category(33, "Rio de Janeiro",
            List.of(Code.of(330455)), List.of(new IntRange(330000, 339999)), 3, List.of());
    private final Category sudeste = new Category(3, "Sudeste",
            List.of(Code.of(0)), List.of(), null, List.of(saoPaulo, rio));

    @Test
    void contains_ShouldUseTheWholeSubtree() {
        assertTrue(sudeste.contains(Code.of(355030)));
        assertTrue(sudeste.contains(Code.of(351000)));
        assertTrue(sudeste.contains(Code.of(330455)));
        assertTrue(sudeste.contains(Code.of(0)));
        assertFalse(sudeste.contains(Code.of(410000)));
        assertFalse(saoPaulo.contains(Code.of(330455)));
    }

    @Test
    void allCodesAndRanges_ShouldBeTheUnionOfDescendants() {
        assertEquals(Set.of(Code.of(0), Code.of(355030), Code.of(330455)), sudeste.allCodes());
        assertEquals(List.of(new IntRange(350000, 359999), new IntRange(330000, 339999)), sudeste.allRanges());
        assertEquals(List.of(Code.of(0)), sudeste.codes());
        assertTrue(sudeste.ranges().isEmpty());
    }

    @Test
    void findLeaf_ShouldPreferChildrenOverOwnCodes() {
        // the capital is listed explicitly and also falls in the interior range
        assertEquals(capital, sudeste.findLeaf(Code.of(355030)).orElseThrow());
        assertEquals(interior, sudeste.findLeaf(Code.of(351000)).orElseThrow());
        assertEquals(sudeste, sudeste.findLeaf(Code.of(0)).orElseThrow());
        assertEquals(Optional.empty(), sudeste.findLeaf(Code.of(1)));
    }

    @Test
    void findPath_ShouldListAncestorsTopDown() {
        assertEquals(List.of(sudeste, saoPaulo, interior), sudeste.findPath(Code.of(351000)).orElseThrow());
        assertEquals(List.of(sudeste, rio), sudeste.findPath(Code.of(330455)).orElseThrow());
        assertEquals(List.of(sudeste), sudeste.findPath(Code.of(0)).orElseThrow());
        assertEquals(Optional.empty(), sudeste.findPath(Code.of(1)));
    }

    @Test
    void findRoot_ShouldReturnTheSubtreeRootWhenItMatches() {
        assertEquals(sudeste, sudeste.findRoot(Code.of(355030)).orElseThrow());
        assertEquals(Optional.empty(), saoPaulo.findRoot(Code.of(330455)));
    }

    @Test
    void findRoot_OnChildNode_ShouldNotClimbToTheForestRoot() {
        assertEquals(saoPaulo, saoPaulo.findRoot(Code.of(355030)).orElseThrow());
        assertEquals(interior, interior.findRoot(351000).orElseThrow());
    }

    @Test
    void lookups_ShouldAcceptIntAndStringCodes() {
        Category letters = Category.of(1, "Norte", List.of(Code.of("AM"), Code.of("PA")), List.of(new StrRange("A0", "A9")));

        assertEquals(sudeste, sudeste.findRoot(330455).orElseThrow());
        assertEquals(Optional.empty(), sudeste.findRoot(1));
        assertEquals(capital, sudeste.findLeaf(355030).orElseThrow());
        assertEquals(Optional.empty(), sudeste.findLeaf("355030"));
        assertEquals(List.of(sudeste, saoPaulo, interior), sudeste.findPath(351000).orElseThrow());
        assertEquals(Optional.empty(), sudeste.findPath(1));

        assertEquals(letters, letters.findRoot("AM").orElseThrow());
        assertEquals(letters, letters.findLeaf("A5").orElseThrow());
        assertEquals(List.of(letters), letters.findPath("PA").orElseThrow());
        assertEquals(Optional.empty(), letters.findLeaf("RJ"));
    }

    @Test
    void descendants_ShouldBePreOrder() {
        assertEquals(List.of(3, 35, 355030, 359999, 33), sudeste.descendants().map(Category::idx).toList());
        assertFalse(sudeste.isLeaf());
        assertTrue(rio.isLeaf());
    }

    @Test
    void stringCodes_ShouldNotMatchIntegerRanges() {
        Category mixed = Category.of(28, "Ignorado/exterior", List.of(Code.of("  ")), List.of(new IntRange(0, 99)));

        assertTrue(mixed.contains(Code.of("  ")));
        assertTrue(mixed.contains(Code.of(50)));
        assertFalse(mixed.contains(Code.of("50")));
    }

    @Test
    void equality_ShouldCoverChildren() {
        Category copy = new Category(35, "Sao Paulo", List.of(), List.of(), 3, List.of(capital, interior));
        Category pruned = new Category(35, "Sao Paulo", List.of(), List.of(), 3, List.of(capital));

        assertEquals(saoPaulo, copy);
        assertEquals(saoPaulo.hashCode(), copy.hashCode());
        assertNotEquals(saoPaulo, pruned);
        assertNotEquals(Category.of(1, "A", List.of(Code.of("1")), List.of()),
                Category.of(1, "A", List.of(Code.of(1)), List.of()));
        assertNotEquals(Category.of(1, "A", List.of(), List.of(new StrRange("1", "2"))),
                Category.of(1, "A", List.of(), List.of(new IntRange(1, 2))));
    }

    @Test
    void collections_ShouldBeUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> sudeste.children().add(rio));
        assertThrows(UnsupportedOperationException.class, () -> sudeste.allCodes().add(Code.of(9)));
    }
}
