package com.vidnyan.tabula.domain.def;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DefLineTypeTest {

    @Test
    void fromMarker_ShouldResolveKnownMarkers() {
        assertEquals(Optional.of(DefLineType.COMMENT), DefLineType.fromMarker(';'));
        assertEquals(Optional.of(DefLineType.LINE_VAR_DEF), DefLineType.fromMarker('L'));
        assertEquals(Optional.of(DefLineType.PROPORTION_RESULT), DefLineType.fromMarker('%'));
        assertEquals(Optional.empty(), DefLineType.fromMarker('Z'));
    }

    @Test
    void markers_ShouldBeUnique() {
        long distinct = Arrays.stream(DefLineType.values()).map(DefLineType::marker).distinct().count();
        assertEquals(DefLineType.values().length, distinct);
    }
}
