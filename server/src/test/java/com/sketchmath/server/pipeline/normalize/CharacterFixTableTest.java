package com.sketchmath.server.pipeline.normalize;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CharacterFixTableTest {

    @Test
    public void testEntriesApplyInOrder() {
        CharacterFixTable table = CharacterFixTable.builder()
                .fix("a", "b")
                .fix("b", "c")
                .build();
        assertEquals(2, table.size());
        // Output of the first entry is rewritten by the second
        assertEquals("cc", table.apply("ab"));
    }

    @Test
    public void testProtectedWordsAreSkipped() {
        CharacterFixTable table = CharacterFixTable.builder().fix("o", "0").build();
        assertEquals("cos(0) + 0", table.applyOutside("cos(o) + o", Set.of("cos")));
        assertEquals("c0sine", table.applyOutside("cosine", Set.of("cos")));
        assertEquals("c0s", table.applyOutside("cos", Set.of()));
    }
}
