package org.minivect.codegen;

import org.junit.jupiter.api.Test;
import org.minivect.core.CodegenException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NameManglerTest {

    private final NameMangler mangler = new NameMangler("__mini_");

    @Test
    public void testPlainIdentifiersAreKept() {
        assertEquals("x", mangler.mangle("x"));
        assertEquals("loop_index2", mangler.mangle("loop_index2"));
        assertEquals("_private", mangler.mangle("_private"));
    }

    @Test
    public void testKeywordsAndReservedNamesAreEscaped() {
        assertEquals("__mini_int", mangler.mangle("int"));
        assertEquals("__mini_____x", mangler.mangle("__x"));
        assertEquals("__mini___Tmp", mangler.mangle("_Tmp"));
    }

    @Test
    public void testNonAsciiNamesAreEscaped() {
        assertEquals("__mini_caf_xe9_", mangler.mangle("caf\u00e9"));
    }

    @Test
    public void testCanonicallyEquivalentNamesShareOneName() {
        // precomposed and decomposed e-acute
        assertEquals(mangler.mangle("caf\u00e9"), mangler.mangle("cafe\u0301"));
    }

    @Test
    public void testDistinctNamesNeverCollide() {
        List<String> names = List.of("int", "__mini_int", "a_b", "a__b", "_int", "café", "caf_xe9_",
                "x", "__x", "_x", "été", "__mini_", "for", "__mini_for");
        Set<String> mangled = new HashSet<>();
        for (String name : names) {
            assertTrue(mangled.add(mangler.mangle(name)), "collision for " + name);
        }
    }

    @Test
    public void testManglingIsDeterministic() {
        NameMangler other = new NameMangler("__mini_");
        assertEquals(mangler.mangle("été"), other.mangle("été"));
    }

    @Test
    public void testNonIdentifiersAreRejected() {
        assertThrows(CodegenException.class, () -> mangler.mangle(""));
        assertThrows(CodegenException.class, () -> mangler.mangle(null));
        assertThrows(CodegenException.class, () -> mangler.mangle("a b"));
        assertThrows(CodegenException.class, () -> mangler.mangle("1st"));
        assertThrows(CodegenException.class, () -> mangler.mangle("a.b"));
    }

    @Test
    public void testInvalidPrefixIsRejected() {
        assertThrows(CodegenException.class, () -> new NameMangler("9bad"));
        assertThrows(CodegenException.class, () -> new NameMangler(""));
    }
}
