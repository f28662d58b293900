package de.upb.sse.casegen.dedup;

import de.upb.sse.casegen.fixtures.Priority;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class EquivalenceFilterTests {

    private static List<Object> tuple(Object... values) {
        return Arrays.asList(values);
    }

    @Test
    @DisplayName("Numbers compare by value across boxed types")
    void numbers() {
        assertTrue(EquivalenceFilter.equivalent(tuple(0, 5), tuple(0L, (short) 5)));
        assertTrue(EquivalenceFilter.equivalent(tuple(1), tuple(1.0)));
        assertFalse(EquivalenceFilter.equivalent(tuple(1), tuple(1.5)));
    }

    @Test
    @DisplayName("null only matches null")
    void nulls() {
        assertTrue(EquivalenceFilter.equivalent(tuple((Object) null), tuple((Object) null)));
        assertFalse(EquivalenceFilter.equivalent(tuple((Object) null), tuple(0)));
        assertFalse(EquivalenceFilter.equivalent(tuple(""), tuple((Object) null)));
    }

    @Test
    @DisplayName("Scalars compare by equality")
    void scalars() {
        assertTrue(EquivalenceFilter.equivalent(tuple("a", true, 'c', Priority.LOW), tuple("a", true, 'c', Priority.LOW)));
        assertFalse(EquivalenceFilter.equivalent(tuple("a"), tuple("b")));
        assertFalse(EquivalenceFilter.equivalent(tuple(Priority.LOW), tuple(Priority.HIGH)));
    }

    @Test
    @DisplayName("Tuples of different length differ")
    void lengths() {
        assertFalse(EquivalenceFilter.equivalent(tuple(1, 2), tuple(1)));
    }

    @Test
    @DisplayName("Containers compare structurally")
    void containers() {
        assertTrue(EquivalenceFilter.equivalent(tuple(List.of(1, 2)), tuple(new ArrayList<>(List.of(1L, 2L)))));
        assertTrue(EquivalenceFilter.equivalent(tuple((Object) new int[]{1, 2}), tuple((Object) new int[]{1, 2})));
        assertFalse(EquivalenceFilter.equivalent(tuple((Object) new int[]{1, 2}), tuple((Object) new int[]{2, 1})));
        assertFalse(EquivalenceFilter.equivalent(tuple(List.of(1)), tuple(List.of(1, 1))));

        Map<String, Object> a = new LinkedHashMap<>();
        a.put("x", 1);
        Map<String, Object> b = new HashMap<>();
        b.put("x", 1L);
        assertTrue(EquivalenceFilter.equivalent(tuple(a), tuple(b)));
        b.put("y", 2);
        assertFalse(EquivalenceFilter.equivalent(tuple(a), tuple(b)));
    }

    @Test
    @DisplayName("Other objects fall back to their string form")
    void string_form() {
        Object failing = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("no string form");
            }
        };
        assertFalse(EquivalenceFilter.equivalent(tuple(failing), tuple(failing)));
        assertTrue(EquivalenceFilter.equivalent(tuple(new StringBuilder("x")), tuple(new StringBuilder("x"))));
    }

    @Test
    @DisplayName("Used inputs accept each equivalence class once")
    void used_inputs() {
        UsedInputs used = new UsedInputs();
        assertTrue(used.tryAdd(tuple(0, 5)));
        assertFalse(used.tryAdd(tuple(0L, 5L)));
        assertTrue(used.tryAdd(tuple(5, 0)));
        assertEquals(2, used.size());
    }

    @Test
    @DisplayName("Values of different shapes differ in both directions")
    void different_shapes() {
        assertFalse(EquivalenceFilter.equivalentValues(List.of("a"), "[a]"));
        assertFalse(EquivalenceFilter.equivalentValues("[a]", List.of("a")));
        assertFalse(EquivalenceFilter.equivalentValues(1, "1"));
        assertFalse(EquivalenceFilter.equivalentValues("1", 1));
        assertFalse(EquivalenceFilter.equivalentValues(Map.of(), List.of()));
        assertFalse(EquivalenceFilter.equivalentValues(new StringBuilder("x"), "x"));
        assertFalse(EquivalenceFilter.equivalentValues("x", new StringBuilder("x")));
        assertTrue(EquivalenceFilter.equivalentValues(new ArrayDeque<>(List.of(1, 2)), List.of(1L, 2L)));
    }
}
