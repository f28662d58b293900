package de.upb.sse.casegen.values;

import de.upb.sse.casegen.fixtures.BankAccount;
import de.upb.sse.casegen.fixtures.Priority;
import de.upb.sse.casegen.model.TypeDescriptor;
import de.upb.sse.casegen.model.TypeDescriptor.CollectionKind;
import de.upb.sse.casegen.model.TypeDescriptor.ScalarKind;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ValueSynthesizerTests {
    private static final TypeDescriptor INT = TypeDescriptor.scalar(ScalarKind.INT, int.class);
    private static final TypeDescriptor STRING = TypeDescriptor.scalar(ScalarKind.STRING, String.class);

    private ValueSynthesizer values;

    @BeforeEach
    void setup() {
        values = new ValueSynthesizer(new Random(7));
    }

    @Test
    @DisplayName("Integer boundaries in sweep order")
    void int_boundaries() {
        assertEquals(List.of(0, 1, -1, 100, -100), values.boundaryValues(INT));
    }

    @Test
    @DisplayName("Boundaries keep the declared numeric type")
    void long_and_double_boundaries() {
        List<Object> longs = values.boundaryValues(TypeDescriptor.scalar(ScalarKind.LONG, long.class));
        assertEquals(List.of(0L, 1L, -1L, 100L, -100L), longs);
        List<Object> doubles = values.boundaryValues(TypeDescriptor.scalar(ScalarKind.DOUBLE, Double.class));
        assertEquals(List.of(0.0, 1.0, -1.0, 100.0, -100.0), doubles);
    }

    @Test
    @DisplayName("String boundaries include empty, blank and long strings")
    void string_boundaries() {
        List<Object> strings = values.boundaryValues(STRING);
        assertEquals(5, strings.size());
        assertEquals("", strings.get(0));
        assertTrue(strings.contains(" "));
        assertEquals("A".repeat(100), strings.get(4));
    }

    @Test
    @DisplayName("Enum boundaries are the first and last constant")
    void enum_boundaries() {
        TypeDescriptor priority = TypeDescriptor.scalar(ScalarKind.ENUM, Priority.class);
        assertEquals(List.of(Priority.LOW, Priority.HIGH), values.boundaryValues(priority));
    }

    @Test
    @DisplayName("Collection boundaries have zero, one and three elements")
    void list_boundaries() {
        TypeDescriptor list = TypeDescriptor.collection(CollectionKind.LIST, List.class, STRING);
        List<Object> boundaries = values.boundaryValues(list);
        assertEquals(List.of(List.of(), List.of("a"), List.of("a", "b", "c")), boundaries);
    }

    @Test
    @DisplayName("Array boundaries are arrays of the component type")
    void array_boundaries() {
        TypeDescriptor array = TypeDescriptor.collection(CollectionKind.ARRAY, int[].class, INT);
        List<Object> boundaries = values.boundaryValues(array);
        assertArrayEquals(new int[0], (int[]) boundaries.get(0));
        assertArrayEquals(new int[]{1, 2, 3}, (int[]) boundaries.get(2));
    }

    @Test
    @DisplayName("Concrete collection types are honoured")
    void concrete_collection_type() {
        TypeDescriptor treeSet = TypeDescriptor.collection(CollectionKind.SET, TreeSet.class, INT);
        for (Object value : values.boundaryValues(treeSet)) assertTrue(value instanceof TreeSet);
        assertTrue(values.randomValue(treeSet) instanceof TreeSet);
    }

    @Test
    @DisplayName("Untyped map boundaries")
    void untyped_map_boundaries() {
        TypeDescriptor map = TypeDescriptor.mapping(Map.class, TypeDescriptor.unknown(), TypeDescriptor.unknown());
        List<Object> boundaries = values.boundaryValues(map);
        assertEquals(Map.of(), boundaries.get(0));
        assertEquals(Map.of("key", "value"), boundaries.get(1));
        assertEquals(Map.of("a", 1, "b", 2), boundaries.get(2));
    }

    @Test
    @DisplayName("User classes and unknown types get null")
    void user_class_boundaries() {
        List<Object> expected = new ArrayList<>();
        expected.add(null);
        assertEquals(expected, values.boundaryValues(TypeDescriptor.userClass(BankAccount.class)));
        assertNull(values.randomValue(TypeDescriptor.unknown()));
    }

    @Test
    @DisplayName("Random integers stay within range")
    void random_int_range() {
        for (int i = 0; i < 500; i++) {
            int v = (Integer) values.randomValue(INT);
            assertTrue(v >= ValueSynthesizer.RANDOM_MIN && v <= ValueSynthesizer.RANDOM_MAX, "out of range: " + v);
        }
    }

    @Test
    @DisplayName("Random strings are alphanumeric and short")
    void random_strings() {
        for (int i = 0; i < 200; i++) {
            String s = (String) values.randomValue(STRING);
            assertTrue(s.length() <= ValueSynthesizer.MAX_STRING_LENGTH);
            assertTrue(s.chars().allMatch(Character::isLetterOrDigit), s);
        }
    }

    @Test
    @DisplayName("Same seed, same values")
    void seeded_values_repeat() {
        ValueSynthesizer first = new ValueSynthesizer(new Random(42));
        ValueSynthesizer second = new ValueSynthesizer(new Random(42));
        TypeDescriptor list = TypeDescriptor.collection(CollectionKind.LIST, List.class, INT);
        for (int i = 0; i < 20; i++) {
            assertEquals(first.randomValue(list), second.randomValue(list));
        }
    }

    @Test
    @DisplayName("Every call hands out fresh collections")
    void fresh_instances() {
        TypeDescriptor list = TypeDescriptor.collection(CollectionKind.LIST, List.class, INT);
        Object a = values.boundaryValues(list).get(1);
        Object b = values.boundaryValues(list).get(1);
        assertEquals(a, b);
        assertNotSame(a, b);
    }

    @Test
    @DisplayName("Interface types get a container that implements them")
    void declared_interface_types() {
        TypeDescriptor sortedMap = TypeDescriptor.mapping(SortedMap.class, STRING, INT);
        for (Object value : values.boundaryValues(sortedMap)) assertTrue(value instanceof SortedMap);
        assertTrue(values.randomValue(sortedMap) instanceof SortedMap);

        TypeDescriptor navigableSet = TypeDescriptor.collection(CollectionKind.SET, NavigableSet.class, INT);
        for (Object value : values.boundaryValues(navigableSet)) assertTrue(value instanceof NavigableSet);

        TypeDescriptor queue = TypeDescriptor.collection(CollectionKind.LIST, Queue.class, INT);
        TypeDescriptor deque = TypeDescriptor.collection(CollectionKind.LIST, Deque.class, INT);
        for (Object value : values.boundaryValues(queue)) assertTrue(value instanceof Queue);
        assertTrue(values.randomValue(deque) instanceof Deque);
        assertEquals(List.of(1, 2, 3), new ArrayList<>((Collection<?>) values.boundaryValues(deque).get(2)));
    }

    @Test
    @DisplayName("Elements a container refuses are left out")
    void refused_elements() {
        TypeDescriptor users = TypeDescriptor.collection(CollectionKind.LIST, Queue.class,
                TypeDescriptor.userClass(BankAccount.class));
        // user-class elements are null, which ArrayDeque does not take
        assertEquals(0, ((Collection<?>) values.boundaryValues(users).get(1)).size());
    }
}
