package de.upb.sse.casegen.analysis;

import de.upb.sse.casegen.fixtures.*;
import de.upb.sse.casegen.model.ClassDescription;
import de.upb.sse.casegen.model.MethodDescriptor;
import de.upb.sse.casegen.model.PropertyDescriptor;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class StructureAnalyzerTests {
    private StructureAnalyzer analyzer;

    @BeforeEach
    void setup() {
        analyzer = new StructureAnalyzer();
    }

    @Test
    @DisplayName("Ancestor chain: class, superclasses, then interfaces")
    void linearize() {
        assertEquals(List.of(Rectangle.class, Shape.class, Comparable.class), StructureAnalyzer.linearize(Rectangle.class));
        assertEquals(List.of(Counter.class), StructureAnalyzer.linearize(Counter.class));
    }

    @Test
    @DisplayName("BankAccount members land in their buckets")
    void bank_account_buckets() {
        ClassDescription description = analyzer.analyze(BankAccount.class);

        assertFalse(description.isFailed());
        assertEquals("BankAccount", description.name);
        assertTrue(description.baseClasses.isEmpty());
        assertFalse(description.noArgConstructor);
        assertEquals(List.of("owner", "balance"), description.getConstructor().orElseThrow().parameterNames());

        assertEquals(List.of("deposit", "withdraw"), new ArrayList<>(description.methods.keySet()));
        assertEquals(Set.of("empty"), description.classMethods.keySet());
        assertEquals(Set.of("interest"), description.staticMethods.keySet());
        assertEquals(List.of("balance", "owner"), new ArrayList<>(description.properties.keySet()));
        assertEquals(Set.of("toString"), description.specialMethods.keySet());

        assertFalse(description.properties.get("balance").hasSetter());
        assertTrue(description.properties.get("owner").hasSetter());
        assertEquals(Optional.of("class_methods"), description.categoryOf("empty"));
    }

    @Test
    @DisplayName("Members are attributed to the most-derived definer")
    void inheritance() {
        ClassDescription description = analyzer.analyze(Rectangle.class);

        assertEquals(List.of("Shape", "Comparable"), description.baseClasses);
        assertEquals("Rectangle", description.methods.get("area").definedIn);
        assertEquals("Shape", description.methods.get("describe").definedIn);
        assertEquals("Rectangle", description.methods.get("perimeter").definedIn);

        PropertyDescriptor name = description.properties.get("name");
        assertEquals("Shape", name.definedIn);
        assertTrue(name.hasSetter());
        assertEquals("Rectangle", description.properties.get("width").definedIn);
    }

    @Test
    @DisplayName("Static members: factories are class-bound, the rest no-instance")
    void static_members() {
        ClassDescription description = analyzer.analyze(Rectangle.class);

        assertEquals(MethodDescriptor.Category.CLASS_BOUND, description.classMethods.get("ofSide").category);
        assertEquals("Rectangle", description.classMethods.get("ofSide").definedIn);
        // Shape.unit yields a Shape, so it is bound to Shape
        assertEquals("Shape", description.classMethods.get("unit").definedIn);
        assertTrue(description.staticMethods.containsKey("ratio"));
    }

    @Test
    @DisplayName("Overloaded names are keyed by parameter list")
    void overload_keys() {
        ClassDescription description = analyzer.analyze(Rectangle.class);

        assertTrue(description.methods.containsKey("scale(double)"));
        assertTrue(description.methods.containsKey("scale(double, double)"));
        assertFalse(description.methods.containsKey("scale"));
        assertEquals("scale", description.methods.get("scale(double)").name);
    }

    @Test
    @DisplayName("Special methods are recorded but kept apart")
    void special_methods() {
        ClassDescription description = analyzer.analyze(Rectangle.class);

        assertTrue(description.specialMethods.containsKey("toString"));
        assertTrue(description.specialMethods.containsKey("compareTo"));
        assertFalse(description.methods.containsKey("toString"));
    }

    @Test
    @DisplayName("Every member sits in exactly one bucket")
    void disjoint_buckets() {
        ClassDescription description = analyzer.analyze(Rectangle.class);
        List<String> keys = new ArrayList<>();
        keys.addAll(description.methods.keySet());
        keys.addAll(description.classMethods.keySet());
        keys.addAll(description.staticMethods.keySet());
        keys.addAll(description.properties.keySet());
        keys.addAll(description.specialMethods.keySet());
        assertEquals(new HashSet<>(keys).size(), keys.size(), keys.toString());
        assertEquals(0, analyzer.getFaultCount());
    }

    @Test
    @DisplayName("Primary constructor is the one with most parameters")
    void primary_constructor() {
        ClassDescription description = analyzer.analyze(Rectangle.class);
        assertTrue(description.noArgConstructor);
        assertEquals(List.of("width", "height"), description.constructor.parameterNames());
    }

    @Test
    @DisplayName("Bean property names")
    void property_names() throws NoSuchMethodException {
        assertEquals("balance", StructureAnalyzer.propertyName(BankAccount.class.getMethod("getBalance")));
        assertNull(StructureAnalyzer.propertyName(BankAccount.class.getMethod("deposit", double.class)));
        assertNull(StructureAnalyzer.propertyName(Counter.class.getMethod("increment")));
    }
}
