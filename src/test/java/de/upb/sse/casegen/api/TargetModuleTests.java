package de.upb.sse.casegen.api;

import de.upb.sse.casegen.fixtures.*;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TargetModuleTests {

    @Test
    @DisplayName("Utility classes contribute functions, other classes are tested as classes")
    void classification() {
        TargetModule module = TargetModule.of("samples", MathFunctions.class, BankAccount.class, StringUtils.class);

        assertEquals("samples", module.name);
        assertEquals(List.of(BankAccount.class), module.classes);
        assertTrue(module.functions.containsKey("divide"));
        assertTrue(module.functions.containsKey("reverse"));
        assertFalse(module.functions.containsKey("deposit"));
    }

    @Test
    @DisplayName("Overloaded functions are keyed by parameter list")
    void overload_keys() {
        TargetModule module = TargetModule.of("math", MathFunctions.class);

        assertTrue(module.functions.containsKey("scale(int)"));
        assertTrue(module.functions.containsKey("scale(double)"));
        assertFalse(module.functions.containsKey("scale"));
    }

    @Test
    @DisplayName("Function holders")
    void function_holders() {
        assertTrue(TargetModule.isFunctionHolder(MathFunctions.class));
        assertTrue(TargetModule.isFunctionHolder(Looper.class));
        assertFalse(TargetModule.isFunctionHolder(Counter.class));
        assertFalse(TargetModule.isFunctionHolder(Priority.class));
        assertFalse(TargetModule.isFunctionHolder(Runnable.class));
    }

    @Test
    @DisplayName("Only static methods can be registered as functions")
    void builder_rejects_instance_methods() throws NoSuchMethodException {
        TargetModule.Builder builder = TargetModule.builder("manual");
        assertThrows(IllegalArgumentException.class,
                () -> builder.function(Counter.class.getMethod("increment")));

        TargetModule module = builder.function(MathFunctions.class.getMethod("answer")).classUnderTest(Counter.class).build();
        assertEquals(List.of("answer"), List.copyOf(module.functions.keySet()));
        assertEquals(List.of(Counter.class), module.classes);
    }
}
