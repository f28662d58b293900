package de.upb.sse.casegen.oracle;

import de.upb.sse.casegen.configuration.CaseGenConfiguration;
import de.upb.sse.casegen.exceptions.CallRejectedException;
import de.upb.sse.casegen.fixtures.Looper;
import de.upb.sse.casegen.fixtures.MathFunctions;
import org.junit.jupiter.api.*;

import java.lang.reflect.Method;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class OracleRunnerTests {
    private OracleRunner runner;

    @BeforeEach
    void setup() {
        runner = new OracleRunner(new PreemptiveDeadline());
    }

    @AfterEach
    void clearProperty() {
        System.clearProperty(Deadline.PROPERTY);
    }

    private static TargetCall function(String name, Class<?>... parameterTypes) throws NoSuchMethodException {
        Method method = MathFunctions.class.getMethod(name, parameterTypes);
        return args -> method.invoke(null, args);
    }

    @Test
    @DisplayName("A returned value is the outcome")
    void returned() throws NoSuchMethodException {
        Outcome outcome = runner.invoke(function("divide", int.class, int.class), new Object[]{9, 3}, Duration.ofSeconds(1));
        assertEquals(Outcome.Kind.RETURNED, outcome.kind);
        assertEquals(3, outcome.value);
        assertNull(outcome.errorKind());
    }

    @Test
    @DisplayName("The target's own exception is reported, not the reflection wrapper")
    void raised() throws NoSuchMethodException {
        Outcome outcome = runner.invoke(function("divide", int.class, int.class), new Object[]{1, 0}, Duration.ofSeconds(1));
        assertEquals(Outcome.Kind.RAISED, outcome.kind);
        assertEquals(ArithmeticException.class, outcome.errorKind());
        assertNull(outcome.value);
    }

    @Test
    @DisplayName("A call that never returns times out near the deadline")
    void timed_out() throws NoSuchMethodException {
        Method spin = Looper.class.getMethod("spin");
        long start = System.nanoTime();
        Outcome outcome = runner.invoke(args -> spin.invoke(null, args), new Object[0], Duration.ofMillis(200));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(outcome.isTimedOut());
        assertTrue(elapsedMillis < 2000, "took " + elapsedMillis + "ms");
    }

    @Test
    @DisplayName("Errors other than exceptions are captured too")
    void raised_error() {
        Outcome outcome = runner.invoke(args -> {
            throw new StackOverflowError();
        }, new Object[0], Duration.ofSeconds(1));
        assertEquals(StackOverflowError.class, outcome.errorKind());
    }

    @Test
    @DisplayName("Inline deadline runs on the caller's thread")
    void inline() throws NoSuchMethodException {
        OracleRunner inline = new OracleRunner(new InlineDeadline());
        Thread caller = Thread.currentThread();
        Outcome thread = inline.invoke(args -> Thread.currentThread(), new Object[0], Duration.ofSeconds(1));
        assertSame(caller, thread.value);

        Outcome raised = inline.invoke(function("divide", int.class, int.class), new Object[]{1, 0}, Duration.ofSeconds(1));
        assertEquals(ArithmeticException.class, raised.errorKind());
        assertFalse(inline.getDeadline().isPreemptive());
    }

    @Test
    @DisplayName("Deadline is chosen from configuration and system property")
    void select() {
        CaseGenConfiguration config = new CaseGenConfiguration();
        assertTrue(Deadline.select(config) instanceof PreemptiveDeadline);

        config.setPreemptiveDeadline(false);
        assertTrue(Deadline.select(config) instanceof InlineDeadline);

        config.setPreemptiveDeadline(true);
        System.setProperty(Deadline.PROPERTY, "inline");
        assertTrue(Deadline.select(config) instanceof InlineDeadline);
    }

    @Test
    @DisplayName("An argument reflection refuses is not reported as the target's error")
    void rejected_by_reflection() throws NoSuchMethodException {
        TargetCall divide = TargetCall.reflective(function("divide", int.class, int.class));
        CallRejectedException rejected = assertThrows(CallRejectedException.class,
                () -> runner.invoke(divide, new Object[]{"nine", 3}, Duration.ofSeconds(1)));
        assertTrue(rejected.getCause() instanceof IllegalArgumentException);

        OracleRunner inline = new OracleRunner(new InlineDeadline());
        assertThrows(CallRejectedException.class, () -> inline.invoke(divide, new Object[]{1}, Duration.ofSeconds(1)));

        Outcome raised = runner.invoke(divide, new Object[]{1, 0}, Duration.ofSeconds(1));
        assertEquals(ArithmeticException.class, raised.errorKind());
    }
}
