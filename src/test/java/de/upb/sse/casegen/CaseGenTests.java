package de.upb.sse.casegen;

import de.upb.sse.casegen.api.ModuleCases;
import de.upb.sse.casegen.api.TargetModule;
import de.upb.sse.casegen.configuration.CaseGenConfiguration;
import de.upb.sse.casegen.fixtures.*;
import de.upb.sse.casegen.model.ClassMethodTestCase;
import de.upb.sse.casegen.model.TestCase;
import de.upb.sse.casegen.oracle.InlineDeadline;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CaseGenTests {
    private CaseGen caseGen;

    @BeforeEach
    void setup() {
        CaseGenConfiguration config = new CaseGenConfiguration(3, 1234L);
        config.setPerCallDeadlineSeconds(2);
        caseGen = new CaseGen(config);
    }

    @Test
    @DisplayName("A module yields function and class cases")
    void generate_module() {
        ModuleCases cases = caseGen.generate(TargetModule.of("samples", MathFunctions.class, StringUtils.class, Rectangle.class));

        assertEquals("samples", cases.getModuleName());
        assertTrue(cases.getFunctionCases().containsKey("divide"));
        assertTrue(cases.getFunctionCases().containsKey("isPalindrome"));
        assertEquals(List.of("Rectangle"), new ArrayList<>(cases.getClassCases().keySet()));
        assertEquals(ClassMethodTestCase.CONSTRUCTOR, cases.getClassCases().get("Rectangle").keySet().iterator().next());
        assertEquals(cases.totalCases(), cases.getStats().totalRecorded());
        assertTrue(cases.totalCases() > 0);
    }

    @Test
    @DisplayName("A fixed seed reproduces the same cases")
    void deterministic() {
        TargetModule module = TargetModule.of("strings", StringUtils.class);
        List<String> first = describe(caseGen.generate(module));
        List<String> second = describe(caseGen.generate(module));
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Random case count follows the configuration")
    void random_case_count() throws NoSuchMethodException {
        List<TestCase> cases = caseGen.generateFunction(StringUtils.class.getMethod("reverse", String.class));
        long random = cases.stream().filter(c -> c.getDescription().startsWith("Test with inputs")).count();
        assertTrue(random <= 3);
        assertEquals(5, cases.size() - random);
    }

    @Test
    @DisplayName("Cases are handed to the sink")
    void sink() throws IOException {
        List<ModuleCases> received = new ArrayList<>();
        caseGen.generate(TargetModule.of("counter", Counter.class), received::add);

        assertEquals(1, received.size());
        assertTrue(received.get(0).getClassCases().containsKey("Counter"));
    }

    @Test
    @DisplayName("Inline deadline when preemption is turned off")
    void inline_deadline() {
        CaseGenConfiguration config = new CaseGenConfiguration();
        config.setPreemptiveDeadline(false);
        CaseGen inline = new CaseGen(config);
        assertTrue(inline.getDeadline() instanceof InlineDeadline);
        assertEquals(0, inline.generateClass(Value.class).get("getValue").get(0).getExpectedOutput());
    }

    @Test
    @DisplayName("Out-of-range configuration is rejected")
    void configuration_ranges() {
        CaseGenConfiguration config = new CaseGenConfiguration();
        assertThrows(IllegalArgumentException.class, () -> config.setNumRandomCases(0));
        assertThrows(IllegalArgumentException.class, () -> config.setNumRandomCases(11));
        assertThrows(IllegalArgumentException.class, () -> config.setPerCallDeadlineSeconds(0));
        config.setNumRandomCases(10);
        assertEquals(10, config.getNumRandomCases());
    }

    private static List<String> describe(ModuleCases cases) {
        return cases.getFunctionCases().entrySet().stream()
                .flatMap(e -> e.getValue().stream().map(c -> e.getKey() + ": " + c.getDescription() + " -> " + c.getExpectedOutput()))
                .collect(Collectors.toList());
    }
}
