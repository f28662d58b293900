package de.upb.sse.casegen.api;

import de.upb.sse.casegen.model.ClassMethodTestCase;
import de.upb.sse.casegen.model.TestCase;
import de.upb.sse.casegen.stats.SynthesisStats;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything generated for one {@link TargetModule}: function name to cases, and class name to
 * member key to cases, with constructors under {@link ClassMethodTestCase#CONSTRUCTOR}.
 */
@Getter
@ToString
public final class ModuleCases {
    private final String moduleName;
    private final Map<String, List<TestCase>> functionCases;
    private final Map<String, Map<String, List<ClassMethodTestCase>>> classCases;
    @ToString.Exclude
    private final SynthesisStats stats;

    public ModuleCases(String moduleName, Map<String, List<TestCase>> functionCases,
                       Map<String, Map<String, List<ClassMethodTestCase>>> classCases, SynthesisStats stats) {
        this.moduleName = moduleName;
        this.functionCases = Collections.unmodifiableMap(functionCases);
        this.classCases = Collections.unmodifiableMap(classCases);
        this.stats = stats;
    }

    public int totalCases() {
        int total = functionCases.values().stream().mapToInt(List::size).sum();
        for (Map<String, List<ClassMethodTestCase>> members : classCases.values()) {
            total += members.values().stream().mapToInt(List::size).sum();
        }
        return total;
    }
}
