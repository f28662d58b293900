package de.upb.sse.casegen;

import de.upb.sse.casegen.analysis.StructureAnalyzer;
import de.upb.sse.casegen.api.CaseSink;
import de.upb.sse.casegen.api.ModuleCases;
import de.upb.sse.casegen.api.TargetModule;
import de.upb.sse.casegen.configuration.CaseGenConfiguration;
import de.upb.sse.casegen.model.ClassMethodTestCase;
import de.upb.sse.casegen.model.TestCase;
import de.upb.sse.casegen.oracle.Deadline;
import de.upb.sse.casegen.oracle.OracleRunner;
import de.upb.sse.casegen.stats.SynthesisStats;
import de.upb.sse.casegen.synthesis.CaseSynthesizer;
import de.upb.sse.casegen.values.ValueSynthesizer;
import lombok.Getter;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.logging.Logger;

public class CaseGen {
    private static final Logger logger = Logger.getLogger(CaseGen.class.getName());

    @Getter private final CaseGenConfiguration config;
    @Getter private final Deadline deadline;
    @Getter private SynthesisStats lastStats = new SynthesisStats();

    public CaseGen() {
        this(new CaseGenConfiguration());
    }

    public CaseGen(CaseGenConfiguration config) {
        this(config, Deadline.select(config));
    }

    public CaseGen(CaseGenConfiguration config, Deadline deadline) {
        this.config = Objects.requireNonNull(config, "config");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        logger.info(() -> ">> Using deadline " + deadline.getClass().getSimpleName() + " with " + config);
    }

    public ModuleCases generate(TargetModule module) {
        CaseSynthesizer synthesizer = newSynthesizer();
        logger.info(() -> "Generating cases for module " + module.name + ": " + module.functions.size()
                + " functions, " + module.classes.size() + " classes");

        Map<String, List<TestCase>> functionCases = new LinkedHashMap<>();
        for (Map.Entry<String, Method> function : module.functions.entrySet()) {
            functionCases.put(function.getKey(), synthesizer.synthesizeFunction(function.getValue()));
        }

        Map<String, Map<String, List<ClassMethodTestCase>>> classCases = new LinkedHashMap<>();
        for (Class<?> cls : module.classes) {
            String name = classCases.containsKey(cls.getSimpleName()) || cls.getSimpleName().isEmpty()
                    ? cls.getName()
                    : cls.getSimpleName();
            classCases.put(name, synthesizer.synthesizeClass(cls));
        }

        ModuleCases cases = new ModuleCases(module.name, functionCases, classCases, synthesizer.getStats());
        logger.info(() -> "Finished module " + module.name + " with " + cases.totalCases() + " cases, " + cases.getStats());
        return cases;
    }

    public void generate(TargetModule module, CaseSink sink) throws IOException {
        sink.write(generate(module));
    }

    public List<TestCase> generateFunction(Method function) {
        return newSynthesizer().synthesizeFunction(function);
    }

    public Map<String, List<ClassMethodTestCase>> generateClass(Class<?> cls) {
        return newSynthesizer().synthesizeClass(cls);
    }

    /** Fresh random source and statistics per run, so a fixed seed reproduces the same cases. */
    private CaseSynthesizer newSynthesizer() {
        Random random = config.getRandomSeed() == null ? new Random() : new Random(config.getRandomSeed());
        lastStats = new SynthesisStats();
        return new CaseSynthesizer(new ValueSynthesizer(random), new StructureAnalyzer(), new OracleRunner(deadline),
                config, lastStats);
    }
}
