package de.upb.sse.casegen.synthesis;

import de.upb.sse.casegen.analysis.StructureAnalyzer;
import de.upb.sse.casegen.configuration.CaseGenConfiguration;
import de.upb.sse.casegen.dedup.UsedInputs;
import de.upb.sse.casegen.exceptions.CallRejectedException;
import de.upb.sse.casegen.model.*;
import de.upb.sse.casegen.model.ClassMethodTestCase.AccessorKind;
import de.upb.sse.casegen.oracle.OracleRunner;
import de.upb.sse.casegen.oracle.Outcome;
import de.upb.sse.casegen.oracle.TargetCall;
import de.upb.sse.casegen.stats.SynthesisStats;
import de.upb.sse.casegen.values.ValueSynthesizer;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;

/**
 * Drives generation for one callable at a time: proposes candidates (boundary sweep first,
 * then random tuples), drops those equivalent to a tuple already tried, runs the rest through
 * the {@link OracleRunner} and records what came back.
 *
 * Candidates are run strictly one after the other. Instance members never share an instance:
 * the {@link InstanceRecipe} is replayed inside every oracle call.
 */
public class CaseSynthesizer {
    private static final Logger logger = Logger.getLogger(CaseSynthesizer.class.getName());

    private final ValueSynthesizer values;
    private final StructureAnalyzer analyzer;
    private final OracleRunner oracle;
    private final CaseGenConfiguration config;
    private final SynthesisStats stats;

    public CaseSynthesizer(ValueSynthesizer values, StructureAnalyzer analyzer, OracleRunner oracle,
                           CaseGenConfiguration config, SynthesisStats stats) {
        this.values = values;
        this.analyzer = analyzer;
        this.oracle = oracle;
        this.config = config;
        this.stats = stats;
    }

    public SynthesisStats getStats() {
        return stats;
    }

    public List<TestCase> synthesizeFunction(Method function) {
        accessible(function);
        List<ParameterDescriptor> parameters = analyzer.describeParameters(function);
        TargetCall call = TargetCall.reflective(args -> function.invoke(null, args));

        List<TestCase> cases = new ArrayList<>();
        UsedInputs used = new UsedInputs();
        for (Candidate candidate : candidates(parameters, null)) {
            String description = candidate.kind == Candidate.Kind.BOUNDARY
                    ? "Edge case for " + candidate.sweptParameter + "=" + Candidate.render(candidate.sweptValue)
                    : "Test" + candidate.detail();
            run(function.getName(), call, candidate, used, description,
                    (inputs, outcome, text) -> cases.add(new TestCase(inputs, outcome.value, text, outcome.errorKind())));
        }
        logger.info(() -> "Generated " + cases.size() + " cases for " + function.getName());
        return cases;
    }

    public Map<String, List<ClassMethodTestCase>> synthesizeClass(Class<?> cls) {
        int faultsBefore = analyzer.getFaultCount();
        ClassDescription description = analyzer.analyze(cls);
        stats.addAnalysisFaults(analyzer.getFaultCount() - faultsBefore);
        return synthesizeClass(cls, description);
    }

    /**
     * Cases per member key, in the order: constructor, instance methods, class-bound methods,
     * no-instance methods, then getter and setter of each property.
     */
    public Map<String, List<ClassMethodTestCase>> synthesizeClass(Class<?> cls, ClassDescription description) {
        Map<String, List<ClassMethodTestCase>> cases = new LinkedHashMap<>();
        if (description.isFailed()) {
            logger.warning(() -> "No cases for " + description.name + ": " + description.error);
            return cases;
        }

        if (isInstantiable(cls) && description.constructor != null) {
            cases.put(ClassMethodTestCase.CONSTRUCTOR, constructorCases(cls, description));
        }

        InstanceRecipe recipe = prepareInstance(cls, description);
        if (!recipe.isUsable() && !recipe.hasRecordableFailure() && !description.methods.isEmpty()) {
            logger.warning(() -> "Skipping instance methods " + description.methods.keySet() + " of " + description.name
                    + ": " + recipe.getReason());
        }
        for (MethodDescriptor method : description.methods.values()) {
            if (recipe.isUsable()) {
                cases.put(method.key, methodCases(cls, method, recipe, description));
            } else if (recipe.hasRecordableFailure()) {
                cases.put(method.key, List.of(constructionFailure(cls, method, recipe)));
            }
        }
        for (MethodDescriptor method : description.classMethods.values()) {
            cases.put(method.key, methodCases(cls, method, recipe, description));
        }
        for (MethodDescriptor method : description.staticMethods.values()) {
            cases.put(method.key, methodCases(cls, method, recipe, description));
        }

        if (!recipe.isUsable() && !description.properties.isEmpty()) {
            logger.warning(() -> "Skipping properties " + description.properties.keySet() + " of " + description.name
                    + ": no working instance (" + recipe.getReason() + ")");
        } else {
            for (PropertyDescriptor property : description.properties.values()) {
                cases.put(property.getter.getName(), getterCases(cls, property, recipe));
                if (property.hasSetter()) {
                    cases.put(property.setter.getName(), setterCases(cls, property, recipe, description));
                }
            }
        }

        logger.info(() -> "Generated " + cases.values().stream().mapToInt(List::size).sum() + " cases for "
                + cases.size() + " members of " + description.name);
        return cases;
    }

    private List<ClassMethodTestCase> constructorCases(Class<?> cls, ClassDescription description) {
        ConstructorDescriptor constructor = description.constructor;
        accessible(constructor.constructor);
        TargetCall call = TargetCall.reflective(args -> {
            constructor.constructor.newInstance(args);
            return null;
        });

        List<ClassMethodTestCase> cases = new ArrayList<>();
        UsedInputs used = new UsedInputs();
        for (Candidate candidate : candidates(constructor.parameters, description)) {
            run(description.name + "." + ClassMethodTestCase.CONSTRUCTOR, call, candidate, used, "Constructor" + candidate.detail(),
                    (inputs, outcome, text) -> cases.add(ClassMethodTestCase.constructorCase(cls, inputs, text, outcome.errorKind())));
        }
        return cases;
    }

    private List<ClassMethodTestCase> methodCases(Class<?> cls, MethodDescriptor descriptor, InstanceRecipe recipe,
                                                  ClassDescription description) {
        Method method = descriptor.method;
        accessible(method);
        TargetCall call = TargetCall.reflective(descriptor.isStatic()
                ? args -> method.invoke(null, args)
                : args -> method.invoke(recipe.newInstance(), args));
        List<Object> constructorInputs = descriptor.isStatic() ? List.of() : recipe.getArguments();
        String subject = subjectOf(descriptor) + " " + descriptor.name;

        List<ClassMethodTestCase> cases = new ArrayList<>();
        UsedInputs used = new UsedInputs();
        for (Candidate candidate : candidates(descriptor.parameters, description)) {
            run(description.name + "." + descriptor.key, call, candidate, used, subject + candidate.detail(),
                    (inputs, outcome, text) -> cases.add(new ClassMethodTestCase(cls, constructorInputs, descriptor.name,
                            inputs, outcome.value, text, outcome.errorKind(), AccessorKind.NONE)));
        }
        return cases;
    }

    private List<ClassMethodTestCase> getterCases(Class<?> cls, PropertyDescriptor property, InstanceRecipe recipe) {
        Method getter = property.getter;
        accessible(getter);
        TargetCall call = TargetCall.reflective(args -> getter.invoke(recipe.newInstance()));

        List<ClassMethodTestCase> cases = new ArrayList<>();
        run(property.definedIn + "." + property.name, call, Candidate.noArgs(), new UsedInputs(),
                "Property getter for " + property.name,
                (inputs, outcome, text) -> cases.add(new ClassMethodTestCase(cls, recipe.getArguments(), getter.getName(),
                        inputs, outcome.value, text, outcome.errorKind(), AccessorKind.GETTER)));
        return cases;
    }

    /** Writes each value through the setter and records what the getter reads back. */
    private List<ClassMethodTestCase> setterCases(Class<?> cls, PropertyDescriptor property, InstanceRecipe recipe,
                                                  ClassDescription description) {
        Method getter = property.getter;
        Method setter = property.setter;
        accessible(getter);
        accessible(setter);
        TargetCall call = TargetCall.reflective(args -> {
            Object instance = recipe.newInstance();
            setter.invoke(instance, args);
            return getter.invoke(instance);
        });

        List<ClassMethodTestCase> cases = new ArrayList<>();
        UsedInputs used = new UsedInputs();
        List<ParameterDescriptor> value = List.of(new ParameterDescriptor("value", property.type));
        for (Candidate candidate : candidates(value, description)) {
            String text = "Property setter for " + property.name + " with value=" + Candidate.render(candidate.inputs.get(0));
            run(property.definedIn + "." + setter.getName(), call, candidate, used, text,
                    (inputs, outcome, t) -> cases.add(new ClassMethodTestCase(cls, recipe.getArguments(), setter.getName(),
                            inputs, outcome.value, t, outcome.errorKind(), AccessorKind.SETTER)));
        }
        return cases;
    }

    private ClassMethodTestCase constructionFailure(Class<?> cls, MethodDescriptor method, InstanceRecipe recipe) {
        Throwable failure = recipe.getFailure();
        stats.incrementRecordedFailures();
        String text = "Instance method " + method.name + " - constructor fails with "
                + failure.getClass().getSimpleName() + ": " + failure.getMessage();
        return new ClassMethodTestCase(cls, recipe.getArguments(), method.name, List.of(), null, text,
                failure.getClass(), AccessorKind.NONE);
    }

    /**
     * No-arg construction first, then the primary constructor with synthesized arguments. An
     * error raised by the class is kept for the instance-method cases; a timeout or a call refused
     * by reflection leaves the class without a working instance and nothing to record.
     */
    private InstanceRecipe prepareInstance(Class<?> cls, ClassDescription description) {
        if (!isInstantiable(cls)) {
            return failedRecipe(description, List.of(), new InstantiationException(cls.getName() + " is abstract"));
        }

        Throwable failure = new NoSuchMethodException(cls.getName() + " has no public constructor");
        if (description.noArgConstructor) {
            try {
                Constructor<?> noArg = cls.getConstructor();
                accessible(noArg);
                Outcome outcome = oracle.invoke(TargetCall.reflective(noArg::newInstance), new Object[0], deadline());
                if (outcome.kind == Outcome.Kind.RETURNED) return InstanceRecipe.of(noArg, List.of());
                if (outcome.isTimedOut()) return timedOutRecipe(description, List.of());
                failure = outcome.error;
            } catch (NoSuchMethodException e) {
                failure = e;
            } catch (CallRejectedException e) {
                return rejectedRecipe(description, List.of(), e);
            }
        }

        List<Object> arguments = new ArrayList<>();
        ConstructorDescriptor primary = description.constructor;
        if (primary != null && !primary.parameters.isEmpty()) {
            for (ParameterDescriptor p : primary.parameters) arguments.add(typicalValue(p.type, description));
            accessible(primary.constructor);
            try {
                Outcome outcome = oracle.invoke(TargetCall.reflective(primary.constructor::newInstance),
                        Candidate.snapshot(arguments).toArray(), deadline());
                if (outcome.kind == Outcome.Kind.RETURNED) return InstanceRecipe.of(primary.constructor, arguments);
                if (outcome.isTimedOut()) return timedOutRecipe(description, arguments);
                failure = outcome.error;
            } catch (CallRejectedException e) {
                return rejectedRecipe(description, arguments, e);
            }
        }
        return failedRecipe(description, arguments, failure);
    }

    private InstanceRecipe failedRecipe(ClassDescription description, List<Object> arguments, Throwable failure) {
        stats.incrementConstructionFailures();
        logger.warning(() -> "Cannot construct " + description.name + " (" + failure.getClass().getSimpleName() + ": "
                + failure.getMessage() + "), instance members are not exercised");
        return InstanceRecipe.failed(arguments, failure);
    }

    private InstanceRecipe timedOutRecipe(ClassDescription description, List<Object> arguments) {
        String reason = "not constructed within " + config.getPerCallDeadlineSeconds() + "s";
        stats.recordTimeout(description.name + "." + ClassMethodTestCase.CONSTRUCTOR + ": working instance " + reason);
        logger.warning(() -> description.name + " was " + reason + ", instance members are not exercised");
        return InstanceRecipe.unavailable(arguments, reason);
    }

    private InstanceRecipe rejectedRecipe(ClassDescription description, List<Object> arguments, CallRejectedException e) {
        stats.incrementRejectedCalls();
        logger.warning(() -> "Cannot construct " + description.name + ": " + e.getMessage());
        return InstanceRecipe.unavailable(arguments, e.getMessage());
    }

    /**
     * Boundary candidates, parameter-major and boundary-value-minor, followed by the random
     * tuples. A callable without parameters has exactly one candidate.
     */
    private List<Candidate> candidates(List<ParameterDescriptor> parameters, ClassDescription self) {
        List<Candidate> candidates = new ArrayList<>();
        if (parameters.isEmpty()) {
            candidates.add(Candidate.noArgs());
            return candidates;
        }

        for (int i = 0; i < parameters.size(); i++) {
            ParameterDescriptor swept = parameters.get(i);
            for (Object boundary : values.boundaryValues(swept.type)) {
                List<Object> inputs = new ArrayList<>(parameters.size());
                for (int j = 0; j < parameters.size(); j++) {
                    inputs.add(j == i ? boundary : typicalValue(parameters.get(j).type, self));
                }
                candidates.add(Candidate.boundary(inputs, swept.name, boundary));
            }
        }

        for (int n = 0; n < config.getNumRandomCases(); n++) {
            List<Object> inputs = new ArrayList<>(parameters.size());
            for (ParameterDescriptor p : parameters) inputs.add(typicalValue(p.type, self));
            candidates.add(Candidate.random(inputs));
        }
        return candidates;
    }

    /**
     * A random value of the type. A parameter of the class under test itself is filled with an
     * instance built from that class's constructor; inside that construction the class is no
     * longer tracked, so nested self references fall back to {@code null}.
     */
    private Object typicalValue(TypeDescriptor type, ClassDescription self) {
        if (self != null && self.constructor != null && type.refersTo(self.constructor.constructor.getDeclaringClass())) {
            return constructNested(self.constructor);
        }
        return values.randomValue(type);
    }

    private Object constructNested(ConstructorDescriptor constructor) {
        Object[] args = new Object[constructor.parameters.size()];
        for (int i = 0; i < args.length; i++) args[i] = typicalValue(constructor.parameters.get(i).type, null);

        try {
            Outcome outcome = oracle.invoke(TargetCall.reflective(constructor.constructor::newInstance), args, deadline());
            if (outcome.kind == Outcome.Kind.RETURNED) return outcome.value;
            logger.fine(() -> "Cannot build a nested " + constructor.definedIn + " (" + outcome + "), using null");
        } catch (CallRejectedException e) {
            logger.fine(() -> "Cannot build a nested " + constructor.definedIn + " (" + e.getMessage() + "), using null");
        }
        return null;
    }

    private void run(String callable, TargetCall call, Candidate candidate, UsedInputs used, String description,
                     Recorder recorder) {
        List<Object> inputs = Candidate.snapshot(candidate.inputs);
        if (!used.tryAdd(inputs)) {
            stats.incrementDuplicatesSkipped();
            logger.fine(() -> "Skipping duplicate candidate of " + callable + ": " + description);
            return;
        }

        Outcome outcome;
        try {
            outcome = oracle.invoke(call, candidate.arguments(), deadline());
        } catch (CallRejectedException e) {
            stats.incrementRejectedCalls();
            logger.warning(() -> callable + " could not be called for '" + description + "' (" + e.getCause()
                    + "), no case recorded");
            return;
        }
        switch (outcome.kind) {
            case RETURNED:
                stats.incrementRecordedSuccesses();
                recorder.record(inputs, outcome, description);
                break;
            case RAISED:
                stats.incrementRecordedFailures();
                recorder.record(inputs, outcome, description + " (raises " + outcome.error.getClass().getSimpleName() + ")");
                break;
            case TIMED_OUT:
                stats.recordTimeout(callable + ": " + description);
                logger.warning(() -> callable + " did not finish within " + config.getPerCallDeadlineSeconds()
                        + "s for '" + description + "', no case recorded");
                break;
        }
    }

    private Duration deadline() {
        return Duration.ofSeconds(config.getPerCallDeadlineSeconds());
    }

    private static String subjectOf(MethodDescriptor descriptor) {
        switch (descriptor.category) {
            case CLASS_BOUND:
                return "Class method";
            case NO_INSTANCE:
                return "Static method";
            default:
                return "Method";
        }
    }

    private static boolean isInstantiable(Class<?> cls) {
        return !cls.isInterface() && !Modifier.isAbstract(cls.getModifiers());
    }

    private static void accessible(AccessibleObject member) {
        if (!member.trySetAccessible()) {
            logger.finest(() -> member + " stays inaccessible, relying on public access");
        }
    }

    @FunctionalInterface
    private interface Recorder {
        void record(List<Object> inputs, Outcome outcome, String description);
    }
}
