package work.lcod.thoughts.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable, ordered collection of {@link Step}s for one computation.
 *
 * <p>Invariants, enforced by {@link Builder#append(Step)}: step ids strictly increase in
 * encounter order, dependencies only reference earlier steps of the same path, and input
 * dependencies only name declared parameters. The symbol table maps each variable to the most
 * recent step assigning it; earlier steps for the same name stay in {@link #steps()}.
 */
public final class ReasoningPath {
    private final List<String> parameters;
    private final List<Step> steps;
    private final Map<String, Step> symbolTable;
    private final Map<Integer, Step> stepsById;
    private final List<String> returnVars;

    private ReasoningPath(Builder builder) {
        this.parameters = List.copyOf(builder.parameters);
        this.steps = List.copyOf(builder.steps);
        this.symbolTable = Collections.unmodifiableMap(new LinkedHashMap<>(builder.symbolTable));
        this.stepsById = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stepsById));
        this.returnVars = List.copyOf(builder.returnVars);
    }

    public static Builder builder(Collection<String> parameters) {
        return new Builder(parameters);
    }

    public static ReasoningPath empty() {
        return builder(List.of()).build();
    }

    public List<String> parameters() {
        return parameters;
    }

    public List<Step> steps() {
        return steps;
    }

    /**
     * Variable name to the latest step assigning it.
     */
    public Map<String, Step> symbolTable() {
        return symbolTable;
    }

    /**
     * Declared return variables, deduplicated and sorted.
     */
    public List<String> returnVars() {
        return returnVars;
    }

    public Optional<Step> step(int stepId) {
        return Optional.ofNullable(stepsById.get(stepId));
    }

    public Optional<Step> stepByVariable(String variable) {
        return Optional.ofNullable(symbolTable.get(variable));
    }

    public boolean isParameter(String name) {
        return parameters.contains(name);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Union of all input dependencies, sorted.
     */
    public List<String> inputDependencies() {
        var inputs = new TreeSet<String>();
        steps.forEach(step -> inputs.addAll(step.dependenciesInput()));
        return List.copyOf(inputs);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ReasoningPath path)) {
            return false;
        }
        return steps.equals(path.steps) && returnVars.equals(path.returnVars) && parameters.equals(path.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(steps, returnVars, parameters);
    }

    @Override
    public String toString() {
        return steps.stream().map(Step::toString).collect(Collectors.joining("\n"));
    }

    /**
     * Append-only builder; every appended step is validated against the steps before it.
     */
    public static final class Builder {
        private final List<String> parameters;
        private final List<Step> steps = new ArrayList<>();
        private final Map<String, Step> symbolTable = new LinkedHashMap<>();
        private final Map<Integer, Step> stepsById = new LinkedHashMap<>();
        private final TreeSet<String> returnVars = new TreeSet<>();

        private Builder(Collection<String> parameters) {
            this.parameters = parameters == null ? List.of() : List.copyOf(new LinkedHashSet<>(parameters));
        }

        public Builder append(Step step) {
            Objects.requireNonNull(step, "step");
            int lastId = steps.isEmpty() ? 0 : steps.get(steps.size() - 1).stepId();
            if (step.stepId() <= lastId) {
                throw new IllegalArgumentException(
                    "step id " + step.stepId() + " does not increase after " + lastId
                );
            }
            for (int dependency : step.dependencies()) {
                if (!stepsById.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                        "step " + step.stepId() + " depends on unknown or later step " + dependency
                    );
                }
            }
            for (String input : step.dependenciesInput()) {
                if (!parameters.contains(input)) {
                    throw new IllegalArgumentException(
                        "step " + step.stepId() + " reads undeclared parameter " + input
                    );
                }
            }
            steps.add(step);
            stepsById.put(step.stepId(), step);
            symbolTable.put(step.variable(), step);
            return this;
        }

        public Builder returnVar(String name) {
            returnVars.add(Objects.requireNonNull(name, "name"));
            return this;
        }

        public Builder returnVars(Collection<String> names) {
            names.forEach(this::returnVar);
            return this;
        }

        public Optional<Step> lookup(String variable) {
            return Optional.ofNullable(symbolTable.get(variable));
        }

        public boolean isParameter(String name) {
            return parameters.contains(name);
        }

        public int nextStepId() {
            return steps.isEmpty() ? 1 : steps.get(steps.size() - 1).stepId() + 1;
        }

        public ReasoningPath build() {
            return new ReasoningPath(this);
        }
    }
}
