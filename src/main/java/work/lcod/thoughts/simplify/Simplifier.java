package work.lcod.thoughts.simplify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.expr.Expression;
import work.lcod.thoughts.expr.Expressions;
import work.lcod.thoughts.expr.SourceParseException;
import work.lcod.thoughts.expr.SourceParser;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.Step;

/**
 * Canonicalizes a {@link ReasoningPath}: removes pure-alias steps, rewrites their readers to the
 * alias source, drops steps no return variable depends on and re-indexes the survivors from 1.
 *
 * <p>The receiver is never modified. An alias step is removed only when every reader still sees
 * the alias source under the source's name, and never when it is the final assignment of a
 * return variable. Reachability follows every name a step reads, including a name the step
 * reassigns. Passes repeat until nothing more is removed, so simplifying twice is a no-op.
 */
public final class Simplifier {
    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    private Simplifier() {}

    public static ReasoningPath simplify(ReasoningPath path) {
        if (path.returnVars().isEmpty()) {
            return path;
        }
        ReasoningPath current = path;
        while (true) {
            ReasoningPath next = new Pass(current).run();
            if (next.size() >= current.size()) {
                return next;
            }
            current = next;
        }
    }

    /**
     * What a name resolves to at a given step: an earlier step (by index) or a declared parameter.
     */
    private record Binding(int index, String parameter) {
        static Binding step(int index) {
            return new Binding(index, null);
        }

        static Binding parameter(String name) {
            return new Binding(-1, name);
        }

        boolean isStep() {
            return parameter == null;
        }
    }

    private static final class Pass {
        private final ReasoningPath path;
        private final List<Step> steps;
        private final Set<String> parameters;
        private final List<Expression> parsed = new ArrayList<>();
        private final List<Map<String, Integer>> bindingsBefore = new ArrayList<>();
        private final List<Map<String, Binding>> reads = new ArrayList<>();
        private final boolean[] removable;
        private final Binding[] sources;

        Pass(ReasoningPath path) {
            this.path = path;
            this.steps = path.steps();
            this.parameters = new LinkedHashSet<>(path.parameters());
            this.removable = new boolean[steps.size()];
            this.sources = new Binding[steps.size()];
        }

        ReasoningPath run() {
            resolveReads();
            detectAliases();
            var rewritten = rewriteExpressions();
            var live = reachable();

            var builder = ReasoningPath.builder(path.parameters());
            int aliases = 0;
            int dead = 0;
            for (int i = 0; i < steps.size(); i++) {
                if (removable[i]) {
                    aliases++;
                    continue;
                }
                if (!live.contains(i)) {
                    dead++;
                    continue;
                }
                builder.append(rederive(builder, steps.get(i).variable(), rewritten.get(i)));
            }
            builder.returnVars(path.returnVars());
            if (aliases > 0 || dead > 0) {
                LOG.debug("Simplification removed {} alias steps and {} unreachable steps", aliases, dead);
            }
            return builder.build();
        }

        private void resolveReads() {
            var bindings = new HashMap<String, Integer>();
            for (int i = 0; i < steps.size(); i++) {
                Step step = steps.get(i);
                Expression expression = parse(step);
                parsed.add(expression);
                bindingsBefore.add(Map.copyOf(bindings));
                var stepReads = new LinkedHashMap<String, Binding>();
                for (String name : Expressions.referencedNames(expression)) {
                    Binding binding = resolve(i, name);
                    if (binding != null) {
                        stepReads.put(name, binding);
                    }
                }
                reads.add(stepReads);
                bindings.put(step.variable(), i);
            }
        }

        private Binding resolve(int index, String name) {
            Integer local = bindingsBefore.get(index).get(name);
            if (local != null) {
                return Binding.step(local);
            }
            return parameters.contains(name) ? Binding.parameter(name) : null;
        }

        private void detectAliases() {
            var returnFinals = new TreeSet<Integer>();
            for (String returnVar : path.returnVars()) {
                path.stepByVariable(returnVar).ifPresent(step -> returnFinals.add(steps.indexOf(step)));
            }
            for (int i = 0; i < steps.size(); i++) {
                if (!(parsed.get(i) instanceof Expression.Name name) || name.id().equals(steps.get(i).variable())) {
                    continue;
                }
                Binding target = reads.get(i).get(name.id());
                if (target == null) {
                    continue;
                }
                Binding source = target.isStep() && removable[target.index()] ? sources[target.index()] : target;
                sources[i] = source;
                removable[i] = !returnFinals.contains(i) && readersSeeSource(i, source);
            }
        }

        private boolean readersSeeSource(int alias, Binding source) {
            String sourceName = nameOf(source);
            for (int k = alias + 1; k < steps.size(); k++) {
                if (!reads.get(k).containsValue(Binding.step(alias))) {
                    continue;
                }
                if (sourceName.equals(steps.get(k).variable()) || !source.equals(resolve(k, sourceName))) {
                    return false;
                }
            }
            return true;
        }

        private List<String> rewriteExpressions() {
            var rewritten = new ArrayList<String>();
            for (int i = 0; i < steps.size(); i++) {
                var renames = new HashMap<String, String>();
                reads.get(i).forEach((name, binding) -> {
                    if (binding.isStep() && removable[binding.index()]) {
                        renames.put(name, nameOf(sources[binding.index()]));
                    }
                });
                rewritten.add(renames.isEmpty()
                    ? steps.get(i).expression()
                    : Expressions.rename(parsed.get(i), renames).render());
            }
            return rewritten;
        }

        private Set<Integer> reachable() {
            var live = new TreeSet<Integer>();
            var queue = new ArrayDeque<Integer>();
            for (String returnVar : path.returnVars()) {
                path.stepByVariable(returnVar).ifPresent(step -> {
                    int index = steps.indexOf(step);
                    if (live.add(index)) {
                        queue.add(index);
                    }
                });
            }
            while (!queue.isEmpty()) {
                int current = queue.poll();
                for (Binding binding : reads.get(current).values()) {
                    Binding effective = binding.isStep() && removable[binding.index()] ? sources[binding.index()] : binding;
                    if (effective.isStep() && live.add(effective.index())) {
                        queue.add(effective.index());
                    }
                }
            }
            return live;
        }

        /**
         * Dependencies of a surviving step, derived exactly as extraction derives them.
         */
        private Step rederive(ReasoningPath.Builder builder, String variable, String expressionText) {
            var dependencies = new ArrayList<Integer>();
            var inputs = new ArrayList<String>();
            Expression expression = SourceParser.parseExpression(expressionText);
            for (String name : Expressions.referencedNames(expression)) {
                if (name.equals(variable)) {
                    continue;
                }
                if (builder.isParameter(name)) {
                    inputs.add(name);
                } else {
                    builder.lookup(name).ifPresent(step -> dependencies.add(step.stepId()));
                }
            }
            return new Step(builder.nextStepId(), variable, expressionText, dependencies, inputs);
        }

        private String nameOf(Binding binding) {
            return binding.isStep() ? steps.get(binding.index()).variable() : binding.parameter();
        }

        private Expression parse(Step step) {
            try {
                return SourceParser.parseExpression(step.expression());
            } catch (SourceParseException ex) {
                throw new IllegalArgumentException(
                    "Step " + step.stepId() + " has an unparsable expression: " + step.expression(),
                    ex
                );
            }
        }
    }
}
