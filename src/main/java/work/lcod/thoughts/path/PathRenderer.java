package work.lcod.thoughts.path;

/**
 * Reconstructs function source from a path: one assignment per step and one {@code return} per
 * return variable. Extracting the rendered source of a path with ids {@code 1..n} yields an
 * equal path.
 */
public final class PathRenderer {
    private static final String INDENT = "    ";

    private PathRenderer() {}

    public static String render(ReasoningPath path) {
        return render(path, StepExtractor.DEFAULT_ENTRY_FUNCTION);
    }

    public static String render(ReasoningPath path, String functionName) {
        var out = new StringBuilder();
        out.append("def ").append(functionName).append('(')
            .append(String.join(", ", path.parameters()))
            .append("):\n");
        for (var step : path.steps()) {
            out.append(INDENT).append(step.variable()).append(" = ").append(step.expression()).append('\n');
        }
        for (var returnVar : path.returnVars()) {
            out.append(INDENT).append("return ").append(returnVar).append('\n');
        }
        if (path.isEmpty() && path.returnVars().isEmpty()) {
            out.append(INDENT).append("pass\n");
        }
        return out.toString();
    }
}
