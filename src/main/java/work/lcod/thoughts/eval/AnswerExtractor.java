package work.lcod.thoughts.eval;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the numeric final answer out of a free-text reasoning process.
 *
 * <p>A {@code #### <number>} marker wins; otherwise the last number in the text is used.
 * Dollar signs are ignored and thousands separators are stripped from the marked answer.
 */
public final class AnswerExtractor {
    private static final Pattern MARKED_ANSWER = Pattern.compile("#### (-?[0-9.,]+)");
    private static final Pattern NUMBER = Pattern.compile("(-?[0-9]+\\.?[0-9]*)");

    private AnswerExtractor() {}

    public static OptionalDouble extract(String reasoning) {
        if (reasoning == null || reasoning.isBlank()) {
            return OptionalDouble.empty();
        }
        String text = reasoning.replace("$", "");
        Matcher marked = MARKED_ANSWER.matcher(text);
        if (marked.find()) {
            OptionalDouble parsed = parse(marked.group(1).strip().replace(",", ""));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        Matcher numbers = NUMBER.matcher(text);
        String last = null;
        while (numbers.find()) {
            last = numbers.group(1);
        }
        return last == null ? OptionalDouble.empty() : parse(last);
    }

    private static OptionalDouble parse(String candidate) {
        try {
            return OptionalDouble.of(Double.parseDouble(candidate));
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }
}
