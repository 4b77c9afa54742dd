package work.lcod.thoughts.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AnswerExtractorTest {
    @Test
    void prefersTheMarkedAnswer() {
        String reasoning = "She sells 16 - 3 - 4 = 9 eggs for $2 each.\n#### $1,018\nThat took 3 steps.";

        assertEquals(1018.0, AnswerExtractor.extract(reasoning).orElseThrow());
    }

    @Test
    void fallsBackToTheLastNumber() {
        assertEquals(-2.5, AnswerExtractor.extract("first 10, then 4, the answer is -2.5.").orElseThrow());
        assertEquals(18.0, AnswerExtractor.extract("Janet makes $18 every day").orElseThrow());
    }

    @Test
    void returnsEmptyWithoutNumbers() {
        assertTrue(AnswerExtractor.extract("no digits here").isEmpty());
        assertTrue(AnswerExtractor.extract("").isEmpty());
        assertTrue(AnswerExtractor.extract(null).isEmpty());
    }
}
