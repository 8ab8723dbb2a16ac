package FSM;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import FSM.Model.CompactFiniteAutomaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Language preservation of every conversion, checked on Tabakov-Vardi random automata against
 * direct simulation and against AutomataLib's own subset construction.
 */
@Tag("IntegTest")
public class PropertyIntegTest {
    private static final int AMOUNT = 200;
    private static final int MAX_WORD_LENGTH = 6;
    private static final List<CompactFiniteAutomaton<Integer, Integer>> AUTOMATA;
    private static final List<CompactFiniteAutomaton<Integer, Integer>> EPSILON_AUTOMATA;
    private static final List<List<Integer>> WORDS = ExampleAutomata.wordsUpTo(List.of(0, 1), MAX_WORD_LENGTH);

    static {
        AUTOMATA = new ArrayList<>(AMOUNT);
        EPSILON_AUTOMATA = new ArrayList<>(AMOUNT);
        for (int randomSeed = 0; randomSeed < AMOUNT; randomSeed++) {
            final int size = 5 + randomSeed % 8;
            AUTOMATA.add(TabakovVardiRandomNFA.getRandomAutomaton(randomSeed, size));
            EPSILON_AUTOMATA.add(TabakovVardiRandomNFA.getRandomEpsilonAutomaton(randomSeed, size));
        }
    }

    @Test
    void testDeterminizationPreservesLanguage() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : all()) {
            final CompactFiniteAutomaton<Set<Integer>, Integer> dfa = Canonicalizer.toDeterministic(automaton);
            Assertions.assertTrue(StructuralAnalyzer.isDeterministic(dfa));
            Assertions.assertTrue(StructuralAnalyzer.isAccessible(dfa));
            assertSameLanguage(automaton, dfa);
        }
    }

    @Test
    void testCompleteDeterminizationPreservesLanguage() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : all()) {
            final CompactFiniteAutomaton<Set<Integer>, Integer> dfa = Canonicalizer.toCompleteDeterministic(automaton);
            Assertions.assertTrue(StructuralAnalyzer.isDeterministic(dfa));
            Assertions.assertTrue(StructuralAnalyzer.isComplete(dfa));
            assertSameLanguage(automaton, dfa);
        }
    }

    @Test
    void testCompletionPreservesLanguage() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : all()) {
            final CompactFiniteAutomaton<Integer, Integer> complete = Canonicalizer.toComplete(automaton, -1);
            Assertions.assertTrue(StructuralAnalyzer.isComplete(complete));
            Assertions.assertTrue(complete.size() <= automaton.size() + 1);
            assertSameLanguage(automaton, complete);
        }
    }

    @Test
    void testRestrictionsPreserveLanguage() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : all()) {
            final CompactFiniteAutomaton<Integer, Integer> accessible = Canonicalizer.toAccessible(automaton);
            final CompactFiniteAutomaton<Integer, Integer> coAccessible = Canonicalizer.toCoAccessible(automaton);
            final CompactFiniteAutomaton<Integer, Integer> trimmed = Canonicalizer.trim(automaton);

            Assertions.assertTrue(StructuralAnalyzer.isAccessible(accessible));
            Assertions.assertTrue(StructuralAnalyzer.isCoAccessible(coAccessible));
            Assertions.assertTrue(StructuralAnalyzer.isAccessible(trimmed));
            Assertions.assertTrue(StructuralAnalyzer.isCoAccessible(trimmed));

            assertSameLanguage(automaton, accessible);
            assertSameLanguage(automaton, coAccessible);
            assertSameLanguage(automaton, trimmed);
        }
    }

    @Test
    void testIdempotence() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : all()) {
            final CompactFiniteAutomaton<Integer, Integer> accessible = Canonicalizer.toAccessible(automaton);
            Assertions.assertEquals(accessible.getStates(), Canonicalizer.toAccessible(accessible).getStates());

            final CompactFiniteAutomaton<Integer, Integer> trimmed = Canonicalizer.trim(automaton);
            Assertions.assertEquals(trimmed.getTransitions(), Canonicalizer.trim(trimmed).getTransitions());

            final CompactFiniteAutomaton<Integer, Integer> complete = Canonicalizer.toComplete(automaton, -1);
            Assertions.assertEquals(complete.getTransitions(), Canonicalizer.toComplete(complete, -2).getTransitions());

            final CompactFiniteAutomaton<Set<Integer>, Integer> dfa = Canonicalizer.toDeterministic(automaton);
            Assertions.assertEquals(dfa.size(), Canonicalizer.toDeterministic(dfa).size());
        }
    }

    @Test
    void testReverseTwiceKeepsLanguage() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : EPSILON_AUTOMATA) {
            assertSameLanguage(automaton, Canonicalizer.reverse(Canonicalizer.reverse(automaton)));
        }
    }

    @Test
    void testAgainstAutomataLib() {
        for (CompactFiniteAutomaton<Integer, Integer> automaton : AUTOMATA) {
            final Alphabet<Integer> alphabet = automaton.getInputAlphabet();
            final CompactNFA<Integer> nfa = AutomataLibAdapter.toCompactNFA(automaton);
            for (List<Integer> word : WORDS) {
                Assertions.assertEquals(nfa.accepts(word), StructuralAnalyzer.accepts(automaton, word));
            }

            final CompactDFA<Integer> expected = NFAs.determinize(nfa, alphabet);
            final CompactDFA<Integer> actual =
                NFAs.determinize(AutomataLibAdapter.toCompactNFA(Canonicalizer.toDeterministic(automaton)), alphabet);
            Assertions.assertTrue(Automata.testEquivalence(expected, actual, alphabet));
        }
    }

    private static List<CompactFiniteAutomaton<Integer, Integer>> all() {
        final List<CompactFiniteAutomaton<Integer, Integer>> result = new ArrayList<>(AUTOMATA);
        result.addAll(EPSILON_AUTOMATA);
        return result;
    }

    private static void assertSameLanguage(CompactFiniteAutomaton<?, Integer> expected,
                                           CompactFiniteAutomaton<?, Integer> actual) {
        for (List<Integer> word : WORDS) {
            Assertions.assertEquals(StructuralAnalyzer.accepts(expected, word), StructuralAnalyzer.accepts(actual, word),
                "word " + word);
        }
    }
}
