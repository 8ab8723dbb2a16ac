package FSM;

import java.util.ArrayList;
import java.util.List;

import FSM.Model.CompactFiniteAutomaton;

/**
 * Small hand-built automata shared by the tests.
 */
public class ExampleAutomata {

    /**
     * Binary strings ending with '1'. Deterministic, complete, accessible and co-accessible.
     */
    static CompactFiniteAutomaton<String, Character> endsWithOne() {
        CompactFiniteAutomaton<String, Character> dfa = new CompactFiniteAutomaton<>(List.of('0', '1'));
        dfa.addState("q0");
        dfa.addState("q1", true);
        dfa.setInitial("q0", true);
        dfa.addTransition("q0", '0', "q0");
        dfa.addTransition("q0", '1', "q1");
        dfa.addTransition("q1", '0', "q0");
        dfa.addTransition("q1", '1', "q1");
        return dfa;
    }

    /**
     * s0 -a-> s1, s0 -a-> s2, only s2 accepting.
     */
    static CompactFiniteAutomaton<String, String> forkOnA() {
        CompactFiniteAutomaton<String, String> nfa = new CompactFiniteAutomaton<>(List.of("a"));
        nfa.addState("s0");
        nfa.addState("s1");
        nfa.addState("s2", true);
        nfa.setInitial("s0", true);
        nfa.addTransition("s0", "a", "s1");
        nfa.addTransition("s0", "a", "s2");
        return nfa;
    }

    /**
     * s0 -ε-> s1 -a-> s2, s2 accepting.
     */
    static CompactFiniteAutomaton<String, String> epsilonThenA() {
        CompactFiniteAutomaton<String, String> nfa = new CompactFiniteAutomaton<>(List.of("a", "b"));
        nfa.addState("s0");
        nfa.addState("s1");
        nfa.addState("s2", true);
        nfa.setInitial("s0", true);
        nfa.addEpsilonTransition("s0", "s1");
        nfa.addTransition("s1", "a", "s2");
        return nfa;
    }

    /**
     * One state, initial and accepting, no transitions.
     */
    static CompactFiniteAutomaton<String, Character> singleState() {
        CompactFiniteAutomaton<String, Character> automaton = new CompactFiniteAutomaton<>(List.of('a'));
        automaton.addState("q", true);
        automaton.setInitial("q", true);
        return automaton;
    }

    /**
     * All words over the alphabet of length at most {@code maxLength}, shortest first.
     */
    static <I> List<List<I>> wordsUpTo(List<I> alphabet, int maxLength) {
        List<List<I>> result = new ArrayList<>();
        List<List<I>> layer = new ArrayList<>();
        layer.add(List.of());
        result.addAll(layer);
        for (int length = 1; length <= maxLength; length++) {
            List<List<I>> next = new ArrayList<>();
            for (List<I> prefix : layer) {
                for (I symbol : alphabet) {
                    List<I> word = new ArrayList<>(prefix);
                    word.add(symbol);
                    next.add(word);
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
