package FSM;

import java.util.Random;

import FSM.Model.CompactFiniteAutomaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.common.util.random.RandomUtil;

public class TabakovVardiRandomNFA {
    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param td
     *      transition density, in [0,size]
     * @param ad
     *      acceptance density, in (0,1]. 0.5 is the usual value
     * @param alphabet
     *      alphabet
     * @return
     *      a random NFA, not necessarily connected
     */
    public static CompactFiniteAutomaton<Integer, Integer> generateNFA(
            Random r, int size, float td, float ad, Alphabet<Integer> alphabet) {
        return generateNFA(r, size, Math.round(td * size), Math.max(1, Math.round(ad * size)), alphabet);
    }

    /**
     * Generate random NFA, with fixed number of accept states and edges (per letter).
     */
    public static CompactFiniteAutomaton<Integer, Integer> generateNFA(
            Random r, int size, int edgeNum, int acceptNum, Alphabet<Integer> alphabet) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size*size;

        CompactFiniteAutomaton<Integer, Integer> result = basicNFA(size, alphabet);

        // Set final states other than the initial state.
        // We want exactly acceptNum-1 of them, from the elements [1,size).
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            result.setAccepting(f, true);
        }

        // For each letter, add edgeNum transitions.
        for (int a : alphabet) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size*size)) {
                result.addTransition(edgeIndex / size, a, edgeIndex % size);
            }
        }

        return result;
    }

    static CompactFiniteAutomaton<Integer, Integer> basicNFA(int size, Alphabet<Integer> alphabet) {
        CompactFiniteAutomaton<Integer, Integer> result = new CompactFiniteAutomaton<>(alphabet);

        for (int i = 0; i < size; i++) {
            result.addState(i);
        }
        // per the paper, the first state is always initial and accepting
        result.setInitial(0, true);
        result.setAccepting(0, true);
        return result;
    }

    public static CompactFiniteAutomaton<Integer, Integer> getRandomAutomaton(int randomSeed, int size) {
        final float td = 1.25f;
        final float ad = 0.5f;
        final Random random = new Random(randomSeed);
        final Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
        return generateNFA(random, size, td, ad, alphabet);
    }

    /**
     * Tabakov-Vardi automaton with a second initial state and a few epsilon moves on top.
     */
    public static CompactFiniteAutomaton<Integer, Integer> getRandomEpsilonAutomaton(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        final CompactFiniteAutomaton<Integer, Integer> result =
            generateNFA(random, size, 1.25f, 0.5f, Alphabets.integers(0, 1));
        result.setInitial(random.nextInt(size), true);
        for (int i = 0; i < size / 3; i++) {
            result.addEpsilonTransition(random.nextInt(size), random.nextInt(size));
        }
        return result;
    }
}
