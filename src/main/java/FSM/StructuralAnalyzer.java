package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSM.Model.FiniteAutomaton;
import FSM.Model.InvalidStateReferenceException;
import FSM.Model.UnknownSymbolException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Classifications and word acceptance over a {@link FiniteAutomaton}. Nothing here mutates its input.
 * <p>
 * Sets of states are handled as {@link BitSet}s over state ids; a deterministic automaton is just the
 * case where the current set never holds more than one state.
 */
public class StructuralAnalyzer {

    /**
     * Single initial state, no epsilon moves, at most one successor per (state, symbol).
     */
    public static boolean isDeterministic(FiniteAutomaton<?, ?> automaton) {
        if (automaton.getInitialStates().size() != 1 || automaton.hasEpsilonTransitions()) {
            return false;
        }
        final int symbols = automaton.getInputAlphabet().size();
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < symbols; a++) {
                if (automaton.getIntSuccessors(q, a).size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * At least one successor per (state, symbol). Epsilon moves do not count.
     */
    public static boolean isComplete(FiniteAutomaton<?, ?> automaton) {
        final int symbols = automaton.getInputAlphabet().size();
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < symbols; a++) {
                if (automaton.getIntSuccessors(q, a).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    public static boolean isAccessible(FiniteAutomaton<?, ?> automaton) {
        return accessibleStateIds(automaton).cardinality() == automaton.size();
    }

    public static boolean isCoAccessible(FiniteAutomaton<?, ?> automaton) {
        return coAccessibleStateIds(automaton).cardinality() == automaton.size();
    }

    public static <S> Set<S> accessibleStates(FiniteAutomaton<S, ?> automaton) {
        return labels(automaton, accessibleStateIds(automaton));
    }

    public static <S> Set<S> coAccessibleStates(FiniteAutomaton<S, ?> automaton) {
        return labels(automaton, coAccessibleStateIds(automaton));
    }

    /**
     * States reachable from the initial states, epsilon moves included.
     */
    public static BitSet accessibleStateIds(FiniteAutomaton<?, ?> automaton) {
        return forwardReach(automaton, initialStateIds(automaton));
    }

    /**
     * States from which an accepting state is reachable: the same traversal over the reversed relation,
     * seeded with the accepting states.
     */
    public static BitSet coAccessibleStateIds(FiniteAutomaton<?, ?> automaton) {
        final IntList[] predecessors = predecessors(automaton);
        final BitSet seen = acceptingStateIds(automaton);
        final Deque<Integer> queue = new ArrayDeque<>();
        for (int q = seen.nextSetBit(0); q >= 0; q = seen.nextSetBit(q + 1)) {
            queue.add(q);
        }
        while (!queue.isEmpty()) {
            final int q = queue.poll();
            for (int p : predecessors[q]) {
                if (!seen.get(p)) {
                    seen.set(p);
                    queue.add(p);
                }
            }
        }
        return seen;
    }

    public static <S> boolean isStateAccessible(FiniteAutomaton<S, ?> automaton, S state) {
        return accessibleStateIds(automaton).get(requireState(automaton, state));
    }

    public static <S> boolean isStateCoAccessible(FiniteAutomaton<S, ?> automaton, S state) {
        return coAccessibleStateIds(automaton).get(requireState(automaton, state));
    }

    /**
     * Whether {@code to} can be reached from {@code from} in zero or more steps.
     */
    public static <S> boolean isReachable(FiniteAutomaton<S, ?> automaton, S from, S to) {
        final BitSet seed = new BitSet();
        seed.set(requireState(automaton, from));
        return forwardReach(automaton, seed).get(requireState(automaton, to));
    }

    /**
     * Fixed point of {@code states} under epsilon moves. The argument is not modified.
     */
    public static BitSet epsilonClosure(FiniteAutomaton<?, ?> automaton, BitSet states) {
        final BitSet closure = (BitSet) states.clone();
        if (!automaton.hasEpsilonTransitions()) {
            return closure;
        }
        final Deque<Integer> stack = new ArrayDeque<>();
        for (int q = closure.nextSetBit(0); q >= 0; q = closure.nextSetBit(q + 1)) {
            stack.push(q);
        }
        while (!stack.isEmpty()) {
            for (int t : automaton.getIntEpsilonSuccessors(stack.pop())) {
                if (!closure.get(t)) {
                    closure.set(t);
                    stack.push(t);
                }
            }
        }
        return closure;
    }

    /**
     * Union of the successors of {@code states} on one symbol, without epsilon closure.
     */
    public static BitSet post(FiniteAutomaton<?, ?> automaton, BitSet states, int symbolIndex) {
        final BitSet result = new BitSet();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            for (int t : automaton.getIntSuccessors(q, symbolIndex)) {
                result.set(t);
            }
        }
        return result;
    }

    public static BitSet initialStateIds(FiniteAutomaton<?, ?> automaton) {
        final BitSet result = new BitSet();
        for (int q = 0; q < automaton.size(); q++) {
            if (automaton.isIntInitial(q)) {
                result.set(q);
            }
        }
        return result;
    }

    public static BitSet acceptingStateIds(FiniteAutomaton<?, ?> automaton) {
        final BitSet result = new BitSet();
        for (int q = 0; q < automaton.size(); q++) {
            if (automaton.isIntAccepting(q)) {
                result.set(q);
            }
        }
        return result;
    }

    public static boolean acceptsEmptyWord(FiniteAutomaton<?, ?> automaton) {
        return epsilonClosure(automaton, initialStateIds(automaton)).intersects(acceptingStateIds(automaton));
    }

    /**
     * Simulates the automaton on {@code word}. Every symbol is checked against the alphabet before the
     * run starts, so a malformed word is never reported as simply rejected.
     *
     * @throws UnknownSymbolException for the first symbol outside the alphabet
     */
    public static <I> boolean accepts(FiniteAutomaton<?, I> automaton, Iterable<? extends I> word) {
        final IntList symbols = new IntArrayList();
        for (I symbol : word) {
            final int index = automaton.getSymbolIndex(symbol);
            if (index < 0) {
                throw new UnknownSymbolException(symbol);
            }
            symbols.add(index);
        }

        BitSet current = epsilonClosure(automaton, initialStateIds(automaton));
        for (int i = 0; i < symbols.size() && !current.isEmpty(); i++) {
            current = epsilonClosure(automaton, post(automaton, current, symbols.getInt(i)));
        }
        return current.intersects(acceptingStateIds(automaton));
    }

    /**
     * Convenience for automata over characters: each character of {@code word} is one symbol.
     */
    public static boolean accepts(FiniteAutomaton<?, Character> automaton, CharSequence word) {
        final List<Character> symbols = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            symbols.add(word.charAt(i));
        }
        return accepts(automaton, symbols);
    }

    private static BitSet forwardReach(FiniteAutomaton<?, ?> automaton, BitSet seeds) {
        final int symbols = automaton.getInputAlphabet().size();
        final BitSet seen = (BitSet) seeds.clone();
        final Deque<Integer> queue = new ArrayDeque<>();
        for (int q = seen.nextSetBit(0); q >= 0; q = seen.nextSetBit(q + 1)) {
            queue.add(q);
        }
        while (!queue.isEmpty()) {
            final int q = queue.poll();
            for (int a = 0; a <= symbols; a++) {
                for (int t : a < symbols ? automaton.getIntSuccessors(q, a) : automaton.getIntEpsilonSuccessors(q)) {
                    if (!seen.get(t)) {
                        seen.set(t);
                        queue.add(t);
                    }
                }
            }
        }
        return seen;
    }

    private static IntList[] predecessors(FiniteAutomaton<?, ?> automaton) {
        final int symbols = automaton.getInputAlphabet().size();
        final IntList[] result = new IntList[automaton.size()];
        for (int q = 0; q < result.length; q++) {
            result[q] = new IntArrayList();
        }
        for (int q = 0; q < result.length; q++) {
            for (int a = 0; a < symbols; a++) {
                for (int t : automaton.getIntSuccessors(q, a)) {
                    result[t].add(q);
                }
            }
            for (int t : automaton.getIntEpsilonSuccessors(q)) {
                result[t].add(q);
            }
        }
        return result;
    }

    private static <S> int requireState(FiniteAutomaton<S, ?> automaton, S state) {
        final int id = automaton.getStateId(state);
        if (id == FiniteAutomaton.MISSING_STATE) {
            throw new InvalidStateReferenceException(state);
        }
        return id;
    }

    private static <S> Set<S> labels(FiniteAutomaton<S, ?> automaton, BitSet ids) {
        final Set<S> result = new LinkedHashSet<>();
        for (int q = ids.nextSetBit(0); q >= 0; q = ids.nextSetBit(q + 1)) {
            result.add(automaton.getState(q));
        }
        return result;
    }
}
