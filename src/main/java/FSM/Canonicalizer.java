package FSM;

import java.util.BitSet;
import java.util.Collections;
import java.util.Set;

import FSM.Model.CompactFiniteAutomaton;
import FSM.Model.FiniteAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions producing a new automaton with a target property. The input is never modified and the
 * result is owned by the caller.
 */
public class Canonicalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Canonicalizer.class);

    /**
     * Restriction to the states reachable from an initial state.
     */
    public static <S, I> CompactFiniteAutomaton<S, I> toAccessible(FiniteAutomaton<S, I> automaton) {
        final CompactFiniteAutomaton<S, I> result = restrict(automaton, StructuralAnalyzer.accessibleStateIds(automaton));
        LOGGER.debug("Accessible part: {} -> {} states", automaton.size(), result.size());
        return result;
    }

    /**
     * Restriction to the states from which an accepting state is reachable.
     */
    public static <S, I> CompactFiniteAutomaton<S, I> toCoAccessible(FiniteAutomaton<S, I> automaton) {
        final CompactFiniteAutomaton<S, I> result = restrict(automaton, StructuralAnalyzer.coAccessibleStateIds(automaton));
        LOGGER.debug("Co-accessible part: {} -> {} states", automaton.size(), result.size());
        return result;
    }

    /**
     * Restriction to the states that are both accessible and co-accessible.
     */
    public static <S, I> CompactFiniteAutomaton<S, I> trim(FiniteAutomaton<S, I> automaton) {
        final BitSet states = StructuralAnalyzer.accessibleStateIds(automaton);
        states.and(StructuralAnalyzer.coAccessibleStateIds(automaton));
        final CompactFiniteAutomaton<S, I> result = restrict(automaton, states);
        LOGGER.debug("Trimmed: {} -> {} states", automaton.size(), result.size());
        return result;
    }

    /**
     * Same states, every transition reversed, initial and accepting states swapped.
     */
    public static <S, I> CompactFiniteAutomaton<S, I> reverse(FiniteAutomaton<S, I> automaton) {
        final int symbols = automaton.getInputAlphabet().size();
        final CompactFiniteAutomaton<S, I> out = new CompactFiniteAutomaton<>(automaton.getInputAlphabet());

        // Accepting are initial states and vice versa
        for (int q = 0; q < automaton.size(); q++) {
            out.addIntState(automaton.getState(q), automaton.isIntInitial(q));
            out.setIntInitial(q, automaton.isIntAccepting(q));
        }
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < symbols; a++) {
                for (int t : automaton.getIntSuccessors(q, a)) {
                    out.addIntTransition(t, a, q);
                }
            }
            for (int t : automaton.getIntEpsilonSuccessors(q)) {
                out.addIntEpsilonTransition(t, q);
            }
        }
        return out;
    }

    /**
     * Completion with a trap state. If the input is already complete an equal copy is returned and
     * {@code sink} is not used. Otherwise {@code sink} is added as a non-accepting state and every missing
     * (state, symbol) pair, the sink's own included, gets a transition to it. Existing transitions are
     * left alone, so a deterministic input stays deterministic.
     *
     * @throws IllegalArgumentException if completion is needed and {@code sink} is already a state
     */
    public static <S, I> CompactFiniteAutomaton<S, I> toComplete(FiniteAutomaton<S, I> automaton, S sink) {
        final CompactFiniteAutomaton<S, I> out = new CompactFiniteAutomaton<>(automaton);
        if (StructuralAnalyzer.isComplete(out)) {
            return out;
        }
        if (out.getStateId(sink) != FiniteAutomaton.MISSING_STATE) {
            throw new IllegalArgumentException("Sink state " + sink + " is already part of the automaton");
        }

        final int symbols = out.getInputAlphabet().size();
        final int sinkId = out.addIntState(sink, false);
        int added = 0;
        for (int q = 0; q < out.size(); q++) {
            for (int a = 0; a < symbols; a++) {
                if (out.getIntSuccessors(q, a).isEmpty()) {
                    out.addIntTransition(q, a, sinkId);
                    added++;
                }
            }
        }
        LOGGER.debug("Completed with sink {}: {} transitions added", sink, added);
        return out;
    }

    public static <S, I> CompactFiniteAutomaton<Set<S>, I> toDeterministic(FiniteAutomaton<S, I> automaton) {
        return PowersetDeterminizer.determinize(automaton);
    }

    /**
     * Subset construction followed by completion. The empty configuration serves as the sink: subset
     * construction never produces it for an automaton with initial states, and it is a trap by definition.
     */
    public static <S, I> CompactFiniteAutomaton<Set<S>, I> toCompleteDeterministic(FiniteAutomaton<S, I> automaton) {
        final CompactFiniteAutomaton<Set<S>, I> dfa = PowersetDeterminizer.determinize(automaton);
        final Set<S> sink = Collections.emptySet();
        if (dfa.getStateId(sink) != FiniteAutomaton.MISSING_STATE) {
            // no initial states: the single result state is already the empty configuration
            dfa.addSelfLoops(sink);
            return dfa;
        }
        return toComplete(dfa, sink);
    }

    private static <S, I> CompactFiniteAutomaton<S, I> restrict(FiniteAutomaton<S, I> automaton, BitSet states) {
        final int symbols = automaton.getInputAlphabet().size();
        final CompactFiniteAutomaton<S, I> out = new CompactFiniteAutomaton<>(automaton.getInputAlphabet());
        final int[] mapping = new int[automaton.size()];

        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            mapping[q] = out.addIntState(automaton.getState(q), automaton.isIntAccepting(q));
            out.setIntInitial(mapping[q], automaton.isIntInitial(q));
        }

        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            for (int a = 0; a < symbols; a++) {
                for (int t : automaton.getIntSuccessors(q, a)) {
                    if (states.get(t)) {
                        out.addIntTransition(mapping[q], a, mapping[t]);
                    }
                }
            }
            for (int t : automaton.getIntEpsilonSuccessors(q)) {
                if (states.get(t)) {
                    out.addIntEpsilonTransition(mapping[q], mapping[t]);
                }
            }
        }
        return out;
    }
}
