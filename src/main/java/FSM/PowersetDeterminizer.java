package FSM;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import FSM.Model.Cancellation;
import FSM.Model.CompactFiniteAutomaton;
import FSM.Model.DeterminizationCancelledException;
import FSM.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction. Each state of the result is labelled by the configuration (set of source states)
 * it stands for; two configurations are the same result state iff they hold the same source states.
 * Empty configurations are never materialized, so the result may be incomplete.
 */
public class PowersetDeterminizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PowersetDeterminizer.class);

    private final Cancellation cancellation;

    public PowersetDeterminizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public <S, I> CompactFiniteAutomaton<Set<S>, I> run(FiniteAutomaton<S, I> nfa) {
        return doDeterminize(nfa, this.cancellation);
    }

    public static <S, I> CompactFiniteAutomaton<Set<S>, I> determinize(FiniteAutomaton<S, I> nfa) {
        return doDeterminize(nfa, new Cancellation());
    }

    /**
     * @throws DeterminizationCancelledException if the cancellation fires before the worklist is empty
     */
    public static <S, I> CompactFiniteAutomaton<Set<S>, I> determinize(FiniteAutomaton<S, I> nfa,
                                                                        Cancellation cancellation) {
        return doDeterminize(nfa, cancellation);
    }

    private static <S, I> CompactFiniteAutomaton<Set<S>, I> doDeterminize(FiniteAutomaton<S, I> nfa,
                                                                           Cancellation cancellation) {
        if (StructuralAnalyzer.isDeterministic(nfa)) {
            // state-for-state, unreachable states included
            checkCancellation(cancellation, nfa.size());
            LOGGER.debug("Input with {} states is already deterministic", nfa.size());
            return new CompactFiniteAutomaton<>(nfa).relabel(s -> Collections.singleton(s));
        }

        final int symbols = nfa.getInputAlphabet().size();
        final BitSet accepting = StructuralAnalyzer.acceptingStateIds(nfa);
        final CompactFiniteAutomaton<Set<S>, I> out = new CompactFiniteAutomaton<>(nfa.getInputAlphabet());

        final Object2IntOpenHashMap<BitSet> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(FiniteAutomaton.MISSING_STATE);
        final Deque<DeterminizeRecord> worklist = new ArrayDeque<>();

        final BitSet init = StructuralAnalyzer.epsilonClosure(nfa, StructuralAnalyzer.initialStateIds(nfa));
        final int initOut = out.addIntState(configuration(nfa, init), init.intersects(accepting));
        out.setIntInitial(initOut, true);
        outStateMap.put(init, initOut);
        worklist.add(new DeterminizeRecord(init, initOut));

        while (!worklist.isEmpty()) {
            checkCancellation(cancellation, out.size());
            final DeterminizeRecord curr = worklist.poll();

            for (int a = 0; a < symbols; a++) {
                final BitSet succ = StructuralAnalyzer.epsilonClosure(nfa, StructuralAnalyzer.post(nfa, curr.inputState(), a));
                if (succ.isEmpty()) {
                    continue;
                }
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == FiniteAutomaton.MISSING_STATE) {
                    outSucc = out.addIntState(configuration(nfa, succ), succ.intersects(accepting));
                    outStateMap.put(succ, outSucc);
                    worklist.add(new DeterminizeRecord(succ, outSucc));
                }
                out.addIntTransition(curr.outputState(), a, outSucc);
            }
        }

        LOGGER.debug("Subset construction: {} states -> {} states", nfa.size(), out.size());
        return out;
    }

    private static void checkCancellation(Cancellation cancellation, int size) {
        if (cancellation.isInterrupted() || cancellation.isAboveThreshold(size)) {
            LOGGER.debug("Subset construction cancelled ({}) at {} states", cancellation.cancelLabel(), size);
            throw new DeterminizationCancelledException(cancellation.cancelLabel(), size);
        }
    }

    private static <S> Set<S> configuration(FiniteAutomaton<S, ?> nfa, BitSet states) {
        final Set<S> result = new LinkedHashSet<>();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            result.add(nfa.getState(q));
        }
        return Collections.unmodifiableSet(result);
    }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
