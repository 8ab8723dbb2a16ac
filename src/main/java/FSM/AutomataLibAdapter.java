package FSM;

import java.util.Collection;
import java.util.Set;

import FSM.Model.CompactFiniteAutomaton;
import FSM.Model.FiniteAutomaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions between {@link FiniteAutomaton} and AutomataLib's automata. State ids are preserved when
 * going to a {@link CompactNFA}; the other direction keeps AutomataLib's state objects as labels.
 */
public class AutomataLibAdapter {

    /**
     * @throws IllegalArgumentException if the automaton has epsilon transitions, which CompactNFA cannot hold
     */
    public static <I> CompactNFA<I> toCompactNFA(FiniteAutomaton<?, I> automaton) {
        if (automaton.hasEpsilonTransitions()) {
            throw new IllegalArgumentException("Epsilon transitions cannot be represented in a CompactNFA");
        }
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final CompactNFA<I> nfa = new CompactNFA<>(alphabet, automaton.size());
        for (int q = 0; q < automaton.size(); q++) {
            nfa.addState(automaton.isIntAccepting(q));
            if (automaton.isIntInitial(q)) {
                nfa.setInitial(q, true);
            }
        }
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final I symbol = alphabet.getSymbol(a);
                for (int t : automaton.getIntSuccessors(q, a)) {
                    nfa.addTransition(q, symbol, t);
                }
            }
        }
        return nfa;
    }

    public static <S, I> CompactFiniteAutomaton<S, I> fromNFA(NFA<S, I> nfa, Alphabet<I> alphabet) {
        final CompactFiniteAutomaton<S, I> out = new CompactFiniteAutomaton<>(alphabet);
        final Set<S> initialStates = nfa.getInitialStates();
        final Collection<S> states = nfa.getStates();
        for (S s : states) {
            out.addState(s, nfa.isAccepting(s));
            if (initialStates.contains(s)) {
                out.setInitial(s, true);
            }
        }
        for (S s : states) {
            for (I i : alphabet) {
                for (S t : nfa.getTransitions(s, i)) {
                    out.addTransition(s, i, t);
                }
            }
        }
        return out;
    }
}
