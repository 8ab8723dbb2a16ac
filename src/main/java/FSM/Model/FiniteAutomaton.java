package FSM.Model;

import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntSet;
import net.automatalib.alphabet.Alphabet;

/**
 * Read-only view of a finite automaton over a finite alphabet.
 * <p>
 * States are identified by labels of type {@code S}. Every implementation also assigns each state a
 * stable integer id in {@code [0, size())}, and symbols are addressed by their index in
 * {@link #getInputAlphabet()}; the int-level methods are what the algorithms work on.
 *
 * @param <S> state label type
 * @param <I> input symbol type
 */
public interface FiniteAutomaton<S, I> {
    int MISSING_STATE = -1;

    Alphabet<I> getInputAlphabet();

    int size();

    /**
     * States in id order.
     */
    List<S> getStates();

    Set<S> getInitialStates();

    Set<S> getAcceptingStates();

    boolean isInitial(S state);

    boolean isAccepting(S state);

    /**
     * Destinations of {@code state} on {@code symbol}; empty if there are none or if the state is unknown.
     * @throws UnknownSymbolException if the symbol is not in the alphabet
     */
    Set<S> getSuccessors(S state, I symbol);

    Set<S> getEpsilonSuccessors(S state);

    /**
     * Every transition, ordered by source id, then symbol index, epsilon moves last.
     */
    List<Transition<S, I>> getTransitions();

    boolean hasEpsilonTransitions();

    // int-level access

    /**
     * @return the id of the state, or {@link #MISSING_STATE}
     */
    int getStateId(S state);

    S getState(int id);

    /**
     * @return the index of the symbol, or -1 if it is not part of the alphabet
     */
    int getSymbolIndex(I symbol);

    IntSet getIntSuccessors(int state, int symbolIndex);

    IntSet getIntEpsilonSuccessors(int state);

    boolean isIntInitial(int state);

    boolean isIntAccepting(int state);
}
