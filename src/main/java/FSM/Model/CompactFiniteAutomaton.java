package FSM.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import it.unimi.dsi.fastutil.ints.IntArraySet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Finite automaton stored as an arena of integer state ids. Labels are only used at the API boundary;
 * the transition relation references ids, one successor set per (state, symbol index).
 *
 * @param <S> state label type
 * @param <I> input symbol type
 */
public class CompactFiniteAutomaton<S, I> implements MutableFiniteAutomaton<S, I> {

    private final Alphabet<I> alphabet;
    private final Object2IntOpenHashMap<I> symbolIds;

    private final List<S> states = new ArrayList<>();
    private final Object2IntOpenHashMap<S> stateIds = new Object2IntOpenHashMap<>();
    private final List<IntSet[]> successors = new ArrayList<>();
    private final List<IntSet> epsilonSuccessors = new ArrayList<>();
    private final BitSet initial = new BitSet();
    private final BitSet accepting = new BitSet();
    private int epsilonCount;

    public CompactFiniteAutomaton(Collection<? extends I> symbols) {
        this(Alphabets.fromCollection(new ArrayList<>(new LinkedHashSet<>(symbols))));
    }

    public CompactFiniteAutomaton(Alphabet<I> alphabet) {
        this.alphabet = alphabet;
        this.symbolIds = new Object2IntOpenHashMap<>(alphabet.size());
        this.symbolIds.defaultReturnValue(-1);
        for (int i = 0; i < alphabet.size(); i++) {
            this.symbolIds.put(alphabet.getSymbol(i), i);
        }
        this.stateIds.defaultReturnValue(MISSING_STATE);
    }

    /**
     * Copies another automaton. State ids are preserved.
     */
    public CompactFiniteAutomaton(FiniteAutomaton<S, I> other) {
        this(other.getInputAlphabet());
        for (int q = 0; q < other.size(); q++) {
            addIntState(other.getState(q), other.isIntAccepting(q));
            setIntInitial(q, other.isIntInitial(q));
        }
        copyTransitions(other, this);
    }

    // ---------------------------------------------------------------- construction

    /**
     * Adds a state, or returns the id of the existing state with that label.
     */
    public int addIntState(S state, boolean acc) {
        Objects.requireNonNull(state, "state");
        int id = stateIds.getInt(state);
        if (id != MISSING_STATE) {
            return id;
        }
        id = states.size();
        states.add(state);
        stateIds.put(state, id);
        successors.add(new IntSet[alphabet.size()]);
        epsilonSuccessors.add(null);
        accepting.set(id, acc);
        return id;
    }

    @Override
    public boolean addState(S state, boolean acc) {
        final int before = states.size();
        addIntState(state, acc);
        return states.size() > before;
    }

    @Override
    public void addTransition(S source, I symbol, S target) {
        final int src = requireState(source);
        final int dst = requireState(target);
        final int sym = symbolIds.getInt(symbol);
        if (sym < 0) {
            throw new UnknownSymbolException(symbol);
        }
        addIntTransition(src, sym, dst);
    }

    public void addIntTransition(int source, int symbolIndex, int target) {
        checkId(source);
        checkId(target);
        IntSet[] row = successors.get(source);
        if (row[symbolIndex] == null) {
            row[symbolIndex] = new IntArraySet(2);
        }
        row[symbolIndex].add(target);
    }

    @Override
    public void addEpsilonTransition(S source, S target) {
        addIntEpsilonTransition(requireState(source), requireState(target));
    }

    public void addIntEpsilonTransition(int source, int target) {
        checkId(source);
        checkId(target);
        IntSet set = epsilonSuccessors.get(source);
        if (set == null) {
            set = new IntArraySet(2);
            epsilonSuccessors.set(source, set);
        }
        if (set.add(target)) {
            epsilonCount++;
        }
    }

    @Override
    public void setInitial(S state, boolean init) {
        setIntInitial(requireState(state), init);
    }

    public void setIntInitial(int state, boolean init) {
        checkId(state);
        initial.set(state, init);
    }

    @Override
    public void setAccepting(S state, boolean acc) {
        setIntAccepting(requireState(state), acc);
    }

    public void setIntAccepting(int state, boolean acc) {
        checkId(state);
        accepting.set(state, acc);
    }

    /**
     * Copies this automaton under new state labels. Ids, flags and transitions are kept.
     * @throws IllegalArgumentException if two states are mapped to the same label
     */
    public <T> CompactFiniteAutomaton<T, I> relabel(Function<? super S, ? extends T> mapping) {
        final CompactFiniteAutomaton<T, I> out = new CompactFiniteAutomaton<>(alphabet);
        for (int q = 0; q < size(); q++) {
            final T label = mapping.apply(states.get(q));
            if (!out.addState(label, isIntAccepting(q))) {
                throw new IllegalArgumentException("Relabelling maps two states to " + label);
            }
            out.setIntInitial(q, isIntInitial(q));
        }
        copyTransitions(this, out);
        return out;
    }

    private static <I> void copyTransitions(FiniteAutomaton<?, I> from, CompactFiniteAutomaton<?, I> to) {
        final int symbols = from.getInputAlphabet().size();
        for (int q = 0; q < from.size(); q++) {
            for (int a = 0; a < symbols; a++) {
                for (int t : from.getIntSuccessors(q, a)) {
                    to.addIntTransition(q, a, t);
                }
            }
            for (int t : from.getIntEpsilonSuccessors(q)) {
                to.addIntEpsilonTransition(q, t);
            }
        }
    }

    private int requireState(S state) {
        final int id = stateIds.getInt(state);
        if (id == MISSING_STATE) {
            throw new InvalidStateReferenceException(state);
        }
        return id;
    }

    private void checkId(int id) {
        if (id < 0 || id >= states.size()) {
            throw new InvalidStateReferenceException(id);
        }
    }

    // ---------------------------------------------------------------- queries

    @Override
    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    @Override
    public int size() {
        return states.size();
    }

    @Override
    public List<S> getStates() {
        return Collections.unmodifiableList(states);
    }

    @Override
    public Set<S> getInitialStates() {
        return labels(initial);
    }

    @Override
    public Set<S> getAcceptingStates() {
        return labels(accepting);
    }

    @Override
    public boolean isInitial(S state) {
        final int id = stateIds.getInt(state);
        return id != MISSING_STATE && initial.get(id);
    }

    @Override
    public boolean isAccepting(S state) {
        final int id = stateIds.getInt(state);
        return id != MISSING_STATE && accepting.get(id);
    }

    @Override
    public Set<S> getSuccessors(S state, I symbol) {
        final int sym = symbolIds.getInt(symbol);
        if (sym < 0) {
            throw new UnknownSymbolException(symbol);
        }
        final int id = stateIds.getInt(state);
        if (id == MISSING_STATE) {
            return Collections.emptySet();
        }
        return labels(getIntSuccessors(id, sym));
    }

    @Override
    public Set<S> getEpsilonSuccessors(S state) {
        final int id = stateIds.getInt(state);
        if (id == MISSING_STATE) {
            return Collections.emptySet();
        }
        return labels(getIntEpsilonSuccessors(id));
    }

    @Override
    public List<Transition<S, I>> getTransitions() {
        final List<Transition<S, I>> result = new ArrayList<>();
        for (int q = 0; q < size(); q++) {
            final S source = states.get(q);
            for (int a = 0; a < alphabet.size(); a++) {
                final I symbol = alphabet.getSymbol(a);
                for (int t : getIntSuccessors(q, a)) {
                    result.add(new Transition<>(source, symbol, states.get(t)));
                }
            }
            for (int t : getIntEpsilonSuccessors(q)) {
                result.add(new Transition<>(source, null, states.get(t)));
            }
        }
        return result;
    }

    @Override
    public boolean hasEpsilonTransitions() {
        return epsilonCount > 0;
    }

    @Override
    public int getStateId(S state) {
        return stateIds.getInt(state);
    }

    @Override
    public S getState(int id) {
        return states.get(id);
    }

    @Override
    public int getSymbolIndex(I symbol) {
        return symbolIds.getInt(symbol);
    }

    @Override
    public IntSet getIntSuccessors(int state, int symbolIndex) {
        final IntSet set = successors.get(state)[symbolIndex];
        return set == null ? IntSets.EMPTY_SET : IntSets.unmodifiable(set);
    }

    @Override
    public IntSet getIntEpsilonSuccessors(int state) {
        final IntSet set = epsilonSuccessors.get(state);
        return set == null ? IntSets.EMPTY_SET : IntSets.unmodifiable(set);
    }

    @Override
    public boolean isIntInitial(int state) {
        return initial.get(state);
    }

    @Override
    public boolean isIntAccepting(int state) {
        return accepting.get(state);
    }

    private Set<S> labels(BitSet ids) {
        final Set<S> result = new LinkedHashSet<>();
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            result.add(states.get(i));
        }
        return Collections.unmodifiableSet(result);
    }

    private Set<S> labels(IntSet ids) {
        final Set<S> result = new LinkedHashSet<>();
        for (int i : ids) {
            result.add(states.get(i));
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        return "FiniteAutomaton(\n"
            + "\talphabet: " + new ArrayList<>(alphabet) + "\n"
            + "\tstates: " + states + "\n"
            + "\tinitial states: " + getInitialStates() + "\n"
            + "\taccepting states: " + getAcceptingStates() + "\n"
            + "\ttransitions: " + getTransitions() + "\n"
            + ")";
    }
}
