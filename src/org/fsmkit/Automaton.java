/*
 * @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.Misc.LS;
import static org.fsmkit.Misc.contains;
import static org.fsmkit.Misc.containsAll;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.fsmkit.AutomatonException.InvariantException;
import org.fsmkit.AutomatonException.PreconditionException;
import org.fsmkit.AutomatonException.StructureException;

/**
 * A finite automaton - deterministic, nondeterministic or nondeterministic
 * with epsilon transitions - over arbitrary state and symbol values.
 * <p>
 * States and symbols are plain objects; identity is decided by
 * {@link Object#equals(Object)} (and <code>hashCode()</code>, which must be
 * consistent with it), never by reference. The reserved {@link #EPSILON}
 * marker labels epsilon transitions and is never an alphabet symbol.
 * <p>
 * An automaton is built incrementally with {@link #newAutomaton()} followed
 * by {@link #addState(Object)}, {@link #addSymbol(Object)},
 * {@link #setInitialState(Object)}, {@link #addAcceptingState(Object)},
 * {@link #addTransition(Object, Collection, Object)} and
 * {@link #addEpsilonTransition(Object, Collection)}. Each of these checks its
 * own precondition; {@link Validator#validate(Automaton)} checks the whole.
 * Externally authored descriptions are ingested through
 * {@link Validator#validate(List, List, Object, List, List)}.
 * <p>
 * Once built, an automaton is only read by the algorithms in
 * {@link Automata} and {@link Operations}; every transformation returns a
 * new, independently owned instance.
 */
public final class Automaton {

    /**
     * The classification of an automaton by the shape of its transition
     * function (not by reachability).
     */
    public enum Type {
        /**
         * No epsilon transitions, exactly one transition with exactly one
         * target for every (state, symbol) pair.
         */
        DFA,
        /**
         * No epsilon transitions, but missing or multi-target transitions.
         */
        NFA,
        /**
         * At least one epsilon transition.
         */
        ENFA;
    }

    private enum Marker {
        EPSILON;
        @Override
        public String toString() {
            return "$";
        }
    }

    /**
     * The reserved label of epsilon transitions. No other value is equal to
     * it.
     */
    public static final Object EPSILON = Marker.EPSILON;

    /**
     * A transition record: every state reachable from <code>from</code> on
     * <code>symbol</code>. There is at most one record per (from, symbol)
     * pair in a valid automaton. Instances are immutable; missing parts are
     * reported by the {@link Validator}, not here.
     */
    public static final class Transition {

        final Object from;
        final Object symbol;
        final List<Object> to;

        public Transition(Object from, Collection<?> to, Object symbol) {
            this.from = from;
            this.symbol = symbol;
            this.to = to == null ? null : Collections.unmodifiableList(
                new ArrayList<Object>(to));
        }

        public static Transition epsilon(Object from, Collection<?> to) {
            return new Transition(from, to, EPSILON);
        }

        public Object fromState() {
            return from;
        }

        public Object symbol() {
            return symbol;
        }

        public List<Object> toStates() {
            return to;
        }

        public boolean isEpsilon() {
            return symbol == EPSILON;
        }

        /*
         * this record with the targets in to added, each at most once
         */
        Transition merge(Collection<?> to) {
            return new Transition(from, Misc.union(this.to, to), symbol);
        }

        @Override
        public String toString() {
            return from + " -" + symbol + "-> " + to;
        }
    }

    final List<Object> states;
    final List<Object> alphabet;
    final List<Object> acceptingStates;
    Object initialState;
    final List<Transition> transitions;

    /*
     * unchecked: callers in this package are responsible for the invariants.
     */
    Automaton(Collection<?> states, Collection<?> alphabet,
            Object initialState, Collection<?> acceptingStates,
            Collection<Transition> transitions) {
        this.states = new ArrayList<Object>(states);
        this.alphabet = new ArrayList<Object>(alphabet);
        this.initialState = initialState;
        this.acceptingStates = new ArrayList<Object>(acceptingStates);
        this.transitions = new ArrayList<Transition>(transitions);
    }

    private Automaton() {
        this(Collections.emptyList(), Collections.emptyList(), null,
            Collections.emptyList(), Collections.<Transition>emptyList());
    }

    /**
     * Creates an empty automaton: no states, no symbols, no initial state.
     * It does not {@linkplain Validator#validate(Automaton) validate} until
     * at least one state, one symbol and the initial state have been added.
     *
     * @return the new automaton.
     */
    public static Automaton newAutomaton() {
        return new Automaton();
    }

    /**
     * @return an independently owned copy of this automaton.
     */
    public Automaton copy() {
        return new Automaton(states, alphabet, initialState, acceptingStates,
            transitions);
    }

    /**
     * Adds a state.
     *
     * @param state
     *            the state value; must not be <code>null</code>.
     * @return the added state.
     * @throws StructureException
     *             if state is <code>null</code>.
     * @throws InvariantException
     *             if an equal state already exists.
     */
    public Object addState(Object state) {
        if (state == null) {
            throw new StructureException("no state object specified");
        }
        if (contains(states, state)) {
            throw new InvariantException("state already exists: " + state);
        }
        states.add(state);
        return state;
    }

    /**
     * Adds an alphabet symbol.
     *
     * @param symbol
     *            the symbol value; must not be <code>null</code>.
     * @return the added symbol.
     * @throws StructureException
     *             if symbol is <code>null</code>.
     * @throws InvariantException
     *             if the symbol is {@link #EPSILON} or already present.
     */
    public Object addSymbol(Object symbol) {
        if (symbol == null) {
            throw new StructureException("no symbol object specified");
        }
        if (symbol.equals(EPSILON)) {
            throw new InvariantException(
                "can't add the epsilon symbol to the alphabet");
        }
        if (contains(alphabet, symbol)) {
            throw new InvariantException("symbol already exists: " + symbol);
        }
        alphabet.add(symbol);
        return symbol;
    }

    public void setInitialState(Object state) {
        checkState(state);
        initialState = state;
    }

    /**
     * Makes a state accepting.
     *
     * @throws PreconditionException
     *             if state is not a state of this automaton.
     * @throws InvariantException
     *             if state is already accepting.
     */
    public void addAcceptingState(Object state) {
        checkState(state);
        if (contains(acceptingStates, state)) {
            throw new InvariantException(
                "the specified state is already accepting: " + state);
        }
        acceptingStates.add(state);
    }

    /**
     * Adds a transition from <code>from</code> to every state in
     * <code>toStates</code> on <code>symbol</code>. If a record for (from,
     * symbol) already exists, the targets are merged into it (set union);
     * otherwise a new record is appended.
     *
     * @throws PreconditionException
     *             if symbol is not in the alphabet, or any of the states is
     *             unknown.
     */
    public void addTransition(Object from, Collection<?> toStates,
            Object symbol) {
        if (!contains(alphabet, symbol)) {
            throw new PreconditionException(
                "not an alphabet symbol of the automaton: " + symbol);
        }
        putTransition(from, toStates, symbol);
    }

    /**
     * Like {@link #addTransition(Object, Collection, Object)}, labelled with
     * {@link #EPSILON}: the transition consumes no input.
     */
    public void addEpsilonTransition(Object from, Collection<?> toStates) {
        putTransition(from, toStates, EPSILON);
    }

    private void putTransition(Object from, Collection<?> toStates,
            Object symbol) {
        if (toStates == null) {
            throw new StructureException("no target states specified");
        }
        if (!contains(states, from) || !containsAll(states, toStates)) {
            throw new PreconditionException(
                "one of the specified objects is not a state of the automaton: "
                    + from + ", " + toStates);
        }
        for (int i = 0; i < transitions.size(); ++i) {
            Transition t = transitions.get(i);
            if (t.from.equals(from) && t.symbol.equals(symbol)) {
                transitions.set(i, t.merge(toStates));
                return;
            }
        }
        transitions.add(new Transition(from, Misc.union(
            Collections.emptyList(), toStates), symbol));
    }

    private void checkState(Object state) {
        if (!contains(states, state)) {
            throw new PreconditionException(
                "the specified object is not a state of the automaton: " + state);
        }
    }

    public List<Object> states() {
        return Collections.unmodifiableList(states);
    }

    public List<Object> alphabet() {
        return Collections.unmodifiableList(alphabet);
    }

    public List<Object> acceptingStates() {
        return Collections.unmodifiableList(acceptingStates);
    }

    public Object initialState() {
        return initialState;
    }

    public List<Transition> transitions() {
        return Collections.unmodifiableList(transitions);
    }

    public boolean isAccepting(Object state) {
        return contains(acceptingStates, state);
    }

    /**
     * @return the record for (from, symbol), or <code>null</code>.
     */
    public Transition transition(Object from, Object symbol) {
        for (Transition t : transitions) {
            if (t.from.equals(from) && t.symbol.equals(symbol)) return t;
        }
        return null;
    }

    private static final String INDENT = "    ";

    /**
     * A plain text rendering of the transition table, one state per
     * paragraph.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(states.size())
            .append(" alphabet: ").append(alphabet)
            .append(" transitions: ").append(transitions.size())
            .append(LS);
        for (Object state : states) {
            sb.append("state: ").append(state).append(' ');
            if (state.equals(initialState)) sb.append("(init) ");
            if (isAccepting(state))         sb.append("(accept) ");
            sb.append(LS);
            for (Transition t : transitions) {
                if (!t.from.equals(state)) continue;
                sb.append(INDENT).append(t.symbol).append(" -> ")
                    .append(t.to).append(LS);
            }
        }
        return sb.toString();
    }
}
