/*
 * @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.Misc.areEqualSets;
import static org.fsmkit.Misc.contains;
import static org.fsmkit.Misc.containsAll;
import static org.fsmkit.Misc.containsAny;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmkit.Automaton.Transition;
import org.fsmkit.Automaton.Type;
import org.fsmkit.AutomatonException.PreconditionException;
import org.fsmkit.Misc.WorkQueue;

/**
 * Uninstantiable class holding the static algorithms on {@link Automaton}s:
 * stepping and reading input, classification, epsilon elimination, subset
 * construction, and minimization. None of these mutate their arguments;
 * every transformation returns a new automaton.
 * <p>
 * Set valued results (epsilon closures, transition targets) are returned as
 * lists without duplicates, in discovery order.
 */
public final class Automata {

    private static final Logger logger = Logger.getLogger("org.fsmkit");
    private static final Level level = Level.FINER;

    private Automata() {}   // uninstantiable

    /**
     * A state introduced by a construction (the new initial state of
     * {@link Operations#kleene(Automaton)} and
     * {@link Operations#reverse(Automaton)}). Always chosen so that it is not
     * equal to any state of the operand.
     */
    public static final class Fresh {

        private final int id;

        private Fresh(int id) {
            this.id = id;
        }

        static Fresh absentFrom(Collection<?> states) {
            int id = 0;
            while (contains(states, new Fresh(id))) {
                ++id;
            }
            return new Fresh(id);
        }

        @Override
        public int hashCode() {
            return 31 + id;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Fresh && ((Fresh) obj).id == id;
        }

        @Override
        public String toString() {
            return "new" + id;
        }
    }

    /**
     * Transition lookup by (from, symbol), built once per algorithm
     * invocation so that the algorithms don't have to scan the transition
     * list for every step.
     */
    static final class Table {

        private final Map<Object, Map<Object, List<Object>>> map =
            new HashMap<Object, Map<Object, List<Object>>>();
        private final Set<Object> accepting;

        Table(Automaton fsm) {
            for (Transition t : fsm.transitions) {
                Map<Object, List<Object>> bySymbol = map.get(t.from);
                if (bySymbol == null) {
                    bySymbol = new LinkedHashMap<Object, List<Object>>();
                    map.put(t.from, bySymbol);
                }
                bySymbol.put(t.symbol, t.to);
            }
            accepting = new HashSet<Object>(fsm.acceptingStates);
        }

        List<Object> targets(Object from, Object symbol) {
            Map<Object, List<Object>> bySymbol = map.get(from);
            if (bySymbol == null) return Collections.emptyList();
            List<Object> to = bySymbol.get(symbol);
            return to == null ? Collections.emptyList() : to;
        }

        /*
         * the single target of a DFA transition
         */
        Object next(Object from, Object symbol) {
            List<Object> to = targets(from, symbol);
            assert to.size() == 1 : from + " " + symbol + " " + to;
            return to.get(0);
        }

        Collection<List<Object>> allTargets(Object from) {
            Map<Object, List<Object>> bySymbol = map.get(from);
            if (bySymbol == null) return Collections.emptyList();
            return bySymbol.values();
        }

        boolean accepting(Object state) {
            return accepting.contains(state);
        }

        List<Object> closure(Collection<?> states) {
            WorkQueue<Object> queue = new WorkQueue<Object>(states);
            List<Object> ret = new ArrayList<Object>();
            while (!queue.isEmpty()) {
                Object current = queue.poll();
                ret.add(current);
                queue.addAll(targets(current, Automaton.EPSILON));
            }
            return ret;
        }

        List<Object> step(Collection<?> states, Object symbol) {
            Set<Object> ret = new LinkedHashSet<Object>();
            for (Object state : states) {
                ret.addAll(targets(state, symbol));
            }
            return new ArrayList<Object>(ret);
        }

        List<Object> extendedStep(Collection<?> states, Object symbol) {
            return closure(step(closure(states), symbol));
        }
    }

    /**
     * Classifies an automaton by the shape of its transition function. Any
     * epsilon-labelled record makes it an {@linkplain Type#ENFA eNFA}; any
     * record with zero or several targets, or a missing (state, symbol)
     * record, makes it an {@linkplain Type#NFA NFA}; otherwise it is a
     * {@linkplain Type#DFA DFA}.
     */
    public static Type determineType(Automaton fsm) {
        Type type = Type.DFA;
        for (Transition t : fsm.transitions) {
            if (t.isEpsilon()) {
                return Type.ENFA;
            } else if (t.to.size() != 1) {
                type = Type.NFA;
            }
        }
        if (type == Type.DFA
                && fsm.transitions.size() != fsm.states.size() * fsm.alphabet.size()) {
            type = Type.NFA;
        }
        return type;
    }

    public static boolean isAcceptingState(Automaton fsm, Object state) {
        return fsm.isAccepting(state);
    }

    /**
     * The smallest superset of <code>states</code> closed under epsilon
     * transitions.
     *
     * @throws PreconditionException
     *             if any of the states is unknown.
     */
    public static List<Object> epsilonClosure(Automaton fsm, Collection<?> states) {
        checkStates(fsm, states);
        return new Table(fsm).closure(states);
    }

    /**
     * The union of the targets of the <code>symbol</code> transitions of all
     * the given states. Epsilon transitions are not followed.
     */
    public static List<Object> step(Automaton fsm, Collection<?> states, Object symbol) {
        checkStates(fsm, states);
        checkSymbol(fsm, symbol);
        return new Table(fsm).step(states, symbol);
    }

    /**
     * <code>epsilonClosure(step(epsilonClosure(states), symbol))</code>.
     */
    public static List<Object> extendedTransition(Automaton fsm,
            Collection<?> states, Object symbol) {
        checkStates(fsm, states);
        checkSymbol(fsm, symbol);
        return new Table(fsm).extendedStep(states, symbol);
    }

    /**
     * Runs the automaton on a sequence of symbols.
     *
     * @return the states the automaton can be in after reading all of them.
     */
    public static List<Object> readString(Automaton fsm, List<?> symbols) {
        for (Object symbol : symbols) {
            checkSymbol(fsm, symbol);
        }
        Table table = new Table(fsm);
        List<Object> states = table.closure(Collections.singletonList(fsm.initialState));
        for (Object symbol : symbols) {
            states = table.extendedStep(states, symbol);
        }
        return states;
    }

    public static boolean isAccepted(Automaton fsm, List<?> symbols) {
        return containsAny(fsm.acceptingStates, readString(fsm, symbols));
    }

    public static boolean isStringInLanguage(Automaton fsm, List<?> symbols) {
        return isAccepted(fsm, symbols);
    }

    /**
     * Runs the automaton on a sequence of symbols starting from
     * <code>state</code>, recording every set of states on the way.
     *
     * @return <code>symbols.size() + 1</code> state sets, the first one being
     *         <code>[state]</code>.
     */
    public static List<List<Object>> transitionTrail(Automaton fsm,
            Object state, List<?> symbols) {
        checkStates(fsm, Collections.singletonList(state));
        for (Object symbol : symbols) {
            checkSymbol(fsm, symbol);
        }
        Table table = new Table(fsm);
        List<List<Object>> trail = new ArrayList<List<Object>>();
        List<Object> states = Collections.singletonList(state);
        trail.add(states);
        for (Object symbol : symbols) {
            states = table.extendedStep(states, symbol);
            trail.add(states);
        }
        return trail;
    }

    /**
     * @return the symbols (possibly including {@link Automaton#EPSILON}) of
     *         the transitions leading directly from p to q.
     */
    public static List<Object> symbolsForTransitions(Automaton fsm, Object p, Object q) {
        List<Object> ret = new ArrayList<Object>();
        for (Transition t : fsm.transitions) {
            if (t.from.equals(p) && contains(t.to, q)) {
                ret.add(t.symbol);
            }
        }
        return ret;
    }

    /**
     * The states reachable from <code>state</code> by following transitions
     * of any label, epsilon included.
     *
     * @param includeState
     *            whether <code>state</code> itself is part of the result
     *            when it is not reachable from itself.
     */
    public static List<Object> reachableStates(Automaton fsm, Object state,
            boolean includeState) {
        Table table = new Table(fsm);
        List<Object> ret = new ArrayList<Object>();
        WorkQueue<Object> queue = new WorkQueue<Object>();
        if (includeState) {
            queue.offer(state);
        } else {
            for (List<Object> to : table.allTargets(state)) queue.addAll(to);
        }
        while (!queue.isEmpty()) {
            Object current = queue.poll();
            ret.add(current);
            for (List<Object> to : table.allTargets(current)) {
                queue.addAll(to);
            }
        }
        return ret;
    }

    /**
     * Drops every state that can't be reached from the initial state,
     * together with its accepting flag and its transition records.
     */
    public static Automaton removeUnreachableStates(Automaton fsm) {
        Set<Object> reachable = new HashSet<Object>(
            reachableStates(fsm, fsm.initialState, true));
        List<Object> states = new ArrayList<Object>();
        List<Object> accepting = new ArrayList<Object>();
        List<Transition> transitions = new ArrayList<Transition>();
        for (Object state : fsm.states) {
            if (reachable.contains(state)) states.add(state);
        }
        for (Object state : fsm.acceptingStates) {
            if (reachable.contains(state)) accepting.add(state);
        }
        for (Transition t : fsm.transitions) {
            if (reachable.contains(t.from)) transitions.add(t);
        }
        return new Automaton(states, fsm.alphabet, fsm.initialState,
            accepting, transitions);
    }

    /**
     * Eliminates epsilon transitions. For each state p and symbol a, the
     * extended transition of {p} on a becomes the direct transition of p on
     * a. The initial state becomes accepting when its epsilon closure
     * contains an accepting state, so that the empty string is still
     * accepted. An automaton without epsilon transitions is returned as a
     * copy.
     */
    public static Automaton convertEnfaToNfa(Automaton fsm) {
        if (determineType(fsm) != Type.ENFA) {
            return fsm.copy();
        }
        Table table = new Table(fsm);
        List<Object> accepting = new ArrayList<Object>(fsm.acceptingStates);
        List<Object> initialClosure = table.closure(
            Collections.singletonList(fsm.initialState));
        if (containsAny(accepting, initialClosure)
                && !contains(accepting, fsm.initialState)) {
            accepting.add(fsm.initialState);
        }
        List<Transition> transitions = new ArrayList<Transition>();
        for (Object state : fsm.states) {
            for (Object symbol : fsm.alphabet) {
                List<Object> to = table.extendedStep(
                    Collections.singletonList(state), symbol);
                if (!to.isEmpty()) {
                    transitions.add(new Transition(state, to, symbol));
                }
            }
        }
        return new Automaton(fsm.states, fsm.alphabet, fsm.initialState,
            accepting, transitions);
    }

    private static Set<Object> stateSetFrom(Collection<?> states) {
        return Collections.unmodifiableSet(new LinkedHashSet<Object>(states));
    }

    /**
     * Subset construction. Every state s of the NFA becomes the DFA state
     * {s}; sets of several NFA states reached on some symbol become new DFA
     * states, accepting iff they contain an accepting NFA state. States of
     * the result are therefore {@link Set}s, compared by value. Whenever a
     * state has no target on some symbol, the transition goes to the sink:
     * the empty set, added once, looping on every symbol. The transition
     * function of the result is total.
     *
     * @return a DFA accepting the same language; a copy if fsm already is a
     *         DFA.
     * @throws PreconditionException
     *             if fsm has epsilon transitions.
     */
    public static Automaton convertNfaToDfa(Automaton fsm) {
        Type type = determineType(fsm);
        if (type == Type.ENFA) {
            throw new PreconditionException("automaton must be an NFA");
        }
        if (type == Type.DFA) {
            return fsm.copy();
        }
        Table table = new Table(fsm);

        List<Object> states = new ArrayList<Object>();
        List<Object> accepting = new ArrayList<Object>();
        List<Transition> transitions = new ArrayList<Transition>();

        WorkQueue<Set<Object>> queue = new WorkQueue<Set<Object>>();
        for (Object state : fsm.states) {
            Set<Object> seed = stateSetFrom(Collections.singleton(state));
            queue.offer(seed);
            states.add(seed);
            if (table.accepting(state)) accepting.add(seed);
        }

        final Set<Object> sink = Collections.emptySet();
        boolean sinkAdded = false;

        while (!queue.isEmpty()) {
            Set<Object> current = queue.poll();
            for (Object symbol : fsm.alphabet) {
                Set<Object> next = stateSetFrom(table.step(current, symbol));
                if (next.isEmpty()) {
                    sinkAdded = true;
                    next = sink;
                } else if (queue.offer(next)) {
                    assert next.size() > 1;
                    states.add(next);
                    if (containsAny(fsm.acceptingStates, next)) accepting.add(next);
                }
                transitions.add(new Transition(current,
                    Collections.singletonList(next), symbol));
            }
        }
        if (sinkAdded) {
            states.add(sink);
            for (Object symbol : fsm.alphabet) {
                transitions.add(new Transition(sink,
                    Collections.singletonList(sink), symbol));
            }
        }

        Automaton dfa = new Automaton(states, fsm.alphabet,
            stateSetFrom(Collections.singleton(fsm.initialState)),
            accepting, transitions);
        assert determineType(dfa) == Type.DFA;
        if (logger.isLoggable(level)) {
            logger.log(level, "subset construction: " + fsm.states.size()
                + " NFA states -> " + states.size() + " DFA states");
        }
        return dfa;
    }

    private static void checkDfa(Automaton fsm) {
        if (determineType(fsm) != Type.DFA) {
            throw new PreconditionException("automaton must be a DFA");
        }
    }

    /*
     * Product exploration: walk the pairs reachable from (p, q) by
     * synchronized transitions; p and q are equivalent iff no reached pair
     * disagrees on acceptance.
     */
    private static boolean equivalent(Automaton a, Table ta, Object p,
            Table tb, Object q) {
        WorkQueue<Pair> queue = new WorkQueue<Pair>();
        queue.offer(new Pair(p, q));
        while (!queue.isEmpty()) {
            Pair current = queue.poll();
            if (ta.accepting(current.l()) != tb.accepting(current.r())) {
                return false;
            }
            for (Object symbol : a.alphabet) {
                queue.offer(new Pair(ta.next(current.l(), symbol),
                    tb.next(current.r(), symbol)));
            }
        }
        return true;
    }

    /**
     * Decides whether state p of DFA a and state q of DFA b accept the same
     * language.
     *
     * @throws PreconditionException
     *             if either automaton is not a DFA, if their alphabets
     *             differ, or if p or q is unknown.
     */
    public static boolean areEquivalentStates(Automaton a, Object p,
            Automaton b, Object q) {
        checkDfa(a);
        checkDfa(b);
        checkSameAlphabet(a, b);
        if (!contains(a.states, p) || !contains(b.states, q)) {
            throw new PreconditionException("automata must contain states: "
                + p + ", " + q);
        }
        return equivalent(a, new Table(a), p, new Table(b), q);
    }

    /**
     * Language equivalence of two DFAs over the same alphabet.
     */
    public static boolean areEquivalentFSMs(Automaton a, Automaton b) {
        return areEquivalentStates(a, a.initialState, b, b.initialState);
    }

    /**
     * Merges equivalent states of a DFA. Each state collapses into the
     * earliest state (in state order) equivalent to it, in the state set,
     * the accepting set, the initial state and the transition targets; the
     * transition records of collapsed states are dropped.
     *
     * @throws PreconditionException
     *             if fsm is not a DFA.
     */
    public static Automaton removeEquivalentStates(Automaton fsm) {
        checkDfa(fsm);
        Table table = new Table(fsm);

        final Map<Object, Object> representative = new HashMap<Object, Object>();
        for (int j = 0; j < fsm.states.size(); ++j) {
            Object q = fsm.states.get(j);
            for (int i = 0; i < j; ++i) {
                Object p = fsm.states.get(i);
                if (!representative.containsKey(p)
                        && equivalent(fsm, table, p, table, q)) {
                    representative.put(q, p);
                    break;
                }
            }
        }

        List<Object> states = new ArrayList<Object>();
        List<Object> accepting = new ArrayList<Object>();
        List<Transition> transitions = new ArrayList<Transition>();
        for (Object state : fsm.states) {
            if (!representative.containsKey(state)) states.add(state);
        }
        for (Object state : fsm.acceptingStates) {
            if (!representative.containsKey(state)) accepting.add(state);
        }
        for (Transition t : fsm.transitions) {
            if (representative.containsKey(t.from)) continue;
            List<Object> to = new ArrayList<Object>(t.to.size());
            for (Object target : t.to) {
                Object rep = representative.get(target);
                to.add(rep == null ? target : rep);
            }
            transitions.add(new Transition(t.from, to, t.symbol));
        }
        Object rep = representative.get(fsm.initialState);
        return new Automaton(states, fsm.alphabet,
            rep == null ? fsm.initialState : rep, accepting, transitions);
    }

    /**
     * Converts to a DFA if necessary, then removes unreachable and
     * equivalent states.
     *
     * @return the minimal DFA accepting the language of fsm.
     */
    public static Automaton minimize(Automaton fsm) {
        Automaton dfa;
        switch (determineType(fsm)) {
        case ENFA:
            dfa = convertNfaToDfa(convertEnfaToNfa(fsm));
            break;
        case NFA:
            dfa = convertNfaToDfa(fsm);
            break;
        case DFA:
            dfa = fsm.copy();
            break;
        default:
            throw new AssertionError();
        }
        Automaton ret = removeEquivalentStates(removeUnreachableStates(dfa));
        if (logger.isLoggable(level)) {
            logger.log(level, "minimize: " + fsm.states.size() + " -> "
                + ret.states.size() + " states");
        }
        return ret;
    }

    /**
     * @return true iff the automaton accepts at least one string.
     */
    public static boolean isLanguageNonEmpty(Automaton fsm) {
        return !minimize(fsm).acceptingStates.isEmpty();
    }

    /**
     * @return true iff the automaton accepts infinitely many strings.
     */
    public static boolean isLanguageInfinite(Automaton fsm) {
        Automaton min = minimize(fsm);

        Object dead = null;
        for (Object state : min.states) {
            if (min.isAccepting(state)) continue;
            if (containsAny(min.acceptingStates, reachableStates(min, state, true))) {
                continue;
            }
            dead = state;
            break;
        }
        if (dead == null) {
            return true;
        }
        for (Object state : min.states) {
            if (state.equals(dead)) continue;
            if (contains(reachableStates(min, state, false), state)) {
                return true;
            }
        }
        return false;
    }

    /**
     * State elimination. With the states numbered 0..n-1 in state order,
     * R<sub>0</sub>[i][j] is the alternation of the symbols labelling the
     * transitions from i to j (epsilon included when i == j), and
     * R<sub>k</sub>[i][j] = R<sub>k-1</sub>[i][j] +
     * R<sub>k-1</sub>[i][k-1] (R<sub>k-1</sub>[k-1][k-1])*
     * R<sub>k-1</sub>[k-1][j]. The result is the alternation of
     * R<sub>n</sub>[initial][a] over the accepting states a.
     * <p>
     * Epsilon transitions become {@link RegexTree.Eps} nodes. The tree is
     * not simplified and shares subtrees; its size grows exponentially with
     * the number of states, so it is normally handed to the
     * {@link Simplifier} next.
     */
    public static RegexTree.Node toRegex(Automaton fsm) {
        final int n = fsm.states.size();
        RegexTree.Node[][] r = new RegexTree.Node[n][n];
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j < n; ++j) {
                List<RegexTree.Node> choices = new ArrayList<RegexTree.Node>();
                for (Object symbol : symbolsForTransitions(fsm,
                        fsm.states.get(i), fsm.states.get(j))) {
                    choices.add(symbol == Automaton.EPSILON
                        ? RegexTree.makeEps() : RegexTree.makeLit(symbol));
                }
                if (i == j) {
                    choices.add(RegexTree.makeEps());
                }
                r[i][j] = RegexTree.makeAlt(choices);
            }
        }
        for (int k = 1; k <= n; ++k) {
            RegexTree.Node[][] next = new RegexTree.Node[n][n];
            for (int i = 0; i < n; ++i) {
                for (int j = 0; j < n; ++j) {
                    next[i][j] = RegexTree.makeAlt(r[i][j], RegexTree.makeSeq(
                        r[i][k - 1], RegexTree.makeKStar(r[k - 1][k - 1]),
                        r[k - 1][j]));
                }
            }
            r = next;
        }

        int start = fsm.states.indexOf(fsm.initialState);
        List<RegexTree.Node> choices = new ArrayList<RegexTree.Node>();
        for (int i = 0; i < n; ++i) {
            if (fsm.isAccepting(fsm.states.get(i))) {
                choices.add(r[start][i]);
            }
        }
        return RegexTree.makeAlt(choices);
    }

    static void checkSameAlphabet(Automaton a, Automaton b) {
        if (!areEqualSets(a.alphabet, b.alphabet)) {
            throw new PreconditionException("automaton alphabets must be the same: "
                + a.alphabet + ", " + b.alphabet);
        }
    }

    private static void checkStates(Automaton fsm, Collection<?> states) {
        if (!containsAll(fsm.states, states)) {
            throw new PreconditionException(
                "automaton must contain all the states: " + states);
        }
    }

    private static void checkSymbol(Automaton fsm, Object symbol) {
        if (!contains(fsm.alphabet, symbol)) {
            throw new PreconditionException(
                "automaton must contain the input symbol: " + symbol);
        }
    }
}
