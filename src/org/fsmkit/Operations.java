/*
 * @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.Misc.containsAny;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmkit.Automata.Fresh;
import org.fsmkit.Automata.Table;
import org.fsmkit.Automaton.Transition;
import org.fsmkit.Automaton.Type;
import org.fsmkit.AutomatonException.PreconditionException;

/**
 * Language operations on automata: the boolean operations, which work on
 * the product of two DFAs, and the Thompson style constructions
 * (concatenation, Kleene star, reversal), which wire operands together with
 * epsilon transitions.
 * <p>
 * Binary operations require both operands to have the same alphabet (as a
 * set); a {@link PreconditionException} is thrown otherwise.
 */
public final class Operations {

    private static final Logger logger = Logger.getLogger("org.fsmkit");
    private static final Level level = Level.FINER;

    private Operations() {}   // uninstantiable

    private enum Combine {
        UNION {
            @Override
            boolean accepts(boolean a, boolean b) {
                return a || b;
            }
        },
        INTERSECTION {
            @Override
            boolean accepts(boolean a, boolean b) {
                return a && b;
            }
        },
        DIFFERENCE {
            @Override
            boolean accepts(boolean a, boolean b) {
                return a && !b;
            }
        };
        abstract boolean accepts(boolean a, boolean b);
    }

    /*
     * language preserving: the product needs total, single target transitions
     */
    static Automaton toDfa(Automaton fsm) {
        switch (Automata.determineType(fsm)) {
        case ENFA:
            return Automata.convertNfaToDfa(Automata.convertEnfaToNfa(fsm));
        case NFA:
            return Automata.convertNfaToDfa(fsm);
        default:
            return fsm;
        }
    }

    /*
     * The full cross product: every pair of states, reachable or not, whose
     * components follow their own automaton on every symbol.
     */
    private static Automaton product(Automaton a, Automaton b, Combine combine) {
        Automata.checkSameAlphabet(a, b);
        Automaton dfaA = toDfa(a);
        Automaton dfaB = toDfa(b);
        Table ta = new Table(dfaA);
        Table tb = new Table(dfaB);

        List<Object> states = new ArrayList<Object>();
        List<Object> accepting = new ArrayList<Object>();
        List<Transition> transitions = new ArrayList<Transition>();
        for (Object p : dfaA.states) {
            for (Object q : dfaB.states) {
                Pair state = new Pair(p, q);
                states.add(state);
                if (combine.accepts(ta.accepting(p), tb.accepting(q))) {
                    accepting.add(state);
                }
                for (Object symbol : dfaA.alphabet) {
                    Pair next = new Pair(ta.next(p, symbol), tb.next(q, symbol));
                    transitions.add(new Transition(state,
                        Collections.singletonList(next), symbol));
                }
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, combine + ": " + dfaA.states.size() + " x "
                + dfaB.states.size() + " states");
        }
        return new Automaton(states, dfaA.alphabet,
            new Pair(dfaA.initialState, dfaB.initialState), accepting,
            transitions);
    }

    /**
     * @return a DFA accepting L(a) &#x222a; L(b). Its states are
     *         {@link Pair}s.
     */
    public static Automaton union(Automaton a, Automaton b) {
        return product(a, b, Combine.UNION);
    }

    /**
     * @return a DFA accepting L(a) &#x2229; L(b). Its states are
     *         {@link Pair}s.
     */
    public static Automaton intersection(Automaton a, Automaton b) {
        return product(a, b, Combine.INTERSECTION);
    }

    /**
     * @return a DFA accepting L(a) \ L(b). Its states are {@link Pair}s.
     */
    public static Automaton difference(Automaton a, Automaton b) {
        return product(a, b, Combine.DIFFERENCE);
    }

    /**
     * Swaps accepting and non accepting states.
     *
     * @throws PreconditionException
     *             if fsm is not a DFA, whose transition function is total.
     */
    public static Automaton complement(Automaton fsm) {
        if (Automata.determineType(fsm) != Type.DFA) {
            throw new PreconditionException("automaton must be a DFA");
        }
        List<Object> accepting = new ArrayList<Object>();
        for (Object state : fsm.states) {
            if (!fsm.isAccepting(state)) accepting.add(state);
        }
        return new Automaton(fsm.states, fsm.alphabet, fsm.initialState,
            accepting, fsm.transitions);
    }

    /**
     * @return true iff L(b) is a subset of L(a).
     */
    public static boolean isSubset(Automaton a, Automaton b) {
        Automaton both = intersection(a, b);
        return Automata.areEquivalentFSMs(toDfa(b), both);
    }

    /*
     * every state s of fsm becomes <tag, s>
     */
    private static Automaton relabel(Automaton fsm, Object tag) {
        List<Object> states = new ArrayList<Object>(fsm.states.size());
        List<Object> accepting = new ArrayList<Object>(fsm.acceptingStates.size());
        List<Transition> transitions = new ArrayList<Transition>(fsm.transitions.size());
        for (Object state : fsm.states) {
            states.add(new Pair(tag, state));
        }
        for (Object state : fsm.acceptingStates) {
            accepting.add(new Pair(tag, state));
        }
        for (Transition t : fsm.transitions) {
            List<Object> to = new ArrayList<Object>(t.to.size());
            for (Object target : t.to) {
                to.add(new Pair(tag, target));
            }
            transitions.add(new Transition(new Pair(tag, t.from), to, t.symbol));
        }
        return new Automaton(states, fsm.alphabet,
            new Pair(tag, fsm.initialState), accepting, transitions);
    }

    /**
     * An automaton accepting L(a)L(b). Every accepting state of a gets an
     * epsilon transition to the initial state of b; the accepting states are
     * those of b. If the operands share states, they are first relabelled to
     * <code>Pair(0, s)</code> and <code>Pair(1, s)</code> respectively.
     */
    public static Automaton concatenation(Automaton a, Automaton b) {
        Automata.checkSameAlphabet(a, b);
        if (containsAny(a.states, b.states)) {
            a = relabel(a, Integer.valueOf(0));
            b = relabel(b, Integer.valueOf(1));
        }
        List<Object> states = new ArrayList<Object>(a.states);
        states.addAll(b.states);
        List<Transition> transitions = new ArrayList<Transition>(a.transitions);
        transitions.addAll(b.transitions);

        Automaton ret = new Automaton(states, a.alphabet, a.initialState,
            b.acceptingStates, transitions);
        List<Object> toInitial = Collections.singletonList(b.initialState);
        for (Object state : a.acceptingStates) {
            ret.addEpsilonTransition(state, toInitial);
        }
        return ret;
    }

    /**
     * An automaton accepting L(fsm)*. A fresh state becomes the initial
     * state; it is accepting, has an epsilon transition to the old initial
     * state, and every old accepting state has an epsilon transition back to
     * it.
     */
    public static Automaton kleene(Automaton fsm) {
        Automaton ret = fsm.copy();
        Object start = Fresh.absentFrom(fsm.states);
        ret.addState(start);
        ret.addEpsilonTransition(start, Collections.singletonList(fsm.initialState));
        ret.initialState = start;
        List<Object> toStart = Collections.singletonList(start);
        for (Object state : fsm.acceptingStates) {
            ret.addEpsilonTransition(state, toStart);
        }
        ret.acceptingStates.add(start);
        return ret;
    }

    /**
     * An automaton accepting the reversal of every string of L(fsm). Every
     * transition is flipped; the old initial state is the only accepting
     * state; a fresh initial state has an epsilon transition to every old
     * accepting state.
     */
    public static Automaton reverse(Automaton fsm) {
        Automaton ret = new Automaton(fsm.states, fsm.alphabet,
            fsm.initialState, Collections.singletonList(fsm.initialState),
            Collections.<Transition>emptyList());
        for (Transition t : fsm.transitions) {
            List<Object> toFrom = Collections.singletonList(t.from);
            for (Object target : t.to) {
                if (t.isEpsilon()) {
                    ret.addEpsilonTransition(target, toFrom);
                } else {
                    ret.addTransition(target, toFrom, t.symbol);
                }
            }
        }
        Object start = Fresh.absentFrom(fsm.states);
        ret.addState(start);
        if (!fsm.acceptingStates.isEmpty()) {
            ret.addEpsilonTransition(start, fsm.acceptingStates);
        }
        ret.initialState = start;
        return ret;
    }
}
