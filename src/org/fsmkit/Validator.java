/*
 * @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.Misc.contains;
import static org.fsmkit.Misc.containsAny;
import static org.fsmkit.Misc.containsFrom;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmkit.Automaton.Transition;
import org.fsmkit.AutomatonException.InvariantException;
import org.fsmkit.AutomatonException.StructureException;

/**
 * Checks every invariant of an {@link Automaton} and reports the first
 * violation found. Nothing is ever trimmed or repaired: a description that
 * is not valid is rejected with a {@link StructureException} (a required
 * part is missing) or an {@link InvariantException} (the parts are
 * inconsistent).
 * <p>
 * Checks are made in this order: structural shape, non-emptiness, state and
 * alphabet uniqueness and disjointness, epsilon exclusion from the alphabet,
 * accepting states, initial state, each transition record, and finally
 * duplicate (from, symbol) records.
 */
public final class Validator {

    private static final Logger logger = Logger.getLogger("org.fsmkit");
    private static final Level level = Level.FINE;

    private Validator() {}  // uninstantiable

    /**
     * Ingests an externally authored automaton description.
     *
     * @return a new automaton made of the given parts, if they are valid.
     * @throws StructureException
     *             if any part is missing.
     * @throws InvariantException
     *             if the parts are inconsistent.
     */
    public static Automaton validate(List<?> states, List<?> alphabet,
            Object initialState, List<?> acceptingStates,
            List<Transition> transitions) {
        if (states == null || alphabet == null || acceptingStates == null
                || initialState == null || transitions == null) {
            throw structure("automaton must be defined and have states, "
                + "alphabet, acceptingStates, initialState and transitions");
        }
        return validate(new Automaton(states, alphabet, initialState,
            acceptingStates, transitions));
    }

    /**
     * Checks every invariant of an automaton.
     *
     * @return fsm, unchanged, if it is valid.
     * @throws StructureException
     *             if any part is missing.
     * @throws InvariantException
     *             if the parts are inconsistent.
     */
    public static Automaton validate(Automaton fsm) {

        if (fsm == null || fsm.initialState == null) {
            throw structure("automaton must be defined and have an initial state");
        }
        if (fsm.states.contains(null) || fsm.alphabet.contains(null)
                || fsm.acceptingStates.contains(null)) {
            throw structure("states, alphabet symbols and accepting states must not be null");
        }
        for (Transition t : fsm.transitions) {
            if (t == null || t.from == null || t.to == null || t.symbol == null
                    || t.to.contains(null)) {
                throw structure("transitions must have fromState, toStates and symbol");
            }
        }

        if (fsm.states.isEmpty()) {
            throw invariant("set of states must not be empty");
        }
        if (fsm.alphabet.isEmpty()) {
            throw invariant("alphabet must not be empty");
        }
        if (Misc.hasDuplicates(fsm.states)) {
            throw invariant("equivalent states");
        }
        if (Misc.hasDuplicates(fsm.alphabet)) {
            throw invariant("equivalent alphabet symbols");
        }
        if (containsAny(fsm.states, fsm.alphabet)) {
            throw invariant("states and alphabet symbols must not overlap");
        }
        if (contains(fsm.alphabet, Automaton.EPSILON)) {
            throw invariant("alphabet must not contain the epsilon symbol");
        }

        for (int i = 0; i < fsm.acceptingStates.size(); ++i) {
            Object accepting = fsm.acceptingStates.get(i);
            if (containsFrom(fsm.acceptingStates, accepting, i + 1)) {
                throw invariant("equivalent accepting states");
            }
            if (!contains(fsm.states, accepting)) {
                throw invariant("each accepting state must be in states: " + accepting);
            }
        }

        if (!contains(fsm.states, fsm.initialState)) {
            throw invariant("initial state must be in states: " + fsm.initialState);
        }

        for (Transition t : fsm.transitions) {
            if (!contains(fsm.states, t.from)) {
                throw invariant("transition fromState must be in states: " + t);
            }
            if (!t.isEpsilon() && !contains(fsm.alphabet, t.symbol)) {
                throw invariant("transition symbol must be in alphabet: " + t);
            }
            for (int k = 0; k < t.to.size(); ++k) {
                if (!contains(fsm.states, t.to.get(k))) {
                    throw invariant("transition toStates must be in states: " + t);
                }
                if (containsFrom(t.to, t.to.get(k), k + 1)) {
                    throw invariant("transition toStates must not contain duplicates: " + t);
                }
            }
        }

        List<Transition> ts = fsm.transitions;
        for (int i = 0; i < ts.size(); ++i) {
            for (int j = i + 1; j < ts.size(); ++j) {
                if (ts.get(i).from.equals(ts.get(j).from)
                        && ts.get(i).symbol.equals(ts.get(j).symbol)) {
                    throw invariant("transitions for the same fromState and "
                        + "symbol must be defined in a single transition: "
                        + ts.get(i) + ", " + ts.get(j));
                }
            }
        }
        return fsm;
    }

    private static StructureException structure(String msg) {
        logger.log(level, "invalid automaton: " + msg);
        return new StructureException(msg);
    }

    private static InvariantException invariant(String msg) {
        logger.log(level, "invalid automaton: " + msg);
        return new InvariantException(msg);
    }
}
