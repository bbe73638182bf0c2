/*
 * @LICENSE@
 */

package org.fsmkit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.fsmkit.Automaton.Transition;
import org.fsmkit.Automaton.Type;

/**
 * Generates random automata, and random words in or out of an automaton's
 * language, mostly for testing. Like {@link RandomRegex} it draws from a
 * caller supplied {@link Random}.
 */
public final class RandomFsm {

    private final Random random;

    public RandomFsm(Random random) {
        if (random == null) throw new NullPointerException("null random source");
        this.random = random;
    }

    /**
     * Builds an automaton with states <code>s0, s1, ...</code> and symbols
     * <code>a0, a1, ...</code> (zero padded to a common width), initial state
     * <code>s0</code>, each state accepting with probability 1/2.
     * <p>
     * A {@linkplain Type#DFA DFA} gets exactly one random target for every
     * (state, symbol) pair. Otherwise every pair gets between 0 and
     * <code>maxTargets</code> distinct targets, and an
     * {@linkplain Type#ENFA eNFA} also draws epsilon transitions the same
     * way; a pair drawing no target has no transition.
     *
     * @throws IllegalArgumentException
     *             if there are no states or no symbols, or maxTargets is
     *             negative.
     */
    public Automaton automaton(Type type, int numStates, int numSymbols, int maxTargets) {
        if (numStates < 1) {
            throw new IllegalArgumentException("need at least one state: " + numStates);
        }
        if (numSymbols < 1) {
            throw new IllegalArgumentException("need at least one symbol: " + numSymbols);
        }
        if (maxTargets < 0) {
            throw new IllegalArgumentException("negative target count: " + maxTargets);
        }
        Automaton fsm = Automaton.newAutomaton();
        for (int i = 0; i < numStates; ++i) {
            fsm.addState(name("s", i, numStates));
        }
        for (int i = 0; i < numSymbols; ++i) {
            fsm.addSymbol(name("a", i, numSymbols));
        }
        fsm.setInitialState(fsm.states().get(0));
        for (Object state : fsm.states()) {
            if (random.nextBoolean()) {
                fsm.addAcceptingState(state);
            }
        }

        List<Object> symbols = new ArrayList<Object>(fsm.alphabet());
        if (type == Type.ENFA) {
            symbols.add(Automaton.EPSILON);
        }
        int max = Math.min(maxTargets, numStates);
        for (Object from : fsm.states()) {
            for (Object symbol : symbols) {
                int n = type == Type.DFA ? 1 : random.nextInt(max + 1);
                if (n == 0) continue;
                List<Object> to = choose(fsm.states(), n);
                if (symbol == Automaton.EPSILON) {
                    fsm.addEpsilonTransition(from, to);
                } else {
                    fsm.addTransition(from, to, symbol);
                }
            }
        }
        return fsm;
    }

    private static String name(String prefix, int i, int count) {
        StringBuilder sb = new StringBuilder(prefix);
        String digits = String.valueOf(i);
        for (int n = String.valueOf(count).length() - digits.length(); n > 0; --n) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }

    /*
     * n distinct items, in list order; selection sampling
     */
    private List<Object> choose(List<Object> items, int n) {
        List<Object> ret = new ArrayList<Object>(n);
        for (int k = 0; k < items.size() && ret.size() < n; ++k) {
            int needed = n - ret.size();
            int left = items.size() - k;
            if (random.nextInt(left) < needed) {
                ret.add(items.get(k));
            }
        }
        return ret;
    }

    /**
     * @return a random word the automaton accepts, or <code>null</code> if
     *         its language is empty.
     */
    public List<Object> stringInLanguage(Automaton fsm) {
        Automaton min = Automata.minimize(fsm);
        return walkBack(min, min.acceptingStates());
    }

    /**
     * @return a random word over the automaton's alphabet that it rejects,
     *         or <code>null</code> if it accepts every word.
     */
    public List<Object> stringNotInLanguage(Automaton fsm) {
        Automaton min = Automata.minimize(fsm);
        List<Object> rejecting = new ArrayList<Object>();
        for (Object state : min.states()) {
            if (!min.isAccepting(state)) {
                rejecting.add(state);
            }
        }
        return walkBack(min, rejecting);
    }

    /*
     * Picks one of targets and follows random incoming transitions of the
     * (total, reachable) dfa back to its initial state, where it stops with
     * probability 1/2 or when nothing leads there.
     */
    private List<Object> walkBack(Automaton dfa, List<Object> targets) {
        if (targets.isEmpty()) {
            return null;
        }
        Object current = targets.get(random.nextInt(targets.size()));
        List<Object> word = new ArrayList<Object>();
        while (true) {
            if (current.equals(dfa.initialState()) && random.nextBoolean()) {
                break;
            }
            List<Transition> incoming = new ArrayList<Transition>();
            for (Transition t : dfa.transitions()) {
                if (t.toStates().get(0).equals(current)) {
                    incoming.add(t);
                }
            }
            if (incoming.isEmpty()) {
                assert current.equals(dfa.initialState()) : current;
                break;
            }
            Transition t = incoming.get(random.nextInt(incoming.size()));
            word.add(t.symbol());
            current = t.fromState();
        }
        Collections.reverse(word);
        return word;
    }
}
