/*@LICENSE@
 */

package org.fsmkit;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.fsmkit.RegexTree.Node;

/**
 * Static assertions on automata and regular expressions. Strings of symbols
 * are written as Java strings, one symbol per character.
 */
public final class FsmAssert {

    private FsmAssert() {}   // not instantiable.

    public static List<Object> list(Object... items) {
        return new ArrayList<Object>(Arrays.asList(items));
    }

    /**
     * @return the characters of s, each as a one character String.
     */
    public static List<Object> chars(String s) {
        List<Object> ret = new ArrayList<Object>(s.length());
        for (int i = 0; i < s.length(); ++i) {
            ret.add(String.valueOf(s.charAt(i)));
        }
        return ret;
    }

    private static boolean accepts(Automaton fsm, List<Object> word) {
        return Misc.containsAll(fsm.alphabet(), word)
            && Automata.isAccepted(fsm, word);
    }

    public static void assertAccepts(Automaton fsm, String... words) {
        for (String word : words) {
            assertTrue("should accept \"" + word + "\"", accepts(fsm, chars(word)));
        }
    }

    public static void assertRejects(Automaton fsm, String... words) {
        for (String word : words) {
            assertFalse("should reject \"" + word + "\"", accepts(fsm, chars(word)));
        }
    }

    /**
     * Language equivalence, decided on the minimal DFAs. The alphabets must
     * be equal as sets.
     */
    public static void assertEquivalent(Automaton expected, Automaton actual) {
        assertTrue("not equivalent:" + Misc.LS + expected + Misc.LS + actual,
            Automata.areEquivalentFSMs(Automata.minimize(expected),
                Automata.minimize(actual)));
    }

    public static void assertNotEquivalent(Automaton expected, Automaton actual) {
        assertFalse("equivalent:" + Misc.LS + expected + Misc.LS + actual,
            Automata.areEquivalentFSMs(Automata.minimize(expected),
                Automata.minimize(actual)));
    }

    /**
     * Language equivalence of two trees, over the symbols of both.
     */
    public static void assertSameLanguage(Node expected, Node actual) {
        List<Object> alphabet = Misc.union(Simplifier.symbolsOf(expected),
            Simplifier.symbolsOf(actual));
        assertTrue("not the same language: " + expected + " / " + actual,
            Automata.areEquivalentFSMs(
                Automata.minimize(RegexTree.toAutomaton(expected, alphabet)),
                Automata.minimize(RegexTree.toAutomaton(actual, alphabet))));
    }

    public static void assertSameLanguage(String expected, String actual) {
        assertSameLanguage(RegexString.toTree(expected), RegexString.toTree(actual));
    }

    /**
     * Compares acceptance of every string over the union of both alphabets
     * of length <code>maxLength</code> or less.
     */
    public static void assertSameLanguageUpTo(Automaton expected,
            Automaton actual, int maxLength) {
        List<Object> alphabet = Misc.union(expected.alphabet(), actual.alphabet());
        List<List<Object>> words = new ArrayList<List<Object>>();
        words.add(new ArrayList<Object>());
        for (int length = 0; length <= maxLength; ++length) {
            List<List<Object>> longer = new ArrayList<List<Object>>();
            for (List<Object> word : words) {
                assertEquals("acceptance of " + word,
                    accepts(expected, word), accepts(actual, word));
                for (Object symbol : alphabet) {
                    List<Object> next = new ArrayList<Object>(word);
                    next.add(symbol);
                    longer.add(next);
                }
            }
            words = longer;
        }
    }
}
