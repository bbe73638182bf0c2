/*@LICENSE@
 */
package org.fsmkit.test;

import static org.fsmkit.FsmAssert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.fsmkit.AbstractFsmTestCase;
import org.fsmkit.Automata;
import org.fsmkit.Automaton;
import org.fsmkit.Automaton.Transition;
import org.fsmkit.Operations;
import org.fsmkit.RandomRegex;
import org.fsmkit.RegexArray;
import org.fsmkit.RegexString;
import org.fsmkit.RegexTree;
import org.fsmkit.RegexTree.Node;
import org.fsmkit.Simplifier;
import org.fsmkit.Validator;

/**
 * End to end runs through the public API: notation to automaton, automaton
 * algorithms, and back to a simplified notation.
 */
public class PipelineTestCase extends AbstractFsmTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PipelineTestCase.class);
    }

    public PipelineTestCase(String name) {
        super(name);
    }

    private static String roundTrip(String regex, Simplifier simplifier) {
        Automaton min = Automata.minimize(RegexString.toAutomaton(regex));
        Node tree = simplifier.simplify(Automata.toRegex(min));
        return RegexTree.toString(tree);
    }

    public void testRoundTrip() {
        String regex = roundTrip("(a+b)*ab", new Simplifier(Simplifier.NO_SEMANTIC_RULES));
        logger.log(level, "(a+b)*ab => " + regex);
        assertSameLanguage("(a+b)*ab", regex);
    }

    public void testRoundTripSimplifies() {
        Automaton min = Automata.minimize(RegexString.toAutomaton("(a+b)*b"));
        assertEquals(2, min.states().size());
        Node raw = Automata.toRegex(min);
        Node simple = new Simplifier().simplify(raw);
        logger.log(level, raw + " => " + simple);
        assertSameLanguage(raw, simple);
        assertSameLanguage("(a+b)*b", RegexTree.toString(simple));
        assertTrue(RegexTree.toArray(simple).size() < RegexTree.toArray(raw).size());
    }

    public void testExternalDescription() {
        // even length words over {0, 1}
        Automaton even = Validator.validate(list("e", "o"), list("0", "1"), "e",
            list("e"), Arrays.asList(
                new Transition("e", list("o"), "0"), new Transition("e", list("o"), "1"),
                new Transition("o", list("e"), "0"), new Transition("o", list("e"), "1")));
        Automaton endsWith1 = RegexTree.toAutomaton(RegexString.toTree("(0+1)*1"),
            list("0", "1"));

        Automaton both = Operations.intersection(even, endsWith1);
        assertAccepts(both, "01", "0001", "1111");
        assertRejects(both, "", "1", "10", "011");
        // odd length words need not remember their last symbol
        assertEquals(3, Automata.minimize(both).states().size());
        assertTrue(Automata.isLanguageInfinite(both));

        String regex = RegexTree.toString(new Simplifier(Simplifier.NO_SEMANTIC_RULES)
            .simplify(Automata.toRegex(Automata.minimize(both))));
        assertEquivalent(both, RegexTree.toAutomaton(RegexString.toTree(regex),
            list("0", "1")));
    }

    public void testRandomRegexReparses() {
        RandomRegex random = new RandomRegex(new Random(42));
        for (int i = 0; i < 50; ++i) {
            String s = random.string(i % 7, "ab");
            assertEquals(s, RegexTree.toString(RegexString.toTree(s)));
        }
    }

    public void testRandomRegexSymbolCount() {
        RandomRegex random = new RandomRegex(new Random(3), 0.3, 0.3, 0.3);
        for (int n = 1; n < 12; ++n) {
            List<Object> arr = random.array(n, list(0, 1, 2));
            int symbols = 0;
            for (Object item : arr) {
                if (!(item instanceof RegexArray.Special)) ++symbols;
            }
            assertEquals(arr.toString(), n, symbols);
        }
        assertEquals(RegexTree.makeEps(), new RandomRegex(new Random(1), 0, 0, 0)
            .tree(0, list()));
    }

    public void testRandomRegexReproducible() {
        String a = new RandomRegex(new Random(5)).string(10, "abc");
        String b = new RandomRegex(new Random(5)).string(10, "abc");
        assertEquals(a, b);
    }

    public void testRandomRegexSimplifies() {
        RandomRegex random = new RandomRegex(new Random(7));
        for (int i = 0; i < 30; ++i) {
            String s = random.string(2 + i % 5, "ab");
            String simplified = RegexString.simplify(s);
            logger.log(level, s + " => " + simplified);
            assertSameLanguage(s, simplified);
        }
    }

    public void testRandomRegexArguments() {
        Random r = new Random(0);
        try {
            new RandomRegex(r, 0.5, 0.1, 1.0);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            new RandomRegex(r, 1.5, 0.1, 0.1);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            new RandomRegex(null);
            fail("should throw");
        } catch (NullPointerException e) {}
        RandomRegex random = new RandomRegex(r);
        assertEquals(RandomRegex.DEFAULT_ALT_PROBABILITY, random.altProbability(), 0.0);
        try {
            random.tree(-1, list("a"));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            random.tree(2, list());
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }
}
