/* @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.FsmAssert.*;
import static org.fsmkit.RegexArray.Special.*;

import java.util.regex.PatternSyntaxException;

public class RegexStringTestCase extends AbstractFsmTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexStringTestCase.class);
    }

    public RegexStringTestCase(String name) {
        super(name);
    }

    public void testToArray() {
        assertEquals(list("a", ALT, "b", KSTAR), RegexString.toArray("a+b*"));
        assertEquals(list(LEFT_PAREN, EPS, RIGHT_PAREN), RegexString.toArray("($)"));
        assertEquals(list("$", "\\", "x", "*"), RegexString.toArray("\\$\\\\x\\*"));
        assertEquals(list(" ", "."), RegexString.toArray(" ."));
        assertTrue(RegexString.toArray("").isEmpty());
    }

    public void testIllegalEscape() {
        try {
            RegexString.toArray("a\\b");
            fail("should throw");
        } catch (PatternSyntaxException e) {
            assertEquals(2, e.getIndex());
            assertEquals("Malformed string regex: illegal escape sequence \\b",
                e.getDescription());
            assertEquals("a\\b", e.getPattern());
        }
    }

    public void testUnfinishedEscape() {
        try {
            RegexString.toArray("ab\\");
            fail("should throw");
        } catch (PatternSyntaxException e) {
            assertEquals(2, e.getIndex());
            assertTrue(e.getDescription().contains("unfinished escape sequence"));
        }
    }

    public void testToString() {
        for (String s : new String[] {"(a+\\*)*\\\\", "$", "a+b", "\\(\\)", ""}) {
            assertEquals(s, RegexString.toString(RegexString.toArray(s)));
        }
    }

    public void testStarThenSymbol() {
        Automaton fsm = RegexString.toAutomaton("a*b");
        Validator.validate(fsm);
        assertEquals(list("a", "b"), fsm.alphabet());
        assertAccepts(fsm, "b", "ab", "aaab");
        assertRejects(fsm, "", "a", "ba", "abb");
        // with the dead state
        assertEquals(3, Automata.minimize(fsm).states().size());
    }

    public void testEscapedSymbols() {
        Automaton fsm = RegexString.toAutomaton("(\\++\\$)*");
        assertEquals(list("+", "$"), fsm.alphabet());
        assertAccepts(fsm, "", "+", "$+$");
    }

    public void testSyntaxErrorsPropagate() {
        for (String s : new String[] {"(ab", "ab)", "*a", "a+**"}) {
            try {
                RegexString.toTree(s);
                fail("should throw for " + s);
            } catch (PatternSyntaxException e) {
                logger.log(level, e.getMessage());
            }
        }
    }

    public void testSimplify() {
        assertEquals("a*b", RegexString.simplify("a*b"));
        assertEquals("(a+b)*", RegexString.simplify("(a+b)*(a+b)*"));
        assertEquals("(a+b)*", RegexString.simplify("(a*b*)*"));
        assertEquals("\\+*", RegexString.simplify("(\\++\\+*)*"));
    }
}
