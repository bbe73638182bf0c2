/* @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.FsmAssert.*;
import static org.fsmkit.RegexArray.Special.ALT;
import static org.fsmkit.RegexArray.Special.KSTAR;
import static org.fsmkit.RegexArray.Special.LEFT_PAREN;
import static org.fsmkit.RegexArray.Special.RIGHT_PAREN;
import static org.fsmkit.RegexTree.*;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.fsmkit.Automaton.Type;

public class RegexTreeTestCase extends AbstractFsmTestCase {

    private Node a, b, c;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexTreeTestCase.class);
    }

    public RegexTreeTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        a = makeLit("a");
        b = makeLit("b");
        c = makeLit("c");
    }

    public void testEquality() {
        assertEquals(makeSeq(a, b), makeSeq(makeLit("a"), makeLit("b")));
        assertEquals(makeSeq(a, b).hashCode(),
            makeSeq(makeLit("a"), makeLit("b")).hashCode());
        assertFalse(makeSeq(a, b).equals(makeSeq(b, a)));
        assertFalse(makeSeq(a, b).equals(makeAlt(a, b)));
        assertFalse(makeLit(1).equals(makeLit("1")));
        assertEquals(makeKStar(makeAlt(a, makeEps())),
            makeKStar(makeAlt(makeLit("a"), makeEps())));
        assertSame(makeEps(), makeEps());
        assertEquals(makeAlt(), makeAlt(new java.util.ArrayList<Node>()));
        assertFalse(makeAlt().equals(makeSeq()));
    }

    public void testFactories() {
        assertEquals(Tag.ALT, makeAlt(a).tag());
        assertEquals(Tag.SEQ, makeSeq(a).tag());
        assertEquals(Tag.KSTAR, makeKStar(a).tag());
        assertEquals(Tag.LIT, a.tag());
        assertEquals(Tag.EPS, makeEps().tag());
        assertEquals("a", ((Lit) a).symbol());
        assertSame(a, makeKStar(a).inner());
        assertEquals(2, makeAlt(a, b).choices().size());
        try {
            makeAlt(a, b).choices().add(c);
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
        try {
            makeLit(null);
            fail("should throw");
        } catch (NullPointerException e) {}
        try {
            makeSeq(a, null);
            fail("should throw");
        } catch (NullPointerException e) {}
    }

    public void testVisitor() {
        Node tree = makeAlt(makeSeq(a, makeKStar(b)), makeEps(), c);
        int count = new Visitor<Integer>() {
            @Override
            protected Integer visit(Alt node) {
                int n = 1;
                for (Node choice : node.choices()) n += visit(choice);
                return n;
            }
            @Override
            protected Integer visit(Seq node) {
                int n = 1;
                for (Node element : node.elements()) n += visit(element);
                return n;
            }
            @Override
            protected Integer visit(KStar node) {
                return 1 + visit(node.inner());
            }
            @Override
            protected Integer visit(Lit node) {
                return 1;
            }
            @Override
            protected Integer visit(Eps node) {
                return 1;
            }
        }.visit(tree);
        assertEquals(7, count);
    }

    public void testThompsonLiteral() {
        Automaton fsm = toAutomaton(a);
        assertEquals(list(0, 1), fsm.states());
        assertEquals(list("a"), fsm.alphabet());
        assertEquals(0, fsm.initialState());
        assertEquals(list(1), fsm.acceptingStates());
        assertEquals(Type.NFA, Automata.determineType(fsm));
        Validator.validate(fsm);
    }

    public void testThompsonSeq() {
        Automaton fsm = toAutomaton(makeSeq(a, b));
        assertEquals(4, fsm.states().size());
        assertEquals(list(3), fsm.acceptingStates());
        assertEquals(list(Automaton.EPSILON),
            Automata.symbolsForTransitions(fsm, 1, 2));
        Validator.validate(fsm);
        assertAccepts(fsm, "ab");
        assertRejects(fsm, "", "a", "b", "ba", "abab");
    }

    public void testThompsonAlt() {
        Automaton fsm = toAutomaton(makeAlt(a, b, makeEps()));
        assertEquals(8, fsm.states().size());
        assertEquals(Type.ENFA, Automata.determineType(fsm));
        Validator.validate(fsm);
        assertAccepts(fsm, "", "a", "b");
        assertRejects(fsm, "ab", "aa");
    }

    public void testThompsonKStar() {
        Automaton fsm = toAutomaton(makeKStar(makeSeq(a, b)));
        assertEquals(6, fsm.states().size());
        Validator.validate(fsm);
        assertAccepts(fsm, "", "ab", "abab");
        assertRejects(fsm, "a", "aba", "ba");
    }

    public void testThompsonEmptyLanguage() {
        for (Node empty : new Node[] {makeAlt(), makeSeq(), makeSeq(a, makeAlt())}) {
            Automaton fsm = toAutomaton(empty, list("a"));
            assertFalse(empty.toString(), Automata.isLanguageNonEmpty(fsm));
        }
        // but the star of the empty language is {""}
        Automaton fsm = toAutomaton(makeKStar(makeSeq()), list("a"));
        assertAccepts(fsm, "");
        assertRejects(fsm, "a");
    }

    public void testThompsonAlphabet() {
        Automaton fsm = toAutomaton(makeSeq(b, a, b), list("c", "a"));
        assertEquals(list("c", "a", "b"), fsm.alphabet());
        assertEquals(list("b", "a"), toAutomaton(makeSeq(b, a, b)).alphabet());
        // arbitrary symbol objects
        fsm = toAutomaton(makeKStar(makeLit(new Pair("x", 1))));
        assertTrue(Automata.isAccepted(fsm,
            list(new Pair("x", 1), new Pair("x", 1))));
    }

    public void testToArray() {
        assertEquals(list(LEFT_PAREN, "a", "b", RIGHT_PAREN, KSTAR),
            toArray(makeKStar(makeSeq(a, b))));
        assertEquals(list(LEFT_PAREN, "a", ALT, "b", RIGHT_PAREN, "c"),
            toArray(makeSeq(makeAlt(a, b), c)));
        assertEquals(list("a", "b", ALT, "c"), toArray(makeAlt(makeSeq(a, b), c)));
        // parentheses between equal precedences
        assertEquals(list(LEFT_PAREN, "a", "b", RIGHT_PAREN),
            toArray(makeSeq(makeSeq(a, b))));
        assertEquals(list(LEFT_PAREN, "a", KSTAR, RIGHT_PAREN, KSTAR),
            toArray(makeKStar(makeKStar(a))));
        assertEquals(list("a", RegexArray.Special.EPS), toArray(makeSeq(a, makeEps())));
        assertTrue(toArray(makeAlt()).isEmpty());
    }

    public void testToString() {
        assertEquals("(ab)*", RegexTree.toString(makeKStar(makeSeq(a, b))));
        assertEquals("a\\+b", RegexTree.toString(makeSeq(a, makeLit("+"), b)));
        assertEquals("a+$", RegexTree.toString(makeAlt(a, makeEps())));
        assertEquals("a", RegexTree.toString(makeLit('a')));
        try {
            RegexTree.toString(makeSeq(a, makeLit(42)));
            fail("should throw");
        } catch (PatternSyntaxException e) {
            assertEquals(1, e.getIndex());
        }
        // diagnostics never fail
        assertEquals("a 42", makeSeq(a, makeLit(42)).toString());
    }

    public void testArrayRoundTrip() {
        for (String s : new String[] {"(a+b)*ab", "a*b", "$+a(b+$)*", "((a))", "a+"}) {
            List<Object> arr = RegexString.toArray(s);
            Node tree = RegexArray.toTree(arr);
            assertEquals(s, tree, RegexArray.toTree(toArray(tree)));
            assertSameLanguage(tree, RegexArray.toTree(toArray(tree)));
        }
    }
}
