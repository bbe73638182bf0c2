/* @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.FsmAssert.list;

import java.util.ArrayList;
import java.util.List;

import org.fsmkit.Automaton.Transition;
import org.fsmkit.AutomatonException.InvariantException;
import org.fsmkit.AutomatonException.StructureException;

public class ValidatorTestCase extends AbstractFsmTestCase {

    private List<Object> states;
    private List<Object> alphabet;
    private List<Object> accepting;
    private List<Transition> transitions;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ValidatorTestCase.class);
    }

    public ValidatorTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        states = list("s", "t");
        alphabet = list("0", "1");
        accepting = list("t");
        transitions = new ArrayList<Transition>();
        transitions.add(new Transition("s", list("t"), "1"));
        transitions.add(new Transition("t", list("s", "t"), "0"));
        transitions.add(Transition.epsilon("t", list("s")));
    }

    private Automaton validate() {
        return Validator.validate(states, alphabet, "s", accepting, transitions);
    }

    private void assertInvariantViolation() {
        try {
            validate();
            fail("should throw");
        } catch (InvariantException e) {
            logger.log(level, e.getMessage());
        }
    }

    private void assertStructureViolation() {
        try {
            validate();
            fail("should throw");
        } catch (StructureException e) {
            logger.log(level, e.getMessage());
        }
    }

    public void testValid() {
        Automaton fsm = validate();
        assertEquals(states, fsm.states());
        assertEquals("s", fsm.initialState());
        assertEquals(3, fsm.transitions().size());
        assertSame(fsm, Validator.validate(fsm));
        Validator.validate(endsWithAb());
    }

    public void testAcceptingStateNotAState() {
        accepting = list("t", "u");
        assertInvariantViolation();
    }

    public void testMissingParts() {
        states = null;
        assertStructureViolation();
        setUpQuietly();
        alphabet = null;
        assertStructureViolation();
        setUpQuietly();
        transitions = null;
        assertStructureViolation();
        try {
            Validator.validate(list("s"), list("0"), null, list(), new ArrayList<Transition>());
            fail("should throw");
        } catch (StructureException e) {}
    }

    public void testIncompleteTransition() {
        transitions.add(new Transition("s", null, "0"));
        assertStructureViolation();
        setUpQuietly();
        transitions.add(new Transition("s", list("t"), null));
        assertStructureViolation();
    }

    public void testEmptyStatesOrAlphabet() {
        states = list();
        assertInvariantViolation();
        setUpQuietly();
        alphabet = list();
        assertInvariantViolation();
    }

    public void testDuplicates() {
        states = list("s", "t", "s");
        assertInvariantViolation();
        setUpQuietly();
        alphabet = list("0", "1", "0");
        assertInvariantViolation();
        setUpQuietly();
        accepting = list("t", "t");
        assertInvariantViolation();
    }

    public void testOverlap() {
        alphabet = list("0", "1", "t");
        assertInvariantViolation();
    }

    public void testEpsilonInAlphabet() {
        alphabet = list("0", Automaton.EPSILON);
        assertInvariantViolation();
    }

    public void testInitialNotAState() {
        try {
            Validator.validate(states, alphabet, "u", accepting, transitions);
            fail("should throw");
        } catch (InvariantException e) {}
    }

    public void testBadTransitions() {
        transitions.add(new Transition("u", list("t"), "0"));
        assertInvariantViolation();
        setUpQuietly();
        transitions.add(new Transition("s", list("t"), "2"));
        assertInvariantViolation();
        setUpQuietly();
        transitions.add(new Transition("s", list("u"), "0"));
        assertInvariantViolation();
        setUpQuietly();
        transitions.add(new Transition("s", list("t", "t"), "0"));
        assertInvariantViolation();
    }

    public void testDuplicateRecords() {
        transitions.add(new Transition("s", list("s"), "1"));
        assertInvariantViolation();
    }

    public void testFirstViolationWins() {
        // both an empty alphabet and a dangling accepting state
        alphabet = list();
        accepting = list("u");
        try {
            validate();
            fail("should throw");
        } catch (InvariantException e) {
            assertEquals("alphabet must not be empty", e.getMessage());
        }
    }

    private void setUpQuietly() {
        try {
            setUp();
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
