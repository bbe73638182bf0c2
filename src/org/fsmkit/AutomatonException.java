/*
 * @LICENSE@
 */
package org.fsmkit;

/**
 * Base class of the runtime exceptions thrown when an {@link Automaton} is
 * malformed, violates one of its invariants, or does not meet the
 * precondition of the operation applied to it. Every such failure is
 * reported to the immediate caller at the point of detection; no partially
 * built automaton is ever returned.
 */
public abstract class AutomatonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    AutomatonException(String msg) {
        super(msg);
    }

    /**
     * The automaton description is missing a required part (states,
     * alphabet, initial state, ...) or a transition record is incomplete.
     */
    public static final class StructureException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public StructureException(String msg) {
            super(msg);
        }
    }

    /**
     * The automaton is complete but inconsistent: duplicate states or
     * symbols, overlapping namespaces, dangling references, duplicate
     * transition records.
     */
    public static final class InvariantException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public InvariantException(String msg) {
            super(msg);
        }
    }

    /**
     * An operation was applied to arguments it does not accept: differing
     * alphabets, overlapping states, a non-DFA where a DFA is required, an
     * unknown state or symbol.
     */
    public static final class PreconditionException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public PreconditionException(String msg) {
            super(msg);
        }
    }
}
