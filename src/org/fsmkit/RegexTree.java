/*
 * @LICENSE@
 */

package org.fsmkit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.fsmkit.Automaton.Transition;
import org.fsmkit.RegexArray.Special;

/**
 * Uninstantiable class which serves as a source container for the regular
 * expression tree node classes, their visitor, the static factories used to
 * build trees, and the conversions of trees to automata and to the linear
 * notations.
 * <p>
 * Trees are immutable values: two trees are equal iff they have the same
 * shape and equal symbols. Subtrees may be shared freely.
 */
public final class RegexTree {

    private static final Logger logger = Logger.getLogger("org.fsmkit");
    private static final Level level = Level.FINEST;

    private RegexTree() {}   // uninstantiable

    /**
     * Node kinds, with the binding strength of the operator each one
     * represents (atoms bind tightest).
     */
    public enum Tag {
        ALT(0), SEQ(1), KSTAR(2), LIT(3), EPS(3);

        final int prec;

        Tag(int prec) {
            this.prec = prec;
        }
    }

    public static abstract class Node {

        private int hash = 0;

        private Node() {}

        public abstract Tag tag();

        public abstract <R> R accept(Visitor<R> v);

        abstract int computeHash();

        /*
         * racy but idempotent, like String.hashCode()
         */
        @Override
        public final int hashCode() {
            int h = hash;
            if (h == 0) {
                h = computeHash();
                if (h == 0) h = 1;
                hash = h;
            }
            return h;
        }

        /**
         * The array notation of this tree, items separated by blanks. Unlike
         * {@link RegexTree#toString(Node)} this never fails; it is meant for
         * diagnostics.
         */
        @Override
        public final String toString() {
            StringBuilder sb = new StringBuilder();
            for (Object o : toArray(this)) {
                sb.append(sb.length() == 0 ? "" : " ").append(o);
            }
            return sb.toString();
        }
    }

    /**
     * Alternation. An empty alternation denotes the empty language.
     */
    public static final class Alt extends Node {

        private final List<Node> choices;

        private Alt(List<Node> choices) {
            this.choices = choices;
        }

        public List<Node> choices() {
            return choices;
        }

        @Override
        public Tag tag() {
            return Tag.ALT;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visit(this);
        }

        @Override
        int computeHash() {
            return 31 * Tag.ALT.hashCode() + choices.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Alt)) return false;
            Alt other = (Alt) obj;
            return hashCode() == other.hashCode() && choices.equals(other.choices);
        }
    }

    /**
     * Concatenation. An empty sequence, like an empty alternation, denotes
     * the empty language.
     */
    public static final class Seq extends Node {

        private final List<Node> elements;

        private Seq(List<Node> elements) {
            this.elements = elements;
        }

        public List<Node> elements() {
            return elements;
        }

        @Override
        public Tag tag() {
            return Tag.SEQ;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visit(this);
        }

        @Override
        int computeHash() {
            return 31 * Tag.SEQ.hashCode() + elements.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Seq)) return false;
            Seq other = (Seq) obj;
            return hashCode() == other.hashCode() && elements.equals(other.elements);
        }
    }

    public static final class KStar extends Node {

        private final Node inner;

        private KStar(Node inner) {
            this.inner = inner;
        }

        public Node inner() {
            return inner;
        }

        @Override
        public Tag tag() {
            return Tag.KSTAR;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visit(this);
        }

        @Override
        int computeHash() {
            return 31 * Tag.KSTAR.hashCode() + inner.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof KStar)) return false;
            KStar other = (KStar) obj;
            return hashCode() == other.hashCode() && inner.equals(other.inner);
        }
    }

    public static final class Lit extends Node {

        private final Object symbol;

        private Lit(Object symbol) {
            this.symbol = symbol;
        }

        public Object symbol() {
            return symbol;
        }

        @Override
        public Tag tag() {
            return Tag.LIT;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visit(this);
        }

        @Override
        int computeHash() {
            return 31 * Tag.LIT.hashCode() + symbol.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Lit)) return false;
            return symbol.equals(((Lit) obj).symbol);
        }
    }

    /**
     * The empty string. There is a single instance.
     */
    public static final class Eps extends Node {

        private Eps() {}

        @Override
        public Tag tag() {
            return Tag.EPS;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visit(this);
        }

        @Override
        int computeHash() {
            return Tag.EPS.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Eps;
        }
    }

    /**
     * Dispatch on the node kind. Every kind has its own abstract
     * <code>visit</code> method, so a visitor must handle them all.
     */
    public static abstract class Visitor<R> {

        public final R visit(Node node) {
            return node.accept(this);
        }

        protected abstract R visit(Alt node);
        protected abstract R visit(Seq node);
        protected abstract R visit(KStar node);
        protected abstract R visit(Lit node);
        protected abstract R visit(Eps node);
    }

    /*
     * static factories
     */

    private static final Eps EPS = new Eps();

    private static List<Node> listFrom(Collection<? extends Node> nodes) {
        List<Node> list = new ArrayList<Node>(nodes.size());
        for (Node n : nodes) {
            if (n == null) throw new NullPointerException("null regex tree node");
            list.add(n);
        }
        return Collections.unmodifiableList(list);
    }

    public static Alt makeAlt(List<? extends Node> choices) {
        return new Alt(listFrom(choices));
    }

    public static Alt makeAlt(Node... choices) {
        return makeAlt(Arrays.asList(choices));
    }

    public static Seq makeSeq(List<? extends Node> elements) {
        return new Seq(listFrom(elements));
    }

    public static Seq makeSeq(Node... elements) {
        return makeSeq(Arrays.asList(elements));
    }

    public static KStar makeKStar(Node inner) {
        if (inner == null) throw new NullPointerException("null regex tree node");
        return new KStar(inner);
    }

    public static Lit makeLit(Object symbol) {
        if (symbol == null) throw new NullPointerException("null symbol");
        return new Lit(symbol);
    }

    public static Eps makeEps() {
        return EPS;
    }

    /**
     * Thompson construction. Every node is translated into a fragment
     * delimited by a left and a right state, and the fragments are wired
     * together with epsilon transitions. States are consecutive
     * {@link Integer}s starting at 0; the alphabet is the set of symbols
     * occurring in the tree, in order of first occurrence.
     *
     * @return an automaton, generally an eNFA, accepting the language of
     *         tree; its only accepting state is the right state of the root.
     */
    public static Automaton toAutomaton(Node tree) {
        return toAutomaton(tree, Collections.emptyList());
    }

    /**
     * Like {@link #toAutomaton(Node)}, with <code>alphabet</code> added to the
     * alphabet of the result, first and in order. Automata built from
     * different trees can thus be given a common alphabet, which the binary
     * operations require.
     */
    public static Automaton toAutomaton(Node tree, Collection<?> alphabet) {
        ThompsonBuilder builder = new ThompsonBuilder(alphabet);
        int[] lr = builder.visit(tree);
        Automaton fsm = builder.automaton(lr[0], lr[1]);
        if (logger.isLoggable(level)) {
            logger.log(level, "Thompson construction: " + fsm.states.size()
                + " states for " + tree);
        }
        return fsm;
    }

    private static final class ThompsonBuilder extends Visitor<int[]> {

        private int counter = 0;
        private final Set<Object> alphabet = new LinkedHashSet<Object>();
        private final Map<Pair, List<Object>> transitions =
            new LinkedHashMap<Pair, List<Object>>();

        ThompsonBuilder(Collection<?> alphabet) {
            this.alphabet.addAll(alphabet);
        }

        private Integer newState() {
            return Integer.valueOf(counter++);
        }

        private void connect(Integer from, Integer to, Object symbol) {
            Pair key = new Pair(from, symbol);
            List<Object> targets = transitions.get(key);
            if (targets == null) {
                targets = new ArrayList<Object>(2);
                transitions.put(key, targets);
            }
            targets.add(to);
        }

        private void epsilon(Integer from, Integer to) {
            connect(from, to, Automaton.EPSILON);
        }

        Automaton automaton(int initial, int accepting) {
            List<Object> states = new ArrayList<Object>(counter);
            for (int i = 0; i < counter; ++i) {
                states.add(Integer.valueOf(i));
            }
            List<Transition> ts = new ArrayList<Transition>(transitions.size());
            for (Map.Entry<Pair, List<Object>> e : transitions.entrySet()) {
                ts.add(new Transition(e.getKey().l(), e.getValue(), e.getKey().r()));
            }
            return new Automaton(states, alphabet, Integer.valueOf(initial),
                Collections.singletonList(Integer.valueOf(accepting)), ts);
        }

        @Override
        protected int[] visit(Alt node) {
            Integer l = newState();
            Integer r = newState();
            for (Node choice : node.choices) {
                int[] lr = visit(choice);
                epsilon(l, lr[0]);
                epsilon(lr[1], r);
            }
            return new int[] {l, r};
        }

        @Override
        protected int[] visit(Seq node) {
            if (node.elements.isEmpty()) {
                // empty language: nothing connects l to r
                return new int[] {newState(), newState()};
            }
            int[] ret = null;
            for (Node element : node.elements) {
                int[] lr = visit(element);
                if (ret == null) {
                    ret = lr;
                } else {
                    epsilon(ret[1], lr[0]);
                    ret[1] = lr[1];
                }
            }
            return ret;
        }

        @Override
        protected int[] visit(KStar node) {
            Integer l = newState();
            Integer r = newState();
            int[] inner = visit(node.inner);
            epsilon(l, r);          // zero times
            epsilon(l, inner[0]);   // once or more
            epsilon(inner[1], inner[0]); // repeat
            epsilon(inner[1], r);   // done
            return new int[] {l, r};
        }

        @Override
        protected int[] visit(Lit node) {
            Integer l = newState();
            Integer r = newState();
            alphabet.add(node.symbol);
            connect(l, r, node.symbol);
            return new int[] {l, r};
        }

        @Override
        protected int[] visit(Eps node) {
            Integer l = newState();
            Integer r = newState();
            epsilon(l, r);
            return new int[] {l, r};
        }
    }

    /**
     * The array notation of a tree. A child is parenthesized whenever its
     * operator binds no tighter than its parent's, so parentheses are
     * sometimes redundant.
     */
    public static List<Object> toArray(Node tree) {
        final List<Object> arr = new ArrayList<Object>();
        new Visitor<Void>() {

            private void child(Node parent, Node child) {
                boolean parens = parent.tag().prec >= child.tag().prec;
                if (parens) arr.add(Special.LEFT_PAREN);
                visit(child);
                if (parens) arr.add(Special.RIGHT_PAREN);
            }

            @Override
            protected Void visit(Alt node) {
                for (int i = 0; i < node.choices.size(); ++i) {
                    if (i > 0) arr.add(Special.ALT);
                    child(node, node.choices.get(i));
                }
                return null;
            }

            @Override
            protected Void visit(Seq node) {
                for (Node element : node.elements) {
                    child(node, element);
                }
                return null;
            }

            @Override
            protected Void visit(KStar node) {
                child(node, node.inner);
                arr.add(Special.KSTAR);
                return null;
            }

            @Override
            protected Void visit(Lit node) {
                arr.add(node.symbol);
                return null;
            }

            @Override
            protected Void visit(Eps node) {
                arr.add(Special.EPS);
                return null;
            }
        }.visit(tree);
        return arr;
    }

    /**
     * The string notation of a tree.
     *
     * @throws PatternSyntaxException
     *             if a symbol is not a single character.
     */
    public static String toString(Node tree) {
        return RegexArray.toString(toArray(tree));
    }
}
