/*
 * @LICENSE@
 */

package org.fsmkit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.fsmkit.RegexTree.Node;

/**
 * The array notation of regular expressions: a list whose items are either
 * symbols, which may be arbitrary objects, or one of the {@link Special}
 * markers. Concatenation is implicit. Kleene star binds tighter than
 * concatenation, which binds tighter than alternation; parentheses regroup.
 * <p>
 * For instance <code>[LEFT_PAREN, "a", ALT, "b", RIGHT_PAREN, KSTAR]</code>
 * stands for all the strings of a's and b's.
 */
public final class RegexArray {

    private RegexArray() {}   // uninstantiable

    /**
     * The operator markers. Being enum constants, they are never equal to
     * a symbol, even one that prints the same.
     */
    public enum Special {
        ALT("+"), KSTAR("*"), LEFT_PAREN("("), RIGHT_PAREN(")"), EPS("$");

        private final String glyph;

        Special(String glyph) {
            this.glyph = glyph;
        }

        @Override
        public String toString() {
            return glyph;
        }
    }

    /*
     * expr   := concat (ALT concat)*
     * concat := katom*
     * katom  := atom KSTAR?
     * atom   := LEFT_PAREN expr RIGHT_PAREN | EPS | symbol
     *
     * Every expr is an Alt and every concat a Seq, even with one child; the
     * Simplifier takes care of those.
     */
    private static final class Parser {

        private final List<?> arr;
        private int idx = 0;

        Parser(List<?> arr) {
            this.arr = arr;
        }

        private Object peek() {
            return idx < arr.size() ? arr.get(idx) : null;
        }

        private boolean atEnd() {
            return idx >= arr.size();
        }

        Node parse() {
            Node ret = expr();
            if (!atEnd()) {
                syntaxError("Malformed regex array: successfully parsed up to position " + idx);
            }
            return ret;
        }

        private Node expr() {
            List<Node> concats = new ArrayList<Node>();
            while (true) {
                concats.add(concat());
                if (!atEnd() && peek() == Special.ALT) {
                    ++idx;
                } else {
                    break;
                }
            }
            return RegexTree.makeAlt(concats);
        }

        private Node concat() {
            List<Node> katoms = new ArrayList<Node>();
            Node katom;
            while ((katom = katom()) != null) {
                katoms.add(katom);
            }
            return RegexTree.makeSeq(katoms);
        }

        private Node katom() {
            Node atom = atom();
            if (atom != null && !atEnd() && peek() == Special.KSTAR) {
                ++idx;
                atom = RegexTree.makeKStar(atom);
            }
            return atom;
        }

        /*
         * null at the end of a concatenation
         */
        private Node atom() {
            if (atEnd()) {
                return null;
            }
            Object item = peek();
            if (item == Special.LEFT_PAREN) {
                ++idx;
                Node expr = expr();
                if (atEnd() || peek() != Special.RIGHT_PAREN) {
                    syntaxError("Malformed regex array: missing matching right parenthesis at index " + idx);
                }
                ++idx;
                return expr;
            } else if (item == Special.EPS) {
                ++idx;
                return RegexTree.makeEps();
            } else if (item == Special.ALT || item == Special.RIGHT_PAREN) {
                return null;
            } else if (item == Special.KSTAR) {
                syntaxError("Malformed regex array: dangling Kleene star at index " + idx);
            } else if (item == null) {
                syntaxError("Malformed regex array: null symbol at index " + idx);
            }
            ++idx;
            return RegexTree.makeLit(item);
        }

        private void syntaxError(String msg) {
            throw new PatternSyntaxException(msg, String.valueOf(arr), idx);
        }
    }

    /**
     * Parses the array notation.
     *
     * @throws PatternSyntaxException
     *             if parentheses don't match, a Kleene star has nothing to
     *             apply to, or the whole array can't be parsed.
     */
    public static Node toTree(List<?> arr) {
        return new Parser(arr).parse();
    }

    /**
     * @return the automaton built by {@link RegexTree#toAutomaton(Node)} from
     *         the parsed array.
     */
    public static Automaton toAutomaton(List<?> arr) {
        return RegexTree.toAutomaton(toTree(arr));
    }

    static String escape(String s) {
        return RegexString.ESCAPABLE.indexOf(s.charAt(0)) != -1 ? "\\" + s : s;
    }

    /**
     * The string notation of the array notation. Symbols must be single
     * characters (one character {@link String}s or {@link Character}s);
     * those that collide with a reserved character are escaped.
     *
     * @throws PatternSyntaxException
     *             at the position of the first symbol that is not a single
     *             character.
     */
    public static String toString(List<?> arr) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < arr.size(); ++i) {
            Object item = arr.get(i);
            String s = item instanceof Character ? item.toString()
                : item instanceof String ? (String) item : null;
            if (item instanceof Special) {
                sb.append(item);
            } else if (s != null && s.length() == 1) {
                sb.append(escape(s));
            } else {
                throw new PatternSyntaxException(
                    "Array regex not convertible to string representation: failed at position " + i,
                    String.valueOf(arr), i);
            }
        }
        return sb.toString();
    }

    /**
     * Parses, simplifies with default options, and prints back.
     */
    public static List<Object> simplify(List<?> arr) {
        return RegexTree.toArray(new Simplifier().simplify(toTree(arr)));
    }

    public static List<Object> simplify(List<?> arr, Simplifier simplifier) {
        return RegexTree.toArray(simplifier.simplify(toTree(arr)));
    }
}
