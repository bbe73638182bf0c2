/*
 * @LICENSE@
 */

package org.fsmkit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.fsmkit.RegexArray.Special;
import org.fsmkit.RegexTree.Node;

/**
 * The string notation of regular expressions, for alphabets of single
 * characters. Every character is a symbol except the reserved ones:
 * <code>$</code> (epsilon), <code>+</code> (alternation), <code>*</code>
 * (Kleene star), <code>(</code> and <code>)</code> (grouping), and
 * <code>\</code>, which escapes any reserved character, itself included.
 * <p>
 * <code>"(a+b)*\\+"</code>, for instance, is the Java literal for all the
 * strings of a's and b's followed by a plus sign. Symbols in the array and
 * tree forms produced from strings are one character {@link String}s.
 */
public final class RegexString {

    private RegexString() {}   // uninstantiable

    /**
     * The characters that have to be escaped to stand for themselves.
     */
    public static final String ESCAPABLE = "$+*()\\";

    /**
     * Scans the string notation into the array notation.
     *
     * @throws PatternSyntaxException
     *             on an escape of a non reserved character, or a backslash
     *             at the end of the string.
     */
    public static List<Object> toArray(String str) {
        List<Object> arr = new ArrayList<Object>(str.length());
        boolean escaped = false;
        for (int i = 0; i < str.length(); ++i) {
            char c = str.charAt(i);
            if (escaped) {
                if (ESCAPABLE.indexOf(c) == -1) {
                    throw new PatternSyntaxException(
                        "Malformed string regex: illegal escape sequence \\" + c, str, i);
                }
                arr.add(String.valueOf(c));
                escaped = false;
                continue;
            }
            switch (c) {
            case '\\':
                escaped = true;
                break;
            case '$':
                arr.add(Special.EPS);
                break;
            case '+':
                arr.add(Special.ALT);
                break;
            case '*':
                arr.add(Special.KSTAR);
                break;
            case '(':
                arr.add(Special.LEFT_PAREN);
                break;
            case ')':
                arr.add(Special.RIGHT_PAREN);
                break;
            default:
                arr.add(String.valueOf(c));
                break;
            }
        }
        if (escaped) {
            throw new PatternSyntaxException(
                "Malformed string regex: unfinished escape sequence at end of string",
                str, str.length() - 1);
        }
        return arr;
    }

    /**
     * The inverse of {@link #toArray(String)}; same as
     * {@link RegexArray#toString(List)}.
     */
    public static String toString(List<?> arr) {
        return RegexArray.toString(arr);
    }

    public static Node toTree(String str) {
        return RegexArray.toTree(toArray(str));
    }

    public static Automaton toAutomaton(String str) {
        return RegexTree.toAutomaton(toTree(str));
    }

    public static String simplify(String str) {
        return simplify(str, new Simplifier());
    }

    public static String simplify(String str, Simplifier simplifier) {
        return RegexTree.toString(simplifier.simplify(toTree(str)));
    }
}
