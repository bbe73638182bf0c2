/*
 * @LICENSE@
 */

package org.fsmkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.fsmkit.RegexTree.Node;

/**
 * Generates random regular expressions, mostly for testing. A generator
 * draws from a caller supplied {@link Random}, so a seeded source gives
 * reproducible expressions.
 * <p>
 * An expression with n symbols is split at a random point into two
 * expressions joined by alternation (probability {@link #altProbability()})
 * or concatenation; each subexpression is starred with probability
 * {@link #kleeneProbability()}, and an epsilon choice is added with
 * probability {@link #epsilonProbability()}.
 */
public final class RandomRegex {

    public static final double DEFAULT_ALT_PROBABILITY = 0.5;
    public static final double DEFAULT_KLEENE_PROBABILITY = 0.1;
    public static final double DEFAULT_EPSILON_PROBABILITY = 0.1;

    private final Random random;
    private final double altp;
    private final double kleenep;
    private final double epsp;

    public RandomRegex(Random random) {
        this(random, DEFAULT_ALT_PROBABILITY, DEFAULT_KLEENE_PROBABILITY,
            DEFAULT_EPSILON_PROBABILITY);
    }

    public RandomRegex(Random random, double altp, double kleenep, double epsp) {
        if (random == null) throw new NullPointerException("null random source");
        checkProbability(altp);
        checkProbability(kleenep);
        checkProbability(epsp);
        if (epsp == 1.0) {
            throw new IllegalArgumentException("epsilon probability must be below 1");
        }
        this.random = random;
        this.altp = altp;
        this.kleenep = kleenep;
        this.epsp = epsp;
    }

    private static void checkProbability(double p) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("not a probability: " + p);
        }
    }

    public double altProbability() {
        return altp;
    }

    public double kleeneProbability() {
        return kleenep;
    }

    public double epsilonProbability() {
        return epsp;
    }

    /**
     * @param numSymbols
     *            the number of literals in the expression; 0 gives epsilon.
     * @param alphabet
     *            the symbols to choose from, uniformly (repeat a symbol to
     *            make it likelier).
     */
    public Node tree(int numSymbols, List<?> alphabet) {
        if (numSymbols < 0) {
            throw new IllegalArgumentException("negative symbol count: " + numSymbols);
        }
        if (numSymbols > 0 && alphabet.isEmpty()) {
            throw new IllegalArgumentException("empty alphabet");
        }
        return kleene(numSymbols, alphabet);
    }

    public List<Object> array(int numSymbols, List<?> alphabet) {
        return RegexTree.toArray(tree(numSymbols, alphabet));
    }

    /**
     * @param alphabet
     *            each character is a symbol.
     */
    public String string(int numSymbols, String alphabet) {
        List<Object> symbols = new ArrayList<Object>(alphabet.length());
        for (int i = 0; i < alphabet.length(); ++i) {
            symbols.add(String.valueOf(alphabet.charAt(i)));
        }
        return RegexTree.toString(tree(numSymbols, symbols));
    }

    private Node kleene(int numSymbols, List<?> alphabet) {
        Node expr = expr(numSymbols, alphabet);
        if (random.nextDouble() < kleenep) {
            expr = RegexTree.makeKStar(expr);
        }
        return expr;
    }

    private Node expr(int numSymbols, List<?> alphabet) {
        if (numSymbols == 0) {
            return RegexTree.makeEps();
        } else if (numSymbols == 1) {
            return RegexTree.makeLit(alphabet.get(random.nextInt(alphabet.size())));
        } else if (random.nextDouble() < epsp) {
            return RegexTree.makeAlt(RegexTree.makeEps(), kleene(numSymbols, alphabet));
        }
        int left = 1 + random.nextInt(numSymbols - 1);
        Node l = kleene(left, alphabet);
        Node r = kleene(numSymbols - left, alphabet);
        return random.nextDouble() < altp ? RegexTree.makeAlt(l, r) : RegexTree.makeSeq(l, r);
    }
}
