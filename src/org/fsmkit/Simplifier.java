/*
 * @LICENSE@
 */

package org.fsmkit;

import static org.fsmkit.Misc.isSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmkit.Misc.FlagMgr;
import org.fsmkit.RegexTree.Alt;
import org.fsmkit.RegexTree.Eps;
import org.fsmkit.RegexTree.KStar;
import org.fsmkit.RegexTree.Lit;
import org.fsmkit.RegexTree.Node;
import org.fsmkit.RegexTree.Seq;
import org.fsmkit.RegexTree.Tag;
import org.fsmkit.RegexTree.Visitor;

/**
 * Language preserving term rewriting of regular expression trees.
 * <p>
 * Simplification proceeds in passes. Each pass looks for the first node, in
 * pre-order (Alt choices, Seq elements and KStar body in order), to which
 * some {@link Rule} applies, trying the whole catalog at each node before
 * descending, and rebuilds the tree with that one node rewritten. At a node
 * the syntactic rules come first, then the semantic rules, which compare the
 * languages of subexpressions with automata. Passes are repeated until
 * nothing applies or the pass limit is reached.
 * <p>
 * Trees are immutable, so the caller's tree is never modified. A Simplifier
 * holds only its options and may be reused.
 */
public final class Simplifier {

    private static final Logger logger = Logger.getLogger("org.fsmkit");
    private static final Level level = Level.FINER;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Disables the rules that compare languages with automata. Simplification
     * gets much faster on large trees, and less thorough.
     */
    public static final int NO_SEMANTIC_RULES = flagMgr.next("NO_SEMANTIC_RULES");

    static final int FLAG_COUNT = flagMgr.freezeAndCount();

    private final int flags;
    private final int maxPasses;

    public Simplifier() {
        this(0);
    }

    public Simplifier(int flags) {
        this(flags, -1);
    }

    /**
     * @param flags
     *            a combination of the flags defined by this class.
     * @param maxPasses
     *            the maximum number of rewrites; negative for no limit.
     * @throws IllegalArgumentException
     *             on unknown flags.
     */
    public Simplifier(int flags, int maxPasses) {
        flagMgr.check(flags);
        this.flags = flags;
        this.maxPasses = maxPasses;
    }

    public int flags() {
        return flags;
    }

    public Node simplify(Node tree) {
        return simplify(tree, null);
    }

    /**
     * @param appliedRules
     *            if not <code>null</code>, receives the name of each rule
     *            applied, in order.
     * @return the simplified tree.
     */
    public Node simplify(Node tree, List<String> appliedRules) {
        Context ctx = new Context();
        int passes = 0;
        while (maxPasses < 0 || passes < maxPasses) {
            Node next = rewrite(tree, ctx);
            if (next == null) {
                break;
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "pass " + passes + ": " + ctx.applied.name);
            }
            if (appliedRules != null) {
                appliedRules.add(ctx.applied.name);
            }
            tree = next;
            ++passes;
        }
        return tree;
    }

    /*
     * Per call state: the rule last applied and the automata built by the
     * semantic rules, which see the same subexpressions pass after pass.
     */
    static final class Context {

        Rule applied;
        private final Map<Pair, Automaton> automata = new HashMap<Pair, Automaton>();

        Automaton minimalAutomaton(Node tree, List<Object> alphabet) {
            Pair key = new Pair(tree, alphabet);
            Automaton fsm = automata.get(key);
            if (fsm == null) {
                fsm = Automata.minimize(RegexTree.toAutomaton(tree, alphabet));
                automata.put(key, fsm);
            }
            return fsm;
        }

        /*
         * L(b) is a subset of L(a); both over alphabet. Anything going wrong
         * in the automaton code just means "no".
         */
        boolean isSubset(Node a, Node b, List<Object> alphabet) {
            try {
                return Operations.isSubset(minimalAutomaton(a, alphabet),
                    minimalAutomaton(b, alphabet));
            } catch (AutomatonException e) {
                logger.log(Level.FINE, "subset test failed for " + a + ", " + b, e);
                return false;
            }
        }
    }

    private static final Rule[] RULES = Rule.values();

    private Node rewrite(Node node, Context ctx) {
        for (Rule rule : RULES) {
            if (rule.semantic && isSet(flags, NO_SEMANTIC_RULES)) continue;
            Node ret = rule.apply(node, ctx);
            if (ret != null) {
                ctx.applied = rule;
                return ret;
            }
        }
        switch (node.tag()) {
        case ALT:
            List<Node> choices = ((Alt) node).choices();
            for (int i = 0; i < choices.size(); ++i) {
                Node child = rewrite(choices.get(i), ctx);
                if (child != null) {
                    return RegexTree.makeAlt(replaced(choices, i, child));
                }
            }
            return null;
        case SEQ:
            List<Node> elements = ((Seq) node).elements();
            for (int i = 0; i < elements.size(); ++i) {
                Node child = rewrite(elements.get(i), ctx);
                if (child != null) {
                    return RegexTree.makeSeq(replaced(elements, i, child));
                }
            }
            return null;
        case KSTAR:
            Node inner = rewrite(((KStar) node).inner(), ctx);
            return inner == null ? null : RegexTree.makeKStar(inner);
        default:
            return null;
        }
    }

    /*
     * list helpers: all return fresh lists
     */

    private static List<Node> replaced(List<Node> list, int i, Node node) {
        List<Node> ret = new ArrayList<Node>(list);
        ret.set(i, node);
        return ret;
    }

    private static List<Node> without(List<Node> list, int i) {
        List<Node> ret = new ArrayList<Node>(list);
        ret.remove(i);
        return ret;
    }

    private static List<Node> spliced(List<Node> list, int i, List<Node> nodes) {
        List<Node> ret = new ArrayList<Node>(list);
        ret.remove(i);
        ret.addAll(i, nodes);
        return ret;
    }

    private static boolean is(Node node, Tag tag) {
        return node.tag() == tag;
    }

    private static Alt starredAlt(Node node, int minChoices) {
        if (is(node, Tag.KSTAR) && is(((KStar) node).inner(), Tag.ALT)) {
            Alt alt = (Alt) ((KStar) node).inner();
            if (alt.choices().size() >= minChoices) return alt;
        }
        return null;
    }

    private static List<Node> choicesOf(Node node, int min) {
        if (is(node, Tag.ALT) && ((Alt) node).choices().size() >= min) {
            return ((Alt) node).choices();
        }
        return null;
    }

    private static List<Node> elementsOf(Node node, int min) {
        if (is(node, Tag.SEQ) && ((Seq) node).elements().size() >= min) {
            return ((Seq) node).elements();
        }
        return null;
    }

    private static Node innerOf(Node node) {
        return is(node, Tag.KSTAR) ? ((KStar) node).inner() : null;
    }

    /*
     * the distinct symbols of a tree, in order of first occurrence
     */
    static List<Object> symbolsOf(Node tree) {
        final Set<Object> symbols = new LinkedHashSet<Object>();
        new Visitor<Void>() {
            @Override
            protected Void visit(Alt node) {
                for (Node n : node.choices()) visit(n);
                return null;
            }
            @Override
            protected Void visit(Seq node) {
                for (Node n : node.elements()) visit(n);
                return null;
            }
            @Override
            protected Void visit(KStar node) {
                visit(node.inner());
                return null;
            }
            @Override
            protected Void visit(Lit node) {
                symbols.add(node.symbol());
                return null;
            }
            @Override
            protected Void visit(Eps node) {
                return null;
            }
        }.visit(tree);
        return Collections.unmodifiableList(new ArrayList<Object>(symbols));
    }

    /**
     * The rewrite rules, in the order they are tried at each node. Each rule
     * returns the rewritten node, or <code>null</code> if it does not apply.
     * The names are for diagnostics only.
     */
    enum Rule {

        SEQ_SINGLETON("(a) => a", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> elements = elementsOf(node, 1);
                return elements != null && elements.size() == 1 ? elements.get(0) : null;
            }
        },

        ALT_SINGLETON("(a) => a", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 1);
                return choices != null && choices.size() == 1 ? choices.get(0) : null;
            }
        },

        STAR_EPS("$* => $", false) {
            @Override
            Node apply(Node node, Context ctx) {
                Node inner = innerOf(node);
                return inner != null && is(inner, Tag.EPS) ? inner : null;
            }
        },

        STAR_STAR("(a*)* => a*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                Node inner = innerOf(node);
                return inner != null && is(inner, Tag.KSTAR) ? inner : null;
            }
        },

        STAR_ALT_STAR("(a+b*)* => (a+b)*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                Alt alt = starredAlt(node, 1);
                if (alt == null) return null;
                List<Node> choices = alt.choices();
                for (int i = 0; i < choices.size(); ++i) {
                    Node inner = innerOf(choices.get(i));
                    if (inner != null) {
                        return RegexTree.makeKStar(
                            RegexTree.makeAlt(replaced(choices, i, inner)));
                    }
                }
                return null;
            }
        },

        ALT_EPS_STAR("$+a* => a*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                int eps = -1;
                boolean star = false;
                for (int i = 0; i < choices.size(); ++i) {
                    if (is(choices.get(i), Tag.EPS)) {
                        eps = i;
                    } else if (is(choices.get(i), Tag.KSTAR)) {
                        star = true;
                    }
                }
                return eps >= 0 && star ? RegexTree.makeAlt(without(choices, eps)) : null;
            }
        },

        /*
         * (a*b*)* and (a*+b*)* both denote (a+b)*; a*b* alone does not.
         */
        STAR_SEQ_OF_STARS("(a*b*)* => (a*+b*)*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                Node inner = innerOf(node);
                List<Node> elements = inner == null ? null : elementsOf(inner, 1);
                if (elements == null) return null;
                for (Node element : elements) {
                    if (!is(element, Tag.KSTAR)) return null;
                }
                return RegexTree.makeKStar(RegexTree.makeAlt(elements));
            }
        },

        SEQ_EPS("$a => a", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> elements = elementsOf(node, 2);
                if (elements == null) return null;
                for (int i = elements.size() - 1; i >= 0; --i) {
                    if (is(elements.get(i), Tag.EPS)) {
                        return RegexTree.makeSeq(without(elements, i));
                    }
                }
                return null;
            }
        },

        ALT_FLATTEN("(a+(b+c)) => a+b+c", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                for (int i = choices.size() - 1; i >= 0; --i) {
                    if (is(choices.get(i), Tag.ALT)) {
                        return RegexTree.makeAlt(spliced(choices, i,
                            ((Alt) choices.get(i)).choices()));
                    }
                }
                return null;
            }
        },

        /*
         * an empty nested sequence is the empty language, not epsilon: it
         * stays
         */
        SEQ_FLATTEN("ab(cd) => abcd", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> elements = elementsOf(node, 2);
                if (elements == null) return null;
                for (int i = 0; i < elements.size(); ++i) {
                    List<Node> nested = elementsOf(elements.get(i), 1);
                    if (nested != null) {
                        return RegexTree.makeSeq(spliced(elements, i, nested));
                    }
                }
                return null;
            }
        },

        ALT_DUPLICATE("a+a => a", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                for (int i = 0; i < choices.size() - 1; ++i) {
                    for (int j = i + 1; j < choices.size(); ++j) {
                        if (choices.get(i).equals(choices.get(j))) {
                            return RegexTree.makeAlt(without(choices, j));
                        }
                    }
                }
                return null;
            }
        },

        ALT_STAR_ABSORBS("a+a* => a*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                for (int i = 0; i < choices.size() - 1; ++i) {
                    for (int j = i + 1; j < choices.size(); ++j) {
                        if (choices.get(i).equals(innerOf(choices.get(j)))) {
                            return RegexTree.makeAlt(without(choices, i));
                        } else if (choices.get(j).equals(innerOf(choices.get(i)))) {
                            return RegexTree.makeAlt(without(choices, j));
                        }
                    }
                }
                return null;
            }
        },

        SEQ_STAR_STAR("a*a* => a*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> elements = elementsOf(node, 2);
                if (elements == null) return null;
                for (int i = 0; i < elements.size() - 1; ++i) {
                    if (is(elements.get(i), Tag.KSTAR)
                            && elements.get(i).equals(elements.get(i + 1))) {
                        return RegexTree.makeSeq(without(elements, i + 1));
                    }
                }
                return null;
            }
        },

        STAR_ALT_REPEAT("(aa+a)* => (a)*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                Alt alt = starredAlt(node, 2);
                if (alt == null) return null;
                List<Node> choices = alt.choices();
                for (int i = 0; i < choices.size(); ++i) {
                    for (int j = 0; j < choices.size(); ++j) {
                        List<Node> elements = i == j ? null : elementsOf(choices.get(j), 2);
                        if (elements != null && allEqual(elements, choices.get(i))) {
                            return RegexTree.makeKStar(
                                RegexTree.makeAlt(without(choices, j)));
                        }
                    }
                }
                return null;
            }

            private boolean allEqual(List<Node> elements, Node node) {
                for (Node element : elements) {
                    if (!element.equals(node)) return false;
                }
                return true;
            }
        },

        STAR_ALT_EPS("(a+$)* => (a)*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                Alt alt = starredAlt(node, 2);
                if (alt == null) return null;
                List<Node> choices = alt.choices();
                for (int i = 0; i < choices.size(); ++i) {
                    if (is(choices.get(i), Tag.EPS)) {
                        return RegexTree.makeKStar(RegexTree.makeAlt(without(choices, i)));
                    }
                }
                return null;
            }
        },

        ALT_COMMON_PREFIX("(ab+ac) => a(b+c)", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                for (int i = 0; i < choices.size() - 1; ++i) {
                    List<Node> first = elementsOf(choices.get(i), 2);
                    if (first == null) continue;
                    for (int j = i + 1; j < choices.size(); ++j) {
                        List<Node> second = elementsOf(choices.get(j), 2);
                        if (second == null || !first.get(0).equals(second.get(0))) {
                            continue;
                        }
                        Node factored = RegexTree.makeSeq(first.get(0), RegexTree.makeAlt(
                            RegexTree.makeSeq(first.subList(1, first.size())),
                            RegexTree.makeSeq(second.subList(1, second.size()))));
                        return RegexTree.makeAlt(without(replaced(choices, i, factored), j));
                    }
                }
                return null;
            }
        },

        ALT_COMMON_SUFFIX("(ab+cb) => (a+c)b", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                for (int i = 0; i < choices.size() - 1; ++i) {
                    List<Node> first = elementsOf(choices.get(i), 2);
                    if (first == null) continue;
                    Node last = first.get(first.size() - 1);
                    for (int j = i + 1; j < choices.size(); ++j) {
                        List<Node> second = elementsOf(choices.get(j), 2);
                        if (second == null || !last.equals(second.get(second.size() - 1))) {
                            continue;
                        }
                        Node factored = RegexTree.makeSeq(RegexTree.makeAlt(
                            RegexTree.makeSeq(first.subList(0, first.size() - 1)),
                            RegexTree.makeSeq(second.subList(0, second.size() - 1))),
                            last);
                        return RegexTree.makeAlt(without(replaced(choices, i, factored), j));
                    }
                }
                return null;
            }
        },

        SEQ_STAR_ONE_STAR("a*aa* => aa*", false) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> elements = elementsOf(node, 3);
                if (elements == null) return null;
                for (int i = 1; i < elements.size() - 1; ++i) {
                    Node before = elements.get(i - 1);
                    Node inner = innerOf(before);
                    if (inner != null && before.equals(elements.get(i + 1))
                            && inner.equals(elements.get(i))) {
                        return RegexTree.makeSeq(without(elements, i - 1));
                    }
                }
                return null;
            }
        },

        ALT_SUBSET("L1+L2 => L2, if L1 is subset of L2", true) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> choices = choicesOf(node, 2);
                if (choices == null) return null;
                List<Object> alphabet = symbolsOf(node);
                for (int i = 0; i < choices.size() - 1; ++i) {
                    for (int j = i + 1; j < choices.size(); ++j) {
                        if (ctx.isSubset(choices.get(i), choices.get(j), alphabet)) {
                            return RegexTree.makeAlt(without(choices, j));
                        } else if (ctx.isSubset(choices.get(j), choices.get(i), alphabet)) {
                            return RegexTree.makeAlt(without(choices, i));
                        }
                    }
                }
                return null;
            }
        },

        STAR_ALT_SUBSET("(L1+L2)* => L2*, if L1 is subset of L2*", true) {
            @Override
            Node apply(Node node, Context ctx) {
                Alt alt = starredAlt(node, 2);
                if (alt == null) return null;
                List<Node> choices = alt.choices();
                List<Object> alphabet = symbolsOf(node);
                for (int i = 0; i < choices.size() - 1; ++i) {
                    Node si = RegexTree.makeKStar(choices.get(i));
                    for (int j = i + 1; j < choices.size(); ++j) {
                        Node sj = RegexTree.makeKStar(choices.get(j));
                        if (ctx.isSubset(si, sj, alphabet)) {
                            return RegexTree.makeKStar(RegexTree.makeAlt(without(choices, j)));
                        } else if (ctx.isSubset(sj, si, alphabet)) {
                            return RegexTree.makeKStar(RegexTree.makeAlt(without(choices, i)));
                        }
                    }
                }
                return null;
            }
        },

        SEQ_STAR_SUBSET("L1*L2* => L2*, if L1 is subset of L2", true) {
            @Override
            Node apply(Node node, Context ctx) {
                List<Node> elements = elementsOf(node, 2);
                if (elements == null) return null;
                List<Object> alphabet = symbolsOf(node);
                for (int i = 0; i < elements.size() - 1; ++i) {
                    Node a = elements.get(i);
                    Node b = elements.get(i + 1);
                    if (!is(a, Tag.KSTAR) || !is(b, Tag.KSTAR)) continue;
                    if (ctx.isSubset(a, b, alphabet)) {
                        return RegexTree.makeSeq(without(elements, i + 1));
                    } else if (ctx.isSubset(b, a, alphabet)) {
                        return RegexTree.makeSeq(without(elements, i));
                    }
                }
                return null;
            }
        };

        final String name;
        final boolean semantic;

        Rule(String name, boolean semantic) {
            this.name = name;
            this.semantic = semantic;
        }

        abstract Node apply(Node node, Context ctx);
    }
}
