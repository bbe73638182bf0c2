/*
 * @LICENSE@
 */

/**
 * <h3><b>fsmkit</b> - finite automata and regular expressions, and the
 * conversions between them.</h3>
 * <p>
 * <h4>Automata.</h4>
 * <p>
 * An {@link org.fsmkit.Automaton} is a deterministic (DFA), nondeterministic
 * (NFA) or epsilon-nondeterministic (eNFA) finite automaton whose states and
 * symbols are arbitrary objects, compared by value. Automata are built
 * incrementally, or ingested from an external description through
 * {@link org.fsmkit.Validator}, which checks every structural invariant and
 * reports the first violation as an {@link org.fsmkit.AutomatonException}.
 * <p>
 * {@link org.fsmkit.Automata} holds the algorithms: epsilon closure, reading
 * strings, classification, epsilon elimination, subset construction,
 * minimization, equivalence, and conversion of an automaton to a regular
 * expression by state elimination. {@link org.fsmkit.Operations} holds the
 * language operations: union, intersection, difference, complement,
 * concatenation, Kleene star, reversal and the subset test. Nothing ever
 * modifies an automaton it was given; every transformation returns a new
 * one.
 * <p>
 * <h4>Regular expressions.</h4>
 * <p>
 * Regular expressions come in three forms:
 * <ul>
 * <li>the {@linkplain org.fsmkit.RegexTree tree} form: immutable Alt, Seq,
 * KStar, Lit and Eps nodes, converted to automata by the Thompson
 * construction;</li>
 * <li>the {@linkplain org.fsmkit.RegexArray array} form: a list of arbitrary
 * symbols and operator markers;</li>
 * <li>the {@linkplain org.fsmkit.RegexString string} form, for single
 * character symbols, such as <code>"(a+b)*abb"</code>, where <code>+</code>
 * is alternation and <code>$</code> epsilon.</li>
 * </ul>
 * The {@link org.fsmkit.Simplifier} rewrites trees into smaller trees
 * denoting the same language, some of its rules deciding language inclusion
 * with automata. A typical round trip:
 *
 * <pre>
 * Automaton fsm = Automata.minimize(RegexString.toAutomaton(&quot;a*b+a*ab&quot;));
 * String regex = RegexTree.toString(new Simplifier().simplify(Automata.toRegex(fsm)));
 * </pre>
 * <p>
 * Notation errors are reported as
 * {@link java.util.regex.PatternSyntaxException}s.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Everything logs to the <code>java.util.logging</code> logger named
 * <code>org.fsmkit</code>, at FINE and below.
 */
package org.fsmkit;

