package org.dice.truthtable.parsing.ast;

import java.util.Map;
import java.util.Set;

/**
 * <expr>  ::= <prop>|<neg>|<op>
 * <prop>  ::= letter (not 'v', not "tmp") {letter|digit|'_'}
 * <neg>   ::= '¬'<prop>|'¬'<op>
 * <op>    ::= '('<expr><sym><expr>')'
 * <sym>   ::= ' v '|' ^ '|' -> '|' <-> '
 */
public interface Formula {

	/**
	 * Evaluates the formula.
	 *
	 * @param assignment truth values of the propositions
	 * @throws UnboundPropositionException if a referenced proposition has no value
	 */
	public boolean evaluate(Map<String, Boolean> assignment);

	/**
	 * @return the canonical surface text, which parses back to an equal formula
	 */
	public String render();

	/**
	 * Adds the proposition names to {@code names} in left-to-right, depth-first order.
	 */
	public void collectPropositions(Set<String> names);
}
