package org.dice.truthtable.parsing.ast.operators;

import org.dice.truthtable.parsing.ast.Formula;

import java.util.Map;

public class Not extends UnaryOperator {
	public static final String SYMBOL = "¬";

	public Not(Formula child){
		super(child);
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return !child.evaluate(assignment);
	}

	public String render() {
		return SYMBOL + child.render();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Not && child.equals(((Not) obj).child);
	}

	@Override
	public int hashCode() {
		return 31 * child.hashCode() + 1;
	}
}
