package org.dice.truthtable.parsing.ast.operators;

import org.dice.truthtable.parsing.ast.Formula;

/**
 * Material implication, false only when the left operand is true and the right one false.
 */
public class Conditional extends BinaryOperator {

	public Conditional(Formula left, Formula right){
		super(left, right);
	}

	@Override
	public Connective getConnective() {
		return Connective.CONDITIONAL;
	}

	@Override
	protected boolean apply(boolean l, boolean r) {
		return !l || r;
	}
}
