package org.dice.truthtable.parsing.ast.operators;

import org.dice.truthtable.parsing.ast.Formula;

public class And extends BinaryOperator {

	public And(Formula left, Formula right){
		super(left, right);
	}

	@Override
	public Connective getConnective() {
		return Connective.AND;
	}

	@Override
	protected boolean apply(boolean l, boolean r) {
		return l && r;
	}
}
