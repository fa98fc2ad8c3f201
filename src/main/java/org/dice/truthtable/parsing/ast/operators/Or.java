package org.dice.truthtable.parsing.ast.operators;

import org.dice.truthtable.parsing.ast.Formula;

public class Or extends BinaryOperator {

	public Or(Formula left, Formula right){
		super(left, right);
	}

	@Override
	public Connective getConnective() {
		return Connective.OR;
	}

	@Override
	protected boolean apply(boolean l, boolean r) {
		return l || r;
	}
}
