package org.dice.truthtable.parsing.ast.operators;

import org.dice.truthtable.parsing.ast.Formula;

public class Biconditional extends BinaryOperator {

	public Biconditional(Formula left, Formula right){
		super(left, right);
	}

	@Override
	public Connective getConnective() {
		return Connective.BICONDITIONAL;
	}

	@Override
	protected boolean apply(boolean l, boolean r) {
		return l == r;
	}
}
