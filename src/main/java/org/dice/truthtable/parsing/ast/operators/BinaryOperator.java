package org.dice.truthtable.parsing.ast.operators;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.dice.truthtable.parsing.ast.Formula;

import java.util.Map;
import java.util.Set;

public abstract class BinaryOperator implements Formula {
	protected final Formula left, right;

    BinaryOperator(Formula left, Formula right){
        this.left = Preconditions.checkNotNull(left, "left");
        this.right = Preconditions.checkNotNull(right, "right");
    }

    public abstract Connective getConnective();

    /**
     * Combines the values of both operands. Both operands are always evaluated, so a missing
     * proposition is reported wherever it occurs.
     */
    protected abstract boolean apply(boolean l, boolean r);

    public boolean evaluate(Map<String, Boolean> assignment) {
        boolean l = left.evaluate(assignment);
        boolean r = right.evaluate(assignment);
        return apply(l, r);
    }

    public String render() {
        return String.format("(%s %s %s)", left.render(), getConnective().getSymbol(), right.render());
    }

    public void collectPropositions(Set<String> names) {
        left.collectPropositions(names);
        right.collectPropositions(names);
    }

    public Formula getLeft() {
        return left;
    }

    public Formula getRight() {
        return right;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == null || obj.getClass() != this.getClass()){
            return false;
        }
        BinaryOperator other = (BinaryOperator) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getConnective(), left, right);
    }

	@Override
	public String toString(){
		return this.render();
	}
}
