package org.dice.truthtable.parsing.ast.operators;

import com.google.common.base.Preconditions;
import org.dice.truthtable.parsing.ast.Formula;

import java.util.Set;

public abstract class UnaryOperator implements Formula {
    protected final Formula child;

    UnaryOperator(Formula child){
        this.child = Preconditions.checkNotNull(child, "child");
    }

    public Formula getChild() {
        return child;
    }

    public void collectPropositions(Set<String> names) {
        child.collectPropositions(names);
    }

    @Override
    public String toString(){
        return this.render();
    }
}
