package org.dice.truthtable.parsing.ast.operands;

import com.google.common.base.Preconditions;
import org.dice.truthtable.parsing.ast.Formula;
import org.dice.truthtable.parsing.ast.UnboundPropositionException;

import java.util.Map;
import java.util.Set;

public class Proposition implements Formula {
	protected final String name;

	public Proposition(String name) {
		this.name = Preconditions.checkNotNull(name, "name");
	}

	public String getName() {
		return name;
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		Boolean value = assignment.get(name);
		if(value == null){
			throw new UnboundPropositionException(name);
		}
		return value;
	}

	public String render() {
		return name;
	}

	public void collectPropositions(Set<String> names) {
		names.add(name);
	}

	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof Proposition)){
			return false;
		}
		return name.equals(((Proposition) obj).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString(){
		return this.render();
	}
}
