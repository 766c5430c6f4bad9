package edu.uw.mgsem.semantics;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Lets a complete expression appear in an argument position, e.g. the clausal complement of "believe".
 */
public class EmbeddedFormula extends Entity {
	private static final long serialVersionUID = 1L;

	private final Expression formula;

	public EmbeddedFormula(final Expression formula) {
		super();
		this.formula = Preconditions.checkNotNull(formula);
	}

	public Expression getFormula() {
		return formula;
	}

	@Override
	public Entity doSubstitution(final Substitution substitution) {
		final Expression newFormula = formula.doSubstitution(substitution);
		return newFormula == formula ? this : new EmbeddedFormula(newFormula);
	}

	@Override
	public Entity alphaConvert(final Variable target, final Variable replacement) {
		final Expression newFormula = formula.alphaConvert(target, replacement);
		return newFormula == formula ? this : new EmbeddedFormula(newFormula);
	}

	@Override
	Entity substitutePredicate(final Variable variable, final Expression function) {
		final Expression newFormula = formula.substitutePredicate(variable, function);
		return newFormula == formula ? this : new EmbeddedFormula(newFormula);
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		return formula.getFreeVariables();
	}

	@Override
	void addVariables(final Set<Variable> result) {
		formula.addVariables(result);
	}

	@Override
	void toString(final StringBuilder result) {
		formula.toString(result);
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof EmbeddedFormula && formula.equals(((EmbeddedFormula) obj).formula);
	}

	@Override
	public int hashCode() {
		return formula.hashCode();
	}
}
