package edu.uw.mgsem.semantics;

import java.io.Serializable;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Something that can fill an argument position of a {@link Predicate}: a {@link Constant}, a {@link Variable}, or
 * an {@link EmbeddedFormula}.
 */
public abstract class Entity implements Serializable {
	private static final long serialVersionUID = 1L;

	// Closed family: only the three variants in this package.
	Entity() {
		super();
	}

	public abstract Entity doSubstitution(Substitution substitution);

	public abstract Entity alphaConvert(Variable target, Variable replacement);

	Entity substitutePredicate(@SuppressWarnings("unused") final Variable variable,
			@SuppressWarnings("unused") final Expression function) {
		return this;
	}

	public abstract ImmutableSet<Variable> getFreeVariables();

	abstract void addVariables(Set<Variable> result);

	abstract void toString(StringBuilder result);

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		toString(result);
		return result.toString();
	}
}
