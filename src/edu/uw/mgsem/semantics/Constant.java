package edu.uw.mgsem.semantics;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * A fixed individual, or the name of a relation when used as the head of a {@link Predicate}.
 */
public class Constant extends Entity {
	private static final long serialVersionUID = 1L;

	private final String name;

	public Constant(final String name) {
		super();
		Preconditions.checkNotNull(name);
		Preconditions.checkArgument(!name.isEmpty(), "Constant names must be non-empty");
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public Entity doSubstitution(final Substitution substitution) {
		return this;
	}

	@Override
	public Entity alphaConvert(final Variable target, final Variable replacement) {
		return this;
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		return ImmutableSet.of();
	}

	@Override
	void addVariables(final Set<Variable> result) {
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(name);
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof Constant && name.equals(((Constant) obj).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}
}
