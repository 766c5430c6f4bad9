package edu.uw.mgsem.semantics;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import edu.uw.mgsem.util.Util;

public class Variable extends Entity {
	private static final long serialVersionUID = 1L;

	/**
	 * Individual variables range over entities of the domain. Predicate variables stand for one-place properties,
	 * and may only appear as the head of a {@link Predicate}.
	 */
	public enum VariableType {
		INDIVIDUAL, PREDICATE
	}

	private final String name;
	private final VariableType type;

	public Variable(final String name, final VariableType type) {
		super();
		Preconditions.checkNotNull(name);
		Preconditions.checkNotNull(type);
		Preconditions.checkArgument(!name.isEmpty(), "Variable names must be non-empty");
		this.name = name;
		this.type = type;
	}

	/**
	 * Lowercase names make individual variables (x, y), capitalized names make predicate variables (P, Q).
	 */
	public static Variable named(final String name) {
		Preconditions.checkArgument(!name.isEmpty(), "Variable names must be non-empty");
		return new Variable(name, Util.isCapitalized(name) ? VariableType.PREDICATE : VariableType.INDIVIDUAL);
	}

	public String getName() {
		return name;
	}

	public VariableType getType() {
		return type;
	}

	public boolean isIndividual() {
		return type == VariableType.INDIVIDUAL;
	}

	public boolean isPredicate() {
		return type == VariableType.PREDICATE;
	}

	/**
	 * Returns a variable of the same type that does not occur in the given set, made by priming this one: x, x',
	 * x'', ...
	 */
	Variable makeFresh(final Set<Variable> used) {
		Variable result = this;
		while (used.contains(result)) {
			result = new Variable(result.name + "'", type);
		}
		return result;
	}

	@Override
	public Entity doSubstitution(final Substitution substitution) {
		return substitution.getValue(this);
	}

	@Override
	public Variable alphaConvert(final Variable target, final Variable replacement) {
		if (!equals(target)) {
			return this;
		}
		Preconditions.checkArgument(replacement.type == type, "Cannot rename " + this + " to " + replacement);
		return replacement;
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		return ImmutableSet.of(this);
	}

	@Override
	void addVariables(final Set<Variable> result) {
		result.add(this);
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(name);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Variable)) {
			return false;
		}
		final Variable other = (Variable) obj;
		return type == other.type && name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + type.hashCode();
	}
}
