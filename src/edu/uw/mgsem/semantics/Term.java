package edu.uw.mgsem.semantics;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Wraps an entity so that it can be passed to {@link Application#apply}.
 */
public class Term extends Expression {
	private static final long serialVersionUID = 1L;

	private final Entity entity;

	public Term(final Entity entity) {
		super();
		this.entity = Preconditions.checkNotNull(entity);
	}

	public Entity getEntity() {
		return entity;
	}

	@Override
	public Expression doSubstitution(final Substitution substitution) {
		final Entity newEntity = entity.doSubstitution(substitution);
		return newEntity == entity ? this : new Term(newEntity);
	}

	@Override
	public Expression alphaConvert(final Variable target, final Variable replacement) {
		final Entity newEntity = entity.alphaConvert(target, replacement);
		return newEntity == entity ? this : new Term(newEntity);
	}

	@Override
	public Expression substitutePredicate(final Variable variable, final Expression function) {
		final Entity newEntity = entity.substitutePredicate(variable, function);
		return newEntity == entity ? this : new Term(newEntity);
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		return entity.getFreeVariables();
	}

	@Override
	void addVariables(final Set<Variable> result) {
		entity.addVariables(result);
	}

	@Override
	void toString(final StringBuilder result) {
		entity.toString(result);
	}

	@Override
	public <T> T accept(final ExpressionVisitor<T> v) {
		return v.visit(this);
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof Term && entity.equals(((Term) obj).entity);
	}

	@Override
	public int hashCode() {
		return entity.hashCode();
	}
}
