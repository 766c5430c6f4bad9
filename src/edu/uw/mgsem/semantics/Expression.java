package edu.uw.mgsem.semantics;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * An immutable logical expression: a {@link Term}, {@link Predicate}, {@link Binder} or {@link OperatorExpression}.
 * Rewriting methods return new trees, sharing any subtrees they leave untouched.
 */
public abstract class Expression implements Serializable {

	private static final long serialVersionUID = 1L;

	// Closed family: only the four variants in this package.
	Expression() {
		super();
	}

	/**
	 * Capture-avoiding substitution of the substitution's value for its variable.
	 */
	public abstract Expression doSubstitution(Substitution substitution);

	/**
	 * Renames every occurrence of the target variable, including binding occurrences.
	 */
	public abstract Expression alphaConvert(Variable target, Variable replacement);

	/**
	 * Replaces every predicate headed by the given predicate variable with the result of applying the function to
	 * that predicate's arguments.
	 */
	public abstract Expression substitutePredicate(Variable variable, Expression function);

	public abstract ImmutableSet<Variable> getFreeVariables();

	/**
	 * All variables occurring in the expression, free or bound.
	 */
	public Set<Variable> getAllVariables() {
		final Set<Variable> result = new HashSet<>();
		addVariables(result);
		return result;
	}

	abstract void addVariables(Set<Variable> result);

	public abstract <T> T accept(ExpressionVisitor<T> v);

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		toString(result);
		return result.toString();
	}

	abstract void toString(StringBuilder result);

	public interface ExpressionVisitor<T> {
		T visit(Term term);

		T visit(Predicate predicate);

		T visit(Binder binder);

		T visit(OperatorExpression operatorExpression);
	}
}
