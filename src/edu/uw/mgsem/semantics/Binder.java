package edu.uw.mgsem.semantics;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * A construct that introduces a variable scope: a lambda abstraction (\x.happy(x)) or a quantifier
 * (∀x[student(x) -> happy(x)]).
 */
public class Binder extends Expression {
	private static final long serialVersionUID = 1L;

	public enum Tag {
		LAMBDA("\\"), EXISTS("∃"), FORALL("∀");

		private final String symbol;

		private Tag(final String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		public boolean isQuantifier() {
			return this != LAMBDA;
		}
	}

	private final Tag tag;
	private final Variable variable;
	private final Expression body;

	public Binder(final Tag tag, final Variable variable, final Expression body) {
		super();
		Preconditions.checkNotNull(tag);
		Preconditions.checkNotNull(variable);
		Preconditions.checkNotNull(body);
		Preconditions.checkArgument(!tag.isQuantifier() || variable.isIndividual(),
				"Quantifiers must bind individual variables, but found: " + variable);
		this.tag = tag;
		this.variable = variable;
		this.body = body;
	}

	public static Binder lambda(final Variable variable, final Expression body) {
		return new Binder(Tag.LAMBDA, variable, body);
	}

	public Tag getTag() {
		return tag;
	}

	public Variable getVariable() {
		return variable;
	}

	public Expression getBody() {
		return body;
	}

	public boolean isLambda() {
		return tag == Tag.LAMBDA;
	}

	@Override
	public Expression doSubstitution(final Substitution substitution) {
		final Variable target = substitution.getVariable();
		if (variable.equals(target) || !body.getFreeVariables().contains(target)) {
			// Shadowed, or nothing to replace.
			return this;
		}

		if (substitution.captures(variable)) {
			final Set<Variable> used = getAllVariables();
			used.add(target);
			used.addAll(substitution.getFreeVariablesOfValue());
			final Variable fresh = variable.makeFresh(used);
			return new Binder(tag, fresh, body.alphaConvert(variable, fresh).doSubstitution(substitution));
		}

		return new Binder(tag, variable, body.doSubstitution(substitution));
	}

	@Override
	public Expression alphaConvert(final Variable target, final Variable replacement) {
		final Variable newVariable = variable.alphaConvert(target, replacement);
		final Expression newBody = body.alphaConvert(target, replacement);
		return newVariable == variable && newBody == body ? this : new Binder(tag, newVariable, newBody);
	}

	@Override
	public Expression substitutePredicate(final Variable predicateVariable, final Expression function) {
		if (variable.equals(predicateVariable) || !body.getFreeVariables().contains(predicateVariable)) {
			return this;
		}

		final ImmutableSet<Variable> freeInFunction = function.getFreeVariables();
		if (freeInFunction.contains(variable)) {
			final Set<Variable> used = getAllVariables();
			used.add(predicateVariable);
			used.addAll(freeInFunction);
			final Variable fresh = variable.makeFresh(used);
			return new Binder(tag, fresh, body.alphaConvert(variable, fresh).substitutePredicate(predicateVariable,
					function));
		}

		return new Binder(tag, variable, body.substitutePredicate(predicateVariable, function));
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		final ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
		for (final Variable free : body.getFreeVariables()) {
			if (!free.equals(variable)) {
				result.add(free);
			}
		}
		return result.build();
	}

	@Override
	void addVariables(final Set<Variable> result) {
		result.add(variable);
		body.addVariables(result);
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(tag.symbol);
		variable.toString(result);
		final boolean bracket = body instanceof OperatorExpression;
		result.append(bracket ? "[" : ".");
		body.toString(result);
		if (bracket) {
			result.append("]");
		}
	}

	@Override
	public <T> T accept(final ExpressionVisitor<T> v) {
		return v.visit(this);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Binder)) {
			return false;
		}
		final Binder other = (Binder) obj;
		return tag == other.tag && variable.equals(other.variable) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * tag.hashCode() + variable.hashCode()) + body.hashCode();
	}
}
