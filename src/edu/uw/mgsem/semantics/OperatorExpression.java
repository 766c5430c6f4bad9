package edu.uw.mgsem.semantics;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Negation, conjunction, disjunction and implication.
 */
public class OperatorExpression extends Expression {
	private static final long serialVersionUID = 1L;

	public enum Operator {
		NOT("¬", 1), AND("&", 2), OR("|", 2), IMPLIES("->", 2);

		private final String symbol;
		private final int arity;

		private Operator(final String symbol, final int arity) {
			this.symbol = symbol;
			this.arity = arity;
		}

		public String getSymbol() {
			return symbol;
		}

		public int getArity() {
			return arity;
		}
	}

	private final Operator operator;
	private final List<Expression> arguments;

	public OperatorExpression(final Operator operator, final Expression... arguments) {
		this(operator, Arrays.asList(arguments));
	}

	public OperatorExpression(final Operator operator, final List<? extends Expression> arguments) {
		super();
		Preconditions.checkNotNull(operator);
		if (arguments.size() != 1 && arguments.size() != 2) {
			throw new ArityException("Operators take one or two arguments, but " + operator + " was given "
					+ arguments.size());
		}
		if (arguments.size() != operator.arity) {
			throw new ArityException(operator + " takes " + operator.arity + " argument(s), but was given "
					+ arguments.size());
		}
		for (final Expression argument : arguments) {
			Preconditions.checkNotNull(argument);
		}

		this.operator = operator;
		this.arguments = ImmutableList.copyOf(arguments);
	}

	public static OperatorExpression not(final Expression argument) {
		return new OperatorExpression(Operator.NOT, argument);
	}

	public static OperatorExpression and(final Expression left, final Expression right) {
		return new OperatorExpression(Operator.AND, left, right);
	}

	public static OperatorExpression or(final Expression left, final Expression right) {
		return new OperatorExpression(Operator.OR, left, right);
	}

	public static OperatorExpression implies(final Expression left, final Expression right) {
		return new OperatorExpression(Operator.IMPLIES, left, right);
	}

	public Operator getOperator() {
		return operator;
	}

	public List<Expression> getArguments() {
		return arguments;
	}

	public Expression getArgument(final int index) {
		return arguments.get(index);
	}

	private Expression map(final UnaryOperator<Expression> function) {
		final ImmutableList.Builder<Expression> newArguments = ImmutableList.builder();
		boolean changed = false;
		for (final Expression argument : arguments) {
			final Expression newArgument = function.apply(argument);
			changed = changed || newArgument != argument;
			newArguments.add(newArgument);
		}
		return changed ? new OperatorExpression(operator, newArguments.build()) : this;
	}

	@Override
	public Expression doSubstitution(final Substitution substitution) {
		return map(x -> x.doSubstitution(substitution));
	}

	@Override
	public Expression alphaConvert(final Variable target, final Variable replacement) {
		return map(x -> x.alphaConvert(target, replacement));
	}

	@Override
	public Expression substitutePredicate(final Variable variable, final Expression function) {
		return map(x -> x.substitutePredicate(variable, function));
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		final ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
		for (final Expression argument : arguments) {
			result.addAll(argument.getFreeVariables());
		}
		return result.build();
	}

	@Override
	void addVariables(final Set<Variable> result) {
		for (final Expression argument : arguments) {
			argument.addVariables(result);
		}
	}

	@Override
	void toString(final StringBuilder result) {
		if (arguments.size() == 1) {
			result.append(operator.symbol);
			arguments.get(0).toString(result);
		} else {
			arguments.get(0).toString(result);
			result.append(" ");
			result.append(operator.symbol);
			result.append(" ");
			arguments.get(1).toString(result);
		}
	}

	@Override
	public <T> T accept(final ExpressionVisitor<T> v) {
		return v.visit(this);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof OperatorExpression)) {
			return false;
		}
		final OperatorExpression other = (OperatorExpression) obj;
		return operator == other.operator && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return 31 * operator.hashCode() + arguments.hashCode();
	}
}
