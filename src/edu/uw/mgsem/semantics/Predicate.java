package edu.uw.mgsem.semantics;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A relation applied to a fixed number of arguments, e.g. know(mary, y). The head is normally a {@link Constant},
 * but may be a predicate variable inside an abstraction such as \P.\x.P(x).
 */
public class Predicate extends Expression {

	private static final long serialVersionUID = 1L;
	private final Entity head;
	private final List<Entity> arguments;

	public Predicate(final String name, final Entity... arguments) {
		this(new Constant(name), Arrays.asList(arguments));
	}

	public Predicate(final Entity head, final Entity... arguments) {
		this(head, Arrays.asList(arguments));
	}

	public Predicate(final Entity head, final List<? extends Entity> arguments) {
		super();
		Preconditions.checkNotNull(head);
		Preconditions.checkArgument(head instanceof Constant
				|| (head instanceof Variable && ((Variable) head).isPredicate()),
				"Predicate heads must be constants or predicate variables, but found: " + head);
		for (final Entity argument : arguments) {
			Preconditions.checkNotNull(argument);
			Preconditions.checkArgument(!(argument instanceof Variable && ((Variable) argument).isPredicate()),
					"Predicate variable " + argument + " used as an argument of " + head);
		}

		this.head = head;
		this.arguments = ImmutableList.copyOf(arguments);
	}

	public Entity getHead() {
		return head;
	}

	public List<Entity> getArguments() {
		return arguments;
	}

	public int getArity() {
		return arguments.size();
	}

	@Override
	public Expression doSubstitution(final Substitution substitution) {
		final Entity newHead = head.doSubstitution(substitution);
		final ImmutableList.Builder<Entity> newArguments = ImmutableList.builder();
		boolean changed = newHead != head;
		for (final Entity argument : arguments) {
			final Entity newArgument = argument.doSubstitution(substitution);
			changed = changed || newArgument != argument;
			newArguments.add(newArgument);
		}

		return changed ? new Predicate(newHead, newArguments.build()) : this;
	}

	@Override
	public Expression alphaConvert(final Variable target, final Variable replacement) {
		final Entity newHead = head.alphaConvert(target, replacement);
		final ImmutableList.Builder<Entity> newArguments = ImmutableList.builder();
		boolean changed = newHead != head;
		for (final Entity argument : arguments) {
			final Entity newArgument = argument.alphaConvert(target, replacement);
			changed = changed || newArgument != argument;
			newArguments.add(newArgument);
		}

		return changed ? new Predicate(newHead, newArguments.build()) : this;
	}

	@Override
	public Expression substitutePredicate(final Variable variable, final Expression function) {
		final ImmutableList.Builder<Entity> builder = ImmutableList.builder();
		boolean changed = false;
		for (final Entity argument : arguments) {
			final Entity newArgument = argument.substitutePredicate(variable, function);
			changed = changed || newArgument != argument;
			builder.add(newArgument);
		}
		final List<Entity> newArguments = builder.build();

		if (!head.equals(variable)) {
			return changed ? new Predicate(head, newArguments) : this;
		}

		if (newArguments.isEmpty()) {
			throw new ArityException("Cannot substitute " + function + " for " + variable
					+ ", which is used with no arguments");
		}

		// Simplify (\x.p(x))(Y) to p(Y)
		Expression result = function;
		for (final Entity argument : newArguments) {
			if (!Application.isAbstraction(result)) {
				throw new ArityException(function + " takes fewer than " + newArguments.size() + " arguments in " + this);
			}
			result = Application.apply(result, new Term(argument));
		}

		if (Application.isAbstraction(result)) {
			throw new ArityException(function + " takes more than " + newArguments.size() + " arguments in " + this);
		}

		return result;
	}

	@Override
	public ImmutableSet<Variable> getFreeVariables() {
		final ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
		result.addAll(head.getFreeVariables());
		for (final Entity argument : arguments) {
			result.addAll(argument.getFreeVariables());
		}
		return result.build();
	}

	@Override
	void addVariables(final Set<Variable> result) {
		head.addVariables(result);
		for (final Entity argument : arguments) {
			argument.addVariables(result);
		}
	}

	@Override
	void toString(final StringBuilder result) {
		head.toString(result);
		if (arguments.isEmpty()) {
			return;
		}

		result.append("(");
		boolean isFirst = true;
		for (final Entity argument : arguments) {
			if (isFirst) {
				isFirst = false;
			} else {
				result.append(", ");
			}
			argument.toString(result);
		}
		result.append(")");
	}

	@Override
	public <T> T accept(final ExpressionVisitor<T> v) {
		return v.visit(this);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Predicate)) {
			return false;
		}
		final Predicate other = (Predicate) obj;
		return head.equals(other.head) && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return 31 * head.hashCode() + arguments.hashCode();
	}
}
