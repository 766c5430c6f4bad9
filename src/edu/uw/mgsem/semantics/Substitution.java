package edu.uw.mgsem.semantics;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Stores a variable/value pair for substitutions. The value must have a type the variable can stand for:
 * predicate variables only take constants (relation names) or other predicate variables.
 */
public class Substitution {

	private final Variable var;
	private final Entity value;
	private final ImmutableSet<Variable> freeVariablesOfValue;

	public Substitution(final Variable variable, final Entity value) {
		Preconditions.checkNotNull(variable);
		Preconditions.checkNotNull(value);
		if (variable.isPredicate()) {
			Preconditions.checkArgument(value instanceof Constant || isPredicateVariable(value),
					"Cannot substitute " + value + " for predicate variable " + variable);
		} else {
			Preconditions.checkArgument(!isPredicateVariable(value), "Cannot substitute predicate variable " + value
					+ " for individual variable " + variable);
		}
		this.var = variable;
		this.value = value;
		this.freeVariablesOfValue = value.getFreeVariables();
	}

	private static boolean isPredicateVariable(final Entity entity) {
		return entity instanceof Variable && ((Variable) entity).isPredicate();
	}

	public Variable getVariable() {
		return var;
	}

	public Entity getValue() {
		return value;
	}

	Entity getValue(final Variable variable) {
		return variable.equals(var) ? value : variable;
	}

	/**
	 * True if substituting under a binder for the given variable would capture part of the value.
	 */
	boolean captures(final Variable boundVariable) {
		return freeVariablesOfValue.contains(boundVariable);
	}

	ImmutableSet<Variable> getFreeVariablesOfValue() {
		return freeVariablesOfValue;
	}
}
