package edu.uw.mgsem.semantics;

import com.google.common.base.Preconditions;

/**
 * Function application (beta-reduction) between two expressions. The rule is chosen from the shapes of the operands
 * and the type of the abstracted variables; operand order only matters for error messages.
 */
public class Application {

	private Application() {
	}

	public static Expression apply(final Expression left, final Expression right) {
		Preconditions.checkNotNull(left);
		Preconditions.checkNotNull(right);

		if (left instanceof Term && isAbstraction(right)) {
			return applyToTerm((Binder) right, (Term) left);
		} else if (isAbstraction(left) && right instanceof Term) {
			return applyToTerm((Binder) left, (Term) right);
		} else if (isAbstraction(left) && isAbstraction(right)) {
			final Binder leftBinder = (Binder) left;
			final Binder rightBinder = (Binder) right;
			if (leftBinder.getVariable().isPredicate() && rightBinder.getVariable().isIndividual()) {
				return applyToProperty(leftBinder, rightBinder);
			} else if (rightBinder.getVariable().isPredicate() && leftBinder.getVariable().isIndividual()) {
				return applyToProperty(rightBinder, leftBinder);
			}
		}

		throw new ApplicationTypeException(left, right);
	}

	/**
	 * (\x.know(x, y))(mary) --> know(mary, y)
	 */
	private static Expression applyToTerm(final Binder function, final Term argument) {
		if (!function.getVariable().isIndividual()) {
			throw new ApplicationTypeException("Cannot apply " + function + " to individual " + argument
					+ ": it abstracts over a predicate");
		}

		return function.getBody().doSubstitution(new Substitution(function.getVariable(), argument.getEntity()));
	}

	/**
	 * (\P.\Q.∀x[P(x) -> Q(x)])(\x.student(x)) --> \Q.∀x[student(x) -> Q(x)]
	 */
	private static Expression applyToProperty(final Binder function, final Binder argument) {
		return function.getBody().substitutePredicate(function.getVariable(), argument);
	}

	static boolean isAbstraction(final Expression expression) {
		return expression instanceof Binder && ((Binder) expression).isLambda();
	}
}
