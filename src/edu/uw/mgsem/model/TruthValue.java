package edu.uw.mgsem.model;

/**
 * Result of evaluating a formula. UNDEFINED means the model has no information about some part of the formula, and
 * is never silently treated as FALSE.
 */
public enum TruthValue {
	TRUE, FALSE, UNDEFINED;

	public static TruthValue of(final boolean value) {
		return value ? TRUE : FALSE;
	}

	public boolean isDefined() {
		return this != UNDEFINED;
	}

	public TruthValue not() {
		return isDefined() ? of(this == FALSE) : UNDEFINED;
	}

	public TruthValue and(final TruthValue other) {
		if (!isDefined() || !other.isDefined()) {
			return UNDEFINED;
		}
		return of(this == TRUE && other == TRUE);
	}

	public TruthValue or(final TruthValue other) {
		if (!isDefined() || !other.isDefined()) {
			return UNDEFINED;
		}
		return of(this == TRUE || other == TRUE);
	}

	public TruthValue implies(final TruthValue other) {
		if (!isDefined() || !other.isDefined()) {
			return UNDEFINED;
		}
		return of(this == FALSE || other == TRUE);
	}
}
