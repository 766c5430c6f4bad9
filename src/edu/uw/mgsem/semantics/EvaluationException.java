package edu.uw.mgsem.semantics;

public class EvaluationException extends LogicException {
	private static final long serialVersionUID = 1L;

	public EvaluationException(final String message) {
		super(message);
	}
}
