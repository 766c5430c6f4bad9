package edu.uw.mgsem.semantics.lexicon;

import java.util.Optional;

import edu.uw.mgsem.semantics.Binder;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.Predicate;
import edu.uw.mgsem.semantics.Variable;
import edu.uw.mgsem.syntax.CategoryDescription;

/**
 * Builds logical forms for words, based on their categories and lemmas.
 */
public abstract class Lexicon {

	/**
	 * Builds a semantic representation for a word, or returns empty if this lexicon has no template for its category.
	 */
	public abstract Optional<Expression> getEntry(CategoryDescription category);

	/**
	 * e.g. getEntry("know", "=d,=d,v")
	 */
	public Optional<Expression> getEntry(final String lemma, final String features) {
		return getEntry(CategoryDescription.valueOf(lemma, features));
	}

	/** \x.lemma(x) */
	static Expression makeProperty(final String lemma) {
		final Variable x = Variable.named("x");
		return Binder.lambda(x, new Predicate(lemma, x));
	}
}
