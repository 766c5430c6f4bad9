package edu.uw.mgsem.semantics.lexicon;

import java.util.List;
import java.util.Optional;

import edu.uw.mgsem.semantics.Binder;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.Predicate;
import edu.uw.mgsem.semantics.Variable;
import edu.uw.mgsem.syntax.CategoryDescription;
import edu.uw.mgsem.syntax.Feature;

/**
 * Special-case semantics for "be" with an adjectival complement, which contributes nothing but passes the property
 * on to the subject: \P.\x.P(x)
 */
public class CopulaLexicon extends Lexicon {

	private final static List<Feature> COPULA = Feature.listFromString("=j,=d,v");

	@Override
	public Optional<Expression> getEntry(final CategoryDescription category) {
		if (category.getLemma().equals("be") && category.hasFeatures(COPULA)) {
			final Variable p = Variable.named("P");
			final Variable x = Variable.named("x");
			return Optional.of(Binder.lambda(p, Binder.lambda(x, new Predicate(p, x))));
		}

		return Optional.empty();
	}
}
