package edu.uw.mgsem.semantics.lexicon;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import edu.uw.mgsem.semantics.Binder;
import edu.uw.mgsem.semantics.Binder.Tag;
import edu.uw.mgsem.semantics.Constant;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.OperatorExpression;
import edu.uw.mgsem.semantics.Predicate;
import edu.uw.mgsem.semantics.Term;
import edu.uw.mgsem.semantics.UnsupportedOperatorException;
import edu.uw.mgsem.semantics.Variable;
import edu.uw.mgsem.syntax.CategoryDescription;
import edu.uw.mgsem.syntax.Feature;

/**
 * Constructs a default semantics for a word based on its category. Categories are tried in order, and the first
 * match wins.
 */
public class DefaultLexicon extends Lexicon {

	private final static List<Feature> TRANSITIVE_VERB = Feature.listFromString("=d,=d,v");
	private final static List<Feature> INTRANSITIVE_VERB = Feature.listFromString("=d,v");
	private final static List<Feature> NOUN = Feature.listFromString("n");
	private final static List<Feature> ADJECTIVE = Feature.listFromString("j");
	private final static List<Feature> ATTRIBUTIVE_ADJECTIVE = Feature.listFromString("=n,j");
	private final static List<List<Feature>> DETERMINERS = ImmutableList.of(Feature.listFromString("=n,d"),
			Feature.listFromString("=n,d,-case"), Feature.listFromString("=j,d"), Feature.listFromString("=j,d,-case"));
	private final static List<List<Feature>> NAMES = ImmutableList.of(Feature.listFromString("d"),
			Feature.listFromString("d,-case"));

	@Override
	public Optional<Expression> getEntry(final CategoryDescription category) {
		final String lemma = category.getLemma();

		if (category.hasFeatures(TRANSITIVE_VERB)) {
			// The object is selected first: \y.\x.know(x, y)
			final Variable x = Variable.named("x");
			final Variable y = Variable.named("y");
			return Optional.of(Binder.lambda(y, Binder.lambda(x, new Predicate(lemma, x, y))));
		} else if (category.hasFeatures(INTRANSITIVE_VERB) || category.hasFeatures(NOUN)
				|| category.hasFeatures(ADJECTIVE)) {
			return Optional.of(makeProperty(lemma));
		} else if (category.hasFeatures(ATTRIBUTIVE_ADJECTIVE)) {
			// \P.\x[P(x) & happy(x)]
			final Variable p = Variable.named("P");
			final Variable x = Variable.named("x");
			return Optional.of(Binder.lambda(p, Binder.lambda(x,
					OperatorExpression.and(new Predicate(p, x), new Predicate(lemma, x)))));
		} else if (DETERMINERS.stream().anyMatch(category::hasFeatures)) {
			return Optional.of(makeDeterminer(lemma));
		} else if (NAMES.stream().anyMatch(category::hasFeatures)) {
			return Optional.of(new Term(new Constant(lemma)));
		}

		return Optional.empty();
	}

	private static Expression makeDeterminer(final String lemma) {
		final Variable p = Variable.named("P");
		final Variable q = Variable.named("Q");
		final Variable x = Variable.named("x");
		final Predicate px = new Predicate(p, x);
		final Predicate qx = new Predicate(q, x);

		final Expression quantified;
		switch (lemma.toLowerCase(Locale.ROOT)) {
		case "every":
			// \P.\Q.∀x[P(x) -> Q(x)]
			quantified = new Binder(Tag.FORALL, x, OperatorExpression.implies(px, qx));
			break;
		case "a":
		case "an":
			// \P.\Q.∃x[P(x) & Q(x)]
			quantified = new Binder(Tag.EXISTS, x, OperatorExpression.and(px, qx));
			break;
		default:
			throw new UnsupportedOperatorException("No quantifier for determiner: " + lemma);
		}

		return Binder.lambda(p, Binder.lambda(q, quantified));
	}
}
