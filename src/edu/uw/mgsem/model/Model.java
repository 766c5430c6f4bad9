package edu.uw.mgsem.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

import edu.uw.mgsem.semantics.Binder;
import edu.uw.mgsem.semantics.Constant;
import edu.uw.mgsem.semantics.Entity;
import edu.uw.mgsem.semantics.EvaluationException;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.Expression.ExpressionVisitor;
import edu.uw.mgsem.semantics.OperatorExpression;
import edu.uw.mgsem.semantics.Predicate;
import edu.uw.mgsem.semantics.Substitution;
import edu.uw.mgsem.semantics.Term;

/**
 * A finite model: a domain of entities, and explicit extensions for one and two place relations.
 *
 * Populate the model before evaluating anything. Evaluation never modifies it, so a populated model can be shared.
 */
public class Model {

	private static final Pattern FACT = Pattern.compile("\\s*([a-zA-Z0-9_]+)\\s*\\(([^()]*)\\)\\s*");
	private static final Splitter ARGUMENT_SPLITTER = Splitter.on(',').trimResults();

	private final Set<Entity> domain = new LinkedHashSet<>();
	private final Map<String, Set<Entity>> unaries = new HashMap<>();
	// name -> first argument -> second arguments
	private final Table<String, Entity, Set<Entity>> binaries = HashBasedTable.create();
	private final Set<String> binaryNames = new HashSet<>();

	/**
	 * Builds a model from facts like "student(a)" or "knows(a, b)". Every argument becomes a member of the domain.
	 */
	public static Model fromFacts(final Iterable<String> facts) {
		final Model result = new Model();
		for (final String fact : facts) {
			result.addFact(fact);
		}
		return result;
	}

	public void addFact(final String fact) {
		final Matcher matcher = FACT.matcher(fact);
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Unable to interpret fact: \"" + fact + "\"");
		}

		final String name = matcher.group(1);
		final List<String> arguments = ARGUMENT_SPLITTER.splitToList(matcher.group(2));
		for (final String argument : arguments) {
			Preconditions.checkArgument(!argument.isEmpty(), "Empty argument in fact: \"" + fact + "\"");
			addEntity(argument);
		}

		if (arguments.size() == 1) {
			addUnary(name, new Constant(arguments.get(0)));
		} else if (arguments.size() == 2) {
			addBinary(name, new Constant(arguments.get(0)), new Constant(arguments.get(1)));
		} else {
			throw new IllegalArgumentException("Facts must have one or two arguments: \"" + fact + "\"");
		}
	}

	public void addEntity(final String name) {
		addEntity(new Constant(name));
	}

	public void addEntity(final Entity entity) {
		domain.add(Preconditions.checkNotNull(entity));
	}

	/**
	 * Registers a one place relation with an empty extension.
	 */
	public void declareUnary(final String name) {
		unaries.computeIfAbsent(Preconditions.checkNotNull(name), k -> new HashSet<>());
	}

	public void addUnary(final String name, final Entity member) {
		Preconditions.checkNotNull(member);
		declareUnary(name);
		unaries.get(name).add(member);
	}

	/**
	 * Registers a two place relation with an empty extension.
	 */
	public void declareBinary(final String name) {
		binaryNames.add(Preconditions.checkNotNull(name));
	}

	/**
	 * Records that name(first, second) holds.
	 */
	public void addBinary(final String name, final Entity first, final Entity second) {
		Preconditions.checkNotNull(first);
		Preconditions.checkNotNull(second);
		declareBinary(name);
		Set<Entity> related = binaries.get(name, first);
		if (related == null) {
			related = new HashSet<>();
			binaries.put(name, first, related);
		}
		related.add(second);
	}

	public Set<Entity> getDomain() {
		return Collections.unmodifiableSet(domain);
	}

	/**
	 * Evaluates a closed formula. All abstractions must already have been applied.
	 */
	public TruthValue eval(final Expression expression) {
		return expression.accept(new Evaluator());
	}

	private TruthValue evalUnary(final String name, final Entity argument) {
		final Set<Entity> extension = unaries.get(name);
		if (extension == null || !domain.contains(argument)) {
			return TruthValue.UNDEFINED;
		}
		return TruthValue.of(extension.contains(argument));
	}

	private TruthValue evalBinary(final String name, final Entity first, final Entity second) {
		if (!binaryNames.contains(name)) {
			return TruthValue.UNDEFINED;
		}
		final Set<Entity> related = binaries.get(name, first);
		if (related == null) {
			return TruthValue.UNDEFINED;
		}
		return TruthValue.of(related.contains(second));
	}

	private class Evaluator implements ExpressionVisitor<TruthValue> {

		@Override
		public TruthValue visit(final Term term) {
			throw new EvaluationException("Cannot evaluate a bare term: " + term);
		}

		@Override
		public TruthValue visit(final Predicate predicate) {
			if (!(predicate.getHead() instanceof Constant)) {
				throw new EvaluationException("Cannot evaluate predicate with a variable head: " + predicate);
			}
			if (!predicate.getFreeVariables().isEmpty()) {
				throw new EvaluationException("Cannot evaluate predicate with free variables " + predicate
						+ ": " + predicate.getFreeVariables());
			}

			final String name = ((Constant) predicate.getHead()).getName();
			final List<Entity> arguments = predicate.getArguments();
			switch (arguments.size()) {
			case 1:
				return evalUnary(name, arguments.get(0));
			case 2:
				return evalBinary(name, arguments.get(0), arguments.get(1));
			default:
				throw new EvaluationException("Cannot evaluate " + arguments.size() + " place predicate: " + predicate);
			}
		}

		@Override
		public TruthValue visit(final Binder binder) {
			switch (binder.getTag()) {
			case EXISTS:
				boolean sawUndefined = false;
				for (final Entity entity : domain) {
					final TruthValue value = instantiate(binder, entity);
					if (value == TruthValue.TRUE) {
						return TruthValue.TRUE;
					}
					sawUndefined = sawUndefined || value == TruthValue.UNDEFINED;
				}
				return sawUndefined ? TruthValue.UNDEFINED : TruthValue.FALSE;
			case FORALL:
				// Only an explicit counterexample falsifies.
				for (final Entity entity : domain) {
					if (instantiate(binder, entity) == TruthValue.FALSE) {
						return TruthValue.FALSE;
					}
				}
				return TruthValue.TRUE;
			case LAMBDA:
				throw new EvaluationException("Cannot evaluate unapplied function: " + binder);
			default:
				throw new EvaluationException("Cannot evaluate: " + binder);
			}
		}

		private TruthValue instantiate(final Binder binder, final Entity entity) {
			return binder.getBody().doSubstitution(new Substitution(binder.getVariable(), entity)).accept(this);
		}

		@Override
		public TruthValue visit(final OperatorExpression operatorExpression) {
			final List<Expression> arguments = operatorExpression.getArguments();
			switch (operatorExpression.getOperator()) {
			case NOT:
				return arguments.get(0).accept(this).not();
			case AND:
				return arguments.get(0).accept(this).and(arguments.get(1).accept(this));
			case OR:
				return arguments.get(0).accept(this).or(arguments.get(1).accept(this));
			case IMPLIES:
				return arguments.get(0).accept(this).implies(arguments.get(1).accept(this));
			default:
				throw new EvaluationException("Cannot evaluate: " + operatorExpression);
			}
		}
	}
}
