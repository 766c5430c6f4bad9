package edu.uw.mgsem.model;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import edu.uw.mgsem.semantics.Binder;
import edu.uw.mgsem.semantics.Binder.Tag;
import edu.uw.mgsem.semantics.Constant;
import edu.uw.mgsem.semantics.EvaluationException;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.OperatorExpression;
import edu.uw.mgsem.semantics.Predicate;
import edu.uw.mgsem.semantics.Term;
import edu.uw.mgsem.semantics.Variable;

public class ModelTest {

	private final Constant a = new Constant("a");
	private final Constant b = new Constant("b");
	private final Constant c = new Constant("c");
	private final Variable x = Variable.named("x");

	private Model model;

	@Before
	public void setUp() {
		model = new Model();
		model.addEntity(a);
		model.addEntity(b);
		model.addEntity(c);
		model.addUnary("student", a);
		model.addUnary("student", b);
		model.addUnary("happy", a);
	}

	private Expression every(final String restrictor, final String scope) {
		return new Binder(Tag.FORALL, x, OperatorExpression.implies(new Predicate(restrictor, x), new Predicate(scope,
				x)));
	}

	@Test
	public void testUniversal() {
		assertEquals(TruthValue.TRUE, model.eval(every("student", "student")));
		// b is a student, but not happy
		assertEquals(TruthValue.FALSE, model.eval(every("student", "happy")));
	}

	@Test
	public void testExistential() {
		final Model knows = new Model();
		knows.addEntity(a);
		knows.addEntity(b);
		knows.addBinary("knows", a, b);

		final Expression formula = new Binder(Tag.EXISTS, x, new Predicate("knows", a, x));
		assertEquals(TruthValue.TRUE, knows.eval(formula));
	}

	@Test
	public void testEmptyBinaryTableIsUndefined() {
		final Model empty = new Model();
		empty.addEntity(a);
		empty.addEntity(b);
		empty.declareBinary("knows");

		assertEquals(TruthValue.UNDEFINED, empty.eval(new Binder(Tag.EXISTS, x, new Predicate("knows", a, x))));
	}

	@Test
	public void testExistentialWithNoWitness() {
		assertEquals(TruthValue.FALSE, model.eval(new Binder(Tag.EXISTS, x, OperatorExpression.and(new Predicate(
				"student", x), OperatorExpression.not(new Predicate("student", x))))));
	}

	@Test
	public void testUnaryLookup() {
		assertEquals(TruthValue.TRUE, model.eval(new Predicate("happy", a)));
		assertEquals(TruthValue.FALSE, model.eval(new Predicate("happy", b)));
		// Unknown predicate, and an individual outside the domain.
		assertEquals(TruthValue.UNDEFINED, model.eval(new Predicate("tall", a)));
		assertEquals(TruthValue.UNDEFINED, model.eval(new Predicate("happy", new Constant("zed"))));
	}

	@Test
	public void testDeclaredUnaryWithNoMembers() {
		model.declareUnary("tall");
		assertEquals(TruthValue.FALSE, model.eval(new Predicate("tall", a)));
	}

	@Test
	public void testBinaryLookup() {
		model.addBinary("knows", a, b);
		assertEquals(TruthValue.TRUE, model.eval(new Predicate("knows", a, b)));
		assertEquals(TruthValue.FALSE, model.eval(new Predicate("knows", a, c)));
		assertEquals(TruthValue.UNDEFINED, model.eval(new Predicate("knows", b, a)));
		assertEquals(TruthValue.UNDEFINED, model.eval(new Predicate("likes", a, b)));
	}

	@Test
	public void testConnectives() {
		final Expression happyA = new Predicate("happy", a);
		final Expression happyB = new Predicate("happy", b);
		final Expression unknown = new Predicate("tall", a);

		assertEquals(TruthValue.FALSE, model.eval(OperatorExpression.and(happyA, happyB)));
		assertEquals(TruthValue.TRUE, model.eval(OperatorExpression.or(happyA, happyB)));
		assertEquals(TruthValue.TRUE, model.eval(OperatorExpression.not(happyB)));
		assertEquals(TruthValue.TRUE, model.eval(OperatorExpression.implies(happyB, happyA)));
		assertEquals(TruthValue.FALSE, model.eval(OperatorExpression.implies(happyA, happyB)));

		// Undefined operands make the whole formula undefined.
		assertEquals(TruthValue.UNDEFINED, model.eval(OperatorExpression.and(happyB, unknown)));
		assertEquals(TruthValue.UNDEFINED, model.eval(OperatorExpression.implies(happyB, unknown)));
		assertEquals(TruthValue.UNDEFINED, model.eval(OperatorExpression.or(happyA, unknown)));
		assertEquals(TruthValue.UNDEFINED, model.eval(OperatorExpression.not(unknown)));
	}

	@Test
	public void testUndefinedInstancesDoNotFalsifyUniversal() {
		assertEquals(TruthValue.TRUE, model.eval(every("student", "tall")));
		assertEquals(TruthValue.TRUE, model.eval(new Binder(Tag.FORALL, x, new Predicate("tall", x))));
	}

	@Test
	public void testEmptyDomain() {
		final Model empty = new Model();
		assertEquals(TruthValue.TRUE, empty.eval(new Binder(Tag.FORALL, x, new Predicate("happy", x))));
		assertEquals(TruthValue.FALSE, empty.eval(new Binder(Tag.EXISTS, x, new Predicate("happy", x))));
	}

	@Test
	public void testEvaluationDoesNotChangeModel() {
		model.eval(every("student", "happy"));
		model.eval(new Predicate("happy", new Constant("zed")));
		assertEquals(3, model.getDomain().size());
	}

	@Test
	public void testFromFacts() {
		final Model fromFacts = Model.fromFacts(Arrays.asList("student(a)", " knows( a , b ) "));
		assertEquals(2, fromFacts.getDomain().size());
		assertEquals(TruthValue.TRUE, fromFacts.eval(new Predicate("student", a)));
		assertEquals(TruthValue.TRUE, fromFacts.eval(new Predicate("knows", a, b)));
		assertEquals(TruthValue.FALSE, fromFacts.eval(new Predicate("student", b)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMalformedFact() {
		Model.fromFacts(Arrays.asList("student a"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFactWithThreeArguments() {
		Model.fromFacts(Arrays.asList("give(a, b, c)"));
	}

	@Test(expected = EvaluationException.class)
	public void testUnappliedFunction() {
		model.eval(Binder.lambda(x, new Predicate("happy", x)));
	}

	@Test(expected = EvaluationException.class)
	public void testUnappliedFunctionInsideFormula() {
		model.eval(OperatorExpression.not(Binder.lambda(x, new Predicate("happy", x))));
	}

	@Test(expected = EvaluationException.class)
	public void testTerm() {
		model.eval(new Term(a));
	}

	@Test(expected = EvaluationException.class)
	public void testFreeVariable() {
		model.eval(new Predicate("happy", x));
	}

	@Test(expected = EvaluationException.class)
	public void testZeroPlacePredicate() {
		model.eval(new Predicate("raining"));
	}

	@Test(expected = EvaluationException.class)
	public void testThreePlacePredicate() {
		model.eval(new Predicate("give", a, b, c));
	}

	@Test(expected = EvaluationException.class)
	public void testPredicateVariableHead() {
		model.eval(new Predicate(Variable.named("P"), a));
	}
}
