package edu.uw.mgsem.semantics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.uw.mgsem.semantics.Binder.Tag;
import edu.uw.mgsem.semantics.OperatorExpression.Operator;

public class ExpressionTest {

	private final Variable x = Variable.named("x");
	private final Variable y = Variable.named("y");
	private final Constant a = new Constant("a");

	@Test
	public void testPredicateRendering() {
		assertEquals("raining", new Predicate("raining").toString());
		assertEquals("happy(a)", new Predicate("happy", a).toString());
		assertEquals("know(mary, y)", new Predicate("know", new Constant("mary"), y).toString());
	}

	@Test
	public void testOperatorRendering() {
		final Predicate happy = new Predicate("happy", a);
		assertEquals("¬happy(a)", OperatorExpression.not(happy).toString());
		assertEquals("student(x) -> happy(x)",
				OperatorExpression.implies(new Predicate("student", x), new Predicate("happy", x)).toString());
		assertEquals("p | q & r", OperatorExpression.and(
				OperatorExpression.or(new Predicate("p"), new Predicate("q")), new Predicate("r")).toString());
		assertEquals("¬p & q", OperatorExpression.not(OperatorExpression.and(new Predicate("p"), new Predicate("q")))
				.toString());
	}

	@Test
	public void testBinderRendering() {
		assertEquals("\\x.happy(x)", Binder.lambda(x, new Predicate("happy", x)).toString());
		assertEquals("∀x[student(x) -> happy(x)]", new Binder(Tag.FORALL, x, OperatorExpression.implies(
				new Predicate("student", x), new Predicate("happy", x))).toString());
		assertEquals("∃y.know(a, y)", new Binder(Tag.EXISTS, y, new Predicate("know", a, y)).toString());
	}

	@Test
	public void testEmbeddedFormulaRendering() {
		final Expression embedded = new Predicate("believe", new Constant("john"), new EmbeddedFormula(
				new Predicate("happy", new Constant("mary"))));
		assertEquals("believe(john, happy(mary))", embedded.toString());
	}

	@Test
	public void testRenderingIsDeterministic() {
		final Expression expression = Binder.lambda(Variable.named("P"), new Binder(Tag.EXISTS, x,
				OperatorExpression.and(new Predicate(Variable.named("P"), x), new Predicate("happy", x))));
		assertEquals(expression.toString(), expression.toString());
	}

	@Test(expected = ArityException.class)
	public void testOperatorWithThreeArguments() {
		new OperatorExpression(Operator.AND, new Predicate("p"), new Predicate("q"), new Predicate("r"));
	}

	@Test(expected = ArityException.class)
	public void testNegationWithTwoArguments() {
		new OperatorExpression(Operator.NOT, new Predicate("p"), new Predicate("q"));
	}

	@Test(expected = ArityException.class)
	public void testOperatorWithNoArguments() {
		new OperatorExpression(Operator.OR);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testPredicateVariableAsArgument() {
		new Predicate("happy", Variable.named("P"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIndividualVariableAsHead() {
		new Predicate(x, a);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testQuantifierOverPredicateVariable() {
		new Binder(Tag.FORALL, Variable.named("P"), new Predicate(Variable.named("P"), a));
	}

	@Test
	public void testVariableTypes() {
		assertTrue(Variable.named("x").isIndividual());
		assertTrue(Variable.named("Q").isPredicate());
		assertNotEquals(new Variable("p", Variable.VariableType.INDIVIDUAL), new Variable("p",
				Variable.VariableType.PREDICATE));
	}

	@Test
	public void testFreeVariables() {
		final Expression expression = Binder.lambda(x, new Predicate("know", x, y));
		assertEquals(1, expression.getFreeVariables().size());
		assertTrue(expression.getFreeVariables().contains(y));
		assertTrue(expression.getAllVariables().contains(x));
	}

	@Test
	public void testStructuralEquality() {
		assertEquals(Binder.lambda(x, new Predicate("happy", x)), Binder.lambda(Variable.named("x"), new Predicate(
				"happy", Variable.named("x"))));
		assertNotEquals(Binder.lambda(x, new Predicate("happy", x)), Binder.lambda(y, new Predicate("happy", y)));
	}
}
