package edu.uw.mgsem.syntax;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import edu.uw.mgsem.model.Model;
import edu.uw.mgsem.model.TruthValue;
import edu.uw.mgsem.semantics.ApplicationTypeException;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.lexicon.CompositeLexicon;
import edu.uw.mgsem.semantics.lexicon.Lexicon;

public class DerivationTest {

	private final Lexicon lexicon = CompositeLexicon.makeDefault();
	private Model model;

	@Before
	public void setUp() {
		model = Model.fromFacts(Arrays.asList("student(a)", "student(b)", "happy(a)", "happy(b)", "know(a, mary)",
				"sleep(b)"));
		model.addEntity("c");
	}

	private Expression semantics(final String derivation) {
		return Derivation.fromString(derivation).getSemantics(lexicon).get();
	}

	@Test
	public void testEveryStudentIsHappy() {
		final Expression sentence = semantics("[[every::=n,d student::n] [be::=j,=d,v happy::j]]");
		assertEquals("∀x[student(x) -> happy(x)]", sentence.toString());
		assertEquals(TruthValue.TRUE, model.eval(sentence));
	}

	@Test
	public void testAStudentKnowsMary() {
		final Expression sentence = semantics("[[a::=n,d,-case student::n] [know::=d,=d,v mary::d]]");
		assertEquals("∃x[student(x) & know(x, mary)]", sentence.toString());
		assertEquals(TruthValue.TRUE, model.eval(sentence));
	}

	@Test
	public void testProperName() {
		assertEquals("sleep(b)", semantics("[b::d sleep::=d,v]").toString());
		assertEquals(TruthValue.TRUE, model.eval(semantics("[b::d sleep::=d,v]")));
		assertEquals(TruthValue.FALSE, model.eval(semantics("[a::d sleep::=d,v]")));
	}

	@Test
	public void testVacuousItemsPassTheirSiblingThrough() {
		final Expression sentence = semantics("[[every::=n,d student::n] [do::=v,t [be::=j,=d,v happy::j]]]");
		assertEquals("∀x[student(x) -> happy(x)]", sentence.toString());
	}

	@Test
	public void testAttributiveAdjective() {
		final Expression sentence = semantics("[[a::=j,d [happy::=n,j student::n]] sleep::=d,v]");
		assertEquals("∃x[student(x) & happy(x) & sleep(x)]", sentence.toString());
		assertEquals(TruthValue.TRUE, model.eval(sentence));
	}

	@Test
	public void testEveryStudentSleeps() {
		// a is a counterexample
		assertEquals(TruthValue.FALSE, model.eval(semantics("[[every::=n,d student::n] sleep::=d,v]")));
	}

	@Test
	public void testNoSemantics() {
		assertFalse(Derivation.fromString("do::=v,t").getSemantics(lexicon).isPresent());
	}

	@Test
	public void testToString() {
		final String input = "[[every::=n,d student::n] [be::=j,=d,v happy::j]]";
		assertEquals(input, Derivation.fromString(input).toString());
		assertEquals(input, Derivation.fromString("  [ [every::=n,d   student::n]  [be::=j,=d,v happy::j] ] ")
				.toString());
		assertEquals("every student be happy", Derivation.fromString(input).getWords());
	}

	@Test(expected = ApplicationTypeException.class)
	public void testTwoNames() {
		semantics("[john::d mary::d]");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSingleConstituent() {
		Derivation.fromString("[john::d]");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testThreeConstituents() {
		Derivation.fromString("[john::d know::=d,=d,v mary::d]");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnbalancedBrackets() {
		Derivation.fromString("[john::d sleep::=d,v");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingFeatures() {
		Derivation.fromString("[john sleep::=d,v]");
	}
}
