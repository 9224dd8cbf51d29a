package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jbash.frontend.JbashParser;
import org.metricshub.jbash.frontend.ParserException;
import org.metricshub.jbash.frontend.TokenType;
import org.metricshub.jbash.frontend.ast.AndNode;
import org.metricshub.jbash.frontend.ast.CommandBlockNode;
import org.metricshub.jbash.frontend.ast.CommandNode;
import org.metricshub.jbash.frontend.ast.Evaluable;
import org.metricshub.jbash.frontend.ast.Node;
import org.metricshub.jbash.frontend.ast.NullCommandNode;
import org.metricshub.jbash.frontend.ast.OperatorNode;
import org.metricshub.jbash.frontend.ast.OrNode;
import org.metricshub.jbash.frontend.ast.PipeNode;

public class ParserTest {

	private final Evaluable a = new NullCommandNode(0);
	private final Evaluable b = new NullCommandNode(1);
	private final Evaluable c = new NullCommandNode(2);
	private final Evaluable d = new NullCommandNode(3);

	private static int failure(String script) {
		ParserException e = assertThrows(ParserException.class, () -> JbashParser.parse(script));
		return e.getStatus();
	}

	private static String dump(Evaluable root) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		((Node) root).dump(new PrintStream(out, true, StandardCharsets.UTF_8));
		return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	@Test
	public void testEmptyScript() {
		assertTrue(JbashParser.parse("") instanceof NullCommandNode);
		assertTrue(JbashParser.parse(" ;\n ; ") instanceof NullCommandNode);
	}

	@Test
	public void testLeafOperands() {
		Evaluable root = OperatorNode.make(TokenType.AND, 0, a, b);
		assertTrue(root instanceof AndNode);
		assertSame(a, ((OperatorNode) root).getLeft());
		assertSame(b, ((OperatorNode) root).getRight());
	}

	@Test
	public void testLooserLeftOperatorBecomesRoot() {
		Evaluable or = OperatorNode.make(TokenType.OR, 0, a, b);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.AND, 0, or, c);
		assertTrue(root instanceof OrNode);
		assertSame(a, root.getLeft());
		OperatorNode and = (OperatorNode) root.getRight();
		assertTrue(and instanceof AndNode);
		assertSame(b, and.getLeft());
		assertSame(c, and.getRight());
	}

	@Test
	public void testTighterLeftOperatorStaysLeft() {
		Evaluable pipe = OperatorNode.make(TokenType.PIPE, 0, a, b);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.AND, 0, pipe, c);
		assertTrue(root instanceof AndNode);
		assertSame(pipe, root.getLeft());
		assertSame(c, root.getRight());
	}

	@Test
	public void testTighterRightOperatorStaysRight() {
		Evaluable and = OperatorNode.make(TokenType.AND, 0, b, c);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.OR, 0, a, and);
		// a || (b && c)
		assertTrue(root instanceof OrNode);
		assertSame(a, root.getLeft());
		assertSame(and, root.getRight());
	}

	@Test
	public void testLooserRightOperatorBecomesRoot() {
		Evaluable or = OperatorNode.make(TokenType.OR, 0, b, c);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.AND, 0, a, or);
		// (a && b) || c
		assertSame(or, root);
		OperatorNode and = (OperatorNode) root.getLeft();
		assertTrue(and instanceof AndNode);
		assertSame(a, and.getLeft());
		assertSame(b, and.getRight());
		assertSame(c, root.getRight());
	}

	@Test
	public void testEqualPriorityChainIsLeftAssociative() {
		Evaluable right = OperatorNode.make(TokenType.PIPE, 0, b, c);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.PIPE, 0, a, right);
		assertSame(right, root);
		OperatorNode left = (OperatorNode) root.getLeft();
		assertSame(a, left.getLeft());
		assertSame(b, left.getRight());
		assertSame(c, root.getRight());
	}

	@Test
	public void testRotationReachesTheLeftmostOperand() {
		Evaluable and = OperatorNode.make(TokenType.AND, 0, b, c);
		Evaluable or = OperatorNode.make(TokenType.OR, 0, and, d);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.PIPE, 0, a, or);
		// ((a | b) && c) || d
		assertSame(or, root);
		assertSame(d, root.getRight());
		OperatorNode left = (OperatorNode) root.getLeft();
		assertSame(and, left);
		assertSame(c, left.getRight());
		OperatorNode pipe = (OperatorNode) left.getLeft();
		assertTrue(pipe instanceof PipeNode);
		assertSame(a, pipe.getLeft());
		assertSame(b, pipe.getRight());
	}

	@Test
	public void testLooserLeftOperatorKeepsTighterRight() {
		Evaluable or = OperatorNode.make(TokenType.OR, 0, a, b);
		Evaluable pipe = OperatorNode.make(TokenType.PIPE, 0, c, d);
		OperatorNode root = (OperatorNode) OperatorNode.make(TokenType.AND, 0, or, pipe);
		// a || (b && (c | d))
		assertSame(or, root);
		assertSame(a, root.getLeft());
		OperatorNode and = (OperatorNode) root.getRight();
		assertTrue(and instanceof AndNode);
		assertSame(b, and.getLeft());
		assertSame(pipe, and.getRight());
	}

	@Test
	public void testParsedOperatorPrecedence() {
		OperatorNode root = (OperatorNode) JbashParser.parse("echo a && echo b || echo c");
		assertTrue(root instanceof OrNode);
		assertTrue(root.getLeft() instanceof AndNode);
		assertTrue(root.getRight() instanceof CommandNode);

		root = (OperatorNode) JbashParser.parse("echo a || echo b && echo c");
		assertTrue(root instanceof OrNode);
		assertTrue(root.getLeft() instanceof CommandNode);
		assertTrue(root.getRight() instanceof AndNode);

		root = (OperatorNode) JbashParser.parse("echo a | cat && echo b || echo c | cat");
		// ((a | cat) && b) || (c | cat)
		assertTrue(root instanceof OrNode);
		assertTrue(root.getRight() instanceof PipeNode);
		OperatorNode and = (OperatorNode) root.getLeft();
		assertTrue(and instanceof AndNode);
		assertTrue(and.getLeft() instanceof PipeNode);
	}

	@Test
	public void testNodesRejectMissingChildren() {
		assertThrows(IllegalArgumentException.class, () -> OperatorNode.make(TokenType.AND, 0, null, a));
		assertThrows(IllegalArgumentException.class, () -> OperatorNode.make(TokenType.SPACE, 0, a, b));
		assertThrows(IllegalArgumentException.class, () -> new CommandBlockNode(0, Collections.<Evaluable>emptyList()));
	}

	@Test
	public void testDump() {
		assertEquals(
				"CommandNode\n"
						+ " CommandExpressionNode\n"
						+ "  Word \"echo\"\n"
						+ "  Variable $x\n",
				dump(JbashParser.parse("echo $x")));
	}

	@Test
	public void testDepthGuard() {
		StringBuilder ok = new StringBuilder();
		for (int i = 0; i < JbashParser.MAX_DEPTH; i++) {
			ok.append('(');
		}
		ok.append("echo -n a");
		for (int i = 0; i < JbashParser.MAX_DEPTH; i++) {
			ok.append(')');
		}
		JbashParser.parse(ok.toString());
		assertEquals(JbashStatus.MAX_DEPTH_REACHED, failure("(" + ok + ")"));
	}

	@Test
	public void testDepthGuardCountsKeywords() {
		StringBuilder script = new StringBuilder();
		for (int i = 0; i <= JbashParser.MAX_DEPTH; i++) {
			script.append("if [ a == a ]; then ");
		}
		for (int i = 0; i <= JbashParser.MAX_DEPTH; i++) {
			script.append("fi; ");
		}
		assertEquals(JbashStatus.MAX_DEPTH_REACHED, failure(script.toString()));
	}

	private static String nested(String open, String body, String close, int count) {
		StringBuilder script = new StringBuilder();
		for (int i = 0; i < count; i++) {
			script.append(open);
		}
		script.append(body);
		for (int i = 0; i < count; i++) {
			script.append(close);
		}
		return script.toString();
	}

	@Test
	public void testDepthGuardCountsCommandSubstitutions() {
		JbashParser.parse("echo " + nested("$(echo ", "a", ")", JbashParser.MAX_DEPTH));
		assertEquals(
				JbashStatus.MAX_DEPTH_REACHED,
				failure("echo " + nested("$(echo ", "a", ")", JbashParser.MAX_DEPTH + 1)));
	}

	@Test
	public void testDepthGuardCountsLoops() {
		// a loop takes two levels, its keyword and its body
		int loops = JbashParser.MAX_DEPTH / 2;
		JbashParser.parse(nested("for i in 1; do ", "echo a; ", "done; ", loops));
		assertEquals(
				JbashStatus.MAX_DEPTH_REACHED,
				failure(nested("for i in 1; do ", "echo a; ", "done; ", loops + 1)));
		JbashParser.parse(nested("while [ a == b ]; do ", "echo a; ", "done; ", loops));
		assertEquals(
				JbashStatus.MAX_DEPTH_REACHED,
				failure(nested("while [ a == b ]; do ", "echo a; ", "done; ", loops + 1)));
		assertEquals(
				JbashStatus.MAX_DEPTH_REACHED,
				failure(nested("until [ a == a ]; do ", "echo a; ", "done; ", loops + 1)));
	}

	@Test
	public void testDiagnostics() {
		ParserException e = assertThrows(ParserException.class, () -> JbashParser.parse("é\necho \"a"));
		assertEquals(JbashStatus.UNCLOSED_DOUBLE_QUOTES, e.getStatus());
		assertEquals(8, e.getPosition());
		assertEquals(7, e.getCodePoint());
		assertEquals("Unclosed double quotes\necho \"a\n     ^~~~\nCode point: 7\nByte: 8\n", e.getMessage());
	}

	@Test
	public void testDiagnosticsAtEndOfScript() {
		ParserException e = assertThrows(ParserException.class, () -> JbashParser.parse("echo a |"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, e.getStatus());
		assertEquals(7, e.getPosition());
	}

	@Test
	public void testKeywordErrors() {
		assertEquals(JbashStatus.UNFINISHED_KEYWORD_IF, failure("if [ a == a ]; then echo a"));
		assertEquals(JbashStatus.UNFINISHED_KEYWORD_IF, failure("if [ a == a ]; then echo a; else echo b"));
		assertEquals(JbashStatus.MISSING_KEYWORD_THEN, failure("if [ a == a ]; echo a; fi"));
		assertEquals(JbashStatus.UNFINISHED_KEYWORD_FOR, failure("for i in a b; do echo $i"));
		assertEquals(JbashStatus.MISSING_KEYWORD_IN, failure("for i of a b; do echo $i; done"));
		assertEquals(JbashStatus.INVALID_VARIABLE_NAME, failure("for 1 in a; do echo; done"));
		assertEquals(JbashStatus.MISSING_KEYWORD_DO, failure("for i in a; echo $i; done"));
		assertEquals(JbashStatus.UNFINISHED_KEYWORD_WHILE, failure("while [ a == a ]; do echo"));
		assertEquals(JbashStatus.UNFINISHED_KEYWORD_UNTIL, failure("until [ a == a ]; do echo"));
		assertEquals(JbashStatus.MISSING_KEYWORD_DO, failure("while [ a == a ]; echo; done"));
		assertEquals(JbashStatus.INVALID_FUNCTION_BODY, failure("function f echo"));
	}

	@Test
	public void testLoopControlOutsideOfLoop() {
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("break"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("continue"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("for i in a; do (break); done"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("for i in a; do break now; done"));
		JbashParser.parse("for i in a; do if [ a == a ]; then { break; }; fi; done");
	}

	@Test
	public void testOperatorErrors() {
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("&& echo"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("echo a ||"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("& echo"));
		assertEquals(JbashStatus.UNEXPECTED_TOKEN, failure("[ ]"));
	}

	@Test
	public void testInvalidNames() {
		assertEquals(JbashStatus.INVALID_VARIABLE_NAME, failure("echo ${!-x}"));
	}
}
