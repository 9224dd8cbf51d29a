package org.metricshub.jbash.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jbash
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.frontend.ast.ArgNode;
import org.metricshub.jbash.frontend.ast.BackQuoteNode;
import org.metricshub.jbash.frontend.ast.BackgroundNode;
import org.metricshub.jbash.frontend.ast.BreakNode;
import org.metricshub.jbash.frontend.ast.CommandBlockNode;
import org.metricshub.jbash.frontend.ast.CommandExpressionNode;
import org.metricshub.jbash.frontend.ast.CommandNode;
import org.metricshub.jbash.frontend.ast.ContinueNode;
import org.metricshub.jbash.frontend.ast.DollarCommandNode;
import org.metricshub.jbash.frontend.ast.DoubleStringNode;
import org.metricshub.jbash.frontend.ast.Evaluable;
import org.metricshub.jbash.frontend.ast.Expandable;
import org.metricshub.jbash.frontend.ast.ForNode;
import org.metricshub.jbash.frontend.ast.FunctionNode;
import org.metricshub.jbash.frontend.ast.IfNode;
import org.metricshub.jbash.frontend.ast.IndirectArgNode;
import org.metricshub.jbash.frontend.ast.IndirectVariableNode;
import org.metricshub.jbash.frontend.ast.NullCommandNode;
import org.metricshub.jbash.frontend.ast.OperatorNode;
import org.metricshub.jbash.frontend.ast.SimpleStringNode;
import org.metricshub.jbash.frontend.ast.SpecialNode;
import org.metricshub.jbash.frontend.ast.SubshellBlockNode;
import org.metricshub.jbash.frontend.ast.TestNode;
import org.metricshub.jbash.frontend.ast.UnicodeNode;
import org.metricshub.jbash.frontend.ast.UntilNode;
import org.metricshub.jbash.frontend.ast.VariableNode;
import org.metricshub.jbash.frontend.ast.WhileNode;
import org.metricshub.jbash.frontend.ast.WordNode;
import org.metricshub.jbash.runtime.Variables;
import org.metricshub.jbash.util.JbashLogger;
import org.slf4j.Logger;

/**
 * Recursive descent parser building the syntax tree of a script.
 * <p>
 * The grammar, from the top:
 * <ul>
 * <li>a <em>block</em> is a list of command groups separated by
 * {@code ;} or newlines</li>
 * <li>a <em>command group</em> is a list of commands, subshells
 * {@code ( )}, brace blocks <code>{ }</code>, tests {@code [ ]} and
 * control structures, combined with {@code |}, {@code &&}, {@code ||}
 * and ended by {@code &}</li>
 * <li>a <em>command expression</em> is the words of one command: plain
 * words, escapes, quoted strings, {@code $} references and command
 * substitutions</li>
 * </ul>
 * The right operand of an operator is the rest of the group, and
 * {@link OperatorNode#make} restores operator precedence.
 * <p>
 * Nesting of subshells, brace blocks, {@code $( )} and keywords is
 * limited to {@link #MAX_DEPTH} levels; deeper scripts fail with
 * {@link JbashStatus#MAX_DEPTH_REACHED}.
 * <p>
 * A parser is good for one script.
 */
public class JbashParser {

	private static final Logger LOG = JbashLogger.getLogger(JbashParser.class);

	/** Maximum nesting of constructs in a script. */
	public static final int MAX_DEPTH = 16;

	private final byte[] source;
	private final TokenCursor tokens;
	private int depth;

	/**
	 * Tokenizes a script, ready to be parsed.
	 *
	 * @param source UTF-8 bytes of the script
	 * @throws ParserException if the script cannot be tokenized
	 */
	public JbashParser(byte[] source) {
		this.source = source;
		this.tokens = new TokenCursor(Tokenizer.tokenize(source), source.length);
	}

	/**
	 * Parses a script.
	 *
	 * @param script the script text
	 * @return the root of its syntax tree
	 * @throws ParserException on syntax errors
	 */
	public static Evaluable parse(String script) {
		return new JbashParser(script.getBytes(StandardCharsets.UTF_8)).parse();
	}

	/**
	 * Parses the whole script.
	 *
	 * @return the root of the syntax tree, a {@link NullCommandNode} for an
	 *         empty script
	 * @throws ParserException on syntax errors
	 */
	public Evaluable parse() {
		Evaluable root = parseBlock(null, ParseMode.NORMAL);
		if (root == null) {
			root = new NullCommandNode(0);
		}
		LOG.debug("Parsed {} bytes into {}", source.length, root);
		return root;
	}

	private ParserException error(int status, int position) {
		return new ParserException(status, source, position);
	}

	private ParserException unexpectedToken() {
		return error(JbashStatus.UNEXPECTED_TOKEN, tokens.position());
	}

	/** Enters one level of nesting. Each call must be paired with {@link #leave()}. */
	private void enter(int position) {
		if (depth >= MAX_DEPTH) {
			throw error(JbashStatus.MAX_DEPTH_REACHED, position);
		}
		depth++;
	}

	private void leave() {
		depth--;
	}

	private static ParseMode innerMode(ParseMode mode) {
		return mode == ParseMode.LOOP ? ParseMode.LOOP : ParseMode.NORMAL;
	}

	private static Evaluable orNull(Evaluable node, int position) {
		return node == null ? new NullCommandNode(position) : node;
	}

	/**
	 * Parses command groups until the {@code end} token, or the end of the
	 * script when {@code end} is {@code null}.
	 *
	 * @return {@code null} if there is no command, the command if there is
	 *         one, a {@link CommandBlockNode} otherwise
	 */
	private Evaluable parseBlock(TokenType end, ParseMode mode) {
		int startPosition = tokens.position();
		ParseMode groupMode = end == TokenType.QUOTE_BACK ? ParseMode.BACKQUOTE : mode;
		List<Evaluable> commands = new ArrayList<Evaluable>();
		Token token = tokens.get();
		while (token != null && token.getType() != end) {
			parseBlockItem(token, commands, groupMode);
			token = tokens.get();
		}
		if (token == null && end != null) {
			throw error(unclosedStatus(end), startPosition);
		}
		return toBlock(startPosition, commands);
	}

	/**
	 * Parses command groups until one of the {@code end} keywords, which is
	 * left as the current token.
	 *
	 * @param unfinishedStatus status raised at {@code constructPosition}
	 *        when the script ends first
	 */
	private Evaluable parseKeywordBlock(Set<Keyword> end, ParseMode mode, int constructPosition, int unfinishedStatus) {
		int startPosition = tokens.position();
		List<Evaluable> commands = new ArrayList<Evaluable>();
		Token token = tokens.get();
		while (token != null && !end.contains(tokens.keyword())) {
			parseBlockItem(token, commands, mode);
			token = tokens.get();
		}
		if (token == null) {
			throw error(unfinishedStatus, constructPosition);
		}
		return toBlock(startPosition, commands);
	}

	private void parseBlockItem(Token token, List<Evaluable> commands, ParseMode mode) {
		switch (token.getType()) {
		case WORD:
		case OPEN_PARENTHESIS:
		case OPEN_BRACKETS:
		case OPEN_SQR_BRACKETS:
		case ESCAPED:
		case UNICODE:
		case DOLLAR:
		case QUOTE_SIMPLE:
		case QUOTE_DOUBLE:
		case QUOTE_BACK:
			tokens.putBack();
			addIfPresent(commands, parseCommandGroup(mode));
			break;
		case SPACE:
		case CMD_SEPARATOR:
			break;
		default:
			throw unexpectedToken();
		}
	}

	private static void addIfPresent(List<Evaluable> commands, Evaluable command) {
		if (command != null) {
			commands.add(command);
		}
	}

	private static Evaluable toBlock(int position, List<Evaluable> commands) {
		if (commands.isEmpty()) {
			return null;
		}
		if (commands.size() == 1) {
			return commands.get(0);
		}
		return new CommandBlockNode(position, commands);
	}

	private static int unclosedStatus(TokenType end) {
		switch (end) {
		case CLOSE_PARENTHESIS:
			return JbashStatus.UNCLOSED_PARENTHESES;
		case CLOSE_BRACKETS:
			return JbashStatus.UNCLOSED_BRACKETS;
		case CLOSE_SQR_BRACKETS:
			return JbashStatus.UNCLOSED_SQR_BRACKETS;
		case QUOTE_BACK:
			return JbashStatus.UNCLOSED_BACK_QUOTES;
		default:
			return JbashStatus.SYNTAX_ERROR;
		}
	}

	/**
	 * Parses commands and operators up to a separator or a closing token.
	 *
	 * @return {@code null} if there is no command, the command if there is
	 *         one, a {@link CommandBlockNode} otherwise
	 */
	private Evaluable parseCommandGroup(ParseMode mode) {
		List<Evaluable> commands = new ArrayList<Evaluable>();
		Token token = nextNonSpace();
		int startPosition = tokens.position();
		boolean delimited = false;
		while (token != null && !delimited) {
			switch (token.getType()) {
			case WORD:
				Keyword keyword = tokens.keyword();
				if (keyword == null) {
					tokens.putBack();
					commands.add(parseCommand(mode));
				} else {
					commands.add(parseKeyword(keyword, mode));
				}
				break;
			case ESCAPED:
			case UNICODE:
			case DOLLAR:
			case QUOTE_SIMPLE:
			case QUOTE_DOUBLE:
				tokens.putBack();
				commands.add(parseCommand(mode));
				break;
			case QUOTE_BACK:
				tokens.putBack();
				if (mode == ParseMode.BACKQUOTE) {
					delimited = true;
				} else {
					commands.add(parseCommand(mode));
				}
				break;
			case OPEN_PARENTHESIS:
				commands.add(parseParentheses());
				break;
			case OPEN_BRACKETS:
				commands.add(parseBrackets(mode));
				break;
			case OPEN_SQR_BRACKETS:
				commands.add(parseSqrBrackets());
				break;
			case CMD_SEPARATOR:
			case CLOSE_PARENTHESIS:
			case CLOSE_BRACKETS:
			case CLOSE_SQR_BRACKETS:
				tokens.putBack();
				delimited = true;
				break;
			case BACKGROUND:
				if (commands.isEmpty()) {
					throw unexpectedToken();
				}
				int last = commands.size() - 1;
				commands.set(last, new BackgroundNode(token.getPosition(), commands.get(last)));
				delimited = true;
				break;
			case PIPE:
			case AND:
			case OR:
				parseOperator(commands, token, mode);
				break;
			default:
				throw unexpectedToken();
			}
			if (!delimited) {
				token = nextNonSpace();
			}
		}
		return toBlock(startPosition, commands);
	}

	private void parseOperator(List<Evaluable> commands, Token operator, ParseMode mode) {
		if (commands.isEmpty()) {
			throw error(JbashStatus.UNEXPECTED_TOKEN, operator.getPosition());
		}
		Evaluable right = parseCommandGroup(mode);
		if (right == null) {
			throw error(JbashStatus.UNEXPECTED_TOKEN, operator.getPosition());
		}
		int last = commands.size() - 1;
		commands.set(last, OperatorNode.make(operator.getType(), operator.getPosition(), commands.get(last), right));
	}

	private Evaluable parseCommand(ParseMode mode) {
		CommandExpressionNode expression = parseCommandExpression(mode);
		if (expression == null) {
			return new NullCommandNode(source.length);
		}
		return new CommandNode(expression);
	}

	/**
	 * Reads the words of one command.
	 *
	 * @return {@code null} if there is no word
	 */
	private CommandExpressionNode parseCommandExpression(ParseMode mode) {
		List<Expandable> parts = new ArrayList<Expandable>();
		Token token = tokens.get();
		boolean delimited = false;
		while (token != null && !delimited) {
			switch (token.getType()) {
			case WORD:
				parts.add(new WordNode(token.getPosition(), token.getText()));
				break;
			case ESCAPED:
			case UNICODE:
				parts.add(parseUnicode(token));
				break;
			case SPACE:
				addSplit(parts);
				break;
			case QUOTE_SIMPLE:
				parts.add(parseQuoteSimple());
				break;
			case QUOTE_DOUBLE:
				parts.add(parseQuoteDouble());
				break;
			case QUOTE_BACK:
				if (mode == ParseMode.BACKQUOTE) {
					tokens.putBack();
					delimited = true;
				} else {
					parts.add(parseQuoteBack());
				}
				break;
			case DOLLAR:
				parts.add(parseDollar());
				break;
			case CMD_SEPARATOR:
			case CLOSE_PARENTHESIS:
			case CLOSE_BRACKETS:
			case CLOSE_SQR_BRACKETS:
			case PIPE:
			case OR:
			case BACKGROUND:
			case AND:
				tokens.putBack();
				delimited = true;
				break;
			case OPEN_BRACKETS:
				if (mode != ParseMode.FUNCTION_NAME) {
					throw unexpectedToken();
				}
				tokens.putBack();
				delimited = true;
				break;
			default:
				throw unexpectedToken();
			}
			if (!delimited) {
				token = tokens.get();
			}
		}
		return parts.isEmpty() ? null : new CommandExpressionNode(parts);
	}

	/** Marks a word boundary, unless there is no word before it. */
	private static void addSplit(List<Expandable> parts) {
		if (!parts.isEmpty() && parts.get(parts.size() - 1) != null) {
			parts.add(null);
		}
	}

	private Expandable parseUnicode(Token token) {
		int codePoint = Tokenizer.decodeEscape(token.getText());
		if (codePoint < 0) {
			throw error(JbashStatus.BAD_ENCODING, token.getPosition());
		}
		return new UnicodeNode(token.getPosition(), codePoint);
	}

	private Expandable parseQuoteSimple() {
		int startPosition = tokens.position();
		List<Expandable> parts = new ArrayList<Expandable>();
		Token token = tokens.get();
		while (token != null && token.getType() != TokenType.QUOTE_SIMPLE) {
			switch (token.getType()) {
			case WORD:
				parts.add(new WordNode(token.getPosition(), token.getText()));
				break;
			case ESCAPED:
			case UNICODE:
				parts.add(parseUnicode(token));
				break;
			default:
				throw unexpectedToken();
			}
			token = tokens.get();
		}
		if (token == null) {
			throw error(JbashStatus.UNCLOSED_SIMPLE_QUOTES, startPosition);
		}
		return new SimpleStringNode(startPosition, parts);
	}

	private Expandable parseQuoteDouble() {
		int startPosition = tokens.position();
		List<Expandable> parts = new ArrayList<Expandable>();
		Token token = tokens.get();
		while (token != null && token.getType() != TokenType.QUOTE_DOUBLE) {
			switch (token.getType()) {
			case WORD:
				parts.add(new WordNode(token.getPosition(), token.getText()));
				break;
			case ESCAPED:
			case UNICODE:
				parts.add(parseUnicode(token));
				break;
			case DOLLAR:
				parts.add(parseDollar());
				break;
			case QUOTE_BACK:
				parts.add(parseQuoteBack());
				break;
			default:
				throw unexpectedToken();
			}
			token = tokens.get();
		}
		if (token == null) {
			throw error(JbashStatus.UNCLOSED_DOUBLE_QUOTES, startPosition);
		}
		return new DoubleStringNode(startPosition, parts);
	}

	private Expandable parseQuoteBack() {
		int position = tokens.position();
		Evaluable command = parseBlock(TokenType.QUOTE_BACK, ParseMode.NORMAL);
		return new BackQuoteNode(position, orNull(command, position));
	}

	private Expandable parseDollar() {
		int dollarPosition = tokens.position();
		Token token = tokens.get();
		if (token == null) {
			throw error(JbashStatus.UNEXPECTED_TOKEN, dollarPosition);
		}
		switch (token.getType()) {
		case WORD:
			String name = token.getText();
			if (Variables.isArg(name)) {
				return new ArgNode(token.getPosition(), Variables.argIndex(name), false);
			}
			if (Variables.isVar(name)) {
				return new VariableNode(token.getPosition(), name, false);
			}
			throw error(JbashStatus.INVALID_VARIABLE_NAME, token.getPosition());
		case DOLLAR_SPECIAL:
			return new SpecialNode(token.getPosition(), token.getText().charAt(0));
		case OPEN_BRACKETS:
			return parseDollarVariable();
		case OPEN_PARENTHESIS:
			return parseDollarCommand();
		default:
			throw unexpectedToken();
		}
	}

	/** Reads <code>${name}</code>, <code>${12}</code> or their <code>${!...}</code> indirect forms. */
	private Expandable parseDollarVariable() {
		int bracePosition = tokens.position();
		Token token = tokens.get();
		boolean indirect = false;
		if (token != null && token.getType() == TokenType.EXCLAMATION) {
			indirect = true;
			token = tokens.get();
		}
		if (token == null) {
			throw error(JbashStatus.UNCLOSED_VARIABLE, bracePosition);
		}
		if (token.getType() != TokenType.WORD) {
			throw error(JbashStatus.UNEXPECTED_TOKEN, bracePosition);
		}
		String name = token.getText();
		boolean arg = Variables.isArg(name);
		if (!arg && !Variables.isVar(name)) {
			throw error(JbashStatus.INVALID_VARIABLE_NAME, bracePosition);
		}
		if (tokens.get() == null || !tokens.is(TokenType.CLOSE_BRACKETS)) {
			throw error(JbashStatus.UNCLOSED_VARIABLE, bracePosition);
		}
		if (arg) {
			int index = Variables.argIndex(name);
			return indirect ? new IndirectArgNode(bracePosition, index) : new ArgNode(bracePosition, index, true);
		}
		return indirect ? new IndirectVariableNode(bracePosition, name) : new VariableNode(bracePosition, name, true);
	}

	private Expandable parseDollarCommand() {
		int position = tokens.position();
		enter(position);
		try {
			Evaluable command = parseBlock(TokenType.CLOSE_PARENTHESIS, ParseMode.NORMAL);
			return new DollarCommandNode(position, orNull(command, position));
		} finally {
			leave();
		}
	}

	private Evaluable parseParentheses() {
		int position = tokens.position();
		enter(position);
		try {
			Evaluable block = parseBlock(TokenType.CLOSE_PARENTHESIS, ParseMode.NORMAL);
			if (block == null) {
				return new NullCommandNode(position);
			}
			return new SubshellBlockNode(position, Collections.singletonList(block));
		} finally {
			leave();
		}
	}

	private Evaluable parseBrackets(ParseMode mode) {
		int position = tokens.position();
		enter(position);
		try {
			Evaluable block = parseBlock(TokenType.CLOSE_BRACKETS, innerMode(mode));
			if (block == null) {
				return new NullCommandNode(position);
			}
			return new CommandBlockNode(position, Collections.singletonList(block));
		} finally {
			leave();
		}
	}

	private Evaluable parseSqrBrackets() {
		int position = tokens.position();
		CommandExpressionNode expression = parseTestExpression();
		tokens.get();
		if (!tokens.is(TokenType.CLOSE_SQR_BRACKETS)) {
			throw error(JbashStatus.UNCLOSED_SQR_BRACKETS, position);
		}
		if (expression == null) {
			throw error(JbashStatus.UNEXPECTED_TOKEN, position);
		}
		return new TestNode(position, expression);
	}

	/**
	 * Reads the words between {@code [} and {@code ]}, where operators and
	 * parentheses are plain words.
	 */
	private CommandExpressionNode parseTestExpression() {
		List<Expandable> parts = new ArrayList<Expandable>();
		Token token = tokens.get();
		while (token != null && token.getType() != TokenType.CLOSE_SQR_BRACKETS) {
			switch (token.getType()) {
			case WORD:
			case OR:
			case AND:
			case OPEN_PARENTHESIS:
			case CLOSE_PARENTHESIS:
				parts.add(new WordNode(token.getPosition(), token.getText()));
				break;
			case ESCAPED:
			case UNICODE:
				parts.add(parseUnicode(token));
				break;
			case SPACE:
				addSplit(parts);
				break;
			case QUOTE_SIMPLE:
				parts.add(parseQuoteSimple());
				break;
			case QUOTE_DOUBLE:
				parts.add(parseQuoteDouble());
				break;
			case QUOTE_BACK:
				parts.add(parseQuoteBack());
				break;
			case DOLLAR:
				parts.add(parseDollar());
				break;
			default:
				throw unexpectedToken();
			}
			token = tokens.get();
		}
		if (token != null) {
			tokens.putBack();
		}
		return parts.isEmpty() ? null : new CommandExpressionNode(parts);
	}

	private Evaluable parseKeyword(Keyword keyword, ParseMode mode) {
		int position = tokens.position();
		enter(position);
		try {
			switch (keyword) {
			case IF:
				return parseIf(mode);
			case FOR:
				return parseFor();
			case WHILE:
				return parseConditionalLoop(false);
			case UNTIL:
				return parseConditionalLoop(true);
			case FUNCTION:
				return parseFunction();
			case BREAK:
			case CONTINUE:
				return parseLoopControl(keyword, mode);
			default:
				throw error(JbashStatus.UNEXPECTED_TOKEN, position);
			}
		} finally {
			leave();
		}
	}

	/**
	 * {@code break} and {@code continue} are only read in a loop body, and
	 * must end the command.
	 */
	private Evaluable parseLoopControl(Keyword keyword, ParseMode mode) {
		int position = tokens.position();
		if (mode == ParseMode.LOOP) {
			while (tokens.isNext(TokenType.SPACE)) {
				tokens.get();
			}
			Token next = tokens.next();
			if (next == null
					|| next.getType() == TokenType.CMD_SEPARATOR
					|| next.getType() == TokenType.OR
					|| next.getType() == TokenType.AND) {
				return keyword == Keyword.BREAK ? new BreakNode(position) : new ContinueNode(position);
			}
		}
		throw error(JbashStatus.UNEXPECTED_TOKEN, position);
	}

	/** Advances to the next token that is not a blank. */
	private Token nextNonSpace() {
		tokens.get();
		tokens.skipSpaces();
		return tokens.current();
	}

	private Evaluable parseIf(ParseMode mode) {
		int position = tokens.position();
		Evaluable condition = parseCommandGroup(ParseMode.NORMAL);
		if (condition == null) {
			tokens.get();
			throw unexpectedToken();
		}
		nextNonSpace();
		if (!tokens.is(TokenType.CMD_SEPARATOR)) {
			throw unexpectedToken();
		}
		nextNonSpace();
		if (!tokens.isKeyword(Keyword.THEN)) {
			throw error(JbashStatus.MISSING_KEYWORD_THEN, position);
		}
		ParseMode bodyMode = innerMode(mode);
		Evaluable thenBranch = orNull(
				parseKeywordBlock(Keyword.IF_DELIMITER, bodyMode, position, JbashStatus.UNFINISHED_KEYWORD_IF),
				tokens.position());

		Keyword delimiter = tokens.keyword();
		if (delimiter == Keyword.FI) {
			return new IfNode(position, condition, thenBranch, null);
		}
		int elsePosition = tokens.position();
		enter(elsePosition);
		try {
			Evaluable elseBranch;
			if (delimiter == Keyword.ELIF) {
				elseBranch = parseIf(mode);
			} else {
				elseBranch = orNull(
						parseKeywordBlock(Keyword.ELSE_DELIMITER, bodyMode, position, JbashStatus.UNFINISHED_KEYWORD_IF),
						elsePosition);
			}
			return new IfNode(position, condition, thenBranch, elseBranch);
		} finally {
			leave();
		}
	}

	private Evaluable parseFor() {
		int position = tokens.position();
		Token variable = nextNonSpace();
		if (variable == null || variable.getType() != TokenType.WORD || !Variables.isVar(variable.getText())) {
			throw error(JbashStatus.INVALID_VARIABLE_NAME, position);
		}
		nextNonSpace();
		if (!tokens.isKeyword(Keyword.IN)) {
			throw error(JbashStatus.MISSING_KEYWORD_IN, position);
		}
		CommandExpressionNode sequence = parseCommandExpression(ParseMode.NORMAL);
		tokens.get();
		if (sequence == null || !tokens.is(TokenType.CMD_SEPARATOR)) {
			throw unexpectedToken();
		}
		nextNonSpace();
		if (!tokens.isKeyword(Keyword.DO)) {
			throw error(JbashStatus.MISSING_KEYWORD_DO, position);
		}
		Evaluable body = parseLoopBody(position, JbashStatus.UNFINISHED_KEYWORD_FOR);
		return new ForNode(position, variable.getText(), sequence, body);
	}

	private Evaluable parseConditionalLoop(boolean until) {
		int position = tokens.position();
		Evaluable condition = parseCommandGroup(ParseMode.NORMAL);
		if (condition == null) {
			tokens.get();
			throw unexpectedToken();
		}
		nextNonSpace();
		if (!tokens.is(TokenType.CMD_SEPARATOR)) {
			throw unexpectedToken();
		}
		nextNonSpace();
		if (!tokens.isKeyword(Keyword.DO)) {
			throw error(JbashStatus.MISSING_KEYWORD_DO, position);
		}
		if (until) {
			return new UntilNode(position, condition, parseLoopBody(position, JbashStatus.UNFINISHED_KEYWORD_UNTIL));
		}
		return new WhileNode(position, condition, parseLoopBody(position, JbashStatus.UNFINISHED_KEYWORD_WHILE));
	}

	private Evaluable parseLoopBody(int loopPosition, int unfinishedStatus) {
		int bodyPosition = tokens.position();
		enter(bodyPosition);
		try {
			Evaluable body = parseKeywordBlock(Keyword.LOOP_DELIMITER, ParseMode.LOOP, loopPosition, unfinishedStatus);
			return orNull(body, bodyPosition);
		} finally {
			leave();
		}
	}

	private Evaluable parseFunction() {
		int position = tokens.position();
		nextNonSpace();
		tokens.putBack();
		CommandExpressionNode name = parseCommandExpression(ParseMode.FUNCTION_NAME);
		if (name == null) {
			throw error(JbashStatus.INVALID_FUNCTION_NAME, position);
		}
		nextNonSpace();
		if (!tokens.is(TokenType.OPEN_BRACKETS)) {
			throw error(JbashStatus.INVALID_FUNCTION_BODY, position);
		}
		int bodyPosition = tokens.position();
		Evaluable body = parseBlock(TokenType.CLOSE_BRACKETS, ParseMode.NORMAL);
		return new FunctionNode(position, name, orNull(body, bodyPosition));
	}
}
