package org.metricshub.jbash.frontend.ast;

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

import java.util.Arrays;
import java.util.List;
import org.metricshub.jbash.frontend.TokenType;

/**
 * A binary operator between two commands: {@code |}, {@code &&} or
 * {@code ||}.
 * <p>
 * The parser reads the right operand of an operator as the whole rest of
 * the command group, so operands arrive in right-recursive order.
 * {@link #make(TokenType, int, Evaluable, Evaluable)} restores the
 * precedence of the operators (pipe, then and, then or) by rotating
 * operator operands as it combines them, which yields the tree a
 * precedence-climbing parser would build.
 */
public abstract class OperatorNode extends Node implements Evaluable {

	public static final int PIPE_PRIORITY = 5;
	public static final int AND_PRIORITY = 4;
	public static final int OR_PRIORITY = 3;

	private final int priority;
	private Evaluable left;
	private Evaluable right;

	protected OperatorNode(int position, int priority) {
		super(position);
		this.priority = priority;
	}

	public int getPriority() {
		return priority;
	}

	public Evaluable getLeft() {
		return left;
	}

	public Evaluable getRight() {
		return right;
	}

	@Override
	protected List<?> children() {
		return Arrays.asList(left, right);
	}

	/**
	 * Combines {@code left OP right}.
	 * <p>
	 * An operator on the left that binds less tightly than {@code OP}
	 * stays the root, {@code OP} being combined with its right operand. An
	 * operator on the right that binds less tightly than {@code OP}, or as
	 * tightly, becomes the root, {@code OP} being combined with its left
	 * operand. Operators of equal priority are thus left-associative, and
	 * {@code a && b || c} gives {@code (a && b) || c} while
	 * {@code a || b && c} gives {@code a || (b && c)}.
	 *
	 * @param type {@link TokenType#PIPE}, {@link TokenType#AND} or {@link TokenType#OR}
	 * @param position byte offset of the operator
	 * @param left left operand
	 * @param right right operand
	 * @return the root of the combined tree
	 */
	public static Evaluable make(TokenType type, int position, Evaluable left, Evaluable right) {
		requireChild(left, "Left operand");
		requireChild(right, "Right operand");
		int priority = priorityOf(type);

		if (left instanceof OperatorNode && ((OperatorNode) left).priority < priority) {
			OperatorNode leftOperator = (OperatorNode) left;
			leftOperator.right = make(type, position, leftOperator.right, right);
			return leftOperator;
		}
		if (right instanceof OperatorNode && ((OperatorNode) right).priority <= priority) {
			OperatorNode rightOperator = (OperatorNode) right;
			rightOperator.left = make(type, position, left, rightOperator.left);
			return rightOperator;
		}
		OperatorNode central = create(type, position);
		central.left = left;
		central.right = right;
		return central;
	}

	private static int priorityOf(TokenType type) {
		switch (type) {
		case PIPE:
			return PIPE_PRIORITY;
		case AND:
			return AND_PRIORITY;
		case OR:
			return OR_PRIORITY;
		default:
			throw new IllegalArgumentException("Not an operator: " + type);
		}
	}

	private static OperatorNode create(TokenType type, int position) {
		switch (type) {
		case PIPE:
			return new PipeNode(position);
		case AND:
			return new AndNode(position);
		case OR:
			return new OrNode(position);
		default:
			throw new IllegalArgumentException("Not an operator: " + type);
		}
	}
}
