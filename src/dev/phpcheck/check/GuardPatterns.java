/*
 * Copyright 2026 The phpcheck Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.phpcheck.check;

import com.google.common.collect.ImmutableSet;
import dev.phpcheck.syntax.Node;
import dev.phpcheck.syntax.Token;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Recognizes the condition idioms PHP code uses to guard variables, and bodies that never fall
 * through. Every method is a pure function of its arguments.
 */
final class GuardPatterns {

  private GuardPatterns() {}

  /** Variables named by {@code !isset(...)} operands of an OR-chain, e.g. {@code !isset($a)}. */
  static ImmutableSet<String> negatedIssetVariables(Node cond) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    collectOrChain(cond, names, GuardPatterns::addNegatedIsset);
    return names.build();
  }

  /** Variables tested by {@code is_null($v)} operands of an OR-chain. */
  static ImmutableSet<String> isNullVariables(Node cond) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    collectOrChain(cond, names, GuardPatterns::addIsNull);
    return names.build();
  }

  /** Variables tested by {@code !$v} operands of an OR-chain. */
  static ImmutableSet<String> falsyVariables(Node cond) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    collectOrChain(cond, names, GuardPatterns::addFalsy);
    return names.build();
  }

  /**
   * Variables that are set whenever {@code cond} is true: the base variables of {@code isset(...)}
   * and {@code !empty(...)} operands of an AND-chain.
   */
  static ImmutableSet<String> issetVariables(Node cond) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    collectIsset(cond, names);
    return names.build();
  }

  /**
   * Variables that are set after {@code if (cond) { exit; }}: the operands of an OR-chain that
   * test for a missing, null or falsy variable.
   */
  static ImmutableSet<String> earlyExitGuardVariables(Node cond) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    collectOrChain(
        cond,
        names,
        (operand, out) -> {
          addNegatedIsset(operand, out);
          addIsNull(operand, out);
          addFalsy(operand, out);
        });
    return names.build();
  }

  /** Variables that are set whenever {@code cond} is false. */
  static ImmutableSet<String> negativeBranchVariables(Node cond) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    collectOrChain(
        cond,
        names,
        (operand, out) -> {
          addNegatedIsset(operand, out);
          addFalsy(operand, out);
        });
    return names.build();
  }

  /**
   * Returns X when {@code cond} is {@code !X}, or an OR-chain whose leftmost operand is {@code
   * !X}. Returns null otherwise.
   */
  static @Nullable Node invertedOperand(Node cond) {
    Node leftmost = cond;
    while (leftmost.isOr()) {
      leftmost = leftmost.getFirstChild();
    }
    return leftmost.isNot() ? leftmost.getFirstChild() : null;
  }

  /**
   * Whether control never leaves {@code body} normally. {@code break} and {@code continue} leave
   * the enclosing loop or switch and do not count.
   */
  static boolean isEarlyExit(Node body, String exitMethodSuffix) {
    switch (body.getToken()) {
      case BLOCK:
        for (Node stmt : body.children()) {
          if (isExitStatement(stmt, exitMethodSuffix)) {
            return true;
          }
        }
        return false;
      default:
        return isExitStatement(body, exitMethodSuffix);
    }
  }

  private static boolean isExitStatement(Node stmt, String exitMethodSuffix) {
    switch (stmt.getToken()) {
      case RETURN:
      case THROW:
        return true;
      case BLOCK:
        return isEarlyExit(stmt, exitMethodSuffix);
      case EXPR_RESULT:
        return isExitExpression(stmt.getFirstChild(), exitMethodSuffix);
      case IF:
        return ifAlwaysExits(stmt, exitMethodSuffix);
      default:
        return false;
    }
  }

  private static boolean isExitExpression(Node expr, String exitMethodSuffix) {
    switch (expr.getToken()) {
      case EXIT:
        return true;
      case METHOD_CALL:
      case NULLSAFE_METHOD_CALL:
      case STATIC_CALL:
        Node method = expr.getSecondChild();
        return method.isName() && method.getString().endsWith(exitMethodSuffix);
      default:
        return false;
    }
  }

  /** IF(cond, then, clauses...) exits only when it has an else and every branch exits. */
  private static boolean ifAlwaysExits(Node ifNode, String exitMethodSuffix) {
    if (!ifNode.getLastChild().isElse()) {
      return false;
    }
    for (Node child = ifNode.getSecondChild(); child != null; child = child.getNext()) {
      Node block = child.isBlock() ? child : child.getLastChild();
      if (!isEarlyExit(block, exitMethodSuffix)) {
        return false;
      }
    }
    return true;
  }

  /**
   * The variable whose existence an access expression depends on: {@code $a} for {@code $a},
   * {@code $a['k']}, {@code $a->b} and {@code $a?->b['c']}. Null for variable variables and
   * anything else.
   */
  static @Nullable String baseVariable(Node n) {
    switch (n.getToken()) {
      case VAR:
        String name = n.getString();
        return name.startsWith("$$") ? null : name;
      case GETELEM:
      case GETPROP:
      case NULLSAFE_GETPROP:
        return baseVariable(n.getFirstChild());
      default:
        return null;
    }
  }

  private interface OperandMatcher {
    void match(Node operand, ImmutableSet.Builder<String> out);
  }

  private static void collectOrChain(
      Node cond, ImmutableSet.Builder<String> out, OperandMatcher matcher) {
    if (cond.isOr()) {
      collectOrChain(cond.getFirstChild(), out, matcher);
      collectOrChain(cond.getSecondChild(), out, matcher);
    } else {
      matcher.match(cond, out);
    }
  }

  private static void collectIsset(Node cond, ImmutableSet.Builder<String> out) {
    if (cond.isAnd()) {
      collectIsset(cond.getFirstChild(), out);
      collectIsset(cond.getSecondChild(), out);
    } else if (cond.isIsset()) {
      addBaseVariables(cond, out);
    } else if (cond.isNot() && cond.getFirstChild().isIsEmpty()) {
      addBaseVariables(cond.getFirstChild(), out);
    }
  }

  private static void addNegatedIsset(Node operand, ImmutableSet.Builder<String> out) {
    if (operand.isNot() && operand.getFirstChild().isIsset()) {
      addBaseVariables(operand.getFirstChild(), out);
    }
  }

  private static void addIsNull(Node operand, ImmutableSet.Builder<String> out) {
    if (!operand.isCall() || !operand.getFirstChild().isName()) {
      return;
    }
    String callee = operand.getFirstChild().getString();
    if (callee.startsWith("\\")) {
      callee = callee.substring(1);
    }
    Node args = operand.getSecondChild();
    if (callee.toLowerCase(Locale.ROOT).equals("is_null") && args.hasOneChild()) {
      Node arg = args.getFirstChild();
      if (arg.isVar()) {
        addName(arg, out);
      }
    }
  }

  private static void addFalsy(Node operand, ImmutableSet.Builder<String> out) {
    if (operand.isNot() && operand.getFirstChild().isVar()) {
      addName(operand.getFirstChild(), out);
    }
  }

  private static void addBaseVariables(Node construct, ImmutableSet.Builder<String> out) {
    for (Node arg : construct.children()) {
      String name = baseVariable(arg);
      if (name != null) {
        out.add(name);
      }
    }
  }

  private static void addName(Node var, ImmutableSet.Builder<String> out) {
    String name = var.getString();
    if (!name.startsWith("$$")) {
      out.add(name);
    }
  }
}
