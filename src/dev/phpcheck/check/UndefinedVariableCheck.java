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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Sets;
import dev.phpcheck.syntax.Node;
import dev.phpcheck.syntax.Token;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Reports reads of variables that are not assigned on every path leading to them.
 *
 * <p>The analysis is one structural walk over the tree of a file. Branches of an {@code if} chain
 * or a {@code switch} are walked from the same starting state and joined by {@link
 * BranchMerger}; loop bodies are walked once, and what they assign is only possibly defined
 * afterwards. On top of that the walker understands the usual PHP guard idioms (see {@link
 * GuardPatterns}) and conditions repeated verbatim (see {@link ConditionCorrelationTracker}).
 */
public final class UndefinedVariableCheck implements CheckPass {

  public static final DiagnosticType UNDEFINED_VARIABLE =
      DiagnosticType.error("variable.undefined", "Undefined variable {0}");

  public static final DiagnosticType POSSIBLY_UNDEFINED_VARIABLE =
      DiagnosticType.error("variable.possiblyUndefined", "Variable {0} might not be defined.");

  private final AnalyzerOptions options;

  public UndefinedVariableCheck(AnalyzerOptions options) {
    this.options = options;
  }

  @Override
  public ImmutableList<PhpError> check(SourceFile source, Node root) {
    Walker walker = new Walker(source);
    walker.visit(root);
    return walker.errors.build();
  }

  /** The state of the analysis of one file. */
  private final class Walker {
    private final SourceFile source;
    private final ScopeStack scopes;
    // Replaced by a fresh tracker while a closure body is walked.
    private ConditionCorrelationTracker tracker;
    private final ImmutableList.Builder<PhpError> errors = ImmutableList.builder();

    Walker(SourceFile source) {
      this.source = source;
      this.scopes = new ScopeStack(options.getSuperglobals());
      this.tracker = new ConditionCorrelationTracker(source);
    }

    void visit(Node n) {
      switch (n.getToken()) {
        case IF:
          visitIf(n);
          break;
        case WHILE:
          visitWhile(n);
          break;
        case DO:
          visitChildren(n);
          break;
        case FOR:
          visitFor(n);
          break;
        case FOREACH:
          visitForeach(n);
          break;
        case SWITCH:
          visitSwitch(n);
          break;
        case TRY:
          visitTry(n);
          break;
        case GLOBAL:
          for (Node var : n.children()) {
            defineTarget(var);
          }
          break;
        case STATIC:
          for (Node staticVar : n.children()) {
            if (staticVar.getChildCount() == 2) {
              visit(staticVar.getSecondChild());
            }
            defineTarget(staticVar.getFirstChild());
          }
          break;
        case FUNCTION:
          try (ScopeStack.Frame frame = scopes.pushFunctionScope()) {
            visitFunctionBody(n.getSecondChild(), n.getLastChild());
          }
          break;
        case CLASS:
          visitClass(n);
          break;

        case VAR:
          checkRead(n);
          break;
        case ASSIGN:
        case ASSIGN_OP:
        case ASSIGN_COALESCE:
          // The target of ??= may be unset; a compound assignment defines its target as well.
          visit(n.getSecondChild());
          defineTarget(n.getFirstChild());
          break;
        case ASSIGN_REF:
          visitAssignRef(n);
          break;
        case INC:
        case DEC:
          visit(n.getFirstChild());
          defineTarget(n.getFirstChild());
          break;
        case HOOK:
          visitHook(n);
          break;
        case AND:
          visitAnd(n);
          break;
        case OR:
          visitOr(n);
          break;
        case COALESCE:
          if (!isAccessChain(n.getFirstChild())) {
            visit(n.getFirstChild());
          }
          visit(n.getSecondChild());
          break;
        case CALL:
          visitCall(n);
          break;
        case STATIC_PROP:
          visit(n.getFirstChild());
          if (!n.getSecondChild().isVar()) {
            visit(n.getSecondChild());
          }
          break;
        case ARRAYLIT:
        case LIST:
          visitArrayItems(n, false);
          break;
        case CLOSURE:
          visitClosure(n);
          break;
        case ARROW_FUNCTION:
          // The parameters of an arrow function are defined in the enclosing scope.
          defineParameters(n.getFirstChild());
          visit(n.getLastChild());
          break;

        case ISSET:
        case IS_EMPTY:
        case UNSET:
        case EMPTY:
        case NAME:
        case NUMBER:
        case STRINGLIT:
        case INLINE_HTML:
        case USE_IMPORT:
        case DECLARE:
        case BREAK:
        case CONTINUE:
          break;

        case SCRIPT:
        case BLOCK:
        case NAMESPACE:
        case CONST:
        case EXPR_RESULT:
        case ECHO:
        case RETURN:
        case THROW:
        case EXPR_LIST:
        case ARG_LIST:
        case NAMED_ARG:
        case SPREAD:
        case XOR:
        case BINARY_OP:
        case INSTANCEOF:
        case NOT:
        case UNARY_OP:
        case CAST:
        case SILENCE:
        case METHOD_CALL:
        case NULLSAFE_METHOD_CALL:
        case STATIC_CALL:
        case GETPROP:
        case NULLSAFE_GETPROP:
        case CLASS_CONST_FETCH:
        case GETELEM:
        case NEW:
        case CLONE:
        case INCLUDE:
        case PRINT:
        case YIELD:
        case EXIT:
          visitChildren(n);
          break;

        default:
          throw new IllegalStateException("Unexpected node " + n);
      }
    }

    private void visitChildren(Node n) {
      for (Node child : n.children()) {
        visit(child);
      }
    }

    private void checkRead(Node var) {
      String name = var.getString();
      if (name.startsWith("$$")) {
        return;
      }
      if (scopes.isDefined(name) || tracker.isCorrelated(name)) {
        return;
      }
      DiagnosticType type =
          scopes.isPossiblyDefined(name) ? POSSIBLY_UNDEFINED_VARIABLE : UNDEFINED_VARIABLE;
      errors.add(PhpError.make(source, var, type, name));
    }

    /** Records an assignment to {@code target}, visiting the parts of it that are read. */
    private void defineTarget(Node target) {
      switch (target.getToken()) {
        case VAR:
          if (!target.getString().startsWith("$$")) {
            scopes.define(target.getString());
          }
          break;
        case GETELEM:
          // $a[] = 1 creates $a.
          defineTarget(target.getFirstChild());
          visit(target.getSecondChild());
          break;
        case ARRAYLIT:
        case LIST:
          visitArrayItems(target, true);
          break;
        default:
          visit(target);
          break;
      }
    }

    /**
     * Visits the items of an array literal. In a destructuring assignment every value is a target;
     * otherwise only {@code &$v} items are.
     */
    private void visitArrayItems(Node array, boolean isTarget) {
      for (Node item : array.children()) {
        if (item.getToken() != Token.ARRAY_ITEM) {
          visit(item);
          continue;
        }
        if (item.getBooleanProp(Node.Prop.HAS_KEY)) {
          visit(item.getFirstChild());
        }
        Node value = item.getLastChild();
        if (isTarget || item.getBooleanProp(Node.Prop.BY_REFERENCE)) {
          defineTarget(value);
        } else {
          visit(value);
        }
      }
    }

    private void visitAssignRef(Node n) {
      Node value = n.getSecondChild();
      if (isAssignable(value)) {
        // Taking a reference creates the referenced variable.
        defineTarget(value);
      } else {
        visit(value);
      }
      defineTarget(n.getFirstChild());
    }

    private void visitCall(Node call) {
      Node callee = call.getFirstChild();
      ImmutableSet<Integer> byReference = ImmutableSet.of();
      if (callee.isName()) {
        byReference = byReferencePositions(callee.getString());
      } else {
        visit(callee);
      }
      int index = 0;
      for (Node arg : call.getSecondChild().children()) {
        if (byReference.contains(index) && isAssignable(arg)) {
          defineTarget(arg);
        } else {
          visit(arg);
        }
        index++;
      }
    }

    private ImmutableSet<Integer> byReferencePositions(String function) {
      String name = function.startsWith("\\") ? function.substring(1) : function;
      ImmutableSetMultimap<String, Integer> table = options.getByReferenceParameters();
      return table.get(name.toLowerCase(Locale.ROOT));
    }

    private void visitHook(Node n) {
      Node cond = n.getFirstChild();
      Node then = n.getSecondChild();
      Node elseExpr = n.getLastChild();
      if (then.isEmpty()) {
        // $v ?: $default
        if (!cond.isVar()) {
          visit(cond);
        }
        visit(elseExpr);
        return;
      }
      visit(cond);
      Set<String> assumed =
          Sets.union(GuardPatterns.issetVariables(cond), tracker.assignedUnder(tracker.key(cond)))
              .immutableCopy();
      Scope scope = scopes.current();
      scope.assume(assumed);
      if (!(cond.isVar() && then.matchesVar(cond.getString()))) {
        visit(then);
      }
      scope.retract(assumed);
      visit(elseExpr);
    }

    private void visitAnd(Node n) {
      Node left = n.getFirstChild();
      visit(left);
      visitAssuming(n.getSecondChild(), GuardPatterns.issetVariables(left));
    }

    private void visitOr(Node n) {
      Node left = n.getFirstChild();
      visit(left);
      Set<String> assumed = new LinkedHashSet<>(GuardPatterns.negatedIssetVariables(left));
      Node inverted = GuardPatterns.invertedOperand(left);
      if (inverted != null) {
        assumed.addAll(tracker.noElseAssigned(tracker.key(inverted)));
      }
      visitAssuming(n.getSecondChild(), assumed);
    }

    private void visitAssuming(Node n, Set<String> assumed) {
      Scope scope = scopes.current();
      scope.assume(assumed);
      visit(n);
      scope.retract(assumed);
    }

    private void visitIf(Node n) {
      Node cond = n.getFirstChild();
      Node thenBlock = n.getSecondChild();
      boolean hasElse = n.getLastChild().isElse();
      visit(cond);

      Scope scope = scopes.current();
      Scope.Checkpoint before = scope.checkpoint();
      Branches branches = new Branches();
      ImmutableSet<String> thenNew = visitGuardedBlock(cond, thenBlock, branches);

      if (thenBlock.getNext() != null) {
        ImmutableSet<String> negative = GuardPatterns.negativeBranchVariables(cond);
        scope.assume(negative);
        for (Node clause = thenBlock.getNext(); clause != null; clause = clause.getNext()) {
          scope.restore(before);
          if (clause.isElseIf()) {
            Node clauseCond = clause.getFirstChild();
            visit(clauseCond);
            visitGuardedBlock(clauseCond, clause.getLastChild(), branches);
          } else {
            Node block = clause.getFirstChild();
            visit(block);
            branches.add(block);
          }
        }
        scope.retract(negative);
      }
      branches.merge(before, hasElse);

      String key = tracker.key(cond);
      if (GuardPatterns.isEarlyExit(thenBlock, options.getExitMethodSuffix())) {
        // if (!isset($a)) { return; } leaves $a set.
        for (String name : GuardPatterns.earlyExitGuardVariables(cond)) {
          scopes.define(name);
        }
      }
      if (!hasElse) {
        // if (!isset($a)) { $a = 1; } leaves $a set as well.
        for (String name : Sets.intersection(GuardPatterns.negatedIssetVariables(cond), thenNew)) {
          scopes.define(name);
        }
        tracker.recordNoElseIf(key, thenNew);
      }
      Node inverted = GuardPatterns.invertedOperand(cond);
      if (inverted != null) {
        // if ($x) { $a = 1; } if (!$x) { $a = 2; }
        for (String name :
            Sets.intersection(thenNew, tracker.noElseAssigned(tracker.key(inverted)))) {
          scopes.define(name);
        }
      }
    }

    /**
     * Visits the block guarded by {@code cond}, with the variables the condition proves set
     * assumed. Returns the names the block defined.
     */
    private ImmutableSet<String> visitGuardedBlock(Node cond, Node block, Branches branches) {
      Scope scope = scopes.current();
      ImmutableSet<String> start = scope.snapshot();
      ImmutableSet<String> assumed = GuardPatterns.issetVariables(cond);
      String key = tracker.key(cond);
      scope.assume(assumed);
      tracker.pushCondition(key);
      visit(block);
      tracker.popCondition();
      scope.retract(assumed);

      ImmutableSet<String> defined = Sets.difference(scope.snapshot(), start).immutableCopy();
      tracker.recordAssignedUnder(key, defined);
      branches.add(block);
      return defined;
    }

    private void visitWhile(Node n) {
      visit(n.getFirstChild());
      visitLoopBody(n.getLastChild(), null);
    }

    private void visitFor(Node n) {
      visit(n.getFirstChild());
      visit(n.getSecondChild());
      visitLoopBody(n.getLastChild(), n.getChildAtIndex(2));
    }

    private void visitForeach(Node n) {
      visit(n.getFirstChild());
      Node key = n.getSecondChild();
      if (!key.isEmpty()) {
        defineTarget(key);
      }
      defineTarget(key.getNext());
      visitLoopBody(n.getLastChild(), null);
    }

    /** Walks a loop body once. Whatever it defines is only possibly defined after the loop. */
    private void visitLoopBody(Node body, @Nullable Node increment) {
      Scope scope = scopes.current();
      ImmutableSet<String> before = scope.snapshot();
      visit(body);
      if (increment != null) {
        visit(increment);
      }
      for (String name : Sets.difference(scope.snapshot(), before)) {
        scope.demote(name);
      }
    }

    private void visitSwitch(Node n) {
      visit(n.getFirstChild());
      Scope scope = scopes.current();
      Scope.Checkpoint before = scope.checkpoint();
      Branches branches = new Branches();
      boolean hasDefault = false;
      for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
        scope.restore(before);
        if (c.isDefaultCase()) {
          hasDefault = true;
        } else {
          visit(c.getFirstChild());
        }
        Node body = c.getLastChild();
        if (!body.hasChildren() && c.getNext() != null) {
          // falls through to the next case
          continue;
        }
        visit(body);
        branches.add(body);
      }
      branches.merge(before, hasDefault);
    }

    private void visitTry(Node n) {
      visit(n.getFirstChild());
      for (Node clause = n.getSecondChild(); clause != null; clause = clause.getNext()) {
        if (clause.getToken() == Token.CATCH) {
          Node binding = clause.getFirstChild();
          if (binding.isVar()) {
            defineTarget(binding);
          }
        }
        visit(clause.getLastChild());
      }
    }

    private void visitClass(Node n) {
      for (Node member : n.children()) {
        if (member.getToken() == Token.METHOD && !member.getBooleanProp(Node.Prop.ABSTRACT)) {
          try (ScopeStack.Frame frame = scopes.pushMethodScope()) {
            visitFunctionBody(member.getSecondChild(), member.getLastChild());
          }
        }
      }
    }

    private void visitClosure(Node n) {
      Node uses = n.getSecondChild();
      for (Node use : uses.children()) {
        if (use.getBooleanProp(Node.Prop.BY_REFERENCE)) {
          // use (&$v) creates $v in the enclosing scope.
          defineTarget(use);
        }
      }
      ConditionCorrelationTracker enclosingTracker = tracker;
      boolean isStatic = n.getBooleanProp(Node.Prop.STATIC);
      try (ScopeStack.Frame frame =
          isStatic ? scopes.pushStaticClosureScope() : scopes.pushClosureScope()) {
        for (Node use : uses.children()) {
          frame.getScope().inherit(use.getString());
        }
        tracker = new ConditionCorrelationTracker(source);
        visitFunctionBody(n.getFirstChild(), n.getLastChild());
      } finally {
        tracker = enclosingTracker;
      }
    }

    private void visitFunctionBody(Node params, Node body) {
      defineParameters(params);
      visit(body);
    }

    private void defineParameters(Node params) {
      for (Node param : params.children()) {
        if (param.getChildCount() == 2) {
          visit(param.getSecondChild());
        }
        defineTarget(param.getFirstChild());
      }
    }

    /** The snapshots of the branches of one if chain or switch that fall through. */
    private final class Branches {
      private final List<ImmutableSet<String>> defined = new ArrayList<>();
      private final Set<String> possiblyDefined = new LinkedHashSet<>();

      void add(Node body) {
        if (GuardPatterns.isEarlyExit(body, options.getExitMethodSuffix())) {
          return;
        }
        Scope.Checkpoint end = scopes.current().checkpoint();
        defined.add(end.defined());
        possiblyDefined.addAll(end.possiblyDefined());
      }

      /** Restores {@code before} and applies what the branches did to it. */
      void merge(Scope.Checkpoint before, boolean exhaustive) {
        scopes.current().restore(before);
        BranchMerger.merge(scopes, before.defined(), defined, exhaustive);
        for (String name : possiblyDefined) {
          if (!scopes.isDefined(name)) {
            scopes.definePossibly(name);
          }
        }
      }
    }
  }

  private static boolean isAccessChain(Node n) {
    switch (n.getToken()) {
      case VAR:
      case GETELEM:
      case GETPROP:
      case NULLSAFE_GETPROP:
      case STATIC_PROP:
        return true;
      default:
        return false;
    }
  }

  private static boolean isAssignable(Node n) {
    return isAccessChain(n) || n.isArrayLit() || n.isList();
  }
}
