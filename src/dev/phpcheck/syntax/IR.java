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

package dev.phpcheck.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;

/**
 * An AST construction helper class. Every factory checks the shape of its children, so a tree
 * built through this class has the layout the analysis passes expect.
 */
public class IR {

  private static final Set<Token> STATEMENTS =
      Sets.immutableEnumSet(
          Token.BLOCK,
          Token.EMPTY,
          Token.EXPR_RESULT,
          Token.ECHO,
          Token.IF,
          Token.WHILE,
          Token.DO,
          Token.FOR,
          Token.FOREACH,
          Token.SWITCH,
          Token.TRY,
          Token.RETURN,
          Token.THROW,
          Token.BREAK,
          Token.CONTINUE,
          Token.GLOBAL,
          Token.STATIC,
          Token.UNSET,
          Token.FUNCTION,
          Token.CLASS,
          Token.NAMESPACE,
          Token.USE_IMPORT,
          Token.CONST,
          Token.DECLARE,
          Token.INLINE_HTML);

  // throw is both a statement and, since PHP 8, an expression.
  private static final Set<Token> NON_EXPRESSIONS =
      Sets.immutableEnumSet(
          Sets.union(
              Sets.difference(STATEMENTS, Sets.immutableEnumSet(Token.THROW)),
              Sets.immutableEnumSet(
                  Token.SCRIPT,
                  Token.ELSEIF,
                  Token.ELSE,
                  Token.CASE,
                  Token.DEFAULT_CASE,
                  Token.CATCH,
                  Token.FINALLY,
                  Token.STATIC_VAR,
                  Token.METHOD,
                  Token.PROPERTY,
                  Token.CLASS_CONST,
                  Token.PARAM_LIST,
                  Token.PARAM,
                  Token.USE_LIST,
                  Token.ARG_LIST,
                  Token.EXPR_LIST,
                  Token.ARRAY_ITEM,
                  Token.SPREAD,
                  Token.NAMED_ARG)));

  private IR() {}

  static boolean mayBeStatement(Node n) {
    return STATEMENTS.contains(n.getToken());
  }

  static boolean mayBeExpression(Node n) {
    return !NON_EXPRESSIONS.contains(n.getToken());
  }

  private static boolean isAssignable(Node n) {
    switch (n.getToken()) {
      case VAR:
      case GETELEM:
      case GETPROP:
      case NULLSAFE_GETPROP:
      case STATIC_PROP:
      case ARRAYLIT:
      case LIST:
        return true;
      default:
        return false;
    }
  }

  private static Node expr(Node n) {
    checkState(mayBeExpression(n), "not an expression: %s", n);
    return n;
  }

  private static Node exprOrEmpty(Node n) {
    checkState(n.isEmpty() || mayBeExpression(n), "not an expression: %s", n);
    return n;
  }

  private static Node nameOrExpr(Node n) {
    checkState(n.isName() || mayBeExpression(n), "not a name: %s", n);
    return n;
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  // ==========================================================================
  // Statements

  public static Node script(List<Node> stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node script(Node... stmts) {
    return script(List.of(stmts));
  }

  public static Node block(List<Node> stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(Node... stmts) {
    return block(List.of(stmts));
  }

  public static Node exprResult(Node expr) {
    return new Node(Token.EXPR_RESULT, expr(expr));
  }

  public static Node echo(List<Node> values) {
    checkArgument(!values.isEmpty());
    Node echo = new Node(Token.ECHO);
    for (Node value : values) {
      echo.addChildToBack(expr(value));
    }
    return echo;
  }

  public static Node echo(Node... values) {
    return echo(List.of(values));
  }

  /** IF(condition, BLOCK, ELSEIF*, ELSE?) */
  public static Node ifNode(Node cond, Node then, List<Node> clauses) {
    checkState(then.isBlock());
    Node n = new Node(Token.IF, expr(cond), then);
    boolean seenElse = false;
    for (Node clause : clauses) {
      checkState(!seenElse, "else must be the last clause");
      checkState(clause.isElseIf() || clause.isElse(), clause);
      seenElse = clause.isElse();
      n.addChildToBack(clause);
    }
    return n;
  }

  public static Node ifNode(Node cond, Node then) {
    return ifNode(cond, then, List.of());
  }

  public static Node ifNode(Node cond, Node then, Node elseBlock) {
    return ifNode(cond, then, List.of(elseNode(elseBlock)));
  }

  /** ELSEIF(condition, BLOCK) */
  public static Node elseIf(Node cond, Node block) {
    checkState(block.isBlock());
    return new Node(Token.ELSEIF, expr(cond), block);
  }

  /** ELSE(BLOCK) */
  public static Node elseNode(Node block) {
    checkState(block.isBlock());
    return new Node(Token.ELSE, block);
  }

  /** WHILE(condition, BLOCK) */
  public static Node whileNode(Node cond, Node body) {
    checkState(body.isBlock());
    return new Node(Token.WHILE, expr(cond), body);
  }

  /** DO(BLOCK, condition) */
  public static Node doNode(Node body, Node cond) {
    checkState(body.isBlock());
    return new Node(Token.DO, body, expr(cond));
  }

  /** FOR(EXPR_LIST init, EXPR_LIST condition, EXPR_LIST increment, BLOCK) */
  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.getToken() == Token.EXPR_LIST);
    checkState(cond.getToken() == Token.EXPR_LIST);
    checkState(incr.getToken() == Token.EXPR_LIST);
    checkState(body.isBlock());
    Node n = new Node(Token.FOR, init, cond, incr);
    n.addChildToBack(body);
    return n;
  }

  /** FOREACH(subject, key or EMPTY, value, BLOCK) */
  public static Node foreach(Node subject, Node key, Node value, Node body) {
    checkState(key.isEmpty() || isAssignable(key), key);
    checkState(isAssignable(value), value);
    checkState(body.isBlock());
    Node n = new Node(Token.FOREACH, expr(subject), key, value);
    n.addChildToBack(body);
    return n;
  }

  /** SWITCH(subject, (CASE | DEFAULT_CASE)*) */
  public static Node switchNode(Node subject, List<Node> cases) {
    Node n = new Node(Token.SWITCH, expr(subject));
    for (Node c : cases) {
      checkState(c.getToken() == Token.CASE || c.isDefaultCase(), c);
      n.addChildToBack(c);
    }
    return n;
  }

  public static Node switchNode(Node subject, Node... cases) {
    return switchNode(subject, List.of(cases));
  }

  /** CASE(match, BLOCK) */
  public static Node caseNode(Node match, Node body) {
    checkState(body.isBlock());
    return new Node(Token.CASE, expr(match), body);
  }

  /** DEFAULT_CASE(BLOCK) */
  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT_CASE, body);
  }

  /** TRY(BLOCK, CATCH*, FINALLY?) */
  public static Node tryNode(Node block, List<Node> clauses) {
    checkState(block.isBlock());
    Node n = new Node(Token.TRY, block);
    for (Node clause : clauses) {
      checkState(
          clause.getToken() == Token.CATCH || clause.getToken() == Token.FINALLY, clause);
      n.addChildToBack(clause);
    }
    return n;
  }

  /** CATCH(VAR or EMPTY, BLOCK); the caught type names are kept in the string slot. */
  public static Node catchNode(String types, Node binding, Node block) {
    checkState(binding.isVar() || binding.isEmpty());
    checkState(block.isBlock());
    Node n = new Node(Token.CATCH, binding, block);
    n.setString(types);
    return n;
  }

  /** FINALLY(BLOCK) */
  public static Node finallyNode(Node block) {
    checkState(block.isBlock());
    return new Node(Token.FINALLY, block);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node value) {
    return new Node(Token.RETURN, expr(value));
  }

  public static Node throwNode(Node value) {
    return new Node(Token.THROW, expr(value));
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node global(List<Node> vars) {
    checkArgument(!vars.isEmpty());
    Node n = new Node(Token.GLOBAL);
    for (Node var : vars) {
      checkState(var.isVar(), var);
      n.addChildToBack(var);
    }
    return n;
  }

  public static Node staticDecl(List<Node> staticVars) {
    checkArgument(!staticVars.isEmpty());
    Node n = new Node(Token.STATIC);
    for (Node v : staticVars) {
      checkState(v.getToken() == Token.STATIC_VAR, v);
      n.addChildToBack(v);
    }
    return n;
  }

  /** STATIC_VAR(VAR, initializer?) */
  public static Node staticVar(Node var) {
    checkState(var.isVar());
    return new Node(Token.STATIC_VAR, var);
  }

  public static Node staticVar(Node var, Node init) {
    checkState(var.isVar());
    return new Node(Token.STATIC_VAR, var, expr(init));
  }

  public static Node unset(List<Node> targets) {
    Node n = new Node(Token.UNSET);
    for (Node target : targets) {
      n.addChildToBack(expr(target));
    }
    return n;
  }

  /** FUNCTION(NAME, PARAM_LIST, BLOCK) */
  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  /**
   * CLASS(NAME, member*); the string slot holds the declaring keyword: class, interface, trait or
   * enum.
   */
  public static Node classNode(String kind, Node name, List<Node> members) {
    checkState(name.isName());
    Node n = new Node(Token.CLASS, name);
    n.setString(kind);
    for (Node member : members) {
      checkState(
          member.getToken() == Token.METHOD
              || member.getToken() == Token.PROPERTY
              || member.getToken() == Token.CLASS_CONST
              || member.getToken() == Token.USE_IMPORT,
          member);
      n.addChildToBack(member);
    }
    return n;
  }

  /** METHOD(NAME, PARAM_LIST, BLOCK or EMPTY) */
  public static Node method(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(body.isBlock() || body.isEmpty());
    Node n = new Node(Token.METHOD, name, params, body);
    n.putBooleanProp(Node.Prop.ABSTRACT, body.isEmpty());
    return n;
  }

  /** PROPERTY(VAR, default?) */
  public static Node property(Node var) {
    checkState(var.isVar());
    return new Node(Token.PROPERTY, var);
  }

  public static Node property(Node var, Node value) {
    checkState(var.isVar());
    return new Node(Token.PROPERTY, var, expr(value));
  }

  /** CLASS_CONST(NAME, value) */
  public static Node classConst(Node name, Node value) {
    checkState(name.isName());
    return new Node(Token.CLASS_CONST, name, expr(value));
  }

  /** NAMESPACE(NAME or EMPTY, BLOCK) */
  public static Node namespace(Node name, Node body) {
    checkState(name.isName() || name.isEmpty());
    checkState(body.isBlock());
    return new Node(Token.NAMESPACE, name, body);
  }

  public static Node useImport(String name) {
    return Node.newString(Token.USE_IMPORT, name);
  }

  /** CONST(NAME, value) */
  public static Node constDecl(Node name, Node value) {
    checkState(name.isName());
    return new Node(Token.CONST, name, expr(value));
  }

  public static Node declare() {
    return new Node(Token.DECLARE);
  }

  public static Node inlineHtml(String html) {
    return Node.newString(Token.INLINE_HTML, html);
  }

  // ==========================================================================
  // Function pieces

  public static Node paramList(List<Node> params) {
    Node n = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.getToken() == Token.PARAM, param);
      n.addChildToBack(param);
    }
    return n;
  }

  public static Node paramList(Node... params) {
    return paramList(List.of(params));
  }

  /** PARAM(VAR, default?) */
  public static Node param(Node var) {
    checkState(var.isVar());
    return new Node(Token.PARAM, var);
  }

  public static Node param(Node var, Node defaultValue) {
    checkState(var.isVar());
    return new Node(Token.PARAM, var, expr(defaultValue));
  }

  public static Node useList(List<Node> vars) {
    Node n = new Node(Token.USE_LIST);
    for (Node var : vars) {
      checkState(var.isVar(), var);
      n.addChildToBack(var);
    }
    return n;
  }

  public static Node useList(Node... vars) {
    return useList(List.of(vars));
  }

  public static Node argList(List<Node> args) {
    Node n = new Node(Token.ARG_LIST);
    for (Node arg : args) {
      checkState(
          arg.getToken() == Token.SPREAD
              || arg.getToken() == Token.NAMED_ARG
              || mayBeExpression(arg),
          arg);
      n.addChildToBack(arg);
    }
    return n;
  }

  public static Node argList(Node... args) {
    return argList(List.of(args));
  }

  public static Node exprList(List<Node> exprs) {
    Node n = new Node(Token.EXPR_LIST);
    for (Node e : exprs) {
      n.addChildToBack(expr(e));
    }
    return n;
  }

  public static Node exprList(Node... exprs) {
    return exprList(List.of(exprs));
  }

  /** NAMED_ARG(value); the parameter name is in the string slot. */
  public static Node namedArg(String name, Node value) {
    Node n = new Node(Token.NAMED_ARG, expr(value));
    n.setString(name);
    return n;
  }

  public static Node spread(Node value) {
    return new Node(Token.SPREAD, expr(value));
  }

  // ==========================================================================
  // Leaves

  /** A variable; the name includes its sigil, e.g. {@code $foo} or {@code $$foo}. */
  public static Node var(String name) {
    checkArgument(name.startsWith("$"), "variable name without sigil: %s", name);
    return Node.newString(Token.VAR, name);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node number(String text) {
    return Node.newString(Token.NUMBER, text);
  }

  public static Node string(String text) {
    return Node.newString(Token.STRINGLIT, text);
  }

  // ==========================================================================
  // Assignments and operators

  public static Node assign(Node target, Node value) {
    checkState(isAssignable(target), "not assignable: %s", target);
    return new Node(Token.ASSIGN, target, expr(value));
  }

  public static Node assignOp(String op, Node target, Node value) {
    checkState(isAssignable(target), "not assignable: %s", target);
    Node n = new Node(Token.ASSIGN_OP, target, expr(value));
    n.setString(op);
    return n;
  }

  public static Node assignCoalesce(Node target, Node value) {
    checkState(isAssignable(target), "not assignable: %s", target);
    return new Node(Token.ASSIGN_COALESCE, target, expr(value));
  }

  public static Node assignRef(Node target, Node value) {
    checkState(isAssignable(target), "not assignable: %s", target);
    return new Node(Token.ASSIGN_REF, target, expr(value));
  }

  /** HOOK(condition, then or EMPTY, else) */
  public static Node hook(Node cond, Node then, Node elseExpr) {
    return new Node(Token.HOOK, expr(cond), exprOrEmpty(then), expr(elseExpr));
  }

  public static Node or(Node left, Node right) {
    return new Node(Token.OR, expr(left), expr(right));
  }

  public static Node and(Node left, Node right) {
    return new Node(Token.AND, expr(left), expr(right));
  }

  public static Node xor(Node left, Node right) {
    return new Node(Token.XOR, expr(left), expr(right));
  }

  public static Node coalesce(Node left, Node right) {
    return new Node(Token.COALESCE, expr(left), expr(right));
  }

  public static Node binaryOp(String op, Node left, Node right) {
    Node n = new Node(Token.BINARY_OP, expr(left), expr(right));
    n.setString(op);
    return n;
  }

  public static Node instanceOf(Node value, Node type) {
    return new Node(Token.INSTANCEOF, expr(value), nameOrExpr(type));
  }

  public static Node not(Node value) {
    return new Node(Token.NOT, expr(value));
  }

  public static Node unaryOp(String op, Node value) {
    Node n = new Node(Token.UNARY_OP, expr(value));
    n.setString(op);
    return n;
  }

  public static Node cast(String type, Node value) {
    Node n = new Node(Token.CAST, expr(value));
    n.setString(type);
    return n;
  }

  public static Node silence(Node value) {
    return new Node(Token.SILENCE, expr(value));
  }

  public static Node inc(Node target, boolean prefix) {
    checkState(isAssignable(target), "not assignable: %s", target);
    return new Node(Token.INC, target).putBooleanProp(Node.Prop.PREFIX, prefix);
  }

  public static Node dec(Node target, boolean prefix) {
    checkState(isAssignable(target), "not assignable: %s", target);
    return new Node(Token.DEC, target).putBooleanProp(Node.Prop.PREFIX, prefix);
  }

  // ==========================================================================
  // Calls and accesses

  /** CALL(NAME or callee expression, ARG_LIST) */
  public static Node call(Node callee, Node args) {
    checkState(args.getToken() == Token.ARG_LIST);
    return new Node(Token.CALL, nameOrExpr(callee), args);
  }

  public static Node call(String function, Node... args) {
    return call(name(function), argList(args));
  }

  /** METHOD_CALL(object, NAME or expression, ARG_LIST) */
  public static Node methodCall(Node object, Node method, Node args) {
    checkState(args.getToken() == Token.ARG_LIST);
    return new Node(Token.METHOD_CALL, expr(object), nameOrExpr(method), args);
  }

  public static Node nullsafeMethodCall(Node object, Node method, Node args) {
    checkState(args.getToken() == Token.ARG_LIST);
    return new Node(Token.NULLSAFE_METHOD_CALL, expr(object), nameOrExpr(method), args);
  }

  /** STATIC_CALL(class NAME or expression, method NAME or expression, ARG_LIST) */
  public static Node staticCall(Node type, Node method, Node args) {
    checkState(args.getToken() == Token.ARG_LIST);
    return new Node(Token.STATIC_CALL, nameOrExpr(type), nameOrExpr(method), args);
  }

  public static Node getProp(Node object, Node property) {
    return new Node(Token.GETPROP, expr(object), nameOrExpr(property));
  }

  public static Node nullsafeGetProp(Node object, Node property) {
    return new Node(Token.NULLSAFE_GETPROP, expr(object), nameOrExpr(property));
  }

  /** STATIC_PROP(class NAME or expression, VAR) */
  public static Node staticProp(Node type, Node var) {
    checkState(var.isVar() || mayBeExpression(var));
    return new Node(Token.STATIC_PROP, nameOrExpr(type), var);
  }

  /** CLASS_CONST_FETCH(class NAME or expression, NAME) */
  public static Node classConstFetch(Node type, Node name) {
    checkState(name.isName());
    return new Node(Token.CLASS_CONST_FETCH, nameOrExpr(type), name);
  }

  /** GETELEM(array, index or EMPTY for {@code $a[]}) */
  public static Node getElem(Node array, Node index) {
    return new Node(Token.GETELEM, expr(array), exprOrEmpty(index));
  }

  /** NEW(class NAME or expression, ARG_LIST) */
  public static Node newNode(Node type, Node args) {
    checkState(args.getToken() == Token.ARG_LIST);
    return new Node(Token.NEW, nameOrExpr(type), args);
  }

  public static Node cloneNode(Node value) {
    return new Node(Token.CLONE, expr(value));
  }

  /** INCLUDE(path); the keyword (include, require_once, ...) is in the string slot. */
  public static Node include(String keyword, Node path) {
    Node n = new Node(Token.INCLUDE, expr(path));
    n.setString(keyword);
    return n;
  }

  public static Node print(Node value) {
    return new Node(Token.PRINT, expr(value));
  }

  public static Node yieldNode() {
    return new Node(Token.YIELD);
  }

  public static Node yieldNode(Node value) {
    return new Node(Token.YIELD, expr(value));
  }

  // ==========================================================================
  // Arrays

  public static Node arrayLit(List<Node> items) {
    Node n = new Node(Token.ARRAYLIT);
    for (Node item : items) {
      checkState(
          item.getToken() == Token.ARRAY_ITEM
              || item.getToken() == Token.SPREAD
              || item.isEmpty(),
          item);
      n.addChildToBack(item);
    }
    return n;
  }

  public static Node arrayLit(Node... items) {
    return arrayLit(List.of(items));
  }

  /** LIST(ARRAY_ITEM or EMPTY*), the {@code list(...)} form of destructuring. */
  public static Node list(List<Node> items) {
    Node n = new Node(Token.LIST);
    for (Node item : items) {
      checkState(item.getToken() == Token.ARRAY_ITEM || item.isEmpty(), item);
      n.addChildToBack(item);
    }
    return n;
  }

  public static Node list(Node... items) {
    return list(List.of(items));
  }

  /** ARRAY_ITEM(value) */
  public static Node arrayItem(Node value) {
    return new Node(Token.ARRAY_ITEM, expr(value));
  }

  /** ARRAY_ITEM(key, value) with HAS_KEY set */
  public static Node arrayItem(Node key, Node value) {
    Node n = new Node(Token.ARRAY_ITEM, expr(key), expr(value));
    n.putBooleanProp(Node.Prop.HAS_KEY, true);
    return n;
  }

  // ==========================================================================
  // Closures

  /** CLOSURE(PARAM_LIST, USE_LIST, BLOCK) */
  public static Node closure(Node params, Node uses, Node body) {
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(uses.getToken() == Token.USE_LIST);
    checkState(body.isBlock());
    return new Node(Token.CLOSURE, params, uses, body);
  }

  /** ARROW_FUNCTION(PARAM_LIST, expression) */
  public static Node arrowFunction(Node params, Node body) {
    checkState(params.getToken() == Token.PARAM_LIST);
    return new Node(Token.ARROW_FUNCTION, params, expr(body));
  }

  // ==========================================================================
  // Language constructs

  public static Node isset(List<Node> args) {
    checkArgument(!args.isEmpty());
    Node n = new Node(Token.ISSET);
    for (Node arg : args) {
      n.addChildToBack(expr(arg));
    }
    return n;
  }

  public static Node isset(Node... args) {
    return isset(List.of(args));
  }

  public static Node isEmpty(Node value) {
    return new Node(Token.IS_EMPTY, expr(value));
  }

  /** EXIT(status?); the keyword (exit or die) is in the string slot. */
  public static Node exit(String keyword) {
    return Node.newString(Token.EXIT, keyword);
  }

  public static Node exit(String keyword, Node status) {
    Node n = new Node(Token.EXIT, expr(status));
    n.setString(keyword);
    return n;
  }
}
