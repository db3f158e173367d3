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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.phpcheck.syntax.TokenStream.Kind;
import dev.phpcheck.syntax.TokenStream.Lexeme;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A recursive descent parser for the subset of PHP the checks understand.
 *
 * <p>Every node the parser creates carries the source range it was parsed from. Parentheses do
 * not produce nodes, so the range of {@code ($a)} is the range of {@code $a}.
 */
public final class Parser {

  // Binary operators, loosest binding first. Assignment, ternary and ?? are handled above these,
  // instanceof and the unary operators below.
  private static final ImmutableList<ImmutableSet<String>> BINARY_LEVELS =
      ImmutableList.of(
          ImmutableSet.of("||"),
          ImmutableSet.of("&&"),
          ImmutableSet.of("|"),
          ImmutableSet.of("^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("==", "!=", "===", "!==", "<>", "<=>"),
          ImmutableSet.of("<", "<=", ">", ">="),
          ImmutableSet.of("."),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "%"));

  private static final ImmutableSet<String> ASSIGN_OPS =
      ImmutableSet.of(
          "=", "+=", "-=", "*=", "/=", ".=", "%=", "**=", "&=", "|=", "^=", "<<=", ">>=", "??=");

  private static final ImmutableSet<String> INCLUDE_KEYWORDS =
      ImmutableSet.of("include", "include_once", "require", "require_once");

  private static final ImmutableSet<String> PARAM_MODIFIERS =
      ImmutableSet.of("public", "protected", "private", "readonly");

  private static final ImmutableSet<String> MEMBER_MODIFIERS =
      ImmutableSet.of(
          "public", "protected", "private", "static", "abstract", "final", "readonly", "var");

  private final String source;
  private final ImmutableList<Lexeme> tokens;
  private int index = 0;

  private Parser(String source) {
    this.source = source;
    this.tokens = TokenStream.tokenize(source);
  }

  /**
   * Parses a whole PHP file.
   *
   * @throws ParseException if the text is not in the supported subset
   */
  public static Node parse(String source) {
    return new Parser(source).parseScript();
  }

  private Node parseScript() {
    List<Node> stmts = new ArrayList<>();
    try {
      while (peek().kind() != Kind.EOF) {
        stmts.add(parseStatement());
      }
      return IR.script(stmts).setSourceRange(0, source.length());
    } catch (IllegalStateException | IllegalArgumentException e) {
      // IR rejected a shape the grammar let through, e.g. "1 = 2".
      throw new ParseException("malformed construct: " + e.getMessage(), peek().start(), e);
    }
  }

  // ==========================================================================
  // Token helpers

  private Lexeme peek() {
    return tokens.get(index);
  }

  private Lexeme peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  private Lexeme next() {
    Lexeme t = tokens.get(index);
    if (t.kind() != Kind.EOF) {
      index++;
    }
    return t;
  }

  private int lastEnd() {
    return index == 0 ? 0 : tokens.get(index - 1).end();
  }

  private boolean atOperator(String op) {
    return peek().isOperator(op);
  }

  private boolean atKeyword(String keyword) {
    return peek().isKeyword(keyword);
  }

  private boolean atAnyKeyword(String... keywords) {
    for (String keyword : keywords) {
      if (atKeyword(keyword)) {
        return true;
      }
    }
    return false;
  }

  private boolean acceptOperator(String op) {
    if (atOperator(op)) {
      next();
      return true;
    }
    return false;
  }

  private boolean acceptKeyword(String keyword) {
    if (atKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  private Lexeme expectOperator(String op) {
    if (!atOperator(op)) {
      throw error("expected '" + op + "'");
    }
    return next();
  }

  private void expectKeyword(String keyword) {
    if (!acceptKeyword(keyword)) {
      throw error("expected '" + keyword + "'");
    }
  }

  private Lexeme expectIdentifier() {
    if (peek().kind() != Kind.IDENTIFIER) {
      throw error("expected an identifier");
    }
    return next();
  }

  private void endStatement() {
    expectOperator(";");
  }

  private ParseException error(String message) {
    Lexeme t = peek();
    String found = t.kind() == Kind.EOF ? "end of input" : "'" + t.text() + "'";
    return new ParseException(message + " but found " + found, t.start());
  }

  /** Sets the range of {@code n} to run from {@code start} to the end of the last token read. */
  private Node finish(Node n, int start) {
    return n.setSourceRange(start, Math.max(start, lastEnd()));
  }

  // ==========================================================================
  // Statements

  private Node parseStatement() {
    Lexeme t = peek();
    int start = t.start();
    switch (t.kind()) {
      case INLINE_HTML:
        next();
        return finish(IR.inlineHtml(t.text()), start);
      case OPERATOR:
        if (t.isOperator(";")) {
          next();
          return finish(IR.empty(), start);
        }
        if (t.isOperator("{")) {
          return parseBlock();
        }
        break;
      case IDENTIFIER:
        Node stmt = parseKeywordStatement(t);
        if (stmt != null) {
          return stmt;
        }
        break;
      default:
        break;
    }
    Node expr = parseExpression();
    endStatement();
    return finish(IR.exprResult(expr), start);
  }

  /** Returns null if {@code t} does not start a keyword statement. */
  private Node parseKeywordStatement(Lexeme t) {
    int start = t.start();
    switch (t.text().toLowerCase(Locale.ROOT)) {
      case "if":
        next();
        return parseIf(start);
      case "while":
        next();
        return parseWhile(start);
      case "do":
        next();
        return parseDo(start);
      case "for":
        next();
        return parseFor(start);
      case "foreach":
        next();
        return parseForeach(start);
      case "switch":
        next();
        return parseSwitch(start);
      case "try":
        next();
        return parseTry(start);
      case "return":
        {
          next();
          Node n = atOperator(";") ? IR.returnNode() : IR.returnNode(parseExpression());
          endStatement();
          return finish(n, start);
        }
      case "throw":
        {
          next();
          Node n = IR.throwNode(parseExpression());
          endStatement();
          return finish(n, start);
        }
      case "break":
      case "continue":
        {
          next();
          if (peek().kind() == Kind.NUMBER) {
            next();
          }
          endStatement();
          Node n = t.isKeyword("break") ? IR.breakNode() : IR.continueNode();
          return finish(n, start);
        }
      case "echo":
        {
          next();
          List<Node> values = new ArrayList<>();
          do {
            values.add(parseAssignment());
          } while (acceptOperator(","));
          endStatement();
          return finish(IR.echo(values), start);
        }
      case "global":
        next();
        return parseGlobal(start);
      case "static":
        if (peek(1).kind() != Kind.VARIABLE) {
          return null;
        }
        next();
        return parseStaticDeclaration(start);
      case "unset":
        if (!peek(1).isOperator("(")) {
          return null;
        }
        next();
        return parseUnset(start);
      case "function":
        if (peek(1).kind() == Kind.IDENTIFIER
            || (peek(1).isOperator("&") && peek(2).kind() == Kind.IDENTIFIER)) {
          next();
          return parseFunctionDeclaration(start);
        }
        return null;
      case "abstract":
      case "final":
      case "readonly":
        if (!peek(1).isKeyword("class")
            && !peek(1).isKeyword("abstract")
            && !peek(1).isKeyword("final")
            && !peek(1).isKeyword("readonly")) {
          return null;
        }
        while (!atKeyword("class")) {
          next();
        }
        return parseClassDeclaration(start);
      case "class":
      case "interface":
      case "trait":
      case "enum":
        if (peek(1).kind() != Kind.IDENTIFIER) {
          return null;
        }
        return parseClassDeclaration(start);
      case "namespace":
        if (peek(1).kind() != Kind.IDENTIFIER && !peek(1).isOperator("{")) {
          return null;
        }
        next();
        return parseNamespace(start);
      case "use":
        next();
        return parseUseImport(start);
      case "const":
        next();
        return parseConstDeclaration(start);
      case "declare":
        next();
        return parseDeclare(start);
      case "goto":
        next();
        expectIdentifier();
        endStatement();
        return finish(IR.empty(), start);
      case "__halt_compiler":
        index = tokens.size() - 1;
        return finish(IR.empty(), start);
      default:
        if (peek(1).isOperator(":")) {
          // a goto label
          next();
          next();
          return finish(IR.empty(), start);
        }
        return null;
    }
  }

  private Node parseBlock() {
    int start = expectOperator("{").start();
    List<Node> stmts = new ArrayList<>();
    while (!atOperator("}")) {
      if (peek().kind() == Kind.EOF) {
        throw error("expected '}'");
      }
      stmts.add(parseStatement());
    }
    next();
    return finish(IR.block(stmts), start);
  }

  /** Parses the body of a control statement: a block, or one statement wrapped in a block. */
  private Node parseBody() {
    if (atOperator("{")) {
      return parseBlock();
    }
    Node stmt = parseStatement();
    return IR.block(stmt).srcref(stmt);
  }

  /** Parses statements up to one of the given keywords, for the alternative syntax. */
  private Node parseStatementsUntil(String... keywords) {
    int start = peek().start();
    List<Node> stmts = new ArrayList<>();
    while (!atAnyKeyword(keywords)) {
      if (peek().kind() == Kind.EOF) {
        throw error("expected '" + keywords[keywords.length - 1] + "'");
      }
      stmts.add(parseStatement());
    }
    return finish(IR.block(stmts), start);
  }

  private Node parseParenthesized() {
    expectOperator("(");
    Node expr = parseExpression();
    expectOperator(")");
    return expr;
  }

  private Node parseIf(int start) {
    Node cond = parseParenthesized();
    List<Node> clauses = new ArrayList<>();
    Node then;
    if (acceptOperator(":")) {
      then = parseStatementsUntil("elseif", "else", "endif");
      while (true) {
        int clauseStart = peek().start();
        if (acceptKeyword("elseif")) {
          Node elseIfCond = parseParenthesized();
          expectOperator(":");
          Node body = parseStatementsUntil("elseif", "else", "endif");
          clauses.add(finish(IR.elseIf(elseIfCond, body), clauseStart));
        } else if (acceptKeyword("else")) {
          expectOperator(":");
          Node body = parseStatementsUntil("endif");
          clauses.add(finish(IR.elseNode(body), clauseStart));
          break;
        } else {
          break;
        }
      }
      expectKeyword("endif");
      endStatement();
    } else {
      then = parseBody();
      while (true) {
        int clauseStart = peek().start();
        if (acceptKeyword("elseif")) {
          Node elseIfCond = parseParenthesized();
          Node body = parseBody();
          clauses.add(finish(IR.elseIf(elseIfCond, body), clauseStart));
        } else if (acceptKeyword("else")) {
          // "else if" is an else whose block holds an if.
          Node body = parseBody();
          clauses.add(finish(IR.elseNode(body), clauseStart));
          break;
        } else {
          break;
        }
      }
    }
    return finish(IR.ifNode(cond, then, clauses), start);
  }

  private Node parseWhile(int start) {
    Node cond = parseParenthesized();
    Node body;
    if (acceptOperator(":")) {
      body = parseStatementsUntil("endwhile");
      next();
      endStatement();
    } else {
      body = parseBody();
    }
    return finish(IR.whileNode(cond, body), start);
  }

  private Node parseDo(int start) {
    Node body = parseBody();
    expectKeyword("while");
    Node cond = parseParenthesized();
    endStatement();
    return finish(IR.doNode(body, cond), start);
  }

  private Node parseFor(int start) {
    expectOperator("(");
    Node init = parseExpressionList(";");
    expectOperator(";");
    Node cond = parseExpressionList(";");
    expectOperator(";");
    Node incr = parseExpressionList(")");
    expectOperator(")");
    Node body;
    if (acceptOperator(":")) {
      body = parseStatementsUntil("endfor");
      next();
      endStatement();
    } else {
      body = parseBody();
    }
    return finish(IR.forNode(init, cond, incr, body), start);
  }

  private Node parseExpressionList(String terminator) {
    int start = peek().start();
    List<Node> exprs = new ArrayList<>();
    if (!atOperator(terminator)) {
      do {
        exprs.add(parseExpression());
      } while (acceptOperator(","));
    }
    return finish(IR.exprList(exprs), start);
  }

  private Node parseForeach(int start) {
    expectOperator("(");
    Node subject = parseExpression();
    expectKeyword("as");
    Node key = IR.empty();
    Node value = parseForeachTarget();
    if (acceptOperator("=>")) {
      key = value;
      value = parseForeachTarget();
    }
    expectOperator(")");
    Node body;
    if (acceptOperator(":")) {
      body = parseStatementsUntil("endforeach");
      next();
      endStatement();
    } else {
      body = parseBody();
    }
    return finish(IR.foreach(subject, key, value, body), start);
  }

  private Node parseForeachTarget() {
    boolean byRef = acceptOperator("&");
    return parsePostfix().putBooleanProp(Node.Prop.BY_REFERENCE, byRef);
  }

  private Node parseSwitch(int start) {
    Node subject = parseParenthesized();
    boolean alternative = acceptOperator(":");
    if (!alternative) {
      expectOperator("{");
    }
    List<Node> cases = new ArrayList<>();
    while (!(alternative ? atKeyword("endswitch") : atOperator("}"))) {
      int caseStart = peek().start();
      if (acceptKeyword("case")) {
        Node match = parseExpression();
        if (!acceptOperator(":")) {
          expectOperator(";");
        }
        cases.add(finish(IR.caseNode(match, parseCaseBody()), caseStart));
      } else if (acceptKeyword("default")) {
        if (!acceptOperator(":")) {
          expectOperator(";");
        }
        cases.add(finish(IR.defaultCase(parseCaseBody()), caseStart));
      } else {
        throw error("expected 'case' or 'default'");
      }
    }
    next();
    if (alternative) {
      endStatement();
    }
    return finish(IR.switchNode(subject, cases), start);
  }

  private Node parseCaseBody() {
    int start = peek().start();
    List<Node> stmts = new ArrayList<>();
    while (!atAnyKeyword("case", "default", "endswitch") && !atOperator("}")) {
      if (peek().kind() == Kind.EOF) {
        throw error("expected '}'");
      }
      stmts.add(parseStatement());
    }
    return finish(IR.block(stmts), start);
  }

  private Node parseTry(int start) {
    Node block = parseBlock();
    List<Node> clauses = new ArrayList<>();
    while (atKeyword("catch")) {
      int clauseStart = next().start();
      expectOperator("(");
      StringBuilder types = new StringBuilder(expectIdentifier().text());
      while (acceptOperator("|")) {
        types.append('|').append(expectIdentifier().text());
      }
      Node binding = IR.empty();
      if (peek().kind() == Kind.VARIABLE) {
        Lexeme v = next();
        binding = finish(IR.var(v.text()), v.start());
      }
      expectOperator(")");
      Node body = parseBlock();
      clauses.add(finish(IR.catchNode(types.toString(), binding, body), clauseStart));
    }
    if (atKeyword("finally")) {
      int clauseStart = next().start();
      clauses.add(finish(IR.finallyNode(parseBlock()), clauseStart));
    }
    if (clauses.isEmpty()) {
      throw error("expected 'catch' or 'finally'");
    }
    return finish(IR.tryNode(block, clauses), start);
  }

  private Node parseGlobal(int start) {
    List<Node> vars = new ArrayList<>();
    do {
      vars.add(parseVariable());
    } while (acceptOperator(","));
    endStatement();
    return finish(IR.global(vars), start);
  }

  private Node parseStaticDeclaration(int start) {
    List<Node> staticVars = new ArrayList<>();
    do {
      int varStart = peek().start();
      Node var = parseVariable();
      Node staticVar =
          acceptOperator("=") ? IR.staticVar(var, parseAssignment()) : IR.staticVar(var);
      staticVars.add(finish(staticVar, varStart));
    } while (acceptOperator(","));
    endStatement();
    return finish(IR.staticDecl(staticVars), start);
  }

  private Node parseUnset(int start) {
    expectOperator("(");
    List<Node> targets = new ArrayList<>();
    while (!atOperator(")")) {
      targets.add(parseAssignment());
      if (!acceptOperator(",")) {
        break;
      }
    }
    expectOperator(")");
    endStatement();
    return finish(IR.unset(targets), start);
  }

  private Node parseVariable() {
    if (peek().kind() != Kind.VARIABLE) {
      throw error("expected a variable");
    }
    Lexeme v = next();
    return finish(IR.var(v.text()), v.start());
  }

  private Node parseName() {
    Lexeme t = expectIdentifier();
    return finish(IR.name(t.text()), t.start());
  }

  private Node parseFunctionDeclaration(int start) {
    acceptOperator("&");
    Node name = parseName();
    Node params = parseParameterList();
    skipReturnType();
    Node body = parseBlock();
    return finish(IR.function(name, params, body), start);
  }

  private Node parseClassDeclaration(int start) {
    String kind = next().text().toLowerCase(Locale.ROOT);
    Node name = parseName();
    // extends, implements and enum backing types do not matter to the checks
    while (!atOperator("{")) {
      if (peek().kind() == Kind.EOF) {
        throw error("expected '{'");
      }
      next();
    }
    List<Node> members = parseClassBody();
    return finish(IR.classNode(kind, name, members), start);
  }

  private List<Node> parseClassBody() {
    expectOperator("{");
    List<Node> members = new ArrayList<>();
    while (!atOperator("}")) {
      if (peek().kind() == Kind.EOF) {
        throw error("expected '}'");
      }
      int start = peek().start();
      if (acceptKeyword("use")) {
        int textStart = peek().start();
        while (!atOperator(";") && !atOperator("{")) {
          next();
        }
        String used = source.substring(textStart, lastEnd());
        if (atOperator("{")) {
          skipBalanced("{", "}");
        } else {
          endStatement();
        }
        members.add(finish(IR.useImport(used), start));
        continue;
      }
      if (acceptKeyword("case")) {
        Node caseName = parseName();
        Node value = acceptOperator("=") ? parseExpression() : IR.name(caseName.getString());
        endStatement();
        members.add(finish(IR.classConst(caseName, value), start));
        continue;
      }
      boolean isStatic = false;
      while (peek().kind() == Kind.IDENTIFIER
          && MEMBER_MODIFIERS.contains(peek().text().toLowerCase(Locale.ROOT))) {
        isStatic |= next().isKeyword("static");
      }
      if (acceptKeyword("const")) {
        if (peek(1).kind() == Kind.IDENTIFIER) {
          skipType();
        }
        do {
          int constStart = peek().start();
          Node constName = parseName();
          expectOperator("=");
          members.add(finish(IR.classConst(constName, parseExpression()), constStart));
        } while (acceptOperator(","));
        endStatement();
        continue;
      }
      if (acceptKeyword("function")) {
        acceptOperator("&");
        Node methodName = parseName();
        Node params = parseParameterList();
        skipReturnType();
        Node body;
        if (atOperator("{")) {
          body = parseBlock();
        } else {
          endStatement();
          body = IR.empty();
        }
        Node method = IR.method(methodName, params, body);
        method.putBooleanProp(Node.Prop.STATIC, isStatic);
        members.add(finish(method, start));
        continue;
      }
      if (peek().kind() != Kind.VARIABLE) {
        skipType();
      }
      do {
        int propStart = peek().start();
        Node var = parseVariable();
        Node property =
            acceptOperator("=") ? IR.property(var, parseExpression()) : IR.property(var);
        property.putBooleanProp(Node.Prop.STATIC, isStatic);
        members.add(finish(property, propStart));
      } while (acceptOperator(","));
      if (atOperator("{")) {
        // property hooks
        skipBalanced("{", "}");
      } else {
        endStatement();
      }
    }
    next();
    return members;
  }

  private void skipBalanced(String open, String close) {
    int start = expectOperator(open).start();
    int depth = 1;
    while (depth > 0) {
      Lexeme t = next();
      if (t.kind() == Kind.EOF) {
        throw new ParseException("unbalanced '" + open + "'", start);
      }
      if (t.isOperator(open)) {
        depth++;
      } else if (t.isOperator(close)) {
        depth--;
      }
    }
  }

  private Node parseNamespace(int start) {
    Node name = peek().kind() == Kind.IDENTIFIER ? parseName() : IR.empty();
    Node body;
    if (atOperator("{")) {
      body = parseBlock();
    } else {
      endStatement();
      body = finish(IR.block(), lastEnd());
    }
    return finish(IR.namespace(name, body), start);
  }

  private Node parseUseImport(int start) {
    int textStart = peek().start();
    while (!atOperator(";")) {
      if (peek().kind() == Kind.EOF) {
        throw error("expected ';'");
      }
      next();
    }
    String imported = source.substring(textStart, lastEnd());
    endStatement();
    return finish(IR.useImport(imported), start);
  }

  private Node parseConstDeclaration(int start) {
    List<Node> consts = new ArrayList<>();
    do {
      int constStart = peek().start();
      Node name = parseName();
      expectOperator("=");
      consts.add(finish(IR.constDecl(name, parseExpression()), constStart));
    } while (acceptOperator(","));
    endStatement();
    return consts.size() == 1 ? consts.get(0) : finish(IR.block(consts), start);
  }

  private Node parseDeclare(int start) {
    skipBalanced("(", ")");
    if (atOperator("{")) {
      return parseBlock();
    }
    endStatement();
    return finish(IR.declare(), start);
  }

  // ==========================================================================
  // Functions

  private Node parseParameterList() {
    int start = expectOperator("(").start();
    List<Node> params = new ArrayList<>();
    while (!atOperator(")")) {
      int paramStart = peek().start();
      while (peek().kind() == Kind.IDENTIFIER
          && PARAM_MODIFIERS.contains(peek().text().toLowerCase(Locale.ROOT))) {
        next();
      }
      if (peek().kind() != Kind.VARIABLE && !atOperator("&") && !atOperator("...")) {
        skipType();
      }
      boolean byRef = acceptOperator("&");
      boolean variadic = acceptOperator("...");
      Node var = parseVariable();
      Node param = acceptOperator("=") ? IR.param(var, parseAssignment()) : IR.param(var);
      param.putBooleanProp(Node.Prop.BY_REFERENCE, byRef);
      param.putBooleanProp(Node.Prop.VARIADIC, variadic);
      params.add(finish(param, paramStart));
      if (!acceptOperator(",")) {
        break;
      }
    }
    expectOperator(")");
    return finish(IR.paramList(params), start);
  }

  private void skipReturnType() {
    if (acceptOperator(":")) {
      skipType();
    }
  }

  /** Skips a type declaration: nullable, union, intersection and DNF types. */
  private void skipType() {
    acceptOperator("?");
    while (true) {
      if (acceptOperator("(")) {
        skipType();
        expectOperator(")");
      } else {
        expectIdentifier();
      }
      if (atOperator("|")) {
        next();
      } else if (atOperator("&")
          && (peek(1).kind() == Kind.IDENTIFIER || peek(1).isOperator("("))) {
        next();
      } else {
        return;
      }
    }
  }

  private Node parseClosure(int start, boolean isStatic, boolean isArrow) {
    acceptOperator("&");
    Node params = parseParameterList();
    Node n;
    if (isArrow) {
      skipReturnType();
      expectOperator("=>");
      n = IR.arrowFunction(params, parseAssignment());
    } else {
      int usesStart = peek().start();
      List<Node> uses = new ArrayList<>();
      if (acceptKeyword("use")) {
        expectOperator("(");
        while (!atOperator(")")) {
          boolean byRef = acceptOperator("&");
          uses.add(parseVariable().putBooleanProp(Node.Prop.BY_REFERENCE, byRef));
          if (!acceptOperator(",")) {
            break;
          }
        }
        expectOperator(")");
      }
      Node useList = finish(IR.useList(uses), usesStart);
      skipReturnType();
      n = IR.closure(params, useList, parseBlock());
    }
    n.putBooleanProp(Node.Prop.STATIC, isStatic);
    return finish(n, start);
  }

  private Node parseArguments() {
    int start = expectOperator("(").start();
    List<Node> args = new ArrayList<>();
    while (!atOperator(")")) {
      int argStart = peek().start();
      if (acceptOperator("...")) {
        if (atOperator(")")) {
          // first-class callable syntax: strlen(...)
          break;
        }
        args.add(finish(IR.spread(parseAssignment()), argStart));
      } else if (peek().kind() == Kind.IDENTIFIER && peek(1).isOperator(":")) {
        String name = next().text();
        next();
        args.add(finish(IR.namedArg(name, parseAssignment()), argStart));
      } else {
        args.add(parseAssignment());
      }
      if (!acceptOperator(",")) {
        break;
      }
    }
    expectOperator(")");
    return finish(IR.argList(args), start);
  }

  // ==========================================================================
  // Expressions

  Node parseExpression() {
    Node left = parseLowXor();
    while (atKeyword("or")) {
      next();
      Node right = parseLowXor();
      left = finish(IR.or(left, right), left.getSourceOffset());
    }
    return left;
  }

  private Node parseLowXor() {
    Node left = parseLowAnd();
    while (atKeyword("xor")) {
      next();
      Node right = parseLowAnd();
      left = finish(IR.xor(left, right), left.getSourceOffset());
    }
    return left;
  }

  private Node parseLowAnd() {
    Node left = parseAssignment();
    while (atKeyword("and")) {
      next();
      Node right = parseAssignment();
      left = finish(IR.and(left, right), left.getSourceOffset());
    }
    return left;
  }

  /**
   * Parses an expression at assignment level. Assignments themselves are recognized in {@link
   * #parsePostfix}, as soon as an assignable operand is followed by an assignment operator.
   */
  private Node parseAssignment() {
    return parseTernary();
  }

  private Node parseTernary() {
    Node cond = parseCoalesce();
    if (atOperator("?")) {
      next();
      Node then = atOperator(":") ? IR.empty() : parseAssignment();
      expectOperator(":");
      Node otherwise = parseAssignment();
      return finish(IR.hook(cond, then, otherwise), cond.getSourceOffset());
    }
    return cond;
  }

  private Node parseCoalesce() {
    Node left = parseBinary(0);
    if (acceptOperator("??")) {
      Node right = parseCoalesce();
      return finish(IR.coalesce(left, right), left.getSourceOffset());
    }
    return left;
  }

  private Node parseBinary(int level) {
    if (level == BINARY_LEVELS.size()) {
      return parseInstanceof();
    }
    ImmutableSet<String> ops = BINARY_LEVELS.get(level);
    Node left = parseBinary(level + 1);
    while (peek().kind() == Kind.OPERATOR && ops.contains(peek().text())) {
      String op = next().text();
      Node right = parseBinary(level + 1);
      Node n;
      switch (op) {
        case "||":
          n = IR.or(left, right);
          break;
        case "&&":
          n = IR.and(left, right);
          break;
        default:
          n = IR.binaryOp(op, left, right);
          break;
      }
      left = finish(n, left.getSourceOffset());
    }
    return left;
  }

  private Node parseInstanceof() {
    Node left = parseUnary();
    while (acceptKeyword("instanceof")) {
      Node type = peek().kind() == Kind.IDENTIFIER ? parseName() : parseUnary();
      left = finish(IR.instanceOf(left, type), left.getSourceOffset());
    }
    return left;
  }

  private Node parseUnary() {
    Lexeme t = peek();
    int start = t.start();
    if (t.kind() == Kind.OPERATOR) {
      switch (t.text()) {
        case "!":
          next();
          return finish(IR.not(parseInstanceof()), start);
        case "-":
        case "+":
        case "~":
          next();
          return finish(IR.unaryOp(t.text(), parseUnary()), start);
        case "@":
          next();
          return finish(IR.silence(parseUnary()), start);
        case "++":
          next();
          return finish(IR.inc(parsePostfix(), true), start);
        case "--":
          next();
          return finish(IR.dec(parsePostfix(), true), start);
        default:
          break;
      }
    } else if (t.kind() == Kind.CAST) {
      next();
      String type = t.text().substring(1, t.text().length() - 1).trim().toLowerCase(Locale.ROOT);
      return finish(IR.cast(type, parseUnary()), start);
    } else if (t.kind() == Kind.IDENTIFIER) {
      String keyword = t.text().toLowerCase(Locale.ROOT);
      if (keyword.equals("clone")) {
        next();
        return finish(IR.cloneNode(parseUnary()), start);
      }
      if (keyword.equals("print")) {
        next();
        return finish(IR.print(parseAssignment()), start);
      }
      if (keyword.equals("yield")) {
        next();
        return finish(parseYield(), start);
      }
      if (INCLUDE_KEYWORDS.contains(keyword)) {
        next();
        return finish(IR.include(keyword, parseAssignment()), start);
      }
      if (keyword.equals("throw")) {
        next();
        return finish(IR.throwNode(parseAssignment()), start);
      }
    }
    return parsePow();
  }

  private Node parseYield() {
    if (atOperator(";") || atOperator(")") || atOperator(",") || atOperator("]")) {
      return IR.yieldNode();
    }
    acceptKeyword("from");
    Node value = parseTernary();
    if (acceptOperator("=>")) {
      Node keyed = parseTernary();
      return IR.yieldNode(
          finish(IR.binaryOp("=>", value, keyed), value.getSourceOffset()));
    }
    return IR.yieldNode(value);
  }

  private Node parsePow() {
    Node base = parsePostfix();
    if (acceptOperator("**")) {
      Node exponent = parseUnary();
      return finish(IR.binaryOp("**", base, exponent), base.getSourceOffset());
    }
    return base;
  }

  private Node parsePostfix() {
    Node n = parsePrimary();
    int start = n.getSourceOffset();
    while (true) {
      Lexeme t = peek();
      if (t.isOperator("[")) {
        next();
        Node index = atOperator("]") ? IR.empty() : parseExpression();
        expectOperator("]");
        n = finish(IR.getElem(n, index), start);
      } else if (t.isOperator("->") || t.isOperator("?->")) {
        next();
        boolean nullsafe = t.isOperator("?->");
        Node member = parseMemberName();
        if (atOperator("(")) {
          Node args = parseArguments();
          n =
              nullsafe
                  ? IR.nullsafeMethodCall(n, member, args)
                  : IR.methodCall(n, member, args);
        } else {
          n = nullsafe ? IR.nullsafeGetProp(n, member) : IR.getProp(n, member);
        }
        n = finish(n, start);
      } else if (t.isOperator("::")) {
        next();
        if (peek().kind() == Kind.VARIABLE) {
          n = IR.staticProp(n, parseVariable());
        } else {
          Node member = parseName();
          n =
              atOperator("(")
                  ? IR.staticCall(n, member, parseArguments())
                  : IR.classConstFetch(n, member);
        }
        n = finish(n, start);
      } else if (t.isOperator("(")) {
        n = finish(IR.call(n, parseArguments()), start);
      } else if (t.isOperator("++") && isAssignable(n)) {
        next();
        n = finish(IR.inc(n, false), start);
      } else if (t.isOperator("--") && isAssignable(n)) {
        next();
        n = finish(IR.dec(n, false), start);
      } else {
        break;
      }
    }
    if (isAssignable(n)
        && peek().kind() == Kind.OPERATOR
        && ASSIGN_OPS.contains(peek().text())) {
      String op = next().text();
      switch (op) {
        case "=":
          if (acceptOperator("&")) {
            return finish(IR.assignRef(n, parseAssignment()), start);
          }
          return finish(IR.assign(n, parseAssignment()), start);
        case "??=":
          return finish(IR.assignCoalesce(n, parseAssignment()), start);
        default:
          String binaryOp = op.substring(0, op.length() - 1);
          return finish(IR.assignOp(binaryOp, n, parseAssignment()), start);
      }
    }
    return n;
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

  private Node parseMemberName() {
    Lexeme t = peek();
    if (t.kind() == Kind.IDENTIFIER) {
      return parseName();
    }
    if (t.kind() == Kind.VARIABLE) {
      return parseVariable();
    }
    if (acceptOperator("{")) {
      Node expr = parseExpression();
      expectOperator("}");
      return expr;
    }
    throw error("expected a member name");
  }

  private Node parsePrimary() {
    Lexeme t = peek();
    int start = t.start();
    switch (t.kind()) {
      case VARIABLE:
        return parseVariable();
      case NUMBER:
        next();
        return finish(IR.number(t.text()), start);
      case STRING:
        next();
        return finish(IR.string(t.text()), start);
      case OPERATOR:
        switch (t.text()) {
          case "(":
            return parseParenthesized();
          case "[":
            next();
            return finish(IR.arrayLit(parseArrayItems("]")), start);
          case "$":
            {
              // ${expr}; the variable is dynamic and named after its source text
              next();
              expectOperator("{");
              parseExpression();
              expectOperator("}");
              return finish(IR.var("$" + source.substring(start, lastEnd())), start);
            }
          default:
            break;
        }
        break;
      case IDENTIFIER:
        next();
        return parseIdentifierExpression(t);
      default:
        break;
    }
    throw error("expected an expression");
  }

  private Node parseIdentifierExpression(Lexeme t) {
    int start = t.start();
    switch (t.text().toLowerCase(Locale.ROOT)) {
      case "array":
        if (acceptOperator("(")) {
          return finish(IR.arrayLit(parseArrayItems(")")), start);
        }
        break;
      case "list":
        if (acceptOperator("(")) {
          return finish(IR.list(parseArrayItems(")")), start);
        }
        break;
      case "isset":
        {
          expectOperator("(");
          List<Node> args = new ArrayList<>();
          do {
            if (atOperator(")")) {
              break;
            }
            args.add(parseAssignment());
          } while (acceptOperator(","));
          expectOperator(")");
          return finish(IR.isset(args), start);
        }
      case "empty":
        {
          Node value = parseParenthesized();
          return finish(IR.isEmpty(value), start);
        }
      case "exit":
      case "die":
        {
          String keyword = t.text().toLowerCase(Locale.ROOT);
          if (acceptOperator("(")) {
            if (acceptOperator(")")) {
              return finish(IR.exit(keyword), start);
            }
            Node status = parseExpression();
            expectOperator(")");
            return finish(IR.exit(keyword, status), start);
          }
          return finish(IR.exit(keyword), start);
        }
      case "function":
        return parseClosure(start, false, false);
      case "fn":
        if (atOperator("(") || atOperator("&")) {
          return parseClosure(start, false, true);
        }
        break;
      case "static":
        if (atKeyword("function")) {
          next();
          return parseClosure(start, true, false);
        }
        if (atKeyword("fn")) {
          next();
          return parseClosure(start, true, true);
        }
        break;
      case "new":
        return parseNew(start);
      case "match":
        if (atOperator("(")) {
          return parseMatch(start);
        }
        break;
      default:
        break;
    }
    return finish(IR.name(t.text()), start);
  }

  private List<Node> parseArrayItems(String close) {
    List<Node> items = new ArrayList<>();
    while (!atOperator(close)) {
      int start = peek().start();
      if (acceptOperator(",")) {
        // a skipped slot in destructuring: [, $b] = ...
        items.add(IR.empty());
        continue;
      }
      if (acceptOperator("...")) {
        items.add(finish(IR.spread(parseAssignment()), start));
      } else {
        boolean byRef = acceptOperator("&");
        Node first = parseAssignment();
        Node item;
        if (!byRef && acceptOperator("=>")) {
          boolean valueByRef = acceptOperator("&");
          item = IR.arrayItem(first, parseAssignment());
          item.putBooleanProp(Node.Prop.BY_REFERENCE, valueByRef);
        } else {
          item = IR.arrayItem(first);
          item.putBooleanProp(Node.Prop.BY_REFERENCE, byRef);
        }
        items.add(finish(item, start));
      }
      if (!acceptOperator(",")) {
        break;
      }
    }
    expectOperator(close);
    return items;
  }

  private Node parseNew(int start) {
    Node type;
    if (atKeyword("class")) {
      // An anonymous class; its members are not analyzed.
      int classStart = next().start();
      Node args = atOperator("(") ? parseArguments() : IR.argList();
      while (!atOperator("{")) {
        if (peek().kind() == Kind.EOF) {
          throw error("expected '{'");
        }
        next();
      }
      parseClassBody();
      type = finish(IR.name("class@anonymous"), classStart);
      return finish(IR.newNode(type, args), start);
    }
    if (peek().kind() == Kind.IDENTIFIER) {
      type = parseName();
    } else if (peek().kind() == Kind.VARIABLE) {
      type = parseVariable();
      while (atOperator("->") || atOperator("::")) {
        boolean isStatic = next().isOperator("::");
        type =
            finish(
                isStatic
                    ? IR.staticProp(type, parseVariable())
                    : IR.getProp(type, parseMemberName()),
                type.getSourceOffset());
      }
    } else if (atOperator("(")) {
      type = parseParenthesized();
    } else {
      throw error("expected a class name");
    }
    Node args = atOperator("(") ? parseArguments() : IR.argList();
    return finish(IR.newNode(type, args), start);
  }

  /**
   * Parses {@code match (subject) { conditions => result, ... }} into a call of {@code match}
   * whose arguments are the subject followed by every condition and result, in source order.
   */
  private Node parseMatch(int start) {
    int argsStart = peek().start();
    List<Node> args = new ArrayList<>();
    args.add(parseParenthesized());
    expectOperator("{");
    while (!atOperator("}")) {
      if (!acceptKeyword("default")) {
        do {
          if (atOperator("=>")) {
            break;
          }
          args.add(parseAssignment());
        } while (acceptOperator(","));
      }
      expectOperator("=>");
      args.add(parseAssignment());
      if (!acceptOperator(",")) {
        break;
      }
    }
    expectOperator("}");
    Node callee = IR.name("match").setSourceRange(start, start + 5);
    return finish(IR.call(callee, finish(IR.argList(args), argsStart)), start);
  }
}
