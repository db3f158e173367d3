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
import java.util.Locale;

/**
 * This class implements the PHP scanner. It turns source text into a flat list of {@link Lexeme}s;
 * whitespace and comments are dropped, {@code ?>} closes a statement like {@code ;} does.
 */
public final class TokenStream {

  /** The lexical classes the parser distinguishes. */
  public enum Kind {
    INLINE_HTML,
    VARIABLE,
    IDENTIFIER,
    NUMBER,
    STRING,
    CAST,
    OPERATOR,
    EOF,
  }

  /** One token: its class, its text and its source range. */
  public record Lexeme(Kind kind, String text, int start, int end) {
    public boolean is(Kind k, String s) {
      return kind == k && text.equals(s);
    }

    public boolean isOperator(String op) {
      return is(Kind.OPERATOR, op);
    }

    /** Keywords are identifiers, compared case-insensitively. */
    public boolean isKeyword(String keyword) {
      return kind == Kind.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }
  }

  // Longest operators first, so that the first match wins.
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "<<=", ">>=", "**=", "...", "<=>", "===", "!==", "??=", "?->",
          "++", "--", "->", "=>", "::", "==", "!=", "<>", "<=", ">=", "&&", "||", "??",
          "+=", "-=", "*=", "/=", ".=", "%=", "&=", "|=", "^=", "<<", ">>", "**",
          "+", "-", "*", "/", "%", "=", "<", ">", "!", ".", ",", ";", "(", ")", "[", "]",
          "{", "}", "?", ":", "&", "|", "^", "~", "@", "$");

  private static final ImmutableSet<String> CAST_TYPES =
      ImmutableSet.of(
          "int", "integer", "bool", "boolean", "float", "double", "real", "string", "array",
          "object", "unset", "binary");

  private final String source;
  private int pos = 0;
  private final ImmutableList.Builder<Lexeme> tokens = ImmutableList.builder();

  private TokenStream(String source) {
    this.source = source;
  }

  /** Splits {@code source} into tokens, ending with a single {@link Kind#EOF} token. */
  public static ImmutableList<Lexeme> tokenize(String source) {
    TokenStream ts = new TokenStream(source);
    ts.scanInlineHtml();
    while (ts.pos < source.length()) {
      ts.scanToken();
    }
    ts.tokens.add(new Lexeme(Kind.EOF, "", source.length(), source.length()));
    return ts.tokens.build();
  }

  private void add(Kind kind, int start) {
    tokens.add(new Lexeme(kind, source.substring(start, pos), start, pos));
  }

  private char peek(int ahead) {
    int i = pos + ahead;
    return i < source.length() ? source.charAt(i) : '\0';
  }

  private boolean lookingAt(String s) {
    return source.startsWith(s, pos);
  }

  private boolean lookingAtIgnoreCase(String s) {
    return source.regionMatches(true, pos, s, 0, s.length());
  }

  /** Consumes text up to the next open tag and emits it as inline HTML. */
  private void scanInlineHtml() {
    int start = pos;
    int open = source.indexOf("<?", pos);
    while (open >= 0) {
      pos = open;
      if (lookingAtIgnoreCase("<?php") || lookingAt("<?=") || !Character.isLetter(peek(2))) {
        break;
      }
      open = source.indexOf("<?", open + 2);
    }
    if (open < 0) {
      pos = source.length();
    }
    if (pos > start) {
      add(Kind.INLINE_HTML, start);
    }
    if (pos >= source.length()) {
      return;
    }
    if (lookingAtIgnoreCase("<?php")) {
      pos += 5;
    } else if (lookingAt("<?=")) {
      pos += 3;
      tokens.add(new Lexeme(Kind.IDENTIFIER, "echo", pos - 3, pos));
    } else {
      pos += 2;
    }
  }

  private void scanToken() {
    char c = peek(0);
    if (Character.isWhitespace(c)) {
      pos++;
      return;
    }
    if (lookingAt("?>")) {
      tokens.add(new Lexeme(Kind.OPERATOR, ";", pos, pos + 2));
      pos += 2;
      if (peek(0) == '\n') {
        pos++;
      }
      scanInlineHtml();
      return;
    }
    if (lookingAt("#[")) {
      skipAttribute();
      return;
    }
    if (c == '#' || lookingAt("//")) {
      skipLineComment();
      return;
    }
    if (lookingAt("/*")) {
      int end = source.indexOf("*/", pos + 2);
      if (end < 0) {
        throw new ParseException("unterminated comment", pos);
      }
      pos = end + 2;
      return;
    }
    int start = pos;
    if (c == '$' && isIdentifierStart(peek(1))) {
      pos++;
      scanIdentifierChars();
      add(Kind.VARIABLE, start);
      return;
    }
    if (c == '$' && peek(1) == '$') {
      // Variable variables: $$name, $$$name, ...
      while (peek(0) == '$') {
        pos++;
      }
      if (!isIdentifierStart(peek(0))) {
        throw new ParseException("unsupported variable variable", start);
      }
      scanIdentifierChars();
      add(Kind.VARIABLE, start);
      return;
    }
    if (isIdentifierStart(c) || (c == '\\' && isIdentifierStart(peek(1)))) {
      scanName();
      add(Kind.IDENTIFIER, start);
      return;
    }
    if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
      scanNumber();
      add(Kind.NUMBER, start);
      return;
    }
    if (c == '\'' || c == '"' || c == '`') {
      scanQuoted(c);
      add(Kind.STRING, start);
      return;
    }
    if (lookingAt("<<<")) {
      scanHeredoc();
      add(Kind.STRING, start);
      return;
    }
    if (c == '(' && scanCast()) {
      add(Kind.CAST, start);
      return;
    }
    for (String op : OPERATORS) {
      if (lookingAt(op)) {
        pos += op.length();
        add(Kind.OPERATOR, start);
        return;
      }
    }
    throw new ParseException("unexpected character '" + c + "'", pos);
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c >= 0x80;
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || Character.isDigit(c);
  }

  private void scanIdentifierChars() {
    while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
      pos++;
    }
  }

  /** Scans a possibly qualified name such as {@code \Foo\Bar}. */
  private void scanName() {
    if (peek(0) == '\\') {
      pos++;
    }
    scanIdentifierChars();
    while (peek(0) == '\\' && isIdentifierStart(peek(1))) {
      pos++;
      scanIdentifierChars();
    }
  }

  private void scanNumber() {
    if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X' || peek(1) == 'b' || peek(1) == 'B')) {
      pos += 2;
      while (Character.isLetterOrDigit(peek(0)) || peek(0) == '_') {
        pos++;
      }
      return;
    }
    while (Character.isDigit(peek(0)) || peek(0) == '_') {
      pos++;
    }
    if (peek(0) == '.' && Character.isDigit(peek(1))) {
      pos++;
      while (Character.isDigit(peek(0)) || peek(0) == '_') {
        pos++;
      }
    }
    if ((peek(0) == 'e' || peek(0) == 'E')
        && (Character.isDigit(peek(1))
            || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
      pos += 2;
      while (Character.isDigit(peek(0))) {
        pos++;
      }
    }
  }

  private void scanQuoted(char quote) {
    int start = pos;
    pos++;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\\') {
        pos += 2;
      } else if (c == quote) {
        pos++;
        return;
      } else {
        pos++;
      }
    }
    throw new ParseException("unterminated string", start);
  }

  private void scanHeredoc() {
    int start = pos;
    pos += 3;
    while (peek(0) == ' ' || peek(0) == '\t') {
      pos++;
    }
    char quote = peek(0);
    if (quote == '\'' || quote == '"') {
      pos++;
    }
    int labelStart = pos;
    scanIdentifierChars();
    String label = source.substring(labelStart, pos);
    if (label.isEmpty()) {
      throw new ParseException("bad heredoc label", start);
    }
    if (quote == '\'' || quote == '"') {
      pos++;
    }
    int lineEnd = source.indexOf('\n', pos);
    while (lineEnd >= 0) {
      int lineStart = lineEnd + 1;
      int i = lineStart;
      while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
        i++;
      }
      if (source.startsWith(label, i)
          && (i + label.length() >= source.length()
              || !isIdentifierPart(source.charAt(i + label.length())))) {
        pos = i + label.length();
        return;
      }
      lineEnd = source.indexOf('\n', lineStart);
    }
    throw new ParseException("unterminated heredoc", start);
  }

  /** Recognizes {@code (int)} and friends; consumes them and returns true if found. */
  private boolean scanCast() {
    int i = pos + 1;
    while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
      i++;
    }
    int wordStart = i;
    while (i < source.length() && Character.isLetter(source.charAt(i))) {
      i++;
    }
    String word = source.substring(wordStart, i).toLowerCase(Locale.ROOT);
    while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
      i++;
    }
    if (i < source.length() && source.charAt(i) == ')' && CAST_TYPES.contains(word)) {
      pos = i + 1;
      return true;
    }
    return false;
  }

  private void skipLineComment() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\n' || lookingAt("?>")) {
        return;
      }
      pos++;
    }
  }

  private void skipAttribute() {
    int start = pos;
    int depth = 0;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\'' || c == '"') {
        scanQuoted(c);
        continue;
      }
      if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
        if (depth == 0) {
          pos++;
          return;
        }
      }
      pos++;
    }
    throw new ParseException("unterminated attribute", start);
  }
}
