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

/**
 * The kinds of nodes in a PHP syntax tree.
 *
 * <p>The child layout of every kind is documented next to its factory method in {@link IR}.
 */
public enum Token {
  SCRIPT,
  BLOCK,
  EMPTY, // placeholder for an absent optional child

  // Statements
  EXPR_RESULT,
  ECHO,
  IF,
  ELSEIF,
  ELSE,
  WHILE,
  DO,
  FOR,
  FOREACH,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  TRY,
  CATCH,
  FINALLY,
  RETURN,
  THROW,
  BREAK,
  CONTINUE,
  GLOBAL,
  STATIC,
  STATIC_VAR,
  UNSET,
  FUNCTION,
  CLASS,
  METHOD,
  PROPERTY,
  CLASS_CONST,
  NAMESPACE,
  USE_IMPORT,
  CONST,
  DECLARE,
  INLINE_HTML,

  // Function pieces
  PARAM_LIST,
  PARAM,
  USE_LIST,
  ARG_LIST,
  EXPR_LIST,

  // Expressions
  VAR,
  NAME,
  NUMBER,
  STRINGLIT,
  ASSIGN,
  ASSIGN_OP, // compound assignment, operator in the string slot
  ASSIGN_COALESCE, // ??=
  ASSIGN_REF, // $a = &$b
  HOOK, // conditional (?:), the then child is EMPTY for the short form
  OR, // || and or
  AND, // && and and
  XOR, // logical xor
  COALESCE, // ??
  BINARY_OP, // any other binary operator, operator in the string slot
  INSTANCEOF,
  NOT,
  UNARY_OP, // -, +, ~, operator in the string slot
  CAST,
  SILENCE, // @
  INC,
  DEC,
  CALL,
  METHOD_CALL,
  NULLSAFE_METHOD_CALL,
  STATIC_CALL,
  GETPROP,
  NULLSAFE_GETPROP,
  STATIC_PROP,
  CLASS_CONST_FETCH,
  GETELEM,
  NEW,
  CLONE,
  INCLUDE,
  PRINT,
  YIELD,
  ARRAYLIT,
  LIST,
  ARRAY_ITEM,
  SPREAD,
  CLOSURE,
  ARROW_FUNCTION,
  ISSET,
  IS_EMPTY,
  EXIT,
  NAMED_ARG,
}
