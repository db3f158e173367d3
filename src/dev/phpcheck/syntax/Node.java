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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node in a PHP syntax tree.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points at the last
 * child so that appending is constant time, while {@code last.next} is null.
 */
public final class Node {

  /** Boolean properties a node may carry. */
  public enum Prop {
    // A by-reference parameter, foreach target, closure capture or array item (&$x).
    BY_REFERENCE,
    // A variadic parameter (...$args).
    VARIADIC,
    // A static closure, arrow function or method.
    STATIC,
    // A prefix ++ or --.
    PREFIX,
    // An array item with an explicit key; its first child is the key.
    HAS_KEY,
    // An abstract or interface method without a body.
    ABSTRACT,
  }

  private Token token;
  private @Nullable String string;
  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);

  private int sourceOffset = -1;
  private int length = 0;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = str;
    return n;
  }

  public Token getToken() {
    return token;
  }

  public void setToken(Token token) {
    this.token = token;
  }

  /** Returns the string slot: a variable or identifier name, a literal, or an operator. */
  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public void setString(String str) {
    this.string = str;
  }

  public boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  @CanIgnoreReturnValue
  public Node putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
    return this;
  }

  // ==========================================================================
  // Source position

  /** Returns the offset of the first character of this node, or -1 if unknown. */
  public int getSourceOffset() {
    return sourceOffset;
  }

  public int getLength() {
    return length;
  }

  /** Returns the offset just past the last character of this node, or -1 if unknown. */
  public int getSourceEnd() {
    return sourceOffset < 0 ? -1 : sourceOffset + length;
  }

  @CanIgnoreReturnValue
  public Node setSourceRange(int start, int end) {
    checkArgument(start >= 0 && end >= start, "bad range [%s, %s)", start, end);
    this.sourceOffset = start;
    this.length = end - start;
    return this;
  }

  @CanIgnoreReturnValue
  public Node srcref(Node other) {
    this.sourceOffset = other.sourceOffset;
    this.length = other.length;
    return this;
  }

  // ==========================================================================
  // Children

  public boolean hasChildren() {
    return first != null;
  }

  public boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public Node getOnlyChild() {
    checkState(hasOneChild(), "%s does not have exactly one child", token);
    return first;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public @Nullable Node getNext() {
    return next;
  }

  public @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  public void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  public Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.next;
      return n;
    }
  }

  // ==========================================================================
  // Token predicates

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isVar() {
    return token == Token.VAR;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isNot() {
    return token == Token.NOT;
  }

  public boolean isOr() {
    return token == Token.OR;
  }

  public boolean isAnd() {
    return token == Token.AND;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isIsset() {
    return token == Token.ISSET;
  }

  public boolean isIsEmpty() {
    return token == Token.IS_EMPTY;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isElse() {
    return token == Token.ELSE;
  }

  public boolean isElseIf() {
    return token == Token.ELSEIF;
  }

  public boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public boolean isArrayLit() {
    return token == Token.ARRAYLIT;
  }

  public boolean isList() {
    return token == Token.LIST;
  }

  public boolean isGetElem() {
    return token == Token.GETELEM;
  }

  /** Whether this is the variable {@code $name}, name given with its sigil. */
  public boolean matchesVar(String name) {
    return token == Token.VAR && name.equals(string);
  }

  // ==========================================================================
  // Debugging

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (!props.isEmpty()) {
      sb.append(' ').append(props);
    }
    if (sourceOffset >= 0) {
      sb.append(" [").append(sourceOffset).append('+').append(length).append(']');
    }
    return sb.toString();
  }

  /** Prints the tree rooted here, one node per line, indented by depth. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, depth + 1);
    }
  }
}
