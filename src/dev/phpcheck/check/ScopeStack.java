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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * The stack of {@link Scope}s active at one point of a file. Only the top scope is changed.
 *
 * <p>Lookups walk from the top toward the root and stop after the first closure scope: a closure
 * sees only its own names and what its {@code use} clause captured. Ordinary function scopes see
 * the facts of the scopes below them.
 */
final class ScopeStack {

  private final Deque<Scope> scopes = new ArrayDeque<>();

  ScopeStack(Iterable<String> ambientNames) {
    Scope root = Scope.create();
    for (String name : ambientNames) {
      root.define(name);
    }
    scopes.push(root);
  }

  Scope current() {
    return scopes.peek();
  }

  int depth() {
    return scopes.size();
  }

  void define(String name) {
    current().define(name);
  }

  void definePossibly(String name) {
    current().definePossibly(name);
  }

  boolean isDefined(String name) {
    for (Scope scope : scopes) {
      if (scope.isDefined(name)) {
        return true;
      }
      if (scope.isClosure()) {
        return false;
      }
    }
    return false;
  }

  boolean isPossiblyDefined(String name) {
    for (Scope scope : scopes) {
      if (scope.isPossiblyDefined(name)) {
        return true;
      }
      if (scope.isClosure()) {
        return false;
      }
    }
    return false;
  }

  /** Whether some scope on the stack belongs to an instance method. */
  boolean hasThisInScope() {
    for (Iterator<Scope> it = scopes.iterator(); it.hasNext(); ) {
      if (it.next().hasThis()) {
        return true;
      }
    }
    return false;
  }

  /** Enters the body of a named function. */
  Frame pushFunctionScope() {
    return push(Scope.create());
  }

  /** Enters the body of a method, where {@code $this} is defined. */
  Frame pushMethodScope() {
    Scope scope = Scope.create();
    scope.setHasThis();
    return push(scope);
  }

  /** Enters the body of a closure, binding {@code $this} if an enclosing method has one. */
  Frame pushClosureScope() {
    Scope scope = Scope.createClosure();
    if (hasThisInScope()) {
      scope.setHasThis();
    }
    return push(scope);
  }

  /** Enters the body of a {@code static function}, which never has {@code $this}. */
  Frame pushStaticClosureScope() {
    return push(Scope.createClosure());
  }

  private Frame push(Scope scope) {
    scopes.push(scope);
    return new Frame(scope);
  }

  /** Pops its scope when closed; meant for try-with-resources. */
  final class Frame implements AutoCloseable {
    private final Scope scope;
    private boolean closed = false;

    private Frame(Scope scope) {
      this.scope = scope;
    }

    Scope getScope() {
      return scope;
    }

    @Override
    public void close() {
      checkState(!closed, "scope already popped");
      checkState(scopes.peek() == scope, "scopes popped out of order");
      scopes.pop();
      closed = true;
    }
  }
}
