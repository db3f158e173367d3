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

import static com.google.common.truth.Truth.assertThat;
import static dev.phpcheck.check.UndefinedVariableCheck.POSSIBLY_UNDEFINED_VARIABLE;
import static dev.phpcheck.check.UndefinedVariableCheck.UNDEFINED_VARIABLE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link UndefinedVariableCheck}. */
@RunWith(JUnit4.class)
public final class UndefinedVariableCheckTest extends CheckTestCase {

  @Override
  protected CheckPass getProcessor(AnalyzerOptions options) {
    return new UndefinedVariableCheck(options);
  }

  private void testUndefined(String php) {
    testWarning(php, UNDEFINED_VARIABLE);
  }

  private void testPossiblyUndefined(String php) {
    testWarning(php, POSSIBLY_UNDEFINED_VARIABLE);
  }

  // Straight-line code

  @Test
  public void testReadOfUnassignedVariable() {
    testWarning(
        "function f(){ $a = 1; echo $b; }", UNDEFINED_VARIABLE, "Undefined variable $b");
  }

  @Test
  public void testReadAfterAssignment() {
    testSame("$a = 1; echo $a;");
    testSame("function f(){ $y = 1; echo $y; }");
  }

  @Test
  public void testReadBeforeAssignment() {
    testUndefined("echo $a; $a = 1;");
  }

  @Test
  public void testEveryBadReadIsReported() {
    testWarnings("echo $a; echo $a;", UNDEFINED_VARIABLE, UNDEFINED_VARIABLE);
  }

  @Test
  public void testDiagnosticLocation() {
    PhpError error = testWarning("function f() {\n  echo $b;\n}", UNDEFINED_VARIABLE);
    assertThat(error.sourceName()).isEqualTo(FILE_NAME);
    assertThat(error.lineno()).isEqualTo(2);
    assertThat(error.column()).isEqualTo(8);
    assertThat(error.length()).isEqualTo(2);
    assertThat(error.rule()).isEqualTo("undefined.variable");
    assertThat(error.identifier()).isEqualTo("variable.undefined");
  }

  @Test
  public void testColumnOnFirstLine() {
    PhpError error = testWarning("echo $b;", UNDEFINED_VARIABLE);
    assertThat(error.lineno()).isEqualTo(1);
    assertThat(error.column()).isEqualTo(OPEN_TAG.length() + 6);
  }

  @Test
  public void testAnalysisIsRepeatable() {
    String php = "function f($flag){ if ($flag) { $a = 1; } echo $a, $b; }";
    ImmutableList<PhpError> first = check(php);
    ImmutableList<PhpError> second = check(php);
    assertThat(first).hasSize(2);
    assertThat(second).isEqualTo(first);
  }

  // Ambient names and special variables

  @Test
  public void testSuperglobals() {
    testSame("echo $_GET['x'], $_POST['y'], $_SERVER['argv'], $argv[0], $GLOBALS['z'];");
    testSame("function f() { return $_SESSION['user']; }");
  }

  @Test
  public void testSuperglobalsNotVisibleInClosures() {
    testUndefined("$f = function() { return $_SERVER; };");
  }

  @Test
  public void testCustomSuperglobals() {
    getOptions().setSuperglobals(ImmutableList.of("$app"));
    testSame("echo $app;");
    testUndefined("echo $_GET;");
  }

  @Test
  public void testVariableVariables() {
    testSame("$name = 'x'; echo $$name;");
    testSame("$$name2 = 1;");
    testSame("echo ${'a' . 'b'};");
  }

  @Test
  public void testStringsAreOpaque() {
    testSame("echo \"Hello $who\";");
    testSame("echo <<<EOT\nHello $who\nEOT;\n");
  }

  @Test
  public void testStaticProperty() {
    testSame("echo Foo::$bar;");
  }

  // Functions, methods and closures

  @Test
  public void testParameters() {
    testSame("function f($a, &$b, ...$c) { return $a . $b . count($c); }");
    testSame("function f(array $a = [], ?int $b = null) { return $a[$b]; }");
  }

  @Test
  public void testFunctionBodyIsItsOwnScope() {
    testUndefined("function f() { $local = 1; } echo $local;");
  }

  @Test
  public void testNestedFunctionSeesEnclosingScope() {
    testSame("function outer() { $a = 1; function inner() { return $a; } }");
  }

  @Test
  public void testThisInMethod() {
    testSame("class A { private $x; public function f() { return $this->x; } }");
    testSame("class A { public static function f() { return $this; } }");
  }

  @Test
  public void testThisOutsideClass() {
    testUndefined("function f() { return $this; }");
  }

  @Test
  public void testAbstractMethodsAndInterfaces() {
    testSame("abstract class A { abstract public function f($x); }");
    testSame("interface I { public function f(); }");
  }

  @Test
  public void testMethodScopesAreSeparate() {
    testUndefined(
        "class A { function f() { $a = 1; } function g() { return $a; } }");
  }

  @Test
  public void testClosureIsolation() {
    testWarning(
        "function f(){ $y = 1; $fn = function() { echo $y; }; }",
        UNDEFINED_VARIABLE,
        "Undefined variable $y");
  }

  @Test
  public void testClosureDoesNotLeak() {
    testUndefined("$f = function() { $inner = 1; }; echo $inner;");
  }

  @Test
  public void testClosureParameters() {
    testSame("$f = function($x) { return $x; };");
  }

  @Test
  public void testClosureUse() {
    testSame("function f() { $y = 1; $g = function() use ($y) { return $y; }; }");
  }

  @Test
  public void testClosureUseIsNotChecked() {
    testSame("$g = function() use ($nope) { return $nope; };");
  }

  @Test
  public void testClosureUseByReferenceDefinesOuterVariable() {
    testSame("$g = function() use (&$total) { $total = 1; }; echo $total;");
  }

  @Test
  public void testNestedClosureDoesNotSeeOuterUse() {
    testUndefined("$f = function() use ($a) { return function() { return $a; }; };");
  }

  @Test
  public void testClosureInMethodBindsThis() {
    testSame("class A { public function f() { return function() { return $this; }; } }");
    testSame("class A { public function f() { return array_map(fn($x) => $this->g($x), []); } }");
  }

  @Test
  public void testStaticClosureHasNoThis() {
    testUndefined(
        "class A { public function f() { return static function() { return $this; }; } }");
  }

  @Test
  public void testClosureDoesNotSeeEnclosingConditions() {
    PhpError error =
        testWarning(
            "function f($c) { if ($c) { $v = 1; }"
                + " if ($c) { $g = function() { echo $v; }; } }",
            UNDEFINED_VARIABLE,
            "Undefined variable $v");
    assertThat(error.column()).isEqualTo(OPEN_TAG.length() + 71);
  }

  @Test
  public void testClosureConditionsDoNotLeakOut() {
    testUndefined(
        "function f($c) { $g = function($c) { if ($c) { $v = 2; } }; if ($c) { echo $v; } }");
  }

  @Test
  public void testArrowFunction() {
    testSame("function f() { $m = 2; $g = fn($x) => $x * $m; }");
    testUndefined("$g = fn($x) => $x * $m;");
  }

  @Test
  public void testArrowFunctionParametersStayDefined() {
    testSame("function f() { $g = fn($x) => $x; return $x; }");
  }

  // Branches

  @Test
  public void testPartialAssignment() {
    testWarning(
        "function f($flag){ if ($flag) { $a = 1; } echo $a; }",
        POSSIBLY_UNDEFINED_VARIABLE,
        "Variable $a might not be defined.");
  }

  @Test
  public void testAssignmentInBothBranches() {
    testSame("function f($flag){ if ($flag) { $a = 1; } else { $a = 2; } echo $a; }");
  }

  @Test
  public void testAssignmentInOneBranchOfTwo() {
    testPossiblyUndefined(
        "function f($n) { if ($n) { $a = 1; $b = 1; } else { $a = 2; } return $a + $b; }");
  }

  @Test
  public void testElseIfChain() {
    testSame(
        "function f($n) { if ($n > 1) { $a = 1; } elseif ($n > 0) { $a = 2; } else { $a = 3; }"
            + " return $a; }");
    testPossiblyUndefined(
        "function f($n) { if ($n > 1) { $a = 1; } elseif ($n > 0) { $a = 2; } return $a; }");
  }

  @Test
  public void testElseIf() {
    testSame(
        "function f($n) { if ($n > 1) { $a = 1; } else if ($n > 0) { $a = 2; } else { $a = 3; }"
            + " return $a; }");
  }

  @Test
  public void testAlternativeSyntax() {
    testSame("function f($c) { if ($c): $b = 1; else: $b = 2; endif; echo $b; }");
  }

  @Test
  public void testAssignmentInCondition() {
    testSame("function f() { if ($row = fetch()) { echo $row; } return $row; }");
  }

  @Test
  public void testExitingBranchIsNotMerged() {
    testUndefined("function f($x) { if ($x) { $a = 1; return; } return $a; }");
    testSame("function f($x) { if ($x) { return; } else { $a = 1; } return $a; }");
  }

  @Test
  public void testPossiblyDefinedSurvivesBranches() {
    testPossiblyUndefined(
        "function f($x, $items) { if ($x) { foreach ($items as $i) { $a = $i; } } return $a; }");
  }

  // Guard idioms

  @Test
  public void testNegatedIssetAssignment() {
    testSame("function f(){ if (!isset($x)) { $x = 5; } echo $x; }");
  }

  @Test
  public void testNegatedIssetEarlyExit() {
    testSame("if (!isset($config)) { throw new Exception('missing'); } echo $config;");
    testSame("function f() { if (!isset($a) || !isset($b)) { return; } return $a + $b; }");
  }

  @Test
  public void testIsNullEarlyExit() {
    testPossiblyUndefined(
        "function f($flag) { if ($flag) { $v = 1; } if (is_null($v)) { die('no'); } return $v; }");
    testPossiblyUndefined(
        "function f($flag) { if ($flag) { $v = 1; } if (\\IS_NULL($v)) { exit; } return $v; }");
  }

  @Test
  public void testFalsyEarlyExit() {
    testPossiblyUndefined(
        "function f($flag) { if ($flag) { $v = 1; } if (!$v) { return null; } return $v; }");
  }

  @Test
  public void testExitMethodCall() {
    testSame(
        "class C { public function f() { if (!isset($v)) { $this->redirectAndExit(); }"
            + " return $v; } }");
    testSame("function f() { if (!isset($v)) { Response::sendAndExit(); } return $v; }");
  }

  @Test
  public void testCustomExitMethodSuffix() {
    getOptions().setExitMethodSuffix("Halt");
    testUndefined(
        "class C { public function f() { if (!isset($v)) { $this->redirectAndExit(); }"
            + " return $v; } }");
  }

  @Test
  public void testBreakIsNotAnExit() {
    testUndefined(
        "function f($items) { foreach ($items as $i) { if (!isset($found)) { break; } }"
            + " return $found; }");
  }

  @Test
  public void testNestedIfThatAlwaysExits() {
    testSame(
        "function f($a) { if (!isset($v)) { if ($a) { return 1; } else { throw new E(); } }"
            + " return $v; }");
    testUndefined(
        "function f($a) { if (!isset($v)) { if ($a) { return 1; } } return $v; }");
  }

  @Test
  public void testIssetGuardsThenBranch() {
    testSame("function f() { if (isset($row['id'])) { return $row['id']; } return null; }");
    testSame("function f() { if (isset($a, $b)) { return $a . $b; } }");
    testSame("function f() { if (!empty($opts) && $opts['debug']) { echo $opts['debug']; } }");
  }

  @Test
  public void testIssetAssumptionIsRetracted() {
    testUndefined("function f() { if (isset($a)) { echo $a; } echo $a; }");
    testUndefined("function f() { if (isset($x)) { echo 1; } else { echo $x; } }");
  }

  @Test
  public void testNegatedIssetGuardsElse() {
    testSame("function f() { if (!isset($x)) { echo 'none'; } else { echo $x; } }");
    testSame(
        "function f() { if (!isset($x)) { echo 'none'; } elseif ($x > 1) { echo $x; } }");
  }

  // Condition correlation

  @Test
  public void testSameCondition() {
    testSame(
        "function f($debug) { if ($debug) { $start = microtime(true); } run();"
            + " if ($debug) { echo microtime(true) - $start; } }");
  }

  @Test
  public void testSameConditionIgnoresWhitespace() {
    testSame("function f($a) { if ($a > 1) { $b = 1; } if ($a>1) { echo $b; } }");
  }

  @Test
  public void testDifferentCondition() {
    testPossiblyUndefined("function f($a) { if ($a > 1) { $b = 1; } if ($a > 2) { echo $b; } }");
  }

  @Test
  public void testSameConditionInTernary() {
    testSame(
        "function f($debug) { if ($debug) { $start = 1; } return $debug ? $start : 0; }");
  }

  @Test
  public void testInverseCondition() {
    testSame("function f($x) { if ($x) { $a = 1; } if (!$x) { $a = 2; } return $a; }");
    testSame("function f($x, $y) { if ($x) { $a = 1; } if (!$x || $y) { $a = 2; } return $a; }");
    testPossiblyUndefined(
        "function f($x, $y) { if ($x) { $a = 1; } if ($y) { $a = 2; } return $a; }");
  }

  @Test
  public void testInverseConditionInShortCircuit() {
    testSame("function f($x) { if ($x) { $a = 1; } return !$x || $a > 0; }");
  }

  // Expressions

  @Test
  public void testTernary() {
    testSame("function f() { return isset($v) ? $v : null; }");
    testPossiblyUndefined("function f() { if (rand()) { $v = 1; } return $v ? $v : 0; }");
  }

  @Test
  public void testShortTernary() {
    testSame("function f() { if (rand()) { $v = 1; } return $v ?: 0; }");
    testUndefined("function f() { return $v ?: $w; }");
  }

  @Test
  public void testCoalesce() {
    testSame("function f() { return $v ?? 'default'; }");
    testSame("function f() { return $config['a']['b'] ?? null; }");
    testSame("function f() { return $o?->p->q ?? null; }");
    testWarning("function f() { return $a ?? $b; }", UNDEFINED_VARIABLE, "Undefined variable $b");
    testWarning("function f() { return g($x) ?? 1; }", UNDEFINED_VARIABLE, "Undefined variable $x");
  }

  @Test
  public void testCoalesceAssignment() {
    testSame("function f() { $v ??= 1; return $v; }");
    testSame("function f() { $cache['k'] ??= compute(); return $cache; }");
  }

  @Test
  public void testAnd() {
    testSame("function f() { return isset($a) && $a > 0; }");
    testUndefined("function f() { return $a && isset($a); }");
  }

  @Test
  public void testOr() {
    testSame("function f() { if (!isset($a) || $a < 0) { return 0; } return $a; }");
    testUndefined("function f() { return isset($a) || $a; }");
  }

  @Test
  public void testIssetEmptyUnsetAreNotReads() {
    testSame("if (isset($a) || empty($b)) {} unset($c);");
  }

  @Test
  public void testCompoundAssignment() {
    testSame("$total .= 'x'; echo $total;");
    testUndefined("$total += $delta;");
  }

  @Test
  public void testIncrement() {
    testUndefined("$n++;");
    testWarnings("$n++; echo $n; --$m; echo $m;", UNDEFINED_VARIABLE, UNDEFINED_VARIABLE);
  }

  @Test
  public void testReferenceAssignment() {
    testSame("$a = &$b; echo $a, $b;");
    testSame("$a = &$arr['k']; echo $a, $arr;");
  }

  @Test
  public void testArrayAppend() {
    testSame("$list[] = 1; echo count($list);");
    testSame("$m['a']['b'] = 1; return $m;");
    testUndefined("$a[$i] = 1;");
  }

  @Test
  public void testPropertyAssignmentReadsObject() {
    testUndefined("$obj->name = 'x';");
    testSame("$obj = new Foo(); $obj->name = 'x'; $obj->items[] = 1;");
  }

  @Test
  public void testDestructuring() {
    testSame(
        "[$a, [$b, $c]] = f(); list($d, , $e) = g(); ['x' => $x] = h();"
            + " echo $a, $b, $c, $d, $e, $x;");
    testUndefined("[$a, $b] = [$b, 1];");
  }

  @Test
  public void testArrayLiteralByReference() {
    testSame("$refs = [&$slot]; echo $slot;");
  }

  @Test
  public void testMatch() {
    testUndefined("function f($k) { return match ($k) { 1, 2 => 'a', default => $other }; }");
  }

  @Test
  public void testReadsInsideExpressions() {
    testWarnings(
        "echo f($a)->g($b)[$c] . new Foo($d) . (string) $e . -$f;",
        UNDEFINED_VARIABLE,
        UNDEFINED_VARIABLE,
        UNDEFINED_VARIABLE,
        UNDEFINED_VARIABLE,
        UNDEFINED_VARIABLE,
        UNDEFINED_VARIABLE);
  }

  // By-reference parameters

  @Test
  public void testByReferenceFunctions() {
    testSame("function f($s) { preg_match('/a/', $s, $m); return $m[0]; }");
    testSame("function f($s) { \\PREG_MATCH_ALL('/a/', $s, $m); return $m; }");
    testSame("function f($s) { parse_str($s, $out); return $out; }");
    testSame("function f() { if (headers_sent($file, $line)) { echo $file, $line; } }");
    testSame("function f() { exec('ls', $output, $status); return [$output, $status]; }");
  }

  @Test
  public void testUnknownFunctionArgumentsAreReads() {
    testUndefined("function f($s) { my_match('/a/', $s, $m); }");
  }

  @Test
  public void testCustomByReferenceFunctions() {
    getOptions().setByReferenceParameters(ImmutableSetMultimap.of("My_Match", 2));
    testSame("function f($s) { my_match('/a/', $s, $m); return $m; }");
  }

  // Loops

  @Test
  public void testWhileBodyMayNotRun() {
    testPossiblyUndefined("function f($n) { while ($n-- > 0) { $last = $n; } return $last; }");
  }

  @Test
  public void testWhileConditionAlwaysRuns() {
    testSame("function f($h) { while ($line = fgets($h)) { echo $line; } return $line; }");
  }

  @Test
  public void testFor() {
    testPossiblyUndefined(
        "function f() { for ($i = 0; $i < 10; $i++) { $x = $i; } return $i + $x; }");
  }

  @Test
  public void testForeach() {
    testWarning(
        "function f(array $items) { foreach ($items as $k => $v) { $last = $v; }"
            + " return $k . $v . $last; }",
        POSSIBLY_UNDEFINED_VARIABLE,
        "Variable $last might not be defined.");
  }

  @Test
  public void testForeachTargets() {
    testSame("function f($items) { foreach ($items as &$item) { $item++; } }");
    testSame("function f($pairs) { foreach ($pairs as [$a, $b]) { echo $a + $b; } }");
    testSame("function f($rows) { foreach ($rows as list('id' => $id)) { echo $id; } }");
    testSame("function f($rows) { foreach ($rows as $row['copy']) { echo 1; } return $row; }");
  }

  @Test
  public void testReadBeforeAssignmentInLoop() {
    testUndefined("function f($items) { foreach ($items as $i) { echo $prev; $prev = $i; } }");
  }

  @Test
  public void testDoWhileBodyAlwaysRuns() {
    testSame("function f() { do { $x = next_value(); } while ($x > 0); return $x; }");
  }

  // Switch

  @Test
  public void testSwitchWithDefault() {
    testSame(
        "function f($k) { switch ($k) { case 1: $v = 'a'; break; case 2: $v = 'b'; break;"
            + " default: $v = 'c'; } return $v; }");
  }

  @Test
  public void testSwitchWithoutDefault() {
    testPossiblyUndefined(
        "function f($k) { switch ($k) { case 1: $v = 'a'; break; case 2: $v = 'b'; break; }"
            + " return $v; }");
  }

  @Test
  public void testSwitchExitingCase() {
    testSame(
        "function f($k) { switch ($k) { case 1: $v = 'a'; break; default: throw new E(); }"
            + " return $v; }");
  }

  @Test
  public void testSwitchFallThrough() {
    testSame(
        "function f($k) { switch ($k) { case 1: case 2: $v = 1; break; default: $v = 2; }"
            + " return $v; }");
  }

  @Test
  public void testSwitchWithEmptyTrailingDefault() {
    testPossiblyUndefined(
        "function f($k) { switch ($k) { case 1: $v = 1; break; default: } return $v; }");
  }

  @Test
  public void testSwitchWithEmptyTrailingCase() {
    testPossiblyUndefined(
        "function f($k) { switch ($k) { default: $v = 1; break; case 2: } return $v; }");
  }

  @Test
  public void testThrowExpression() {
    testSame("function f($b) { $v = $b ?? throw new E(); return $v; }");
    testUndefined("function f() { return fn() => throw new E($missing); }");
  }

  @Test
  public void testSwitchCaseExpressionsAreReads() {
    testUndefined("function f($k) { switch ($k) { case $other: break; } }");
  }

  // Try, global, static

  @Test
  public void testTryCatch() {
    testSame(
        "function f() { try { $r = g(); } catch (Exception $e) { log_error($e->getMessage()); }"
            + " return $r; }");
    testSame("function f() { try { g(); } catch (A | B) { h(); } finally { $done = 1; } }");
  }

  @Test
  public void testGlobalAndStatic() {
    testSame("function f() { global $db; static $count = 0, $cache; $count++; return $db; }");
    testUndefined("function f() { static $x = 0; return $y; }");
  }
}
