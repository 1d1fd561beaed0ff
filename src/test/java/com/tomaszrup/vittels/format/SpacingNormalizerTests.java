////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vittels.format;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.vittels.format.StyleOptions.ColonSpacing;

/**
 * Tests for {@link SpacingNormalizer}. Operators, commas and colons are
 * covered separately, then together through {@code normalize}.
 */
class SpacingNormalizerTests {

	// ------------------------------------------------------------------
	// Operators
	// ------------------------------------------------------------------

	@Test
	void testBinaryOperatorsGetOneSpaceEachSide() {
		Assertions.assertEquals("a = b + c", SpacingNormalizer.spaceOperators("a=b+c"));
		Assertions.assertEquals("a = b + c", SpacingNormalizer.spaceOperators("a  =   b  +c"));
	}

	@Test
	void testLongestOperatorWins() {
		Assertions.assertEquals("x === y", SpacingNormalizer.spaceOperators("x===y"));
		Assertions.assertEquals("x >>>= 2", SpacingNormalizer.spaceOperators("x>>>=2"));
		Assertions.assertEquals("a <= b && c != d", SpacingNormalizer.spaceOperators("a<=b&&c!=d"));
	}

	@Test
	void testArrowOperators() {
		Assertions.assertEquals("(a) => a", SpacingNormalizer.spaceOperators("(a)=>a"));
		Assertions.assertEquals("fn f() -> int", SpacingNormalizer.spaceOperators("fn f()->int"));
	}

	@Test
	void testTightOperatorsStayTight() {
		Assertions.assertEquals("i++", SpacingNormalizer.spaceOperators("i++"));
		Assertions.assertEquals("mod::item", SpacingNormalizer.spaceOperators("mod::item"));
		Assertions.assertEquals("user?.name", SpacingNormalizer.spaceOperators("user?.name"));
		Assertions.assertEquals("for i in 0..10", SpacingNormalizer.spaceOperators("for i in 0..10"));
		Assertions.assertEquals("f(...args)", SpacingNormalizer.spaceOperators("f(...args)"));
	}

	@Test
	void testPrefixMinusStaysAttached() {
		Assertions.assertEquals("x = -1", SpacingNormalizer.spaceOperators("x=-1"));
		Assertions.assertEquals("x = -1", SpacingNormalizer.spaceOperators("x = - 1"));
		Assertions.assertEquals("f(-a, b)", SpacingNormalizer.spaceOperators("f(-a, b)"));
		Assertions.assertEquals("return -x", SpacingNormalizer.spaceOperators("return -x"));
	}

	@Test
	void testPrefixAtStartOfBodyIsLeftAlone() {
		Assertions.assertEquals("*ptr = 1", SpacingNormalizer.spaceOperators("*ptr=1"));
		Assertions.assertEquals("-x", SpacingNormalizer.spaceOperators("-x"));
	}

	@Test
	void testNegationIsTight() {
		Assertions.assertEquals("a && !b", SpacingNormalizer.spaceOperators("a&&!b"));
		Assertions.assertEquals("!done", SpacingNormalizer.spaceOperators("!done"));
	}

	@Test
	void testExponentSignIsNotAnOperator() {
		Assertions.assertEquals("x = 1.5e-3", SpacingNormalizer.spaceOperators("x=1.5e-3"));
		Assertions.assertEquals("x = e - 3", SpacingNormalizer.spaceOperators("x=e-3"));
	}

	@Test
	void testOperatorsInStringsAndCommentsUntouched() {
		Assertions.assertEquals("s = \"a+b==c\" // x=y", SpacingNormalizer.spaceOperators("s=\"a+b==c\" // x=y"));
	}

	@Test
	void testSpacedOperatorsAreStable() {
		String spaced = "let total = a * (b - c) / 2";
		Assertions.assertEquals(spaced, SpacingNormalizer.spaceOperators(spaced));
	}

	@Test
	void testPrefixOperatorKeepsSpaceBeforeOperatorItWouldMergeWith() {
		Assertions.assertEquals("let x = - -y", SpacingNormalizer.spaceOperators("let x = - -y"));
		Assertions.assertEquals("x1 == & &;", SpacingNormalizer.spaceOperators("x1==& &;"));
		Assertions.assertEquals("x1 == & &;", SpacingNormalizer.spaceOperators("x1 == & &;"));
	}

	@Test
	void testPrefixOperatorStillHugsOperand() {
		Assertions.assertEquals("let x = -y", SpacingNormalizer.spaceOperators("let x = - y"));
	}

	// ------------------------------------------------------------------
	// Commas
	// ------------------------------------------------------------------

	@Test
	void testCommaFollowedByOneSpace() {
		Assertions.assertEquals("f(a, b, c)", SpacingNormalizer.spaceCommas("f(a,b ,  c)"));
	}

	@Test
	void testNoSpaceBeforeClosingBracketOrComma() {
		Assertions.assertEquals("[1, 2,]", SpacingNormalizer.spaceCommas("[1,2,]"));
		Assertions.assertEquals("(a,,)", SpacingNormalizer.spaceCommas("(a,,)"));
	}

	@Test
	void testCommaInsideStringUntouched() {
		Assertions.assertEquals("f(\"a,b\", c)", SpacingNormalizer.spaceCommas("f(\"a,b\",c)"));
	}

	// ------------------------------------------------------------------
	// Colons
	// ------------------------------------------------------------------

	@Test
	void testColonModes() {
		Assertions.assertEquals("a: int", SpacingNormalizer.spaceColons("a :int", ColonSpacing.RIGHT));
		Assertions.assertEquals("a :int", SpacingNormalizer.spaceColons("a: int", ColonSpacing.LEFT));
		Assertions.assertEquals("a : int", SpacingNormalizer.spaceColons("a:int", ColonSpacing.BOTH));
		Assertions.assertEquals("a:int", SpacingNormalizer.spaceColons("a:int", ColonSpacing.NONE));
	}

	@Test
	void testScopeAndWalrusColonsUntouched() {
		Assertions.assertEquals("std::io", SpacingNormalizer.spaceColons("std::io", ColonSpacing.BOTH));
		Assertions.assertEquals("x := 1", SpacingNormalizer.spaceColons("x := 1", ColonSpacing.RIGHT));
		Assertions.assertEquals("a ?: b", SpacingNormalizer.spaceColons("a ?: b", ColonSpacing.RIGHT));
	}

	@Test
	void testLeftColonKeepsSpaceBeforeEquals() {
		Assertions.assertEquals("c ? a : =b", SpacingNormalizer.spaceColons("c ? a : =b", ColonSpacing.LEFT));
		Assertions.assertEquals("c ? a : = b", SpacingNormalizer.spaceColons("c ? a :\t= b", ColonSpacing.LEFT));
	}

	@Test
	void testRightColonKeepsSpaceAfterQuestionMark() {
		Assertions.assertEquals("a ? : b", SpacingNormalizer.spaceColons("a ? : b", ColonSpacing.RIGHT));
	}

	@Test
	void testColonInsideStringUntouched() {
		Assertions.assertEquals("{k: \"a:b\"}", SpacingNormalizer.spaceColons("{k:\"a:b\"}", ColonSpacing.RIGHT));
	}

	// ------------------------------------------------------------------
	// normalize()
	// ------------------------------------------------------------------

	@Test
	void testNormalizeAppliesAllRules() {
		Assertions.assertEquals("fn add(a: int, b: int) -> int {",
				SpacingNormalizer.normalize("fn add(a:int,b:int)->int {", StyleOptions.defaults()));
	}

	@Test
	void testNormalizeKeepsStringLiteral() {
		String body = "let s = \"a,b:c{d}\"";
		Assertions.assertEquals(body, SpacingNormalizer.normalize(body, StyleOptions.defaults()));
	}

	@Test
	void testNormalizeWithEverythingDisabled() {
		StyleOptions off = StyleOptions.builder()
				.spaceAroundOperators(false)
				.spaceAfterComma(false)
				.colonSpacing(ColonSpacing.NONE)
				.build();
		Assertions.assertEquals("f(a,b:c)=1", SpacingNormalizer.normalize("f(a,b:c)=1", off));
	}
}
