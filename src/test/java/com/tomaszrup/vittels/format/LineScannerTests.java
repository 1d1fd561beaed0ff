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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.vittels.format.LineSegment.Kind;

/**
 * Tests for {@link LineScanner}: segment classification, escapes,
 * unterminated literals and the helpers built on top of the scan.
 */
class LineScannerTests {

	private static LineSegment segment(Kind kind, String text, boolean terminated) {
		return new LineSegment(kind, text, terminated);
	}

	// ------------------------------------------------------------------
	// scan()
	// ------------------------------------------------------------------

	@Test
	void testScanCodeStringAndLineComment() {
		List<LineSegment> segments = LineScanner.scan("let s = \"a,b\" // note");
		Assertions.assertEquals(Arrays.asList(
				LineSegment.code("let s = "),
				segment(Kind.STRING, "\"a,b\"", true),
				LineSegment.code(" "),
				segment(Kind.COMMENT, "// note", true)), segments);
	}

	@Test
	void testScanEscapedQuoteStaysInString() {
		List<LineSegment> segments = LineScanner.scan("x = \"a\\\"b\" + 1");
		Assertions.assertEquals(segment(Kind.STRING, "\"a\\\"b\"", true), segments.get(1));
		Assertions.assertEquals(LineSegment.code(" + 1"), segments.get(2));
	}

	@Test
	void testScanOtherQuoteInsideString() {
		List<LineSegment> segments = LineScanner.scan("'say \"hi\"'");
		Assertions.assertEquals(1, segments.size());
		Assertions.assertEquals('\'', segments.get(0).quote());
	}

	@Test
	void testScanUnterminatedStringRunsToEndOfLine() {
		List<LineSegment> segments = LineScanner.scan("s = 'abc // no comment");
		Assertions.assertEquals(2, segments.size());
		Assertions.assertTrue(segments.get(1).isString());
		Assertions.assertFalse(segments.get(1).isTerminated());
		Assertions.assertEquals("'abc // no comment", segments.get(1).getText());
	}

	@Test
	void testScanBlockCommentInsideCode() {
		List<LineSegment> segments = LineScanner.scan("a /* b */ c");
		Assertions.assertEquals(Arrays.asList(
				LineSegment.code("a "),
				segment(Kind.COMMENT, "/* b */", true),
				LineSegment.code(" c")), segments);
	}

	@Test
	void testScanUnterminatedBlockComment() {
		List<LineSegment> segments = LineScanner.scan("a /* b");
		Assertions.assertEquals(segment(Kind.COMMENT, "/* b", false), segments.get(1));
	}

	@Test
	void testScanCommentMarkerInsideString() {
		List<LineSegment> segments = LineScanner.scan("url = \"http://vitte.dev\"");
		Assertions.assertEquals(2, segments.size());
		Assertions.assertFalse(segments.get(1).isComment());
	}

	@Test
	void testScanEmptyLine() {
		Assertions.assertTrue(LineScanner.scan("").isEmpty());
		Assertions.assertTrue(LineScanner.scan(null).isEmpty());
	}

	@Test
	void testJoinRebuildsLine() {
		String line = "f('x', \"y\") /* z */ + g() // tail";
		Assertions.assertEquals(line, LineScanner.join(LineScanner.scan(line)));
	}

	// ------------------------------------------------------------------
	// helpers
	// ------------------------------------------------------------------

	@Test
	void testStripStringsAndCodeOnly() {
		Assertions.assertEquals("x =  + ", LineScanner.stripStrings("x = 'a' + \"b\""));
		Assertions.assertEquals("x = 1 ", LineScanner.codeOnly("x = 1 // y"));
	}

	@Test
	void testSplitCodeAndTrailingComment() {
		LineScanner.CodeAndComment split = LineScanner.splitCodeAndComment("x = 1  // c");
		Assertions.assertTrue(split.hasComment());
		Assertions.assertEquals("x = 1  ", split.getCode());
		Assertions.assertEquals("// c", split.getComment());
	}

	@Test
	void testSplitKeepsInlineBlockCommentInCode() {
		LineScanner.CodeAndComment split = LineScanner.splitCodeAndComment("a /* b */ c");
		Assertions.assertFalse(split.hasComment());
		Assertions.assertEquals("a /* b */ c", split.getCode());
	}

	@Test
	void testSplitWholeLineComment() {
		LineScanner.CodeAndComment split = LineScanner.splitCodeAndComment("// only");
		Assertions.assertEquals("", split.getCode());
		Assertions.assertEquals("// only", split.getComment());
	}

	@Test
	void testRewriteCodeLeavesStringsAlone() {
		Assertions.assertEquals("A,B \"c,d\" // e,f",
				LineScanner.rewriteCode("a,b \"c,d\" // e,f", code -> code.toUpperCase()));
	}

	@Test
	void testNetBracketDeltaIgnoresStringsAndComments() {
		Assertions.assertEquals(1, LineScanner.netBracketDelta("f(a[1], \"(\") {"));
		Assertions.assertEquals(-1, LineScanner.netBracketDelta("} // {"));
		Assertions.assertEquals(0, LineScanner.netBracketDelta("(]"));
	}
}
