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

/**
 * Tests for {@link AlignmentEngine}: document-wide trailing comment
 * alignment and block-local assignment alignment.
 */
class AlignmentEngineTests {

	// ------------------------------------------------------------------
	// Trailing comments
	// ------------------------------------------------------------------

	@Test
	void testCommentsStartOnePastWidestCode() {
		List<String> aligned = AlignmentEngine.alignTrailingComments(
				Arrays.asList("let a = 1 // one", "let bb = 22  // two", "x"), 2);
		Assertions.assertEquals(Arrays.asList("let a = 1   // one", "let bb = 22 // two", "x"), aligned);
	}

	@Test
	void testCommentAlignmentSpansWholeDocument() {
		List<String> aligned = AlignmentEngine.alignTrailingComments(
				Arrays.asList("a // x", "", "longer_code // y"), 2);
		Assertions.assertEquals("a" + " ".repeat(11) + "// x", aligned.get(0));
		Assertions.assertEquals("longer_code // y", aligned.get(2));
	}

	@Test
	void testWholeLineCommentsAreNotMoved() {
		List<String> lines = Arrays.asList("  // header", "value // note");
		List<String> aligned = AlignmentEngine.alignTrailingComments(lines, 2);
		Assertions.assertEquals("  // header", aligned.get(0));
		Assertions.assertEquals("value // note", aligned.get(1));
	}

	@Test
	void testInlineBlockCommentIsNotTrailing() {
		List<String> lines = Arrays.asList("a /* b */ c", "dd // e");
		Assertions.assertEquals(lines, AlignmentEngine.alignTrailingComments(lines, 2));
	}

	@Test
	void testTabsCountByVisualWidth() {
		List<String> aligned = AlignmentEngine.alignTrailingComments(
				Arrays.asList("\tx // a", "abcdef // b"), 4);
		Assertions.assertEquals("\tx" + "  " + "// a", aligned.get(0));
	}

	// ------------------------------------------------------------------
	// Equals
	// ------------------------------------------------------------------

	@Test
	void testContiguousAssignmentsAlign() {
		List<String> aligned = AlignmentEngine.alignEquals(Arrays.asList("x = 1", "longname = 2"), 2);
		Assertions.assertEquals(Arrays.asList("x" + " ".repeat(8) + "= 1", "longname = 2"), aligned);
	}

	@Test
	void testBlankLineBreaksBlock() {
		List<String> lines = Arrays.asList("x = 1", "", "longname = 2");
		Assertions.assertEquals(lines, AlignmentEngine.alignEquals(lines, 2));
	}

	@Test
	void testIndentedBlock() {
		List<String> aligned = AlignmentEngine.alignEquals(Arrays.asList("  a = 1", "  bcd = 2"), 2);
		Assertions.assertEquals(Arrays.asList("  a   = 1", "  bcd = 2"), aligned);
	}

	@Test
	void testCompoundOperatorsAreNotAnchors() {
		List<String> lines = Arrays.asList("a += 1", "bb = 2", "if a == b", "c => d");
		Assertions.assertEquals(lines, AlignmentEngine.alignEquals(lines, 2));
	}

	@Test
	void testEqualsInsideStringIgnored() {
		List<String> aligned = AlignmentEngine.alignEquals(Arrays.asList("s = \"a=b\"", "tt = 1"), 2);
		Assertions.assertEquals(Arrays.asList("s  = \"a=b\"", "tt = 1"), aligned);
	}

	@Test
	void testEmptyRightHandSide() {
		List<String> aligned = AlignmentEngine.alignEquals(Arrays.asList("a =", "bb = 2"), 2);
		Assertions.assertEquals(Arrays.asList("a  =", "bb = 2"), aligned);
	}

	@Test
	void testAlignedBlockIsStable() {
		List<String> once = AlignmentEngine.alignEquals(Arrays.asList("x=1", "yyy   =  2"), 2);
		Assertions.assertEquals(once, AlignmentEngine.alignEquals(once, 2));
	}

	@Test
	void testFindAssignment() {
		Assertions.assertEquals(11, AlignmentEngine.findAssignment("let x: int = 5"));
		Assertions.assertEquals(-1, AlignmentEngine.findAssignment("a != b"));
		Assertions.assertEquals(-1, AlignmentEngine.findAssignment("f(\"=\")"));
		Assertions.assertEquals(-1, AlignmentEngine.findAssignment("// a = b"));
		Assertions.assertEquals(-1, AlignmentEngine.findAssignment("   "));
	}
}
