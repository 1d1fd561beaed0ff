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
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.vittels.format.StyleOptions.EndOfLine;

class LineModelTests {

	// --- split ---

	@Test
	void testSplitLf() {
		Assertions.assertEquals(Arrays.asList("a", "b"), LineModel.split("a\nb"));
	}

	@Test
	void testSplitCrlfWithTrailingTerminator() {
		Assertions.assertEquals(Arrays.asList("a", "b", ""), LineModel.split("a\r\nb\n"));
	}

	@Test
	void testSplitEmptyAndNull() {
		Assertions.assertEquals(Collections.singletonList(""), LineModel.split(""));
		Assertions.assertEquals(Collections.singletonList(""), LineModel.split(null));
	}

	@Test
	void testSplitKeepsBareCarriageReturn() {
		Assertions.assertEquals(Collections.singletonList("a\rb"), LineModel.split("a\rb"));
	}

	@Test
	void testSplitOnlyTerminator() {
		Assertions.assertEquals(Arrays.asList("", ""), LineModel.split("\r\n"));
	}

	// --- join ---

	@Test
	void testJoinUsesEndOfLine() {
		Assertions.assertEquals("a\r\nb\r\n", LineModel.join(Arrays.asList("a", "b", ""), EndOfLine.CRLF));
		Assertions.assertEquals("a\nb", LineModel.join(Arrays.asList("a", "b"), EndOfLine.LF));
	}

	// --- visualWidth ---

	@Test
	void testVisualWidthExpandsTabsToNextStop() {
		Assertions.assertEquals(6, LineModel.visualWidth("\tab", 4));
		Assertions.assertEquals(5, LineModel.visualWidth("a\tb", 4));
		Assertions.assertEquals(4, LineModel.visualWidth("ab\t", 2));
		Assertions.assertEquals(0, LineModel.visualWidth("", 4));
	}

	// --- whitespace helpers ---

	@Test
	void testIsBlank() {
		Assertions.assertTrue(LineModel.isBlank(""));
		Assertions.assertTrue(LineModel.isBlank(" \t "));
		Assertions.assertFalse(LineModel.isBlank("  x "));
	}

	@Test
	void testLeadingAndTrailingWhitespace() {
		Assertions.assertEquals(" \t", LineModel.leadingWhitespace(" \tx y \t"));
		Assertions.assertEquals(" \t", LineModel.trailingWhitespace(" \tx y \t"));
		Assertions.assertEquals("x y \t", LineModel.stripLeading(" \tx y \t"));
		Assertions.assertEquals(" \tx y", LineModel.stripTrailing(" \tx y \t"));
	}
}
