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

import com.tomaszrup.vittels.format.StyleOptions.QuoteStyle;

class QuoteNormalizerTests {

	@Test
	void testSingleToDouble() {
		Assertions.assertEquals("x = \"hi\"", QuoteNormalizer.normalize("x = 'hi'", QuoteStyle.DOUBLE));
	}

	@Test
	void testDoubleToSingle() {
		Assertions.assertEquals("f('a', 'b')", QuoteNormalizer.normalize("f(\"a\", 'b')", QuoteStyle.SINGLE));
	}

	@Test
	void testLiteralHoldingTargetQuoteIsKept() {
		String line = "s = 'she said \"hi\"'";
		Assertions.assertEquals(line, QuoteNormalizer.normalize(line, QuoteStyle.DOUBLE));
		Assertions.assertEquals("\"it's\"", QuoteNormalizer.normalize("\"it's\"", QuoteStyle.SINGLE));
	}

	@Test
	void testUnterminatedLiteralIsKept() {
		Assertions.assertEquals("x = 'abc", QuoteNormalizer.normalize("x = 'abc", QuoteStyle.DOUBLE));
	}

	@Test
	void testCommentsAreKept() {
		String line = "x = 'a' // 'quoted'";
		Assertions.assertEquals("x = \"a\" // 'quoted'", QuoteNormalizer.normalize(line, QuoteStyle.DOUBLE));
	}

	@Test
	void testPreserveReturnsInput() {
		String line = "f('a', \"b\")";
		Assertions.assertSame(line, QuoteNormalizer.normalize(line, QuoteStyle.PRESERVE));
	}
}
