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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BlankLineLimiterTests {

	@Test
	void testFiveBlankLinesCappedAtTwo() {
		Assertions.assertEquals(Arrays.asList("a", "", "", "b"),
				BlankLineLimiter.limit(Arrays.asList("a", "", "", "", "", "", "b"), 2));
	}

	@Test
	void testShortRunsAreKept() {
		Assertions.assertEquals(Arrays.asList("a", "", "b", "", "", "c"),
				BlankLineLimiter.limit(Arrays.asList("a", "", "b", "", "", "c"), 2));
	}

	@Test
	void testZeroRemovesBlankLines() {
		Assertions.assertEquals(Arrays.asList("a", "b"),
				BlankLineLimiter.limit(Arrays.asList("a", "", "b", ""), 0));
	}

	@Test
	void testWhitespaceOnlyLinesComeOutEmpty() {
		Assertions.assertEquals(Arrays.asList("a", "", "b"),
				BlankLineLimiter.limit(Arrays.asList("a", " \t", "b"), 2));
	}
}
