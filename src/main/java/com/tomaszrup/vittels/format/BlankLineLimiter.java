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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vittels.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Caps runs of consecutive blank lines. Lines holding only whitespace count
 * as blank.
 */
public final class BlankLineLimiter {

	private BlankLineLimiter() {
	}

	/**
	 * Keeps at most {@code maxBlank} blank lines per run. Kept blank lines
	 * come out empty.
	 */
	public static List<String> limit(List<String> lines, int maxBlank) {
		List<String> out = new ArrayList<>(lines.size());
		int run = 0;
		for (String line : lines) {
			if (LineModel.isBlank(line)) {
				run++;
				if (run <= maxBlank) {
					out.add("");
				}
			} else {
				run = 0;
				out.add(line);
			}
		}
		return out;
	}
}
