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

import com.tomaszrup.vittels.format.StyleOptions.QuoteStyle;

/**
 * Rewrites string delimiters to the preferred quote character when that
 * needs no extra escaping. Literals whose content already holds the target
 * quote, unterminated literals and anything inside comments stay as they are.
 */
public final class QuoteNormalizer {

	private QuoteNormalizer() {
	}

	public static String normalize(String line, QuoteStyle style) {
		if (style == QuoteStyle.PRESERVE) {
			return line;
		}
		char target = style == QuoteStyle.DOUBLE ? '"' : '\'';
		StringBuilder out = new StringBuilder();
		for (LineSegment segment : LineScanner.scan(line)) {
			String text = segment.getText();
			if (!segment.isString() || !segment.isTerminated() || segment.quote() == target) {
				out.append(text);
				continue;
			}
			String content = text.substring(1, text.length() - 1);
			if (content.indexOf(target) >= 0) {
				out.append(text);
			} else {
				out.append(target).append(content).append(target);
			}
		}
		return out.toString();
	}
}
