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

import com.tomaszrup.vittels.format.StyleOptions.EndOfLine;

/**
 * Line-level helpers shared by the formatting passes.
 *
 * <p>{@code \r\n} and {@code \n} both end a line. A bare {@code \r} that is
 * not followed by {@code \n} stays part of the line content.</p>
 */
public final class LineModel {

	private LineModel() {
	}

	/**
	 * Splits text into logical lines without terminators. Text ending in a
	 * line terminator yields a trailing empty line, so {@code "a\n"} becomes
	 * {@code ["a", ""]} and the empty string becomes {@code [""]}.
	 */
	public static List<String> split(String text) {
		List<String> lines = new ArrayList<>();
		if (text == null) {
			lines.add("");
			return lines;
		}
		int start = 0;
		int length = text.length();
		for (int i = 0; i < length; i++) {
			if (text.charAt(i) == '\n') {
				int end = i;
				if (end > start && text.charAt(end - 1) == '\r') {
					end--;
				}
				lines.add(text.substring(start, end));
				start = i + 1;
			}
		}
		lines.add(text.substring(start));
		return lines;
	}

	public static String join(List<String> lines, EndOfLine endOfLine) {
		return String.join(endOfLine.sequence(), lines);
	}

	/** Width of {@code s} in columns, with tab stops every {@code tabSize} columns. */
	public static int visualWidth(CharSequence s, int tabSize) {
		int width = 0;
		for (int i = 0; i < s.length(); i++) {
			if (s.charAt(i) == '\t') {
				width += tabSize - (width % tabSize);
			} else {
				width++;
			}
		}
		return width;
	}

	public static boolean isBlank(String line) {
		for (int i = 0; i < line.length(); i++) {
			if (!Character.isWhitespace(line.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	static boolean isIndentChar(char c) {
		return c == ' ' || c == '\t';
	}

	/** Leading run of spaces and tabs. */
	public static String leadingWhitespace(String line) {
		int i = 0;
		while (i < line.length() && isIndentChar(line.charAt(i))) {
			i++;
		}
		return line.substring(0, i);
	}

	/** Trailing run of spaces and tabs. */
	public static String trailingWhitespace(String line) {
		int i = line.length();
		while (i > 0 && isIndentChar(line.charAt(i - 1))) {
			i--;
		}
		return line.substring(i);
	}

	public static String stripLeading(String s) {
		return s.substring(leadingWhitespace(s).length());
	}

	public static String stripTrailing(String s) {
		return s.substring(0, s.length() - trailingWhitespace(s).length());
	}
}
