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
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

import com.tomaszrup.vittels.format.LineSegment.Kind;

/**
 * Character-level scanner that classifies a single line into code, string
 * and comment segments.
 *
 * <p>States are CODE and IN_STRING (keyed by the opening quote, {@code "} or
 * {@code '}). Inside a string a backslash consumes the next character
 * unconditionally. Outside strings, {@code //} opens a comment running to the
 * end of the line and {@code /*} opens one running to the matching
 * {@code *}{@code /}, or to the end of the line when there is none.</p>
 *
 * <p>Nothing carries over from one line to the next: a literal left open at
 * the end of a line simply ends there.</p>
 */
public final class LineScanner {

	private LineScanner() {
	}

	private enum ScanState {
		CODE,
		IN_STRING
	}

	/** Code before a trailing comment, and the comment itself. */
	public static final class CodeAndComment {
		private final String code;
		private final String comment;

		CodeAndComment(String code, String comment) {
			this.code = code;
			this.comment = comment;
		}

		public String getCode() {
			return code;
		}

		/** The trailing comment, or the empty string when the line has none. */
		public String getComment() {
			return comment;
		}

		public boolean hasComment() {
			return !comment.isEmpty();
		}
	}

	public static List<LineSegment> scan(String line) {
		if (line == null || line.isEmpty()) {
			return Collections.emptyList();
		}
		List<LineSegment> segments = new ArrayList<>();
		StringBuilder code = new StringBuilder();
		ScanState state = ScanState.CODE;
		int stringStart = 0;
		char quote = 0;
		int length = line.length();
		int i = 0;
		while (i < length) {
			char c = line.charAt(i);
			char next = i + 1 < length ? line.charAt(i + 1) : 0;
			if (state == ScanState.IN_STRING) {
				if (c == '\\') {
					i = Math.min(length, i + 2);
					continue;
				}
				i++;
				if (c == quote) {
					segments.add(new LineSegment(Kind.STRING, line.substring(stringStart, i), true));
					state = ScanState.CODE;
				}
				continue;
			}
			if (c == '"' || c == '\'') {
				flushCode(segments, code);
				state = ScanState.IN_STRING;
				quote = c;
				stringStart = i;
				i++;
			} else if (c == '/' && next == '/') {
				flushCode(segments, code);
				segments.add(new LineSegment(Kind.COMMENT, line.substring(i), true));
				return segments;
			} else if (c == '/' && next == '*') {
				flushCode(segments, code);
				int close = line.indexOf("*/", i + 2);
				int end = close >= 0 ? close + 2 : length;
				segments.add(new LineSegment(Kind.COMMENT, line.substring(i, end), close >= 0));
				i = end;
			} else {
				code.append(c);
				i++;
			}
		}
		if (state == ScanState.IN_STRING) {
			segments.add(new LineSegment(Kind.STRING, line.substring(stringStart), false));
		}
		flushCode(segments, code);
		return segments;
	}

	private static void flushCode(List<LineSegment> segments, StringBuilder code) {
		if (code.length() > 0) {
			segments.add(LineSegment.code(code.toString()));
			code.setLength(0);
		}
	}

	public static String join(List<LineSegment> segments) {
		StringBuilder builder = new StringBuilder();
		for (LineSegment segment : segments) {
			builder.append(segment.getText());
		}
		return builder.toString();
	}

	/** The line with every string literal, delimiters included, removed. */
	public static String stripStrings(String line) {
		StringBuilder builder = new StringBuilder();
		for (LineSegment segment : scan(line)) {
			if (!segment.isString()) {
				builder.append(segment.getText());
			}
		}
		return builder.toString();
	}

	/** Concatenation of the code segments only. */
	public static String codeOnly(String line) {
		StringBuilder builder = new StringBuilder();
		for (LineSegment segment : scan(line)) {
			if (segment.isCode()) {
				builder.append(segment.getText());
			}
		}
		return builder.toString();
	}

	/**
	 * Splits off a comment that runs to the end of the line. A block comment
	 * followed by more code is not trailing and stays in the code part.
	 */
	public static CodeAndComment splitCodeAndComment(String line) {
		List<LineSegment> segments = scan(line);
		if (segments.isEmpty()) {
			return new CodeAndComment(line == null ? "" : line, "");
		}
		LineSegment last = segments.get(segments.size() - 1);
		if (!last.isComment()) {
			return new CodeAndComment(line, "");
		}
		String code = join(segments.subList(0, segments.size() - 1));
		return new CodeAndComment(code, last.getText());
	}

	/**
	 * Rebuilds the line, passing each code segment through {@code transform}
	 * and copying strings and comments verbatim.
	 */
	public static String rewriteCode(String line, UnaryOperator<String> transform) {
		StringBuilder builder = new StringBuilder();
		for (LineSegment segment : scan(line)) {
			if (segment.isCode()) {
				builder.append(transform.apply(segment.getText()));
			} else {
				builder.append(segment.getText());
			}
		}
		return builder.toString();
	}

	/** Net count of opening minus closing brackets of any kind in code. */
	public static int netBracketDelta(String line) {
		int delta = 0;
		String code = codeOnly(line);
		for (int i = 0; i < code.length(); i++) {
			char c = code.charAt(i);
			if (c == '{' || c == '[' || c == '(') {
				delta++;
			} else if (c == '}' || c == ']' || c == ')') {
				delta--;
			}
		}
		return delta;
	}
}
