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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tomaszrup.vittels.format.StyleOptions.BraceStyle;

/**
 * Brace placement after a closing parenthesis and placement of
 * {@code else} after a closing brace. Both work on a line body without
 * indentation and may turn it into several bodies.
 */
public final class BraceStyleTransformer {

	private static final Pattern PAREN_BRACE = Pattern.compile("\\)[ \\t]*\\{$");
	private static final Pattern CLOSE_ELSE = Pattern.compile("\\}[ \\t]*else\\b");
	private static final Pattern LEADING_ELSE = Pattern.compile("^[ \\t]*else\\b");

	private BraceStyleTransformer() {
	}

	/**
	 * Rewrites a closing parenthesis followed by an opening brace at the end
	 * of the code. {@link BraceStyle#ATTACH} keeps one space between the two;
	 * {@link BraceStyle#BREAK} moves the brace to a body of its own. A
	 * trailing comment follows the brace.
	 */
	public static List<String> applyBraceStyle(String body, BraceStyle style) {
		LineScanner.CodeAndComment split = LineScanner.splitCodeAndComment(body);
		String code = LineModel.stripTrailing(split.getCode());
		String gap = split.getCode().substring(code.length());
		List<LineSegment> segments = LineScanner.scan(code);
		if (segments.isEmpty()) {
			return Collections.singletonList(body);
		}
		LineSegment last = segments.get(segments.size() - 1);
		if (!last.isCode()) {
			return Collections.singletonList(body);
		}
		Matcher matcher = PAREN_BRACE.matcher(last.getText());
		if (!matcher.find()) {
			return Collections.singletonList(body);
		}
		int parenIndex = code.length() - last.getText().length() + matcher.start();
		String head = code.substring(0, parenIndex + 1);
		String brace = "{" + (split.hasComment() ? gap + split.getComment() : "");
		if (style == BraceStyle.BREAK) {
			return Arrays.asList(head, brace);
		}
		return Collections.singletonList(head + " " + brace);
	}

	/**
	 * Splits a closing brace followed by {@code else} so that the brace ends
	 * one body and {@code else} starts the next. Bodies that already start
	 * with {@code else} are left alone.
	 */
	public static List<String> splitBeforeElse(String body) {
		if (LEADING_ELSE.matcher(body).find()) {
			return Collections.singletonList(body);
		}
		List<int[]> cuts = new ArrayList<>();
		int offset = 0;
		for (LineSegment segment : LineScanner.scan(body)) {
			if (segment.isCode()) {
				Matcher matcher = CLOSE_ELSE.matcher(segment.getText());
				while (matcher.find()) {
					int braceEnd = offset + matcher.start() + 1;
					int elseStart = offset + matcher.end() - "else".length();
					cuts.add(new int[] { braceEnd, elseStart });
				}
			}
			offset += segment.getText().length();
		}
		if (cuts.isEmpty()) {
			return Collections.singletonList(body);
		}
		List<String> parts = new ArrayList<>();
		int start = 0;
		for (int[] cut : cuts) {
			parts.add(LineModel.stripTrailing(body.substring(start, cut[0])));
			start = cut[1];
		}
		parts.add(body.substring(start));
		return parts;
	}
}
