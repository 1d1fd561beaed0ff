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
 * Column alignment of trailing comments and of assignment operators.
 *
 * <p>Comment alignment is document-wide: every trailing comment starts one
 * column past the widest code that carries one. Equals alignment works on
 * runs of consecutive lines that each contain an assignment; a run needs at
 * least two lines.</p>
 */
public final class AlignmentEngine {

	/** Characters that, directly before {@code =}, make it part of another operator. */
	private static final String COMPOUND_PREFIXES = "=!<>+-*/%&|^?:~";

	private AlignmentEngine() {
	}

	public static List<String> alignTrailingComments(List<String> lines, int tabSize) {
		List<String> out = new ArrayList<>(lines);
		List<Integer> indexes = new ArrayList<>();
		List<String> codes = new ArrayList<>();
		List<String> comments = new ArrayList<>();
		int maxWidth = 0;
		for (int i = 0; i < lines.size(); i++) {
			LineScanner.CodeAndComment split = LineScanner.splitCodeAndComment(lines.get(i));
			if (!split.hasComment() || LineModel.isBlank(split.getCode())) {
				continue;
			}
			String code = LineModel.stripTrailing(split.getCode());
			maxWidth = Math.max(maxWidth, LineModel.visualWidth(code, tabSize));
			indexes.add(i);
			codes.add(code);
			comments.add(split.getComment());
		}
		for (int k = 0; k < indexes.size(); k++) {
			String code = codes.get(k);
			int padding = maxWidth + 1 - LineModel.visualWidth(code, tabSize);
			out.set(indexes.get(k), code + " ".repeat(padding) + comments.get(k));
		}
		return out;
	}

	public static List<String> alignEquals(List<String> lines, int tabSize) {
		List<String> out = new ArrayList<>(lines);
		int i = 0;
		while (i < out.size()) {
			if (findAssignment(out.get(i)) < 0) {
				i++;
				continue;
			}
			int end = i;
			while (end < out.size() && findAssignment(out.get(end)) >= 0) {
				end++;
			}
			if (end - i >= 2) {
				alignBlock(out, i, end, tabSize);
			}
			i = end;
		}
		return out;
	}

	private static void alignBlock(List<String> lines, int from, int to, int tabSize) {
		int width = 0;
		for (int i = from; i < to; i++) {
			String line = lines.get(i);
			String left = LineModel.stripTrailing(line.substring(0, findAssignment(line)));
			width = Math.max(width, LineModel.visualWidth(left, tabSize));
		}
		for (int i = from; i < to; i++) {
			String line = lines.get(i);
			int anchor = findAssignment(line);
			String left = LineModel.stripTrailing(line.substring(0, anchor));
			String right = LineModel.stripLeading(line.substring(anchor + 1));
			StringBuilder aligned = new StringBuilder(left);
			aligned.append(" ".repeat(width - LineModel.visualWidth(left, tabSize)));
			aligned.append(" =");
			if (!right.isEmpty()) {
				aligned.append(' ').append(right);
			}
			lines.set(i, aligned.toString());
		}
	}

	/**
	 * Index of the first plain assignment {@code =} in code, or -1. Blank
	 * lines and lines starting with a line comment never have one.
	 */
	public static int findAssignment(String line) {
		if (LineModel.isBlank(line) || LineModel.stripLeading(line).startsWith("//")) {
			return -1;
		}
		int offset = 0;
		for (LineSegment segment : LineScanner.scan(line)) {
			String text = segment.getText();
			if (segment.isCode()) {
				for (int j = 0; j < text.length(); j++) {
					if (text.charAt(j) != '=') {
						continue;
					}
					int index = offset + j;
					char before = index > 0 ? line.charAt(index - 1) : 0;
					char after = index + 1 < line.length() ? line.charAt(index + 1) : 0;
					if (COMPOUND_PREFIXES.indexOf(before) < 0 && after != '=' && after != '>') {
						return index;
					}
				}
			}
			offset += text.length();
		}
		return -1;
	}
}
