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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greedy word wrap for whole-line {@code //} comments. The comment prefix,
 * indentation included, is repeated on every produced line.
 */
public final class CommentWrapper {

	private static final Pattern LINE_COMMENT = Pattern.compile("^([ \\t]*//[ \\t]?)(.*)$");
	private static final Pattern WORD_SEPARATOR = Pattern.compile("\\s+");

	private CommentWrapper() {
	}

	public static List<String> wrap(List<String> lines, int maxWidth, int tabSize) {
		List<String> out = new ArrayList<>(lines.size());
		for (String line : lines) {
			Matcher matcher = LINE_COMMENT.matcher(line);
			if (!matcher.matches()) {
				out.add(line);
				continue;
			}
			String prefix = matcher.group(1);
			String body = matcher.group(2).trim();
			if (body.isEmpty()) {
				out.add(prefix);
				continue;
			}
			for (String wrapped : wrapText(body, maxWidth - LineModel.visualWidth(prefix, tabSize))) {
				out.add(prefix + wrapped);
			}
		}
		return out;
	}

	/**
	 * Packs the words of {@code text} into lines no wider than {@code width}.
	 * A word longer than the width gets a line of its own.
	 */
	public static List<String> wrapText(String text, int width) {
		if (text.length() <= width) {
			return Collections.singletonList(text);
		}
		List<String> lines = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		for (String word : WORD_SEPARATOR.split(text.trim())) {
			if (current.length() == 0) {
				current.append(word);
			} else if (current.length() + 1 + word.length() <= width) {
				current.append(' ').append(word);
			} else {
				lines.add(current.toString());
				current.setLength(0);
				current.append(word);
			}
		}
		if (current.length() > 0) {
			lines.add(current.toString());
		}
		return lines;
	}
}
