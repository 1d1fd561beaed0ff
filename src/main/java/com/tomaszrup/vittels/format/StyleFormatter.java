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

import com.tomaszrup.vittels.format.StyleOptions.QuoteStyle;

/**
 * Runs the formatting passes over a whole document:
 * <ol>
 *   <li>indentation, quotes, spacing and brace/else placement, line by line</li>
 *   <li>blank-line runs capped</li>
 *   <li>trailing comments and assignments aligned</li>
 *   <li>whole-line comments wrapped</li>
 * </ol>
 * then rejoins the lines with the configured end-of-line sequence and
 * applies the final-newline policy.
 *
 * <p>The output depends only on the input text and the options, and
 * formatting the output again returns it unchanged.</p>
 */
public final class StyleFormatter {

	private final StyleOptions options;

	public StyleFormatter(StyleOptions options) {
		this.options = options != null ? options : StyleOptions.defaults();
	}

	public String format(String text) {
		List<String> lines = formatLines(LineModel.split(text == null ? "" : text));
		String joined = LineModel.join(lines, options.getEndOfLine());
		return applyFinalNewlinePolicy(joined);
	}

	List<String> formatLines(List<String> source) {
		List<String> lines = indentAndSpace(source);
		lines = BlankLineLimiter.limit(lines, options.getMaxConsecutiveBlankLines());
		if (options.isAlignInlineComments()) {
			lines = AlignmentEngine.alignTrailingComments(lines, options.getTabSize());
		}
		if (options.isAlignEquals()) {
			lines = AlignmentEngine.alignEquals(lines, options.getTabSize());
			if (options.isAlignInlineComments()) {
				// assignments moved the code, so trailing comments line up again
				lines = AlignmentEngine.alignTrailingComments(lines, options.getTabSize());
			}
		}
		if (options.isCommentWrappingEnabled()) {
			lines = CommentWrapper.wrap(lines, options.getWrapCommentsAt(), options.getTabSize());
		}
		return lines;
	}

	List<String> indentAndSpace(List<String> source) {
		IndentationTracker tracker = new IndentationTracker(options);
		List<String> out = new ArrayList<>(source.size());
		for (String raw : source) {
			String line = tracker.normalizeLeadingWhitespace(raw);
			if (LineModel.isBlank(line)) {
				out.add("");
				continue;
			}
			String trailing = LineModel.trailingWhitespace(line);
			String body = LineModel.stripTrailing(LineModel.stripLeading(line));

			// each emitted part is a line of its own on the next run
			List<String> bodies = rewriteBody(body);
			for (int i = 0; i < bodies.size(); i++) {
				String part = bodies.get(i);
				String rewritten = tracker.indentFor(part) + part;
				if (!options.isTrimTrailingWhitespace() && i == bodies.size() - 1) {
					rewritten += trailing;
				}
				out.add(rewritten);
				tracker.advance(part);
			}
		}
		return out;
	}

	private List<String> rewriteBody(String body) {
		String rewritten = body;
		if (options.getQuoteStyle() != QuoteStyle.PRESERVE) {
			rewritten = QuoteNormalizer.normalize(rewritten, options.getQuoteStyle());
		}
		rewritten = SpacingNormalizer.normalize(rewritten, options);

		List<String> bodies = BraceStyleTransformer.applyBraceStyle(rewritten, options.getBraceStyle());
		if (!options.isNewlineBeforeElse()) {
			return bodies;
		}
		List<String> split = new ArrayList<>();
		for (String part : bodies) {
			split.addAll(BraceStyleTransformer.splitBeforeElse(part));
		}
		return Collections.unmodifiableList(split);
	}

	String applyFinalNewlinePolicy(String text) {
		String eol = options.getEndOfLine().sequence();
		String result = text;
		if (options.isTrimFinalNewlines()) {
			String doubled = eol + eol;
			while (result.endsWith(doubled)) {
				result = result.substring(0, result.length() - eol.length());
			}
		}
		if (options.isInsertFinalNewline() && !result.endsWith(eol)) {
			result += eol;
		}
		return result;
	}
}
