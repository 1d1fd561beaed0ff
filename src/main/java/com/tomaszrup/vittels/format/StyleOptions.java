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

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable set of style choices for one formatting run.
 *
 * <p>Every field has a default, so a value built from an empty
 * {@link Builder} is always complete. Out-of-range numbers are clamped when
 * the value is built: a tab size below 1 falls back to the default and a
 * negative blank-line cap becomes 0.</p>
 */
public final class StyleOptions {

	public static final int DEFAULT_TAB_SIZE = 2;
	public static final int DEFAULT_MAX_CONSECUTIVE_BLANK_LINES = 2;
	public static final int DEFAULT_WRAP_COMMENTS_AT = 100;

	/** Comment wrapping is skipped for widths at or below this column. */
	public static final int MIN_WRAP_WIDTH = 10;

	private static final StyleOptions DEFAULTS = builder().build();

	public enum EndOfLine {
		LF("\n"),
		CRLF("\r\n");

		private final String sequence;

		EndOfLine(String sequence) {
			this.sequence = sequence;
		}

		public String sequence() {
			return sequence;
		}
	}

	public enum ColonSpacing {
		NONE,
		LEFT,
		RIGHT,
		BOTH
	}

	public enum QuoteStyle {
		PRESERVE,
		DOUBLE,
		SINGLE
	}

	public enum BraceStyle {
		ATTACH,
		BREAK
	}

	private final int tabSize;
	private final boolean insertSpaces;
	private final boolean trimTrailingWhitespace;
	private final boolean insertFinalNewline;
	private final boolean trimFinalNewlines;
	private final EndOfLine endOfLine;
	private final int maxConsecutiveBlankLines;
	private final boolean spaceAroundOperators;
	private final boolean spaceAfterComma;
	private final ColonSpacing colonSpacing;
	private final QuoteStyle quoteStyle;
	private final boolean alignInlineComments;
	private final boolean alignEquals;
	private final BraceStyle braceStyle;
	private final boolean newlineBeforeElse;
	private final int wrapCommentsAt;

	private StyleOptions(Builder builder) {
		this.tabSize = builder.tabSize >= 1 ? builder.tabSize : DEFAULT_TAB_SIZE;
		this.insertSpaces = builder.insertSpaces;
		this.trimTrailingWhitespace = builder.trimTrailingWhitespace;
		this.insertFinalNewline = builder.insertFinalNewline;
		this.trimFinalNewlines = builder.trimFinalNewlines;
		this.endOfLine = builder.endOfLine;
		this.maxConsecutiveBlankLines = Math.max(0, builder.maxConsecutiveBlankLines);
		this.spaceAroundOperators = builder.spaceAroundOperators;
		this.spaceAfterComma = builder.spaceAfterComma;
		this.colonSpacing = builder.colonSpacing;
		this.quoteStyle = builder.quoteStyle;
		this.alignInlineComments = builder.alignInlineComments;
		this.alignEquals = builder.alignEquals;
		this.braceStyle = builder.braceStyle;
		this.newlineBeforeElse = builder.newlineBeforeElse;
		this.wrapCommentsAt = builder.wrapCommentsAt;
	}

	public static StyleOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		Builder builder = new Builder();
		builder.tabSize = tabSize;
		builder.insertSpaces = insertSpaces;
		builder.trimTrailingWhitespace = trimTrailingWhitespace;
		builder.insertFinalNewline = insertFinalNewline;
		builder.trimFinalNewlines = trimFinalNewlines;
		builder.endOfLine = endOfLine;
		builder.maxConsecutiveBlankLines = maxConsecutiveBlankLines;
		builder.spaceAroundOperators = spaceAroundOperators;
		builder.spaceAfterComma = spaceAfterComma;
		builder.colonSpacing = colonSpacing;
		builder.quoteStyle = quoteStyle;
		builder.alignInlineComments = alignInlineComments;
		builder.alignEquals = alignEquals;
		builder.braceStyle = braceStyle;
		builder.newlineBeforeElse = newlineBeforeElse;
		builder.wrapCommentsAt = wrapCommentsAt;
		return builder;
	}

	public int getTabSize() {
		return tabSize;
	}

	public boolean isInsertSpaces() {
		return insertSpaces;
	}

	/** One level of indentation: {@code tabSize} spaces or a single tab. */
	public String indentUnit() {
		return insertSpaces ? " ".repeat(tabSize) : "\t";
	}

	public boolean isTrimTrailingWhitespace() {
		return trimTrailingWhitespace;
	}

	public boolean isInsertFinalNewline() {
		return insertFinalNewline;
	}

	public boolean isTrimFinalNewlines() {
		return trimFinalNewlines;
	}

	public EndOfLine getEndOfLine() {
		return endOfLine;
	}

	public int getMaxConsecutiveBlankLines() {
		return maxConsecutiveBlankLines;
	}

	public boolean isSpaceAroundOperators() {
		return spaceAroundOperators;
	}

	public boolean isSpaceAfterComma() {
		return spaceAfterComma;
	}

	public ColonSpacing getColonSpacing() {
		return colonSpacing;
	}

	public QuoteStyle getQuoteStyle() {
		return quoteStyle;
	}

	public boolean isAlignInlineComments() {
		return alignInlineComments;
	}

	public boolean isAlignEquals() {
		return alignEquals;
	}

	public BraceStyle getBraceStyle() {
		return braceStyle;
	}

	public boolean isNewlineBeforeElse() {
		return newlineBeforeElse;
	}

	public int getWrapCommentsAt() {
		return wrapCommentsAt;
	}

	public boolean isCommentWrappingEnabled() {
		return wrapCommentsAt > MIN_WRAP_WIDTH;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StyleOptions)) {
			return false;
		}
		StyleOptions that = (StyleOptions) o;
		return tabSize == that.tabSize
				&& insertSpaces == that.insertSpaces
				&& trimTrailingWhitespace == that.trimTrailingWhitespace
				&& insertFinalNewline == that.insertFinalNewline
				&& trimFinalNewlines == that.trimFinalNewlines
				&& maxConsecutiveBlankLines == that.maxConsecutiveBlankLines
				&& spaceAroundOperators == that.spaceAroundOperators
				&& spaceAfterComma == that.spaceAfterComma
				&& alignInlineComments == that.alignInlineComments
				&& alignEquals == that.alignEquals
				&& newlineBeforeElse == that.newlineBeforeElse
				&& wrapCommentsAt == that.wrapCommentsAt
				&& endOfLine == that.endOfLine
				&& colonSpacing == that.colonSpacing
				&& quoteStyle == that.quoteStyle
				&& braceStyle == that.braceStyle;
	}

	@Override
	public int hashCode() {
		return Objects.hash(tabSize, insertSpaces, trimTrailingWhitespace, insertFinalNewline,
				trimFinalNewlines, endOfLine, maxConsecutiveBlankLines, spaceAroundOperators,
				spaceAfterComma, colonSpacing, quoteStyle, alignInlineComments, alignEquals,
				braceStyle, newlineBeforeElse, wrapCommentsAt);
	}

	@Override
	public String toString() {
		return "StyleOptions{tabSize=" + tabSize
				+ ", insertSpaces=" + insertSpaces
				+ ", eol=" + endOfLine.name().toLowerCase(Locale.ROOT)
				+ ", maxBlank=" + maxConsecutiveBlankLines
				+ ", operators=" + spaceAroundOperators
				+ ", comma=" + spaceAfterComma
				+ ", colon=" + colonSpacing.name().toLowerCase(Locale.ROOT)
				+ ", quotes=" + quoteStyle.name().toLowerCase(Locale.ROOT)
				+ ", alignComments=" + alignInlineComments
				+ ", alignEquals=" + alignEquals
				+ ", braces=" + braceStyle.name().toLowerCase(Locale.ROOT)
				+ ", newlineBeforeElse=" + newlineBeforeElse
				+ ", wrapCommentsAt=" + wrapCommentsAt
				+ "}";
	}

	public static final class Builder {
		private int tabSize = DEFAULT_TAB_SIZE;
		private boolean insertSpaces = true;
		private boolean trimTrailingWhitespace = true;
		private boolean insertFinalNewline = true;
		private boolean trimFinalNewlines = true;
		private EndOfLine endOfLine = EndOfLine.LF;
		private int maxConsecutiveBlankLines = DEFAULT_MAX_CONSECUTIVE_BLANK_LINES;
		private boolean spaceAroundOperators = true;
		private boolean spaceAfterComma = true;
		private ColonSpacing colonSpacing = ColonSpacing.RIGHT;
		private QuoteStyle quoteStyle = QuoteStyle.PRESERVE;
		private boolean alignInlineComments = true;
		private boolean alignEquals = true;
		private BraceStyle braceStyle = BraceStyle.ATTACH;
		private boolean newlineBeforeElse = false;
		private int wrapCommentsAt = DEFAULT_WRAP_COMMENTS_AT;

		private Builder() {
		}

		public Builder tabSize(int tabSize) {
			this.tabSize = tabSize;
			return this;
		}

		public Builder insertSpaces(boolean insertSpaces) {
			this.insertSpaces = insertSpaces;
			return this;
		}

		public Builder trimTrailingWhitespace(boolean trimTrailingWhitespace) {
			this.trimTrailingWhitespace = trimTrailingWhitespace;
			return this;
		}

		public Builder insertFinalNewline(boolean insertFinalNewline) {
			this.insertFinalNewline = insertFinalNewline;
			return this;
		}

		public Builder trimFinalNewlines(boolean trimFinalNewlines) {
			this.trimFinalNewlines = trimFinalNewlines;
			return this;
		}

		public Builder endOfLine(EndOfLine endOfLine) {
			this.endOfLine = Objects.requireNonNull(endOfLine, "endOfLine");
			return this;
		}

		public Builder maxConsecutiveBlankLines(int maxConsecutiveBlankLines) {
			this.maxConsecutiveBlankLines = maxConsecutiveBlankLines;
			return this;
		}

		public Builder spaceAroundOperators(boolean spaceAroundOperators) {
			this.spaceAroundOperators = spaceAroundOperators;
			return this;
		}

		public Builder spaceAfterComma(boolean spaceAfterComma) {
			this.spaceAfterComma = spaceAfterComma;
			return this;
		}

		public Builder colonSpacing(ColonSpacing colonSpacing) {
			this.colonSpacing = Objects.requireNonNull(colonSpacing, "colonSpacing");
			return this;
		}

		public Builder quoteStyle(QuoteStyle quoteStyle) {
			this.quoteStyle = Objects.requireNonNull(quoteStyle, "quoteStyle");
			return this;
		}

		public Builder alignInlineComments(boolean alignInlineComments) {
			this.alignInlineComments = alignInlineComments;
			return this;
		}

		public Builder alignEquals(boolean alignEquals) {
			this.alignEquals = alignEquals;
			return this;
		}

		public Builder braceStyle(BraceStyle braceStyle) {
			this.braceStyle = Objects.requireNonNull(braceStyle, "braceStyle");
			return this;
		}

		public Builder newlineBeforeElse(boolean newlineBeforeElse) {
			this.newlineBeforeElse = newlineBeforeElse;
			return this;
		}

		public Builder wrapCommentsAt(int wrapCommentsAt) {
			this.wrapCommentsAt = wrapCommentsAt;
			return this;
		}

		public StyleOptions build() {
			return new StyleOptions(this);
		}
	}
}
