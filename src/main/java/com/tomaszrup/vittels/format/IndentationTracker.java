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

import java.util.List;

/**
 * Running bracket-depth counter used to re-derive leading whitespace.
 *
 * <p>One instance serves one formatting run. The counter may go negative
 * after unbalanced closers; it is only clamped at zero when an indent is
 * computed, so a later opener can bring it back.</p>
 */
public final class IndentationTracker {

	private final String indentUnit;
	private final int tabSize;
	private final boolean insertSpaces;
	private int indentLevel;

	public IndentationTracker(StyleOptions options) {
		this.indentUnit = options.indentUnit();
		this.tabSize = options.getTabSize();
		this.insertSpaces = options.isInsertSpaces();
	}

	public int getIndentLevel() {
		return indentLevel;
	}

	/**
	 * Converts the leading whitespace of {@code line} to the configured
	 * indent character, keeping its visual width. With spaces every tab
	 * expands to {@code tabSize} spaces; with tabs the width is rebuilt as
	 * tabs followed by the remaining spaces.
	 */
	public String normalizeLeadingWhitespace(String line) {
		String lead = LineModel.leadingWhitespace(line);
		String body = line.substring(lead.length());
		if (insertSpaces) {
			return lead.replace("\t", " ".repeat(tabSize)) + body;
		}
		int width = LineModel.visualWidth(lead, tabSize);
		return "\t".repeat(width / tabSize) + " ".repeat(width % tabSize) + body;
	}

	/** Whether the first non-blank character is a closing bracket in code. */
	public static boolean startsWithClosingBracket(String line) {
		List<LineSegment> segments = LineScanner.scan(LineModel.stripLeading(line));
		if (segments.isEmpty() || !segments.get(0).isCode()) {
			return false;
		}
		char first = segments.get(0).getText().charAt(0);
		return first == '}' || first == ']' || first == ')';
	}

	/** Indentation for a line whose body is {@code body}, at the current depth. */
	public String indentFor(String body) {
		int preDec = startsWithClosingBracket(body) ? 1 : 0;
		return indentUnit.repeat(Math.max(0, indentLevel - preDec));
	}

	/** Moves the counter past {@code line}; affects only the lines after it. */
	public void advance(String line) {
		indentLevel += LineScanner.netBracketDelta(line);
	}
}
