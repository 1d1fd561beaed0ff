////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;

/**
 * Conversions between LSP positions and string offsets. {@code \r\n},
 * {@code \n} and a lone {@code \r} each end a line, as clients count them.
 */
public class Positions {
	private Positions() {
	}

	/** Whether {@code a} comes strictly before {@code b}. */
	public static boolean isBefore(Position a, Position b) {
		if (a.getLine() != b.getLine()) {
			return a.getLine() < b.getLine();
		}
		return a.getCharacter() < b.getCharacter();
	}

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/** Offset of {@code position} in {@code string}, or -1 if it lies outside the text. */
	public static int getOffset(String string, Position position) {
		if (string == null || position == null || !valid(position)) {
			return -1;
		}
		int lineStart = 0;
		for (int line = 0; line < position.getLine(); line++) {
			lineStart = nextLineStart(string, lineStart);
			if (lineStart < 0) {
				return -1;
			}
		}
		int lineLength = lineEnd(string, lineStart) - lineStart;
		if (position.getCharacter() > lineLength) {
			return -1;
		}
		return lineStart + position.getCharacter();
	}

	/** Position just past the last character of {@code string}. */
	public static Position getEnd(String string) {
		if (string == null) {
			return new Position(0, 0);
		}
		int line = 0;
		int lineStart = 0;
		int next;
		while ((next = nextLineStart(string, lineStart)) >= 0) {
			line++;
			lineStart = next;
		}
		return new Position(line, string.length() - lineStart);
	}

	private static int lineEnd(String string, int from) {
		for (int i = from; i < string.length(); i++) {
			char c = string.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return string.length();
	}

	/** Start of the line after the one at {@code from}; -1 on the last line. */
	private static int nextLineStart(String string, int from) {
		int end = lineEnd(string, from);
		if (end == string.length()) {
			return -1;
		}
		if (string.charAt(end) == '\r' && end + 1 < string.length() && string.charAt(end + 1) == '\n') {
			return end + 2;
		}
		return end + 1;
	}
}
