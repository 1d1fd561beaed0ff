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

import java.util.Objects;

/**
 * A run of characters on one line that share a lexical class. String
 * segments include their delimiters.
 */
public final class LineSegment {

	public enum Kind {
		CODE,
		STRING,
		COMMENT
	}

	private final Kind kind;
	private final String text;
	private final boolean terminated;

	LineSegment(Kind kind, String text, boolean terminated) {
		this.kind = kind;
		this.text = text;
		this.terminated = terminated;
	}

	static LineSegment code(String text) {
		return new LineSegment(Kind.CODE, text, true);
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public boolean isCode() {
		return kind == Kind.CODE;
	}

	public boolean isString() {
		return kind == Kind.STRING;
	}

	public boolean isComment() {
		return kind == Kind.COMMENT;
	}

	/**
	 * For strings, whether the closing delimiter was found on the line. For
	 * block comments, whether {@code *}{@code /} was found. Always true for
	 * code and line comments.
	 */
	public boolean isTerminated() {
		return terminated;
	}

	/** Opening delimiter of a string segment. */
	public char quote() {
		return text.charAt(0);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LineSegment)) {
			return false;
		}
		LineSegment that = (LineSegment) o;
		return terminated == that.terminated && kind == that.kind && text.equals(that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, terminated);
	}

	@Override
	public String toString() {
		return kind + "[" + text + "]";
	}
}
