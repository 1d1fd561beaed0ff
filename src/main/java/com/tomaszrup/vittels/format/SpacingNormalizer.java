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
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.tomaszrup.vittels.format.StyleOptions.ColonSpacing;

/**
 * Canonicalizes whitespace around operators, commas and colons in the code
 * segments of a line body. String literals and comments are copied through
 * untouched.
 *
 * <p>Operators are matched longest-first, so {@code ===} is one token and is
 * never split into {@code = = =}. A handful of tokens are kept tight:
 * increment and decrement, scope and range operators, safe navigation, and
 * the prefix-only {@code !} and {@code ~}. {@code + - * &} in prefix position
 * get no space after them, which keeps {@code x = -1} and {@code f(-a)}
 * intact, unless the next token is an operator they would merge with, as in
 * {@code - -y}.</p>
 */
public final class SpacingNormalizer {

	private static final class Operator {
		private final String text;
		private final boolean spaced;

		private Operator(String text, boolean spaced) {
			this.text = text;
			this.spaced = spaced;
		}
	}

	private enum Previous {
		NONE,
		OPERAND,
		OPENER,
		OPERATOR
	}

	private static final List<Operator> OPERATORS;

	static {
		List<Operator> operators = new ArrayList<>();
		for (String op : new String[] {
				">>>=", "===", "!==", "<<=", ">>=", "**=", "&&=", "||=", "??=", ">>>",
				"==", "!=", "<=", ">=", "&&", "||", "<<", ">>", "+=", "-=", "*=", "/=", "%=",
				"&=", "^=", "|=", "**", "=>", "->", "??", ":=",
				"+", "-", "*", "/", "%", "<", ">", "=", "&", "|", "^" }) {
			operators.add(new Operator(op, true));
		}
		for (String op : new String[] { "...", "++", "--", "::", "?.", "..", "*/", "!", "~" }) {
			operators.add(new Operator(op, false));
		}
		operators.sort(Comparator.comparingInt((Operator op) -> op.text.length()).reversed());
		OPERATORS = Collections.unmodifiableList(operators);
	}

	private static final Set<String> UNARY_CANDIDATES = new HashSet<>(Arrays.asList("+", "-", "*", "&"));

	private static final Set<String> PREFIX_KEYWORDS = new HashSet<>(
			Arrays.asList("return", "case", "throw", "yield", "else", "in"));

	private static final String OPENERS = "([{,;:?.";

	/** A numeric literal that ends in an exponent marker, as in {@code 1.5e}. */
	private static final Pattern EXPONENT_TAIL = Pattern.compile("(?<![\\w.])\\d[\\d_]*(?:\\.\\d*)?[eE]$");

	private SpacingNormalizer() {
	}

	/**
	 * Applies every enabled spacing rule to a body that has no leading or
	 * trailing whitespace. The result never gains leading or trailing
	 * whitespace either.
	 */
	public static String normalize(String body, StyleOptions options) {
		String result = body;
		if (options.isSpaceAroundOperators()) {
			result = spaceOperators(result);
		}
		if (options.isSpaceAfterComma()) {
			result = spaceCommas(result);
		}
		if (options.getColonSpacing() != ColonSpacing.NONE) {
			result = spaceColons(result, options.getColonSpacing());
		}
		return LineModel.stripTrailing(LineModel.stripLeading(result));
	}

	// --- Operators ---

	public static String spaceOperators(String body) {
		StringBuilder out = new StringBuilder();
		Previous previous = Previous.NONE;
		String lastWord = "";
		for (LineSegment segment : LineScanner.scan(body)) {
			if (segment.isComment()) {
				out.append(segment.getText());
				continue;
			}
			if (segment.isString()) {
				out.append(segment.getText());
				previous = Previous.OPERAND;
				lastWord = "";
				continue;
			}
			String code = segment.getText();
			int i = 0;
			while (i < code.length()) {
				char c = code.charAt(i);
				if (LineModel.isIndentChar(c)) {
					int end = skipWhitespace(code, i);
					out.append(collapseSpaces(code.substring(i, end)));
					i = end;
					continue;
				}
				Operator op = matchOperator(code, i);
				if (op != null) {
					i += op.text.length();
					if (!op.spaced) {
						out.append(op.text);
						previous = previousAfterTightOperator(op.text, previous);
					} else if (isPrefixPosition(op.text, previous, lastWord)) {
						out.append(op.text);
						if (previous != Previous.NONE) {
							int next = skipWhitespace(code, i);
							if (next > i && joinsNextOperator(op, code, next)) {
								out.append(' ');
							}
							i = next;
						}
						previous = Previous.OPERATOR;
					} else if (isExponentSign(op.text, out)) {
						out.append(op.text);
						previous = Previous.OPERATOR;
					} else {
						trimTrailingWhitespace(out);
						if (out.length() > 0) {
							out.append(' ');
						}
						out.append(op.text).append(' ');
						i = skipWhitespace(code, i);
						previous = Previous.OPERATOR;
					}
					lastWord = "";
					continue;
				}
				if (isWordChar(c)) {
					int end = i;
					while (end < code.length() && isWordChar(code.charAt(end))) {
						end++;
					}
					lastWord = code.substring(i, end);
					out.append(lastWord);
					previous = Previous.OPERAND;
					i = end;
					continue;
				}
				out.append(c);
				previous = OPENERS.indexOf(c) >= 0 ? Previous.OPENER : Previous.OPERAND;
				lastWord = "";
				i++;
			}
		}
		return out.toString();
	}

	private static Operator matchOperator(String code, int index) {
		for (Operator op : OPERATORS) {
			if (code.startsWith(op.text, index)) {
				return op;
			}
		}
		return null;
	}

	/** Whether {@code op} written directly before {@code code[index]} would read as a longer operator. */
	private static boolean joinsNextOperator(Operator op, String code, int index) {
		Operator joined = matchOperator(op.text + code.substring(index), 0);
		return joined != null && joined.text.length() > op.text.length();
	}

	private static boolean isPrefixPosition(String op, Previous previous, String lastWord) {
		if (!UNARY_CANDIDATES.contains(op)) {
			return false;
		}
		return previous != Previous.OPERAND || PREFIX_KEYWORDS.contains(lastWord);
	}

	private static boolean isExponentSign(String op, StringBuilder out) {
		return ("+".equals(op) || "-".equals(op)) && EXPONENT_TAIL.matcher(out).find();
	}

	private static Previous previousAfterTightOperator(String op, Previous previous) {
		if ("++".equals(op) || "--".equals(op)) {
			// postfix keeps the operand, prefix leaves an operator behind
			return previous == Previous.OPERAND ? Previous.OPERAND : Previous.OPERATOR;
		}
		if ("*/".equals(op)) {
			return Previous.OPERAND;
		}
		return Previous.OPERATOR;
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private static String collapseSpaces(String run) {
		if (run.length() >= 2 && run.chars().allMatch(ch -> ch == ' ')) {
			return " ";
		}
		return run;
	}

	// --- Commas ---

	public static String spaceCommas(String body) {
		return LineScanner.rewriteCode(body, SpacingNormalizer::spaceCommasInCode);
	}

	private static String spaceCommasInCode(String code) {
		StringBuilder out = new StringBuilder();
		int i = 0;
		while (i < code.length()) {
			char c = code.charAt(i);
			if (c != ',') {
				out.append(c);
				i++;
				continue;
			}
			trimTrailingWhitespace(out);
			i = skipWhitespace(code, i + 1);
			out.append(',');
			if (i >= code.length() || ",)]}".indexOf(code.charAt(i)) < 0) {
				out.append(' ');
			}
		}
		return out.toString();
	}

	// --- Colons ---

	public static String spaceColons(String body, ColonSpacing mode) {
		if (mode == ColonSpacing.NONE) {
			return body;
		}
		return LineScanner.rewriteCode(body, code -> spaceColonsInCode(code, mode));
	}

	private static String spaceColonsInCode(String code, ColonSpacing mode) {
		StringBuilder out = new StringBuilder();
		int i = 0;
		while (i < code.length()) {
			char c = code.charAt(i);
			if (c != ':') {
				out.append(c);
				i++;
				continue;
			}
			char before = i > 0 ? code.charAt(i - 1) : 0;
			char after = i + 1 < code.length() ? code.charAt(i + 1) : 0;
			if (before == ':' || before == '?' || after == ':' || after == '=') {
				out.append(c);
				i++;
				continue;
			}
			trimTrailingWhitespace(out);
			i = skipWhitespace(code, i + 1);
			// a colon must not touch another ':', '?' or '=' and form a new token
			boolean gluesLeft = out.length() > 0 && "?:".indexOf(out.charAt(out.length() - 1)) >= 0;
			boolean gluesRight = i < code.length() && "=:".indexOf(code.charAt(i)) >= 0;
			switch (mode) {
				case LEFT:
					out.append(gluesRight ? " : " : " :");
					break;
				case BOTH:
					out.append(" : ");
					break;
				case RIGHT:
				default:
					out.append(gluesLeft ? " : " : ": ");
					break;
			}
		}
		return out.toString();
	}

	// --- Helpers ---

	private static int skipWhitespace(String s, int index) {
		int i = index;
		while (i < s.length() && LineModel.isIndentChar(s.charAt(i))) {
			i++;
		}
		return i;
	}

	private static void trimTrailingWhitespace(StringBuilder builder) {
		int length = builder.length();
		while (length > 0 && LineModel.isIndentChar(builder.charAt(length - 1))) {
			length--;
		}
		builder.setLength(length);
	}
}
