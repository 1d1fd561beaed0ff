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
package com.tomaszrup.vittels.config;

import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.jsonrpc.messages.Either3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.vittels.format.StyleOptions;
import com.tomaszrup.vittels.format.StyleOptions.BraceStyle;
import com.tomaszrup.vittels.format.StyleOptions.ColonSpacing;
import com.tomaszrup.vittels.format.StyleOptions.EndOfLine;
import com.tomaszrup.vittels.format.StyleOptions.QuoteStyle;

/**
 * Reads style options from the places a client can send them: the
 * {@code format} object of {@code initializationOptions}, the
 * {@code vitte.format} settings section and the {@link FormattingOptions}
 * of a formatting request.
 *
 * <p>Every read starts from a base {@link StyleOptions} and overrides only
 * the keys that are present. A value of the wrong type or an unknown enum
 * constant is logged and skipped, so the base value stays in effect.</p>
 */
public final class StyleOptionsParser {
	private static final Logger logger = LoggerFactory.getLogger(StyleOptionsParser.class);

	public static final String TAB_SIZE = "tabSize";
	public static final String INSERT_SPACES = "insertSpaces";
	public static final String TRIM_TRAILING_WHITESPACE = "trimTrailingWhitespace";
	public static final String INSERT_FINAL_NEWLINE = "insertFinalNewline";
	public static final String TRIM_FINAL_NEWLINES = "trimFinalNewlines";
	public static final String NORMALIZE_EOL = "normalizeEOL";
	public static final String MAX_CONSECUTIVE_BLANK_LINES = "maxConsecutiveBlankLines";
	public static final String SPACE_AROUND_OPERATORS = "ensureSpaceAroundOperators";
	public static final String SPACE_AFTER_COMMA = "spaceAfterComma";
	public static final String SPACE_AROUND_COLON = "spaceAroundColon";
	public static final String NORMALIZE_QUOTES = "normalizeQuotes";
	public static final String ALIGN_INLINE_COMMENTS = "alignInlineComments";
	public static final String ALIGN_EQUALS = "alignEquals";
	public static final String BRACE_STYLE = "braceStyle";
	public static final String NEWLINE_BEFORE_ELSE = "newlineBeforeElse";
	public static final String WRAP_COMMENTS_AT = "wrapCommentsAt";

	private StyleOptionsParser() {
	}

	/**
	 * Overrides {@code base} with the keys present in {@code json}. A
	 * {@code null} object returns {@code base} unchanged.
	 */
	public static StyleOptions fromJson(JsonObject json, StyleOptions base) {
		StyleOptions start = base != null ? base : StyleOptions.defaults();
		if (json == null) {
			return start;
		}
		StyleOptions.Builder builder = start.toBuilder();
		readInt(json, TAB_SIZE, builder::tabSize);
		readBoolean(json, INSERT_SPACES, builder::insertSpaces);
		readBoolean(json, TRIM_TRAILING_WHITESPACE, builder::trimTrailingWhitespace);
		readBoolean(json, INSERT_FINAL_NEWLINE, builder::insertFinalNewline);
		readBoolean(json, TRIM_FINAL_NEWLINES, builder::trimFinalNewlines);
		readEnum(json, NORMALIZE_EOL, EndOfLine.class, builder::endOfLine);
		readInt(json, MAX_CONSECUTIVE_BLANK_LINES, builder::maxConsecutiveBlankLines);
		readBoolean(json, SPACE_AROUND_OPERATORS, builder::spaceAroundOperators);
		readBoolean(json, SPACE_AFTER_COMMA, builder::spaceAfterComma);
		readEnum(json, SPACE_AROUND_COLON, ColonSpacing.class, builder::colonSpacing);
		readEnum(json, NORMALIZE_QUOTES, QuoteStyle.class, builder::quoteStyle);
		readBoolean(json, ALIGN_INLINE_COMMENTS, builder::alignInlineComments);
		readBoolean(json, ALIGN_EQUALS, builder::alignEquals);
		readEnum(json, BRACE_STYLE, BraceStyle.class, builder::braceStyle);
		readBoolean(json, NEWLINE_BEFORE_ELSE, builder::newlineBeforeElse);
		readInt(json, WRAP_COMMENTS_AT, builder::wrapCommentsAt);
		return builder.build();
	}

	/**
	 * Overrides {@code base} with the properties of a formatting request.
	 * {@code tabSize} and {@code insertSpaces} come from the editor; the
	 * other keys are read when the client sends them as extra properties.
	 */
	public static StyleOptions fromFormattingOptions(FormattingOptions options, StyleOptions base) {
		if (options == null) {
			return base != null ? base : StyleOptions.defaults();
		}
		return fromJson(toJson(options), base);
	}

	static JsonObject toJson(Map<String, Either3<String, Number, Boolean>> properties) {
		JsonObject json = new JsonObject();
		for (Map.Entry<String, Either3<String, Number, Boolean>> entry : properties.entrySet()) {
			Either3<String, Number, Boolean> value = entry.getValue();
			if (value == null) {
				continue;
			}
			if (value.isFirst()) {
				json.add(entry.getKey(), new JsonPrimitive(value.getFirst()));
			} else if (value.isSecond()) {
				json.add(entry.getKey(), new JsonPrimitive(value.getSecond()));
			} else if (value.isThird()) {
				json.add(entry.getKey(), new JsonPrimitive(value.getThird()));
			}
		}
		return json;
	}

	private static JsonPrimitive primitive(JsonObject json, String key) {
		if (!json.has(key)) {
			return null;
		}
		JsonElement element = json.get(key);
		if (element.isJsonNull()) {
			return null;
		}
		if (!element.isJsonPrimitive()) {
			logger.warn("Ignoring format option '{}': expected a value, got {}", key, element);
			return null;
		}
		return element.getAsJsonPrimitive();
	}

	private static void readBoolean(JsonObject json, String key, Consumer<Boolean> setter) {
		JsonPrimitive value = primitive(json, key);
		if (value == null) {
			return;
		}
		if (!value.isBoolean()) {
			logger.warn("Ignoring format option '{}': expected a boolean, got {}", key, value);
			return;
		}
		setter.accept(value.getAsBoolean());
	}

	private static void readInt(JsonObject json, String key, IntConsumer setter) {
		JsonPrimitive value = primitive(json, key);
		if (value == null) {
			return;
		}
		if (!value.isNumber()) {
			logger.warn("Ignoring format option '{}': expected a number, got {}", key, value);
			return;
		}
		setter.accept(value.getAsNumber().intValue());
	}

	private static <E extends Enum<E>> void readEnum(JsonObject json, String key, Class<E> type,
			Consumer<E> setter) {
		JsonPrimitive value = primitive(json, key);
		if (value == null) {
			return;
		}
		if (!value.isString()) {
			logger.warn("Ignoring format option '{}': expected a string, got {}", key, value);
			return;
		}
		E parsed = parseEnum(type, value.getAsString());
		if (parsed == null) {
			logger.warn("Ignoring format option '{}': unknown value '{}'", key, value.getAsString());
			return;
		}
		setter.accept(parsed);
	}

	/** Case-insensitive lookup; {@code null} for an unknown name. */
	static <E extends Enum<E>> E parseEnum(Class<E> type, String name) {
		String wanted = name.trim().toUpperCase(Locale.ROOT);
		for (E constant : type.getEnumConstants()) {
			if (constant.name().equals(wanted)) {
				return constant;
			}
		}
		return null;
	}
}
