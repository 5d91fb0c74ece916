package org.metricshub.rash.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Rash
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.rash.frontend.ast.LexerException;
import org.metricshub.rash.frontend.ast.SourceSpan;

/**
 * Splits Rust source text into {@link Token}s.
 * <p>
 * Whitespace and comments (line comments and nested block comments) are
 * dropped. String and character literals are decoded; integer literals are
 * normalized to their decimal representation with any type suffix removed.
 */
public class RustLexer {

	/**
	 * Token categories.
	 */
	public enum TokenType {
		IDENT,
		INT,
		FLOAT,
		STRING,
		BYTE_STRING,
		CHAR,
		LIFETIME,
		PUNCT,
		EOF
	}

	/**
	 * One lexical token with its location.
	 */
	public static final class Token {
		private final TokenType type;
		private final String text;
		private final SourceSpan span;

		Token(TokenType type, String text, SourceSpan span) {
			this.type = type;
			this.text = text;
			this.span = span;
		}

		public TokenType getType() {
			return type;
		}

		public String getText() {
			return text;
		}

		public SourceSpan getSpan() {
			return span;
		}

		boolean is(TokenType t, String s) {
			return type == t && text.equals(s);
		}

		@Override
		public String toString() {
			return type == TokenType.EOF ? "end of input" : "'" + text + "'";
		}
	}

	// longest first
	private static final String[] PUNCTUATION = {
			"<<=", ">>=", "...", "..=",
			"::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=",
			"<<", ">>", "..",
			"+", "-", "*", "/", "%", "^", "!", "&", "|", "=", "<", ">", "@", ".", ",", ";", ":", "#", "$", "?",
			"{", "}", "[", "]", "(", ")"
	};

	private final String source;
	private final String description;
	private int pos;
	private int line = 1;
	private int column = 1;

	/**
	 * <p>
	 * Constructor for RustLexer.
	 * </p>
	 *
	 * @param source the source text
	 * @param description description of the source, used in locations
	 */
	public RustLexer(String source, String description) {
		this.source = source;
		this.description = description;
	}

	/**
	 * Tokenizes the whole source.
	 *
	 * @return the tokens, terminated by a single {@link TokenType#EOF} token
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		skipShebang();
		while (true) {
			skipWhitespaceAndComments();
			if (pos >= source.length()) {
				tokens.add(new Token(TokenType.EOF, "", span()));
				return Collections.unmodifiableList(tokens);
			}
			tokens.add(next());
		}
	}

	private SourceSpan span() {
		return new SourceSpan(description, line, column);
	}

	private LexerException lexerException(String msg, SourceSpan at) {
		return new LexerException(msg, at);
	}

	private char peek(int offset) {
		int i = pos + offset;
		return i < source.length() ? source.charAt(i) : '\0';
	}

	private boolean atEnd() {
		return pos >= source.length();
	}

	private char advance() {
		char c = source.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private void skipShebang() {
		if (source.startsWith("#!") && !source.startsWith("#![")) {
			while (!atEnd() && peek(0) != '\n') {
				advance();
			}
		}
	}

	private void skipWhitespaceAndComments() {
		while (!atEnd()) {
			char c = peek(0);
			if (Character.isWhitespace(c)) {
				advance();
			} else if (c == '/' && peek(1) == '/') {
				while (!atEnd() && peek(0) != '\n') {
					advance();
				}
			} else if (c == '/' && peek(1) == '*') {
				SourceSpan start = span();
				advance();
				advance();
				int depth = 1;
				while (depth > 0) {
					if (atEnd()) {
						throw lexerException("Unterminated block comment", start);
					}
					if (peek(0) == '/' && peek(1) == '*') {
						advance();
						advance();
						depth++;
					} else if (peek(0) == '*' && peek(1) == '/') {
						advance();
						advance();
						depth--;
					} else {
						advance();
					}
				}
			} else {
				return;
			}
		}
	}

	private static boolean isIdentStart(char c) {
		return c == '_' || Character.isLetter(c);
	}

	private static boolean isIdentPart(char c) {
		return c == '_' || Character.isLetterOrDigit(c);
	}

	private Token next() {
		SourceSpan start = span();
		char c = peek(0);

		if (c == 'r' && (peek(1) == '"' || (peek(1) == '#' && (peek(2) == '"' || peek(2) == '#')))) {
			advance();
			return new Token(TokenType.STRING, readRawString(start), start);
		}
		if (c == 'b' && peek(1) == 'r' && (peek(2) == '"' || peek(2) == '#')) {
			advance();
			advance();
			return new Token(TokenType.BYTE_STRING, readRawString(start), start);
		}
		if (c == 'b' && peek(1) == '"') {
			advance();
			return new Token(TokenType.BYTE_STRING, readString(start), start);
		}
		if (c == 'b' && peek(1) == '\'') {
			advance();
			advance();
			return new Token(TokenType.CHAR, readCharBody(start), start);
		}
		if (c == 'r' && peek(1) == '#' && isIdentStart(peek(2))) {
			// raw identifier
			advance();
			advance();
			return new Token(TokenType.IDENT, readIdent(), start);
		}
		if (isIdentStart(c)) {
			return new Token(TokenType.IDENT, readIdent(), start);
		}
		if (Character.isDigit(c)) {
			return readNumber(start);
		}
		if (c == '"') {
			return new Token(TokenType.STRING, readString(start), start);
		}
		if (c == '\'') {
			advance();
			if (peek(0) == '\\') {
				return new Token(TokenType.CHAR, readCharBody(start), start);
			}
			if (isIdentStart(peek(0)) && peek(1) != '\'') {
				return new Token(TokenType.LIFETIME, "'" + readIdent(), start);
			}
			return new Token(TokenType.CHAR, readCharBody(start), start);
		}
		for (String p : PUNCTUATION) {
			if (source.startsWith(p, pos)) {
				for (int i = 0; i < p.length(); i++) {
					advance();
				}
				return new Token(TokenType.PUNCT, p, start);
			}
		}
		if (c == '\0') {
			throw lexerException("NUL byte in source text", start);
		}
		throw lexerException("Unexpected character '" + c + "'", start);
	}

	private String readIdent() {
		StringBuilder sb = new StringBuilder();
		while (!atEnd() && isIdentPart(peek(0))) {
			sb.append(advance());
		}
		return sb.toString();
	}

	private Token readNumber(SourceSpan start) {
		int radix = 10;
		if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'o' || peek(1) == 'b')) {
			char r = peek(1);
			radix = r == 'x' ? 16 : r == 'o' ? 8 : 2;
			advance();
			advance();
		}
		StringBuilder digits = new StringBuilder();
		boolean isFloat = false;
		while (!atEnd()) {
			char c = peek(0);
			if (c == '_') {
				advance();
			} else if (Character.digit(c, radix) >= 0) {
				digits.append(advance());
			} else {
				break;
			}
		}
		if (radix == 10) {
			// a dot starts a fraction unless it is a range or a method call
			if (peek(0) == '.' && peek(1) != '.' && !isIdentStart(peek(1))) {
				isFloat = true;
				digits.append(advance());
				while (!atEnd() && (Character.isDigit(peek(0)) || peek(0) == '_')) {
					char c = advance();
					if (c != '_') {
						digits.append(c);
					}
				}
			}
			if ((peek(0) == 'e' || peek(0) == 'E')
					&& (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
				isFloat = true;
				digits.append(advance());
				if (peek(0) == '+' || peek(0) == '-') {
					digits.append(advance());
				}
				while (!atEnd() && Character.isDigit(peek(0))) {
					digits.append(advance());
				}
			}
		}
		if (digits.length() == 0) {
			throw lexerException("Malformed numeric literal", start);
		}
		String suffix = isIdentStart(peek(0)) ? readIdent() : "";
		if (suffix.equals("f32") || suffix.equals("f64")) {
			isFloat = true;
		}
		if (isFloat) {
			return new Token(TokenType.FLOAT, digits.toString(), start);
		}
		return new Token(TokenType.INT, new BigInteger(digits.toString(), radix).toString(), start);
	}

	private String readString(SourceSpan start) {
		// opening quote
		advance();
		StringBuilder sb = new StringBuilder();
		while (true) {
			if (atEnd()) {
				throw lexerException("Unterminated string literal", start);
			}
			char c = advance();
			if (c == '"') {
				return sb.toString();
			}
			if (c == '\\') {
				if (peek(0) == '\n') {
					// line continuation swallows the leading whitespace of the next line
					while (!atEnd() && Character.isWhitespace(peek(0))) {
						advance();
					}
				} else {
					sb.appendCodePoint(readEscape(start));
				}
			} else if (c != '\r') {
				sb.append(c);
			}
		}
	}

	private String readRawString(SourceSpan start) {
		int hashes = 0;
		while (peek(0) == '#') {
			advance();
			hashes++;
		}
		if (peek(0) != '"') {
			throw lexerException("Malformed raw string literal", start);
		}
		advance();
		StringBuilder sb = new StringBuilder();
		while (true) {
			if (atEnd()) {
				throw lexerException("Unterminated raw string literal", start);
			}
			char c = advance();
			if (c == '"') {
				int count = 0;
				while (count < hashes && peek(count) == '#') {
					count++;
				}
				if (count == hashes) {
					for (int i = 0; i < hashes; i++) {
						advance();
					}
					return sb.toString();
				}
			}
			if (c != '\r') {
				sb.append(c);
			}
		}
	}

	private String readCharBody(SourceSpan start) {
		if (atEnd()) {
			throw lexerException("Unterminated character literal", start);
		}
		String value;
		char c = advance();
		if (c == '\\') {
			value = new String(Character.toChars(readEscape(start)));
		} else if (Character.isHighSurrogate(c) && !atEnd()) {
			value = new String(new char[] { c, advance() });
		} else {
			value = String.valueOf(c);
		}
		if (atEnd() || advance() != '\'') {
			throw lexerException("Unterminated character literal", start);
		}
		return value;
	}

	private int readEscape(SourceSpan start) {
		if (atEnd()) {
			throw lexerException("Unterminated escape sequence", start);
		}
		char c = advance();
		switch (c) {
		case 'n':
			return '\n';
		case 'r':
			return '\r';
		case 't':
			return '\t';
		case '\\':
			return '\\';
		case '0':
			return 0;
		case '\'':
			return '\'';
		case '"':
			return '"';
		case 'x':
			int hi = Character.digit(peek(0), 16);
			int lo = Character.digit(peek(1), 16);
			if (hi < 0 || lo < 0 || hi > 7) {
				throw lexerException("Invalid \\x escape", start);
			}
			advance();
			advance();
			return hi * 16 + lo;
		case 'u':
			if (peek(0) != '{') {
				throw lexerException("Invalid \\u escape", start);
			}
			advance();
			StringBuilder hex = new StringBuilder();
			while (!atEnd() && peek(0) != '}') {
				char h = advance();
				if (h != '_') {
					hex.append(h);
				}
			}
			if (atEnd() || hex.length() == 0 || hex.length() > 6) {
				throw lexerException("Invalid \\u escape", start);
			}
			advance();
			int cp;
			try {
				cp = Integer.parseInt(hex.toString(), 16);
			} catch (NumberFormatException e) {
				throw lexerException("Invalid \\u escape", start);
			}
			if (!Character.isValidCodePoint(cp) || (cp >= 0xD800 && cp <= 0xDFFF)) {
				throw lexerException("Invalid unicode code point in \\u escape", start);
			}
			return cp;
		default:
			throw lexerException("Unknown escape sequence \\" + c, start);
		}
	}
}
