package org.scriptonbasestar.serving.cache.store;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Redis KEYS/SCAN 스타일 glob 패턴을 정규식으로 변환합니다.
 *
 * 지원: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]}, {@code \} 이스케이프
 *
 * @since 2026-10
 */
final class GlobPattern {

	private static final String REGEX_META = ".$|()[]{}^+*?\\";

	private GlobPattern() {
	}

	static Pattern compile(String glob) {
		StringBuilder regex = new StringBuilder();
		boolean inClass = false;

		for (int i = 0; i < glob.length(); i++) {
			char c = glob.charAt(i);

			if (c == '\\' && i + 1 < glob.length()) {
				appendLiteral(regex, glob.charAt(++i));
				continue;
			}

			if (inClass) {
				if (c == ']') {
					inClass = false;
					regex.append(']');
				} else if (c == '[' || c == '&' || c == '\\') {
					regex.append('\\').append(c);
				} else {
					regex.append(c);
				}
				continue;
			}

			switch (c) {
				case '*':
					regex.append(".*");
					break;
				case '?':
					regex.append('.');
					break;
				case '[':
					inClass = true;
					regex.append('[');
					if (i + 1 < glob.length() && glob.charAt(i + 1) == '^') {
						regex.append('^');
						i++;
					}
					break;
				default:
					appendLiteral(regex, c);
			}
		}

		if (inClass) {
			// 닫히지 않은 '['는 문자 그대로 비교
			return Pattern.compile(Pattern.quote(glob), Pattern.DOTALL);
		}
		try {
			return Pattern.compile(regex.toString(), Pattern.DOTALL);
		} catch (PatternSyntaxException e) {
			return Pattern.compile(Pattern.quote(glob), Pattern.DOTALL);
		}
	}

	private static void appendLiteral(StringBuilder regex, char c) {
		if (REGEX_META.indexOf(c) >= 0) {
			regex.append('\\');
		}
		regex.append(c);
	}
}
