package org.filesearcher.search;

import java.util.regex.Pattern;

/**
 * 文件名通配符匹配器。
 * <p>
 * 规则：{@code *} 匹配任意长度（含空）字符，{@code ?} 匹配恰好一个字符（包括换行等行终止符，它们在文件名中是合法的），
 * 其余字符按字面量处理；整串匹配、不区分大小写。
 * <p>
 * 空/空白模式匹配一切；模式无法编译或匹配过程中出错时视为“不匹配”，不会中断搜索。
 */
public final class WildcardMatcher {

    private static final WildcardMatcher MATCH_ALL = new WildcardMatcher(null, true);
    private static final WildcardMatcher MATCH_NONE = new WildcardMatcher(null, false);

    private final Pattern pattern;
    private final boolean fallback;

    private WildcardMatcher(Pattern pattern, boolean fallback) {
        this.pattern = pattern;
        this.fallback = fallback;
    }

    public static WildcardMatcher compile(String wildcard) {
        if (wildcard == null || wildcard.isBlank()) {
            return MATCH_ALL;
        }
        try {
            return new WildcardMatcher(Pattern.compile(toRegex(wildcard), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL), false);
        } catch (RuntimeException e) {
            return MATCH_NONE;
        }
    }

    public boolean matches(String name) {
        if (pattern == null) {
            return fallback;
        }
        if (name == null) {
            return false;
        }
        try {
            return pattern.matcher(name).matches();
        } catch (RuntimeException e) {
            // 匹配期异常按不匹配处理
            return false;
        }
    }

    static String toRegex(String wildcard) {
        StringBuilder regex = new StringBuilder(wildcard.length() + 16);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < wildcard.length(); i++) {
            char c = wildcard.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(regex, literal);
        return regex.toString();
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
