package com.knowledgedesk.ragbot.service.ingestion;

import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace tokenizer that also emits every CJK ideograph, kana or full-width symbol as its own token,
 * since those scripts do not separate words with spaces.
 */
public final class TokenCounter {

    private TokenCounter() {
    }

    public static int count(String text) {
        return text == null ? 0 : tokenize(text).size();
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
                flush(current, tokens);
            } else if (isWide(codePoint)) {
                flush(current, tokens);
                tokens.add(new String(Character.toChars(codePoint)));
            } else {
                current.appendCodePoint(codePoint);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    public static String join(List<String> tokens) {
        StringBuilder builder = new StringBuilder();
        String previous = null;
        for (String token : tokens) {
            appendJoined(builder, previous, token, " ");
            previous = token;
        }
        return builder.toString();
    }

    static void appendJoined(StringBuilder builder, String previous, String token, String separator) {
        if (previous != null && !(isWideToken(previous) && isWideToken(token))) {
            builder.append(separator);
        } else if (previous != null && "\n".equals(separator)) {
            builder.append(separator);
        }
        builder.append(token);
    }

    static boolean isWideToken(String token) {
        return token.codePointCount(0, token.length()) == 1 && isWide(token.codePointAt(0));
    }

    static boolean isWide(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        if (script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA) {
            return true;
        }
        Character.UnicodeBlock block = Character.UnicodeBlock.of(codePoint);
        return block == Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION
                || (block == Character.UnicodeBlock.HALFWIDTH_AND_FULLWIDTH_FORMS && codePoint < 0xFF61);
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
