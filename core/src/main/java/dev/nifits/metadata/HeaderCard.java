/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.metadata;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One header card: keyword, value and comment.
 * <p>
 * Values are {@code String}, {@code Long}, {@code Double}, {@code Boolean}, or {@code null}
 * for an undefined value. Commentary cards ({@code COMMENT}, {@code HISTORY} and blank
 * keywords) have no value; their text is held in {@code comment}.
 * </p>
 */
public record HeaderCard(String keyword, Object value, String comment) {

    private static final Set<String> COMMENTARY_KEYWORDS = Set.of("COMMENT", "HISTORY", "");

    public HeaderCard {
        Objects.requireNonNull(keyword, "keyword");
        keyword = keyword.trim().toUpperCase(Locale.ROOT);
        comment = comment == null || comment.isBlank() ? null : comment.stripTrailing();
        value = normalizeValue(keyword, value);
        if (COMMENTARY_KEYWORDS.contains(keyword) && value != null) {
            throw new IllegalArgumentException("Commentary card " + keyword + " cannot have a value");
        }
    }

    public HeaderCard(String keyword, Object value) {
        this(keyword, value, null);
    }

    public static HeaderCard commentary(String keyword, String text) {
        return new HeaderCard(keyword, null, text);
    }

    public boolean isCommentary() {
        return COMMENTARY_KEYWORDS.contains(keyword);
    }

    static Object normalizeValue(String keyword, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Double) {
            if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                throw new IllegalArgumentException("Non-finite value for keyword " + keyword + ": " + d);
            }
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return normalizeValue(keyword, f.doubleValue());
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        throw new IllegalArgumentException("Unsupported value type for keyword " + keyword + ": "
                + value.getClass().getName());
    }

    @Override
    public String toString() {
        if (isCommentary()) {
            return keyword + " " + (comment == null ? "" : comment);
        }
        StringBuilder sb = new StringBuilder(keyword).append(" = ");
        sb.append(value instanceof String ? "'" + value + "'" : String.valueOf(value));
        if (comment != null && !comment.isEmpty()) {
            sb.append(" / ").append(comment);
        }
        return sb.toString();
    }
}
