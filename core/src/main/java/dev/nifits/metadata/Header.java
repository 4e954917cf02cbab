/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Ordered, mutable list of header cards with case-insensitive keyword lookup.
 * <p>
 * Value keywords are unique: {@link #set(String, Object)} replaces an existing card in
 * place. Commentary cards may repeat and are appended with {@link #addCommentary}.
 * </p>
 */
public final class Header implements Iterable<HeaderCard> {

    private final List<HeaderCard> cards;

    public Header() {
        this.cards = new ArrayList<>();
    }

    public Header(List<HeaderCard> cards) {
        this();
        for (HeaderCard card : cards) {
            add(card);
        }
    }

    public static Header of(HeaderCard... cards) {
        return new Header(List.of(cards));
    }

    /**
     * Appends a card, or replaces the card with the same keyword for value cards.
     */
    public Header add(HeaderCard card) {
        if (card.isCommentary()) {
            cards.add(card);
            return this;
        }
        int index = indexOf(card.keyword());
        if (index >= 0) {
            cards.set(index, card);
        }
        else {
            cards.add(card);
        }
        return this;
    }

    /**
     * Sets a value, keeping the existing comment if the keyword is already present.
     */
    public Header set(String keyword, Object value) {
        HeaderCard existing = getCard(keyword);
        return add(new HeaderCard(keyword, value, existing != null ? existing.comment() : null));
    }

    public Header set(String keyword, Object value, String comment) {
        return add(new HeaderCard(keyword, value, comment));
    }

    public Header addCommentary(String keyword, String text) {
        return add(HeaderCard.commentary(keyword, text));
    }

    public boolean remove(String keyword) {
        int index = indexOf(keyword);
        if (index < 0) {
            return false;
        }
        cards.remove(index);
        return true;
    }

    public boolean contains(String keyword) {
        return indexOf(keyword) >= 0;
    }

    /**
     * @return the first card with the given keyword, or {@code null}
     */
    public HeaderCard getCard(String keyword) {
        int index = indexOf(keyword);
        return index >= 0 ? cards.get(index) : null;
    }

    /**
     * @return the value for the keyword, or {@code null} if absent or undefined
     */
    public Object get(String keyword) {
        HeaderCard card = getCard(keyword);
        return card != null ? card.value() : null;
    }

    public String getString(String keyword) {
        Object value = require(keyword);
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("Keyword " + keyword + " is not a string: " + value);
        }
        return s;
    }

    public String getString(String keyword, String defaultValue) {
        Object value = get(keyword);
        return value instanceof String s ? s : defaultValue;
    }

    public long getLong(String keyword) {
        Object value = require(keyword);
        if (!(value instanceof Long l)) {
            throw new IllegalArgumentException("Keyword " + keyword + " is not an integer: " + value);
        }
        return l;
    }

    public long getLong(String keyword, long defaultValue) {
        Object value = get(keyword);
        return value instanceof Long l ? l : defaultValue;
    }

    public int getInt(String keyword) {
        return Math.toIntExact(getLong(keyword));
    }

    /**
     * Returns a numeric value; integer values are widened.
     */
    public double getDouble(String keyword) {
        Object value = require(keyword);
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("Keyword " + keyword + " is not numeric: " + value);
        }
        return n.doubleValue();
    }

    public double getDouble(String keyword, double defaultValue) {
        Object value = get(keyword);
        return value instanceof Number n ? n.doubleValue() : defaultValue;
    }

    public boolean getBoolean(String keyword, boolean defaultValue) {
        Object value = get(keyword);
        return value instanceof Boolean b ? b : defaultValue;
    }

    private Object require(String keyword) {
        Object value = get(keyword);
        if (value == null) {
            throw new IllegalArgumentException("Missing keyword: " + keyword);
        }
        return value;
    }

    private int indexOf(String keyword) {
        String key = keyword.trim().toUpperCase(Locale.ROOT);
        for (int i = 0; i < cards.size(); i++) {
            HeaderCard card = cards.get(i);
            if (!card.isCommentary() && card.keyword().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    public List<HeaderCard> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    @Override
    public Iterator<HeaderCard> iterator() {
        return getCards().iterator();
    }

    /**
     * Independent copy; cards are immutable so a shallow list copy suffices.
     */
    public Header copy() {
        Header copy = new Header();
        copy.cards.addAll(cards);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Header other && cards.equals(other.cards));
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (HeaderCard card : cards) {
            sb.append(card).append('\n');
        }
        return sb.toString();
    }
}
