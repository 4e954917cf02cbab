/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.internal.fits;

import java.util.Iterator;
import java.util.regex.Pattern;

import dev.nifits.metadata.Header;
import dev.nifits.metadata.HeaderCard;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;

/**
 * Copies header cards between {@link Header} and the nom.tam FITS header model.
 * <p>
 * Keywords longer than eight characters, or containing blanks, use the {@code HIERARCH}
 * convention on disk; nom.tam names them {@code HIERARCH.A.B}, which is read back as
 * {@code A B}.
 * </p>
 */
public final class HeaderConverter {

    private static final String HIERARCH = "HIERARCH.";
    private static final int SHORT_KEYWORD_LENGTH = 8;

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]{1,18}");
    private static final Pattern REAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([EeDd][+-]?[0-9]+)?");

    static {
        FitsFactory.setUseHierarch(true);
        FitsFactory.setLongStringsEnabled(true);
    }

    private HeaderConverter() {
    }

    /**
     * Reads all cards of a nom.tam header, in order. The {@code END} card is dropped.
     */
    public static Header toHeader(nom.tam.fits.Header source) {
        Header header = new Header();
        Iterator<nom.tam.fits.HeaderCard> cards = source.iterator();
        while (cards.hasNext()) {
            nom.tam.fits.HeaderCard card = cards.next();
            String key = card.getKey() == null ? "" : card.getKey();
            if (key.equals("END")) {
                continue;
            }
            String keyword = key.startsWith(HIERARCH) ? key.substring(HIERARCH.length()).replace('.', ' ') : key;
            if (!card.isKeyValuePair()) {
                header.add(HeaderCard.commentary(keyword, card.getComment()));
            }
            else if (card.isStringValue()) {
                header.add(new HeaderCard(keyword, card.getValue(), card.getComment()));
            }
            else {
                header.add(new HeaderCard(keyword, parseLiteral(card.getValue()), card.getComment()));
            }
        }
        return header;
    }

    static Object parseLiteral(String text) {
        String value = text.trim();
        if (value.equals("T")) {
            return Boolean.TRUE;
        }
        if (value.equals("F")) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(value).matches()) {
            return Long.parseLong(value);
        }
        if (REAL.matcher(value).matches()) {
            return Double.parseDouble(value.replace('D', 'E').replace('d', 'e'));
        }
        // complex and other literals are kept verbatim
        return value;
    }

    /**
     * Appends or replaces one card in a nom.tam header. Cards without a value are written
     * in commentary style.
     */
    public static void addCard(nom.tam.fits.Header target, HeaderCard card) throws FitsException {
        String key = toFitsKeyword(card.keyword());
        Object value = card.value();
        if (value == null) {
            String text = card.comment() == null ? "" : card.comment();
            switch (card.keyword()) {
                case "COMMENT" -> target.insertComment(text);
                case "HISTORY" -> target.insertHistory(text);
                default -> target.insertCommentStyle(key, text);
            }
        }
        else if (value instanceof Boolean b) {
            target.addValue(key, b.booleanValue(), card.comment());
        }
        else if (value instanceof Long l) {
            target.addValue(key, l.longValue(), card.comment());
        }
        else if (value instanceof Double d) {
            target.addValue(key, d.doubleValue(), card.comment());
        }
        else {
            target.addValue(key, value.toString(), card.comment());
        }
    }

    static String toFitsKeyword(String keyword) {
        if (keyword.length() > SHORT_KEYWORD_LENGTH || keyword.indexOf(' ') >= 0) {
            return HIERARCH + keyword.replace(' ', '.');
        }
        return keyword;
    }
}
