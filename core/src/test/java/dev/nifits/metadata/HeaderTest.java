/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.metadata;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for headers and header cards.
 */
public class HeaderTest {

    @Test
    void testSetReplacesInPlaceAndKeepsComment() {
        Header header = new Header();
        header.set("A", 1, "first");
        header.set("B", "two");
        header.set("a", 3);

        assertThat(header.getCards()).extracting(HeaderCard::keyword).containsExactly("A", "B");
        assertThat(header.getLong("A")).isEqualTo(3);
        assertThat(header.getCard("A").comment()).isEqualTo("first");
    }

    @Test
    void testCommentaryCardsAccumulate() {
        Header header = new Header();
        header.addCommentary("HISTORY", "one");
        header.addCommentary("HISTORY", "two");

        assertThat(header.size()).isEqualTo(2);
    }

    @Test
    void testValuesNormalized() {
        Header header = new Header();
        header.set("INT", 5);
        header.set("FLT", 0.5f);
        header.set("CHR", 'x');

        assertThat(header.get("INT")).isEqualTo(5L);
        assertThat(header.get("FLT")).isEqualTo(0.5);
        assertThat(header.get("CHR")).isEqualTo("x");
        assertThat(header.getDouble("INT")).isEqualTo(5.0);
    }

    @Test
    void testTypedGettersRejectMissingAndMistyped() {
        Header header = new Header();
        header.set("NAME", "value");

        assertThatThrownBy(() -> header.getString("MISSING"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> header.getLong("NAME"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(header.getLong("MISSING", 7)).isEqualTo(7);
        assertThat(header.getBoolean("MISSING", true)).isTrue();
    }

    @Test
    void testNonFiniteValuesRejected() {
        assertThatThrownBy(() -> new HeaderCard("X", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(HeaderCard.commentary("COMMENT", "ok").value()).isNull();
        assertThatThrownBy(() -> new HeaderCard("COMMENT", "value"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCopyIsIndependent() {
        Header header = new Header();
        header.set("A", 1);
        Header copy = header.copy();
        copy.set("A", 2);

        assertThat(header.getLong("A")).isEqualTo(1);
        assertThat(header.copy()).isEqualTo(header);
    }
}
