package com.codemeter.core.counting;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileLineStats}.
 */
class FileLineStatsTest {

    @Test
    void code_isTotalMinusBlankAndComment() {
        assertThat(new FileLineStats(10, 3, 2).code()).isEqualTo(5);
        assertThat(FileLineStats.EMPTY.code()).isZero();
    }

    @Test
    void constructor_negativeCount_throws() {
        assertThatThrownBy(() -> new FileLineStats(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_moreBlankAndCommentThanTotal_throws() {
        assertThatThrownBy(() -> new FileLineStats(2, 2, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
