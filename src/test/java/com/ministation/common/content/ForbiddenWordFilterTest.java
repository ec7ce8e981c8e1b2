package com.ministation.common.content;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ForbiddenWordFilterTest {

    @Test
    void sanitize_ShouldMaskIgnoringCase() {
        ForbiddenWordFilter filter = new ForbiddenWordFilter(List.of("scamcoin"));

        assertThat(filter.sanitize("Buy ScamCoin now, scamcoin!")).isEqualTo("Buy *** now, ***!");
    }

    @Test
    void sanitize_ShouldPreferLongerWords() {
        ForbiddenWordFilter filter = new ForbiddenWordFilter(List.of("free", "free-crypto-giveaway"));

        assertThat(filter.sanitize("join the free-crypto-giveaway")).isEqualTo("join the ***");
    }

    @Test
    void sanitize_ShouldPassThroughCleanOrEmptyText() {
        ForbiddenWordFilter filter = new ForbiddenWordFilter(List.of("scamcoin", " ", ""));

        assertThat(filter.sanitize("station roadmap")).isEqualTo("station roadmap");
        assertThat(filter.sanitize("")).isEmpty();
        assertThat(filter.sanitize(null)).isNull();
    }

    @Test
    void classpathList_ShouldSkipCommentLines() {
        ForbiddenWordFilter filter = new ForbiddenWordFilter(new ClassPathResource("forbidden-words.txt"));

        assertThat(filter.sanitize("you shithead")).isEqualTo("you ***");
        assertThat(filter.sanitize("# comment")).isEqualTo("# comment");
    }

    @Test
    void missingResource_ShouldDisableFiltering() {
        ForbiddenWordFilter filter = new ForbiddenWordFilter(new ClassPathResource("no-such-file.txt"));

        assertThat(filter.sanitize("scamcoin")).isEqualTo("scamcoin");
    }
}
