package com.ministation.domain.service;

import com.ministation.domain.config.StationProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlugServiceTest {

    @Test
    void slugify_ShouldCollapseNonAlphanumerics() {
        assertThat(SlugService.slugify("  Rust & Friends!! ", 50)).isEqualTo("rust-friends");
        assertThat(SlugService.slugify("Café Zürich", 50)).isEqualTo("caf-z-rich");
        assertThat(SlugService.slugify("--Already-Slugged--", 50)).isEqualTo("already-slugged");
    }

    @Test
    void slugify_EmptyResult_ShouldFallback() {
        assertThat(SlugService.slugify("!!!", 50)).isEqualTo(SlugService.FALLBACK);
        assertThat(SlugService.slugify("", 50)).isEqualTo(SlugService.FALLBACK);
        assertThat(SlugService.slugify(null, 50)).isEqualTo(SlugService.FALLBACK);
    }

    @Test
    void slugify_ShouldTruncateWithoutTrailingDash() {
        assertThat(SlugService.slugify("abcd efgh", 5)).isEqualTo("abcd");
    }

    @Test
    void candidate_ShouldAppendSuffixWithinLimit() {
        assertThat(SlugService.candidate("mars-base", 0, 50)).isEqualTo("mars-base");
        assertThat(SlugService.candidate("mars-base", 1, 50)).isEqualTo("mars-base-1");
        assertThat(SlugService.candidate("abcdefghij", 12, 10)).isEqualTo("abcdefg-12");
        assertThat(SlugService.candidate("abcdefghij", 12, 10)).hasSizeLessThanOrEqualTo(10);
    }

    @Test
    void instanceMethods_ShouldUseConfiguredMaxLength() {
        StationProperties props = new StationProperties();
        props.setSlugMaxLength(8);
        SlugService svc = new SlugService(props);

        assertThat(svc.slugify("Deep Space Nine")).isEqualTo("deep-spa");
        assertThat(svc.candidate("deep-spa", 3)).isEqualTo("deep-s-3");
    }
}
