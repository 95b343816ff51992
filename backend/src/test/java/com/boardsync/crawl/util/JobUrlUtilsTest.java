package com.boardsync.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobUrlUtilsTest {

    @Test
    void normalizeDropsTrackingFragmentAndTrailingSlash() {
        String normalized = JobUrlUtils.normalize(
            "HTTPS://Boards.Greenhouse.io/acme/jobs/123/?utm_source=linkedin&page=2#apply"
        );

        assertThat(normalized).isEqualTo("https://boards.greenhouse.io/acme/jobs/123?page=2");
    }

    @Test
    void variantsOfTheSameUrlNormalizeToOneKey() {
        String a = JobUrlUtils.normalize("https://jobs.lever.co/acme/0b5c6a7e-1111-2222-3333-444455556666");
        String b = JobUrlUtils.normalize("https://jobs.lever.co:443/acme/0b5c6a7e-1111-2222-3333-444455556666/?ref=board");

        assertThat(a).isEqualTo(b);
    }

    @Test
    void normalizeKeepsUnparseableInputTrimmed() {
        assertThat(JobUrlUtils.normalize("  not a url  ")).isEqualTo("not a url");
        assertThat(JobUrlUtils.normalize("   ")).isNull();
    }

    @Test
    void resolveIgnoresAnchorsAndScriptLinks() {
        assertThat(JobUrlUtils.resolve("https://acme.com/careers", "/careers/engineer-1"))
            .isEqualTo("https://acme.com/careers/engineer-1");
        assertThat(JobUrlUtils.resolve("https://acme.com/careers", "#open-roles")).isNull();
        assertThat(JobUrlUtils.resolve("https://acme.com/careers", "javascript:void(0)")).isNull();
        assertThat(JobUrlUtils.resolve("https://acme.com/careers", "mailto:jobs@acme.com")).isNull();
    }

    @Test
    void atsReferralParametersDoNotChangeTheIdentityKey() {
        String plain = JobUrlUtils.normalize("https://boards.greenhouse.io/acme/jobs/123");

        assertThat(JobUrlUtils.normalize("https://boards.greenhouse.io/acme/jobs/123?gh_src=8f2a1c"))
            .isEqualTo(plain);
        assertThat(JobUrlUtils.normalize("https://www.acme.com/careers?gh_jid=123&gh_src=8f2a1c"))
            .isEqualTo("https://www.acme.com/careers?gh_jid=123");
        assertThat(JobUrlUtils.normalize("https://jobs.lever.co/acme/abc-123?lever-origin=applied&lever-source%5B%5D=LinkedIn"))
            .isEqualTo(JobUrlUtils.normalize("https://jobs.lever.co/acme/abc-123?lever-source%5B%5D=Indeed"));
    }
}
