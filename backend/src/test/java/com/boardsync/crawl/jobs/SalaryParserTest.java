package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.SalaryPeriod;
import com.boardsync.crawl.model.SalaryRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SalaryParserTest {
    private final SalaryParser parser = new SalaryParser();

    @Test
    void parsesThousandsShorthandRange() {
        SalaryRange range = parser.parse("$120K - $150K").orElseThrow();

        assertEquals("$120,000 - $150,000", range.display());
        assertEquals(120_000L, range.min());
        assertEquals(150_000L, range.max());
        assertEquals(SalaryPeriod.YEARLY, range.period());
    }

    @Test
    void parsesHourlyRangeWithToSeparator() {
        SalaryRange range = parser.parse("$45 to $60 per hour").orElseThrow();

        assertEquals(SalaryPeriod.HOURLY, range.period());
        assertThat(range.isHourly()).isTrue();
        assertEquals("$45 - $60", range.display());
    }

    @Test
    void smallAmountWithoutPeriodIsTreatedAsWage() {
        assertEquals(SalaryPeriod.HOURLY, parser.parse("$30").orElseThrow().period());
        assertEquals(SalaryPeriod.MONTHLY, parser.parse("$8,000 per month").orElseThrow().period());
    }

    @Test
    void textWithoutAmountsYieldsNothing() {
        assertThat(parser.parse("Competitive salary and equity")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
