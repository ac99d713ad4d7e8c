package com.sarkari.jobfeed.scrape.normalize;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class RangeParserTest {

    @Test
    void explicitRangeWins() {
        RangeParser.Range range = RangeParser.parse("Pay Level 7: Rs. 44,900 to 1,42,400");

        assertThat(range.bound()).isEqualTo(RangeParser.Bound.RANGE);
        assertThat(range.min()).isEqualByComparingTo(new BigDecimal("44900"));
        assertThat(range.max()).isEqualByComparingTo(new BigDecimal("142400"));
    }

    @Test
    void reversedRangeIsOrdered() {
        RangeParser.Range range = RangeParser.parse("between 30 and 21");

        assertThat(range.min()).isEqualByComparingTo("21");
        assertThat(range.max()).isEqualByComparingTo("30");
    }

    @Test
    void maximumOnlyLeavesMinimumEmpty() {
        RangeParser.Range range = RangeParser.parse("Upto 25000 per month");

        assertThat(range.bound()).isEqualTo(RangeParser.Bound.MAX_ONLY);
        assertThat(range.min()).isNull();
        assertThat(range.max()).isEqualByComparingTo("25000");
    }

    @Test
    void minimumOnlyLeavesMaximumEmpty() {
        RangeParser.Range range = RangeParser.parse("Minimum 18 years");

        assertThat(range.bound()).isEqualTo(RangeParser.Bound.MIN_ONLY);
        assertThat(range.minAsInt()).isEqualTo(18);
        assertThat(range.max()).isNull();
    }

    @Test
    void singleSalaryValueFillsBothEnds() {
        RangeParser.Range range = RangeParser.parse("Rs 56,100");

        assertThat(range.min()).isEqualByComparingTo("56100");
        assertThat(range.max()).isEqualByComparingTo("56100");
    }

    @Test
    void singleAgeValueIsAnUpperLimit() {
        RangeParser.Range range = RangeParser.parseAge("32 years");

        assertThat(range.minAsInt()).isNull();
        assertThat(range.maxAsInt()).isEqualTo(32);
    }

    @Test
    void textWithoutNumbersIsEmpty() {
        assertThat(RangeParser.parse("As per rules").isEmpty()).isTrue();
    }

    @Test
    void feeWordsMeanZero() {
        assertThat(MoneyParser.parseFee("No Fee for SC/ST")).isEqualByComparingTo("0.00");
        assertThat(MoneyParser.parseFee("Exempted")).isEqualByComparingTo("0.00");
        assertThat(MoneyParser.parseFee("General: ₹1,000, SC/ST: ₹250")).isEqualByComparingTo("1000.00");
        assertThat(MoneyParser.parseFee("see notification")).isNull();
    }
}
