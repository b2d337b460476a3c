package com.spendchat.ledger.dialogue;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class AmountExtractorTest {

    @Test
    void extractsFirstNumberWithOptionalCurrencySign() {
        assertThat(AmountExtractor.extract("Paid 250 for lunch")).contains(new BigDecimal("250"));
        assertThat(AmountExtractor.extract("$12.50 sandwich")).contains(new BigDecimal("12.50"));
        assertThat(AmountExtractor.extract("₹99 chai and 10 samosa")).contains(new BigDecimal("99"));
    }

    @Test
    void isoDatesAreNotAmounts() {
        assertThat(AmountExtractor.extract("2024-03-10 taxi 340")).contains(new BigDecimal("340"));
        assertThat(AmountExtractor.extract("expenses on 2024-03-10")).isEmpty();
    }

    @Test
    void zeroAndMissingAmountsAreEmpty() {
        assertThat(AmountExtractor.extract("spent 0 on nothing")).isEmpty();
        assertThat(AmountExtractor.extract("coffee with friends")).isEmpty();
        assertThat(AmountExtractor.extract(null)).isEmpty();
    }

    @Test
    void parseToleratesSeparatorsAndSigns() {
        assertThat(AmountExtractor.parse("₹1,200.50")).contains(new BigDecimal("1200.50"));
        assertThat(AmountExtractor.parse("twelve")).isEmpty();
        assertThat(AmountExtractor.parse("-4")).isEmpty();
    }
}
