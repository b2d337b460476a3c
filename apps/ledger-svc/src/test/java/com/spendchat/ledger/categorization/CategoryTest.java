package com.spendchat.ledger.categorization;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CategoryTest {

    @Test
    void labelsFollowDeclarationOrder() {
        assertThat(Category.labels()).hasSize(35);
        assertThat(Category.labels().get(0)).isEqualTo("food");
        assertThat(Category.labels().get(34)).isEqualTo("others");
        assertThat(Category.labels()).doesNotHaveDuplicates();
    }

    @Test
    void fromLabelIsCaseInsensitiveAndAcceptsSpaces() {
        assertThat(Category.fromLabel("Personal Care")).contains(Category.PERSONAL_CARE);
        assertThat(Category.fromLabel(" TRAVEL ")).contains(Category.TRAVEL);
        assertThat(Category.fromLabel("spaceship")).isEmpty();
        assertThat(Category.fromLabel(null)).isEmpty();
    }

    @Test
    void displayNameTitleCasesEachWord() {
        assertThat(Category.ONLINE_FOOD.displayName()).isEqualTo("Online Food");
        assertThat(Category.COFFEE.displayName()).isEqualTo("Coffee");
        assertThat(Category.TRAVEL.glyph()).isEqualTo("✈️");
    }
}
