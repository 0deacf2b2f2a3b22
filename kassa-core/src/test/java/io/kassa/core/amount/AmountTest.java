package io.kassa.core.amount;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class AmountTest {

    @Test
    void shouldParseAndPrintCanonically() {
        assertThat(Amount.parse("EUR:10.50")).isEqualTo(new Amount("EUR", 10, 50_000_000));
        assertThat(Amount.parse("EUR:10.50").toString()).isEqualTo("EUR:10.5");
        assertThat(Amount.parse("KUDOS:0.00000001").toString()).isEqualTo("KUDOS:0.00000001");
        assertThat(Amount.parse("EUR:7").toString()).isEqualTo("EUR:7");
        assertThat(Amount.parse("eur:1")).isEqualTo(Amount.parse("EUR:1"));
    }

    @Test
    void shouldUppercaseCurrencyRegardlessOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Amount amount = Amount.parse("bitcoin:1");

            assertThat(amount.currency()).isEqualTo("BITCOIN");
            assertThat(amount).isEqualTo(Amount.parse("BITCOIN:1"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shouldRejectMalformedInput() {
        for (String raw : new String[] {"EUR", "EUR:", ":5", "EUR:1.", "EUR:-1", "EUR:1.123456789", "EUR:1,5", "VERYLONGCURRENCY:1"}) {
            assertThatThrownBy(() -> Amount.parse(raw)).as(raw).isInstanceOf(AmountFormatException.class);
        }
    }

    @Test
    void shouldCarryFractionOnAddition() {
        Amount sum = Amount.parse("EUR:0.6").add(Amount.parse("EUR:0.7"));

        assertThat(sum).isEqualTo(Amount.parse("EUR:1.3"));
    }

    @Test
    void shouldBorrowOnSubtractionAndRefuseNegativeResults() {
        assertThat(Amount.parse("EUR:2.1").subtract(Amount.parse("EUR:0.2"))).contains(Amount.parse("EUR:1.9"));
        assertThat(Amount.parse("EUR:1").subtract(Amount.parse("EUR:1.01"))).isEmpty();
        assertThat(Amount.parse("EUR:1").subtractOrZero(Amount.parse("EUR:3"))).isEqualTo(Amount.zero("EUR"));
    }

    @Test
    void shouldDivideRoundingDown() {
        assertThat(Amount.parse("EUR:1").divide(3)).isEqualTo(new Amount("EUR", 0, 33_333_333));
        assertThat(Amount.parse("EUR:7.5").divide(2)).isEqualTo(Amount.parse("EUR:3.75"));
        assertThatThrownBy(() -> Amount.parse("EUR:1").divide(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRefuseMixingCurrencies() {
        Amount euro = Amount.parse("EUR:1");
        Amount kudos = Amount.parse("KUDOS:1");

        assertThat(euro.sameCurrency(kudos)).isFalse();
        assertThatThrownBy(() -> euro.add(kudos)).isInstanceOf(CurrencyMismatchException.class);
        assertThatThrownBy(() -> euro.greaterThan(kudos)).isInstanceOf(CurrencyMismatchException.class);
    }

    @Test
    void shouldDetectOverflow() {
        Amount max = new Amount("EUR", Amount.MAX_VALUE, 0);

        assertThatThrownBy(() -> max.add(Amount.parse("EUR:1"))).isInstanceOf(AmountOverflowException.class);
        assertThatThrownBy(() -> Amount.parse("EUR:99999999999999999999")).isInstanceOf(AmountOverflowException.class);
    }

    @Test
    void shouldCompareByValueThenFraction() {
        assertThat(Amount.parse("EUR:2").greaterThan(Amount.parse("EUR:1.99"))).isTrue();
        assertThat(Amount.parse("EUR:1.5").atLeast(Amount.parse("EUR:1.50"))).isTrue();
        assertThat(Amount.zero("EUR").isZero()).isTrue();
    }

    @Test
    void shouldEncodeNetworkByteOrder() {
        byte[] nbo = Amount.parse("EUR:1.5").toNbo();

        assertThat(nbo).hasSize(Amount.NBO_SIZE);
        assertThat(nbo[7]).isEqualTo((byte) 1);
        assertThat(new String(nbo, 12, 3, StandardCharsets.US_ASCII)).isEqualTo("EUR");
        assertThat(nbo[15]).isZero();
    }
}
