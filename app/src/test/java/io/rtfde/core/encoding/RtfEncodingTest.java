package io.rtfde.core.encoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class RtfEncodingTest {

    @Test
    void encodesControlParameterAsPaddedLowerCaseHex() {
        assertThat(RtfEncoding.encodeControlParameter(10)).isEqualTo("0x000a");
        assertThat(RtfEncoding.encodeControlParameter(0)).isEqualTo("0x0000");
        assertThat(RtfEncoding.encodeControlParameter(0xffff)).isEqualTo("0xffff");
    }

    @Test
    void everySixteenBitValueEncodesToSixCharactersAndDecodesBack() {
        for (int n = 0; n <= 0xFFFF; n++) {
            String encoded = RtfEncoding.encodeControlParameter(n);
            assertThat(encoded).hasSize(6).startsWith("0x");
            assertThat(Integer.parseInt(encoded.substring(2), 16)).isEqualTo(n);
        }
    }

    @Test
    void widerAndNegativeValuesAreNotTruncated() {
        assertThat(RtfEncoding.encodeControlParameter(0x10000)).isEqualTo("0x10000");
        assertThat(RtfEncoding.encodeControlParameter(-10)).isEqualTo("-0x00a");
        assertThat(RtfEncoding.encodeControlParameter(-3913)).isEqualTo("-0xf49");
    }

    @Test
    void numericStringEncodesLikeTheInteger() {
        assertThat(RtfEncoding.encodeControlParameter("42")).isEqualTo(RtfEncoding.encodeControlParameter(42));
        assertThat(RtfEncoding.encodeControlParameter(" 42 ")).isEqualTo("0x002a");
        assertThat(RtfEncoding.encodeControlParameter("-10")).isEqualTo("-0x00a");
    }

    @Test
    void nonIntegerStringIsRejectedWithTheOffendingValue() {
        Throwable thrown = catchThrowable(() -> RtfEncoding.encodeControlParameter("4.2"));

        assertThat(thrown)
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'4.2'");
        assertThat(((InvalidParameterException) thrown).value()).isEqualTo("4.2");
    }

    @Test
    void nullAndBlankStringsAreRejected() {
        assertThat(catchThrowable(() -> RtfEncoding.encodeControlParameter((String) null)))
                .isInstanceOf(InvalidParameterException.class);
        assertThat(catchThrowable(() -> RtfEncoding.encodeControlParameter("  ")))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void textWithoutReservedCharactersIsUnchanged() {
        String text = "Plain text, with 'quotes' and café";

        assertThat(RtfEncoding.encodeEscapedControlChars(text)).isSameAs(text);
        assertThat(RtfEncoding.encodeEscapedControlChars("")).isEmpty();
    }

    @Test
    void escapesEachReservedCharacterExactlyOnce() {
        assertThat(RtfEncoding.encodeEscapedControlChars("\\{}")).isEqualTo("\\'5c\\'7b\\'7d");
        assertThat(RtfEncoding.encodeEscapedControlChars("{")).isEqualTo("\\'7b");
        assertThat(RtfEncoding.encodeEscapedControlChars("a\\b")).isEqualTo("a\\'5cb");
    }

    @Test
    void escapingIsNotIdempotentBecauseOutputContainsBackslashes() {
        String once = RtfEncoding.encodeEscapedControlChars("{");

        assertThat(RtfEncoding.encodeEscapedControlChars(once)).isEqualTo("\\'5c'7b");
    }

    @Test
    void rewritesControlSymbolsToHexEscapes() {
        assertThat(RtfEncoding.encodeEscapedControlSymbols("a\\\\b\\{c\\}")).isEqualTo("a\\'5cb\\'7bc\\'7d");
    }

    @Test
    void controlSymbolRewriteLeavesControlWordsAndBareBracesAlone() {
        assertThat(RtfEncoding.encodeEscapedControlSymbols("{\\par x}")).isEqualTo("{\\par x}");
        assertThat(RtfEncoding.encodeEscapedControlSymbols("\\\\{")).isEqualTo("\\'5c{");
        assertThat(RtfEncoding.encodeEscapedControlSymbols("trailing\\")).isEqualTo("trailing\\");
    }
}
