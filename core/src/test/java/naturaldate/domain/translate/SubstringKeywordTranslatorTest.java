package naturaldate.domain.translate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SubstringKeywordTranslatorTest {

    private final SubstringKeywordTranslator translator = new SubstringKeywordTranslator();

    @Test
    void testWholeWord() {
        assertEquals("at 5", translator.translate("kolo 5"));
        assertEquals("yesterday", translator.translate("wczoraj"));
    }

    @Test
    void testKeyInsideWordIsReplaced() {
        assertEquals("m at nday", translator.translate("Monday"));
    }

    @Test
    void testLaterKeysSeeEarlierReplacements() {
        // "jutro" becomes "tomorrow", whose letters "o" are then replaced too
        assertEquals("t at m at rr at w", translator.translate("jutro"));
    }

    @Test
    void testNoKeys() {
        assertEquals("next friday", translator.translate("next friday"));
    }
}
