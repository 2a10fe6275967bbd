package naturaldate.domain.strings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LatinCharactersTest {

    @Test
    void testPolishLetters() {
        assertEquals('a', LatinCharacters.toLatin('ą'));
        assertEquals('L', LatinCharacters.toLatin('Ł'));
        assertEquals('z', LatinCharacters.toLatin('ż'));
        assertEquals('z', LatinCharacters.toLatin('ź'));
    }

    @Test
    void testLossyMapping() {
        assertEquals('s', LatinCharacters.toLatin('ß'));
    }

    @Test
    void testUnmappedCharactersAreUnchanged() {
        assertEquals('x', LatinCharacters.toLatin('x'));
        assertEquals('7', LatinCharacters.toLatin('7'));
        assertEquals('Ж', LatinCharacters.toLatin('Ж'));
    }

    @Test
    void testString() {
        assertEquals("Zazolc gesla jazn", LatinCharacters.toLatin("Zażółć gęślą jaźń"));
        assertEquals("Sao Paulo", LatinCharacters.toLatin("São Paulo"));
    }

    @Test
    void testEmptyString() {
        assertEquals("", LatinCharacters.toLatin(""));
    }
}
