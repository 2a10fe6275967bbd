package naturaldate.domain.strings;

import java.util.Map;

/**
 * Maps Latin letters carrying diacritics to their ASCII base letter.
 * This is not a full transliteration system, only a curated set of characters is mapped and some mappings
 * are lossy ('ß' maps to 's').
 */
public final class LatinCharacters {
    private static final Map<Character, Character> TRANSLITERATIONS = Map.ofEntries(
            Map.entry('İ', 'I'),
            Map.entry('À', 'A'),
            Map.entry('Á', 'A'),
            Map.entry('Â', 'A'),
            Map.entry('Ä', 'A'),
            Map.entry('Å', 'A'),
            Map.entry('Æ', 'A'),
            Map.entry('Ç', 'C'),
            Map.entry('È', 'E'),
            Map.entry('É', 'E'),
            Map.entry('Ê', 'E'),
            Map.entry('Ë', 'E'),
            Map.entry('Ì', 'I'),
            Map.entry('Í', 'I'),
            Map.entry('Î', 'I'),
            Map.entry('Ï', 'I'),
            Map.entry('Ñ', 'N'),
            Map.entry('Ò', 'O'),
            Map.entry('Ó', 'O'),
            Map.entry('Ô', 'O'),
            Map.entry('Ö', 'O'),
            Map.entry('Ø', 'O'),
            Map.entry('Ù', 'U'),
            Map.entry('Ú', 'U'),
            Map.entry('Û', 'U'),
            Map.entry('Ü', 'U'),
            Map.entry('ß', 's'),
            Map.entry('à', 'a'),
            Map.entry('á', 'a'),
            Map.entry('â', 'a'),
            Map.entry('ä', 'a'),
            Map.entry('å', 'a'),
            Map.entry('æ', 'a'),
            Map.entry('ç', 'c'),
            Map.entry('è', 'e'),
            Map.entry('é', 'e'),
            Map.entry('ê', 'e'),
            Map.entry('ë', 'e'),
            Map.entry('ì', 'i'),
            Map.entry('í', 'i'),
            Map.entry('î', 'i'),
            Map.entry('ï', 'i'),
            Map.entry('ñ', 'n'),
            Map.entry('ò', 'o'),
            Map.entry('ó', 'o'),
            Map.entry('ô', 'o'),
            Map.entry('ö', 'o'),
            Map.entry('ø', 'o'),
            Map.entry('ù', 'u'),
            Map.entry('ú', 'u'),
            Map.entry('û', 'u'),
            Map.entry('ü', 'u'),
            Map.entry('Ā', 'A'),
            Map.entry('ā', 'a'),
            Map.entry('Ă', 'A'),
            Map.entry('ă', 'a'),
            Map.entry('Ą', 'A'),
            Map.entry('ą', 'a'),
            Map.entry('Ć', 'C'),
            Map.entry('ć', 'c'),
            Map.entry('Č', 'C'),
            Map.entry('č', 'c'),
            Map.entry('Ď', 'D'),
            Map.entry('ď', 'd'),
            Map.entry('Đ', 'D'),
            Map.entry('đ', 'd'),
            Map.entry('Ē', 'E'),
            Map.entry('ē', 'e'),
            Map.entry('Ė', 'E'),
            Map.entry('ė', 'e'),
            Map.entry('Ę', 'E'),
            Map.entry('ę', 'e'),
            Map.entry('Ě', 'E'),
            Map.entry('ě', 'e'),
            Map.entry('Ğ', 'G'),
            Map.entry('ğ', 'g'),
            Map.entry('Ģ', 'G'),
            Map.entry('ģ', 'g'),
            Map.entry('Ī', 'I'),
            Map.entry('ī', 'i'),
            Map.entry('Į', 'I'),
            Map.entry('į', 'i'),
            Map.entry('ı', 'i'),
            Map.entry('Ķ', 'K'),
            Map.entry('ķ', 'k'),
            Map.entry('Ĺ', 'L'),
            Map.entry('ĺ', 'l'),
            Map.entry('Ļ', 'L'),
            Map.entry('ļ', 'l'),
            Map.entry('Ľ', 'L'),
            Map.entry('ľ', 'l'),
            Map.entry('Ł', 'L'),
            Map.entry('ł', 'l'),
            Map.entry('Ń', 'N'),
            Map.entry('ń', 'n'),
            Map.entry('Ņ', 'N'),
            Map.entry('ņ', 'n'),
            Map.entry('Ň', 'N'),
            Map.entry('ň', 'n'),
            Map.entry('Ő', 'O'),
            Map.entry('ő', 'o'),
            Map.entry('Ŕ', 'R'),
            Map.entry('ŕ', 'r'),
            Map.entry('Ř', 'R'),
            Map.entry('ř', 'r'),
            Map.entry('Ś', 'S'),
            Map.entry('ś', 's'),
            Map.entry('Ş', 'S'),
            Map.entry('ş', 's'),
            Map.entry('Š', 'S'),
            Map.entry('š', 's'),
            Map.entry('Ť', 'T'),
            Map.entry('ť', 't'),
            Map.entry('Ū', 'U'),
            Map.entry('ū', 'u'),
            Map.entry('Ů', 'U'),
            Map.entry('ů', 'u'),
            Map.entry('Ű', 'U'),
            Map.entry('ű', 'u'),
            Map.entry('Ų', 'U'),
            Map.entry('ų', 'u'),
            Map.entry('Ź', 'Z'),
            Map.entry('ź', 'z'),
            Map.entry('Ż', 'Z'),
            Map.entry('ż', 'z'),
            Map.entry('Ž', 'Z'),
            Map.entry('ž', 'z'),
            Map.entry('Ș', 'S'),
            Map.entry('ș', 's'),
            Map.entry('Ț', 'T'),
            Map.entry('ț', 't')
    );

    private LatinCharacters() {
    }

    /**
     * @param value The character to convert
     * @return The mapped ASCII letter when known, otherwise the original character
     */
    public static char toLatin(final char value) {
        return TRANSLITERATIONS.getOrDefault(value, value);
    }

    public static String toLatin(final String value) {
        final char[] buffer = value.toCharArray();

        for (int i = 0; i < buffer.length; ++i) {
            buffer[i] = toLatin(buffer[i]);
        }

        return new String(buffer);
    }
}
