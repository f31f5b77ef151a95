package it.safecourse.common.util;

import it.safecourse.common.dto.identity.FiscalCodeValidationResult;
import it.safecourse.common.dto.identity.Municipality;
import it.safecourse.common.dto.identity.ReverseEngineeredIdentity;
import it.safecourse.common.dto.identity.Sex;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Codec for the Italian fiscal code (Codice Fiscale).
 *
 * Layout of the 16 characters (1-indexed):
 * - 1-3 surname fragment, 4-6 given name fragment
 * - 7-8 birth year, 9 birth month letter
 * - 10-11 birth day (+40 for women)
 * - 12-15 cadastral code of the birth place
 * - 16 check character
 *
 * Positions 7, 8, 10, 11, 13, 14, 15 may carry a letter in place of a digit (omocodia).
 *
 * All methods are stateless and safe to call from any thread.
 */
public final class FiscalCodeCodec {

    public static final int LENGTH = 16;

    static final String ERROR_MISSING = "Codice fiscale mancante";
    static final String ERROR_FORMAT = "Formato non valido";
    static final String WARNING_CHECKSUM = "Attenzione: checksum non valido";
    static final String WARNING_OMOCODIA = "Codice fiscale con omocodia rilevata";
    static final String UNKNOWN_PLACE_PREFIX = "Codice: ";

    private static final Pattern FORMAT_PATTERN =
            Pattern.compile("^[A-Z]{6}[A-Z0-9]{2}[A-Z][A-Z0-9]{2}[A-Z][A-Z0-9]{3}[A-Z]$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_LETTERS = Pattern.compile("[^A-Z]");

    private static final DateTimeFormatter ITALIAN_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    // 0-indexed positions that may carry an omocodia letter
    private static final int[] OMOCODIA_POSITIONS = {6, 7, 9, 10, 12, 13, 14};

    // Index is the digit: L->0, M->1, ..., V->9
    private static final String OMOCODIA_LETTERS = "LMNPQRSTUV";

    private static final Map<Character, Integer> MONTHS = Map.ofEntries(
            Map.entry('A', 1), Map.entry('B', 2), Map.entry('C', 3), Map.entry('D', 4),
            Map.entry('E', 5), Map.entry('H', 6), Map.entry('L', 7), Map.entry('M', 8),
            Map.entry('P', 9), Map.entry('R', 10), Map.entry('S', 11), Map.entry('T', 12)
    );

    // Odd positions (1-indexed): value of 0-9 and of A-Z. Even positions use the plain ordinal.
    private static final int[] ODD_DIGIT_VALUES = {1, 0, 5, 7, 9, 13, 15, 17, 19, 21};
    private static final int[] ODD_LETTER_VALUES = {
            1, 0, 5, 7, 9, 13, 15, 17, 19, 21, 2, 4, 18,
            20, 11, 3, 6, 8, 12, 14, 16, 10, 22, 25, 24, 23
    };

    private static final String VOWELS = "AEIOU";

    private FiscalCodeCodec() {
        // Utility class - no instantiation
    }

    /**
     * Upper-case and remove all whitespace. Null becomes an empty string.
     */
    public static String normalize(String fiscalCode) {
        if (fiscalCode == null) {
            return "";
        }
        return WHITESPACE.matcher(fiscalCode.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Check the positional grammar on an already normalized code.
     */
    public static boolean isWellFormed(String fiscalCode) {
        return fiscalCode != null && FORMAT_PATTERN.matcher(fiscalCode).matches();
    }

    /**
     * Replace omocodia letters with their digits at the substitutable positions.
     * Idempotent; every other character is left as is.
     */
    public static String decodeOmocodia(String fiscalCode) {
        if (fiscalCode == null) {
            return "";
        }
        char[] chars = fiscalCode.toCharArray();
        for (int pos : OMOCODIA_POSITIONS) {
            if (pos >= chars.length) {
                break;
            }
            int digit = OMOCODIA_LETTERS.indexOf(chars[pos]);
            if (digit >= 0) {
                chars[pos] = (char) ('0' + digit);
            }
        }
        return new String(chars);
    }

    /**
     * Compute the check character from the first 15 characters.
     *
     * The sum runs over the literal characters, omocodia letters included.
     *
     * @param first15 at least 15 characters; anything after the 15th is ignored
     * @return check character A-Z
     * @throws IllegalArgumentException if fewer than 15 characters or a non alphanumeric one
     */
    public static char computeCheckCharacter(String first15) {
        String code = normalize(first15);
        if (code.length() < LENGTH - 1) {
            throw new IllegalArgumentException(
                    "At least 15 characters required, got " + code.length());
        }

        int sum = 0;
        for (int i = 0; i < LENGTH - 1; i++) {
            char ch = code.charAt(i);
            boolean oddPosition = (i + 1) % 2 == 1;
            sum += oddPosition ? oddValue(ch) : evenValue(ch);
        }
        return (char) ('A' + sum % 26);
    }

    /**
     * True when the 16th character matches the computed check character.
     * Codes of the wrong length or with invalid characters are never checksum-valid.
     */
    public static boolean isChecksumValid(String fiscalCode) {
        String code = normalize(fiscalCode);
        if (code.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < LENGTH - 1; i++) {
            if (!isAlphanumeric(code.charAt(i))) {
                return false;
            }
        }
        return code.charAt(LENGTH - 1) == computeCheckCharacter(code);
    }

    /**
     * Full validation.
     *
     * Length and character-class problems are errors and make the code invalid.
     * A wrong check character or omocodia letters are only warnings.
     */
    public static FiscalCodeValidationResult validate(String fiscalCode) {
        FiscalCodeValidationResult.FiscalCodeValidationResultBuilder result =
                FiscalCodeValidationResult.builder();

        if (fiscalCode == null || fiscalCode.isBlank()) {
            return result.normalized("").error(ERROR_MISSING).build();
        }

        String code = normalize(fiscalCode);
        result.normalized(code);

        if (code.length() != LENGTH) {
            return result
                    .error(String.format("Lunghezza non valida: %d caratteri (richiesti 16)", code.length()))
                    .build();
        }

        if (!isWellFormed(code)) {
            return result.error(ERROR_FORMAT).build();
        }

        boolean checksumValid = isChecksumValid(code);
        result.checksumValid(checksumValid);
        if (!checksumValid) {
            result.warning(WARNING_CHECKSUM);
        }

        if (!decodeOmocodia(code).equals(code)) {
            result.warning(WARNING_OMOCODIA);
        }

        return result.valid(true).build();
    }

    /**
     * Derive birth date, birth place and sex using the current year for the century.
     */
    public static ReverseEngineeredIdentity reverse(String fiscalCode) {
        return reverse(fiscalCode, Year.now().getValue());
    }

    /**
     * Derive birth date, birth place and sex.
     *
     * Century rule: a two-digit year greater than {@code (currentYear % 100) + 5} is
     * read as 19xx, anything else as 20xx. People older than about 95 years come out
     * a century too young.
     *
     * @param fiscalCode  raw fiscal code
     * @param currentYear reference year for the century rule
     * @return derived identity; all fields null when the code is not well formed
     */
    public static ReverseEngineeredIdentity reverse(String fiscalCode, int currentYear) {
        String code = normalize(fiscalCode);
        if (!isWellFormed(code)) {
            return ReverseEngineeredIdentity.empty();
        }

        String decoded = decodeOmocodia(code);
        ReverseEngineeredIdentity.ReverseEngineeredIdentityBuilder identity = ReverseEngineeredIdentity.builder();

        Integer year = parseTwoDigits(decoded.substring(6, 8));
        if (year != null) {
            year += year > (currentYear % 100) + 5 ? 1900 : 2000;
        }
        Integer month = MONTHS.get(code.charAt(8));

        Integer day = parseTwoDigits(decoded.substring(9, 11));
        if (day != null) {
            if (day > 40) {
                identity.sex(Sex.F);
                day -= 40;
            } else {
                identity.sex(Sex.M);
            }
        }

        identity.birthYear(year)
                .birthMonth(month)
                .birthDay(day)
                .birthDate(toDate(year, month, day));

        String cadastralCode = decoded.substring(11, 15);
        identity.cadastralCode(cadastralCode);

        Optional<Municipality> municipality = MunicipalityTable.find(cadastralCode);
        if (municipality.isPresent()) {
            identity.birthPlace(municipality.get().getName())
                    .province(municipality.get().getProvince());
        } else {
            identity.birthPlace(UNKNOWN_PLACE_PREFIX + cadastralCode);
        }

        return identity.build();
    }

    /**
     * Format a birth date the Italian way (dd/MM/yyyy). Null becomes an empty string.
     */
    public static String formatBirthDate(LocalDate birthDate) {
        return birthDate == null ? "" : birthDate.format(ITALIAN_DATE);
    }

    /**
     * Build the first six characters of a fiscal code from surname and given name.
     *
     * Each part takes consonants then vowels, padded with X to three characters.
     * A given name with more than three consonants uses the 1st, 3rd and 4th consonant.
     */
    public static String generateNameFragment(String surname, String givenName) {
        return fragment(surname, false) + fragment(givenName, true);
    }

    /**
     * True when the first six characters of the code are the ones generated from the names.
     */
    public static boolean matchesName(String fiscalCode, String surname, String givenName) {
        if (fiscalCode == null || surname == null || surname.isBlank()
                || givenName == null || givenName.isBlank()) {
            return false;
        }
        String code = normalize(fiscalCode);
        if (code.length() != LENGTH) {
            return false;
        }
        return code.substring(0, 6).equals(generateNameFragment(surname, givenName));
    }

    private static String fragment(String name, boolean givenName) {
        String letters = name == null
                ? ""
                : NON_LETTERS.matcher(name.toUpperCase(Locale.ROOT)).replaceAll("");

        StringBuilder consonants = new StringBuilder();
        StringBuilder vowels = new StringBuilder();
        for (char ch : letters.toCharArray()) {
            if (VOWELS.indexOf(ch) >= 0) {
                vowels.append(ch);
            } else {
                consonants.append(ch);
            }
        }

        if (givenName && consonants.length() > 3) {
            return "" + consonants.charAt(0) + consonants.charAt(2) + consonants.charAt(3);
        }

        return (consonants.append(vowels).append("XXX")).substring(0, 3);
    }

    private static LocalDate toDate(Integer year, Integer month, Integer day) {
        if (year == null || month == null || day == null) {
            return null;
        }
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            // Components stay available on the identity, only the composed date is dropped
            return null;
        }
    }

    private static Integer parseTwoDigits(String value) {
        if (value.length() != 2 || !Character.isDigit(value.charAt(0)) || !Character.isDigit(value.charAt(1))) {
            return null;
        }
        return (value.charAt(0) - '0') * 10 + (value.charAt(1) - '0');
    }

    private static int oddValue(char ch) {
        if (ch >= '0' && ch <= '9') {
            return ODD_DIGIT_VALUES[ch - '0'];
        }
        if (ch >= 'A' && ch <= 'Z') {
            return ODD_LETTER_VALUES[ch - 'A'];
        }
        throw new IllegalArgumentException("Invalid fiscal code character: " + ch);
    }

    private static int evenValue(char ch) {
        if (ch >= '0' && ch <= '9') {
            return ch - '0';
        }
        if (ch >= 'A' && ch <= 'Z') {
            return ch - 'A';
        }
        throw new IllegalArgumentException("Invalid fiscal code character: " + ch);
    }

    private static boolean isAlphanumeric(char ch) {
        return (ch >= '0' && ch <= '9') || (ch >= 'A' && ch <= 'Z');
    }
}
