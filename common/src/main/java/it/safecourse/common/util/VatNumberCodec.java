package it.safecourse.common.util;

import it.safecourse.common.dto.identity.VatNumberInfo;
import it.safecourse.common.dto.identity.VatValidationResult;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Codec for the Italian VAT number (Partita IVA).
 *
 * Format: 11 digits
 * - digits 1-7 taxpayer code
 * - digits 8-10 provincial office code
 * - digit 11 check digit
 */
public final class VatNumberCodec {

    public static final int LENGTH = 11;
    public static final String COUNTRY_PREFIX = "IT";

    static final String ERROR_MISSING = "Partita IVA mancante";
    static final String ERROR_FORMAT = "Formato non valido: la partita IVA deve contenere solo cifre";
    static final String ERROR_ALL_ZEROS = "Partita IVA non valida: tutti zeri";
    static final String WARNING_CHECKSUM = "Attenzione: checksum non valido";
    static final String WARNING_OFFICE = "Codice ufficio provinciale insolito";

    private static final Pattern VAT_PATTERN = Pattern.compile("^[0-9]{11}$");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String ALL_ZEROS = "00000000000";

    private VatNumberCodec() {
        // Utility class - no instantiation
    }

    /**
     * Normalize a VAT number: upper-case, drop whitespace and hyphens, drop a leading IT prefix.
     */
    public static String normalize(String vatNumber) {
        if (vatNumber == null) {
            return "";
        }
        String cleaned = SEPARATORS.matcher(vatNumber.toUpperCase(Locale.ROOT)).replaceAll("");
        return cleaned.startsWith(COUNTRY_PREFIX) ? cleaned.substring(COUNTRY_PREFIX.length()) : cleaned;
    }

    /**
     * True for exactly 11 digits.
     */
    public static boolean isWellFormed(String vatNumber) {
        return vatNumber != null && VAT_PATTERN.matcher(vatNumber).matches();
    }

    /**
     * Compute the check digit from the first 10 digits.
     *
     * Digits at odd positions (1-indexed) are summed as they are; digits at even
     * positions are doubled, minus 9 when the result exceeds 9.
     *
     * @throws IllegalArgumentException if the input does not start with 10 digits
     */
    public static int computeCheckDigit(String first10) {
        if (first10 == null || first10.length() < LENGTH - 1) {
            throw new IllegalArgumentException("At least 10 digits required");
        }

        int sum = 0;
        for (int i = 0; i < LENGTH - 1; i++) {
            char ch = first10.charAt(i);
            if (ch < '0' || ch > '9') {
                throw new IllegalArgumentException("Invalid VAT number digit: " + ch);
            }
            int digit = ch - '0';
            if (i % 2 == 0) {
                sum += digit;
            } else {
                int doubled = digit * 2;
                sum += doubled > 9 ? doubled - 9 : doubled;
            }
        }

        int remainder = sum % 10;
        return remainder == 0 ? 0 : 10 - remainder;
    }

    /**
     * True when the number is well formed and its last digit matches the computed one.
     */
    public static boolean isChecksumValid(String vatNumber) {
        if (!isWellFormed(vatNumber)) {
            return false;
        }
        return vatNumber.charAt(LENGTH - 1) - '0' == computeCheckDigit(vatNumber);
    }

    /**
     * Split a VAT number into taxpayer, office and check digit.
     *
     * @return empty when the normalized value is not 11 digits
     */
    public static Optional<VatNumberInfo> extractInfo(String vatNumber) {
        String normalized = normalize(vatNumber);
        if (!isWellFormed(normalized)) {
            return Optional.empty();
        }
        return Optional.of(new VatNumberInfo(
                normalized.substring(0, 7),
                normalized.substring(7, 10),
                normalized.substring(10)
        ));
    }

    /**
     * Full validation.
     *
     * Length, non-digit and all-zero values are errors. A wrong check digit or an
     * unusual office code are warnings only.
     */
    public static VatValidationResult validate(String vatNumber) {
        VatValidationResult.VatValidationResultBuilder result = VatValidationResult.builder().formatted("");

        if (vatNumber == null || vatNumber.isBlank()) {
            return result.error(ERROR_MISSING).build();
        }

        String normalized = normalize(vatNumber);
        result.formatted(normalized);

        if (normalized.length() != LENGTH) {
            return result
                    .error(String.format("Lunghezza non valida: %d cifre (richieste 11)", normalized.length()))
                    .build();
        }

        if (!isWellFormed(normalized)) {
            return result.error(ERROR_FORMAT).build();
        }

        if (ALL_ZEROS.equals(normalized)) {
            return result.error(ERROR_ALL_ZEROS).build();
        }

        boolean checksumValid = isChecksumValid(normalized);
        result.checksumValid(checksumValid);
        if (!checksumValid) {
            result.warning(WARNING_CHECKSUM);
        }

        if (!isKnownOfficeCode(Integer.parseInt(normalized.substring(7, 10)))) {
            result.warning(WARNING_OFFICE);
        }

        return result.valid(true).build();
    }

    /**
     * Prefix a well-formed number with IT. Anything else is returned unchanged.
     */
    public static String formatWithCountryPrefix(String vatNumber) {
        String normalized = normalize(vatNumber);
        if (isWellFormed(normalized)) {
            return COUNTRY_PREFIX + normalized;
        }
        return vatNumber;
    }

    /**
     * Compare two VAT numbers after normalization.
     */
    public static boolean sameNumber(String first, String second) {
        if (first == null || second == null) {
            return false;
        }
        return normalize(first).equals(normalize(second));
    }

    // Offices 001-100, plus 120 and 121. New codes are issued now and then.
    private static boolean isKnownOfficeCode(int officeCode) {
        return (officeCode >= 1 && officeCode <= 100) || officeCode == 120 || officeCode == 121;
    }
}
