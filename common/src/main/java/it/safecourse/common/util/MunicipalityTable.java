package it.safecourse.common.util;

import it.safecourse.common.dto.identity.Municipality;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sample of Italian municipalities keyed by cadastral code.
 *
 * This is NOT the national registry. A code missing from the table is an expected
 * outcome and callers should surface the raw code instead.
 */
public final class MunicipalityTable {

    private static final Map<String, Municipality> BY_CODE = Stream.of(
            new Municipality("A001", "ABANO TERME", "PD"),
            new Municipality("A004", "ABBADIA CERRETO", "LO"),
            new Municipality("A662", "BELPASSO", "CT"),
            new Municipality("A944", "BARI", "BA"),
            new Municipality("B354", "BOLOGNA", "BO"),
            new Municipality("C351", "CATANIA", "CT"),
            new Municipality("D612", "FIRENZE", "FI"),
            new Municipality("D969", "GENOVA", "GE"),
            new Municipality("F205", "MILANO", "MI"),
            new Municipality("F839", "NAPOLI", "NA"),
            new Municipality("G273", "PALERMO", "PA"),
            new Municipality("H501", "ROMA", "RM"),
            new Municipality("L219", "TORINO", "TO"),
            new Municipality("L736", "VENEZIA", "VE"),
            new Municipality("L781", "VERONA", "VR")
    ).collect(Collectors.toUnmodifiableMap(Municipality::getCadastralCode, Function.identity()));

    private MunicipalityTable() {
        // Utility class - no instantiation
    }

    /**
     * Look up a municipality by cadastral code (case and surrounding whitespace ignored).
     */
    public static Optional<Municipality> find(String cadastralCode) {
        if (cadastralCode == null || cadastralCode.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(cadastralCode.trim().toUpperCase(Locale.ROOT)));
    }

    public static int size() {
        return BY_CODE.size();
    }
}
