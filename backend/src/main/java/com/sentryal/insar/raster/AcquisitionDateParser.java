package com.sentryal.insar.raster;

import com.sentryal.insar.exception.UnparsableFilenameException;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the acquisition date encoded in a product filename.
 *
 * <p>Sentinel-1 pair products are named {@code S1AA_<reference>_<secondary>_...} with
 * each date either {@code YYYYMMDD} or {@code YYYYMMDDTHHMMSS}. The secondary date is the
 * acquisition the displacement is measured at, so that one is returned. Any other name
 * falls back to the first standalone {@code YYYYMMDD} group that is a real date.
 */
public final class AcquisitionDateParser {

    private static final Pattern SENTINEL_PAIR =
            Pattern.compile("S1[AB][AB]_(\\d{8})(?:T\\d{6})?_(\\d{8})(?:T\\d{6})?");
    private static final Pattern STANDALONE_DATE = Pattern.compile("(?<!\\d)(\\d{8})(?!\\d)");
    private static final DateTimeFormatter BASIC_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private AcquisitionDateParser() {
    }

    public static LocalDate parse(String filename) {
        return tryParse(filename).orElseThrow(() -> new UnparsableFilenameException(filename));
    }

    public static Optional<LocalDate> tryParse(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        Path name = Path.of(filename).getFileName();
        String base = name == null ? filename : name.toString();

        Matcher pair = SENTINEL_PAIR.matcher(base);
        if (pair.find()) {
            Optional<LocalDate> secondary = toDate(pair.group(2));
            if (secondary.isPresent()) {
                return secondary;
            }
        }

        Matcher standalone = STANDALONE_DATE.matcher(base);
        while (standalone.find()) {
            Optional<LocalDate> date = toDate(standalone.group(1));
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> toDate(String digits) {
        try {
            return Optional.of(LocalDate.parse(digits, BASIC_DATE));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
