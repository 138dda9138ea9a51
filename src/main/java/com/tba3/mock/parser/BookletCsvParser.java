package com.tba3.mock.parser;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.booklet.BookletKey;
import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.booklet.BookletModels.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

@Component
public class BookletCsvParser {
    private static final Logger log = LoggerFactory.getLogger(BookletCsvParser.class);

    static final Set<String> REQUIRED_COLUMNS = Set.of(
            "vera", "tjahr", "fach", "iqbtestheft_id", "iqbitem_id", "name", "kstufe", "itemnr_th");
    private static final List<String> COMPETENCE_STANDARD_COLUMNS = List.of("kompstd1", "kompstd2", "kompstd3");
    private static final List<String> MATH_COMPETENCE_COLUMNS = List.of(
            "K1", "K2", "K3", "K4", "K5", "K6", "A1", "A2", "A3", "A4", "A5");
    private static final List<String> CORE_IDEA_COLUMNS = List.of("L1", "L2", "L3", "L4", "L5");
    // "detailiert" is a misspelling found in some source files
    private static final Map<String, String> STYLE_COLUMNS = new LinkedHashMap<>();

    static {
        STYLE_COLUMNS.put("selektiv", "selektiv");
        STYLE_COLUMNS.put("detailliert", "detailliert");
        STYLE_COLUMNS.put("detailiert", "detailliert");
        STYLE_COLUMNS.put("inferierend", "inferierend");
        STYLE_COLUMNS.put("global", "global");
    }

    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(';');

    public BookletCatalog loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Metadata directory not found: {}", directory);
            return BookletCatalog.empty();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(".csv")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list metadata directory " + directory, e);
        }

        Map<BookletKey, List<Item>> items = new LinkedHashMap<>();
        for (Path file : files) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
                parse(reader, file.getFileName().toString())
                        .forEach((key, rows) -> items.computeIfAbsent(key, k -> new ArrayList<>()).addAll(rows));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read booklet metadata " + file, e);
            }
        }

        Map<BookletKey, Booklet> booklets = new LinkedHashMap<>();
        items.forEach((key, rows) -> booklets.put(key, new Booklet(key, rows)));
        log.info("Loaded {} booklets from {} ({} files)", booklets.size(), directory, files.size());
        return new BookletCatalog(booklets);
    }

    public Map<BookletKey, List<Item>> parse(Reader reader, String source) throws IOException {
        Map<BookletKey, List<Item>> result = new LinkedHashMap<>();
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
            rows.hasNext(); // consumes the header so the schema is known
            Set<String> columns = new HashSet<>();
            if (rows.getParserSchema() instanceof CsvSchema header) {
                header.forEach(c -> columns.add(c.getName()));
            }
            Set<String> missing = new TreeSet<>(REQUIRED_COLUMNS);
            missing.removeAll(columns);
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("CSV " + source + " missing required column(s): " + missing);
            }
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                String model = blankToNull(row.get("model"));
                if (model != null && !"global".equals(model)) {
                    continue;
                }
                BookletKey key = new BookletKey(
                        parseInt(row.get("vera"), "vera", source),
                        parseInt(row.get("tjahr"), "tjahr", source),
                        required(row, "fach", source),
                        required(row, "iqbtestheft_id", source));
                result.computeIfAbsent(key, k -> new ArrayList<>()).add(toItem(row, source));
            }
        }
        return result;
    }

    private Item toItem(Map<String, String> row, String source) {
        List<String> competenceStandard = COMPETENCE_STANDARD_COLUMNS.stream()
                .map(c -> blankToNull(row.get(c)))
                .filter(Objects::nonNull)
                .toList();
        String style = STYLE_COLUMNS.entrySet().stream()
                .filter(e -> flag(row.get(e.getKey())))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        String afb = blankToNull(row.get("AFB"));

        return new Item(
                required(row, "iqbitem_id", source),
                row.get("name"),
                parseDouble(row.get("logit")),
                parseDouble(row.get("bista")),
                required(row, "kstufe", source),
                blankToNull(row.get("domain")),
                required(row, "itemnr_th", source),
                parseDouble(row.get("itemord_th")),
                parseOptionalDouble(row.get("lh_gs")),
                parseOptionalDouble(row.get("lh_gy")),
                parseOptionalDouble(row.get("lh_ng")),
                competenceStandard.isEmpty() ? null : competenceStandard,
                style,
                flags(row, MATH_COMPETENCE_COLUMNS),
                flags(row, CORE_IDEA_COLUMNS),
                afb == null ? null : String.valueOf((int) parseDouble(afb)));
    }

    private static List<String> flags(Map<String, String> row, List<String> columns) {
        List<String> set = columns.stream().filter(c -> flag(row.get(c))).toList();
        return set.isEmpty() ? null : set;
    }

    private static boolean flag(String value) {
        return value != null && value.trim().equals("1");
    }

    private static String required(Map<String, String> row, String column, String source) {
        String value = blankToNull(row.get(column));
        if (value == null) {
            throw new IllegalArgumentException("CSV " + source + ": empty value in required column " + column);
        }
        return value;
    }

    private static int parseInt(String value, String column, String source) {
        try {
            return Integer.parseInt(value == null ? "" : value.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("CSV " + source + ": column " + column + " is not an integer: " + value, e);
        }
    }

    static double parseDouble(String value) {
        Double parsed = parseOptionalDouble(value);
        return parsed == null ? 0.0 : parsed;
    }

    static Double parseOptionalDouble(String value) {
        String v = blankToNull(value);
        return v == null ? null : Double.parseDouble(v.replace(',', '.'));
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
