package com.example.geotagger;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads file titles from a CSV with a {@code title} column, or from plain text with one title per line.
 */
public class TitleListReader {
    private final CsvMapper csvMapper = new CsvMapper();

    public List<String> read(Path path) throws IOException {
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return readCsv(path);
        }
        List<String> titles = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            String title = line.strip();
            if (!title.isEmpty()) {
                titles.add(title);
            }
        }
        return titles;
    }

    private List<String> readCsv(Path path) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<String> titles = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(path.toFile())) {
            while (rows.hasNext()) {
                String title = rows.next().get("title");
                if (title != null && !title.isBlank()) {
                    titles.add(title.strip());
                }
            }
        }
        return titles;
    }
}
