package com.wagesearch.salary.pipeline;

import com.wagesearch.salary.model.RawCell;
import com.wagesearch.salary.model.RawRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

public class CsvRawRecordSource implements RawRecordSource {
    private final Path path;

    public CsvRawRecordSource(Path path) {
        this.path = path;
    }

    @Override
    public Stream<RawRow> rows() throws IOException {
        Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        CSVParser parser;
        try {
            parser = csvParser(reader);
        } catch (IOException e) {
            reader.close();
            throw e;
        }
        return parser.stream()
            .map(this::toRow)
            .onClose(() -> {
                try {
                    parser.close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
    }

    @Override
    public String describe() {
        return "csv:" + path;
    }

    private RawRow toRow(CSVRecord record) {
        Map<String, RawCell> cells = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : record.toMap().entrySet()) {
            cells.put(entry.getKey(), RawCell.text(entry.getValue()));
        }
        return new RawRow(record.getRecordNumber(), cells);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setAllowMissingColumnNames(true)
            .build();
        return format.parse(reader);
    }
}
