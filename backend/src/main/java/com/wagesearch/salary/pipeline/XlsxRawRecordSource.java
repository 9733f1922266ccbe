package com.wagesearch.salary.pipeline;

import com.wagesearch.salary.model.RawCell;
import com.wagesearch.salary.model.RawRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the first (or a named) sheet of a workbook; row 0 is the header.
 */
public class XlsxRawRecordSource implements RawRecordSource {
    private final Path path;
    private final String sheetName;

    public XlsxRawRecordSource(Path path, String sheetName) {
        this.path = path;
        this.sheetName = sheetName;
    }

    @Override
    public Stream<RawRow> rows() throws IOException {
        Workbook workbook = WorkbookFactory.create(path.toFile(), null, true);
        try {
            Sheet sheet = sheetName != null && !sheetName.isBlank()
                ? workbook.getSheet(sheetName)
                : workbook.getSheetAt(0);
            if (sheet == null) {
                throw new IOException("Sheet not found: " + sheetName);
            }
            Iterator<Row> iterator = sheet.iterator();
            List<String> headers = iterator.hasNext() ? readHeaders(iterator.next()) : List.of();
            Stream<Row> dataRows = StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false
            );
            return dataRows
                .map(row -> toRow(row, headers))
                .onClose(() -> closeWorkbook(workbook));
        } catch (IOException | RuntimeException e) {
            workbook.close();
            throw e;
        }
    }

    @Override
    public String describe() {
        return "xlsx:" + path + (sheetName == null || sheetName.isBlank() ? "" : "#" + sheetName);
    }

    private List<String> readHeaders(Row headerRow) {
        List<String> headers = new ArrayList<>();
        for (int i = 0; i < headerRow.getLastCellNum(); i++) {
            Cell cell = headerRow.getCell(i);
            headers.add(cell == null ? "" : cellText(cell));
        }
        return headers;
    }

    private RawRow toRow(Row row, List<String> headers) {
        Map<String, RawCell> cells = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isBlank()) {
                continue;
            }
            cells.put(header, toCell(row.getCell(i)));
        }
        return new RawRow(row.getRowNum(), cells);
    }

    private RawCell toCell(Cell cell) {
        if (cell == null) {
            return RawCell.ABSENT;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
            ? cell.getCachedFormulaResultType()
            : cell.getCellType();
        switch (type) {
            case STRING:
                return RawCell.text(cell.getStringCellValue());
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return RawCell.text(cell.getLocalDateTimeCellValue().toString());
                }
                return RawCell.number(cell.getNumericCellValue());
            case BOOLEAN:
                return RawCell.text(String.valueOf(cell.getBooleanCellValue()));
            default:
                return RawCell.ABSENT;
        }
    }

    private String cellText(Cell cell) {
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                return String.valueOf((long) cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    private void closeWorkbook(Workbook workbook) {
        try {
            workbook.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
