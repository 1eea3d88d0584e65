package io.github.flexsource.parser;

import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.Partition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Implementation of {@link FormatReader} that reads one sheet of an Excel workbook ({@code .xls}
 * or {@code .xlsx}) with Apache POI.
 *
 * <p>
 * Supported parameters:
 * </p>
 * <ul>
 * <li>{@code sheet_name}: sheet index or name, default {@code 0}</li>
 * <li>{@code header}: whether the first row holds the column names, default {@code true}</li>
 * <li>{@code dtype}: {@code str} reads every cell as its displayed text; otherwise cells keep their
 * type ({@link String}, {@link Double}, {@link Boolean}, {@link java.time.LocalDateTime})</li>
 * <li>{@code na_filter}: whether NA markers become missing values, default {@code true}</li>
 * <li>{@code include_path_column}: default {@code true}</li>
 * </ul>
 *
 * <p>
 * Workbooks are loaded whole when the partition is computed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ExcelFormatReader extends FileFormatReader {

    /**
     * {@inheritDoc}
     */
    @Override
    protected FilePartition inspect(Path file, ReaderParameters params) throws IOException {
        Object sheetName = params.get("sheet_name") == null ? 0 : params.get("sheet_name");
        boolean header = params.getBoolean("header", true);
        boolean asText = "str".equals(params.getString(DTYPE, null));
        boolean naFilter = params.getBoolean(NA_FILTER, true);

        List<String> names;
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            Sheet sheet = resolveSheet(workbook, sheetName);
            Row first = sheet.getRow(sheet.getFirstRowNum());
            int width = first == null ? 0 : Math.max(first.getLastCellNum(), 0);
            if (header && first != null) {
                DataFormatter formatter = new DataFormatter();
                names = deduplicate(IntStream.range(0, width)
                        .mapToObj(i -> formatter.formatCellValue(first.getCell(i)).trim())
                        .collect(Collectors.toList()));
            } else {
                names = IntStream.range(0, width).mapToObj(String::valueOf)
                        .collect(Collectors.toList());
            }
        }
        Function<String, Column> toColumn = asText ? Column::string : Column::object;
        List<Column> columns = names.stream().map(toColumn).collect(Collectors.toList());

        Partition rows = () -> readRows(file, sheetName, header, names.size(), asText, naFilter)
                .stream();
        return new FilePartition(columns, rows);
    }

    private static List<DataRow> readRows(Path file, Object sheetName, boolean header, int width,
            boolean asText, boolean naFilter) {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            Sheet sheet = resolveSheet(workbook, sheetName);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            DataFormatter formatter = new DataFormatter();
            int firstDataRow = sheet.getFirstRowNum() + (header ? 1 : 0);

            List<DataRow> rows = new ArrayList<>();
            for (int r = firstDataRow; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<Object> values = new ArrayList<>(width);
                for (int c = 0; c < width; c++) {
                    Cell cell = row == null ? null : row.getCell(c);
                    values.add(cellValue(cell, asText, naFilter, formatter, evaluator));
                }
                rows.add(new DataRow((long) (r - firstDataRow), values));
            }
            return rows;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workbook: " + file, e);
        }
    }

    private static Sheet resolveSheet(Workbook workbook, Object sheetName) {
        Sheet sheet;
        if (sheetName instanceof Number) {
            sheet = workbook.getSheetAt(((Number) sheetName).intValue());
        } else if (StringUtils.isNumeric(String.valueOf(sheetName))) {
            sheet = workbook.getSheetAt(Integer.parseInt(String.valueOf(sheetName)));
        } else {
            sheet = workbook.getSheet(String.valueOf(sheetName));
        }
        if (sheet == null) {
            throw new IllegalArgumentException("No such sheet: " + sheetName);
        }
        return sheet;
    }

    private static Object cellValue(Cell cell, boolean asText, boolean naFilter,
            DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return null;
        }
        if (asText) {
            return filterNa(formatter.formatCellValue(cell, evaluator), naFilter);
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING:
                return filterNa(cell.getStringCellValue(), naFilter);
            case NUMERIC:
                return DateUtil.isCellDateFormatted(cell) ? cell.getLocalDateTimeCellValue()
                        : cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case BLANK:
                return filterNa("", naFilter);
            default:
                return null;
        }
    }
}
