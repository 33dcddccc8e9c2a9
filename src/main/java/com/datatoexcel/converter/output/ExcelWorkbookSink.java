package com.datatoexcel.converter.output;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ScalarNode;
import com.datatoexcel.converter.model.Table;
import com.datatoexcel.converter.naming.LabelledTable;

/**
 * Renders labelled tables as sheets of an {@code .xlsx} workbook, one sheet per table.
 *
 * Sheets are built in memory; the file is only written by {@link #commit()}, through a temporary
 * file in the target directory that then replaces the target.
 */
public class ExcelWorkbookSink implements TableSink {

    private static final Logger log = LoggerFactory.getLogger(ExcelWorkbookSink.class);

    private static final int MAX_TEXT_LENGTH = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    private final Path target;
    private final XSSFWorkbook workbook = new XSSFWorkbook();
    private final CellTextRenderer textRenderer = new CellTextRenderer();
    private final Map<String, String> sheetOwners = new HashMap<>();
    private boolean committed;

    public ExcelWorkbookSink(Path target) {
        this.target = target;
    }

    @Override
    public void write(LabelledTable labelled) {
        if (committed) {
            throw new IllegalStateException("Workbook already committed to " + target);
        }
        Sheet sheet = createSheet(labelled);
        ColumnWidths widths = new ColumnWidths();

        Row header = sheet.createRow(SheetLayout.HEADER_ROW);
        setText(header, SheetLayout.TITLE_COLUMN, labelled.getDisplayName(), widths);
        setText(header, SheetLayout.ROW_NUMBER_COLUMN, SheetLayout.ROW_NUMBER_HEADER, widths);
        List<String> columnLabels = labelled.getColumnLabels();
        for (int c = 0; c < columnLabels.size(); c++) {
            setText(header, SheetLayout.FIRST_DATA_COLUMN + c, columnLabels.get(c), widths);
        }

        Table table = labelled.getTable();
        for (int r = 0; r < table.getRowCount(); r++) {
            Row row = sheet.createRow(SheetLayout.FIRST_DATA_ROW + r);
            int rowNumber = table.rowNumber(r);
            row.createCell(SheetLayout.ROW_NUMBER_COLUMN).setCellValue(rowNumber);
            widths.observe(SheetLayout.ROW_NUMBER_COLUMN, String.valueOf(rowNumber));

            List<DocumentNode> cells = table.getRow(r);
            for (int c = 0; c < cells.size(); c++) {
                setValue(row, SheetLayout.FIRST_DATA_COLUMN + c, cells.get(c), widths);
            }
        }

        if (!labelled.getDisplayName().equals(labelled.getRawName())) {
            Row second = sheet.getRow(SheetLayout.FIRST_DATA_ROW);
            if (second == null) {
                second = sheet.createRow(SheetLayout.FIRST_DATA_ROW);
            }
            setText(second, SheetLayout.TITLE_COLUMN, labelled.getRawName(), widths);
        }

        format(sheet, widths);
        log.debug("Rendered sheet {} from table {} ({} rows, {} columns)", labelled.getDisplayName(),
                labelled.getRawName(), table.getRowCount(), table.getColumnCount());
    }

    @Override
    public void commit() {
        if (committed) {
            return;
        }
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".data-to-excel-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            committed = true;
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to write workbook " + target + ": " + e.getMessage(), e);
        } finally {
            if (!committed && temp != null) {
                deleteTemp(temp);
            }
        }
    }

    @Override
    public void close() {
        try {
            workbook.close();
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to release workbook " + target + ": " + e.getMessage(), e);
        }
    }

    public int getSheetCount() {
        return workbook.getNumberOfSheets();
    }

    private Sheet createSheet(LabelledTable labelled) {
        String name = labelled.getDisplayName();
        try {
            WorkbookUtil.validateSheetName(name);
        } catch (IllegalArgumentException e) {
            throw new WorkbookWriteException("Invalid sheet name '" + name + "' for table " + labelled.getRawName()
                    + ": " + e.getMessage(), e);
        }
        String owner = sheetOwners.putIfAbsent(name.toLowerCase(Locale.ROOT), labelled.getRawName());
        if (owner != null) {
            throw new WorkbookWriteException("Tables " + owner + " and " + labelled.getRawName()
                    + " both map to sheet name '" + name + "'");
        }
        return workbook.createSheet(name);
    }

    private void setValue(Row row, int column, DocumentNode node, ColumnWidths widths) {
        String text = node.accept(textRenderer);
        Object value = ((ScalarNode) node).getValue();
        if (value == null) {
            return;
        }
        Cell cell = row.createCell(column);
        if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
            widths.observe(column, text);
        } else if (value instanceof Boolean bool) {
            cell.setCellValue(bool);
            widths.observe(column, text);
        } else {
            setText(cell, text, widths);
        }
    }

    private void setText(Row row, int column, String text, ColumnWidths widths) {
        setText(row.createCell(column), text, widths);
    }

    private void setText(Cell cell, String text, ColumnWidths widths) {
        String written = text;
        if (written.length() > MAX_TEXT_LENGTH) {
            log.warn("Truncating text of {} characters in sheet {} at {} to {} characters", written.length(),
                    cell.getSheet().getSheetName(), cell.getAddress(), MAX_TEXT_LENGTH);
            written = written.substring(0, MAX_TEXT_LENGTH);
        }
        cell.setCellValue(written);
        widths.observe(cell.getColumnIndex(), written);
    }

    private void format(Sheet sheet, ColumnWidths widths) {
        sheet.setDisplayGridlines(false);
        sheet.createFreezePane(SheetLayout.FIRST_DATA_COLUMN, SheetLayout.FIRST_DATA_ROW);
        widths.apply(sheet);
    }

    private static void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * Longest text per column, turned into a width of that many characters plus padding.
     */
    private static final class ColumnWidths {
        private final Map<Integer, Integer> longest = new HashMap<>();

        void observe(int column, String text) {
            longest.merge(column, text.length(), Math::max);
        }

        void apply(Sheet sheet) {
            longest.forEach((column, length) -> {
                int characters = Math.min(length + SheetLayout.COLUMN_WIDTH_PADDING, SheetLayout.MAX_COLUMN_WIDTH);
                sheet.setColumnWidth(column, characters * 256);
            });
        }
    }
}
