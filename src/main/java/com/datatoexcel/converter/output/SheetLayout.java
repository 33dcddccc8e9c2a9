package com.datatoexcel.converter.output;

import lombok.experimental.UtilityClass;

/**
 * Cell positions used when a table is rendered on a sheet.
 *
 * Row 0 is the header row. Column A holds the display name (and the raw path below it when it
 * differs), column B stays empty, column C holds the row numbers and data starts in column D.
 */
@UtilityClass
public class SheetLayout {

    public static final int HEADER_ROW = 0;
    public static final int FIRST_DATA_ROW = 1;

    public static final int TITLE_COLUMN = 0;
    public static final int ROW_NUMBER_COLUMN = 2;
    public static final int FIRST_DATA_COLUMN = 3;

    public static final String ROW_NUMBER_HEADER = "nr";

    /** Extra characters added to the longest text of a column. */
    public static final int COLUMN_WIDTH_PADDING = 5;
    /** Largest column width Excel accepts, in characters. */
    public static final int MAX_COLUMN_WIDTH = 255;
}
