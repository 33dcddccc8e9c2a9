package com.datatoexcel.converter.convert;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datatoexcel.converter.config.ConverterConfig;
import com.datatoexcel.converter.flatten.FlatteningEngine;
import com.datatoexcel.converter.flatten.FlatteningException;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.RowReindexer;
import com.datatoexcel.converter.model.Table;
import com.datatoexcel.converter.naming.LabelledTable;
import com.datatoexcel.converter.naming.NamingRegistry;
import com.datatoexcel.converter.naming.NamingRegistryException;
import com.datatoexcel.converter.naming.NamingRegistryLoader;
import com.datatoexcel.converter.naming.TableLabeler;
import com.datatoexcel.converter.output.ExcelWorkbookSink;
import com.datatoexcel.converter.output.TableSink;
import com.datatoexcel.converter.output.WorkbookWriteException;
import com.datatoexcel.converter.parser.DocumentParseException;
import com.datatoexcel.converter.parser.DocumentParsers;

/**
 * Converts one source document into a workbook with a sheet per flattened table.
 *
 * Pipeline: parse, flatten, reindex rows, sort by raw table name, label, write.
 */
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final ConverterConfig config;
    private final Function<Path, TableSink> sinkFactory;

    public ConversionService(ConverterConfig config) {
        this(config, ExcelWorkbookSink::new);
    }

    public ConversionService(ConverterConfig config, Function<Path, TableSink> sinkFactory) {
        this.config = config;
        this.sinkFactory = sinkFactory;
    }

    public ConversionResult convert() {
        return convert(ProgressListener.NONE);
    }

    public ConversionResult convert(ProgressListener progress) {
        long start = System.nanoTime();
        Path output = config.getOutputPath();
        try {
            if (Files.exists(output) && !config.isForce()) {
                return ConversionResult.failure("Output file already exists: " + output + ". Use --force to overwrite.");
            }

            log.info("Step 1: Parsing {} document {}", config.getSourceFormat().getLabel(), config.getInputPath());
            ObjectNode document = DocumentParsers.forFormat(config.getSourceFormat()).parse(config.getInputPath());

            log.info("Step 2: Loading naming registry...");
            NamingRegistry registry = loadRegistry();

            log.info("Step 3: Flattening document...");
            Map<String, Table> tables = new FlatteningEngine(config.getEmptyTablePolicy()).flatten(document);
            List<LabelledTable> sheets = emissionOrder(tables, new TableLabeler(registry));

            log.info("Step 4: Writing {} sheets to {}", sheets.size(), output);
            ConversionResult.ConversionResultBuilder result = ConversionResult.builder()
                    .success(true)
                    .outputPath(output)
                    .tablesFlattened(tables.size())
                    .tablesWritten(sheets.size());
            int rows = 0;
            try (TableSink sink = sinkFactory.apply(output)) {
                progress.started(sheets.size());
                for (int i = 0; i < sheets.size(); i++) {
                    LabelledTable sheet = sheets.get(i);
                    sink.write(sheet);
                    rows += sheet.getTable().getRowCount();
                    result.sheetName(sheet.getDisplayName());
                    progress.advanced(i + 1, sheets.size());
                }
                sink.commit();
            } finally {
                progress.finished();
            }

            return result
                    .rowsWritten(rows)
                    .elapsed(Duration.ofNanos(System.nanoTime() - start))
                    .build();

        } catch (DocumentParseException | FlatteningException | NamingRegistryException | WorkbookWriteException e) {
            return ConversionResult.failure(e.getMessage());
        }
    }

    /**
     * Tables as they are handed to a sink: rows numbered from 1, ordered by raw table name, labelled.
     */
    public static List<LabelledTable> emissionOrder(Map<String, Table> tables, TableLabeler labeler) {
        RowReindexer reindexer = new RowReindexer();
        Map<String, Table> sorted = new TreeMap<>(reindexer.reindexAll(tables));
        List<LabelledTable> labelled = new ArrayList<>(sorted.size());
        sorted.values().forEach(table -> labelled.add(labeler.label(table)));
        return labelled;
    }

    private NamingRegistry loadRegistry() {
        NamingRegistryLoader loader = new NamingRegistryLoader();
        if (config.getNamingRegistryPath() != null) {
            return loader.load(config.getNamingRegistryPath());
        }
        return loader.loadDefault();
    }
}
