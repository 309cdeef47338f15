package com.paperharvest.backend.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.model.dto.ExportRecordDTO;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes stored articles as CSV or JSON lines, in insertion order
 */
@Slf4j
@Service
public class ArticleExporter {

    // Lets spreadsheet tools detect UTF-8
    static final char BOM = '\uFEFF';

    private final ArticleStore articleStore;
    private final ObjectWriter jsonWriter;
    private final ObjectWriter csvWriter;

    public ArticleExporter(ArticleStore articleStore) {
        this.articleStore = articleStore;
        this.jsonWriter = new ObjectMapper()
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writerFor(ExportRecordDTO.class);
        CsvMapper csvMapper = new CsvMapper();
        csvMapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        CsvSchema schema = csvMapper.schemaFor(ExportRecordDTO.class).withHeader();
        this.csvWriter = csvMapper.writerFor(ExportRecordDTO.class).with(schema);
    }

    /**
     * Writes every stored record, or only those discovered from {@code searchUrl} when given.
     *
     * @return number of records written
     */
    public int export(Writer writer, ExportFormat format, String searchUrl) throws IOException {
        List<ExportRecordDTO> records = articleStore.findForExport(searchUrl).stream()
                .map(ExportRecordDTO::from)
                .collect(Collectors.toList());

        if (format == ExportFormat.CSV) {
            writer.write(BOM);
            csvWriter.writeValues(writer).writeAll(records).close();
        } else {
            for (ExportRecordDTO record : records) {
                writer.write(jsonWriter.writeValueAsString(record));
                writer.write('\n');
            }
        }
        writer.flush();
        log.info("Exported {} records as {}", records.size(), format.getExtension());
        return records.size();
    }

    public int exportToFile(Path path, ExportFormat format, String searchUrl) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            int count = export(writer, format, searchUrl);
            log.info("Wrote {} records to {}", count, path);
            return count;
        }
    }
}
