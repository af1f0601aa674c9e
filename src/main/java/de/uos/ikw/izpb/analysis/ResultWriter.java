package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.formats.AggregateRow;
import de.uos.ikw.izpb.formats.AuthorGenderRow;
import de.uos.ikw.izpb.formats.MentionRow;
import de.uos.ikw.izpb.formats.OccurrenceRow;
import de.uos.ikw.izpb.schemas.AggregateRecord;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.Granularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.createFolder;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.writeAllRows;

/**
 * Writes the result tables under the output folder, every file name carrying the output suffix.
 */
public class ResultWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResultWriter.class);

    private final AnalysisConfig.Output output;

    public ResultWriter(AnalysisConfig.Output output) {
        this.output = output;
    }

    public void writeStatistics(Granularity granularity, List<AggregateRecord> records) throws IOException {
        write("stats_" + granularity.tableName(), AggregateRow.class,
                records.stream().map(AggregateRow::of).toList());
    }

    public void writeMentions(List<ArticleAnalysis> analyses) throws IOException {
        write("mentions", MentionRow.class, analyses.stream()
                .flatMap(analysis -> analysis.mentions().stream())
                .map(MentionRow::of)
                .toList());
    }

    public void writeOccurrences(Map<String, List<OccurrenceRow>> tables) throws IOException {
        for (Map.Entry<String, List<OccurrenceRow>> table : tables.entrySet()) {
            write(table.getKey(), OccurrenceRow.class, table.getValue());
        }
    }

    public void writeAuthorGenders(List<AuthorGenderInference.AuthorGender> genders) throws IOException {
        write("authors_aig", AuthorGenderRow.class, genders.stream()
                .map(g -> new AuthorGenderRow(g.author().id(), g.author().name(), g.knowledgeBase().label(),
                        g.pronouns().label(), g.prns().label(), g.combined().label()))
                .toList());
    }

    private <T> void write(String name, Class<T> type, List<T> rows) throws IOException {
        createFolder(output.path());
        Path file = output.file(name);
        writeAllRows(file, type, rows);
        logger.info("Wrote {} rows to {}", rows.size(), file);
    }
}
