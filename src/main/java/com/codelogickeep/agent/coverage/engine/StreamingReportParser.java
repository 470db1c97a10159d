package com.codelogickeep.agent.coverage.engine;

import com.codelogickeep.agent.coverage.exception.AgentToolException;
import com.codelogickeep.agent.coverage.model.ClassCoverageRecord;
import com.codelogickeep.agent.coverage.model.Counter;
import com.codelogickeep.agent.coverage.model.CounterType;
import com.codelogickeep.agent.coverage.model.ReportParseResult;
import com.codelogickeep.agent.coverage.model.ScopeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pull-parses one JaCoCo XML report.
 * <p>
 * Only the counters of the class currently under the cursor are held in memory. Classes rejected by
 * {@link ScopeFilter} are skipped without reading their children. Any failure is returned as
 * {@link ReportParseResult.Failed}; this class never throws for a bad report.
 */
public class StreamingReportParser {
    private static final Logger log = LoggerFactory.getLogger(StreamingReportParser.class);

    private static final String CLASS_ELEMENT = "class";
    private static final String COUNTER_ELEMENT = "counter";

    public ReportParseResult parse(Path reportPath, ScopeQuery query) {
        log.debug("Parsing coverage report: {}", reportPath);

        try (InputStream in = new BufferedInputStream(Files.newInputStream(reportPath))) {
            XMLStreamReader reader = newInputFactory().createXMLStreamReader(in);
            try {
                return readReport(reportPath, reader, query);
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            return ReportParseResult.failed(reportPath,
                    "Malformed coverage report " + reportPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            return ReportParseResult.failed(reportPath,
                    "Cannot read coverage report " + reportPath + ": " + e.getMessage(), e);
        } catch (AgentToolException e) {
            String message = e.getContext() != null ? e.getMessage() + " (" + e.getContext() + ")" : e.getMessage();
            return ReportParseResult.failed(reportPath, message, e);
        }
    }

    private ReportParseResult readReport(Path reportPath, XMLStreamReader reader, ScopeQuery query)
            throws XMLStreamException {
        Counter lineTotals = Counter.EMPTY;
        Counter branchTotals = Counter.EMPTY;
        List<ClassCoverageRecord> records = new ArrayList<>();
        int excluded = 0;

        while (reader.hasNext()) {
            if (reader.next() != XMLStreamConstants.START_ELEMENT
                    || !CLASS_ELEMENT.equals(reader.getLocalName())) {
                continue;
            }

            String className = toClassName(reader.getAttributeValue(null, "name"), reportPath, reader);
            if (!ScopeFilter.isIncluded(className, query)) {
                skipElement(reader);
                excluded++;
                continue;
            }

            ClassCounters counters = readClassCounters(reader, className, reportPath);
            lineTotals = lineTotals.plus(counters.line);
            branchTotals = branchTotals.plus(counters.branch);
            // interfaces and other classes without executable lines are not ranked
            if (counters.line.hasData()) {
                records.add(new ClassCoverageRecord(className, counters.line));
            }
        }

        log.debug("Parsed {}: {} ranked classes, {} excluded, lines {}/{}, branches {}/{}",
                reportPath, records.size(), excluded,
                lineTotals.covered(), lineTotals.total(), branchTotals.covered(), branchTotals.total());
        return ReportParseResult.parsed(reportPath, lineTotals, branchTotals, records);
    }

    /**
     * Reads the direct {@code counter} children of the class element under the cursor and leaves
     * the cursor on its end tag. Nested method counters are passed over.
     */
    private ClassCounters readClassCounters(XMLStreamReader reader, String className, Path reportPath)
            throws XMLStreamException {
        ClassCounters counters = new ClassCounters();
        int depth = 1;

        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
                if (depth == 2 && COUNTER_ELEMENT.equals(reader.getLocalName())) {
                    counters.accept(reader, className, reportPath);
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
        return counters;
    }

    private void skipElement(XMLStreamReader reader) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
    }

    private String toClassName(String rawName, Path reportPath, XMLStreamReader reader) {
        if (rawName == null || rawName.isBlank()) {
            throw AgentToolException.builder(AgentToolException.ErrorCode.COVERAGE_PARSE_ERROR,
                            "Class element without a name in " + reportPath)
                    .context("line " + reader.getLocation().getLineNumber())
                    .build();
        }
        return rawName.trim().replace('/', '.');
    }

    private static long readCount(XMLStreamReader reader, String attribute, String className, Path reportPath) {
        String value = reader.getAttributeValue(null, attribute);
        try {
            long count = Long.parseLong(value != null ? value.trim() : "");
            if (count < 0) {
                throw new NumberFormatException("negative value");
            }
            return count;
        } catch (NumberFormatException e) {
            throw new AgentToolException(AgentToolException.ErrorCode.COVERAGE_PARSE_ERROR,
                    "Invalid counter attribute '" + attribute + "=" + value + "' for class " + className
                            + " in " + reportPath,
                    "line " + reader.getLocation().getLineNumber(), e);
        }
    }

    private static XMLInputFactory newInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        // JaCoCo reports declare report.dtd; it must not be resolved
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    private static final class ClassCounters {
        private Counter line = Counter.EMPTY;
        private Counter branch = Counter.EMPTY;
        private boolean lineSeen;
        private boolean branchSeen;

        void accept(XMLStreamReader reader, String className, Path reportPath) {
            CounterType type = CounterType.fromAttribute(reader.getAttributeValue(null, "type"));
            if (type == CounterType.LINE && !lineSeen) {
                line = new Counter(readCount(reader, "missed", className, reportPath),
                        readCount(reader, "covered", className, reportPath));
                lineSeen = true;
            } else if (type == CounterType.BRANCH && !branchSeen) {
                branch = new Counter(readCount(reader, "missed", className, reportPath),
                        readCount(reader, "covered", className, reportPath));
                branchSeen = true;
            }
        }
    }
}
