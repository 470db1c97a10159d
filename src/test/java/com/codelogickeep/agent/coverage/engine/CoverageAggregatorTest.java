package com.codelogickeep.agent.coverage.engine;

import com.codelogickeep.agent.coverage.model.ClassCoverageRecord;
import com.codelogickeep.agent.coverage.model.Counter;
import com.codelogickeep.agent.coverage.model.CoverageSummary;
import com.codelogickeep.agent.coverage.model.ReportParseResult;
import com.codelogickeep.agent.coverage.model.ScopeQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CoverageAggregator merge, ranking and failure handling.
 */
class CoverageAggregatorTest {

    private CoverageAggregator aggregator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        aggregator = new CoverageAggregator(new StreamingReportParser(), 4, 20);
    }

    private Path writeReport(String name, String classesXml) throws IOException {
        Path report = tempDir.resolve(name);
        Files.writeString(report, "<report name=\"" + name + "\">\n" + classesXml + "</report>\n");
        return report;
    }

    private static String clazz(String slashName, int lineMissed, int lineCovered, int branchMissed, int branchCovered) {
        return "  <class name=\"" + slashName + "\">\n"
                + "    <counter type=\"LINE\" missed=\"" + lineMissed + "\" covered=\"" + lineCovered + "\"/>\n"
                + "    <counter type=\"BRANCH\" missed=\"" + branchMissed + "\" covered=\"" + branchCovered + "\"/>\n"
                + "  </class>\n";
    }

    private static CoverageSummary.Success assertSuccess(CoverageSummary summary) {
        assertTrue(summary.isSuccess(), () -> "expected success but was " + summary);
        return (CoverageSummary.Success) summary;
    }

    @Test
    @DisplayName("single class report yields its line coverage and name")
    void aggregate_singleClass() throws IOException {
        Path report = writeReport("a.xml", clazz("com/x/Foo", 2, 8, 0, 0));

        CoverageSummary.Success summary = assertSuccess(
                aggregator.aggregate(tempDir, List.of(report), ScopeQuery.unscoped()));

        assertEquals(0.8, summary.lineCoverage(), 1e-9);
        assertEquals(0.0, summary.branchCoverage());
        assertEquals(List.of("com.x.Foo"), summary.worstClasses());
    }

    @Test
    @DisplayName("package scope drops lower-covered classes outside the scope")
    void aggregate_packageScopeExcludesOtherPackages() throws IOException {
        Path report = writeReport("a.xml",
                clazz("com/x/Foo", 5, 5, 1, 1)
                        + clazz("com/x/Baz", 1, 9, 0, 2)
                        + clazz("com/y/Bar", 100, 0, 10, 0));

        CoverageSummary.Success summary = assertSuccess(
                aggregator.aggregate(tempDir, List.of(report), ScopeQuery.fromCsv(null, "com.x", null)));

        assertFalse(summary.worstClasses().contains("com.y.Bar"));
        assertEquals(List.of("com.x.Foo", "com.x.Baz"), summary.worstClasses());
        assertEquals(14.0 / 20.0, summary.lineCoverage(), 1e-9);
        assertEquals(3.0 / 4.0, summary.branchCoverage(), 1e-9);
    }

    @Test
    @DisplayName("generated class listed in targetClasses is still excluded")
    void aggregate_generatedClassNeverIncluded() throws IOException {
        Path report = writeReport("a.xml",
                clazz("com/x/generated/Foo", 9, 1, 0, 0) + clazz("com/x/Real", 1, 1, 0, 0));

        CoverageSummary.Success summary = assertSuccess(aggregator.aggregate(tempDir, List.of(report),
                ScopeQuery.fromCsv(null, null, "com.x.generated.Foo,Real")));

        assertEquals(List.of("com.x.Real"), summary.worstClasses());
        assertEquals(0.5, summary.lineCoverage(), 1e-9);
    }

    @Test
    @DisplayName("invalid report is skipped when another report parses")
    void aggregate_skipsInvalidReport() throws IOException {
        Path valid = writeReport("valid.xml", clazz("com/x/Foo", 1, 3, 1, 1));
        Path invalid = tempDir.resolve("invalid.xml");
        Files.writeString(invalid, "<report><class name=\"com/x/Broken\"></report>");

        CoverageSummary.Success summary = assertSuccess(
                aggregator.aggregate(tempDir, List.of(invalid, valid), ScopeQuery.unscoped()));

        assertEquals(0.75, summary.lineCoverage(), 1e-9);
        assertEquals(0.5, summary.branchCoverage(), 1e-9);
        assertEquals(List.of("com.x.Foo"), summary.worstClasses());
    }

    @Test
    @DisplayName("same class in two reports contributes two entries")
    void aggregate_keepsDuplicateClassesAcrossReports() throws IOException {
        Path first = writeReport("a.xml", clazz("com/x/Foo", 8, 2, 0, 0));
        Path second = writeReport("b.xml", clazz("com/x/Foo", 2, 8, 0, 0));

        CoverageSummary.Success summary = assertSuccess(
                aggregator.aggregate(tempDir, List.of(first, second), ScopeQuery.unscoped()));

        assertEquals(List.of("com.x.Foo", "com.x.Foo"), summary.worstClasses());
        assertEquals(0.5, summary.lineCoverage(), 1e-9);
    }

    @Test
    @DisplayName("worst classes are ascending by coverage and truncated to the limit")
    void aggregate_ranksAndTruncates() throws IOException {
        StringBuilder classes = new StringBuilder();
        // Cls00 has 0% coverage, Cls29 has 29/29 covered
        for (int i = 29; i >= 0; i--) {
            classes.append(clazz(String.format("com/x/Cls%02d", i), 29 - i, i, 0, 0));
        }
        Path report = writeReport("a.xml", classes.toString());

        CoverageSummary.Success summary = assertSuccess(
                aggregator.aggregate(tempDir, List.of(report), ScopeQuery.unscoped()));

        assertEquals(20, summary.worstClasses().size());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add(String.format("com.x.Cls%02d", i));
        }
        assertEquals(expected, summary.worstClasses());
    }

    @Test
    @DisplayName("explicit class targets are truncated like any other request")
    void aggregate_truncatesExplicitTargetsToLimit() throws IOException {
        CoverageAggregator small = new CoverageAggregator(new StreamingReportParser(), 2, 2);
        Path report = writeReport("a.xml",
                clazz("com/x/A", 1, 1, 0, 0) + clazz("com/x/B", 3, 1, 0, 0) + clazz("com/x/C", 0, 4, 0, 0));

        CoverageSummary.Success summary = assertSuccess(
                small.aggregate(tempDir, List.of(report), ScopeQuery.fromCsv(null, null, "A,B,C")));

        assertEquals(List.of("com.x.B", "com.x.A"), summary.worstClasses());
    }

    @Test
    @DisplayName("merging two reports equals the sum of their parts")
    void aggregate_isAssociative() throws IOException {
        Path first = writeReport("a.xml", clazz("com/x/A", 3, 7, 2, 2) + clazz("com/x/B", 10, 0, 4, 0));
        Path second = writeReport("b.xml", clazz("com/y/C", 1, 1, 0, 6));
        ScopeQuery query = ScopeQuery.unscoped();

        CoverageSummary.Success both = assertSuccess(aggregator.aggregate(tempDir, List.of(first, second), query));
        CoverageSummary.Success reversed = assertSuccess(aggregator.aggregate(tempDir, List.of(second, first), query));

        // lines: A 7/10, B 0/10, C 1/2 -> 8/22; branches: 2/4, 0/4, 6/6 -> 8/14
        assertEquals(8.0 / 22.0, both.lineCoverage(), 1e-9);
        assertEquals(8.0 / 14.0, both.branchCoverage(), 1e-9);
        assertEquals(both, reversed);
        assertEquals(List.of("com.x.B", "com.y.C", "com.x.A"), both.worstClasses());
    }

    @Test
    @DisplayName("zero denominators produce 0.0 metrics")
    void aggregate_zeroDenominators() throws IOException {
        Path report = writeReport("a.xml", "");

        CoverageSummary.Success summary = assertSuccess(
                aggregator.aggregate(tempDir, List.of(report), ScopeQuery.unscoped()));

        assertEquals(0.0, summary.lineCoverage());
        assertEquals(0.0, summary.branchCoverage());
        assertTrue(summary.worstClasses().isEmpty());
    }

    @Test
    @DisplayName("empty report list is a failure naming the root")
    void aggregate_noReports() {
        CoverageSummary summary = aggregator.aggregate(tempDir, List.of(), ScopeQuery.unscoped());

        assertFalse(summary.isSuccess());
        String error = ((CoverageSummary.Failure) summary).error();
        assertTrue(error.contains("E401"));
        assertTrue(error.contains(tempDir.toString()));
    }

    @Test
    @DisplayName("every report failing is a failure")
    void aggregate_allReportsFail() throws IOException {
        Path broken = tempDir.resolve("broken.xml");
        Files.writeString(broken, "not xml at all");

        CoverageSummary summary = aggregator.aggregate(tempDir,
                List.of(broken, tempDir.resolve("missing.xml")), ScopeQuery.unscoped());

        assertFalse(summary.isSuccess());
        String error = ((CoverageSummary.Failure) summary).error();
        assertTrue(error.contains("E404"));
        assertTrue(error.contains("2 coverage report(s)"));
    }

    @Test
    @DisplayName("a parser crash on one file is contained to that file")
    void aggregate_containsWorkerCrash() {
        StreamingReportParser parser = mock(StreamingReportParser.class);
        Path good = tempDir.resolve("good.xml");
        Path bad = tempDir.resolve("bad.xml");
        when(parser.parse(eq(good), any())).thenReturn(ReportParseResult.parsed(good,
                new Counter(1, 1), Counter.EMPTY,
                List.of(new ClassCoverageRecord("com.x.Foo", new Counter(1, 1)))));
        when(parser.parse(eq(bad), any())).thenThrow(new IllegalStateException("boom"));

        CoverageSummary.Success summary = assertSuccess(new CoverageAggregator(parser, 2, 20)
                .aggregate(tempDir, List.of(bad, good), ScopeQuery.unscoped()));

        assertEquals(0.5, summary.lineCoverage(), 1e-9);
        assertEquals(List.of("com.x.Foo"), summary.worstClasses());
        verify(parser).parse(eq(bad), any());
        verify(parser).parse(eq(good), any());
    }

    @Test
    @DisplayName("summarize treats failed results as skipped")
    void summarize_skipsFailedResults() {
        Path a = tempDir.resolve("a.xml");
        Path b = tempDir.resolve("b.xml");
        List<ReportParseResult> results = List.of(
                ReportParseResult.failed(a, "bad", null),
                ReportParseResult.parsed(b, new Counter(3, 1), new Counter(1, 1), List.of()));

        CoverageSummary.Success summary = assertSuccess(aggregator.summarize(results));

        assertEquals(0.25, summary.lineCoverage(), 1e-9);
        assertEquals(0.5, summary.branchCoverage(), 1e-9);
    }

    @Test
    void constructorRejectsInvalidLimits() {
        StreamingReportParser parser = new StreamingReportParser();
        assertThrows(IllegalArgumentException.class, () -> new CoverageAggregator(parser, 0, 20));
        assertThrows(IllegalArgumentException.class, () -> new CoverageAggregator(parser, 1, 0));
    }
}
