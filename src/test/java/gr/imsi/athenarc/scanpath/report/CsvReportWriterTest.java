package gr.imsi.athenarc.scanpath.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gr.imsi.athenarc.scanpath.analysis.ScanpathAnalysis;
import gr.imsi.athenarc.scanpath.analysis.ScanpathAnalyzer;
import gr.imsi.athenarc.scanpath.domain.Scanpath;
import gr.imsi.athenarc.scanpath.pda.VerificationTransitions;

public class CsvReportWriterTest {

    private final ScanpathAnalyzer analyzer = new ScanpathAnalyzer(VerificationTransitions.standard());

    @Test
    public void testOneRowPerAnalysis() {
        List<ScanpathAnalysis> analyses = List.of(
            analyzer.analyze("1", Scanpath.parse("O R II P Q V ✓ ✓ O")),
            analyzer.analyze("2", Scanpath.parse("O R II P Q")));

        StringWriter out = new StringWriter();
        new CsvReportWriter().write(analyses, out);
        String[] lines = out.toString().split("\\R");

        assertEquals(3, lines.length);
        assertEquals("id,scanpath,accepted,outcome,final_state,max_stack_depth,vcs,consumed", lines[0]);
        assertEquals("1,O R II P Q V ✓ ✓ O,true,COMPLETE,Q6,4,1.0,9", lines[1]);
        assertEquals("2,O R II P Q,false,INCOMPLETE,Q4,3,0.0,5", lines[2]);
    }

    @Test
    public void testCustomDelimiterToFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("results.csv");
        new CsvReportWriter(';').write(List.of(analyzer.analyze("x", Scanpath.parse("O"))), file);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("id;scanpath;accepted"));
        assertEquals("x;O;false;INCOMPLETE;Q1;0;0.0;1", lines.get(1));
    }
}
