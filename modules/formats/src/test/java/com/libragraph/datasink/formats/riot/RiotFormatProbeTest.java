package com.libragraph.datasink.formats.riot;

import com.libragraph.datasink.formats.api.ProbeResult;
import com.libragraph.datasink.types.DatasetFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RiotFormatProbeTest {

    private static final String BASE = "http://example.org/base/";

    private static final String TURTLE = """
            @prefix ex: <http://example.org/> .
            ex:a ex:b ex:c .
            ex:a ex:d "literal" .
            """;

    @Test
    void shouldAcceptValidTurtle() {
        ProbeResult result = new RiotFormatProbe(DatasetFormat.TURTLE, BASE).probe(TURTLE);

        assertThat(result.success()).isTrue();
        assertThat(result.statementCount()).isEqualTo(2);
        assertThat(result.error()).isNull();
    }

    @Test
    void shouldReportParseErrorAsFailure() {
        ProbeResult result = new RiotFormatProbe(DatasetFormat.RDF_XML, BASE).probe(TURTLE);

        assertThat(result.success()).isFalse();
        assertThat(result.statementCount()).isZero();
        assertThat(result.error()).isNotBlank();
    }

    @Test
    void shouldTreatEmptyGraphAsFailure() {
        ProbeResult result = new RiotFormatProbe(DatasetFormat.JSON_LD, BASE).probe("{}");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("no statements");
    }

    @Test
    void shouldCountQuadsAcrossNamedGraphs() {
        String nquads = """
                <http://example.org/a> <http://example.org/b> <http://example.org/c> <http://example.org/g1> .
                <http://example.org/a> <http://example.org/b> <http://example.org/d> <http://example.org/g2> .
                """;

        ProbeResult result = new RiotFormatProbe(DatasetFormat.NQUADS, BASE).probe(nquads);

        assertThat(result.success()).isTrue();
        assertThat(result.statementCount()).isEqualTo(2);
    }

    @Test
    void shouldNotLeakStateBetweenAttempts() {
        RiotFormatProbe probe = new RiotFormatProbe(DatasetFormat.TURTLE, BASE);

        assertThat(probe.probe("ex:broken ex:b").success()).isFalse();
        assertThat(probe.probe(TURTLE).statementCount()).isEqualTo(2);
        assertThat(probe.probe(TURTLE).statementCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectRawProbe() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new RiotFormatProbe(DatasetFormat.RAW, BASE));
    }

    @Test
    void defaultsFollowFormatPriority() {
        assertThat(RiotFormatProbe.defaults(BASE))
                .extracting(p -> p.format())
                .containsExactlyElementsOf(DatasetFormat.structured());
    }
}
