package com.libragraph.datasink.formats.riot;

import com.libragraph.datasink.formats.api.FormatProbe;
import com.libragraph.datasink.formats.api.ProbeResult;
import com.libragraph.datasink.types.DatasetFormat;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.sparql.core.DatasetGraph;
import org.apache.jena.sparql.core.DatasetGraphFactory;
import org.apache.jena.sparql.core.Quad;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * {@link FormatProbe} backed by a Jena RIOT parser. Every attempt parses into a
 * fresh in-memory dataset that is dropped when the attempt returns.
 */
public class RiotFormatProbe implements FormatProbe {

    private final DatasetFormat format;
    private final String baseIri;

    public RiotFormatProbe(DatasetFormat format, String baseIri) {
        Objects.requireNonNull(format, "format cannot be null");
        if (!format.isStructured()) {
            throw new IllegalArgumentException("Cannot probe for " + format);
        }
        this.format = format;
        this.baseIri = Objects.requireNonNull(baseIri, "baseIri cannot be null");
    }

    /** One probe per structured format, in sniffing priority order. */
    public static List<FormatProbe> defaults(String baseIri) {
        List<FormatProbe> probes = new ArrayList<>();
        for (DatasetFormat f : DatasetFormat.structured()) {
            probes.add(new RiotFormatProbe(f, baseIri));
        }
        return List.copyOf(probes);
    }

    @Override
    public DatasetFormat format() {
        return format;
    }

    @Override
    public ProbeResult probe(String text) {
        DatasetGraph scratch = DatasetGraphFactory.create();
        try {
            RDFParser.create()
                    .fromString(text)
                    .lang(RdfLangs.langOf(format))
                    .base(baseIri)
                    .errorHandler(StrictErrorHandler.INSTANCE)
                    .parse(scratch);
            long count = countQuads(scratch);
            if (count == 0) {
                return ProbeResult.failure(format, "no statements");
            }
            return ProbeResult.success(format, count);
        } catch (RuntimeException e) {
            // RiotException in the common case; JSON-LD and XML parsers surface their own types
            return ProbeResult.failure(format, e.getMessage());
        } finally {
            scratch.close();
        }
    }

    private static long countQuads(DatasetGraph dsg) {
        long count = 0;
        Iterator<Quad> it = dsg.find();
        while (it.hasNext()) {
            it.next();
            count++;
        }
        return count;
    }
}
