package com.libragraph.datasink.formats.registry;

import com.libragraph.datasink.formats.api.FormatProbe;
import com.libragraph.datasink.formats.api.ProbeResult;
import com.libragraph.datasink.formats.riot.RiotFormatProbe;
import com.libragraph.datasink.types.DatasetFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies uploaded content by trial parsing.
 *
 * <p>The bytes are decoded as UTF-8; anything that does not decode, or is blank,
 * is {@link DatasetFormat#RAW}. Otherwise each probe runs in priority order and
 * the first one that parses wins. If none does, the content is raw.
 */
@ApplicationScoped
public class FormatSniffer {

    private static final Logger log = Logger.getLogger(FormatSniffer.class);

    /** Base for resolving relative IRIs during trial parses only. */
    static final String SNIFF_BASE = "http://marketplace-datasink.org/sniff/";

    private final List<FormatProbe> probes;

    public FormatSniffer() {
        this(RiotFormatProbe.defaults(SNIFF_BASE));
    }

    public FormatSniffer(List<FormatProbe> probes) {
        Objects.requireNonNull(probes, "probes cannot be null");
        for (FormatProbe p : probes) {
            if (!p.format().isStructured()) {
                throw new IllegalArgumentException("Probe for " + p.format() + " is not allowed");
            }
        }
        this.probes = List.copyOf(probes);
    }

    public List<DatasetFormat> priority() {
        return probes.stream().map(FormatProbe::format).toList();
    }

    public SniffResult sniff(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        String text = decode(content);
        if (text == null) {
            log.debugf("Content of %d bytes is not UTF-8 text, classified raw", content.length);
            return new SniffResult(DatasetFormat.RAW, null, List.of());
        }
        if (text.isBlank()) {
            return new SniffResult(DatasetFormat.RAW, text, List.of());
        }

        List<ProbeResult> attempts = new ArrayList<>();
        for (FormatProbe probe : probes) {
            ProbeResult result = probe.probe(text);
            attempts.add(result);
            if (result.success()) {
                log.debugf("Detected %s (%d statements) after %d attempt(s)",
                        result.format().tag(), result.statementCount(), attempts.size());
                return new SniffResult(result.format(), text, attempts);
            }
            log.debugf("Not %s: %s", probe.format().tag(), result.error());
        }
        return new SniffResult(DatasetFormat.RAW, text, attempts);
    }

    private static String decode(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(content)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
