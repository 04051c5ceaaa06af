package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.model.SdfFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for reading SDF text.
 * <pre>
 * SdfFile sdf = new SdfParser().parse(Path.of("design.sdf"));
 * </pre>
 * Holds no state: every call reads with a fresh {@link SExpressionParser} and
 * {@link SdfTreeTransformer}, so one instance may be shared between threads.
 */
public class SdfParser {

    private static final Logger log = LoggerFactory.getLogger(SdfParser.class);

    /**
     * @throws ParseException on malformed input; no partial result is returned
     */
    public SdfFile parse(String content) {
        long start = System.nanoTime();
        List<SNode> nodes = new SExpressionParser().parse(content);
        SdfFile file = new SdfTreeTransformer().transform(nodes);
        log.debug("Parsed {} chars into {} cell types in {} ms",
                content.length(), file.getCells().size(), (System.nanoTime() - start) / 1_000_000);
        return file;
    }

    public SdfFile parse(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read SDF file " + path, e);
        }
        log.debug("Read {}", path);
        return parse(content);
    }

    public SdfFile parse(InputStream in) {
        String content;
        try {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read SDF stream", e);
        }
        return parse(content);
    }
}
