package nl.bytesoflife.deltasdf.transform;

import nl.bytesoflife.deltasdf.model.SdfFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rescales every delay of a file to another timescale.
 */
public final class DelayNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DelayNormalizer.class);

    private DelayNormalizer() {
    }

    /**
     * Returns a copy of {@code sdf} whose delays are expressed in
     * {@code targetTimescale} units and whose header says so. The input is left
     * untouched.
     *
     * @throws IllegalArgumentException if {@code sdf} has no timescale or either timescale is invalid
     */
    public static SdfFile normalize(SdfFile sdf, String targetTimescale) {
        String source = sdf.getHeader().getTimescale();
        if (source == null) {
            throw new IllegalArgumentException("Source SDF has no timescale set in header");
        }
        double ratio = Timescale.ratio(source, targetTimescale);
        log.debug("Normalizing delays from {} to {} (factor {})", source, targetTimescale, ratio);

        SdfFile result = sdf.mapEntries(entry -> entry.getDelayPaths() == null
                ? entry
                : entry.withDelayPaths(entry.getDelayPaths().times(ratio)));
        result.getHeader().setTimescale(targetTimescale);
        return result;
    }
}
