package work.taskrun.core.shared;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Modification-time fingerprints (epoch seconds with microsecond fraction, e.g. {@code 1697654400.123456}).
 */
public final class Fingerprints {
    private Fingerprints() {}

    public static String lastModified(Path path) throws IOException {
        long micros = Files.getLastModifiedTime(path).to(TimeUnit.MICROSECONDS);
        return BigDecimal.valueOf(micros, 6).stripTrailingZeros().toPlainString();
    }
}
