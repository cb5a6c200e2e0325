package celestial.ephemeris;

import celestial.time.JulianDate;
import org.orekit.errors.OrekitException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 星历表读取器
 *
 * 文本格式：每行一个样本，字段以 '|' 分隔，第一个字段为儒略日，其余为各列数值。
 * 空行和字段数少于 2 的行被忽略。
 */
public final class EphemerisSeriesReader {

    private static final Logger logger = Logger.getLogger(EphemerisSeriesReader.class.getName());

    private static final Pattern SEPARATOR = Pattern.compile("\\|");

    private EphemerisSeriesReader() {
    }

    /**
     * 从类路径资源读取
     *
     * @param name 序列名称
     * @param resource 资源路径，如 "/ephemerides/fk5.ephem"
     */
    public static EphemerisSeries readResource(String name, String resource) {
        InputStream stream = EphemerisSeriesReader.class.getResourceAsStream(resource);
        if (stream == null) {
            throw new OrekitException(CelestialMessages.UNABLE_TO_READ_EPHEMERIS, name,
                                      "resource " + resource + " not found");
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.US_ASCII)) {
            return read(name, reader);
        } catch (IOException e) {
            throw new OrekitException(e, CelestialMessages.UNABLE_TO_READ_EPHEMERIS, name, e.getMessage());
        }
    }

    public static EphemerisSeries readFile(String name, Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII)) {
            return read(name, reader);
        } catch (IOException e) {
            throw new OrekitException(e, CelestialMessages.UNABLE_TO_READ_EPHEMERIS, name, e.getMessage());
        }
    }

    /**
     * 从字符流读取，调用方负责关闭
     */
    public static EphemerisSeries read(String name, Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source : new BufferedReader(source);
        List<EphemerisSample> samples = new ArrayList<>();
        int lineNumber = 0;
        int ignored = 0;
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            lineNumber++;
            String[] fields = SEPARATOR.split(line.trim());
            if (fields.length < 2) {
                ignored++;
                continue;
            }
            samples.add(parseLine(name, lineNumber, fields));
        }

        if (ignored > 0 && logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Ignored %d short lines in ephemeris %s", ignored, name));
        }
        EphemerisSeries series = new EphemerisSeries(name, samples);
        logger.fine(() -> "Loaded ephemeris " + name + " with " + series.size() + " samples");
        return series;
    }

    private static EphemerisSample parseLine(String name, int lineNumber, String[] fields) {
        try {
            double julianDay = Double.parseDouble(fields[0].trim());
            double[] values = new double[fields.length - 1];
            for (int i = 1; i < fields.length; i++) {
                values[i - 1] = Double.parseDouble(fields[i].trim());
            }
            return new EphemerisSample(JulianDate.ofJulianDay(julianDay), values);
        } catch (IllegalArgumentException e) {
            // NumberFormatException 以及非有限儒略日
            throw new OrekitException(e, CelestialMessages.UNABLE_TO_PARSE_EPHEMERIS_LINE,
                                      lineNumber, name, e.getMessage());
        }
    }
}
