package org.crosssection.io;

import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.SpectrumLoadException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Reader for two-column (wavelength, intensity) text exports of the spectrometer.
 */
public class SpectrumTextReader {

    private static final Logger logger = Logger.getLogger(SpectrumTextReader.class.getName());

    public static final int DEFAULT_HEADER_LINES = 2;

    private static final Pattern DELIMITER = Pattern.compile("\\s*[,;\\t]\\s*|\\s+");

    private final int headerLines;

    public SpectrumTextReader() {
        this(DEFAULT_HEADER_LINES);
    }

    public SpectrumTextReader(int headerLines) {
        if (headerLines < 0) {
            throw new IllegalArgumentException("header line count must not be negative");
        }
        this.headerLines = headerLines;
    }

    public Spectrum read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Spectrum spectrum = read(reader, path.toString());
            logger.log(Level.FINE, "Read {0} samples from {1}", new Object[]{spectrum.size(), path});
            return spectrum;
        } catch (NoSuchFileException e) {
            throw new SpectrumLoadException("file not found: " + path, e);
        } catch (IOException e) {
            throw new SpectrumLoadException("cannot read " + path, e);
        }
    }

    /**
     * Reads every path in order, one curve per file.
     */
    public List<Spectrum> readAll(List<Path> paths) {
        List<Spectrum> spectra = new ArrayList<>();
        for (Path path : paths) {
            spectra.add(read(path));
        }
        return spectra;
    }

    Spectrum read(BufferedReader reader, String source) throws IOException {
        List<double[]> rows = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (lineNumber <= headerLines) continue;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            String[] fields = DELIMITER.split(trimmed);
            if (fields.length < 2) {
                throw new SpectrumLoadException(source + ":" + lineNumber + ": expected two columns, got '" + trimmed + "'");
            }
            try {
                rows.add(new double[]{Double.parseDouble(fields[0]), Double.parseDouble(fields[1])});
            } catch (NumberFormatException e) {
                throw new SpectrumLoadException(source + ":" + lineNumber + ": not a number in '" + trimmed + "'", e);
            }
        }
        if (rows.isEmpty()) {
            throw new SpectrumLoadException(source + " holds no data rows");
        }

        rows.sort(Comparator.comparingDouble(r -> r[0]));
        double[] wavelength = new double[rows.size()];
        double[] intensity = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            wavelength[i] = rows.get(i)[0];
            intensity[i] = rows.get(i)[1];
            if (i > 0 && wavelength[i] == wavelength[i - 1]) {
                throw new SpectrumLoadException(source + ": duplicate wavelength " + wavelength[i]);
            }
            if (!Double.isFinite(wavelength[i])) {
                throw new SpectrumLoadException(source + ": non-finite wavelength " + wavelength[i]);
            }
        }
        return new Spectrum(wavelength, intensity);
    }
}
