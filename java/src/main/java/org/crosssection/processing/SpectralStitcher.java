package org.crosssection.processing;

import org.crosssection.core.Spectrum;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Joins detector sub-ranges into one continuous spectrum, averaging where they overlap.
 */
public final class SpectralStitcher {

    private static final Logger logger = Logger.getLogger(SpectralStitcher.class.getName());

    private SpectralStitcher() {
    }

    public static Spectrum stitch(List<Spectrum> segments) {
        if (segments.isEmpty()) {
            return Spectrum.empty();
        }
        Spectrum combined = segments.get(0);
        for (Spectrum next : segments.subList(1, segments.size())) {
            combined = join(combined, next);
        }
        return combined;
    }

    /**
     * Merge two curves. Inside the overlap the next curve is interpolated onto the combined
     * curve's grid and both are averaged; outside it both are kept verbatim.
     */
    static Spectrum join(Spectrum combined, Spectrum next) {
        if (combined.isEmpty()) return next;
        if (next.isEmpty()) return combined;

        double overlapStart = Math.max(combined.getWavelengthMin(), next.getWavelengthMin());
        double overlapEnd = Math.min(combined.getWavelengthMax(), next.getWavelengthMax());

        if (overlapStart > overlapEnd) {
            // No overlap, concatenate in wavelength order
            return combined.getWavelengthMax() < next.getWavelengthMin()
                ? concat(combined, next)
                : concat(next, combined);
        }

        logger.log(Level.FINE, () -> String.format(Locale.ROOT,
            "Averaging overlap %.2f-%.2f nm of %s and %s", overlapStart, overlapEnd, combined, next));

        Spectrum overlap = combined.extractRange(overlapStart, overlapEnd);
        double[] x = overlap.getWavelengths();
        double[] y1 = overlap.getValues();
        double[] y2 = next.resample(x).getValues();
        double[] averaged = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            averaged[i] = (y1[i] + y2[i]) / 2;
        }

        Spectrum lower = combined.getWavelengthMin() <= next.getWavelengthMin() ? combined : next;
        Spectrum upper = combined.getWavelengthMax() >= next.getWavelengthMax() ? combined : next;

        List<Double> wavelengths = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < lower.size() && lower.getWavelengthAt(i) < overlapStart; i++) {
            wavelengths.add(lower.getWavelengthAt(i));
            values.add(lower.getValueAt(i));
        }
        for (int i = 0; i < x.length; i++) {
            wavelengths.add(x[i]);
            values.add(averaged[i]);
        }
        for (int i = 0; i < upper.size(); i++) {
            if (upper.getWavelengthAt(i) > overlapEnd) {
                wavelengths.add(upper.getWavelengthAt(i));
                values.add(upper.getValueAt(i));
            }
        }

        return new Spectrum(
            wavelengths.stream().mapToDouble(Double::doubleValue).toArray(),
            values.stream().mapToDouble(Double::doubleValue).toArray()
        );
    }

    private static Spectrum concat(Spectrum first, Spectrum second) {
        int n = first.size() + second.size();
        double[] wavelengths = new double[n];
        double[] values = new double[n];
        System.arraycopy(first.getWavelengths(), 0, wavelengths, 0, first.size());
        System.arraycopy(second.getWavelengths(), 0, wavelengths, first.size(), second.size());
        System.arraycopy(first.getValues(), 0, values, 0, first.size());
        System.arraycopy(second.getValues(), 0, values, first.size(), second.size());
        return new Spectrum(wavelengths, values);
    }
}
