package org.crosssection.physics;

import org.crosssection.core.Spectrum;

/**
 * Normalized fluorescence lineshape; for temperature-corrected measurements also the two
 * normalized curves before merging (null otherwise).
 */
public final class FluorescenceResult {
    private final Spectrum lineshape;
    private final Spectrum low;
    private final Spectrum high;

    public FluorescenceResult(Spectrum lineshape, Spectrum low, Spectrum high) {
        this.lineshape = lineshape;
        this.low = low;
        this.high = high;
    }

    public Spectrum getLineshape() { return lineshape; }
    public Spectrum getLow() { return low; }
    public Spectrum getHigh() { return high; }
    public boolean isMerged() { return low != null; }
}
