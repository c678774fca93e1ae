package org.crosssection.core;

import org.crosssection.core.exceptions.SpectrumLoadException;

import java.util.*;

/**
 * Raw measured curves per channel as handed over by the loader. Absorption and reference may
 * consist of several overlapping detector segments; fluorescence is either a single curve or a
 * low/high-temperature pair.
 */
public final class RawChannelSet {
    private final List<Spectrum> absorption;
    private final List<Spectrum> reference;
    private final Spectrum fluorescence;
    private final Spectrum fluorescenceLow;
    private final Spectrum fluorescenceHigh;

    private RawChannelSet(Builder b) {
        this.absorption = List.copyOf(b.absorption);
        this.reference = List.copyOf(b.reference);
        this.fluorescence = b.fluorescence;
        this.fluorescenceLow = b.fluorescenceLow;
        this.fluorescenceHigh = b.fluorescenceHigh;

        if ((fluorescenceLow == null) != (fluorescenceHigh == null)) {
            throw new SpectrumLoadException("fluorescence low/high curves must be supplied together");
        }
        if (fluorescence != null && fluorescenceLow != null) {
            throw new SpectrumLoadException("supply either a single fluorescence curve or a low/high pair, not both");
        }
    }

    public static Builder builder() { return new Builder(); }

    public List<Spectrum> getAbsorption() { return absorption; }
    public List<Spectrum> getReference() { return reference; }
    public Spectrum getFluorescence() { return fluorescence; }
    public Spectrum getFluorescenceLow() { return fluorescenceLow; }
    public Spectrum getFluorescenceHigh() { return fluorescenceHigh; }

    public boolean hasAbsorption() { return !absorption.isEmpty() && !reference.isEmpty(); }
    public boolean hasFluorescence() { return fluorescence != null || fluorescenceLow != null; }
    public boolean isTemperatureCorrected() { return fluorescenceLow != null; }

    /**
     * Absorption segments, failing when the channel is missing or any segment is empty.
     */
    public List<Spectrum> requireAbsorption() {
        return requireSegments("absorption", absorption);
    }

    public List<Spectrum> requireReference() {
        return requireSegments("reference", reference);
    }

    public void requireFluorescence() {
        if (!hasFluorescence()) {
            throw new SpectrumLoadException("no fluorescence curve supplied");
        }
        for (Spectrum s : Arrays.asList(fluorescence, fluorescenceLow, fluorescenceHigh)) {
            if (s != null && s.isEmpty()) {
                throw new SpectrumLoadException("fluorescence curve is empty");
            }
        }
    }

    private static List<Spectrum> requireSegments(String channel, List<Spectrum> segments) {
        if (segments.isEmpty()) {
            throw new SpectrumLoadException("no " + channel + " curve supplied");
        }
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).isEmpty()) {
                throw new SpectrumLoadException(channel + " segment " + i + " is empty");
            }
        }
        return segments;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "RawChannelSet(absorption=%d, reference=%d, fluorescence=%s)",
            absorption.size(), reference.size(),
            isTemperatureCorrected() ? "low/high" : (fluorescence != null ? "single" : "none"));
    }

    public static final class Builder {
        private final List<Spectrum> absorption = new ArrayList<>();
        private final List<Spectrum> reference = new ArrayList<>();
        private Spectrum fluorescence;
        private Spectrum fluorescenceLow;
        private Spectrum fluorescenceHigh;

        private Builder() {
        }

        public Builder addAbsorption(Spectrum segment) {
            absorption.add(Objects.requireNonNull(segment, "segment"));
            return this;
        }

        public Builder addReference(Spectrum segment) {
            reference.add(Objects.requireNonNull(segment, "segment"));
            return this;
        }

        public Builder fluorescence(Spectrum curve) {
            this.fluorescence = curve;
            return this;
        }

        public Builder fluorescencePair(Spectrum low, Spectrum high) {
            this.fluorescenceLow = low;
            this.fluorescenceHigh = high;
            return this;
        }

        public RawChannelSet build() {
            return new RawChannelSet(this);
        }
    }
}
