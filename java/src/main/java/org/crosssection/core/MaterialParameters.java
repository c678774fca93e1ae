package org.crosssection.core;

import org.crosssection.core.exceptions.InvalidParameterException;

import java.util.*;

/**
 * Validated, immutable description of a laser crystal. Values are stored in the units of the
 * material record (SI for doping, length, lifetime and ZPL; cm⁻¹ for sublevel energies; nm
 * for calibration and crossfade wavelengths; mm for the reabsorption depth). The {@code *Cm}
 * accessors give the values the physics relations work with.
 */
public final class MaterialParameters {
    public static final double DEFAULT_TEMPERATURE = 295;
    public static final int DEFAULT_DEGENERACY = 2;
    public static final double DEFAULT_CROSSFADE_OFFSET_NM = 10;

    private final String name;
    private final String date;
    private final double doping;
    private final double length;
    private final double lifetime;
    private final double refractiveIndex;
    private final double temperature;
    private final double zeroPhononLine;
    private final double[] energyLowerLevel;
    private final double[] energyUpperLevel;
    private final double[] degeneracyLower;
    private final double[] degeneracyUpper;
    private final double zeroAbsorptionWidth;
    private final double zeroAbsorptionLambda1;
    private final double zeroAbsorptionLambda2;
    private final double absorptionDepth;
    private final double fuchtbauerMin;
    private final double mcCumberMax;
    // null or NaN where the value follows the ZPL
    private final double[] energyUpperLevelOverride;
    private final double fuchtbauerMinOverride;
    private final double mcCumberMaxOverride;

    private MaterialParameters(Builder b) {
        this.name = b.name == null ? "unnamed" : b.name;
        this.date = b.date;
        this.doping = positive("N_dop", b.doping);
        this.length = positive("length", b.length);
        this.lifetime = positive("tau_f", b.lifetime);
        this.refractiveIndex = positive("n", b.refractiveIndex);
        this.temperature = positive("temperature", b.temperature);
        this.zeroPhononLine = positive("ZPL", b.zeroPhononLine);

        this.energyLowerLevel = energies("energy_lower_level",
            b.energyLowerLevel != null ? b.energyLowerLevel : new double[]{0});
        this.energyUpperLevel = energies("energy_upper_level",
            b.energyUpperLevel != null ? b.energyUpperLevel : new double[]{1e-2 / zeroPhononLine});
        this.degeneracyLower = degeneracies("degeneracy_lower", b.degeneracyLower, energyLowerLevel.length);
        this.degeneracyUpper = degeneracies("degeneracy_upper", b.degeneracyUpper, energyUpperLevel.length);

        this.zeroAbsorptionWidth = nonNegative("zero_absorption_width", b.zeroAbsorptionWidth);
        if (Double.isNaN(b.zeroAbsorptionLambda1) || Double.isNaN(b.zeroAbsorptionLambda2)) {
            throw new InvalidParameterException("zero_absorption_wavelength must not be NaN");
        }
        if (b.zeroAbsorptionLambda1 > b.zeroAbsorptionLambda2) {
            throw new InvalidParameterException("zero_absorption_wavelength must be ordered (lower, upper)");
        }
        this.zeroAbsorptionLambda1 = b.zeroAbsorptionLambda1;
        this.zeroAbsorptionLambda2 = b.zeroAbsorptionLambda2;
        this.absorptionDepth = nonNegative("absorption_depth", b.absorptionDepth);

        double zplNm = zeroPhononLine * 1e9;
        this.fuchtbauerMin = optionalFinite("FL_min", b.fuchtbauerMin, zplNm - DEFAULT_CROSSFADE_OFFSET_NM);
        this.mcCumberMax = optionalFinite("MC_max", b.mcCumberMax, zplNm + DEFAULT_CROSSFADE_OFFSET_NM);
        this.energyUpperLevelOverride = b.energyUpperLevel;
        this.fuchtbauerMinOverride = b.fuchtbauerMin;
        this.mcCumberMaxOverride = b.mcCumberMax;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Builder preloaded with this instance's values, for per-recompute overrides.
     */
    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .date(date)
            .doping(doping)
            .length(length)
            .lifetime(lifetime)
            .refractiveIndex(refractiveIndex)
            .temperature(temperature)
            .zeroPhononLine(zeroPhononLine)
            .energyLowerLevel(energyLowerLevel)
            .energyUpperLevel(energyUpperLevelOverride)
            .degeneracyLower(degeneracyLower)
            .degeneracyUpper(energyUpperLevelOverride == null ? null : degeneracyUpper)
            .zeroAbsorptionWidth(zeroAbsorptionWidth)
            .zeroAbsorptionWavelengths(zeroAbsorptionLambda1, zeroAbsorptionLambda2)
            .absorptionDepth(absorptionDepth)
            .fuchtbauerMin(fuchtbauerMinOverride)
            .mcCumberMax(mcCumberMaxOverride);
    }

    // Getters
    public String getName() { return name; }
    public String getDate() { return date; }

    /** Doping concentration [m⁻³]. */
    public double getDoping() { return doping; }
    public double getDopingPerCm3() { return doping * PhysicalConstants.PER_M3_TO_PER_CM3; }

    /** Crystal length [m]. */
    public double getLength() { return length; }
    public double getLengthCm() { return length * PhysicalConstants.M_TO_CM; }

    /** Radiative lifetime [s]. */
    public double getLifetime() { return lifetime; }
    public double getRefractiveIndex() { return refractiveIndex; }
    public double getTemperature() { return temperature; }
    public double getThermalEnergy() { return PhysicalConstants.BOLTZMANN * temperature; }

    /** Zero-phonon line [m]. */
    public double getZeroPhononLine() { return zeroPhononLine; }
    public double getZeroPhononLineNm() { return zeroPhononLine * 1e9; }

    public double[] getEnergyLowerLevel() { return energyLowerLevel.clone(); }
    public double[] getEnergyUpperLevel() { return energyUpperLevel.clone(); }
    public double[] getDegeneracyLower() { return degeneracyLower.clone(); }
    public double[] getDegeneracyUpper() { return degeneracyUpper.clone(); }

    /** Zero-absorption calibration window width [nm]; 0 selects the two-point linear model. */
    public double getZeroAbsorptionWidth() { return zeroAbsorptionWidth; }
    public double getZeroAbsorptionLambda1() { return zeroAbsorptionLambda1; }
    public double getZeroAbsorptionLambda2() { return zeroAbsorptionLambda2; }

    /** Effective reabsorption depth [mm]. */
    public double getAbsorptionDepth() { return absorptionDepth; }
    public double getAbsorptionDepthCm() { return absorptionDepth * PhysicalConstants.MM_TO_CM; }

    /** Wavelength [nm] above which the Füchtbauer-Ladenburg curve is used. */
    public double getFuchtbauerMin() { return fuchtbauerMin; }

    /** Wavelength [nm] below which the McCumber curve is used. */
    public double getMcCumberMax() { return mcCumberMax; }

    private static double positive(String key, double v) {
        if (!Double.isFinite(v) || v <= 0) {
            throw new InvalidParameterException(key + " must be a positive finite number, got " + v);
        }
        return v;
    }

    private static double nonNegative(String key, double v) {
        if (!Double.isFinite(v) || v < 0) {
            throw new InvalidParameterException(key + " must be a non-negative finite number, got " + v);
        }
        return v;
    }

    private static double optionalFinite(String key, double v, double fallback) {
        if (Double.isNaN(v)) return fallback;
        if (Double.isInfinite(v)) {
            throw new InvalidParameterException(key + " must be finite");
        }
        return v;
    }

    private static double[] energies(String key, double[] values) {
        if (values.length == 0) {
            throw new InvalidParameterException(key + " must contain at least one sublevel");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new InvalidParameterException(key + " contains a non-finite energy");
            }
        }
        return values.clone();
    }

    private static double[] degeneracies(String key, double[] values, int sublevels) {
        if (values == null) {
            double[] defaults = new double[sublevels];
            Arrays.fill(defaults, DEFAULT_DEGENERACY);
            return defaults;
        }
        if (values.length != sublevels) {
            throw new InvalidParameterException(key + " needs one entry per sublevel (" + sublevels
                + "), got " + values.length);
        }
        for (double v : values) {
            if (!Double.isFinite(v) || v <= 0) {
                throw new InvalidParameterException(key + " entries must be positive");
            }
        }
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaterialParameters)) return false;
        MaterialParameters m = (MaterialParameters) o;
        return Objects.equals(name, m.name) && Objects.equals(date, m.date)
            && doping == m.doping && length == m.length && lifetime == m.lifetime
            && refractiveIndex == m.refractiveIndex && temperature == m.temperature
            && zeroPhononLine == m.zeroPhononLine
            && Arrays.equals(energyLowerLevel, m.energyLowerLevel)
            && Arrays.equals(energyUpperLevel, m.energyUpperLevel)
            && Arrays.equals(degeneracyLower, m.degeneracyLower)
            && Arrays.equals(degeneracyUpper, m.degeneracyUpper)
            && zeroAbsorptionWidth == m.zeroAbsorptionWidth
            && zeroAbsorptionLambda1 == m.zeroAbsorptionLambda1
            && zeroAbsorptionLambda2 == m.zeroAbsorptionLambda2
            && absorptionDepth == m.absorptionDepth
            && fuchtbauerMin == m.fuchtbauerMin && mcCumberMax == m.mcCumberMax;
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(name, date, doping, length, lifetime, refractiveIndex, temperature,
            zeroPhononLine, zeroAbsorptionWidth, zeroAbsorptionLambda1, zeroAbsorptionLambda2,
            absorptionDepth, fuchtbauerMin, mcCumberMax);
        h = 31 * h + Arrays.hashCode(energyLowerLevel);
        h = 31 * h + Arrays.hashCode(energyUpperLevel);
        h = 31 * h + Arrays.hashCode(degeneracyLower);
        return 31 * h + Arrays.hashCode(degeneracyUpper);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "MaterialParameters(name=%s, N_dop=%.3e m^-3, length=%.3e m, tau=%.3e s, n=%.3f, T=%.1f K, ZPL=%.2f nm)",
            name, doping, length, lifetime, refractiveIndex, temperature, getZeroPhononLineNm());
    }

    public static final class Builder {
        private String name;
        private String date;
        private double doping = Double.NaN;
        private double length = Double.NaN;
        private double lifetime = Double.NaN;
        private double refractiveIndex = Double.NaN;
        private double temperature = DEFAULT_TEMPERATURE;
        private double zeroPhononLine = Double.NaN;
        private double[] energyLowerLevel;
        private double[] energyUpperLevel;
        private double[] degeneracyLower;
        private double[] degeneracyUpper;
        private double zeroAbsorptionWidth = 0;
        private double zeroAbsorptionLambda1 = 0;
        private double zeroAbsorptionLambda2 = Double.POSITIVE_INFINITY;
        private double absorptionDepth = 0;
        private double fuchtbauerMin = Double.NaN;
        private double mcCumberMax = Double.NaN;

        private Builder() {
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder date(String date) { this.date = date; return this; }
        public Builder doping(double perM3) { this.doping = perM3; return this; }
        public Builder length(double meters) { this.length = meters; return this; }
        public Builder lifetime(double seconds) { this.lifetime = seconds; return this; }
        public Builder refractiveIndex(double n) { this.refractiveIndex = n; return this; }
        public Builder temperature(double kelvin) { this.temperature = kelvin; return this; }
        public Builder zeroPhononLine(double meters) { this.zeroPhononLine = meters; return this; }

        public Builder energyLowerLevel(double[] wavenumbers) {
            this.energyLowerLevel = wavenumbers == null ? null : wavenumbers.clone();
            return this;
        }

        public Builder energyUpperLevel(double[] wavenumbers) {
            this.energyUpperLevel = wavenumbers == null ? null : wavenumbers.clone();
            return this;
        }

        public Builder degeneracyLower(double[] degeneracies) {
            this.degeneracyLower = degeneracies == null ? null : degeneracies.clone();
            return this;
        }

        public Builder degeneracyUpper(double[] degeneracies) {
            this.degeneracyUpper = degeneracies == null ? null : degeneracies.clone();
            return this;
        }

        public Builder zeroAbsorptionWidth(double nm) { this.zeroAbsorptionWidth = nm; return this; }

        public Builder zeroAbsorptionWavelengths(double lambda1, double lambda2) {
            this.zeroAbsorptionLambda1 = lambda1;
            this.zeroAbsorptionLambda2 = lambda2;
            return this;
        }

        public Builder absorptionDepth(double mm) { this.absorptionDepth = mm; return this; }

        /** NaN restores the default of ZPL - 10 nm. */
        public Builder fuchtbauerMin(double nm) { this.fuchtbauerMin = nm; return this; }

        /** NaN restores the default of ZPL + 10 nm. */
        public Builder mcCumberMax(double nm) { this.mcCumberMax = nm; return this; }

        public MaterialParameters build() {
            return new MaterialParameters(this);
        }
    }
}
