package org.crosssection.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.crosssection.core.MaterialParameters;
import org.crosssection.core.exceptions.InvalidParameterException;

/**
 * JSON form of a material's base data. Units follow the record format: doping in m⁻³, length
 * and ZPL in m, lifetime in s, energies in cm⁻¹, calibration wavelengths in nm, reabsorption
 * depth in mm.
 */
public class MaterialRecord {

    @JsonProperty("name")
    private String name;

    @JsonProperty("date")
    private String date;

    @JsonProperty("N_dop")
    private Double doping;

    @JsonProperty("length")
    private Double length;

    @JsonProperty("tau_f")
    private Double lifetime;

    @JsonProperty("n")
    private Double refractiveIndex;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("ZPL")
    private Double zeroPhononLine;

    @JsonProperty("energy_lower_level")
    private double[] energyLowerLevel;

    @JsonProperty("energy_upper_level")
    private double[] energyUpperLevel;

    @JsonProperty("degeneracy_lower")
    private double[] degeneracyLower;

    @JsonProperty("degeneracy_upper")
    private double[] degeneracyUpper;

    @JsonProperty("zero_absorption_width")
    private Double zeroAbsorptionWidth;

    @JsonProperty("zero_absorption_wavelength")
    private Double[] zeroAbsorptionWavelength;

    @JsonProperty("absorption_depth")
    private Double absorptionDepth;

    @JsonProperty("FL_min")
    private Double fuchtbauerMin;

    @JsonProperty("MC_max")
    private Double mcCumberMax;

    @JsonProperty("correct_temp")
    private boolean correctTemp;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public Double getDoping() { return doping; }
    public void setDoping(Double doping) { this.doping = doping; }

    public Double getLength() { return length; }
    public void setLength(Double length) { this.length = length; }

    public Double getLifetime() { return lifetime; }
    public void setLifetime(Double lifetime) { this.lifetime = lifetime; }

    public Double getRefractiveIndex() { return refractiveIndex; }
    public void setRefractiveIndex(Double refractiveIndex) { this.refractiveIndex = refractiveIndex; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public Double getZeroPhononLine() { return zeroPhononLine; }
    public void setZeroPhononLine(Double zeroPhononLine) { this.zeroPhononLine = zeroPhononLine; }

    public double[] getEnergyLowerLevel() { return energyLowerLevel; }
    public void setEnergyLowerLevel(double[] energyLowerLevel) { this.energyLowerLevel = energyLowerLevel; }

    public double[] getEnergyUpperLevel() { return energyUpperLevel; }
    public void setEnergyUpperLevel(double[] energyUpperLevel) { this.energyUpperLevel = energyUpperLevel; }

    public double[] getDegeneracyLower() { return degeneracyLower; }
    public void setDegeneracyLower(double[] degeneracyLower) { this.degeneracyLower = degeneracyLower; }

    public double[] getDegeneracyUpper() { return degeneracyUpper; }
    public void setDegeneracyUpper(double[] degeneracyUpper) { this.degeneracyUpper = degeneracyUpper; }

    public Double getZeroAbsorptionWidth() { return zeroAbsorptionWidth; }
    public void setZeroAbsorptionWidth(Double zeroAbsorptionWidth) { this.zeroAbsorptionWidth = zeroAbsorptionWidth; }

    public Double[] getZeroAbsorptionWavelength() { return zeroAbsorptionWavelength; }
    public void setZeroAbsorptionWavelength(Double[] zeroAbsorptionWavelength) {
        this.zeroAbsorptionWavelength = zeroAbsorptionWavelength;
    }

    public Double getAbsorptionDepth() { return absorptionDepth; }
    public void setAbsorptionDepth(Double absorptionDepth) { this.absorptionDepth = absorptionDepth; }

    public Double getFuchtbauerMin() { return fuchtbauerMin; }
    public void setFuchtbauerMin(Double fuchtbauerMin) { this.fuchtbauerMin = fuchtbauerMin; }

    public Double getMcCumberMax() { return mcCumberMax; }
    public void setMcCumberMax(Double mcCumberMax) { this.mcCumberMax = mcCumberMax; }

    /** Whether the fluorescence was recorded as a low/high-temperature pair. */
    public boolean isCorrectTemp() { return correctTemp; }
    public void setCorrectTemp(boolean correctTemp) { this.correctTemp = correctTemp; }

    /**
     * Builder holding every field present in the record; absent optional fields keep the
     * builder defaults.
     */
    public MaterialParameters.Builder toBuilder() {
        MaterialParameters.Builder builder = MaterialParameters.builder()
            .name(name)
            .date(date)
            .doping(require("N_dop", doping))
            .length(require("length", length))
            .lifetime(require("tau_f", lifetime))
            .refractiveIndex(require("n", refractiveIndex))
            .zeroPhononLine(require("ZPL", zeroPhononLine))
            .energyLowerLevel(energyLowerLevel)
            .energyUpperLevel(energyUpperLevel)
            .degeneracyLower(degeneracyLower)
            .degeneracyUpper(degeneracyUpper);
        if (temperature != null) builder.temperature(temperature);
        if (zeroAbsorptionWidth != null) builder.zeroAbsorptionWidth(zeroAbsorptionWidth);
        if (absorptionDepth != null) builder.absorptionDepth(absorptionDepth);
        if (fuchtbauerMin != null) builder.fuchtbauerMin(fuchtbauerMin);
        if (mcCumberMax != null) builder.mcCumberMax(mcCumberMax);
        if (zeroAbsorptionWavelength != null) {
            if (zeroAbsorptionWavelength.length != 2) {
                throw new InvalidParameterException("zero_absorption_wavelength needs two entries, got "
                    + zeroAbsorptionWavelength.length);
            }
            Double lower = zeroAbsorptionWavelength[0];
            Double upper = zeroAbsorptionWavelength[1];
            builder.zeroAbsorptionWavelengths(lower == null ? 0 : lower,
                upper == null ? Double.POSITIVE_INFINITY : upper);
        }
        return builder;
    }

    public MaterialParameters toParameters() {
        return toBuilder().build();
    }

    private static double require(String key, Double value) {
        if (value == null) {
            throw new InvalidParameterException("material record is missing \"" + key + "\"");
        }
        return value;
    }
}
