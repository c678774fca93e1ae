package org.crosssection.physics;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.PhysicalConstants;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.InvalidParameterException;

import java.util.Locale;

/**
 * McCumber reciprocity between absorption and emission cross sections of two Stark-split
 * manifolds in thermal equilibrium:
 * <pre>
 *   σe(λ) = Z_l / Z_u · exp[(E_zpl − hc/λ) / kT] · σa(λ)
 * </pre>
 * Partition functions and the zero-phonon energy are computed once per converter.
 */
public final class McCumberConverter {
    private final double thermalEnergy;
    private final double zeroPhononEnergy;
    private final double partitionLower;
    private final double partitionUpper;

    /**
     * @param energiesLower   lower-manifold sublevels [cm⁻¹], first entry the lowest
     * @param energiesUpper   upper-manifold sublevels [cm⁻¹], first entry the lowest
     * @param degeneracyLower degeneracy per lower sublevel
     * @param degeneracyUpper degeneracy per upper sublevel
     * @param thermalEnergy   kT [eV]
     */
    public McCumberConverter(double[] energiesLower, double[] energiesUpper,
                             double[] degeneracyLower, double[] degeneracyUpper, double thermalEnergy) {
        if (!(thermalEnergy > 0) || Double.isInfinite(thermalEnergy)) {
            throw new InvalidParameterException("thermal energy must be positive, got " + thermalEnergy);
        }
        if (energiesLower.length == 0 || energiesUpper.length == 0) {
            throw new InvalidParameterException("both manifolds need at least one sublevel");
        }
        if (degeneracyLower.length != energiesLower.length || degeneracyUpper.length != energiesUpper.length) {
            throw new InvalidParameterException("one degeneracy per sublevel required");
        }
        this.thermalEnergy = thermalEnergy;
        this.zeroPhononEnergy = (energiesUpper[0] - energiesLower[0]) * PhysicalConstants.HC;
        this.partitionLower = partitionFunction(energiesLower, degeneracyLower, thermalEnergy);
        this.partitionUpper = partitionFunction(energiesUpper, degeneracyUpper, thermalEnergy);
    }

    public static McCumberConverter forMaterial(MaterialParameters material) {
        return new McCumberConverter(material.getEnergyLowerLevel(), material.getEnergyUpperLevel(),
            material.getDegeneracyLower(), material.getDegeneracyUpper(), material.getThermalEnergy());
    }

    /**
     * Σ g·exp(−ΔE/kT) with ΔE measured in eV from the manifold's first sublevel.
     */
    static double partitionFunction(double[] wavenumbers, double[] degeneracies, double kT) {
        double z = 0;
        for (int i = 0; i < wavenumbers.length; i++) {
            double energy = (wavenumbers[i] - wavenumbers[0]) * PhysicalConstants.HC;
            z += degeneracies[i] * Math.exp(-energy / kT);
        }
        return z;
    }

    /**
     * @param crossSection σa when {@code inverse} is false, σe otherwise; wavelengths in nm
     * @param inverse      false: absorption to emission, true: emission to absorption
     */
    public Spectrum convert(Spectrum crossSection, boolean inverse) {
        double[] converted = new double[crossSection.size()];
        for (int i = 0; i < converted.length; i++) {
            double lambda = crossSection.getWavelengthAt(i) * PhysicalConstants.NM_TO_CM;
            double exponent = (zeroPhononEnergy - PhysicalConstants.HC / lambda) / thermalEnergy;
            double factor = inverse
                ? partitionUpper / partitionLower * Math.exp(-exponent)
                : partitionLower / partitionUpper * Math.exp(exponent);
            converted[i] = factor * crossSection.getValueAt(i);
        }
        return crossSection.withValues(converted);
    }

    /** kT [eV]. */
    public double getThermalEnergy() { return thermalEnergy; }

    /** Energy gap between the lowest sublevels [eV]. */
    public double getZeroPhononEnergy() { return zeroPhononEnergy; }

    public double getZeroPhononWavelengthNm() {
        return PhysicalConstants.HC / zeroPhononEnergy / PhysicalConstants.NM_TO_CM;
    }

    public double getPartitionLower() { return partitionLower; }
    public double getPartitionUpper() { return partitionUpper; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "McCumberConverter(ZPL=%.4f eV, Z_l=%.3f, Z_u=%.3f, kT=%.5f eV)",
            zeroPhononEnergy, partitionLower, partitionUpper, thermalEnergy);
    }
}
