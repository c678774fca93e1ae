package org.crosssection.core;

import org.crosssection.core.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MaterialParametersTest {

    static MaterialParameters ybYag() {
        return MaterialParameters.builder()
            .name("Yb:YAG")
            .doping(1.38e26)
            .length(2e-3)
            .lifetime(0.95e-3)
            .refractiveIndex(1.82)
            .zeroPhononLine(968.8e-9)
            .build();
    }

    @Test
    public void testDefaults() {
        MaterialParameters m = ybYag();
        assertEquals(295, m.getTemperature());
        assertArrayEquals(new double[]{0}, m.getEnergyLowerLevel());
        assertArrayEquals(new double[]{1e-2 / 968.8e-9}, m.getEnergyUpperLevel(), 1e-9);
        assertArrayEquals(new double[]{2}, m.getDegeneracyLower());
        assertArrayEquals(new double[]{2}, m.getDegeneracyUpper());
        assertEquals(958.8, m.getFuchtbauerMin(), 1e-9);
        assertEquals(978.8, m.getMcCumberMax(), 1e-9);
        assertEquals(0, m.getZeroAbsorptionLambda1());
        assertEquals(Double.POSITIVE_INFINITY, m.getZeroAbsorptionLambda2());
        assertEquals("Yb:YAG", m.getName());
    }

    @Test
    public void testUnitConversions() {
        MaterialParameters m = ybYag().toBuilder().absorptionDepth(0.5).build();
        assertEquals(1.38e20, m.getDopingPerCm3(), 1e8);
        assertEquals(0.2, m.getLengthCm(), 1e-12);
        assertEquals(968.8, m.getZeroPhononLineNm(), 1e-9);
        assertEquals(0.05, m.getAbsorptionDepthCm(), 1e-12);
        assertEquals(PhysicalConstants.BOLTZMANN * 295, m.getThermalEnergy(), 1e-15);
    }

    @Test
    public void testToBuilder_keepsZplDerivedDefaultsLive() {
        MaterialParameters shifted = ybYag().toBuilder().zeroPhononLine(1000e-9).build();
        assertEquals(990, shifted.getFuchtbauerMin(), 1e-9);
        assertEquals(1010, shifted.getMcCumberMax(), 1e-9);
        assertArrayEquals(new double[]{1e-2 / 1000e-9}, shifted.getEnergyUpperLevel(), 1e-9);

        MaterialParameters pinned = ybYag().toBuilder().fuchtbauerMin(950).build()
            .toBuilder().zeroPhononLine(1000e-9).build();
        assertEquals(950, pinned.getFuchtbauerMin(), 1e-9);
    }

    @Test
    public void testToBuilder_roundTripIsEqual() {
        assertEquals(ybYag(), ybYag().toBuilder().build());
    }

    @Test
    public void testValidation() {
        assertThrows(InvalidParameterException.class, () -> ybYag().toBuilder().doping(0).build());
        assertThrows(InvalidParameterException.class, () -> ybYag().toBuilder().lifetime(Double.NaN).build());
        assertThrows(InvalidParameterException.class,
            () -> ybYag().toBuilder().energyLowerLevel(new double[]{0, 600}).degeneracyLower(new double[]{2}).build());
        assertThrows(InvalidParameterException.class,
            () -> ybYag().toBuilder().zeroAbsorptionWavelengths(1100, 1000).build());
        assertThrows(InvalidParameterException.class, () -> ybYag().toBuilder().zeroAbsorptionWidth(-1).build());
        assertThrows(InvalidParameterException.class,
            () -> MaterialParameters.builder().doping(1e26).length(1e-3).lifetime(1e-3).refractiveIndex(1.8).build());
    }
}
