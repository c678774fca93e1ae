package org.crosssection.core;

/**
 * Constants used by the cross-section relations. Energies in eV, lengths in cm.
 */
public final class PhysicalConstants {

    /** Planck constant times speed of light [eV cm]. */
    public static final double HC = 1.24e-4;

    /** Boltzmann constant [eV/K]. */
    public static final double BOLTZMANN = 8.617333e-5;

    /** Speed of light [cm/s]. */
    public static final double SPEED_OF_LIGHT = 3e10;

    public static final double NM_TO_CM = 1e-7;
    public static final double MM_TO_CM = 0.1;
    public static final double M_TO_CM = 1e2;
    public static final double PER_M3_TO_PER_CM3 = 1e-6;

    private PhysicalConstants() {
    }
}
