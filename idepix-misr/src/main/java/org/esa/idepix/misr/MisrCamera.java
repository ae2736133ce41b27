package org.esa.idepix.misr;

/**
 * The nine MISR cameras, in camera stack order from the most forward to the most aftward view.
 *
 * @author olafd
 */
public enum MisrCamera {
    DF(70.5),
    CF(60.0),
    BF(45.6),
    AF(26.1),
    AN(0.0),
    AA(26.1),
    BA(45.6),
    CA(60.0),
    DA(70.5);

    private final double nominalViewZenith;

    MisrCamera(double nominalViewZenith) {
        this.nominalViewZenith = nominalViewZenith;
    }

    /**
     * @return nominal view zenith angle at the surface in degrees
     */
    public double getNominalViewZenith() {
        return nominalViewZenith;
    }

    public boolean isForward() {
        return ordinal() < AN.ordinal();
    }

    public boolean isAftward() {
        return ordinal() > AN.ordinal();
    }
}
