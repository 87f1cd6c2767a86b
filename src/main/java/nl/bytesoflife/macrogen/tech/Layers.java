package nl.bytesoflife.macrogen.tech;

/** Names under which a rule deck must declare the layers the builders draw on. */
public final class Layers {

    public static final String ACTIV = "Activ";
    public static final String GATPOLY = "GatPoly";
    public static final String CONT = "Cont";
    public static final String NSD = "nSD";
    public static final String PSD = "pSD";
    public static final String NWELL = "NWell";
    public static final String SALBLOCK = "SalBlock";
    public static final String METAL1 = "Metal1";
    public static final String VIA1 = "Via1";
    public static final String METAL2 = "Metal2";
    public static final String VIA2 = "Via2";
    public static final String METAL3 = "Metal3";
    public static final String VIA3 = "Via3";
    public static final String METAL4 = "Metal4";
    public static final String VIA4 = "Via4";
    public static final String METAL5 = "Metal5";
    public static final String CMIM = "Cmim";
    public static final String TOPVIA1 = "TopVia1";
    public static final String TOPMETAL1 = "TopMetal1";
    public static final String BOUNDARY = "prBoundary";

    private Layers() {
    }
}
