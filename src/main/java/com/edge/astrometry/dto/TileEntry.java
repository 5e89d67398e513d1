package com.edge.astrometry.dto;

/**
 * tile 的 TAN 投影参数
 */
public class TileEntry {
    private int id;
    private double crval1;
    private double crval2;
    private double crpix1;
    private double crpix2;
    private double[] cd;          // {CD1_1, CD1_2, CD2_1, CD2_2}
    private double[] xiCoefficients;   // 可选，6 项
    private double[] etaCoefficients;  // 可选，6 项
    private boolean imageTile = true;

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }

    public double getCrval1() { return crval1; }
    public void setCrval1(double crval1) { this.crval1 = crval1; }

    public double getCrval2() { return crval2; }
    public void setCrval2(double crval2) { this.crval2 = crval2; }

    public double getCrpix1() { return crpix1; }
    public void setCrpix1(double crpix1) { this.crpix1 = crpix1; }

    public double getCrpix2() { return crpix2; }
    public void setCrpix2(double crpix2) { this.crpix2 = crpix2; }

    public double[] getCd() { return cd; }
    public void setCd(double[] cd) { this.cd = cd; }

    public double[] getXiCoefficients() { return xiCoefficients; }
    public void setXiCoefficients(double[] xiCoefficients) { this.xiCoefficients = xiCoefficients; }

    public double[] getEtaCoefficients() { return etaCoefficients; }
    public void setEtaCoefficients(double[] etaCoefficients) { this.etaCoefficients = etaCoefficients; }

    public boolean isImageTile() { return imageTile; }
    public void setImageTile(boolean imageTile) { this.imageTile = imageTile; }
}
