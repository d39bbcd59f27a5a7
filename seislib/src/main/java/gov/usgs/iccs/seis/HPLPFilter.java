/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */

package gov.usgs.iccs.seis;

import gov.usgs.iccs.util.Util;

/**
 * Butterworth high pass or low pass filter built as cascaded second order sections.  The analog
 * prototype poles are scaled to the prewarped corner and mapped with the bilinear transform.  The
 * filter can be applied once (causal) or forward and then backward for a zero phase result with
 * twice the attenuation.
 *
 * @author benz
 */
public class HPLPFilter {
    
  private final int nsects;
  private final double sos_num[];
  private final double sos_denom[];
  private final double corner;
  private final boolean highpass;
  private final StringBuilder tmpsb = new StringBuilder(50);

  @Override
  public String toString() {return toStringBuilder(null).toString();}
  public StringBuilder toStringBuilder(StringBuilder tmp) {
    StringBuilder sb = tmp;
    if(sb == null) {
      sb=Util.clear(tmpsb);
    }
    synchronized(sb) {
      sb.append("Filt:").append(" hp=").append(highpass).append(" ").append(corner).append(" npole=").append(nsects*2);
    }
    return sb;
  }      

  /** Creates a new instance of HPLPFilter
   * @param dt sample interval of seismic data
   * @param corner corner frequency of filter (in Hz), must be below the Nyquist
   * @param npoles number of poles in filter, an even number &gt;= 2
   * @param highPass true (will high pass filter), false (will low pass filter)
   */
  public HPLPFilter(double dt, double corner, int npoles, boolean highPass) {
    if(npoles < 2 || npoles % 2 != 0) {
      throw new IllegalArgumentException("Number of poles must be even and >= 2 npoles="+npoles);
    }
    if(!(corner > 0.) || corner >= 0.5/dt) {
      throw new IllegalArgumentException("Corner "+corner+" Hz must be between 0 and the Nyquist "+(0.5/dt));
    }
    this.highpass=highPass;
    this.corner=corner;
    nsects = npoles/2;
    sos_num = new double[3*nsects];
    sos_denom = new double[3*nsects];

    // analog Butterworth prototype, one complex pole pair per section
    for(int k=0; k<nsects; k++) {
      double angle = Math.PI * (0.5 + (2.0*(k+1)-1)/(2.0*npoles));
      double pr = Math.cos(angle);
      double pi = Math.sin(angle);
      double scale = pr*pr + pi*pi;
      int iptr = 3*k;
      if(highPass) {
        sos_num[iptr] = 0.;
        sos_num[iptr+1] = 0.;
        sos_num[iptr+2] = scale;
        sos_denom[iptr] = 1.;
        sos_denom[iptr+1] = -2.*pr;
        sos_denom[iptr+2] = scale;
      }
      else {
        sos_num[iptr] = scale;
        sos_num[iptr+1] = 0.;
        sos_num[iptr+2] = 0.;
        sos_denom[iptr] = scale;
        sos_denom[iptr+1] = -2.*pr;
        sos_denom[iptr+2] = 1.;
      }
    }
    cutOff(warp(corner, dt));
    bilinear();
  }

  /** prewarp the analog cutoff frequency for the bilinear transform
   *
   * @param f The corner in Hz
   * @param dt The sample interval
   * @return The warped analog corner in Hz for a unit sample interval transform
   */
  private static double warp(double f, double dt) {
    return Math.tan(Math.PI * f * dt) / Math.PI / 2.;
  }

  private void cutOff(double f) {
    double scale = 2. * Math.PI * f;
    for(int iptr=0; iptr<3*nsects; iptr+=3) {
      sos_num[iptr+1] /= scale;
      sos_num[iptr+2] /= (scale*scale);
      sos_denom[iptr+1] /= scale;
      sos_denom[iptr+2] /= (scale*scale);
    }
  }

  /** BiLinear transform the analog sections to digital ones */
  private void bilinear() {
    for(int iptr=0; iptr<3*nsects; iptr+=3) {
      double a0 = sos_denom[iptr];
      double a1 = sos_denom[iptr+1];
      double a2 = sos_denom[iptr+2];
      double scale = a2 + a1 + a0;

      sos_denom[iptr] = 1.;
      sos_denom[iptr+1] = (2. * (a0 - a2)) / scale;
      sos_denom[iptr+2] = (a2 - a1 + a0) / scale;

      a0 = sos_num[iptr];
      a1 = sos_num[iptr+1];
      a2 = sos_num[iptr+2];
      sos_num[iptr] = (a2 + a1 + a0) / scale;
      sos_num[iptr+1] = (2. * (a0 - a2)) / scale;
      sos_num[iptr+2] = (a2 - a1 + a0) / scale;
    }
  }

  /** Apply the filter in place
   *
   * @param data The data to filter
   * @param nsamps The number of samples in data to filter
   * @param zerophase If true, run the sections forward and then backward over the data
   */
  public void apply(double [] data, int nsamps, boolean zerophase) {
    pass(data, nsamps, true);
    if(zerophase) pass(data, nsamps, false);
  }

  private void pass(double [] data, int nsamps, boolean forward) {
    for(int jptr=0; jptr<3*nsects; jptr+=3) {
      double x1 = 0., x2 = 0., y1 = 0., y2 = 0.;
      double b0 = sos_num[jptr];
      double b1 = sos_num[jptr+1];
      double b2 = sos_num[jptr+2];
      double a1 = sos_denom[jptr+1];
      double a2 = sos_denom[jptr+2];
      for(int k=0; k<nsamps; k++) {
        int i = forward ? k : nsamps - 1 - k;
        double output = b0*data[i] + b1*x1 + b2*x2 - (a1*y1 + a2*y2);
        y2 = y1;
        y1 = output;
        x2 = x1;
        x1 = data[i];
        data[i] = output;
      }
    }
  }

  public double getCorner() {return corner;}
  public boolean isHighPass() {return highpass;}
  public int getNpoles() {return nsects*2;}
}
