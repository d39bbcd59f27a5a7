/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */

package gov.usgs.iccs.seis;

import java.util.ArrayList;

/** Radix 2 complex FFT.  Each object is characterized by its data length and sign and holds
 * the trigonometric recurrence coefficients for that length.  When the static FFT.doFFT() is
 * called an existing object with the same signature is used for the computation, or a new one
 * is created and added to the list, so the sines and cosines are only computed once per length
 * no matter how many seismograms are correlated.
 * <p>
 * Data are interleaved complex values (real and imaginary parts adjacent) and the number of
 * complex points must be a power of two.  The transforms are multiplied by dt (time to frequency)
 * or df (frequency to time) so a forward followed by an inverse transform returns the input.
 *
 * @author benz
 */
public class FFT {
  private static final ArrayList<FFT> ffts = new ArrayList<>(10);
  private static final double twopi = 2. * Math.PI;
  private double [] wstpr = null;
  private double [] wstpi = null;
  private final int nn;
  private final int isign;
  
  public int getNN() {return nn;}
  public int getSign() {return isign;}

  /** Return the smallest power of two which is at least n.
   *
   * @param n The minimum length
   * @return A power of 2 &gt;= n
   */
  public static int nextPow2(int n) {
    int len = 1;
    while(len < n) len = len << 1;
    return len;
  }

  /** Perform an FFT using a cached FFT object for this length and sign.
   * <br>
   * transform(j) = sum(data(i)*w**((i-1)(j-1)), where i and j run from 1 to nn and
   * w = exp(isign*2*pi*sqrt(-1)/nn).  The time is proportional to n*log2(n).
   * 
   * @param data Interleaved complex data, transformed in place
   * @param nn The number of complex data points in data[], a power of 2
   * @param isign The sign of the desired transform, -1 is time to frequency
   * @param isDt If true, delta is a sample interval, if false, delta is a frequency interval
   * @param delta The sample interval in seconds or if isDT is false, the delta frequency
   * @return This is df if isDT is true, and dt if isDT is false - that is the delta in the new domain
   */
  public static double doFFT(double data[], int nn, int isign, boolean isDt, double delta) {
    if(nn != nextPow2(nn)) {
      throw new IllegalArgumentException("FFT length must be a power of 2 nn="+nn);
    }
    if(data.length < 2*nn) {
      throw new IllegalArgumentException("FFT data too short for nn="+nn+" len="+data.length);
    }
    FFT fft = null;
    synchronized(ffts) {
      for (FFT fft2 : ffts) {
        if (fft2.getNN() == nn && fft2.getSign() == isign) {
          fft = fft2;
          break;
        }
      }
      if(fft == null) {
        fft = new FFT(nn, isign);
        ffts.add(fft);
      }
    }
    return fft.fft(data, nn, isign, isDt, delta);
  }

  /** Zero pad a real series into an interleaved complex array and transform it to frequency.
   *
   * @param x The real time series
   * @param nn The power of 2 transform length, at least x.length
   * @param dt The sample interval
   * @return The interleaved complex spectrum of length 2*nn
   */
  public static double [] forward(double [] x, int nn, double dt) {
    double [] c = new double[2*nn];
    for(int i=0; i<x.length; i++) c[2*i] = x[i];
    doFFT(c, nn, -1, true, dt);
    return c;
  }

  public FFT(int nn, int isign) {
    this.nn=nn;
    this.isign=isign;
    computecoeff(nn,isign);
  }

  /** compute the sine/cosine recurrence table for an fft of length nn and sign as given
   * 
   * @param nn Length of the data array 
   * @param isign  The sign of the desired transform
   */
  private void computecoeff(int nn, int isign) {
    int mmax = 2 ;
    int n = 2 * nn;
    int istep;
    double theta;
    double sinth;

    int k = 0;
    while(mmax < n ){     // figure the power of 2 for nn*2
      istep= 2 *mmax;
      mmax = istep;
      k++;
    }
    wstpr = new double [k];
    wstpi = new double [k];

    mmax = 2;
    int i = 0; 
    while(mmax < n ){
      istep= 2 *mmax;
      theta = twopi/(double)(isign*mmax);
      sinth=Math.sin(theta/2.);
      wstpr[i] =-2.*sinth*sinth;
      wstpi[i]=Math.sin(theta);
      mmax = istep;
      i++;
    }
  }
  
  private double fft(double data[], int nn, int isign, boolean isDt, double delta ) {
    int n;
    int i, j, m, mmax, iiii, istep;
    double tempr, tempi;
    double wr, wi;
    double dtt=0, dff=0;
    double retValue;
    if(isDt)  dtt = delta;
    else dff = delta;

    n = 2 * nn;
    if(dtt == 0.0) dtt = 1./(nn*dff) ;
    if(dff == 0.0) dff = 1./(nn*dtt) ;
    if(dtt != (nn*dff)) dff = 1./(nn*dtt) ;
    if(isDt) retValue =dff;
    else retValue = dtt;

    // bit reversal
    j = 1;
    for (i=1;i<=n; i+=2) {
      if(i < j){
        tempr = data[j-1];
        tempi = data[j  ];
        data[j-1] = data[i-1];
        data[j  ]=data[i  ];
        data[i-1] = tempr;
        data[i  ] = tempi;
      }
      m = n/2;
      while(m >= 2 && j > m) {
        j = j - m;
        m = m/2; 
      }
      j = j+m;
    }

    // Danielson-Lanczos butterflies
    mmax = 2 ;
    int ii = 0;
    while(mmax < n ){
      istep= 2 *mmax;
      wr=1.0;
      wi=0.0;
      for (m=1; m <= mmax ; m +=2){
        for(i = m ; i <= n ; i+=istep){
          j=i+mmax;
          tempr=wr*data[j-1]-wi*data[j  ];
          tempi=wr*data[j  ]+wi*data[j-1];
          data[j-1]=data[i-1]-tempr;
          data[j  ]=data[i  ]-tempi;
          data[i-1]=data[i-1]+tempr;
          data[i  ]=data[i  ]+tempi;
        }
        tempr = wr;
        wr = wr*wstpr[ii]-wi*wstpi[ii] + wr;
        wi = wi*wstpr[ii]+tempr*wstpi[ii] + wi;
      }
      mmax = istep;
      ii++;
    }

    // dimensions of a Fourier transform from the discrete transform
    double scale = isign > 0 ? dff : dtt;
    for (iiii= 0 ; iiii < n ; iiii++){
      data[iiii] = data[iiii] * scale;
    }
    return retValue;
  }

  public static double amp(double real, double imag) {
    return Math.sqrt(real*real+imag*imag);
  }
}
