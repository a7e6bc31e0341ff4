package qdot.fitting.utils;

import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

public class FFTResultTest {

  private static double[] sine(double frequency, double sampleRate, int length, double dc) {
    double[] out = new double[length];
    for (int i = 0; i < length; ++i) {
      out[i] = Math.sin(NumericUtils.TAU * frequency * i / sampleRate) + dc;
    }
    return out;
  }

  @Test
  public void singleSidedFFTHasPositiveFrequencies() {
    FFTResult fft = FFTResult.singleSidedFFT(sine(5., 100., 1000, 0.), 100., false);
    // padded to 1024 points
    assertEquals(513, fft.size());
    assertEquals(513, fft.getFreqs().length);
    assertEquals(0., fft.getFreq(0), 0.);
    assertEquals(50., fft.getFreq(512), 1E-12);
  }

  @Test
  public void removingDCZeroesFirstBin() {
    FFTResult fft = FFTResult.singleSidedFFT(sine(5., 100., 1000, 3.), 100., true);
    assertEquals(Complex.ZERO, fft.getFFT(0));
  }

  @Test
  public void dominantFrequencyOfSine() {
    double[] signal = sine(5., 100., 1000, 10.);
    double estimate = FFTResult.estimateDominantFrequency(signal, 100., true);
    // within a bin of the padded transform
    assertEquals(5., estimate, 100. / 1024);
  }

  @Test
  public void dominantFrequencyScalesWithSampleRate() {
    double[] signal = sine(5., 100., 1000, 0.);
    double estimate = FFTResult.estimateDominantFrequency(signal, 100., true);
    double scaled = FFTResult.estimateDominantFrequency(signal, 200., true);
    assertEquals(2 * estimate, scaled, 1E-9);
  }

}
