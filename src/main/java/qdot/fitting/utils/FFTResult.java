package qdot.fitting.utils;

import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Holds the positive-frequency half of an FFT together with the frequencies of each entry.
 * Also provides the default estimator of the dominant frequency of a sampled signal, used to
 * produce the initial frequency guess for sine fits.
 *
 * @author akearns - KBRWyle
 */
public class FFTResult {

  final private Complex[] transform; // the FFT data
  final private double[] freqs; // array of frequencies matching the fft data

  /**
   * Instantiate the structure holding an FFT and its frequency range
   *
   * @param inFFT Precalculated FFT result for some series
   * @param inFreq Frequencies matched up to each FFT value
   */
  private FFTResult(Complex[] inFFT, double[] inFreq) {
    transform = inFFT;
    freqs = inFreq;
  }

  /**
   * Function for padding and returning the result of a forward FFT.
   * This does not trim the negative frequencies of the result; it returns
   * the full FFT result as an array of Complex numbers
   *
   * @param dataIn Array of doubles representing sampled data
   * @return Complex array representing forward FFT values, including
   * symmetric component (second half of the function)
   */
  private static Complex[] simpleFFT(double[] dataIn) {

    int padding = 2;
    while (padding < dataIn.length) {
      padding *= 2;
    }

    double[] toFFT = Arrays.copyOf(dataIn, padding);

    FastFourierTransformer fft =
        new FastFourierTransformer(DftNormalization.STANDARD);

    return fft.transform(toFFT, TransformType.FORWARD);
  }

  /**
   * Calculates the FFT of some sampled data (zero-padded to a power of two)
   * and returns the positive frequencies resulting from the FFT calculation
   *
   * @param data Sampled data, not modified
   * @param sps Sample rate of the data
   * @param removeDC True if the mean should be removed before the transform
   * @return Complex array of FFT values, and double array of matching frequencies
   */
  public static FFTResult singleSidedFFT(double[] data, double sps, boolean removeDC) {
    if (removeDC) {
      data = TimeSeriesUtils.demean(data);
    }

    Complex[] frqDomn = simpleFFT(data);

    int padding = frqDomn.length;
    int singleSide = padding / 2 + 1;

    double nyquist = sps / 2;
    double deltaFrq = nyquist / (singleSide - 1);

    Complex[] fftOut = new Complex[singleSide];
    double[] frequencies = new double[singleSide];

    for (int i = 0; i < singleSide; ++i) {
      fftOut[i] = frqDomn[i];
      frequencies[i] = i * deltaFrq;
    }

    if (removeDC) {
      fftOut[0] = Complex.ZERO;
    }

    return new FFTResult(fftOut, frequencies);
  }

  /**
   * Estimate the frequency with the most power in a signal. The peak of the magnitude spectrum
   * is refined by taking the magnitude-weighted mean of the frequencies of the peak bin and
   * its immediate neighbors, when the peak is not at either end of the spectrum.
   *
   * @param signal Sampled signal
   * @param sampleRate Sample rate of the signal (samples per unit of the independent variable)
   * @param removeDC True if the constant component should be ignored
   * @return Estimated dominant frequency, in units of the sample rate
   */
  public static double estimateDominantFrequency(double[] signal, double sampleRate,
      boolean removeDC) {
    FFTResult spectrum = singleSidedFFT(signal, sampleRate, removeDC);
    double[] magnitudes = new double[spectrum.size()];
    for (int i = 0; i < magnitudes.length; ++i) {
      magnitudes[i] = spectrum.getFFT(i).abs();
    }

    int peakIdx = NumericUtils.argmax(magnitudes);
    if (peakIdx == 0 || peakIdx == magnitudes.length - 1) {
      return spectrum.getFreq(peakIdx);
    }

    double weightSum = 0.;
    double weightedFreqs = 0.;
    for (int i = peakIdx - 1; i <= peakIdx + 1; ++i) {
      weightSum += magnitudes[i];
      weightedFreqs += magnitudes[i] * spectrum.getFreq(i);
    }
    return weightedFreqs / weightSum;
  }

  /**
   * Return the value of the FFT at the given index
   *
   * @param idx Index to get the FFT value at
   * @return FFT value at index
   */
  public Complex getFFT(int idx) {
    return transform[idx];
  }

  /**
   * Get the frequency value at the given index
   *
   * @param idx Index to get the frequency value at
   * @return Frequency value at index
   */
  public double getFreq(int idx) {
    return freqs[idx];
  }

  /**
   * Get the frequency range for the (previously calculated) FFT
   *
   * @return Array of frequencies (doubles), matching index to each FFT point
   */
  public double[] getFreqs() {
    return freqs;
  }

  /**
   * Get the size of the complex array of FFT values, also the size of the
   * double array of frequencies for the FFT at each index
   *
   * @return int representing size of this object's arrays
   */
  public int size() {
    return transform.length;
  }

}
