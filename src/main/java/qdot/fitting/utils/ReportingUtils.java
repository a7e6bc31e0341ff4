package qdot.fitting.utils;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYSeriesCollection;
import qdot.fitting.fit.FermiLinearEstimate;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.FermiModel;
import qdot.fitting.model.ModelFunction;
import qdot.fitting.output.FitDatasets;
import qdot.fitting.output.FitResult;

/**
 * This class defines functions relevant to creating diagnostic output, such as plots of fits
 * and PNG images of those plots. These methods are all static and never modify the data or
 * results they are given.
 *
 * @author akearns - KBRWyle
 */
public class ReportingUtils {

  /**
   * Plot a fit: the measured data as points, the initial guess and the fitted curve as lines
   *
   * @param title Chart title
   * @param series Data that was fit
   * @param model Model that was fit
   * @param result Result of the fit
   * @return Chart of the fit
   */
  public static JFreeChart createFitChart(String title, SampleSeries series, ModelFunction model,
      FitResult result) {
    XYSeriesCollection xysc = FitDatasets.of(series, model, result);
    JFreeChart chart = ChartFactory.createXYLineChart(title, "x", "y", xysc,
        PlotOrientation.VERTICAL, true, false, false);
    XYPlot plot = chart.getXYPlot();
    XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
    renderer.setSeriesLinesVisible(0, false);
    renderer.setSeriesShapesVisible(0, true);
    renderer.setSeriesPaint(0, Color.BLUE);
    renderer.setSeriesShapesVisible(1, false);
    renderer.setSeriesPaint(1, Color.GRAY);
    renderer.setSeriesShapesVisible(2, false);
    renderer.setSeriesPaint(2, Color.MAGENTA);
    plot.setRenderer(renderer);
    return chart;
  }

  /**
   * Plot the step part of a Fermi-linear estimate: the data with the estimated background
   * removed, the estimated Fermi step, and a marker at the estimated center
   *
   * @param series Data that was estimated
   * @param estimate Estimate of the data
   * @param leverArm Lever arm of the Fermi model
   * @return Chart of the estimate
   */
  public static JFreeChart createFermiEstimateChart(SampleSeries series,
      FermiLinearEstimate estimate, double leverArm) {
    double[] x = series.getX();
    double[] y = series.getY();
    double[] linear = estimate.getLinearPart();
    double[] fermi = estimate.getFermiPart();
    for (int i = 0; i < y.length; ++i) {
      y[i] -= linear[0] * x[i] + linear[1];
    }

    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(FitDatasets.data(new SampleSeries("Fermi part", x, y)));
    xysc.addSeries(FitDatasets.curve("Initial estimate", x, new FermiModel(leverArm), fermi));

    JFreeChart chart = ChartFactory.createXYLineChart("Fermi-linear estimate", "x",
        "y - linear estimate", xysc, PlotOrientation.VERTICAL, true, false, false);
    XYPlot plot = chart.getXYPlot();
    XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
    renderer.setSeriesLinesVisible(0, false);
    renderer.setSeriesPaint(0, Color.BLUE);
    renderer.setSeriesShapesVisible(1, false);
    renderer.setSeriesPaint(1, Color.MAGENTA);
    plot.setRenderer(renderer);

    ValueMarker centerMarker = new ValueMarker(fermi[0]);
    centerMarker.setPaint(Color.CYAN);
    plot.addDomainMarker(centerMarker);
    return chart;
  }

  /**
   * Create a single image from a series of charts, each drawn at the given size
   * (that is, the charts are concatenated vertically)
   *
   * @param width width of each chart plot
   * @param height height of each chart plot
   * @param charts series of charts to be plotted in
   * @return buffered image consisting of the concatenation of the given charts
   */
  public static BufferedImage chartsToImage(int width, int height, JFreeChart... charts) {
    BufferedImage[] bis = new BufferedImage[charts.length];
    for (int i = 0; i < charts.length; ++i) {
      bis[i] = charts[i].createBufferedImage(width, height);
    }
    return mergeBufferedImages(bis);
  }

  /**
   * Render charts into a PNG image
   *
   * @param width width of each chart plot
   * @param height height of each chart plot
   * @param charts charts to render, stacked vertically
   * @return PNG image data
   * @throws IOException if the image could not be encoded
   */
  public static byte[] chartsToPng(int width, int height, JFreeChart... charts)
      throws IOException {
    return ChartUtils.encodeAsPNG(chartsToImage(width, height, charts));
  }

  /**
   * Merge a series of buffered images. Images are concatenated vertically and centered
   * horizontally into an image as wide as the widest passed-in image
   *
   * @param images Buffered images to send in
   * @return Single concatenated buffered image
   */
  private static BufferedImage mergeBufferedImages(BufferedImage... images) {

    int maxWidth = 0;
    int totalHeight = 0;
    for (BufferedImage bi : images) {
      if (maxWidth < bi.getWidth()) {
        maxWidth = bi.getWidth();
      }
      totalHeight += bi.getHeight();
    }

    BufferedImage out =
        new BufferedImage(maxWidth, totalHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();

    int heightIndex = 0;
    for (BufferedImage bi : images) {
      int centeringOffset = 0; // need to center the component?
      if (bi.getWidth() < maxWidth) {
        centeringOffset = (maxWidth - bi.getWidth()) / 2;
      }
      g.drawImage(bi, null, centeringOffset, heightIndex);
      heightIndex += bi.getHeight();
    }
    g.dispose();

    return out;
  }

}
