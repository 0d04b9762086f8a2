package com.consullo.snip.geometry;

import org.apache.commons.lang3.Validate;

/**
 * Conversion factors between the three coordinate spaces for a single frame.
 *
 * <p>Instances are derived from the current panel pixel size and must be recomputed on every render pass and
 * before every hit-test. Never keep one across a resize.
 *
 * @param sourceX source pixels per panel pixel (horizontal)
 * @param sourceY source pixels per panel pixel (vertical)
 * @param monitorX monitor units per panel pixel (horizontal)
 * @param monitorY monitor units per panel pixel (vertical)
 * @since 1.0
 */
public record ScaleFactors(double sourceX, double sourceY, double monitorX, double monitorY) {

  public static final ScaleFactors IDENTITY = new ScaleFactors(1.0, 1.0, 1.0, 1.0);

  public ScaleFactors {
    Validate.isTrue(sourceX > 0 && sourceY > 0, "source scale must be positive");
    Validate.isTrue(monitorX > 0 && monitorY > 0, "monitor scale must be positive");
  }

  /**
   * Computes the factors for the given panel size.
   *
   * @param sourceWidth screenshot width in pixels
   * @param sourceHeight screenshot height in pixels
   * @param monitorWidth monitor width in logical units
   * @param monitorHeight monitor height in logical units
   * @param panelWidth current panel width in pixels
   * @param panelHeight current panel height in pixels
   * @return scale factors for this frame
   */
  public static ScaleFactors compute(
      final int sourceWidth,
      final int sourceHeight,
      final double monitorWidth,
      final double monitorHeight,
      final int panelWidth,
      final int panelHeight) {
    Validate.isTrue(panelWidth > 0 && panelHeight > 0, "panel size must be positive: %dx%d", panelWidth, panelHeight);
    return new ScaleFactors(
        (double) sourceWidth / panelWidth,
        (double) sourceHeight / panelHeight,
        monitorWidth / panelWidth,
        monitorHeight / panelHeight);
  }

  public MonitorPoint toMonitorSpace(final PanelPoint point) {
    return new MonitorPoint(point.x() * monitorX, point.y() * monitorY);
  }

  public PanelPoint toPanelSpace(final MonitorPoint point) {
    return new PanelPoint(point.x() / monitorX, point.y() / monitorY);
  }

  /**
   * Converts a monitor-space rectangle (window geometry) to panel space.
   *
   * @param monitorRect rectangle in monitor space
   * @return rectangle in panel space
   */
  public DoubleRectangle toPanelRect(final DoubleRectangle monitorRect) {
    return new DoubleRectangle(
        monitorRect.x() / monitorX,
        monitorRect.y() / monitorY,
        monitorRect.width() / monitorX,
        monitorRect.height() / monitorY);
  }

  public DoubleRectangle toMonitorRect(final DoubleRectangle panelRect) {
    return new DoubleRectangle(
        panelRect.x() * monitorX,
        panelRect.y() * monitorY,
        panelRect.width() * monitorX,
        panelRect.height() * monitorY);
  }

  public SourcePoint toSourceSpace(final PanelPoint point) {
    return new SourcePoint(point.x() * sourceX, point.y() * sourceY);
  }

  public DoubleRectangle toSourceRect(final DoubleRectangle panelRect) {
    return new DoubleRectangle(
        panelRect.x() * sourceX,
        panelRect.y() * sourceY,
        panelRect.width() * sourceX,
        panelRect.height() * sourceY);
  }

  /**
   * Scales a panel-space length (stroke width, font size) to source space. Uses the horizontal factor.
   *
   * @param panelLength length in panel pixels
   * @return length in source pixels
   */
  public double toSourceLength(final double panelLength) {
    return panelLength * sourceX;
  }
}
