package com.consullo.snip.overlay;

import com.consullo.snip.config.SnipConfig;
import com.consullo.snip.drawing.DrawingOperations;
import com.consullo.snip.drawing.TextAnnotation;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.Geometry;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import com.consullo.snip.window.WindowInfo;
import com.consullo.snip.window.WindowRegistry;
import java.awt.image.BufferedImage;
import org.apache.commons.lang3.Validate;

/**
 * All mutable state of one overlay session.
 *
 * <p>Owned by the UI thread. {@link OverlayController} is the only writer (its mutators are package-private); the
 * renderer reads it through the public accessors. The session lives from the moment the overlay opens until it
 * reaches {@link Phase#COMMITTED} or {@link Phase#CANCELLED}.
 *
 * @since 1.0
 */
public final class OverlaySession {

  /**
   * Lifecycle of the session.
   */
  public enum Phase {
    ACTIVE,
    COMMITTED,
    CANCELLED
  }

  private final BufferedImage screenshot;
  private final DoubleRectangle monitorGeometry;
  private final WindowRegistry windows;
  private final SnipConfig config;

  private final ToolSettings settings;
  private final DrawingOperations drawing = new DrawingOperations();

  private Phase phase = Phase.ACTIVE;
  private int panelWidth;
  private int panelHeight;

  private ToolMode tool = ToolMode.CROP;

  // Crop selection
  private PanelPoint selectionStart;
  private PanelPoint selectionEnd;

  private PanelPoint cursorPosition;
  private boolean dragging;
  private boolean keyboardSelecting;
  private WindowInfo hoveredWindow;
  private WindowInfo selectedWindow;

  // Text drag/edit
  private int selectedTextIndex = -1;
  private PanelPoint textDragStart;
  private PanelPoint textOriginalPosition;

  private ToolbarLayout toolbarLayout = ToolbarLayout.empty();

  /**
   * Creates a session.
   *
   * @param screenshot captured bitmap of the active monitor (source space)
   * @param monitorGeometry active monitor geometry in logical units
   * @param windows window registry, already relative to the monitor
   * @param config tool configuration
   */
  public OverlaySession(final BufferedImage screenshot, final DoubleRectangle monitorGeometry,
      final WindowRegistry windows, final SnipConfig config) {
    Validate.notNull(screenshot, "screenshot must not be null");
    Validate.notNull(monitorGeometry, "monitorGeometry must not be null");
    Validate.isTrue(monitorGeometry.hasArea(), "monitorGeometry must have a positive area");
    Validate.notNull(windows, "windows must not be null");
    Validate.notNull(config, "config must not be null");
    this.screenshot = screenshot;
    this.monitorGeometry = monitorGeometry;
    this.windows = windows;
    this.config = config;
    this.settings = new ToolSettings(config.defaultFontFamily());
    this.panelWidth = (int) monitorGeometry.width();
    this.panelHeight = (int) monitorGeometry.height();
  }

  /**
   * Scale factors for the current panel size. Computed on every call; never cache the result across a resize.
   *
   * @return scale factors of this frame
   */
  public ScaleFactors scaleFactors() {
    return ScaleFactors.compute(
        screenshot.getWidth(),
        screenshot.getHeight(),
        monitorGeometry.width(),
        monitorGeometry.height(),
        panelWidth,
        panelHeight);
  }

  /**
   * Records the panel's current pixel size. Called by the view before dispatching input and before painting.
   *
   * @param width panel width
   * @param height panel height
   */
  public void resize(final int width, final int height) {
    if (width > 0 && height > 0) {
      this.panelWidth = width;
      this.panelHeight = height;
    }
  }

  /**
   * Records the toolbar layout painted in the latest frame, used to hit-test the next pointer-down.
   *
   * @param layout painted layout
   */
  public void recordToolbar(final ToolbarLayout layout) {
    Validate.notNull(layout, "layout must not be null");
    this.toolbarLayout = layout;
  }

  /**
   * Normalized crop selection in panel space.
   *
   * @return selection, or {@link DoubleRectangle#ZERO} when no selection exists
   */
  public DoubleRectangle selectionRectangle() {
    return Geometry.selectionRectangle(selectionStart, selectionEnd);
  }

  /**
   * Returns true when a crop selection with both corners exists in Crop mode.
   *
   * @return true if the renderer should cut the selection out of the dim overlay
   */
  public boolean hasCropSelection() {
    return tool == ToolMode.CROP && selectionStart != null && selectionEnd != null;
  }

  public boolean isTextDragActive() {
    return selectedTextIndex >= 0;
  }

  // ------------------- Read accessors -------------------

  public BufferedImage screenshot() {
    return screenshot;
  }

  public DoubleRectangle monitorGeometry() {
    return monitorGeometry;
  }

  public WindowRegistry windows() {
    return windows;
  }

  public SnipConfig config() {
    return config;
  }

  public ToolSettings settings() {
    return settings;
  }

  public DrawingOperations drawing() {
    return drawing;
  }

  public Phase phase() {
    return phase;
  }

  public boolean isActive() {
    return phase == Phase.ACTIVE;
  }

  public int panelWidth() {
    return panelWidth;
  }

  public int panelHeight() {
    return panelHeight;
  }

  public ToolMode tool() {
    return tool;
  }

  public PanelPoint selectionStart() {
    return selectionStart;
  }

  public PanelPoint selectionEnd() {
    return selectionEnd;
  }

  public PanelPoint cursorPosition() {
    return cursorPosition;
  }

  public boolean isDragging() {
    return dragging;
  }

  public boolean isKeyboardSelecting() {
    return keyboardSelecting;
  }

  public WindowInfo hoveredWindow() {
    return hoveredWindow;
  }

  public WindowInfo selectedWindow() {
    return selectedWindow;
  }

  public int selectedTextIndex() {
    return selectedTextIndex;
  }

  public ToolbarLayout toolbarLayout() {
    return toolbarLayout;
  }

  // ------------------- Mutators (state machine only) -------------------

  void setPhase(final Phase phase) {
    this.phase = phase;
  }

  void setTool(final ToolMode tool) {
    this.tool = tool;
  }

  void setSelectionStart(final PanelPoint point) {
    this.selectionStart = point;
  }

  void setSelectionEnd(final PanelPoint point) {
    this.selectionEnd = point;
  }

  void setCursorPosition(final PanelPoint point) {
    this.cursorPosition = point;
  }

  void setDragging(final boolean dragging) {
    this.dragging = dragging;
  }

  void setKeyboardSelecting(final boolean keyboardSelecting) {
    this.keyboardSelecting = keyboardSelecting;
  }

  void setHoveredWindow(final WindowInfo window) {
    this.hoveredWindow = window;
  }

  void setSelectedWindow(final WindowInfo window) {
    this.selectedWindow = window;
  }

  void beginTextDrag(final int index, final PanelPoint dragStart, final PanelPoint originalPosition) {
    this.selectedTextIndex = index;
    this.textDragStart = dragStart;
    this.textOriginalPosition = originalPosition;
  }

  PanelPoint textDragStart() {
    return textDragStart;
  }

  PanelPoint textOriginalPosition() {
    return textOriginalPosition;
  }

  void endTextDrag() {
    this.selectedTextIndex = -1;
    this.textDragStart = null;
    this.textOriginalPosition = null;
  }

  TextAnnotation selectedText() {
    return (TextAnnotation) drawing.get(selectedTextIndex);
  }
}
