package com.consullo.snip.overlay;

import com.consullo.snip.composite.CompositeCropper;
import com.consullo.snip.drawing.BrushStroke;
import com.consullo.snip.drawing.DrawingOperations;
import com.consullo.snip.drawing.FilledRectangle;
import com.consullo.snip.drawing.InvalidIndexException;
import com.consullo.snip.drawing.TextAnnotation;
import com.consullo.snip.drawing.TextMeasurer;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.Geometry;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import com.consullo.snip.platform.ColorPicker;
import com.consullo.snip.platform.FontPicker;
import com.consullo.snip.platform.TextPrompt;
import com.consullo.snip.window.WindowInfo;
import java.awt.Color;
import java.awt.event.KeyEvent;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tool/input state machine of the overlay.
 *
 * <p>Interprets pointer and keyboard events against the active tool, the selection and the drag state, and mutates
 * the {@link OverlaySession}. All calls must come from the UI thread; blocking dialogs (color, font, text) run
 * inline and suspend event processing until dismissed.
 *
 * <p>Threshold misses (too-small selection, one-point stroke, degenerate rectangle) are discarded silently.
 *
 * @since 1.0
 */
public final class OverlayController {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlayController.class);

  static final String ADD_TEXT_TITLE = "Add Text";
  static final String EDIT_TEXT_TITLE = "Edit Text";

  private static final int ARROW_STEP = 1;
  private static final int ARROW_STEP_FAST = 10;

  private final OverlaySession session;
  private final ColorPicker colorPicker;
  private final FontPicker fontPicker;
  private final TextPrompt textPrompt;
  private final TextMeasurer textMeasurer;
  private final Supplier<List<String>> fontFamilies;
  private final CompositeCropper cropper;
  private final OverlayListener listener;
  private final InteractionThresholds thresholds;

  private OverlayController(final Builder b) {
    this.session = b.session;
    this.colorPicker = b.colorPicker;
    this.fontPicker = b.fontPicker;
    this.textPrompt = b.textPrompt;
    this.textMeasurer = b.textMeasurer;
    this.fontFamilies = b.fontFamilies;
    this.cropper = b.cropper;
    this.listener = b.listener;
    this.thresholds = b.session.config().thresholds();
  }

  public static Builder builder() {
    return new Builder();
  }

  public OverlaySession session() {
    return session;
  }

  // ------------------- Pointer -------------------

  /**
   * Left button pressed.
   *
   * @param point panel-space position
   */
  public void pointerPressed(final PanelPoint point) {
    if (!session.isActive()) {
      return;
    }
    session.setKeyboardSelecting(false);

    final Optional<ToolbarButton> button = session.toolbarLayout().hit(point);
    if (button.isPresent()) {
      handleToolbarClick(button.get());
      return;
    }

    switch (session.tool()) {
      case CROP:
        session.setSelectionStart(point);
        session.setSelectionEnd(point);
        session.setDragging(true);
        break;
      case BRUSH:
        session.drawing().beginStroke(point);
        session.setDragging(true);
        break;
      case TEXT:
        pressText(point);
        break;
      case RECTANGLE:
        session.drawing().beginRectangle(point);
        session.setDragging(true);
        break;
      default:
        throw new IllegalStateException("Unhandled tool: " + session.tool());
    }
    listener.repaintRequested();
  }

  /**
   * Pointer moved with the left button held.
   *
   * @param point panel-space position
   */
  public void pointerDragged(final PanelPoint point) {
    if (!session.isActive() || !session.isDragging()) {
      return;
    }
    switch (session.tool()) {
      case CROP:
        session.setSelectionEnd(point);
        break;
      case BRUSH:
        session.drawing().extendStroke(point);
        break;
      case TEXT:
        dragText(point);
        break;
      case RECTANGLE:
        session.drawing().extendRectangle(point);
        break;
      default:
        throw new IllegalStateException("Unhandled tool: " + session.tool());
    }
    listener.repaintRequested();
  }

  /**
   * Pointer moved without a button held. Updates the crosshair position and, in Crop mode, the hovered window.
   *
   * @param point panel-space position
   */
  public void pointerMoved(final PanelPoint point) {
    if (!session.isActive()) {
      return;
    }
    session.setCursorPosition(point);
    if (session.tool() == ToolMode.CROP) {
      session.setHoveredWindow(findWindowAt(point));
    }
    if (!session.isKeyboardSelecting()) {
      listener.repaintRequested();
    }
  }

  /**
   * Left button released.
   *
   * @param point panel-space position
   */
  public void pointerReleased(final PanelPoint point) {
    if (!session.isActive() || !session.isDragging()) {
      return;
    }
    session.setDragging(false);

    switch (session.tool()) {
      case CROP:
        releaseCrop(point);
        break;
      case BRUSH:
        releaseBrush();
        break;
      case TEXT:
        releaseText(point);
        break;
      case RECTANGLE:
        releaseRectangle(point);
        break;
      default:
        throw new IllegalStateException("Unhandled tool: " + session.tool());
    }
    if (session.isActive()) {
      listener.repaintRequested();
    }
  }

  private void releaseCrop(final PanelPoint point) {
    session.setSelectionEnd(point);
    final DoubleRectangle rect = session.selectionRectangle();
    if (rect.width() > thresholds.cropDragMinPx() || rect.height() > thresholds.cropDragMinPx()) {
      commitCrop(rect);
      return;
    }

    // A click: crop to the window under the pointer
    final WindowInfo clicked = findWindowAt(point);
    if (clicked != null) {
      cropToWindow(clicked);
    } else {
      session.setSelectionStart(null);
      session.setSelectionEnd(null);
    }
  }

  private void releaseBrush() {
    final DrawingOperations drawing = session.drawing();
    if (drawing.strokePoints().size() >= 2) {
      final ToolSettings s = session.settings();
      final BrushStroke stroke = new BrushStroke(drawing.strokePoints(), s.color(), s.brushWidth());
      drawing.commit(stroke);
      LOGGER.debug("Committed stroke with {} points", stroke.points().size());
    }
    drawing.clearStroke();
  }

  private void releaseRectangle(final PanelPoint point) {
    final DrawingOperations drawing = session.drawing();
    drawing.extendRectangle(point);
    if (drawing.hasRectangleInProgress()) {
      final DoubleRectangle rect = drawing.rectangleInProgress();
      if (rect.width() > thresholds.rectangleMinPx() && rect.height() > thresholds.rectangleMinPx()) {
        drawing.commit(new FilledRectangle(rect, session.settings().color()));
        LOGGER.debug("Committed rectangle {}", rect);
      }
    }
    drawing.clearRectangle();
  }

  // ------------------- Text tool -------------------

  private void pressText(final PanelPoint point) {
    final OptionalInt hit = session.drawing().hitTestText(point, textMeasurer);
    if (hit.isPresent()) {
      final TextAnnotation existing = (TextAnnotation) session.drawing().get(hit.getAsInt());
      session.beginTextDrag(hit.getAsInt(), point, existing.position());
      session.setDragging(true);
      return;
    }

    final Optional<String> text = textPrompt.prompt(ADD_TEXT_TITLE, null);
    if (text.isPresent() && !text.get().isBlank()) {
      final ToolSettings s = session.settings();
      session.drawing().commit(new TextAnnotation(text.get(), point, s.color(), s.fontSize(), s.fontFamily()));
      LOGGER.debug("Committed text at {}", point);
    }
  }

  private void dragText(final PanelPoint point) {
    if (!session.isTextDragActive()) {
      return;
    }
    final PanelPoint start = session.textDragStart();
    final PanelPoint origin = session.textOriginalPosition();
    final PanelPoint moved = origin.translate(point.x() - start.x(), point.y() - start.y());
    replaceText(session.selectedTextIndex(), session.selectedText().withPosition(moved));
  }

  private void releaseText(final PanelPoint point) {
    if (!session.isTextDragActive()) {
      return;
    }
    final int index = session.selectedTextIndex();
    final PanelPoint start = session.textDragStart();
    final PanelPoint origin = session.textOriginalPosition();
    final double dx = Math.abs(point.x() - start.x());
    final double dy = Math.abs(point.y() - start.y());

    if (dx < thresholds.textClickMaxPx() && dy < thresholds.textClickMaxPx()) {
      // A click, not a drag: undo any micro-movement and edit
      final TextAnnotation original = session.selectedText().withPosition(origin);
      replaceText(index, original);

      final Optional<String> edited = textPrompt.prompt(EDIT_TEXT_TITLE, original.text());
      if (edited.isPresent()) {
        if (edited.get().isBlank()) {
          removeText(index);
        } else {
          replaceText(index, original.withText(edited.get()));
        }
      }
    }
    session.endTextDrag();
  }

  private void replaceText(final int index, final TextAnnotation text) {
    try {
      session.drawing().replace(index, text);
    } catch (InvalidIndexException e) {
      LOGGER.debug("Ignoring text replace: {}", e.getMessage());
    }
  }

  private void removeText(final int index) {
    try {
      session.drawing().remove(index);
      LOGGER.debug("Removed text annotation {}", index);
    } catch (InvalidIndexException e) {
      LOGGER.debug("Ignoring text removal: {}", e.getMessage());
    }
  }

  // ------------------- Keyboard -------------------

  /**
   * Key pressed.
   *
   * @param keyCode AWT virtual key code ({@link KeyEvent}{@code .VK_*})
   * @param fast true when the speed modifier (Shift) is held
   */
  public void keyPressed(final int keyCode, final boolean fast) {
    if (!session.isActive()) {
      return;
    }
    switch (keyCode) {
      case KeyEvent.VK_ESCAPE:
        escape();
        break;
      case KeyEvent.VK_UP:
      case KeyEvent.VK_DOWN:
      case KeyEvent.VK_LEFT:
      case KeyEvent.VK_RIGHT:
        if (session.tool() == ToolMode.CROP) {
          moveKeyboardCursor(keyCode, fast);
          listener.repaintRequested();
        }
        break;
      case KeyEvent.VK_SPACE:
        startKeyboardSelection();
        break;
      case KeyEvent.VK_ENTER:
        confirmKeyboardSelection();
        break;
      case KeyEvent.VK_1:
      case KeyEvent.VK_C:
        switchTool(ToolMode.CROP);
        break;
      case KeyEvent.VK_2:
      case KeyEvent.VK_B:
        switchTool(ToolMode.BRUSH);
        break;
      case KeyEvent.VK_3:
      case KeyEvent.VK_T:
        switchTool(ToolMode.TEXT);
        break;
      case KeyEvent.VK_4:
      case KeyEvent.VK_R:
        switchTool(ToolMode.RECTANGLE);
        break;
      case KeyEvent.VK_OPEN_BRACKET:
        session.settings().adjustSize(session.tool(), -1);
        listener.repaintRequested();
        break;
      case KeyEvent.VK_CLOSE_BRACKET:
        session.settings().adjustSize(session.tool(), 1);
        listener.repaintRequested();
        break;
      default:
        break;
    }
  }

  private void escape() {
    if (hasInProgress()) {
      resetToolState();
      listener.repaintRequested();
      return;
    }
    session.setPhase(OverlaySession.Phase.CANCELLED);
    LOGGER.debug("Session cancelled");
    listener.onCancel();
  }

  private boolean hasInProgress() {
    return session.selectionStart() != null || session.drawing().hasInProgress() || session.isTextDragActive();
  }

  private void moveKeyboardCursor(final int keyCode, final boolean fast) {
    final int step = fast ? ARROW_STEP_FAST : ARROW_STEP;
    session.setKeyboardSelecting(true);

    PanelPoint cursor = session.cursorPosition();
    if (cursor == null) {
      cursor = new PanelPoint(session.panelWidth() / 2, session.panelHeight() / 2);
    }
    final double maxX = session.panelWidth() - 1;
    final double maxY = session.panelHeight() - 1;

    switch (keyCode) {
      case KeyEvent.VK_UP:
        cursor = new PanelPoint(cursor.x(), Geometry.clamp(cursor.y() - step, 0, maxY));
        break;
      case KeyEvent.VK_DOWN:
        cursor = new PanelPoint(cursor.x(), Geometry.clamp(cursor.y() + step, 0, maxY));
        break;
      case KeyEvent.VK_LEFT:
        cursor = new PanelPoint(Geometry.clamp(cursor.x() - step, 0, maxX), cursor.y());
        break;
      case KeyEvent.VK_RIGHT:
        cursor = new PanelPoint(Geometry.clamp(cursor.x() + step, 0, maxX), cursor.y());
        break;
      default:
        return;
    }
    session.setCursorPosition(cursor);

    if (session.selectionStart() != null) {
      session.setSelectionEnd(cursor);
    }
    session.setHoveredWindow(findWindowAt(cursor));
  }

  private void startKeyboardSelection() {
    final PanelPoint cursor = session.cursorPosition();
    if (session.tool() != ToolMode.CROP || !session.isKeyboardSelecting() || cursor == null) {
      return;
    }
    if (session.selectionStart() == null) {
      session.setSelectionStart(cursor);
      session.setSelectionEnd(cursor);
    }
    listener.repaintRequested();
  }

  private void confirmKeyboardSelection() {
    if (session.tool() != ToolMode.CROP) {
      return;
    }
    if (session.selectionStart() != null && session.selectionEnd() != null) {
      final DoubleRectangle rect = session.selectionRectangle();
      if (rect.width() > thresholds.cropDragMinPx() && rect.height() > thresholds.cropDragMinPx()) {
        commitCrop(rect);
      }
    } else if (session.isKeyboardSelecting() && session.cursorPosition() != null) {
      final WindowInfo window = findWindowAt(session.cursorPosition());
      if (window != null) {
        cropToWindow(window);
      }
    }
  }

  // ------------------- Toolbar -------------------

  private void handleToolbarClick(final ToolbarButton button) {
    final ToolMode tool = session.tool();
    switch (button) {
      case CROP:
      case BRUSH:
      case TEXT:
      case RECTANGLE:
        session.setTool(button.tool());
        break;
      case SIZE_DOWN:
        session.settings().adjustSize(tool, -1);
        break;
      case SIZE_UP:
        session.settings().adjustSize(tool, 1);
        break;
      case COLOR:
        final Optional<Color> color = colorPicker.pick(session.settings().color());
        color.ifPresent(c -> session.settings().setColor(c));
        break;
      case FONT:
        if (tool == ToolMode.TEXT) {
          final Optional<String> family = fontPicker.pick(fontFamilies.get(), session.settings().fontFamily());
          family.ifPresent(f -> session.settings().setFontFamily(f));
        }
        break;
      default:
        throw new IllegalStateException("Unhandled toolbar button: " + button);
    }
    resetToolState();
    listener.repaintRequested();
  }

  private void switchTool(final ToolMode tool) {
    session.setTool(tool);
    resetToolState();
    listener.repaintRequested();
  }

  /**
   * Clears every tool's uncommitted state, including a pointer drag in flight. Committed operations are kept; a
   * text drag in flight snaps back.
   */
  private void resetToolState() {
    session.setDragging(false);
    session.setSelectionStart(null);
    session.setSelectionEnd(null);
    session.drawing().clearInProgress();
    if (session.isTextDragActive()) {
      replaceText(session.selectedTextIndex(), session.selectedText().withPosition(session.textOriginalPosition()));
      session.endTextDrag();
    }
  }

  // ------------------- Commit -------------------

  private WindowInfo findWindowAt(final PanelPoint point) {
    return session.windows().findWindowAt(point, session.scaleFactors()).orElse(null);
  }

  private void cropToWindow(final WindowInfo window) {
    session.setSelectedWindow(window);
    commitCrop(session.scaleFactors().toPanelRect(window.geometry()));
  }

  private void commitCrop(final DoubleRectangle panelRect) {
    final ScaleFactors scale = session.scaleFactors();
    final BufferedImage image =
        cropper.crop(session.screenshot(), session.drawing().operations(), panelRect, scale);
    session.setPhase(OverlaySession.Phase.COMMITTED);
    LOGGER.debug("Session committed: {}x{} image, window={}", image.getWidth(), image.getHeight(),
        session.selectedWindow());
    listener.onCropComplete(new CropResult(image, session.selectedWindow()));
  }

  /**
   * Builder for {@link OverlayController}.
   */
  public static final class Builder {

    private OverlaySession session;
    private ColorPicker colorPicker;
    private FontPicker fontPicker;
    private TextPrompt textPrompt;
    private TextMeasurer textMeasurer;
    private Supplier<List<String>> fontFamilies = List::of;
    private CompositeCropper cropper = new CompositeCropper();
    private OverlayListener listener;

    private Builder() {
    }

    public Builder session(final OverlaySession session) {
      this.session = session;
      return this;
    }

    public Builder colorPicker(final ColorPicker colorPicker) {
      this.colorPicker = colorPicker;
      return this;
    }

    public Builder fontPicker(final FontPicker fontPicker) {
      this.fontPicker = fontPicker;
      return this;
    }

    public Builder textPrompt(final TextPrompt textPrompt) {
      this.textPrompt = textPrompt;
      return this;
    }

    public Builder textMeasurer(final TextMeasurer textMeasurer) {
      this.textMeasurer = textMeasurer;
      return this;
    }

    public Builder fontFamilies(final Supplier<List<String>> fontFamilies) {
      this.fontFamilies = fontFamilies;
      return this;
    }

    public Builder cropper(final CompositeCropper cropper) {
      this.cropper = cropper;
      return this;
    }

    public Builder listener(final OverlayListener listener) {
      this.listener = listener;
      return this;
    }

    public OverlayController build() {
      Validate.notNull(session, "session must not be null");
      Validate.notNull(colorPicker, "colorPicker must not be null");
      Validate.notNull(fontPicker, "fontPicker must not be null");
      Validate.notNull(textPrompt, "textPrompt must not be null");
      Validate.notNull(textMeasurer, "textMeasurer must not be null");
      Validate.notNull(fontFamilies, "fontFamilies must not be null");
      Validate.notNull(cropper, "cropper must not be null");
      Validate.notNull(listener, "listener must not be null");
      return new OverlayController(this);
    }
  }
}
