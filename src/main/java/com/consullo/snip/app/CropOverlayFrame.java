package com.consullo.snip.app;

import com.consullo.snip.config.SnipConfig;
import com.consullo.snip.drawing.FontTextMeasurer;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.overlay.CropResult;
import com.consullo.snip.overlay.OverlayController;
import com.consullo.snip.overlay.OverlayListener;
import com.consullo.snip.overlay.OverlaySession;
import com.consullo.snip.platform.ColorPicker;
import com.consullo.snip.platform.CommandRunner;
import com.consullo.snip.platform.KDialogColorPicker;
import com.consullo.snip.platform.SwingColorPicker;
import com.consullo.snip.platform.SwingFontPicker;
import com.consullo.snip.platform.SwingTextPrompt;
import com.consullo.snip.render.OverlayRenderer;
import java.awt.GraphicsEnvironment;
import java.util.Arrays;
import java.util.function.IntConsumer;
import javax.swing.JFrame;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undecorated full-monitor window hosting the overlay. Must be created and shown on the EDT.
 *
 * @since 1.0
 */
public final class CropOverlayFrame extends JFrame {

  private static final long serialVersionUID = 1L;

  private static final Logger LOGGER = LoggerFactory.getLogger(CropOverlayFrame.class);

  private final OverlayPanel panel;

  /**
   * Builds the frame and wires panel, controller and the outcome handling.
   *
   * @param session overlay session
   * @param runner command runner for the kdialog color picker
   * @param output delivers a committed capture
   * @param exit receives the process exit status once the session ends
   */
  public CropOverlayFrame(final OverlaySession session, final CommandRunner runner, final CaptureOutput output,
      final IntConsumer exit) {
    super("SnipSnip");
    Validate.notNull(session, "session must not be null");
    Validate.notNull(runner, "runner must not be null");
    Validate.notNull(output, "output must not be null");
    Validate.notNull(exit, "exit must not be null");

    setUndecorated(true);
    setAlwaysOnTop(true);
    setDefaultCloseOperation(JFrame.DO_NOTHING_ON_CLOSE);

    final DoubleRectangle monitor = session.monitorGeometry();
    setBounds((int) monitor.x(), (int) monitor.y(), (int) monitor.width(), (int) monitor.height());

    this.panel = new OverlayPanel(session, new OverlayRenderer());
    setContentPane(panel);

    final SnipConfig config = session.config();
    final ColorPicker colorPicker = config.useKDialogForColorPicking()
        ? new KDialogColorPicker(runner)
        : new SwingColorPicker(panel);

    panel.attach(OverlayController.builder()
        .session(session)
        .colorPicker(colorPicker)
        .fontPicker(new SwingFontPicker(panel))
        .textPrompt(new SwingTextPrompt(panel))
        .textMeasurer(new FontTextMeasurer())
        .fontFamilies(() -> Arrays.asList(
            GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames()))
        .listener(new OverlayListener() {
          @Override
          public void onCropComplete(final CropResult result) {
            setVisible(false);
            dispose();
            output.deliver(result);
            exit.accept(CaptureOutput.EXIT_OK);
          }

          @Override
          public void onCancel() {
            LOGGER.info("Capture cancelled");
            setVisible(false);
            dispose();
            exit.accept(CaptureOutput.EXIT_OK);
          }

          @Override
          public void repaintRequested() {
            panel.repaint();
          }
        })
        .build());
  }

  /**
   * Shows the overlay and gives it keyboard focus.
   */
  public void open() {
    setVisible(true);
    toFront();
    panel.requestFocusInWindow();
  }
}
