package com.consullo.snip.app;

import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.overlay.OverlayController;
import com.consullo.snip.overlay.OverlaySession;
import com.consullo.snip.render.OverlayRenderer;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import org.apache.commons.lang3.Validate;

/**
 * Swing surface of the overlay. Forwards left-button mouse events and key presses to the controller and paints
 * the session through {@link OverlayRenderer}.
 *
 * <p>The panel size is pushed into the session before every dispatch and every paint, so scale factors always
 * reflect the current size.
 *
 * @since 1.0
 */
public final class OverlayPanel extends JPanel {

  private static final long serialVersionUID = 1L;

  private final transient OverlaySession session;
  private final transient OverlayRenderer renderer;
  private transient OverlayController controller;

  public OverlayPanel(final OverlaySession session, final OverlayRenderer renderer) {
    super(true);
    Validate.notNull(session, "session must not be null");
    Validate.notNull(renderer, "renderer must not be null");
    this.session = session;
    this.renderer = renderer;
    setFocusable(true);

    final MouseAdapter mouse = new MouseAdapter() {
      @Override
      public void mousePressed(final MouseEvent e) {
        if (controller != null && SwingUtilities.isLeftMouseButton(e)) {
          syncSize();
          controller.pointerPressed(PanelPoint.of(e.getPoint()));
        }
      }

      @Override
      public void mouseDragged(final MouseEvent e) {
        if (controller != null && SwingUtilities.isLeftMouseButton(e)) {
          syncSize();
          controller.pointerDragged(PanelPoint.of(e.getPoint()));
        }
      }

      @Override
      public void mouseMoved(final MouseEvent e) {
        if (controller != null) {
          syncSize();
          controller.pointerMoved(PanelPoint.of(e.getPoint()));
        }
      }

      @Override
      public void mouseReleased(final MouseEvent e) {
        if (controller != null && SwingUtilities.isLeftMouseButton(e)) {
          syncSize();
          controller.pointerReleased(PanelPoint.of(e.getPoint()));
        }
      }
    };
    addMouseListener(mouse);
    addMouseMotionListener(mouse);

    addKeyListener(new KeyAdapter() {
      @Override
      public void keyPressed(final KeyEvent e) {
        if (controller != null) {
          syncSize();
          controller.keyPressed(e.getKeyCode(), e.isShiftDown());
        }
      }
    });
  }

  /**
   * Connects the controller that receives this panel's input.
   *
   * @param controller overlay controller for the same session
   */
  public void attach(final OverlayController controller) {
    Validate.notNull(controller, "controller must not be null");
    Validate.isTrue(controller.session() == session, "controller must drive this panel's session");
    this.controller = controller;
  }

  @Override
  protected void paintComponent(final Graphics g) {
    super.paintComponent(g);
    syncSize();
    final Graphics2D g2d = (Graphics2D) g.create();
    try {
      renderer.paint(g2d, session);
    } finally {
      g2d.dispose();
    }
  }

  private void syncSize() {
    session.resize(getWidth(), getHeight());
  }
}
