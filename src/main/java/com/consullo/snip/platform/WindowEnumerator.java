package com.consullo.snip.platform;

import com.consullo.snip.window.WindowInfo;
import java.io.IOException;
import java.util.List;

/**
 * Lists the visible top-level windows, topmost first, in absolute desktop coordinates.
 *
 * @since 1.0
 */
public interface WindowEnumerator {

  List<WindowInfo> visibleWindows() throws IOException;
}
