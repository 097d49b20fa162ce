/**
 * Display hand-off.
 *
 * <p>Stage threads never call a display surface directly: they post
 * {@link com.phillippitts.livesubs.service.display.DisplayMessage}s that a single display thread
 * delivers to the registered {@link com.phillippitts.livesubs.service.display.DisplaySink}s.
 */
package com.phillippitts.livesubs.service.display;
