/**
 * Translation backends and prompt construction.
 */
package com.phillippitts.livesubs.service.translate;
