package com.phillippitts.livesubs.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts OS processes; replaced by scripted processes in tests.
 */
interface ProcessFactory {
    Process start(List<String> command, Path workingDir) throws IOException;
}
