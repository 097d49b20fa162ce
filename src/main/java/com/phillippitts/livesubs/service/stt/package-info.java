/**
 * Speech recognition.
 *
 * <p>{@link com.phillippitts.livesubs.service.stt.RecognitionEngine} is the backend contract used
 * by the recognition stage; {@code whisper} holds the whisper.cpp command-line adapter.
 */
package com.phillippitts.livesubs.service.stt;
