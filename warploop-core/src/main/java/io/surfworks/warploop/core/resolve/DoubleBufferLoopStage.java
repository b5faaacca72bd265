package io.surfworks.warploop.core.resolve;

/**
 * Stage of a double-buffered loop. Loops that are not double buffered, and queries
 * made before the double-buffer pass has split a loop into stages, use
 * {@link #NOT_APPLICABLE}.
 */
public enum DoubleBufferLoopStage {
    NOT_APPLICABLE,
    PROLOGUE,
    MAIN,
    EPILOGUE
}
