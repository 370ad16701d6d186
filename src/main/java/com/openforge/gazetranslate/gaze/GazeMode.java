package com.openforge.gazetranslate.gaze;

/** Input source of the gaze stream; selects the calibration preset. */
public enum GazeMode {

    /** Eye tracking: precise, noisy confidence. */
    EYE,

    /** Head-pointing (e.g. Quest 3 without eye tracking): coarser and slower. */
    HEAD
}
