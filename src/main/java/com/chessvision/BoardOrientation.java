package com.chessvision;

/**
 * Which side of the physical board appears at the bottom of the rectified image.
 */
public enum BoardOrientation {
    WHITE_AT_BOTTOM,
    BLACK_AT_BOTTOM
}
