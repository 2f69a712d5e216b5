package com.sectionviewer.clip;

import java.util.Locale;
import java.util.Map;

/**
 * Appearance shared by all cap meshes.
 *
 * @param enabled whether caps are drawn at all
 * @param rgb     0xRRGGBB
 * @param opacity 0..1, NaN reads as {@link #DEFAULT_OPACITY}
 */
public record FillStyle(boolean enabled, int rgb, double opacity) {

    public static final int DEFAULT_COLOR = 0x38bdf8;
    public static final double DEFAULT_OPACITY = 1.0;
    public static final FillStyle DEFAULT = new FillStyle(true, DEFAULT_COLOR, DEFAULT_OPACITY);

    private static final Map<String, Integer> NAMED = Map.of(
        "black", 0x000000,
        "white", 0xffffff,
        "red", 0xff0000,
        "green", 0x008000,
        "blue", 0x0000ff,
        "yellow", 0xffff00,
        "orange", 0xffa500,
        "gray", 0x808080,
        "grey", 0x808080,
        "skyblue", 0x87ceeb
    );

    public FillStyle {
        rgb &= 0xffffff;
        opacity = Double.isNaN(opacity) ? DEFAULT_OPACITY : Math.max(0, Math.min(1, opacity));
    }

    public FillStyle withEnabled(boolean enabled) {
        return new FillStyle(enabled, rgb, opacity);
    }

    public FillStyle withRgb(int rgb) {
        return new FillStyle(enabled, rgb, opacity);
    }

    public FillStyle withOpacity(double opacity) {
        return new FillStyle(enabled, rgb, opacity);
    }

    /** Color as "#rrggbb". */
    public String hex() {
        return toHex(rgb);
    }

    public static String toHex(int rgb) {
        return String.format(Locale.ROOT, "#%06x", rgb & 0xffffff);
    }

    /**
     * Parse "#rgb", "#rrggbb", "0xrrggbb" or a basic color name.
     *
     * @throws IllegalArgumentException if the text is not a color
     */
    public static int parseColor(String text) {
        if (text == null) {
            throw new IllegalArgumentException("color is null");
        }
        String s = text.trim().toLowerCase(Locale.ROOT);
        Integer named = NAMED.get(s);
        if (named != null) return named;

        String digits;
        if (s.startsWith("#")) {
            digits = s.substring(1);
        } else if (s.startsWith("0x")) {
            digits = s.substring(2);
        } else {
            throw new IllegalArgumentException("Unrecognized color: " + text);
        }
        if (digits.length() == 3) {
            StringBuilder sb = new StringBuilder(6);
            for (int i = 0; i < 3; i++) {
                sb.append(digits.charAt(i)).append(digits.charAt(i));
            }
            digits = sb.toString();
        }
        if (digits.length() != 6 || !isHex(digits)) {
            throw new IllegalArgumentException("Unrecognized color: " + text);
        }
        return Integer.parseInt(digits, 16);
    }

    private static boolean isHex(String digits) {
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
