package com.sectionviewer.core;

import com.sectionviewer.clip.FillStyle;
import com.sectionviewer.control.ControlServer;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Viewer settings as a key=value properties file.
 * <p>
 * Layers, later wins: built-in defaults, {@code /sectionviewer.properties} on the
 * classpath, then an optional file given on the command line.
 */
public class ViewerConfig {

    private static final Logger LOG = Logger.getLogger(ViewerConfig.class.getName());

    public static final String RESOURCE = "/sectionviewer.properties";

    public static final String CONTROL_PORT = "control.port";
    public static final String CONTROL_ENABLED = "control.enabled";
    public static final String TICK_RATE = "loop.tickRateHz";
    public static final String BROADCAST_INTERVAL = "broadcast.minIntervalMs";
    public static final String FILL_COLOR = "clipping.fillColor";
    public static final String FILL_OPACITY = "clipping.fillOpacity";
    public static final String FILL_ENABLED = "clipping.fillEnabled";
    public static final String CLIPPING_ENABLED = "clipping.enabled";
    public static final String MODEL = "model";

    private final Properties props;

    private ViewerConfig(Properties props) {
        this.props = props;
    }

    /** Built-in defaults only. */
    public static ViewerConfig defaults() {
        return new ViewerConfig(defaultProperties());
    }

    /**
     * Load defaults, the classpath resource if present, then {@code file} if non-null.
     *
     * @throws UncheckedIOException if {@code file} is given but cannot be read
     */
    public static ViewerConfig load(Path file) {
        Properties props = defaultProperties();

        try (InputStream is = ViewerConfig.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            LOG.warning("[ViewerConfig] Failed to read " + RESOURCE + ": " + e.getMessage());
        }

        if (file != null) {
            try (InputStream is = new FileInputStream(file.toFile())) {
                props.load(is);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read config " + file, e);
            }
            LOG.info("[ViewerConfig] Loaded " + file);
        }
        return new ViewerConfig(props);
    }

    private static Properties defaultProperties() {
        Properties props = new Properties();
        props.setProperty(CONTROL_PORT, Integer.toString(ControlServer.DEFAULT_PORT));
        props.setProperty(CONTROL_ENABLED, "true");
        props.setProperty(TICK_RATE, "30");
        props.setProperty(BROADCAST_INTERVAL, Long.toString(ControlServer.DEFAULT_MIN_BROADCAST_INTERVAL_MS));
        props.setProperty(FILL_COLOR, FillStyle.toHex(FillStyle.DEFAULT_COLOR));
        props.setProperty(FILL_OPACITY, "1.0");
        props.setProperty(FILL_ENABLED, "true");
        props.setProperty(CLIPPING_ENABLED, "false");
        props.setProperty(MODEL, "cube");
        return props;
    }

    /** Override one key, e.g. from a command-line flag. */
    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    public String get(String key) {
        return props.getProperty(key);
    }

    // --- Typed accessors ---

    public int getControlPort() { return getInt(CONTROL_PORT, ControlServer.DEFAULT_PORT); }
    public boolean isControlEnabled() { return getBool(CONTROL_ENABLED, true); }
    public int getTickRateHz() { return Math.max(1, getInt(TICK_RATE, 30)); }
    public long getBroadcastIntervalMs() {
        return Math.max(0, getLong(BROADCAST_INTERVAL, ControlServer.DEFAULT_MIN_BROADCAST_INTERVAL_MS));
    }
    public boolean isClippingEnabled() { return getBool(CLIPPING_ENABLED, false); }
    public String getModel() { return props.getProperty(MODEL, "cube").trim(); }

    /** Initial cap fill. An unparsable color falls back to the default one. */
    public FillStyle getFillStyle() {
        int rgb;
        try {
            rgb = FillStyle.parseColor(props.getProperty(FILL_COLOR));
        } catch (IllegalArgumentException e) {
            LOG.warning("[ViewerConfig] " + e.getMessage() + ", using default fill color");
            rgb = FillStyle.DEFAULT_COLOR;
        }
        return new FillStyle(getBool(FILL_ENABLED, true), rgb, getDouble(FILL_OPACITY, 1.0));
    }

    private int getInt(String key, int def) {
        try {
            return Integer.parseInt(props.getProperty(key, "").trim());
        } catch (NumberFormatException e) {
            LOG.warning("[ViewerConfig] Bad integer for " + key + ", using " + def);
            return def;
        }
    }

    private long getLong(String key, long def) {
        try {
            return Long.parseLong(props.getProperty(key, "").trim());
        } catch (NumberFormatException e) {
            LOG.warning("[ViewerConfig] Bad integer for " + key + ", using " + def);
            return def;
        }
    }

    private double getDouble(String key, double def) {
        try {
            return Double.parseDouble(props.getProperty(key, "").trim());
        } catch (NumberFormatException e) {
            LOG.warning("[ViewerConfig] Bad number for " + key + ", using " + def);
            return def;
        }
    }

    private boolean getBool(String key, boolean def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        return Boolean.parseBoolean(v.trim());
    }
}
