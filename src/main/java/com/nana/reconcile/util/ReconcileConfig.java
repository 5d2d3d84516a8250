package com.nana.reconcile.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Process-wide settings for the reconciliation library.
 *
 * <p>LOOKUP ORDER (later wins):
 * <ol>
 *   <li>Built-in {@link #DEFAULTS}.</li>
 *   <li>{@code reconcile.properties} on the classpath, if present.</li>
 *   <li>The file named by the {@code reconcile.config.file} system property,
 *       if set and readable.</li>
 *   <li>Any {@code reconcile.*} system property.</li>
 * </ol>
 *
 * <p>{@link #getInstance()} returns the shared instance used when a caller
 * does not supply one. Tests build their own with
 * {@link #ReconcileConfig(Properties)}.
 */
public final class ReconcileConfig {

    private static final Logger log = LoggerFactory.getLogger(ReconcileConfig.class);

    // -----------------------------------------------------------------------
    // KEYS
    // -----------------------------------------------------------------------

    public static final String KEY_USE_TRANSACTIONS     = "reconcile.use.transactions";
    public static final String KEY_DATE_FORMATS         = "reconcile.date.input.formats";
    public static final String KEY_DATETIME_FORMATS     = "reconcile.datetime.input.formats";
    public static final String KEY_TIME_FORMATS         = "reconcile.time.input.formats";
    public static final String KEY_DATASOURCE_URL       = "reconcile.datasource.url";

    /** System property naming an external properties file. */
    public static final String SYSTEM_CONFIG_FILE = "reconcile.config.file";

    /** Classpath resource read on startup when present. */
    public static final String CLASSPATH_RESOURCE = "reconcile.properties";

    /** Separator between patterns in the *.formats keys. */
    private static final String FORMAT_SEPARATOR = "\\|";

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_USE_TRANSACTIONS, "false");
        DEFAULTS.setProperty(KEY_DATE_FORMATS,     "yyyy-MM-dd");
        DEFAULTS.setProperty(KEY_DATETIME_FORMATS, "yyyy-MM-dd HH:mm:ss|yyyy-MM-dd'T'HH:mm:ss");
        DEFAULTS.setProperty(KEY_TIME_FORMATS,     "HH:mm:ss|HH:mm");
        DEFAULTS.setProperty(KEY_DATASOURCE_URL,   "jdbc:sqlite::memory:");
    }

    // -----------------------------------------------------------------------
    // SINGLETON
    // -----------------------------------------------------------------------

    private static ReconcileConfig instance;

    /**
     * Returns the shared configuration, loading it on first call.
     *
     * @return the process-wide configuration
     */
    public static synchronized ReconcileConfig getInstance() {
        if (instance == null) {
            instance = new ReconcileConfig(loadProcessProperties());
        }
        return instance;
    }

    // -----------------------------------------------------------------------
    // STATE
    // -----------------------------------------------------------------------

    private final Properties props;

    /**
     * Creates a configuration from explicit overrides layered on the
     * built-in defaults. Classpath and system properties are not consulted.
     *
     * @param overrides the values to apply; may be empty
     */
    public ReconcileConfig(Properties overrides) {
        this.props = new Properties(DEFAULTS);
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                props.setProperty(key, overrides.getProperty(key));
            }
        }
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getString(String key) {
        return props.getProperty(key);
    }

    public boolean getBoolean(String key) {
        String val = props.getProperty(key, "false").toLowerCase().trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    /** @return the process default for wrapping imports in a transaction */
    public boolean isUseTransactions() {
        return getBoolean(KEY_USE_TRANSACTIONS);
    }

    /** @return accepted date patterns; the first one is used for rendering */
    public List<String> getDateInputFormats() {
        return getFormats(KEY_DATE_FORMATS);
    }

    /** @return accepted date-time patterns; the first one is used for rendering */
    public List<String> getDateTimeInputFormats() {
        return getFormats(KEY_DATETIME_FORMATS);
    }

    /** @return accepted time patterns; the first one is used for rendering */
    public List<String> getTimeInputFormats() {
        return getFormats(KEY_TIME_FORMATS);
    }

    /** @return JDBC URL for {@link com.nana.reconcile.store.Database} */
    public String getDatasourceUrl() {
        return getString(KEY_DATASOURCE_URL);
    }

    private List<String> getFormats(String key) {
        List<String> formats = new ArrayList<>();
        for (String pattern : props.getProperty(key, "").split(FORMAT_SEPARATOR)) {
            if (!pattern.isBlank()) {
                formats.add(pattern.trim());
            }
        }
        if (formats.isEmpty()) {
            throw new IllegalStateException("No patterns configured for " + key);
        }
        return List.copyOf(formats);
    }

    // -----------------------------------------------------------------------
    // LOADING
    // -----------------------------------------------------------------------

    private static Properties loadProcessProperties() {
        Properties loaded = new Properties();

        try (InputStream in = ReconcileConfig.class.getClassLoader()
                .getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                loaded.load(in);
                log.info("Loaded {} from classpath.", CLASSPATH_RESOURCE);
            }
        } catch (IOException ex) {
            log.warn("Failed to read classpath {}: {}", CLASSPATH_RESOURCE, ex.getMessage());
        }

        String external = System.getProperty(SYSTEM_CONFIG_FILE);
        if (external != null && !external.isBlank()) {
            Path path = Paths.get(external);
            if (Files.isReadable(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    loaded.load(in);
                    log.info("Loaded configuration file: {}", path.toAbsolutePath());
                } catch (IOException ex) {
                    log.warn("Failed to read configuration file {}: {}", path, ex.getMessage());
                }
            } else {
                log.warn("Configuration file {} is not readable; ignoring.", path);
            }
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("reconcile.") && !key.equals(SYSTEM_CONFIG_FILE)) {
                loaded.setProperty(key, System.getProperty(key));
            }
        }
        return loaded;
    }
}
