package nl.nfi.djlearn.common.ini;

import java.util.List;

/**
 * View on one section of an {@link IniConfig}, with defaults for absent keys.
 */
public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public boolean has(final String key) {
        return iniConfig.hasKey(section, key);
    }

    public String getString(final String key, final String defaultValue) {
        return has(key) ? iniConfig.getString(section, key) : defaultValue;
    }

    public boolean getBoolean(final String key, final boolean defaultValue) {
        return has(key) ? iniConfig.getBoolean(section, key) : defaultValue;
    }

    public int getInt(final String key, final int defaultValue) {
        return has(key) ? iniConfig.getInt(section, key) : defaultValue;
    }

    public long getLong(final String key, final long defaultValue) {
        return has(key) ? iniConfig.getLong(section, key) : defaultValue;
    }

    public double getDouble(final String key, final double defaultValue) {
        return has(key) ? iniConfig.getDouble(section, key) : defaultValue;
    }

    public List<String> getStringList(final String key, final List<String> defaultValue) {
        return has(key) ? iniConfig.getStringList(section, key) : defaultValue;
    }
}
