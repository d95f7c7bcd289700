package io.querybridge.core.config;

import io.querybridge.core.error.ConfigValidationException;
import java.util.Locale;

/** Type tag of a data source; selects the adapter. */
public enum DataSourceType {
    MEMORY,
    SQL,
    API;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DataSourceType fromId(String id) {
        if (id != null) {
            for (DataSourceType type : values()) {
                if (type.id().equalsIgnoreCase(id.trim())) {
                    return type;
                }
            }
        }
        throw new ConfigValidationException("Unknown data source type: " + id, "type");
    }
}
