package com.lbg.markets.turbosort.support;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds {@link TurbosortConfig} instances for plain unit tests, without booting Quarkus.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static TurbosortConfig of(Map<String, String> properties) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withMapping(TurbosortConfig.class)
                .withSources(new PropertiesConfigSource(properties, "test", 400))
                .build();
        return config.getConfigMapping(TurbosortConfig.class);
    }

    /**
     * Local source and destination under {@code base}, defaults otherwise, plus any overrides.
     */
    public static TurbosortConfig local(Path base, String... overrides) {
        Map<String, String> properties = new HashMap<>();
        properties.put("turbosort.source.path", base.resolve("source").toString());
        properties.put("turbosort.destination.root", base.resolve("destination").toString());
        properties.put("turbosort.history.file", base.resolve("history.json").toString());
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            properties.put(overrides[i], overrides[i + 1]);
        }
        return of(properties);
    }
}
