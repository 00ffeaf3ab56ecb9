package com.lbg.markets.turbosort.config;

import com.lbg.markets.turbosort.domain.SourceKind;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable application configuration, bound once at startup.
 * Keys follow the {@code turbosort.*} namespace; environment variables map onto them
 * in the usual way ({@code TURBOSORT_SOURCE_PATH} for {@code turbosort.source.path}).
 */
@ConfigMapping(prefix = "turbosort")
public interface TurbosortConfig {

    /**
     * Name of the marker file that declares a directory's destination.
     */
    @WithDefault(".turbosort")
    String markerName();

    /**
     * Copy every item on every pass, ignoring unchanged identities.
     */
    @WithDefault("false")
    boolean forceRecopy();

    /**
     * How often aggregate statistics are logged while running.
     */
    @WithDefault("PT5M")
    Duration statsInterval();

    Source source();

    Destination destination();

    History history();

    Local local();

    Remote remote();

    interface Source {

        @WithDefault("local")
        SourceKind kind();

        /**
         * Root of the local source tree.
         */
        @WithDefault("source")
        String path();

        S3 s3();
    }

    interface S3 {

        Optional<String> bucket();

        /**
         * Key prefix under which the source tree lives; the whole bucket when absent.
         */
        Optional<String> prefix();

        /**
         * Endpoint override for S3-compatible stores such as MinIO.
         */
        Optional<String> endpoint();

        @WithDefault("us-east-1")
        String region();

        Optional<String> accessKey();

        Optional<String> secretKey();

        @WithDefault("true")
        boolean pathStyle();
    }

    interface Destination {

        @WithDefault("destination")
        String root();

        /**
         * Prefix the destination with the first 19xx/20xx year found in the marker.
         */
        @WithDefault("false")
        boolean yearPrefix();

        DriveSuffix driveSuffix();
    }

    interface DriveSuffix {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("incoming")
        String segment();
    }

    interface History {

        @WithDefault("turbosort_history.json")
        String file();
    }

    interface Local {

        /**
         * Minimum time between two drains of the pending-directory set.
         */
        @WithDefault("PT2S")
        Duration quietPeriod();

        @WithDefault("PT0.5S")
        Duration drainInterval();

        @WithDefault("PT1H")
        Duration rescanInterval();
    }

    interface Remote {

        @WithDefault("PT30S")
        Duration pollInterval();

        @WithDefault("PT10M")
        Duration rescanInterval();
    }
}
