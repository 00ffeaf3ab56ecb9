package com.lbg.markets.turbosort.source;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;

/**
 * Picks the source implementation from {@code turbosort.source.kind}.
 * The S3 client is only built when a remote source is configured.
 */
@ApplicationScoped
public class SourceConfiguration {

    private static final Logger LOG = Logger.getLogger(SourceConfiguration.class);

    @Produces
    @ApplicationScoped
    SourceProvider sourceProvider(TurbosortConfig config, Instance<ObjectStore> objectStore) {
        return switch (config.source().kind()) {
            case LOCAL -> {
                LocalFsSource source = new LocalFsSource(config);
                LOG.infof("TurboSort source: local directory %s", source.root());
                yield source;
            }
            case S3 -> new S3Source(objectStore.get(), config);
        };
    }

    @Produces
    @ApplicationScoped
    ObjectStore objectStore(TurbosortConfig config) {
        return S3ObjectStore.create(config.source().s3());
    }

    void closeObjectStore(@Disposes ObjectStore store) {
        if (store instanceof S3ObjectStore s3) {
            s3.close();
        }
    }
}
