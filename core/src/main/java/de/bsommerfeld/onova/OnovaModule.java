package de.bsommerfeld.onova;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import de.bsommerfeld.onova.config.OnovaConfig;
import de.bsommerfeld.onova.extract.PackageExtractor;
import de.bsommerfeld.onova.extract.ZipPackageExtractor;
import de.bsommerfeld.onova.launch.ProcessStarter;
import de.bsommerfeld.onova.launch.UpdaterBinarySource;
import de.bsommerfeld.onova.model.AssemblyMetadata;
import de.bsommerfeld.onova.resolve.PackageResolver;
import de.bsommerfeld.onova.resolve.PackageResolvers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Guice module wiring an {@link UpdateManager} for one application.
 *
 * <p>
 * Configuration is read from a TOML file; a missing file means defaults. The
 * package resolver comes from the {@code [resolver]} table unless one is
 * passed in explicitly.
 */
public class OnovaModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(OnovaModule.class);

    private final AssemblyMetadata updatee;
    private final Path configPath;
    private final PackageResolver resolver;
    private final PackageExtractor extractor;

    public OnovaModule(AssemblyMetadata updatee, Path configPath) {
        this(updatee, configPath, null, null);
    }

    public OnovaModule(AssemblyMetadata updatee, Path configPath, PackageResolver resolver,
            PackageExtractor extractor) {
        this.updatee = updatee;
        this.configPath = configPath;
        this.resolver = resolver;
        this.extractor = extractor;
    }

    @Override
    protected void configure() {
        OnovaConfig config;
        try {
            config = OnovaConfig.load(configPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load Onova configuration from " + configPath, e);
        }
        LOG.info("Onova configured for {} {}", updatee.name(), updatee.version());

        bind(OnovaConfig.class).toInstance(config);
        bind(AssemblyMetadata.class).toInstance(updatee);

        PackageResolver packageResolver = resolver != null
                ? resolver
                : PackageResolvers.fromConfig(config.getResolver())
                        .orElseThrow(() -> new IllegalStateException(
                                "No package resolver configured (set [resolver] in " + configPath + ")"));
        bind(PackageResolver.class).toInstance(packageResolver);

        if (extractor != null) {
            bind(PackageExtractor.class).toInstance(extractor);
        } else {
            bind(PackageExtractor.class).to(ZipPackageExtractor.class);
        }

        bind(UpdaterBinarySource.class)
                .toInstance(UpdaterBinarySource.classpath(UpdaterBinarySource.DEFAULT_RESOURCE));
        bind(ProcessStarter.class).toInstance(ProcessStarter.DEFAULT);
        bind(UpdateManager.class).in(Singleton.class);
    }
}
