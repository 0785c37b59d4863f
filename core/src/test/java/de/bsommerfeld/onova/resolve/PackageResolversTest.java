package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.config.ResolverConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PackageResolversTest {

    @Test
    void fromConfig_shouldBeEmptyWithoutType() {
        assertTrue(PackageResolvers.fromConfig(new ResolverConfig()).isEmpty());
    }

    @Test
    void fromConfig_shouldBuildLocalResolver() {
        var resolver = PackageResolvers.fromConfig(config("local", "/srv/packages"));
        assertInstanceOf(LocalPackageResolver.class, resolver.orElseThrow());
    }

    @Test
    void fromConfig_shouldBuildWebResolver() {
        var resolver = PackageResolvers.fromConfig(config("Web", "https://example.com/manifest.txt"));
        assertInstanceOf(WebPackageResolver.class, resolver.orElseThrow());
    }

    @Test
    void fromConfig_shouldBuildGithubResolver() {
        var resolver = PackageResolvers.fromConfig(config("github", "owner/repo"));
        assertInstanceOf(GithubPackageResolver.class, resolver.orElseThrow());
    }

    @Test
    void fromConfig_shouldRejectUnknownType() {
        assertThrows(IllegalArgumentException.class, () -> PackageResolvers.fromConfig(config("ftp", "x")));
    }

    @Test
    void fromConfig_shouldRejectMissingLocation() {
        assertThrows(IllegalArgumentException.class, () -> PackageResolvers.fromConfig(config("local", " ")));
    }

    private static ResolverConfig config(String type, String location) {
        ResolverConfig config = new ResolverConfig();
        config.setType(type);
        config.setLocation(location);
        return config;
    }
}
