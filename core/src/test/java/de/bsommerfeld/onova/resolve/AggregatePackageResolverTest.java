package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AggregatePackageResolverTest {

    private static final Version V1 = Version.parse("1.0.0.0");
    private static final Version V2 = Version.parse("1.2.0.0");

    @Mock
    PackageResolver primary;

    @Mock
    PackageResolver mirror;

    @Test
    void getPackageVersions_shouldReturnUnion() throws Exception {
        when(primary.getPackageVersions()).thenReturn(Set.of(V1));
        when(mirror.getPackageVersions()).thenReturn(Set.of(V1, V2));

        var resolver = new AggregatePackageResolver(primary, mirror);

        assertEquals(Set.of(V1, V2), resolver.getPackageVersions());
    }

    @Test
    void downloadPackage_shouldUseFirstResolverListingVersion() throws Exception {
        when(primary.getPackageVersions()).thenReturn(Set.of(V1));
        when(mirror.getPackageVersions()).thenReturn(Set.of(V2));
        Path destination = Path.of("1.2.0.0.onv");
        ProgressListener progress = ProgressListener.none();

        new AggregatePackageResolver(primary, mirror).downloadPackage(V2, destination, progress);

        verify(mirror).downloadPackage(V2, destination, progress);
        verify(primary, never()).downloadPackage(any(), any(), any());
    }

    @Test
    void downloadPackage_shouldThrowWhenNoResolverHasVersion() throws Exception {
        when(primary.getPackageVersions()).thenReturn(Set.of(V1));
        when(mirror.getPackageVersions()).thenReturn(Set.of());

        var resolver = new AggregatePackageResolver(primary, mirror);

        assertThrows(IOException.class,
                () -> resolver.downloadPackage(V2, Path.of("x.onv"), ProgressListener.none()));
        verify(primary, never()).downloadPackage(eq(V2), any(), any());
    }

    @Test
    void getPackageVersions_shouldPropagateFailures() throws Exception {
        when(primary.getPackageVersions()).thenThrow(new IOException("offline"));

        var resolver = new AggregatePackageResolver(primary, mirror);

        assertThrows(IOException.class, resolver::getPackageVersions);
    }
}
